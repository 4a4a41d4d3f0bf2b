package org.quarry.history.service;

import org.quarry.history.dto.request.AuditLogInput;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.TargetPathCount;
import org.quarry.history.entity.AuditLogEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only record of user actions.
 * <p>
 * None of these operations signal storage errors: failures are logged and the operation
 * completes with an empty result, 0 or {@link AuditStats#empty()}.
 */
public interface AuditLogService {

    /**
     * Records an action for the session and emits its id. The write itself is batched.
     * Completes empty when the action type is not audited or the input is incomplete.
     */
    Mono<String> logAction(String sessionId, AuditLogInput input);

    /**
     * Writes pending entries now and emits how many were written.
     */
    Mono<Integer> flush();

    Flux<AuditLogEntry> query(AuditLogQuery query);

    Mono<AuditLogEntry> getEntry(String id);

    Mono<AuditStats> getStats();

    Flux<TargetPathCount> getMostEditedPaths(int limit);

    /**
     * Deletes entries older than {@code retentionDays} days and emits how many were removed.
     * A non-positive retention is rejected and removes nothing.
     */
    Mono<Long> pruneAuditLog(int retentionDays);

    /**
     * Deletes the oldest entries so that at most {@code maxEntries} remain. 0 means no cap.
     */
    Mono<Long> trimToMaxEntries(long maxEntries);

    /**
     * Timestamp of the newest entry of the session, empty when it has none.
     */
    Mono<Instant> getLastActivity(String sessionId);
}
