package org.quarry.history.repository;

import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.TargetPathCount;
import org.quarry.history.entity.AuditLogEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

public interface AuditLogDAO {
    Mono<Long> insertBatch(List<AuditLogEntry> entries);
    Flux<AuditLogEntry> query(AuditLogQuery query);
    Mono<AuditLogEntry> findById(String id);
    Mono<AuditStats> getStats();
    Flux<TargetPathCount> getMostEditedPaths(int limit);
    Mono<Long> deleteOlderThan(Instant cutoff);
    Mono<Long> deleteBeyond(long maxEntries);
    Mono<Instant> findLastActivity(String sessionId);
}
