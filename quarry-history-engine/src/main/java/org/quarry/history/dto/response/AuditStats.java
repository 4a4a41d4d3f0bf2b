package org.quarry.history.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.quarry.history.enums.AuditActionType;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate counts over the whole audit log. On an empty log the timestamps are null
 * and {@code entriesByType} is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditStats(
        long totalEntries,
        long undoableEntries,
        long uniqueSessions,
        Instant oldestEntry,
        Instant newestEntry,
        Map<AuditActionType, Long> entriesByType) {

    public static AuditStats empty() {
        return new AuditStats(0, 0, 0, null, null, Map.of());
    }
}
