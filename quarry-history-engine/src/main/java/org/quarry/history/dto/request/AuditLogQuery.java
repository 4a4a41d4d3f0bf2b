package org.quarry.history.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.enums.SortOrder;

import java.time.Instant;

/**
 * Audit log filter. Every criterion is optional and criteria are combined with AND.
 * The time range is half-open: {@code startTime <= timestamp < endTime}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogQuery(
        AuditActionType actionType,
        String actionName,
        AuditTargetType targetType,
        String targetId,
        String targetPathPrefix,
        String sessionId,
        AuditSource source,
        String undoGroupId,
        boolean undoableOnly,
        Instant startTime,
        Instant endTime,
        Integer limit,
        Integer offset,
        SortOrder order) {

    public static final int DEFAULT_LIMIT = 100;

    public static AuditLogQuery recent(int limit) {
        return AuditLogQuery.builder().limit(limit).build();
    }

    public int effectiveLimit() {
        return limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public int effectiveOffset() {
        return offset == null || offset < 0 ? 0 : offset;
    }

    public SortOrder effectiveOrder() {
        return order == null ? SortOrder.DESC : order;
    }
}
