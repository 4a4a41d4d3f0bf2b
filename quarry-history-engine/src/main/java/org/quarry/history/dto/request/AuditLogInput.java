package org.quarry.history.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;

/**
 * Caller-supplied part of an audit entry. Id, timestamp and session are assigned by the store.
 * A null {@code source} is recorded as {@link AuditSource#USER}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogInput(
        AuditActionType actionType,
        String actionName,
        AuditTargetType targetType,
        String targetId,
        String targetPath,
        JsonNode oldValue,
        JsonNode newValue,
        boolean undoable,
        String undoGroupId,
        Long durationMs,
        AuditSource source) {
}
