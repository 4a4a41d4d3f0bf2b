package org.quarry.history.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;

import java.time.Instant;

/**
 * One recorded user action. Written once, never updated, removed only by retention pruning.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogEntry(
        String id,
        Instant timestamp,
        String sessionId,
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
