package org.quarry.history.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import org.quarry.history.enums.AuditTargetType;

/**
 * A reversible transition in a session's undo stack.
 * <p>
 * {@code auditLogId} is an analytics link only: the referenced audit entry may already have
 * been pruned, so it is never dereferenced for integrity.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UndoStackEntry(
        String id,
        String sessionId,
        int stackPosition,
        String auditLogId,
        AuditTargetType targetType,
        String targetId,
        JsonNode beforeState,
        JsonNode afterState,
        boolean active) {

    public UndoStackEntry withActive(boolean active) {
        return toBuilder().active(active).build();
    }
}
