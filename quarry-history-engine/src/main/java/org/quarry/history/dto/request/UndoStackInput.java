package org.quarry.history.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import org.quarry.history.enums.AuditTargetType;

import java.util.Map;

/**
 * A reversible transition to push onto a session's undo stack.
 *
 * @param auditLogId  id of the audit entry recorded for the same action, may be null
 * @param metadata    extra key/value pairs stored alongside the stack entry, may be null
 */
@Builder
public record UndoStackInput(
        String auditLogId,
        AuditTargetType targetType,
        String targetId,
        JsonNode beforeState,
        JsonNode afterState,
        Map<String, String> metadata) {
}
