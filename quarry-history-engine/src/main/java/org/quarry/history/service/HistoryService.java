package org.quarry.history.service;

import org.quarry.history.dto.request.AuditLogInput;
import org.quarry.history.dto.request.UndoStackInput;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.UndoRedoResult;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditTargetType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for hosts that record actions and drive undo/redo without dealing with the
 * audit log and the undo stacks separately.
 */
public interface HistoryService {

    Mono<String> recordAction(String sessionId, AuditLogInput input);

    /**
     * Records the action as undoable and pushes the matching undo entry, with
     * {@code oldValue} as before-state and {@code newValue} as after-state.
     * Emits the id of the undo entry.
     */
    Mono<String> recordUndoableAction(String sessionId, AuditLogInput input, Map<String, String> metadata);

    Flux<AuditLogEntry> getRecentActions(String sessionId, int limit);

    Flux<AuditLogEntry> getActionsByType(AuditActionType actionType, int limit);

    Flux<AuditLogEntry> getActionsForTarget(AuditTargetType targetType, String targetId, int limit);

    Mono<String> pushUndoableAction(String sessionId, UndoStackInput input);

    /**
     * Undoes the session's latest action. A successful undo is itself recorded in the audit
     * log with source {@code undo}.
     */
    Mono<UndoRedoResult> undo(String sessionId);

    /**
     * Replays the session's latest undone action, recorded with source {@code redo}.
     */
    Mono<UndoRedoResult> redo(String sessionId);

    Mono<Boolean> clearStack(String sessionId);

    Mono<UndoStackInfo> getStackInfo(String sessionId);

    Mono<AuditStats> getStats();
}
