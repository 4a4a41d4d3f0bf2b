package org.quarry.history.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.dto.request.AuditLogInput;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.request.UndoStackInput;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.UndoRedoResult;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.entity.UndoStackEntry;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.service.AuditLogService;
import org.quarry.history.service.HistoryService;
import org.quarry.history.service.UndoRedoService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryServiceImpl implements HistoryService {

    static final String REVERT_ACTION = "revert";
    static final String REDO_ACTION = "redo";

    private final AuditLogService auditLogService;
    private final UndoRedoService undoRedoService;

    @Override
    public Mono<String> recordAction(String sessionId, AuditLogInput input) {
        return auditLogService.logAction(sessionId, input);
    }

    @Override
    public Mono<String> recordUndoableAction(String sessionId, AuditLogInput input, Map<String, String> metadata) {
        if (input == null) {
            return Mono.empty();
        }
        AuditLogInput undoable = input.toBuilder().undoable(true).build();
        // the undo entry is pushed even when the action type is not audited
        return auditLogService.logAction(sessionId, undoable)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(auditLogId -> undoRedoService.pushUndoableAction(sessionId, UndoStackInput.builder()
                        .auditLogId(auditLogId.orElse(null))
                        .targetType(input.targetType())
                        .targetId(input.targetId())
                        .beforeState(input.oldValue())
                        .afterState(input.newValue())
                        .metadata(metadata)
                        .build()));
    }

    @Override
    public Flux<AuditLogEntry> getRecentActions(String sessionId, int limit) {
        return auditLogService.query(AuditLogQuery.recent(limit).toBuilder()
                .sessionId(sessionId)
                .build());
    }

    @Override
    public Flux<AuditLogEntry> getActionsByType(AuditActionType actionType, int limit) {
        return auditLogService.query(AuditLogQuery.recent(limit).toBuilder()
                .actionType(actionType)
                .build());
    }

    @Override
    public Flux<AuditLogEntry> getActionsForTarget(AuditTargetType targetType, String targetId, int limit) {
        return auditLogService.query(AuditLogQuery.recent(limit).toBuilder()
                .targetType(targetType)
                .targetId(targetId)
                .build());
    }

    @Override
    public Mono<String> pushUndoableAction(String sessionId, UndoStackInput input) {
        return undoRedoService.pushUndoableAction(sessionId, input);
    }

    @Override
    public Mono<UndoRedoResult> undo(String sessionId) {
        return undoRedoService.undo(sessionId)
                .flatMap(result -> recordReversal(sessionId, result, true));
    }

    @Override
    public Mono<UndoRedoResult> redo(String sessionId) {
        return undoRedoService.redo(sessionId)
                .flatMap(result -> recordReversal(sessionId, result, false));
    }

    @Override
    public Mono<Boolean> clearStack(String sessionId) {
        return undoRedoService.clearStack(sessionId);
    }

    @Override
    public Mono<UndoStackInfo> getStackInfo(String sessionId) {
        return undoRedoService.getUndoStackInfo(sessionId);
    }

    @Override
    public Mono<AuditStats> getStats() {
        return auditLogService.getStats();
    }

    private Mono<UndoRedoResult> recordReversal(String sessionId, UndoRedoResult result, boolean undo) {
        if (!result.success() || result.entry() == null) {
            return Mono.just(result);
        }
        UndoStackEntry entry = result.entry();
        Mono<AuditLogEntry> original = entry.auditLogId() == null
                ? Mono.empty()
                : auditLogService.getEntry(entry.auditLogId());
        return original
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(reference -> auditLogService.logAction(sessionId, AuditLogInput.builder()
                        .actionType(reference.map(AuditLogEntry::actionType).orElse(AuditActionType.CONTENT))
                        .actionName(reference.map(AuditLogEntry::actionName)
                                .orElse(undo ? REVERT_ACTION : REDO_ACTION))
                        .targetType(entry.targetType())
                        .targetId(entry.targetId())
                        .targetPath(reference.map(AuditLogEntry::targetPath).orElse(null))
                        .oldValue(undo ? entry.afterState() : entry.beforeState())
                        .newValue(undo ? entry.beforeState() : entry.afterState())
                        .undoable(false)
                        .source(undo ? AuditSource.UNDO : AuditSource.REDO)
                        .build()))
                .doOnNext(auditId -> log.debug("Recorded {} of {} {} as {}", undo ? "undo" : "redo",
                        entry.targetType(), entry.targetId(), auditId))
                .thenReturn(result);
    }
}
