package org.quarry.history.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.config.UndoProperties;
import org.quarry.history.dto.request.UndoStackInput;
import org.quarry.history.dto.response.UndoRedoResult;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.UndoMetadata;
import org.quarry.history.entity.UndoStackEntry;
import org.quarry.history.repository.UndoStackDAO;
import org.quarry.history.service.ApplyStateHandler;
import org.quarry.history.service.UndoRedoService;
import org.quarry.history.utils.KeyedSerializer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UndoRedoServiceImpl implements UndoRedoService {

    private final UndoStackDAO undoStackDAO;
    private final ApplyStateHandlerRegistry handlerRegistry;
    private final UndoProperties undoProperties;

    private final KeyedSerializer sessions = new KeyedSerializer();

    @Override
    public Mono<String> pushUndoableAction(String sessionId, UndoStackInput input) {
        if (sessionId == null || input == null || input.targetType() == null || input.targetId() == null) {
            log.warn("Ignoring undoable action without session, target type or target id: {}", input);
            return Mono.empty();
        }
        return sessions.serialize(sessionId, () -> undoStackDAO.getStackInfo(sessionId)
                        .flatMap(info -> discardRedoBranch(sessionId, info)
                                .then(Mono.defer(() -> push(sessionId, info.currentPosition() + 1, input)))))
                .doOnError(e -> log.error("Failed to push undoable action on {} {} for session {}: {}",
                        input.targetType(), input.targetId(), sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.empty());
    }

    @Override
    public Mono<UndoRedoResult> undo(String sessionId) {
        return sessions.serialize(sessionId, () -> undoStackDAO.findHighestActive(sessionId)
                        .flatMap(entry -> apply(entry, entry.beforeState(), true))
                        .defaultIfEmpty(UndoRedoResult.failed(UndoRedoResult.NOTHING_TO_UNDO)))
                .doOnError(e -> log.error("Undo failed for session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.just(UndoRedoResult.failed("Undo failed: " + e.getMessage())));
    }

    @Override
    public Mono<UndoRedoResult> redo(String sessionId) {
        return sessions.serialize(sessionId, () -> undoStackDAO.getStackInfo(sessionId)
                        .flatMap(info -> undoStackDAO.findLowestInactiveAbove(sessionId, info.currentPosition()))
                        .flatMap(entry -> apply(entry, entry.afterState(), false))
                        .defaultIfEmpty(UndoRedoResult.failed(UndoRedoResult.NOTHING_TO_REDO)))
                .doOnError(e -> log.error("Redo failed for session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.just(UndoRedoResult.failed("Redo failed: " + e.getMessage())));
    }

    @Override
    public Mono<Boolean> clearStack(String sessionId) {
        return sessions.serialize(sessionId, () -> undoStackDAO.deleteSession(sessionId))
                .doOnSuccess(count -> log.debug("Cleared {} undo entries of session {}", count, sessionId))
                .thenReturn(Boolean.TRUE)
                .doOnError(e -> log.error("Failed to clear undo stack of session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.just(Boolean.FALSE));
    }

    @Override
    public Mono<UndoStackInfo> getUndoStackInfo(String sessionId) {
        return Mono.defer(() -> undoStackDAO.getStackInfo(sessionId))
                .doOnError(e -> log.error("Failed to read undo stack info of session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.just(UndoStackInfo.empty()));
    }

    @Override
    public Flux<UndoStackEntry> getStack(String sessionId) {
        return Flux.defer(() -> undoStackDAO.findBySession(sessionId))
                .doOnError(e -> log.error("Failed to read undo stack of session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Flux.empty());
    }

    @Override
    public Flux<UndoMetadata> getMetadata(String undoStackId) {
        return Flux.defer(() -> undoStackDAO.findMetadata(undoStackId))
                .doOnError(e -> log.error("Failed to read metadata of undo entry {}: {}", undoStackId, e.getMessage()))
                .onErrorResume(e -> Flux.empty());
    }

    private Mono<Long> discardRedoBranch(String sessionId, UndoStackInfo info) {
        if (!info.canRedo()) {
            return Mono.just(0L);
        }
        return undoStackDAO.deleteAbove(sessionId, info.currentPosition())
                .doOnSuccess(count -> log.debug("Discarded {} redo entries of session {}", count, sessionId));
    }

    private Mono<String> push(String sessionId, int position, UndoStackInput input) {
        UndoStackEntry entry = UndoStackEntry.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .stackPosition(position)
                .auditLogId(input.auditLogId())
                .targetType(input.targetType())
                .targetId(input.targetId())
                .beforeState(input.beforeState())
                .afterState(input.afterState())
                .active(true)
                .build();
        return undoStackDAO.insert(entry)
                .then(Mono.defer(() -> undoStackDAO.insertMetadata(toMetadata(entry.id(), input.metadata()))))
                .then(Mono.defer(() -> evictOverflow(sessionId, position)))
                .thenReturn(entry.id());
    }

    private Mono<Long> evictOverflow(String sessionId, int newestPosition) {
        int boundary = newestPosition - undoProperties.getMaxStackSize();
        if (boundary < 0) {
            return Mono.just(0L);
        }
        return undoStackDAO.deleteAtOrBelow(sessionId, boundary)
                .doOnSuccess(count -> {
                    if (count > 0) {
                        log.debug("Evicted {} oldest undo entries of session {}", count, sessionId);
                    }
                });
    }

    private Mono<UndoRedoResult> apply(UndoStackEntry entry, JsonNode state, boolean undo) {
        ApplyStateHandler handler = handlerRegistry.find(entry.targetType()).orElse(null);
        if (handler == null) {
            log.warn("No apply-state handler for target type {}, {} of {} refused", entry.targetType(),
                    undo ? "undo" : "redo", entry.targetId());
            return Mono.just(UndoRedoResult.failed("No apply-state handler for target type "
                    + entry.targetType().wireName()));
        }
        return Mono.defer(() -> handler.applyState(entry.targetType(), entry.targetId(), state, undo))
                .defaultIfEmpty(Boolean.FALSE)
                .onErrorResume(e -> {
                    log.error("Apply-state handler failed on {} {}: {}", entry.targetType(), entry.targetId(),
                            e.getMessage());
                    return Mono.just(Boolean.FALSE);
                })
                .flatMap(applied -> {
                    if (!applied) {
                        return Mono.just(UndoRedoResult.failed("Failed to apply state to "
                                + entry.targetType().wireName() + " " + entry.targetId()));
                    }
                    return undoStackDAO.setActive(entry.id(), !undo)
                            .thenReturn(UndoRedoResult.applied(entry.withActive(!undo), state));
                });
    }

    private static List<UndoMetadata> toMetadata(String undoStackId, Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return List.of();
        }
        return metadata.entrySet().stream()
                .filter(e -> e.getKey() != null)
                .map(e -> new UndoMetadata(UUID.randomUUID().toString(), undoStackId, e.getKey(), e.getValue()))
                .toList();
    }
}
