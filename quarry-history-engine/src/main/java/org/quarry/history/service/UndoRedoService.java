package org.quarry.history.service;

import org.quarry.history.dto.request.UndoStackInput;
import org.quarry.history.dto.response.UndoRedoResult;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.UndoMetadata;
import org.quarry.history.entity.UndoStackEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Per-session undo/redo stacks.
 * <p>
 * Push, undo, redo and clear run one at a time per session. Sessions do not block each other.
 */
public interface UndoRedoService {

    /**
     * Pushes an entry on top of the session's cursor, discarding the redo branch, and emits its id.
     * Completes empty when the entry could not be stored.
     */
    Mono<String> pushUndoableAction(String sessionId, UndoStackInput input);

    Mono<UndoRedoResult> undo(String sessionId);

    Mono<UndoRedoResult> redo(String sessionId);

    /**
     * Removes every entry of the session and its metadata. Emits false on storage failure.
     */
    Mono<Boolean> clearStack(String sessionId);

    Mono<UndoStackInfo> getUndoStackInfo(String sessionId);

    Flux<UndoStackEntry> getStack(String sessionId);

    Flux<UndoMetadata> getMetadata(String undoStackId);
}
