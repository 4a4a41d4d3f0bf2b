package org.quarry.history.repository;

import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.UndoMetadata;
import org.quarry.history.entity.UndoStackEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistence of undo stack entries and their metadata. Every delete removes the metadata
 * rows of the affected entries before the entries themselves.
 */
public interface UndoStackDAO {
    Mono<UndoStackInfo> getStackInfo(String sessionId);
    Mono<UndoStackEntry> findHighestActive(String sessionId);
    Mono<UndoStackEntry> findLowestInactiveAbove(String sessionId, int position);
    Flux<UndoStackEntry> findBySession(String sessionId);
    Flux<String> findSessionIds();
    Mono<Long> insert(UndoStackEntry entry);
    Mono<Long> insertMetadata(List<UndoMetadata> metadata);
    Flux<UndoMetadata> findMetadata(String undoStackId);
    Mono<Long> setActive(String id, boolean active);
    Mono<Long> deleteAbove(String sessionId, int position);
    Mono<Long> deleteAtOrBelow(String sessionId, int position);
    Mono<Long> deleteSession(String sessionId);
}
