package org.quarry.history.entity;

public record UndoMetadata(
        String id,
        String undoStackId,
        String key,
        String value) {
}
