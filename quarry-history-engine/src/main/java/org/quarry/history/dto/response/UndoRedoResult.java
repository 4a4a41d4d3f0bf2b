package org.quarry.history.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.quarry.history.entity.UndoStackEntry;

/**
 * Outcome of an undo or redo. Expected failures such as an empty stack or a rejecting
 * handler are reported here with {@code success == false}, never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UndoRedoResult(
        boolean success,
        UndoStackEntry entry,
        JsonNode appliedState,
        String error) {

    public static final String NOTHING_TO_UNDO = "Nothing to undo";
    public static final String NOTHING_TO_REDO = "Nothing to redo";

    public static UndoRedoResult applied(UndoStackEntry entry, JsonNode appliedState) {
        return new UndoRedoResult(true, entry, appliedState, null);
    }

    public static UndoRedoResult failed(String error) {
        return new UndoRedoResult(false, null, null, error);
    }
}
