package org.quarry.history.dto.response;

/**
 * Shape of a session's undo stack. {@code currentPosition} is the stack position of the
 * highest active entry, or -1 when nothing is active.
 */
public record UndoStackInfo(long totalEntries, long activeEntries, int currentPosition) {

    public static final int NO_POSITION = -1;

    public static UndoStackInfo empty() {
        return new UndoStackInfo(0, 0, NO_POSITION);
    }

    public boolean canUndo() {
        return activeEntries > 0;
    }

    public boolean canRedo() {
        return totalEntries > activeEntries;
    }

    public long undoCount() {
        return activeEntries;
    }

    public long redoCount() {
        return totalEntries - activeEntries;
    }
}
