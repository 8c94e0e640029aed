package com.tyron.editcore.core.document;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, linear undo/redo history of {@link Snapshot}s.
 * <p>
 * Recording a new snapshot discards the redo stack. When the undo stack grows past {@code maxLevels}
 * the oldest entries are evicted first.
 * </p>
 */
public final class EditHistory {

    private static final Logger LOG = Logger.getLogger(EditHistory.class.getName());

    private final int maxLevels;
    private final Deque<Snapshot> undoStack = new ArrayDeque<>();
    private final Deque<Snapshot> redoStack = new ArrayDeque<>();

    public EditHistory(int maxLevels) {
        if (maxLevels < 0) {
            throw new IllegalArgumentException("maxLevels < 0: " + maxLevels);
        }
        this.maxLevels = maxLevels;
    }

    /**
     * Records the state preceding an edit.
     */
    public void record(@NotNull Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        redoStack.clear();
        pushUndo(snapshot);
    }

    /**
     * @param current the state to move onto the redo stack
     * @return The snapshot to restore, or {@code null} if there is nothing to undo.
     */
    @Nullable
    public Snapshot undo(@NotNull Snapshot current) {
        Snapshot previous = undoStack.pollLast();
        if (previous == null) {
            return null;
        }
        redoStack.addLast(current);
        return previous;
    }

    /**
     * @param current the state to move back onto the undo stack
     * @return The snapshot to restore, or {@code null} if there is nothing to redo.
     */
    @Nullable
    public Snapshot redo(@NotNull Snapshot current) {
        Snapshot next = redoStack.pollLast();
        if (next == null) {
            return null;
        }
        pushUndo(current);
        return next;
    }

    private void pushUndo(Snapshot snapshot) {
        undoStack.addLast(snapshot);
        int evicted = 0;
        while (undoStack.size() > maxLevels) {
            undoStack.removeFirst();
            evicted++;
        }
        if (evicted > 0 && LOG.isLoggable(Level.FINE)) {
            LOG.fine("history evicted=" + evicted + " maxLevels=" + maxLevels);
        }
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public int getRedoDepth() {
        return redoStack.size();
    }

    public int getMaxLevels() {
        return maxLevels;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
