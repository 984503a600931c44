package dev.workflows.engine;

import dev.workflows.model.EditorSnapshot;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear undo/redo over whole editor snapshots. Take a checkpoint of the
 * current state before each edit; a checkpoint clears the redo side.
 */
public final class EditorHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<EditorSnapshot> undo = new ArrayDeque<>();
    private final Deque<EditorSnapshot> redo = new ArrayDeque<>();

    public EditorHistory() {
        this(DEFAULT_CAPACITY);
    }

    public EditorHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void checkpoint(EditorSnapshot current) {
        pushUndo(Objects.requireNonNull(current, "current"));
        redo.clear();
    }

    /**
     * Step back. The state being left goes onto the redo side.
     *
     * @return the snapshot to restore, or empty when there is nothing to undo
     */
    public Optional<EditorSnapshot> undo(EditorSnapshot current) {
        if (undo.isEmpty()) {
            return Optional.empty();
        }
        redo.push(Objects.requireNonNull(current, "current"));
        return Optional.of(undo.pop());
    }

    public Optional<EditorSnapshot> redo(EditorSnapshot current) {
        if (redo.isEmpty()) {
            return Optional.empty();
        }
        pushUndo(Objects.requireNonNull(current, "current"));
        return Optional.of(redo.pop());
    }

    private void pushUndo(EditorSnapshot snapshot) {
        undo.push(snapshot);
        while (undo.size() > capacity) {
            undo.removeLast();
        }
    }

    public boolean canUndo() { return !undo.isEmpty(); }
    public boolean canRedo() { return !redo.isEmpty(); }
    public int undoDepth() { return undo.size(); }

    public void clear() {
        undo.clear();
        redo.clear();
    }
}
