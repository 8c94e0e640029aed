package com.tyron.editcore.core.document;

import com.tyron.editcore.api.text.Position;

import java.util.Objects;

/**
 * One undo/redo unit: the document content and the cursor position at the time it was taken.
 */
public record Snapshot(Rope rope, Position cursor) {

    public Snapshot {
        Objects.requireNonNull(rope, "rope");
        Objects.requireNonNull(cursor, "cursor");
    }
}
