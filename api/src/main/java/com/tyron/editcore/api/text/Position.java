package com.tyron.editcore.api.text;

import org.jetbrains.annotations.NotNull;

/**
 * A (line, column) coordinate into a document.
 *
 * The column counts code points from the start of the line, not UTF-16 units and not visual cells.
 * A position is not inherently valid; resolve it against a {@link TextView} with
 * {@link TextView#offsetOf(Position)} or {@link TextView#clamp(Position)}.
 *
 * Ordering is document order: line-major, then column.
 */
public record Position(int line, int column) implements Comparable<Position> {

    public static final Position ZERO = new Position(0, 0);

    public static Position of(int line, int column) {
        return new Position(line, column);
    }

    public boolean isBefore(@NotNull Position other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(@NotNull Position other) {
        return compareTo(other) > 0;
    }

    public Position withColumn(int column) {
        return new Position(line, column);
    }

    /**
     * Offset of this position in {@code view}, after clamping.
     */
    public int toOffset(@NotNull TextView view) {
        return view.offsetOf(this);
    }

    public static Position fromOffset(@NotNull TextView view, int offset) {
        return view.positionOf(offset);
    }

    @Override
    public int compareTo(@NotNull Position o) {
        if (line != o.line) {
            return Integer.compare(line, o.line);
        }
        return Integer.compare(column, o.column);
    }

    @Override
    public String toString() {
        return "(" + line + ", " + column + ")";
    }
}
