package com.tyron.editcore.api.text;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A range between two positions. A selection never owns text; it is resolved against a {@link TextView} on demand.
 *
 * Construction normalizes the endpoints so that {@code start <= end} in document order.
 */
public record Selection(@NotNull Position start, @NotNull Position end) {

    public Selection {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.compareTo(end) > 0) {
            Position tmp = start;
            start = end;
            end = tmp;
        }
    }

    /**
     * Creates a selection from two positions given in any order.
     */
    public static Selection fromPositions(@NotNull Position a, @NotNull Position b) {
        return new Selection(a, b);
    }

    public static Selection caret(@NotNull Position position) {
        return new Selection(position, position);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    /**
     * Inclusive range test. An empty selection contains nothing.
     */
    public boolean contains(@NotNull Position position) {
        if (isEmpty()) {
            return false;
        }
        return position.compareTo(start) >= 0 && position.compareTo(end) <= 0;
    }

    /**
     * @return A selection widened so that it includes {@code position}. Only the exceeded end moves.
     */
    public Selection extendTo(@NotNull Position position) {
        if (position.isBefore(start)) {
            return new Selection(position, end);
        }
        if (position.isAfter(end)) {
            return new Selection(start, position);
        }
        return this;
    }

    public int getStartOffset(@NotNull TextView view) {
        return view.offsetOf(start);
    }

    public int getEndOffset(@NotNull TextView view) {
        return view.offsetOf(end);
    }

    /**
     * @return The selected text, or an empty string for an empty selection.
     */
    public String getText(@NotNull TextView view) {
        if (isEmpty()) {
            return "";
        }
        int from = view.offsetOf(start);
        int to = view.offsetOf(end);
        return view.getText(from, Math.max(from, to));
    }

    /**
     * Selects a full line including its terminator. The last line is selected up to the end of its content.
     *
     * @return {@code null} if {@code line} is outside the document.
     */
    @Nullable
    public static Selection line(@NotNull TextView view, int line) {
        if (line < 0 || line >= view.getLineCount()) {
            return null;
        }
        Position from = new Position(line, 0);
        if (line + 1 < view.getLineCount()) {
            return new Selection(from, new Position(line + 1, 0));
        }
        return new Selection(from, new Position(line, view.getLineLength(line)));
    }

    @Nullable
    public static Selection wordAt(@NotNull TextView view, @NotNull Position position) {
        return wordAt(view, position, WordBoundaryClassifier.DEFAULT);
    }

    /**
     * Selects the word containing the character at {@code position}.
     *
     * @return {@code null} if the character there is a boundary or {@code position} is at the document end.
     */
    @Nullable
    public static Selection wordAt(@NotNull TextView view,
                                   @NotNull Position position,
                                   @NotNull WordBoundaryClassifier classifier) {
        int offset = view.offsetOf(position);
        int length = view.getTextLength();
        if (offset >= length) {
            return null;
        }
        if (classifier.isBoundary(view.codePointAt(offset))) {
            return null;
        }

        int from = offset;
        while (from > 0) {
            int cp = view.codePointBefore(from);
            if (classifier.isBoundary(cp)) break;
            from -= Character.charCount(cp);
        }

        int to = offset;
        while (to < length) {
            int cp = view.codePointAt(to);
            if (classifier.isBoundary(cp)) break;
            to += Character.charCount(cp);
        }

        return new Selection(view.positionOf(from), view.positionOf(to));
    }

    /**
     * Selects from the document start to the end of the last line's content.
     */
    public static Selection all(@NotNull TextView view) {
        return new Selection(Position.ZERO, view.getEndPosition());
    }

    @Override
    public String toString() {
        return "Selection[" + start + " .. " + end + "]";
    }
}
