package com.tyron.editcore.api.text;

/**
 * Read-only view of the text content.
 *
 * Offsets are indices into the UTF-16 code units of the whole document, ranges are {@code [start, end)}.
 * Lines end at {@code '\n'}; a {@code '\r'} directly before it belongs to the terminator, not the line content.
 * A document always has at least one (possibly empty) line.
 */
public interface TextView {

    String getText();

    /**
     * @return The text in the range [start, end).
     */
    String getText(int start, int end);

    int getTextLength();

    int getLineCount();

    /**
     * @return The content of the line, without its terminator.
     */
    String getLineText(int line);

    /**
     * @return Number of code points in the line, excluding the terminator.
     */
    int getLineLength(int line);

    int getLineStartOffset(int line);

    /**
     * @return Offset just past the line's content, i.e. the offset of its terminator (or the document end).
     */
    int getLineEndOffset(int line);

    /**
     * @return The line owning {@code offset}, after clamping it to {@code [0, getTextLength()]}.
     */
    int getLineOfOffset(int offset);

    char charAt(int offset);

    int codePointAt(int offset);

    /**
     * @return The code point ending just before {@code offset}.
     */
    int codePointBefore(int offset);

    /**
     * Resolves a position to an offset. The line is clamped to {@code [0, getLineCount())} and the
     * column to the line's length.
     *
     * @throws InvalidPositionException if a component is negative
     */
    int offsetOf(Position position);

    /**
     * Inverse of {@link #offsetOf(Position)}. The offset is clamped to the document length first.
     */
    Position positionOf(int offset);

    /**
     * @return {@code position} with its line and column clamped into this document.
     * @throws InvalidPositionException if a component is negative
     */
    default Position clamp(Position position) {
        return positionOf(offsetOf(position));
    }

    default boolean isEmpty() {
        return getTextLength() == 0;
    }

    /**
     * @return Position just past the content of the last line.
     */
    default Position getEndPosition() {
        int last = getLineCount() - 1;
        return new Position(last, getLineLength(last));
    }
}
