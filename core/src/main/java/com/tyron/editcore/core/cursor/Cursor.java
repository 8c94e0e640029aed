package com.tyron.editcore.core.cursor;

import com.tyron.editcore.api.command.CursorMovement;
import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.TextView;
import com.tyron.editcore.api.text.VisualColumns;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Caret position plus the visual column remembered across consecutive vertical moves.
 * <p>
 * Movement methods take a read-only {@link TextView} and only mutate the cursor. A position left stale by an
 * edit is clamped into the document before moving. Horizontal, word and explicit moves forget the remembered
 * column; vertical moves set or reuse it, so moving through lines with different tab layouts keeps the
 * on-screen column.
 * </p>
 */
public final class Cursor {

    private static final int NO_COLUMN = -1;

    private final int tabWidth;
    private final WordBoundaryClassifier classifier;

    private Position position = Position.ZERO;
    private int desiredVisualColumn = NO_COLUMN;

    public Cursor() {
        this(VisualColumns.DEFAULT_TAB_WIDTH, WordBoundaryClassifier.DEFAULT);
    }

    public Cursor(int tabWidth, @NotNull WordBoundaryClassifier classifier) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @NotNull
    public Position getPosition() {
        return position;
    }

    /**
     * Places the cursor without validating against a document and forgets the remembered visual column.
     */
    public void setPosition(@NotNull Position position) {
        this.position = Objects.requireNonNull(position, "position");
        this.desiredVisualColumn = NO_COLUMN;
    }

    public boolean hasDesiredVisualColumn() {
        return desiredVisualColumn != NO_COLUMN;
    }

    /**
     * @return The remembered visual column, or {@code -1} when none is set.
     */
    public int getDesiredVisualColumn() {
        return desiredVisualColumn;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    /**
     * Applies one movement.
     *
     * @param pageLines number of line steps taken by {@link CursorMovement#PAGE_UP} and {@link CursorMovement#PAGE_DOWN}
     * @return {@code true} if the movement was possible, which normally means the position changed.
     */
    public boolean move(@NotNull TextView view, @NotNull CursorMovement movement, int pageLines) {
        return switch (movement) {
            case UP -> moveUp(view);
            case DOWN -> moveDown(view);
            case LEFT -> moveLeft(view);
            case RIGHT -> moveRight(view);
            case WORD_LEFT -> moveWordLeft(view);
            case WORD_RIGHT -> moveWordRight(view);
            case LINE_START -> moveToLineStart(view);
            case LINE_END -> moveToLineEnd(view);
            case DOCUMENT_START -> moveToDocumentStart();
            case DOCUMENT_END -> moveToDocumentEnd(view);
            case PAGE_UP -> pageUp(view, pageLines);
            case PAGE_DOWN -> pageDown(view, pageLines);
        };
    }

    public boolean moveLeft(@NotNull TextView view) {
        Position current = view.clamp(position);
        if (current.column() > 0) {
            setPosition(current.withColumn(current.column() - 1));
            return true;
        }
        if (current.line() > 0) {
            int line = current.line() - 1;
            setPosition(new Position(line, view.getLineLength(line)));
            return true;
        }
        setPosition(current);
        return false;
    }

    public boolean moveRight(@NotNull TextView view) {
        Position current = view.clamp(position);
        if (current.column() < view.getLineLength(current.line())) {
            setPosition(current.withColumn(current.column() + 1));
            return true;
        }
        if (current.line() < view.getLineCount() - 1) {
            setPosition(new Position(current.line() + 1, 0));
            return true;
        }
        setPosition(current);
        return false;
    }

    public boolean moveUp(@NotNull TextView view) {
        return moveVertically(view, -1);
    }

    public boolean moveDown(@NotNull TextView view) {
        return moveVertically(view, 1);
    }

    private boolean moveVertically(TextView view, int delta) {
        Position current = view.clamp(position);
        int target = current.line() + delta;
        if (target < 0 || target >= view.getLineCount()) {
            return false;
        }

        int visual = desiredVisualColumn;
        if (visual == NO_COLUMN) {
            visual = VisualColumns.toVisual(view.getLineText(current.line()), current.column(), tabWidth);
        }

        int column = VisualColumns.toCharColumn(view.getLineText(target), visual, tabWidth);
        position = new Position(target, Math.min(column, view.getLineLength(target)));
        desiredVisualColumn = visual;
        return true;
    }

    public boolean pageUp(@NotNull TextView view, int lines) {
        boolean moved = false;
        for (int i = 0; i < lines && moveUp(view); i++) {
            moved = true;
        }
        return moved;
    }

    public boolean pageDown(@NotNull TextView view, int lines) {
        boolean moved = false;
        for (int i = 0; i < lines && moveDown(view); i++) {
            moved = true;
        }
        return moved;
    }

    /**
     * Skips the boundary run before the cursor, then the word run, landing at the start of that word.
     */
    public boolean moveWordLeft(@NotNull TextView view) {
        int offset = view.offsetOf(position);
        if (offset == 0) {
            setPosition(Position.ZERO);
            return false;
        }
        setPosition(view.positionOf(wordStartBefore(view, offset, classifier)));
        return true;
    }

    /**
     * Skips the rest of the current word, then the boundary run after it, landing at the start of the next word
     * or at the document end.
     */
    public boolean moveWordRight(@NotNull TextView view) {
        int offset = view.offsetOf(position);
        if (offset >= view.getTextLength()) {
            setPosition(view.positionOf(offset));
            return false;
        }
        setPosition(view.positionOf(nextWordStart(view, offset, classifier)));
        return true;
    }

    public boolean moveToLineStart(@NotNull TextView view) {
        Position current = view.clamp(position);
        setPosition(current.withColumn(0));
        return current.column() != 0;
    }

    public boolean moveToLineEnd(@NotNull TextView view) {
        Position current = view.clamp(position);
        int end = view.getLineLength(current.line());
        setPosition(current.withColumn(end));
        return current.column() != end;
    }

    public boolean moveToDocumentStart() {
        boolean moved = !position.equals(Position.ZERO);
        setPosition(Position.ZERO);
        return moved;
    }

    public boolean moveToDocumentEnd(@NotNull TextView view) {
        Position end = view.getEndPosition();
        boolean moved = !position.equals(end);
        setPosition(end);
        return moved;
    }

    /**
     * @return Offset reached from {@code offset} by skipping the word run, then the boundary run.
     */
    public static int nextWordStart(TextView view, int offset, WordBoundaryClassifier classifier) {
        int length = view.getTextLength();
        int end = offset;
        while (end < length) {
            int cp = view.codePointAt(end);
            if (classifier.isBoundary(cp)) break;
            end += Character.charCount(cp);
        }
        while (end < length) {
            int cp = view.codePointAt(end);
            if (!classifier.isBoundary(cp)) break;
            end += Character.charCount(cp);
        }
        return end;
    }

    /**
     * @return Offset reached from {@code offset} by skipping the boundary run backwards, then the word run.
     */
    public static int wordStartBefore(TextView view, int offset, WordBoundaryClassifier classifier) {
        int start = offset;
        while (start > 0) {
            int cp = view.codePointBefore(start);
            if (!classifier.isBoundary(cp)) break;
            start -= Character.charCount(cp);
        }
        while (start > 0) {
            int cp = view.codePointBefore(start);
            if (classifier.isBoundary(cp)) break;
            start -= Character.charCount(cp);
        }
        return start;
    }

    /**
     * @return Offset reached from {@code offset} by skipping the boundary run, then the word run.
     */
    public static int wordEndAfter(TextView view, int offset, WordBoundaryClassifier classifier) {
        int length = view.getTextLength();
        int end = offset;
        while (end < length) {
            int cp = view.codePointAt(end);
            if (!classifier.isBoundary(cp)) break;
            end += Character.charCount(cp);
        }
        while (end < length) {
            int cp = view.codePointAt(end);
            if (classifier.isBoundary(cp)) break;
            end += Character.charCount(cp);
        }
        return end;
    }

    @Override
    public String toString() {
        return "Cursor{position=" + position + ", desiredVisualColumn=" + desiredVisualColumn + '}';
    }
}
