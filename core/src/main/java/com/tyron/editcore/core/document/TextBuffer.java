package com.tyron.editcore.core.document;

import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.text.DocumentEvent;
import com.tyron.editcore.api.text.DocumentListener;
import com.tyron.editcore.api.text.InvalidPositionException;
import com.tyron.editcore.api.text.ObservableTextView;
import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import com.tyron.editcore.core.cursor.Cursor;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rope-backed document with snapshot based undo/redo.
 * <p>
 * Every mutating operation that changes the text records exactly one {@link Snapshot} of the state before the
 * change and clears the redo stack; an operation that turns out to change nothing records nothing. Operations
 * take {@link Position}s at the boundary and move the given {@link Cursor} to where the edit leaves it.
 * </p>
 * Not thread-safe: a buffer is owned by a single editor and driven from one thread.
 */
public final class TextBuffer implements ObservableTextView {

    private static final Logger LOG = Logger.getLogger(TextBuffer.class.getName());

    private final EditHistory history;
    private final CopyOnWriteArrayList<DocumentListener> listeners = new CopyOnWriteArrayList<>();

    private Rope rope;
    private boolean modified;
    private long modificationStamp;

    public TextBuffer() {
        this("");
    }

    public TextBuffer(@NotNull String initialText) {
        this(initialText, EditorSettings.DEFAULT_MAX_UNDO_LEVELS);
    }

    public TextBuffer(@NotNull String initialText, int maxUndoLevels) {
        this.rope = Rope.of(Objects.requireNonNull(initialText, "initialText"));
        this.history = new EditHistory(maxUndoLevels);
    }

    // ---- editing ----

    public void insertChar(@NotNull Position position, int codePoint, @NotNull Cursor cursor) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Not a valid code point: " + codePoint);
        }
        int offset = offsetOf(position);
        String text = new String(Character.toChars(codePoint));
        apply(offset, offset, text, cursor);
        cursor.setPosition(positionOf(offset + text.length()));
    }

    /**
     * @return {@code false} without touching anything when {@code text} is empty.
     */
    public boolean insertText(@NotNull Position position, @NotNull String text, @NotNull Cursor cursor) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return false;
        }
        int offset = offsetOf(position);
        apply(offset, offset, text, cursor);
        cursor.setPosition(positionOf(offset + text.length()));
        return true;
    }

    /**
     * Deletes the character at {@code position}.
     *
     * @return {@code false} at the document end.
     */
    public boolean deleteChar(@NotNull Position position, @NotNull Cursor cursor) {
        int offset = offsetOf(position);
        if (offset >= rope.length()) {
            return false;
        }
        int end = isCrLfAt(offset) ? offset + 2 : offset + Character.charCount(codePointAt(offset));
        apply(offset, end, "", cursor);
        cursor.setPosition(positionOf(offset));
        return true;
    }

    /**
     * Deletes the character before {@code position}.
     *
     * @return {@code false} at the document start.
     */
    public boolean deleteCharBackward(@NotNull Position position, @NotNull Cursor cursor) {
        int offset = offsetOf(position);
        if (offset == 0) {
            return false;
        }
        int start = offset >= 2 && isCrLfAt(offset - 2)
                ? offset - 2
                : offset - Character.charCount(codePointBefore(offset));
        apply(start, offset, "", cursor);
        cursor.setPosition(positionOf(start));
        return true;
    }

    /**
     * Removes {@code line} together with its terminator. The last line is removed up to the document end,
     * the terminator before it stays.
     *
     * @return {@code false} if the line does not exist or has nothing to remove.
     */
    public boolean deleteLine(int line, @NotNull Cursor cursor) {
        if (line < 0) {
            throw new InvalidPositionException(line, 0);
        }
        int lineCount = getLineCount();
        if (line >= lineCount || rope.isEmpty()) {
            return false;
        }
        int start = rope.lineStartOffset(line);
        int end = line + 1 < lineCount ? rope.lineStartOffset(line + 1) : rope.length();
        if (start == end) {
            return false;
        }
        apply(start, end, "", cursor);
        cursor.setPosition(new Position(Math.min(line, getLineCount() - 1), 0));
        return true;
    }

    /**
     * @return The removed text; empty if the selection was empty.
     */
    public String deleteSelection(@NotNull Selection selection, @NotNull Cursor cursor) {
        if (selection.isEmpty()) {
            return "";
        }
        int start = offsetOf(selection.start());
        int end = offsetOf(selection.end());
        if (start >= end) {
            return "";
        }
        String removed = rope.substring(start, end);
        apply(start, end, "", cursor);
        cursor.setPosition(positionOf(start));
        return removed;
    }

    /**
     * Replaces the selected range with {@code text} as a single undoable edit and places the cursor after the
     * inserted text.
     *
     * @return {@code true} if the document changed.
     */
    public boolean replace(@NotNull Selection selection, @NotNull String text, @NotNull Cursor cursor) {
        Objects.requireNonNull(text, "text");
        int start = offsetOf(selection.start());
        int end = Math.max(start, offsetOf(selection.end()));
        if (rope.substring(start, end).equals(text)) {
            cursor.setPosition(positionOf(start + text.length()));
            return false;
        }
        apply(start, end, text, cursor);
        cursor.setPosition(positionOf(start + text.length()));
        return true;
    }

    /**
     * Deletes from the cursor across the adjacent boundary run and the word after it.
     */
    public boolean deleteWordForward(@NotNull Cursor cursor, @NotNull WordBoundaryClassifier classifier) {
        int offset = offsetOf(cursor.getPosition());
        if (offset >= rope.length()) {
            return false;
        }
        int end = Cursor.wordEndAfter(this, offset, classifier);
        if (end <= offset) {
            return false;
        }
        apply(offset, end, "", cursor);
        cursor.setPosition(positionOf(offset));
        return true;
    }

    /**
     * Deletes backwards from the cursor across the adjacent boundary run and the word before it.
     */
    public boolean deleteWordBackward(@NotNull Cursor cursor, @NotNull WordBoundaryClassifier classifier) {
        int offset = offsetOf(cursor.getPosition());
        if (offset == 0) {
            return false;
        }
        int start = Cursor.wordStartBefore(this, offset, classifier);
        if (start >= offset) {
            return false;
        }
        apply(start, offset, "", cursor);
        cursor.setPosition(positionOf(start));
        return true;
    }

    /**
     * Deletes from the cursor to the end of the line's content; the terminator stays.
     */
    public boolean deleteToLineEnd(@NotNull Cursor cursor) {
        Position position = clamp(cursor.getPosition());
        int offset = offsetOf(position);
        int lineEnd = getLineEndOffset(position.line());
        if (offset >= lineEnd) {
            return false;
        }
        apply(offset, lineEnd, "", cursor);
        cursor.setPosition(position);
        return true;
    }

    public boolean deleteToLineStart(@NotNull Cursor cursor) {
        Position position = clamp(cursor.getPosition());
        int offset = offsetOf(position);
        int lineStart = getLineStartOffset(position.line());
        if (offset <= lineStart) {
            return false;
        }
        apply(lineStart, offset, "", cursor);
        cursor.setPosition(new Position(position.line(), 0));
        return true;
    }

    // ---- history ----

    /**
     * Restores the most recent snapshot, text and cursor.
     *
     * @return {@code false} if there is nothing to undo.
     */
    public boolean undo(@NotNull Cursor cursor) {
        Snapshot previous = history.undo(new Snapshot(rope, cursor.getPosition()));
        if (previous == null) {
            return false;
        }
        restore(previous, cursor);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("undo undoDepth=" + history.getUndoDepth() + " redoDepth=" + history.getRedoDepth());
        }
        return true;
    }

    public boolean redo(@NotNull Cursor cursor) {
        Snapshot next = history.redo(new Snapshot(rope, cursor.getPosition()));
        if (next == null) {
            return false;
        }
        restore(next, cursor);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("redo undoDepth=" + history.getUndoDepth() + " redoDepth=" + history.getRedoDepth());
        }
        return true;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public int getUndoDepth() {
        return history.getUndoDepth();
    }

    public int getRedoDepth() {
        return history.getRedoDepth();
    }

    public int getMaxUndoLevels() {
        return history.getMaxLevels();
    }

    // ---- search ----

    /**
     * Scans line by line for {@code pattern}. Matches never overlap: after a match the scan resumes just past it.
     *
     * @return Start positions of the matches in document order; empty for an empty pattern.
     */
    public List<Position> find(@NotNull String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        List<Position> result = new ArrayList<>();
        if (pattern.isEmpty()) {
            return result;
        }
        int lineCount = getLineCount();
        for (int line = 0; line < lineCount; line++) {
            String text = getLineText(line);
            int from = 0;
            int index;
            while ((index = text.indexOf(pattern, from)) >= 0) {
                result.add(new Position(line, text.codePointCount(0, index)));
                from = index + pattern.length();
            }
        }
        return result;
    }

    /**
     * Replaces every occurrence of {@code pattern} across the whole document as one undoable edit.
     * The cursor is clamped into the new content.
     *
     * @return Number of occurrences found in the original text.
     */
    public int replaceAll(@NotNull String pattern, @NotNull String replacement, @NotNull Cursor cursor) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        if (pattern.isEmpty()) {
            return 0;
        }
        String text = rope.toString();
        int count = countOccurrences(text, pattern);
        if (count == 0) {
            return 0;
        }
        String newText = text.replace(pattern, replacement);
        if (newText.equals(text)) {
            return count;
        }

        history.record(new Snapshot(rope, cursor.getPosition()));
        Rope old = rope;
        rope = Rope.of(newText);
        modified = true;
        fireChanged(0, old.length(), newText);
        cursor.setPosition(clamp(cursor.getPosition()));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("replaceAll pattern=" + pattern + " count=" + count);
        }
        return count;
    }

    private static int countOccurrences(String text, String pattern) {
        int count = 0;
        int from = 0;
        int index;
        while ((index = text.indexOf(pattern, from)) >= 0) {
            count++;
            from = index + pattern.length();
        }
        return count;
    }

    // ---- state ----

    public boolean isModified() {
        return modified;
    }

    /**
     * Clears the modified flag, e.g. after the host has persisted the text.
     */
    public void markSaved() {
        modified = false;
    }

    /**
     * Replaces the whole content without recording history. Existing history is discarded and the buffer
     * becomes unmodified.
     */
    public void reset(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        Rope old = rope;
        rope = Rope.of(text);
        history.clear();
        modified = false;
        fireChanged(0, old.length(), text);
    }

    private void apply(int start, int end, String text, Cursor cursor) {
        history.record(new Snapshot(rope, cursor.getPosition()));
        rope = rope.replace(start, end, text);
        modified = true;
        fireChanged(start, end, text);
    }

    private void restore(Snapshot snapshot, Cursor cursor) {
        Rope old = rope;
        rope = snapshot.rope();
        modified = true;
        cursor.setPosition(snapshot.cursor());
        fireChanged(0, old.length(), rope.toString());
    }

    private void fireChanged(int start, int end, String newText) {
        modificationStamp++;
        DocumentEvent event = new DocumentEvent(this, start, end, newText);
        for (DocumentListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    // ---- TextView ----

    @Override
    public String getText() {
        return rope.toString();
    }

    @Override
    public String getText(int start, int end) {
        return rope.substring(start, end);
    }

    @Override
    public int getTextLength() {
        return rope.length();
    }

    @Override
    public int getLineCount() {
        return rope.lineCount();
    }

    @Override
    public String getLineText(int line) {
        return rope.substring(getLineStartOffset(line), getLineEndOffset(line));
    }

    @Override
    public int getLineLength(int line) {
        String text = getLineText(line);
        return text.codePointCount(0, text.length());
    }

    @Override
    public int getLineStartOffset(int line) {
        return rope.lineStartOffset(line);
    }

    @Override
    public int getLineEndOffset(int line) {
        checkLine(line);
        if (line + 1 < rope.lineCount()) {
            int terminator = rope.lineStartOffset(line + 1) - 1;
            if (terminator > 0 && rope.charAt(terminator - 1) == '\r') {
                terminator--;
            }
            return terminator;
        }
        return rope.length();
    }

    private boolean isCrLfAt(int offset) {
        return offset + 1 < rope.length() && rope.charAt(offset) == '\r' && rope.charAt(offset + 1) == '\n';
    }

    @Override
    public int getLineOfOffset(int offset) {
        return rope.lineOfOffset(Math.max(0, Math.min(offset, rope.length())));
    }

    @Override
    public char charAt(int offset) {
        if (offset < 0 || offset >= rope.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + rope.length());
        }
        return rope.charAt(offset);
    }

    @Override
    public int codePointAt(int offset) {
        char high = charAt(offset);
        if (Character.isHighSurrogate(high) && offset + 1 < rope.length()) {
            char low = rope.charAt(offset + 1);
            if (Character.isLowSurrogate(low)) {
                return Character.toCodePoint(high, low);
            }
        }
        return high;
    }

    @Override
    public int codePointBefore(int offset) {
        char low = charAt(offset - 1);
        if (Character.isLowSurrogate(low) && offset - 2 >= 0) {
            char high = rope.charAt(offset - 2);
            if (Character.isHighSurrogate(high)) {
                return Character.toCodePoint(high, low);
            }
        }
        return low;
    }

    @Override
    public int offsetOf(@NotNull Position position) {
        if (position.line() < 0 || position.column() < 0) {
            throw new InvalidPositionException(position.line(), position.column());
        }
        int line = Math.min(position.line(), rope.lineCount() - 1);
        int start = rope.lineStartOffset(line);
        String text = rope.substring(start, getLineEndOffset(line));
        int column = Math.min(position.column(), text.codePointCount(0, text.length()));
        return start + text.offsetByCodePoints(0, column);
    }

    @Override
    public Position positionOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, rope.length()));
        int line = rope.lineOfOffset(clamped);
        int start = rope.lineStartOffset(line);
        String prefix = rope.substring(start, Math.min(clamped, getLineEndOffset(line)));
        return new Position(line, prefix.codePointCount(0, prefix.length()));
    }

    private void checkLine(int line) {
        if (line < 0 || line >= rope.lineCount()) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + rope.lineCount());
        }
    }

    // ---- ObservableTextView ----

    @Override
    public void addDocumentListener(DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    @Override
    public String toString() {
        return "TextBuffer{length=" + rope.length() + ", lines=" + rope.lineCount() + ", modified=" + modified + '}';
    }
}
