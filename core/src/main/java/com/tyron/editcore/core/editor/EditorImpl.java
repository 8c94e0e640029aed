package com.tyron.editcore.core.editor;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.CursorMovement;
import com.tyron.editcore.api.command.Response;
import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.editor.Editor;
import com.tyron.editcore.api.editor.EditorListener;
import com.tyron.editcore.api.keys.KeyEvent;
import com.tyron.editcore.api.text.InvalidPositionException;
import com.tyron.editcore.api.text.ObservableTextView;
import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import com.tyron.editcore.core.cursor.Cursor;
import com.tyron.editcore.core.document.TextBuffer;
import com.tyron.editcore.core.shortcuts.ShortcutTable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Editor}: one {@link TextBuffer}, one {@link Cursor}, an optional {@link Selection} and an
 * internal clipboard.
 * <p>
 * Selection rules applied on top of the buffer operations:
 * <ul>
 *     <li>Inserting text, pasting or deleting a single character with a non-empty selection replaces the
 *     selection (one undo step). Every edit clears the selection.</li>
 *     <li>Plain movement clears a non-empty selection and reports that. An empty selection left by
 *     {@link Command.StartSelection} survives plain movement until {@link Command.EndSelection}.</li>
 *     <li>Movement with selection extension keeps the end opposite to the cursor as the anchor.</li>
 *     <li>Undo and redo restore the text and cursor of the snapshot and clear the selection.</li>
 * </ul>
 */
public final class EditorImpl implements Editor {

    private static final Logger LOG = Logger.getLogger(EditorImpl.class.getName());

    private final EditorSettings settings;
    private final TextBuffer buffer;
    private final Cursor cursor;
    private final ShortcutTable shortcuts;
    private final CopyOnWriteArrayList<EditorListener> listeners = new CopyOnWriteArrayList<>();

    @Nullable
    private Selection selection;
    private String clipboard = "";
    @Nullable
    private String lastSearch;

    public EditorImpl() {
        this(EditorSettings.DEFAULT, "");
    }

    public EditorImpl(@NotNull String initialText) {
        this(EditorSettings.DEFAULT, initialText);
    }

    public EditorImpl(@NotNull EditorSettings settings, @NotNull String initialText) {
        this(settings, initialText, ShortcutTable.createDefault());
    }

    public EditorImpl(@NotNull EditorSettings settings, @NotNull String initialText, @NotNull ShortcutTable shortcuts) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.shortcuts = Objects.requireNonNull(shortcuts, "shortcuts");
        this.buffer = new TextBuffer(initialText, settings.getMaxUndoLevels());
        this.cursor = new Cursor(settings.getTabWidth(), settings.getWordBoundaries());
    }

    @NotNull
    @Override
    public Response dispatch(@NotNull Command command) {
        Objects.requireNonNull(command, "command");

        Response response;
        try {
            response = handle(command);
        } catch (RuntimeException e) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.log(Level.WARNING, "dispatch failed kind=" + command.kind() + " error=" + e.getMessage(), e);
            }
            response = Response.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("dispatch kind=" + command.kind() + " response=" + response.kind()
                    + " cursor=" + cursor.getPosition() + " selection=" + selection);
        }

        for (EditorListener listener : listeners) {
            listener.commandDispatched(command, response);
        }
        return response;
    }

    private Response handle(Command command) {
        return switch (command.kind()) {
            case INSERT_CHAR -> insertChar(((Command.InsertChar) command).codePoint());
            case INSERT_TEXT -> insertText(((Command.InsertText) command).text());
            case DELETE_CHAR -> deleteChar(true);
            case DELETE_CHAR_BACKWARD -> deleteChar(false);
            case DELETE_WORD_FORWARD -> {
                selection = null;
                yield changed(buffer.deleteWordForward(cursor, settings.getWordBoundaries()));
            }
            case DELETE_WORD_BACKWARD -> {
                selection = null;
                yield changed(buffer.deleteWordBackward(cursor, settings.getWordBoundaries()));
            }
            case DELETE_TO_LINE_END -> {
                selection = null;
                yield changed(buffer.deleteToLineEnd(cursor));
            }
            case DELETE_TO_LINE_START -> {
                selection = null;
                yield changed(buffer.deleteToLineStart(cursor));
            }
            case DELETE_LINE -> {
                selection = null;
                yield changed(buffer.deleteLine(caret().line(), cursor));
            }
            case DELETE_SELECTION -> deleteSelection();
            case MOVE_CURSOR -> moveCursor(((Command.MoveCursor) command).movement());
            case MOVE_CURSOR_WITH_SELECTION -> moveWithSelection(((Command.MoveCursorWithSelection) command).movement());
            case MOVE_CURSOR_TO -> moveCursorTo(((Command.MoveCursorTo) command).position());
            case SET_SELECTION -> {
                Command.SetSelection set = (Command.SetSelection) command;
                Position start = buffer.clamp(set.start());
                Position end = buffer.clamp(set.end());
                cursor.setPosition(end);
                yield select(Selection.fromPositions(start, end));
            }
            case START_SELECTION -> {
                selection = Selection.caret(caret());
                yield Response.SUCCESS;
            }
            case END_SELECTION -> endSelection();
            case SELECT_ALL -> select(Selection.all(buffer));
            case SELECT_LINE -> {
                Selection line = Selection.line(buffer, caret().line());
                yield line != null ? select(line) : Response.SUCCESS;
            }
            case SELECT_WORD -> {
                Selection word = Selection.wordAt(buffer, caret(), settings.getWordBoundaries());
                yield word != null ? select(word) : Response.SUCCESS;
            }
            case CLEAR_SELECTION -> {
                selection = null;
                yield Response.selectionChanged(null);
            }
            case UNDO -> historyResult(buffer.undo(cursor));
            case REDO -> historyResult(buffer.redo(cursor));
            case CUT -> cut();
            case COPY -> {
                if (hasActiveSelection()) {
                    clipboard = selection.getText(buffer);
                }
                yield Response.SUCCESS;
            }
            case PASTE -> clipboard.isEmpty() ? Response.SUCCESS : insertText(clipboard);
            case FIND -> {
                String pattern = ((Command.Find) command).pattern();
                if (!pattern.isEmpty()) {
                    lastSearch = pattern;
                }
                yield Response.searchResults(buffer.find(pattern));
            }
            case FIND_NEXT -> findAdjacent(true);
            case FIND_PREVIOUS -> findAdjacent(false);
            case REPLACE -> {
                Command.Replace replace = (Command.Replace) command;
                yield replaceNext(replace.pattern(), replace.replacement());
            }
            case REPLACE_ALL -> {
                Command.ReplaceAll replace = (Command.ReplaceAll) command;
                selection = null;
                long stamp = buffer.getModificationStamp();
                buffer.replaceAll(replace.pattern(), replace.replacement(), cursor);
                yield changed(stamp != buffer.getModificationStamp());
            }
            case SCROLL_TO_LINE -> {
                int line = ((Command.ScrollToLine) command).line();
                if (line < 0) {
                    throw new InvalidPositionException(line, 0);
                }
                Position target = new Position(Math.min(line, buffer.getLineCount() - 1), 0);
                cursor.setPosition(target);
                yield Response.cursorMoved(target);
            }
            case CUSTOM -> Response.SUCCESS;
        };
    }

    private Response insertChar(int codePoint) {
        if (hasActiveSelection()) {
            return replaceSelection(new String(Character.toChars(codePoint)));
        }
        selection = null;
        buffer.insertChar(caret(), codePoint, cursor);
        return Response.TEXT_CHANGED;
    }

    private Response insertText(String text) {
        if (hasActiveSelection()) {
            return replaceSelection(text);
        }
        selection = null;
        return changed(buffer.insertText(caret(), text, cursor));
    }

    private Response replaceSelection(String text) {
        Selection replaced = selection;
        selection = null;
        return changed(buffer.replace(replaced, text, cursor));
    }

    private Response deleteChar(boolean forward) {
        if (hasActiveSelection()) {
            return deleteSelection();
        }
        selection = null;
        boolean deleted = forward
                ? buffer.deleteChar(caret(), cursor)
                : buffer.deleteCharBackward(caret(), cursor);
        return changed(deleted);
    }

    private Response deleteSelection() {
        Selection deleted = selection;
        selection = null;
        if (deleted == null || deleted.isEmpty()) {
            return Response.SUCCESS;
        }
        return changed(!buffer.deleteSelection(deleted, cursor).isEmpty());
    }

    private Response cut() {
        if (!hasActiveSelection()) {
            return Response.SUCCESS;
        }
        clipboard = selection.getText(buffer);
        return deleteSelection();
    }

    private Response moveCursor(CursorMovement movement) {
        Position before = cursor.getPosition();
        cursor.move(buffer, movement, settings.getPageLines());
        if (hasActiveSelection()) {
            selection = null;
            return Response.selectionChanged(null);
        }
        Position after = cursor.getPosition();
        return after.equals(before) ? Response.SUCCESS : Response.cursorMoved(after);
    }

    private Response moveWithSelection(CursorMovement movement) {
        Position before = caret();
        Position anchor;
        if (selection == null) {
            anchor = before;
        } else if (before.equals(selection.start())) {
            anchor = selection.end();
        } else {
            // a caret away from both ends (select all, line or word) extends from the end
            anchor = selection.start();
            if (!before.equals(selection.end())) {
                cursor.setPosition(selection.end());
            }
        }

        cursor.move(buffer, movement, settings.getPageLines());
        Position after = cursor.getPosition();
        if (after.equals(anchor)) {
            selection = null;
            return Response.selectionChanged(null);
        }
        return select(Selection.fromPositions(anchor, after));
    }

    private Response moveCursorTo(Position target) {
        Position clamped = buffer.clamp(target);
        cursor.setPosition(clamped);
        if (hasActiveSelection()) {
            selection = null;
        }
        return Response.cursorMoved(clamped);
    }

    private Response endSelection() {
        if (selection == null) {
            return Response.SUCCESS;
        }
        return select(Selection.fromPositions(selection.start(), caret()));
    }

    private Response select(Selection newSelection) {
        selection = newSelection;
        return Response.selectionChanged(newSelection);
    }

    private Response historyResult(boolean changed) {
        if (!changed) {
            return Response.SUCCESS;
        }
        selection = null;
        return Response.TEXT_CHANGED;
    }

    /**
     * Selects the next (or previous) match of the last searched pattern relative to the cursor, wrapping around
     * the document.
     */
    private Response findAdjacent(boolean forward) {
        String pattern = lastSearch;
        if (pattern == null || pattern.isEmpty()) {
            return Response.SUCCESS;
        }
        List<Position> matches = buffer.find(pattern);
        if (matches.isEmpty()) {
            return Response.SUCCESS;
        }

        Position match;
        if (forward) {
            match = firstAtOrAfter(matches, caret());
        } else {
            Position reference = selection != null ? selection.start() : caret();
            match = matches.get(matches.size() - 1);
            for (int i = matches.size() - 1; i >= 0; i--) {
                if (matches.get(i).isBefore(reference)) {
                    match = matches.get(i);
                    break;
                }
            }
        }

        Position end = matchEnd(match, pattern);
        cursor.setPosition(end);
        return select(new Selection(match, end));
    }

    private Response replaceNext(String pattern, String replacement) {
        if (pattern.isEmpty()) {
            return Response.SUCCESS;
        }
        List<Position> matches = buffer.find(pattern);
        if (matches.isEmpty()) {
            return Response.SUCCESS;
        }
        Position start = firstAtOrAfter(matches, caret());
        selection = null;
        return changed(buffer.replace(new Selection(start, matchEnd(start, pattern)), replacement, cursor));
    }

    private static Position firstAtOrAfter(List<Position> matches, Position reference) {
        for (Position candidate : matches) {
            if (!candidate.isBefore(reference)) {
                return candidate;
            }
        }
        return matches.get(0);
    }

    // Matches never span lines, so the end is on the same line.
    private static Position matchEnd(Position start, String pattern) {
        return start.withColumn(start.column() + pattern.codePointCount(0, pattern.length()));
    }

    private boolean hasActiveSelection() {
        return selection != null && !selection.isEmpty();
    }

    private Position caret() {
        return buffer.clamp(cursor.getPosition());
    }

    private static Response changed(boolean changed) {
        return changed ? Response.TEXT_CHANGED : Response.SUCCESS;
    }

    @Nullable
    @Override
    public Response handleKeyEvent(@NotNull KeyEvent event) {
        Command command = shortcuts.resolve(event);
        if (command == null) {
            return null;
        }
        return dispatch(command);
    }

    @NotNull
    @Override
    public ObservableTextView getDocument() {
        return buffer;
    }

    /**
     * Mutable access for hosts that need buffer level operations such as {@link TextBuffer#markSaved()}.
     */
    @NotNull
    public TextBuffer getTextBuffer() {
        return buffer;
    }

    @NotNull
    public Cursor getCursor() {
        return cursor;
    }

    @NotNull
    public ShortcutTable getShortcutTable() {
        return shortcuts;
    }

    @NotNull
    @Override
    public String getText() {
        return buffer.getText();
    }

    @Override
    public void setText(@NotNull String text) {
        buffer.reset(text);
        cursor.setPosition(Position.ZERO);
        selection = null;
    }

    @Override
    public void clear() {
        setText("");
    }

    @NotNull
    @Override
    public Position getCaretPosition() {
        return cursor.getPosition();
    }

    @Nullable
    @Override
    public Selection getSelection() {
        return selection;
    }

    @NotNull
    @Override
    public String getClipboard() {
        return clipboard;
    }

    @Override
    public boolean isModified() {
        return buffer.isModified();
    }

    @Override
    public boolean canUndo() {
        return buffer.canUndo();
    }

    @Override
    public boolean canRedo() {
        return buffer.canRedo();
    }

    @NotNull
    @Override
    public EditorSettings getSettings() {
        return settings;
    }

    @Override
    public void addEditorListener(@NotNull EditorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeEditorListener(@NotNull EditorListener listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return "EditorImpl{" + buffer + ", cursor=" + cursor.getPosition() + ", selection=" + selection + '}';
    }
}
