package com.tyron.editcore.api.command;

import com.tyron.editcore.api.text.Position;

import java.util.List;
import java.util.Objects;

/**
 * A request sent into an editor via {@code Editor.dispatch(Command)}.
 * <p>
 * The set of commands is closed: every implementation is one of the records nested here and reports its
 * {@link Kind}, so a {@code switch} over {@link #kind()} is checked for exhaustiveness by the compiler.
 * </p>
 */
public interface Command {

    Kind kind();

    enum Kind {
        INSERT_CHAR,
        INSERT_TEXT,
        DELETE_CHAR,
        DELETE_CHAR_BACKWARD,
        DELETE_WORD_FORWARD,
        DELETE_WORD_BACKWARD,
        DELETE_TO_LINE_END,
        DELETE_TO_LINE_START,
        DELETE_LINE,
        DELETE_SELECTION,
        MOVE_CURSOR,
        MOVE_CURSOR_WITH_SELECTION,
        MOVE_CURSOR_TO,
        SET_SELECTION,
        START_SELECTION,
        END_SELECTION,
        SELECT_ALL,
        SELECT_LINE,
        SELECT_WORD,
        CLEAR_SELECTION,
        UNDO,
        REDO,
        CUT,
        COPY,
        PASTE,
        FIND,
        FIND_NEXT,
        FIND_PREVIOUS,
        REPLACE,
        REPLACE_ALL,
        SCROLL_TO_LINE,
        CUSTOM
    }

    // Shared instances of the parameterless commands.
    Command DELETE_CHAR = new DeleteChar();
    Command DELETE_CHAR_BACKWARD = new DeleteCharBackward();
    Command DELETE_WORD_FORWARD = new DeleteWordForward();
    Command DELETE_WORD_BACKWARD = new DeleteWordBackward();
    Command DELETE_TO_LINE_END = new DeleteToLineEnd();
    Command DELETE_TO_LINE_START = new DeleteToLineStart();
    Command DELETE_LINE = new DeleteLine();
    Command DELETE_SELECTION = new DeleteSelection();
    Command START_SELECTION = new StartSelection();
    Command END_SELECTION = new EndSelection();
    Command SELECT_ALL = new SelectAll();
    Command SELECT_LINE = new SelectLine();
    Command SELECT_WORD = new SelectWord();
    Command CLEAR_SELECTION = new ClearSelection();
    Command UNDO = new Undo();
    Command REDO = new Redo();
    Command CUT = new Cut();
    Command COPY = new Copy();
    Command PASTE = new Paste();
    Command FIND_NEXT = new FindNext();
    Command FIND_PREVIOUS = new FindPrevious();

    static Command insertChar(int codePoint) {
        return new InsertChar(codePoint);
    }

    static Command insertText(String text) {
        return new InsertText(text);
    }

    static Command move(CursorMovement movement) {
        return new MoveCursor(movement);
    }

    static Command select(CursorMovement movement) {
        return new MoveCursorWithSelection(movement);
    }

    static Command moveTo(Position position) {
        return new MoveCursorTo(position);
    }

    static Command moveTo(int line, int column) {
        return new MoveCursorTo(new Position(line, column));
    }

    static Command find(String pattern) {
        return new Find(pattern);
    }

    /**
     * Inserts one code point (may be a supplementary character).
     */
    record InsertChar(int codePoint) implements Command {
        public InsertChar {
            if (!Character.isValidCodePoint(codePoint)) {
                throw new IllegalArgumentException("Not a valid code point: " + codePoint);
            }
        }

        @Override
        public Kind kind() {
            return Kind.INSERT_CHAR;
        }

        @Override
        public String toString() {
            return "InsertChar[" + new String(Character.toChars(codePoint)) + "]";
        }
    }

    record InsertText(String text) implements Command {
        public InsertText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.INSERT_TEXT;
        }
    }

    record DeleteChar() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_CHAR;
        }
    }

    record DeleteCharBackward() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_CHAR_BACKWARD;
        }
    }

    record DeleteWordForward() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_WORD_FORWARD;
        }
    }

    record DeleteWordBackward() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_WORD_BACKWARD;
        }
    }

    record DeleteToLineEnd() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_TO_LINE_END;
        }
    }

    record DeleteToLineStart() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_TO_LINE_START;
        }
    }

    record DeleteLine() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_LINE;
        }
    }

    record DeleteSelection() implements Command {
        @Override
        public Kind kind() {
            return Kind.DELETE_SELECTION;
        }
    }

    record MoveCursor(CursorMovement movement) implements Command {
        public MoveCursor {
            Objects.requireNonNull(movement, "movement");
        }

        @Override
        public Kind kind() {
            return Kind.MOVE_CURSOR;
        }
    }

    /**
     * Moves the cursor and grows the selection towards the new position, anchored where the selection began.
     */
    record MoveCursorWithSelection(CursorMovement movement) implements Command {
        public MoveCursorWithSelection {
            Objects.requireNonNull(movement, "movement");
        }

        @Override
        public Kind kind() {
            return Kind.MOVE_CURSOR_WITH_SELECTION;
        }
    }

    record MoveCursorTo(Position position) implements Command {
        public MoveCursorTo {
            Objects.requireNonNull(position, "position");
        }

        @Override
        public Kind kind() {
            return Kind.MOVE_CURSOR_TO;
        }
    }

    /**
     * Selects {@code [start, end]} and places the cursor at {@code end} (the moving end).
     */
    record SetSelection(Position start, Position end) implements Command {
        public SetSelection {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        @Override
        public Kind kind() {
            return Kind.SET_SELECTION;
        }
    }

    record StartSelection() implements Command {
        @Override
        public Kind kind() {
            return Kind.START_SELECTION;
        }
    }

    record EndSelection() implements Command {
        @Override
        public Kind kind() {
            return Kind.END_SELECTION;
        }
    }

    record SelectAll() implements Command {
        @Override
        public Kind kind() {
            return Kind.SELECT_ALL;
        }
    }

    record SelectLine() implements Command {
        @Override
        public Kind kind() {
            return Kind.SELECT_LINE;
        }
    }

    record SelectWord() implements Command {
        @Override
        public Kind kind() {
            return Kind.SELECT_WORD;
        }
    }

    record ClearSelection() implements Command {
        @Override
        public Kind kind() {
            return Kind.CLEAR_SELECTION;
        }
    }

    record Undo() implements Command {
        @Override
        public Kind kind() {
            return Kind.UNDO;
        }
    }

    record Redo() implements Command {
        @Override
        public Kind kind() {
            return Kind.REDO;
        }
    }

    record Cut() implements Command {
        @Override
        public Kind kind() {
            return Kind.CUT;
        }
    }

    record Copy() implements Command {
        @Override
        public Kind kind() {
            return Kind.COPY;
        }
    }

    record Paste() implements Command {
        @Override
        public Kind kind() {
            return Kind.PASTE;
        }
    }

    record Find(String pattern) implements Command {
        public Find {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public Kind kind() {
            return Kind.FIND;
        }
    }

    record FindNext() implements Command {
        @Override
        public Kind kind() {
            return Kind.FIND_NEXT;
        }
    }

    record FindPrevious() implements Command {
        @Override
        public Kind kind() {
            return Kind.FIND_PREVIOUS;
        }
    }

    /**
     * Replaces the first occurrence of {@code pattern} at or after the cursor, wrapping around.
     */
    record Replace(String pattern, String replacement) implements Command {
        public Replace {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
        }

        @Override
        public Kind kind() {
            return Kind.REPLACE;
        }
    }

    record ReplaceAll(String pattern, String replacement) implements Command {
        public ReplaceAll {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
        }

        @Override
        public Kind kind() {
            return Kind.REPLACE_ALL;
        }
    }

    record ScrollToLine(int line) implements Command {
        @Override
        public Kind kind() {
            return Kind.SCROLL_TO_LINE;
        }
    }

    /**
     * Host-defined command. The core does not interpret it and always answers {@code Success}.
     */
    record Custom(String name, List<String> args) implements Command {
        public Custom {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        @Override
        public Kind kind() {
            return Kind.CUSTOM;
        }
    }
}
