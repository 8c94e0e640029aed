package com.tyron.editcore.api.command;

import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of dispatching a {@link Command}. Like commands, the set is closed and tagged with a {@link Kind}.
 */
public interface Response {

    Kind kind();

    enum Kind {
        SUCCESS,
        ERROR,
        TEXT_CHANGED,
        CURSOR_MOVED,
        SELECTION_CHANGED,
        SEARCH_RESULTS
    }

    Response SUCCESS = new Success();
    Response TEXT_CHANGED = new TextChanged();

    static Response error(String message) {
        return new Error(message);
    }

    static Response cursorMoved(Position position) {
        return new CursorMoved(position);
    }

    static Response selectionChanged(@Nullable Selection selection) {
        return new SelectionChanged(selection);
    }

    static Response searchResults(List<Position> positions) {
        return new SearchResults(positions);
    }

    default boolean isError() {
        return kind() == Kind.ERROR;
    }

    record Success() implements Response {
        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }
    }

    record Error(String message) implements Response {
        public Error {
            message = message != null ? message : "";
        }

        @Override
        public Kind kind() {
            return Kind.ERROR;
        }
    }

    record TextChanged() implements Response {
        @Override
        public Kind kind() {
            return Kind.TEXT_CHANGED;
        }
    }

    record CursorMoved(Position position) implements Response {
        public CursorMoved {
            Objects.requireNonNull(position, "position");
        }

        @Override
        public Kind kind() {
            return Kind.CURSOR_MOVED;
        }
    }

    /**
     * @param selection the new selection, or {@code null} when the selection was cleared
     */
    record SelectionChanged(@Nullable Selection selection) implements Response {
        @Override
        public Kind kind() {
            return Kind.SELECTION_CHANGED;
        }
    }

    record SearchResults(List<Position> positions) implements Response {
        public SearchResults {
            positions = List.copyOf(positions);
        }

        @Override
        public Kind kind() {
            return Kind.SEARCH_RESULTS;
        }
    }
}
