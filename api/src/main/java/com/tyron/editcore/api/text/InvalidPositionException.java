package com.tyron.editcore.api.text;

import com.tyron.editcore.api.editor.EditorException;

/**
 * Thrown when a {@link Position} cannot be clamped into a document (negative line or column).
 */
public class InvalidPositionException extends EditorException {

    private final int line;
    private final int column;

    public InvalidPositionException(int line, int column) {
        super("Invalid position: line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public InvalidPositionException(Position position) {
        this(position.line(), position.column());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
