package com.tyron.editcore.api.command;

/**
 * Directions a cursor can be moved in with a single command.
 */
public enum CursorMovement {
    UP,
    DOWN,
    LEFT,
    RIGHT,
    WORD_LEFT,
    WORD_RIGHT,
    LINE_START,
    LINE_END,
    DOCUMENT_START,
    DOCUMENT_END,
    PAGE_UP,
    PAGE_DOWN;

    public boolean isVertical() {
        return this == UP || this == DOWN || this == PAGE_UP || this == PAGE_DOWN;
    }
}
