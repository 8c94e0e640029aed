package com.tyron.editcore.api.editor;

/**
 * Base class for failures raised by the editing core.
 */
public class EditorException extends RuntimeException {

    public EditorException(String message) {
        super(message);
    }

    public EditorException(String message, Throwable cause) {
        super(message, cause);
    }
}
