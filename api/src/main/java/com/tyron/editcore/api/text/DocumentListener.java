package com.tyron.editcore.api.text;

/**
 * Listener for {@link ObservableTextView} changes.
 */
public interface DocumentListener {

    /**
     * Fired after the document has been modified.
     */
    void documentChanged(DocumentEvent event);
}
