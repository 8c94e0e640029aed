package com.tyron.editcore.api.text;

/**
 * Extension of {@link TextView} for documents that publish change events.
 */
public interface ObservableTextView extends TextView {

    void addDocumentListener(DocumentListener listener);

    void removeDocumentListener(DocumentListener listener);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}
