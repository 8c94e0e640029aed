package com.tyron.editcore.api.text;

/**
 * Represents a single text change in an {@link ObservableTextView}.
 *
 * The replaced range is {@code [startOffset, endOffset)} in the document as it was <i>before</i> the change.
 * Restoring a history snapshot is reported as a replacement of the whole previous text.
 */
public final class DocumentEvent {

    private final TextView document;
    private final int startOffset;
    private final int endOffset;
    private final String newText;

    public DocumentEvent(TextView document, int startOffset, int endOffset, String newText) {
        this.document = document;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.newText = newText;
    }

    public TextView getDocument() {
        return document;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public String getNewText() {
        return newText;
    }

    public int getOldLength() {
        return Math.max(0, endOffset - startOffset);
    }

    public boolean isInsertion() {
        return startOffset == endOffset && !newText.isEmpty();
    }

    public boolean isDeletion() {
        return newText.isEmpty() && endOffset > startOffset;
    }

    @Override
    public String toString() {
        return "DocumentEvent[" + startOffset + ", " + endOffset + ") -> " + newText.length() + " chars";
    }
}
