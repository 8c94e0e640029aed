package com.tyron.editcore.testFramework;

import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Text with inline {@code <caret>}, {@code <selection>} and {@code </selection>} markers, as used by editor
 * fixtures:
 * <pre>
 * "foo <selection>bar<caret></selection> baz"
 * </pre>
 * Markers are removed from the text; their positions are reported as line/column (code point) coordinates.
 */
public final class EditorMarkup {

    public static final String CARET = "<caret>";
    public static final String SELECTION_START = "<selection>";
    public static final String SELECTION_END = "</selection>";

    private final String text;
    @Nullable
    private final Position caret;
    @Nullable
    private final Selection selection;

    private EditorMarkup(String text, @Nullable Position caret, @Nullable Selection selection) {
        this.text = text;
        this.caret = caret;
        this.selection = selection;
    }

    /**
     * @throws IllegalArgumentException if a marker appears twice or the selection markers are unbalanced
     */
    public static EditorMarkup parse(@NotNull String markup) {
        StringBuilder clean = new StringBuilder(markup.length());
        int caretOffset = -1;
        int selectionStart = -1;
        int selectionEnd = -1;

        int i = 0;
        while (i < markup.length()) {
            if (markup.startsWith(CARET, i)) {
                if (caretOffset >= 0) throw new IllegalArgumentException("More than one " + CARET + " in: " + markup);
                caretOffset = clean.length();
                i += CARET.length();
            } else if (markup.startsWith(SELECTION_START, i)) {
                if (selectionStart >= 0) throw new IllegalArgumentException("More than one " + SELECTION_START + " in: " + markup);
                selectionStart = clean.length();
                i += SELECTION_START.length();
            } else if (markup.startsWith(SELECTION_END, i)) {
                if (selectionEnd >= 0) throw new IllegalArgumentException("More than one " + SELECTION_END + " in: " + markup);
                selectionEnd = clean.length();
                i += SELECTION_END.length();
            } else {
                clean.append(markup.charAt(i++));
            }
        }

        if ((selectionStart < 0) != (selectionEnd < 0)) {
            throw new IllegalArgumentException("Unbalanced selection markers in: " + markup);
        }

        String text = clean.toString();
        Position caret = caretOffset >= 0 ? positionAt(text, caretOffset) : null;
        Selection selection = selectionStart >= 0
                ? Selection.fromPositions(positionAt(text, selectionStart), positionAt(text, selectionEnd))
                : null;
        return new EditorMarkup(text, caret, selection);
    }

    public static Position positionAt(@NotNull String text, int offset) {
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new Position(line, text.codePointCount(lineStart, offset));
    }

    public static int offsetOf(@NotNull String text, @NotNull Position position) {
        int offset = 0;
        for (int line = 0; line < position.line(); line++) {
            int nl = text.indexOf('\n', offset);
            if (nl < 0) return text.length();
            offset = nl + 1;
        }
        int lineEnd = text.indexOf('\n', offset);
        if (lineEnd < 0) lineEnd = text.length();
        int columns = Math.min(position.column(), text.codePointCount(offset, lineEnd));
        return text.offsetByCodePoints(offset, columns);
    }

    /**
     * Inverse of {@link #parse(String)}, used to produce readable assertion messages.
     */
    public static String render(@NotNull String text, @Nullable Position caret, @Nullable Selection selection) {
        int caretOffset = caret != null ? offsetOf(text, caret) : -1;
        int startOffset = selection != null ? offsetOf(text, selection.start()) : -1;
        int endOffset = selection != null ? offsetOf(text, selection.end()) : -1;

        StringBuilder out = new StringBuilder(text.length() + 32);
        for (int i = 0; i <= text.length(); i++) {
            if (i == startOffset) out.append(SELECTION_START);
            if (i == caretOffset) out.append(CARET);
            if (i == endOffset) out.append(SELECTION_END);
            if (i < text.length()) out.append(text.charAt(i));
        }
        return out.toString();
    }

    public String getText() {
        return text;
    }

    @Nullable
    public Position getCaret() {
        return caret;
    }

    @Nullable
    public Selection getSelection() {
        return selection;
    }
}
