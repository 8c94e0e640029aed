package com.tyron.editcore.api.text;

/**
 * Conversions between character columns and visual columns (tabs expanded to the next tab stop).
 *
 * Both functions stop at a {@code '\n'}, so callers may pass a line with or without its terminator.
 */
public final class VisualColumns {

    public static final int DEFAULT_TAB_WIDTH = 4;

    private VisualColumns() {
    }

    public static int nextTabStop(int visualColumn, int tabWidth) {
        return ((visualColumn / tabWidth) + 1) * tabWidth;
    }

    /**
     * @return The visual column of the character column {@code charColumn} in {@code line}.
     */
    public static int toVisual(CharSequence line, int charColumn, int tabWidth) {
        checkTabWidth(tabWidth);
        int visual = 0;
        int column = 0;
        int i = 0;
        int len = line.length();
        while (i < len && column < charColumn) {
            int cp = Character.codePointAt(line, i);
            if (cp == '\n') break;
            if (cp == '\t') {
                visual = nextTabStop(visual, tabWidth);
            } else {
                visual++;
            }
            column++;
            i += Character.charCount(cp);
        }
        return visual;
    }

    /**
     * @return The character column on {@code line} that best matches {@code visualColumn}. A visual column that
     * falls inside a tab's expansion maps to the column just after the tab. The result never exceeds the line's
     * content length.
     */
    public static int toCharColumn(CharSequence line, int visualColumn, int tabWidth) {
        checkTabWidth(tabWidth);
        int visual = 0;
        int column = 0;
        int i = 0;
        int len = line.length();
        while (i < len) {
            int cp = Character.codePointAt(line, i);
            if (cp == '\n') break;
            if (visualColumn <= visual) break;
            if (cp == '\t') {
                int stop = nextTabStop(visual, tabWidth);
                if (visualColumn < stop) {
                    column++;
                    break;
                }
                visual = stop;
            } else {
                visual++;
            }
            column++;
            i += Character.charCount(cp);
        }
        return column;
    }

    /**
     * @return Width of the whole line in visual columns.
     */
    public static int width(CharSequence line, int tabWidth) {
        return toVisual(line, Integer.MAX_VALUE, tabWidth);
    }

    private static void checkTabWidth(int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
    }
}
