package com.tyron.editcore.core.viewport;

import com.tyron.editcore.api.text.TextView;
import com.tyron.editcore.api.text.VisualColumns;
import org.jetbrains.annotations.NotNull;

/**
 * Monospace text measurement shared by the viewport and renderers. Tabs advance to the next multiple of
 * {@code tabWidth} character cells.
 */
public final class TextLayout {

    /**
     * How many lines {@link #maxContentWidth(TextView, double, int)} inspects.
     */
    public static final int DEFAULT_MAX_LINES_TO_CHECK = 1000;

    private TextLayout() {
    }

    public record CharMetrics(double charWidth, double lineHeight) {
    }

    /**
     * Character cell size for a monospace font: width {@code 0.6 * fontSize} (at least 1),
     * height {@code 1.3 * fontSize}.
     */
    public static CharMetrics charMetrics(double fontSize) {
        if (!(fontSize > 0) || Double.isInfinite(fontSize)) {
            throw new IllegalArgumentException("fontSize must be positive: " + fontSize);
        }
        double charWidth = Math.max(fontSize * 0.6, 1.0);
        double lineHeight = Math.max(fontSize * 1.3, fontSize);
        return new CharMetrics(charWidth, lineHeight);
    }

    public static double lineWidth(@NotNull CharSequence line, double charWidth, int tabWidth) {
        return VisualColumns.width(line, tabWidth) * charWidth;
    }

    /**
     * @return X of the left edge of character {@code column} in {@code line}.
     */
    public static double columnX(@NotNull CharSequence line, int column, double charWidth, int tabWidth) {
        return VisualColumns.toVisual(line, column, tabWidth) * charWidth;
    }

    public static double maxContentWidth(@NotNull TextView document, double charWidth, int tabWidth) {
        return maxContentWidth(document, charWidth, tabWidth, DEFAULT_MAX_LINES_TO_CHECK);
    }

    /**
     * @return Width of the widest of the first {@code maxLinesToCheck} lines plus two characters of padding.
     */
    public static double maxContentWidth(@NotNull TextView document, double charWidth, int tabWidth, int maxLinesToCheck) {
        int lines = Math.min(document.getLineCount(), maxLinesToCheck);
        double max = 0;
        for (int line = 0; line < lines; line++) {
            max = Math.max(max, lineWidth(document.getLineText(line), charWidth, tabWidth));
        }
        return max + charWidth * 2;
    }
}
