package com.tyron.editcore.api.config;

import com.tyron.editcore.api.text.VisualColumns;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Immutable editor configuration.
 */
public final class EditorSettings {

    public static final int DEFAULT_MAX_UNDO_LEVELS = 100;
    public static final int DEFAULT_PAGE_LINES = 20;

    public static final EditorSettings DEFAULT = builder().build();

    private final int maxUndoLevels;
    private final int tabWidth;
    private final int pageLines;
    private final WordBoundaryClassifier wordBoundaries;

    private EditorSettings(Builder builder) {
        this.maxUndoLevels = builder.maxUndoLevels;
        this.tabWidth = builder.tabWidth;
        this.pageLines = builder.pageLines;
        this.wordBoundaries = builder.wordBoundaries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maximum number of undo snapshots kept; the oldest are dropped first.
     */
    public int getMaxUndoLevels() {
        return maxUndoLevels;
    }

    /**
     * Tab stop interval, in visual columns.
     */
    public int getTabWidth() {
        return tabWidth;
    }

    /**
     * Number of line steps taken by page up / page down.
     */
    public int getPageLines() {
        return pageLines;
    }

    public WordBoundaryClassifier getWordBoundaries() {
        return wordBoundaries;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxUndoLevels(maxUndoLevels)
                .tabWidth(tabWidth)
                .pageLines(pageLines)
                .wordBoundaries(wordBoundaries);
    }

    @Override
    public String toString() {
        return "EditorSettings{maxUndoLevels=" + maxUndoLevels
                + ", tabWidth=" + tabWidth
                + ", pageLines=" + pageLines + '}';
    }

    public static final class Builder {
        private int maxUndoLevels = DEFAULT_MAX_UNDO_LEVELS;
        private int tabWidth = VisualColumns.DEFAULT_TAB_WIDTH;
        private int pageLines = DEFAULT_PAGE_LINES;
        private WordBoundaryClassifier wordBoundaries = WordBoundaryClassifier.DEFAULT;

        private Builder() {
        }

        public Builder maxUndoLevels(int maxUndoLevels) {
            if (maxUndoLevels < 0) {
                throw new IllegalArgumentException("maxUndoLevels < 0: " + maxUndoLevels);
            }
            this.maxUndoLevels = maxUndoLevels;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            if (tabWidth <= 0) {
                throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
            }
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder pageLines(int pageLines) {
            if (pageLines <= 0) {
                throw new IllegalArgumentException("pageLines must be positive: " + pageLines);
            }
            this.pageLines = pageLines;
            return this;
        }

        public Builder wordBoundaries(@NotNull WordBoundaryClassifier wordBoundaries) {
            this.wordBoundaries = Objects.requireNonNull(wordBoundaries, "wordBoundaries");
            return this;
        }

        public EditorSettings build() {
            return new EditorSettings(this);
        }
    }
}
