package com.tyron.editcore.core.viewport;

/**
 * How much of one line is visible in a scrolled viewport.
 *
 * @param lineIndex       the document line
 * @param yOffset         top of the line relative to the viewport top; negative when the line starts above it
 * @param clipTop         height cut off above the viewport
 * @param clipBottom      height cut off below the viewport
 * @param visibleFraction visible height divided by the line height, in {@code (0, 1]}
 */
public record PartialLineView(int lineIndex, double yOffset, double clipTop, double clipBottom, double visibleFraction) {

    public boolean isFullyVisible() {
        return clipTop == 0 && clipBottom == 0;
    }
}
