package com.tyron.editcore.core.viewport;

/**
 * A fractional scroll position in pixels.
 */
public record ScrollOffset(double x, double y) {

    public static final ScrollOffset ZERO = new ScrollOffset(0, 0);

    public ScrollOffset {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Scroll offset must be finite: (" + x + ", " + y + ")");
        }
    }
}
