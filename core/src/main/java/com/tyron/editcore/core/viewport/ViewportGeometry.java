package com.tyron.editcore.core.viewport;

import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.TextView;
import com.tyron.editcore.api.text.VisualColumns;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Works out which lines of a document intersect a scrolled viewport, and how much of each.
 * <p>
 * Scroll offsets are fractional, so the first and last visible lines may be cut; each one is described by a
 * {@link PartialLineView}. The result is cached and recomputed after the scroll offset, the size, the
 * character metrics or the document's line count change.
 * </p>
 */
public final class ViewportGeometry {

    private static final Logger LOG = Logger.getLogger(ViewportGeometry.class.getName());

    public static final double DEFAULT_WIDTH = 800;
    public static final double DEFAULT_HEIGHT = 600;
    public static final double DEFAULT_CHAR_WIDTH = 8;
    public static final double DEFAULT_LINE_HEIGHT = 18;

    public record LineRange(int start, int end) {
        public boolean contains(int line) {
            return line >= start && line < end;
        }

        public boolean isEmpty() {
            return start >= end;
        }
    }

    private final TextView document;

    private double scrollX;
    private double scrollY;
    private double width = DEFAULT_WIDTH;
    private double height = DEFAULT_HEIGHT;
    private double charWidth = DEFAULT_CHAR_WIDTH;
    private double lineHeight = DEFAULT_LINE_HEIGHT;
    private int tabWidth = VisualColumns.DEFAULT_TAB_WIDTH;

    private boolean dirty = true;
    private int computedLineCount = -1;
    private LineRange visibleRange = new LineRange(0, 0);
    private List<PartialLineView> visibleLines = List.of();

    public ViewportGeometry(@NotNull TextView document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public void setSize(double width, double height) {
        if (!(width >= 0) || !(height >= 0) || Double.isInfinite(width) || Double.isInfinite(height)) {
            throw new IllegalArgumentException("Invalid viewport size: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        dirty = true;
    }

    public void setScrollOffset(double x, double y) {
        setScrollOffset(new ScrollOffset(x, y));
    }

    public void setScrollOffset(@NotNull ScrollOffset offset) {
        this.scrollX = offset.x();
        this.scrollY = offset.y();
        dirty = true;
    }

    public void setCharDimensions(double charWidth, double lineHeight) {
        if (!(charWidth > 0) || Double.isInfinite(charWidth)) {
            throw new IllegalArgumentException("charWidth must be positive: " + charWidth);
        }
        if (!(lineHeight > 0) || Double.isInfinite(lineHeight)) {
            throw new IllegalArgumentException("lineHeight must be positive: " + lineHeight);
        }
        this.charWidth = charWidth;
        this.lineHeight = lineHeight;
        dirty = true;
    }

    public void setTabWidth(int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public ScrollOffset getScrollOffset() {
        return new ScrollOffset(scrollX, scrollY);
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getCharWidth() {
        return charWidth;
    }

    public double getLineHeight() {
        return lineHeight;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    /**
     * @return Lines intersecting the viewport, top to bottom.
     */
    public List<PartialLineView> getVisibleLines() {
        ensureComputed();
        return visibleLines;
    }

    /**
     * @return Candidate line range {@code [floor(top / lineHeight), ceil(bottom / lineHeight))}, clamped to the
     * document.
     */
    public LineRange getVisibleRange() {
        ensureComputed();
        return visibleRange;
    }

    public boolean isLineVisible(int line) {
        for (PartialLineView view : getVisibleLines()) {
            if (view.lineIndex() == line) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if the character cell at {@code position} lies entirely inside the viewport.
     */
    public boolean isPositionVisible(@NotNull Position position) {
        if (position.line() < 0 || position.line() >= document.getLineCount() || !isLineVisible(position.line())) {
            return false;
        }
        double top = position.line() * lineHeight;
        double x = TextLayout.columnX(document.getLineText(position.line()), position.column(), charWidth, tabWidth);
        return top >= scrollY
                && top + lineHeight <= scrollY + height
                && x >= scrollX
                && x + charWidth <= scrollX + width;
    }

    /**
     * Bounds a proposed offset to {@code [0, contentExtent - viewportExtent]} on both axes (0 when the content is
     * smaller than the viewport). The content is {@code lineCount * lineHeight} tall and as wide as the widest
     * line plus two characters.
     */
    public ScrollOffset clampScrollOffset(@NotNull ScrollOffset proposed) {
        double contentHeight = document.getLineCount() * lineHeight;
        double contentWidth = TextLayout.maxContentWidth(document, charWidth, tabWidth);
        return new ScrollOffset(
                clamp(proposed.x(), contentWidth - width),
                clamp(proposed.y(), contentHeight - height));
    }

    private static double clamp(double value, double max) {
        if (max <= 0) {
            return 0;
        }
        return Math.max(0, Math.min(value, max));
    }

    /**
     * @return The smallest change of the vertical offset that shows {@code line} completely, clamped.
     */
    public double scrollYToReveal(int line) {
        int target = Math.max(0, Math.min(line, document.getLineCount() - 1));
        double top = target * lineHeight;
        double bottom = top + lineHeight;
        double y = scrollY;
        if (top < y) {
            y = top;
        } else if (bottom > y + height) {
            y = bottom - height;
        }
        return clampScrollOffset(new ScrollOffset(scrollX, y)).y();
    }

    private void ensureComputed() {
        int lineCount = document.getLineCount();
        if (!dirty && lineCount == computedLineCount) {
            return;
        }
        visibleRange = computeRange(scrollY, height, lineHeight, lineCount);
        visibleLines = computeVisibleLines(scrollY, height, lineHeight, lineCount);
        computedLineCount = lineCount;
        dirty = false;
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("viewport recomputed scrollY=" + scrollY + " range=" + visibleRange + " lines=" + visibleLines.size());
        }
    }

    static LineRange computeRange(double scrollY, double viewportHeight, double lineHeight, int lineCount) {
        int start = (int) Math.floor(scrollY / lineHeight);
        int end = (int) Math.ceil((scrollY + viewportHeight) / lineHeight);
        start = Math.max(0, Math.min(start, lineCount));
        end = Math.max(start, Math.min(end, lineCount));
        return new LineRange(start, end);
    }

    /**
     * Pure form of {@link #getVisibleLines()}.
     */
    public static List<PartialLineView> computeVisibleLines(double scrollY, double viewportHeight,
                                                            double lineHeight, int lineCount) {
        if (!(lineHeight > 0)) {
            throw new IllegalArgumentException("lineHeight must be positive: " + lineHeight);
        }
        LineRange range = computeRange(scrollY, viewportHeight, lineHeight, lineCount);
        double viewTop = scrollY;
        double viewBottom = scrollY + viewportHeight;

        List<PartialLineView> result = new ArrayList<>(Math.max(0, range.end() - range.start()));
        for (int line = range.start(); line < range.end(); line++) {
            double top = line * lineHeight;
            double bottom = top + lineHeight;
            if (bottom <= viewTop || top >= viewBottom) {
                continue;
            }
            double clipTop = top < viewTop ? viewTop - top : 0;
            double clipBottom = bottom > viewBottom ? bottom - viewBottom : 0;
            double visible = lineHeight - clipTop - clipBottom;
            if (visible > 0) {
                result.add(new PartialLineView(line, top - viewTop, clipTop, clipBottom, visible / lineHeight));
            }
        }
        return Collections.unmodifiableList(result);
    }
}
