package com.tyron.editcore.core.viewport;

import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.core.cursor.Cursor;
import com.tyron.editcore.core.document.TextBuffer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViewportGeometryTest {

    private static TextBuffer lines(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append('\n');
            sb.append("line ").append(i);
        }
        return new TextBuffer(sb.toString());
    }

    private static ViewportGeometry geometry(TextBuffer document) {
        ViewportGeometry geometry = new ViewportGeometry(document);
        geometry.setSize(100, 100);
        geometry.setCharDimensions(10, 20);
        return geometry;
    }

    @Test
    void defaults() {
        ViewportGeometry geometry = new ViewportGeometry(new TextBuffer());
        assertEquals(800, geometry.getWidth());
        assertEquals(600, geometry.getHeight());
        assertEquals(8, geometry.getCharWidth());
        assertEquals(18, geometry.getLineHeight());
        assertEquals(ScrollOffset.ZERO, geometry.getScrollOffset());
    }

    @Test
    void alignedScroll_showsWholeLinesOnly() {
        ViewportGeometry geometry = geometry(lines(100));

        List<PartialLineView> visible = geometry.getVisibleLines();

        assertEquals(5, visible.size());
        assertTrue(visible.stream().allMatch(PartialLineView::isFullyVisible));
        assertEquals(new ViewportGeometry.LineRange(0, 5), geometry.getVisibleRange());
        assertEquals(80, visible.get(4).yOffset());
    }

    @Test
    void fractionalScroll_clipsFirstAndLastLine() {
        ViewportGeometry geometry = geometry(lines(100));
        geometry.setScrollOffset(0, 30);

        List<PartialLineView> visible = geometry.getVisibleLines();

        assertEquals(new ViewportGeometry.LineRange(1, 7), geometry.getVisibleRange());
        assertEquals(6, visible.size());

        PartialLineView first = visible.get(0);
        assertEquals(new PartialLineView(1, -10, 10, 0, 0.5), first);
        assertFalse(first.isFullyVisible());

        PartialLineView last = visible.get(5);
        assertEquals(new PartialLineView(6, 90, 0, 10, 0.5), last);

        for (PartialLineView middle : visible.subList(1, 5)) {
            assertEquals(1.0, middle.visibleFraction());
        }
    }

    @Test
    void shortDocument_rangeIsClampedToLineCount() {
        ViewportGeometry geometry = geometry(lines(3));

        assertEquals(new ViewportGeometry.LineRange(0, 3), geometry.getVisibleRange());
        assertEquals(3, geometry.getVisibleLines().size());
        assertFalse(geometry.isLineVisible(3));
    }

    @Test
    void scrolledPastDocument_showsNothing() {
        ViewportGeometry geometry = geometry(lines(3));
        geometry.setScrollOffset(0, 1000);

        assertTrue(geometry.getVisibleRange().isEmpty());
        assertTrue(geometry.getVisibleLines().isEmpty());
    }

    @Test
    void cache_followsLineCountChanges() {
        TextBuffer document = lines(2);
        ViewportGeometry geometry = geometry(document);
        assertEquals(2, geometry.getVisibleLines().size());

        document.insertText(document.getEndPosition(), "\nmore\nand more", new Cursor());

        assertEquals(4, geometry.getVisibleLines().size());
        assertTrue(geometry.isLineVisible(3));
    }

    @Test
    void cache_followsSetters() {
        ViewportGeometry geometry = geometry(lines(100));
        assertEquals(5, geometry.getVisibleLines().size());

        geometry.setSize(100, 200);
        assertEquals(10, geometry.getVisibleLines().size());

        geometry.setCharDimensions(10, 40);
        assertEquals(5, geometry.getVisibleLines().size());
    }

    @Test
    void isPositionVisible_requiresWholeCell() {
        TextBuffer document = new TextBuffer("0123456789abc\n\tx\n" + "z\n".repeat(20));
        ViewportGeometry geometry = geometry(document);

        assertTrue(geometry.isPositionVisible(new Position(0, 0)));
        assertTrue(geometry.isPositionVisible(new Position(0, 9)));
        assertFalse(geometry.isPositionVisible(new Position(0, 10)));
        assertTrue(geometry.isPositionVisible(new Position(1, 1)));
        assertFalse(geometry.isPositionVisible(new Position(10, 0)));
        assertFalse(geometry.isPositionVisible(new Position(-1, 0)));

        geometry.setScrollOffset(40, 10);
        assertTrue(geometry.isPositionVisible(new Position(1, 1)));
        assertFalse(geometry.isPositionVisible(new Position(1, 0)));
        // line 0 is only partially visible
        assertTrue(geometry.isLineVisible(0));
        assertFalse(geometry.isPositionVisible(new Position(0, 5)));
    }

    @Test
    void tabWidth_changesHorizontalVisibility() {
        TextBuffer document = new TextBuffer("\t\tx");
        ViewportGeometry geometry = geometry(document);

        assertTrue(geometry.isPositionVisible(new Position(0, 2)));
        geometry.setTabWidth(8);
        assertFalse(geometry.isPositionVisible(new Position(0, 2)));
        assertThrows(IllegalArgumentException.class, () -> geometry.setTabWidth(0));
    }

    @Test
    void clampScrollOffset_boundsToContent() {
        ViewportGeometry geometry = geometry(lines(100));

        assertEquals(new ScrollOffset(0, 1900), geometry.clampScrollOffset(new ScrollOffset(500, 5000)));
        assertEquals(ScrollOffset.ZERO, geometry.clampScrollOffset(new ScrollOffset(-5, -5)));
    }

    @Test
    void clampScrollOffset_wideContent() {
        TextBuffer document = new TextBuffer("x".repeat(30));
        ViewportGeometry geometry = geometry(document);

        // 30 chars plus two of padding, minus the viewport width
        assertEquals(new ScrollOffset(220, 0), geometry.clampScrollOffset(new ScrollOffset(1000, 1000)));
    }

    @Test
    void scrollYToReveal_movesMinimally() {
        ViewportGeometry geometry = geometry(lines(100));

        assertEquals(120, geometry.scrollYToReveal(10));
        assertEquals(0, geometry.scrollYToReveal(2));

        geometry.setScrollOffset(0, 500);
        assertEquals(0, geometry.scrollYToReveal(0));
        assertEquals(500, geometry.scrollYToReveal(26));
        assertEquals(1900, geometry.scrollYToReveal(1000));
    }

    @Test
    void invalidMetrics_areRejected() {
        ViewportGeometry geometry = new ViewportGeometry(new TextBuffer());

        assertThrows(IllegalArgumentException.class, () -> geometry.setCharDimensions(0, 10));
        assertThrows(IllegalArgumentException.class, () -> geometry.setCharDimensions(8, -1));
        assertThrows(IllegalArgumentException.class, () -> geometry.setSize(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> geometry.setScrollOffset(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class,
                () -> ViewportGeometry.computeVisibleLines(0, 100, 0, 10));
    }

    @Test
    void computeVisibleLines_isPure() {
        List<PartialLineView> a = ViewportGeometry.computeVisibleLines(15, 50, 10, 20);
        List<PartialLineView> b = ViewportGeometry.computeVisibleLines(15, 50, 10, 20);

        assertEquals(a, b);
        assertEquals(6, a.size());
        assertEquals(1, a.get(0).lineIndex());
        assertEquals(0.5, a.get(0).visibleFraction());
        assertEquals(6, a.get(5).lineIndex());
    }
}
