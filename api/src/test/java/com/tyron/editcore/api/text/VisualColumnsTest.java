package com.tyron.editcore.api.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VisualColumnsTest {

    @Test
    public void charToVisualExpandsTabsToNextStop() {
        String line = "hello\tworld\ttab";

        assertEquals(0, VisualColumns.toVisual(line, 0, 4));
        assertEquals(5, VisualColumns.toVisual(line, 5, 4));
        // After the first tab: next stop after 5 is 8.
        assertEquals(8, VisualColumns.toVisual(line, 6, 4));
    }

    @Test
    public void visualToCharLandsAfterTabWhenInsideItsExpansion() {
        String line = "hello\tworld\ttab";

        assertEquals(0, VisualColumns.toCharColumn(line, 0, 4));
        assertEquals(5, VisualColumns.toCharColumn(line, 5, 4));
        assertEquals(6, VisualColumns.toCharColumn(line, 7, 4));
        assertEquals(6, VisualColumns.toCharColumn(line, 8, 4));
    }

    @Test
    public void visualToCharIsClampedToLineContent() {
        assertEquals(3, VisualColumns.toCharColumn("abc\n", 40, 4));
        assertEquals(0, VisualColumns.toCharColumn("", 7, 4));
    }

    @Test
    public void leadingTabLine() {
        String line = "\tindented\tline";
        // Visual 5 = tab (0..4) + 'i'
        assertEquals(2, VisualColumns.toCharColumn(line, 5, 4));
        assertEquals(5, VisualColumns.toVisual(line, 2, 4));
    }

    @Test
    public void supplementaryCharactersCountAsOneColumn() {
        String line = "a😀b";
        assertEquals(2, VisualColumns.toVisual(line, 2, 4));
        assertEquals(2, VisualColumns.toCharColumn(line, 2, 4));
        assertEquals(3, VisualColumns.width(line, 4));
    }

    @Test
    public void rejectsNonPositiveTabWidth() {
        assertThrows(IllegalArgumentException.class, () -> VisualColumns.toVisual("a", 1, 0));
    }
}
