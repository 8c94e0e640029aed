package com.tyron.editcore.core.document;

import com.tyron.editcore.api.text.DocumentEvent;
import com.tyron.editcore.api.text.InvalidPositionException;
import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import com.tyron.editcore.core.cursor.Cursor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextBufferTest {

    private static final WordBoundaryClassifier WORDS = WordBoundaryClassifier.DEFAULT;

    private static Cursor cursorAt(int line, int column) {
        Cursor cursor = new Cursor();
        cursor.setPosition(new Position(line, column));
        return cursor;
    }

    // ---- geometry ----

    @Test
    void lineQueries_excludeTerminators() {
        TextBuffer buffer = new TextBuffer("line1\nline2_with_underscores\nline3");

        assertEquals(3, buffer.getLineCount());
        assertEquals("line2_with_underscores", buffer.getLineText(1));
        assertEquals(22, buffer.getLineLength(1));
        assertEquals(6, buffer.getLineStartOffset(1));
        assertEquals(28, buffer.getLineEndOffset(1));
        assertEquals(buffer.getTextLength(), buffer.getLineEndOffset(2));
    }

    @Test
    void offsetConversion_line1Column5_is11() {
        TextBuffer buffer = new TextBuffer("line1\nline2_with_underscores\nline3");

        assertEquals(3, buffer.offsetOf(new Position(0, 3)));
        assertEquals(11, buffer.offsetOf(new Position(1, 5)));
        assertEquals(new Position(1, 5), buffer.positionOf(11));
        assertEquals(new Position(1, 10), buffer.positionOf(buffer.offsetOf(new Position(1, 10))));
    }

    @Test
    void offsetConversion_clampsInsteadOfFailing() {
        TextBuffer buffer = new TextBuffer("ab\ncd");

        assertEquals(2, buffer.offsetOf(new Position(0, 99)));
        assertEquals(3, buffer.offsetOf(new Position(42, 0)));
        assertEquals(new Position(1, 2), buffer.positionOf(1000));
        assertEquals(new Position(0, 0), buffer.positionOf(-3));
        assertEquals(new Position(1, 2), buffer.clamp(new Position(7, 7)));
    }

    @Test
    void negativePosition_isInvalid() {
        TextBuffer buffer = new TextBuffer("abc");
        InvalidPositionException e = assertThrows(InvalidPositionException.class,
                () -> buffer.offsetOf(new Position(0, -1)));
        assertEquals("Invalid position: line 0, column -1", e.getMessage());
    }

    @Test
    void supplementaryCharacters_occupyOneColumnAndTwoOffsets() {
        TextBuffer buffer = new TextBuffer("a😀b\nx");

        assertEquals(3, buffer.getLineLength(0));
        assertEquals(3, buffer.offsetOf(new Position(0, 2)));
        assertEquals(new Position(0, 2), buffer.positionOf(3));
        assertEquals(0x1F600, buffer.codePointAt(1));
        assertEquals(0x1F600, buffer.codePointBefore(3));
    }

    @Test
    void offsetRoundTrip_holdsForEveryValidPosition() {
        TextBuffer buffer = new TextBuffer("héllo\n\twörld 😀\n\nend");
        for (int line = 0; line < buffer.getLineCount(); line++) {
            for (int column = 0; column <= buffer.getLineLength(line); column++) {
                Position p = new Position(line, column);
                assertEquals(p, buffer.positionOf(buffer.offsetOf(p)), () -> "round trip of " + p);
            }
        }
    }

    // ---- insertion ----

    @Test
    void insertChar_movesCursorAfterCharacter() {
        TextBuffer buffer = new TextBuffer("ac");
        Cursor cursor = cursorAt(0, 1);

        buffer.insertChar(new Position(0, 1), 'b', cursor);

        assertEquals("abc", buffer.getText());
        assertEquals(new Position(0, 2), cursor.getPosition());
        assertTrue(buffer.isModified());
        assertEquals(1, buffer.getUndoDepth());
    }

    @Test
    void insertNewline_movesCursorToNextLine() {
        TextBuffer buffer = new TextBuffer("ab");
        Cursor cursor = cursorAt(0, 1);

        buffer.insertChar(new Position(0, 1), '\n', cursor);

        assertEquals("a\nb", buffer.getText());
        assertEquals(new Position(1, 0), cursor.getPosition());
    }

    @Test
    void insertEmptyText_isANoOp() {
        TextBuffer buffer = new TextBuffer("abc");
        Cursor cursor = cursorAt(0, 1);

        assertFalse(buffer.insertText(new Position(0, 1), "", cursor));
        assertFalse(buffer.isModified());
        assertFalse(buffer.canUndo());
        assertEquals(0, buffer.getModificationStamp());
    }

    @Test
    void insertText_isOneUndoStep() {
        TextBuffer buffer = new TextBuffer();
        Cursor cursor = new Cursor();

        assertTrue(buffer.insertText(Position.ZERO, "Hello,\nWorld!", cursor));

        assertEquals(new Position(1, 6), cursor.getPosition());
        assertEquals(1, buffer.getUndoDepth());
    }

    // ---- deletion ----

    @Test
    void deleteChar_atDocumentEnd_isANoOp() {
        TextBuffer buffer = new TextBuffer("ab");
        Cursor cursor = cursorAt(0, 2);

        assertFalse(buffer.deleteChar(new Position(0, 2), cursor));
        assertFalse(buffer.canUndo());
    }

    @Test
    void deleteChar_joinsLinesAtLineEnd() {
        TextBuffer buffer = new TextBuffer("ab\ncd");
        Cursor cursor = cursorAt(0, 2);

        assertTrue(buffer.deleteChar(new Position(0, 2), cursor));
        assertEquals("abcd", buffer.getText());
        assertEquals(new Position(0, 2), cursor.getPosition());
    }

    @Test
    void deleteCharBackward_removesWholeSurrogatePair() {
        TextBuffer buffer = new TextBuffer("a😀");
        Cursor cursor = cursorAt(0, 2);

        assertTrue(buffer.deleteCharBackward(new Position(0, 2), cursor));
        assertEquals("a", buffer.getText());
        assertEquals(new Position(0, 1), cursor.getPosition());
    }

    @Test
    void deleteCharBackward_atDocumentStart_isANoOp() {
        TextBuffer buffer = new TextBuffer("ab");
        assertFalse(buffer.deleteCharBackward(Position.ZERO, new Cursor()));
        assertFalse(buffer.canUndo());
    }

    @Test
    void deleteLine_removesLineAndTerminator() {
        TextBuffer buffer = new TextBuffer("one\ntwo\nthree");
        Cursor cursor = cursorAt(1, 2);

        assertTrue(buffer.deleteLine(1, cursor));
        assertEquals("one\nthree", buffer.getText());
        assertEquals(new Position(1, 0), cursor.getPosition());
    }

    @Test
    void deleteLine_lastLine_keepsPrecedingTerminator() {
        TextBuffer buffer = new TextBuffer("one\ntwo\nthree");
        Cursor cursor = cursorAt(2, 3);

        assertTrue(buffer.deleteLine(2, cursor));
        assertEquals("one\ntwo\n", buffer.getText());
        assertEquals(3, buffer.getLineCount());
        assertEquals(new Position(2, 0), cursor.getPosition());

        // the now empty last line has nothing left to remove
        assertFalse(buffer.deleteLine(2, cursor));
    }

    @Test
    void deleteLine_lastOfTwoLines() {
        TextBuffer buffer = new TextBuffer("a\nb");
        Cursor cursor = cursorAt(1, 1);

        assertTrue(buffer.deleteLine(1, cursor));
        assertEquals("a\n", buffer.getText());
        assertEquals(new Position(1, 0), cursor.getPosition());
    }

    @Test
    void crLf_isExcludedFromLineContent() {
        TextBuffer buffer = new TextBuffer("ab\r\ncd");

        assertEquals(2, buffer.getLineCount());
        assertEquals("ab", buffer.getLineText(0));
        assertEquals(2, buffer.getLineLength(0));
        assertEquals(2, buffer.getLineEndOffset(0));
        assertEquals(4, buffer.getLineStartOffset(1));
        assertEquals(2, buffer.offsetOf(new Position(0, 5)));
        assertEquals(new Position(0, 2), buffer.positionOf(3));
    }

    @Test
    void crLf_deleteToLineEndKeepsTerminator() {
        TextBuffer buffer = new TextBuffer("ab\r\ncd");
        Cursor cursor = cursorAt(0, 1);

        assertTrue(buffer.deleteToLineEnd(cursor));
        assertEquals("a\r\ncd", buffer.getText());
        assertEquals(new Position(0, 1), cursor.getPosition());
        assertFalse(buffer.deleteToLineEnd(cursor));
    }

    @Test
    void crLf_isDeletedAsOneTerminator() {
        TextBuffer buffer = new TextBuffer("ab\r\ncd");
        Cursor cursor = new Cursor();

        assertTrue(buffer.deleteChar(new Position(0, 2), cursor));
        assertEquals("abcd", buffer.getText());

        buffer.reset("ab\r\ncd");
        assertTrue(buffer.deleteCharBackward(new Position(1, 0), cursor));
        assertEquals("abcd", buffer.getText());
        assertEquals(new Position(0, 2), cursor.getPosition());
    }

    @Test
    void deleteLine_onlyLine_leavesEmptyDocument() {
        TextBuffer buffer = new TextBuffer("only");
        Cursor cursor = cursorAt(0, 2);

        assertTrue(buffer.deleteLine(0, cursor));
        assertEquals("", buffer.getText());
        assertEquals(Position.ZERO, cursor.getPosition());
        assertFalse(buffer.deleteLine(0, cursor));
    }

    @Test
    void deleteLine_outOfRange_isANoOp() {
        TextBuffer buffer = new TextBuffer("a\nb");
        assertFalse(buffer.deleteLine(5, new Cursor()));
        assertThrows(InvalidPositionException.class, () -> buffer.deleteLine(-1, new Cursor()));
    }

    @Test
    void deleteSelection_returnsRemovedTextAndMovesCursorToStart() {
        TextBuffer buffer = new TextBuffer("hello\nworld");
        Cursor cursor = cursorAt(1, 2);
        Selection selection = Selection.fromPositions(new Position(1, 2), new Position(0, 3));

        assertEquals("lo\nwo", buffer.deleteSelection(selection, cursor));
        assertEquals("helrld", buffer.getText());
        assertEquals(new Position(0, 3), cursor.getPosition());
        assertEquals("", buffer.deleteSelection(Selection.caret(new Position(0, 1)), cursor));
        assertEquals(1, buffer.getUndoDepth());
    }

    @Test
    void deleteWordForward_skipsBoundaryRunThenWord() {
        TextBuffer buffer = new TextBuffer("foo.  bar_baz qux");
        Cursor cursor = cursorAt(0, 3);

        assertTrue(buffer.deleteWordForward(cursor, WORDS));
        assertEquals("foo qux", buffer.getText());
        assertEquals(new Position(0, 3), cursor.getPosition());
    }

    @Test
    void deleteWordForward_insideWord_removesRestOfWord() {
        TextBuffer buffer = new TextBuffer("kebab-case next");
        Cursor cursor = cursorAt(0, 2);

        assertTrue(buffer.deleteWordForward(cursor, WORDS));
        assertEquals("ke next", buffer.getText());
    }

    @Test
    void deleteWordBackward_skipsBoundaryRunThenWord() {
        TextBuffer buffer = new TextBuffer("alpha snake_case  ");
        Cursor cursor = cursorAt(0, 18);

        assertTrue(buffer.deleteWordBackward(cursor, WORDS));
        assertEquals("alpha ", buffer.getText());
        assertEquals(new Position(0, 6), cursor.getPosition());
    }

    @Test
    void deleteWord_atDocumentEdges_isANoOp() {
        TextBuffer buffer = new TextBuffer("abc");
        assertFalse(buffer.deleteWordForward(cursorAt(0, 3), WORDS));
        assertFalse(buffer.deleteWordBackward(cursorAt(0, 0), WORDS));
        assertFalse(buffer.canUndo());
    }

    @Test
    void deleteToLineEnd_keepsTerminator() {
        TextBuffer buffer = new TextBuffer("hello world\nnext");
        Cursor cursor = cursorAt(0, 5);

        assertTrue(buffer.deleteToLineEnd(cursor));
        assertEquals("hello\nnext", buffer.getText());
        assertFalse(buffer.deleteToLineEnd(cursor));
    }

    @Test
    void deleteToLineStart_movesCursorToColumnZero() {
        TextBuffer buffer = new TextBuffer("first\nhello world");
        Cursor cursor = cursorAt(1, 6);

        assertTrue(buffer.deleteToLineStart(cursor));
        assertEquals("first\nworld", buffer.getText());
        assertEquals(new Position(1, 0), cursor.getPosition());
        assertFalse(buffer.deleteToLineStart(cursor));
    }

    @Test
    void replace_isSingleUndoStep() {
        TextBuffer buffer = new TextBuffer("hello world");
        Cursor cursor = cursorAt(0, 11);

        assertTrue(buffer.replace(new Selection(new Position(0, 6), new Position(0, 11)), "there", cursor));
        assertEquals("hello there", buffer.getText());
        assertEquals(new Position(0, 11), cursor.getPosition());
        assertEquals(1, buffer.getUndoDepth());

        assertTrue(buffer.undo(cursor));
        assertEquals("hello world", buffer.getText());
    }

    @Test
    void replace_withIdenticalText_recordsNothing() {
        TextBuffer buffer = new TextBuffer("abc");
        Cursor cursor = new Cursor();

        assertFalse(buffer.replace(new Selection(new Position(0, 1), new Position(0, 2)), "b", cursor));
        assertEquals(new Position(0, 2), cursor.getPosition());
        assertFalse(buffer.canUndo());
    }

    // ---- history ----

    @Test
    void undoRedo_scenario() {
        TextBuffer buffer = new TextBuffer();
        Cursor cursor = new Cursor();

        buffer.insertText(cursor.getPosition(), "a", cursor);
        buffer.insertText(cursor.getPosition(), "b", cursor);

        assertTrue(buffer.undo(cursor));
        assertEquals("a", buffer.getText());
        assertTrue(buffer.undo(cursor));
        assertEquals("", buffer.getText());
        assertFalse(buffer.undo(cursor));
        assertTrue(buffer.redo(cursor));
        assertEquals("a", buffer.getText());
        assertEquals(new Position(0, 1), cursor.getPosition());
    }

    @Test
    void undo_restoresTextAndCursor_redoRestoresTheEdit() {
        TextBuffer buffer = new TextBuffer("one\ntwo");
        Cursor cursor = cursorAt(1, 1);

        buffer.deleteLine(0, cursor);
        String after = buffer.getText();
        Position afterCursor = cursor.getPosition();

        assertTrue(buffer.undo(cursor));
        assertEquals("one\ntwo", buffer.getText());
        assertEquals(new Position(1, 1), cursor.getPosition());

        assertTrue(buffer.redo(cursor));
        assertEquals(after, buffer.getText());
        assertEquals(afterCursor, cursor.getPosition());
    }

    @Test
    void newEdit_clearsRedo() {
        TextBuffer buffer = new TextBuffer();
        Cursor cursor = new Cursor();
        buffer.insertText(Position.ZERO, "a", cursor);
        buffer.undo(cursor);
        assertTrue(buffer.canRedo());

        buffer.insertText(Position.ZERO, "b", cursor);

        assertFalse(buffer.canRedo());
        assertFalse(buffer.redo(cursor));
        assertEquals("b", buffer.getText());
    }

    @Test
    void noOpEdit_keepsRedo() {
        TextBuffer buffer = new TextBuffer("x");
        Cursor cursor = cursorAt(0, 1);
        buffer.insertText(cursor.getPosition(), "y", cursor);
        buffer.undo(cursor);

        assertFalse(buffer.deleteChar(new Position(0, 1), cursor));

        assertTrue(buffer.canRedo());
    }

    @Test
    void undoStack_isBoundedWithOldestDroppedFirst() {
        int max = 5;
        TextBuffer buffer = new TextBuffer("", max);
        Cursor cursor = new Cursor();

        for (int i = 0; i < max + 3; i++) {
            buffer.insertText(cursor.getPosition(), String.valueOf(i), cursor);
        }
        assertEquals(max, buffer.getUndoDepth());

        while (buffer.undo(cursor)) {
            // drain
        }
        // the three oldest edits ("0", "1", "2") can no longer be undone
        assertEquals("012", buffer.getText());
    }

    @Test
    void zeroUndoLevels_disablesHistory() {
        TextBuffer buffer = new TextBuffer("", 0);
        Cursor cursor = new Cursor();
        buffer.insertText(Position.ZERO, "a", cursor);

        assertFalse(buffer.canUndo());
        assertFalse(buffer.undo(cursor));
        assertEquals(0, buffer.getMaxUndoLevels());
    }

    @Test
    void markSaved_clearsModifiedFlagUntilNextEdit() {
        TextBuffer buffer = new TextBuffer();
        Cursor cursor = new Cursor();
        buffer.insertText(Position.ZERO, "a", cursor);
        buffer.markSaved();
        assertFalse(buffer.isModified());

        buffer.undo(cursor);
        assertTrue(buffer.isModified());
    }

    // ---- search ----

    @Test
    void find_returnsNonOverlappingMatchesPerLine() {
        TextBuffer buffer = new TextBuffer("aaaa\nbaab\naa");

        assertEquals(List.of(
                new Position(0, 0), new Position(0, 2),
                new Position(1, 1),
                new Position(2, 0)), buffer.find("aa"));
    }

    @Test
    void find_columnsCountCodePoints() {
        TextBuffer buffer = new TextBuffer("😀 x 😀 x");
        assertEquals(List.of(new Position(0, 2), new Position(0, 6)), buffer.find("x"));
    }

    @Test
    void find_emptyPattern_findsNothing() {
        assertTrue(new TextBuffer("abc").find("").isEmpty());
    }

    @Test
    void replaceAll_countsMatchesAndIsOneUndoStep() {
        TextBuffer buffer = new TextBuffer("cat dog cat\ncat");
        Cursor cursor = cursorAt(1, 3);

        assertEquals(3, buffer.replaceAll("cat", "a", cursor));
        assertEquals("a dog a\na", buffer.getText());
        assertEquals(new Position(1, 1), cursor.getPosition());
        assertEquals(1, buffer.getUndoDepth());

        buffer.undo(cursor);
        assertEquals("cat dog cat\ncat", buffer.getText());
    }

    @Test
    void replaceAll_replacementContainingPattern_countsOriginalMatchesOnly() {
        TextBuffer buffer = new TextBuffer("a a");
        assertEquals(2, buffer.replaceAll("a", "aa", new Cursor()));
        assertEquals("aa aa", buffer.getText());
    }

    @Test
    void replaceAll_withoutMatches_recordsNothing() {
        TextBuffer buffer = new TextBuffer("abc");
        assertEquals(0, buffer.replaceAll("x", "y", new Cursor()));
        assertEquals(0, buffer.replaceAll("", "y", new Cursor()));
        assertFalse(buffer.canUndo());
    }

    // ---- events ----

    @Test
    void listeners_receiveOneEventPerChange() {
        TextBuffer buffer = new TextBuffer("hello");
        List<DocumentEvent> events = new ArrayList<>();
        buffer.addDocumentListener(events::add);
        Cursor cursor = cursorAt(0, 5);

        buffer.insertText(new Position(0, 5), "!", cursor);
        buffer.deleteCharBackward(cursor.getPosition(), cursor);
        buffer.undo(cursor);

        assertEquals(3, events.size());
        assertTrue(events.get(0).isInsertion());
        assertEquals(5, events.get(0).getStartOffset());
        assertTrue(events.get(1).isDeletion());
        assertEquals(0, events.get(2).getStartOffset());
        assertEquals("hello!", events.get(2).getNewText());
        assertEquals(3, buffer.getModificationStamp());
    }

    @Test
    void reset_discardsHistory() {
        TextBuffer buffer = new TextBuffer();
        Cursor cursor = new Cursor();
        buffer.insertText(Position.ZERO, "abc", cursor);

        buffer.reset("new\ntext");

        assertEquals("new\ntext", buffer.getText());
        assertFalse(buffer.canUndo());
        assertFalse(buffer.isModified());
    }
}
