package com.tyron.editcore.core.editor;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.CursorMovement;
import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.text.WordBoundaryClassifier;
import com.tyron.editcore.testFramework.BaseEditorTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Editors created with non-default settings.
 */
public class EditorSettingsTest extends BaseEditorTest {

    @Override
    protected EditorSettings settings() {
        return EditorSettings.builder()
                .maxUndoLevels(3)
                .tabWidth(8)
                .pageLines(2)
                .wordBoundaries(new WordBoundaryClassifier(WordBoundaryClassifier.DEFAULT_PUNCTUATION + "-", "_"))
                .build();
    }

    @Test
    void undoLevels_limitHistory() {
        type("abcde");

        int undone = 0;
        while (editor.canUndo()) {
            dispatch(Command.UNDO);
            undone++;
        }

        assertEquals(3, undone);
        assertText("ab");
    }

    @Test
    void tabWidth_drivesVerticalMovement() {
        configureByText("""
                \tx<caret>
                abcdefghij""");

        move(CursorMovement.DOWN);

        assertCaret(1, 9);
    }

    @Test
    void pageLines_limitPageMoves() {
        configureByText("""
                <caret>0
                1
                2
                3""");

        move(CursorMovement.PAGE_DOWN);

        assertCaret(2, 0);
    }

    @Test
    void wordBoundaries_areConfigurable() {
        configureByText("<caret>kebab-case snake_case");

        move(CursorMovement.WORD_RIGHT);
        assertCaret(0, 6);
        move(CursorMovement.WORD_RIGHT);
        assertCaret(0, 11);
    }

    @Test
    void settings_areExposed() {
        assertEquals(3, editor.getSettings().getMaxUndoLevels());
        assertEquals(8, editor.getSettings().getTabWidth());
        assertEquals(2, editor.getSettings().getPageLines());
    }
}
