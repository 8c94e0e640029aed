package com.tyron.editcore.api.editor;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.Response;
import com.tyron.editcore.api.config.EditorSettings;
import com.tyron.editcore.api.keys.KeyEvent;
import com.tyron.editcore.api.text.ObservableTextView;
import com.tyron.editcore.api.text.Position;
import com.tyron.editcore.api.text.Selection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Abstract view of one editing session: a document, a cursor, an optional selection and a clipboard buffer.
 * <p>
 * All changes go through {@link #dispatch(Command)}. Instances are single-threaded and own their state
 * exclusively; create one per open document.
 * </p>
 */
public interface Editor {

    /**
     * Applies {@code command} and describes what changed. Never throws for any command content; failures are
     * reported as {@link Response.Error}.
     */
    @NotNull
    Response dispatch(@NotNull Command command);

    /**
     * Resolves a key press through the editor's shortcut table and dispatches the resulting command.
     *
     * @return the response, or {@code null} if the key is not bound to anything
     */
    @Nullable
    Response handleKeyEvent(@NotNull KeyEvent event);

    /**
     * Read-only view of the document, for renderers.
     */
    @NotNull
    ObservableTextView getDocument();

    @NotNull
    String getText();

    /**
     * Replaces the whole content, resetting the cursor, selection and history.
     */
    void setText(@NotNull String text);

    void clear();

    @NotNull
    Position getCaretPosition();

    @Nullable
    Selection getSelection();

    @NotNull
    String getClipboard();

    boolean isModified();

    boolean canUndo();

    boolean canRedo();

    @NotNull
    EditorSettings getSettings();

    void addEditorListener(@NotNull EditorListener listener);

    void removeEditorListener(@NotNull EditorListener listener);
}
