package com.tyron.editcore.api.editor;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.Response;

/**
 * Notified after every {@link Editor#dispatch(Command)}, once the command has been fully applied.
 */
public interface EditorListener {

    void commandDispatched(Command command, Response response);
}
