package com.tyron.editcore.core.shortcuts;

import com.tyron.editcore.api.command.Command;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A shortcut, the command it triggers and a human readable description.
 */
public record KeyBinding(@NotNull Shortcut shortcut, @NotNull Command command, @NotNull String description) {

    public KeyBinding {
        Objects.requireNonNull(shortcut, "shortcut");
        Objects.requireNonNull(command, "command");
        description = description != null ? description : "";
    }
}
