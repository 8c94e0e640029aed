package com.tyron.editcore.core.shortcuts;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.CursorMovement;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Kebab-case names for the commands that can be bound to a key, e.g. {@code delete-line},
 * {@code move-word-left} or {@code select-to-line-end}.
 */
public final class CommandNames {

    private static final Map<String, Command> BY_NAME = new LinkedHashMap<>();
    private static final Map<Command, String> BY_COMMAND = new LinkedHashMap<>();

    static {
        for (CursorMovement movement : CursorMovement.values()) {
            register("move-" + suffix(movement), Command.move(movement));
        }
        for (CursorMovement movement : CursorMovement.values()) {
            register("select-" + suffix(movement), Command.select(movement));
        }
        register("delete-char", Command.DELETE_CHAR);
        register("delete-char-backward", Command.DELETE_CHAR_BACKWARD);
        register("delete-word-forward", Command.DELETE_WORD_FORWARD);
        register("delete-word-backward", Command.DELETE_WORD_BACKWARD);
        register("delete-to-line-end", Command.DELETE_TO_LINE_END);
        register("delete-to-line-start", Command.DELETE_TO_LINE_START);
        register("delete-line", Command.DELETE_LINE);
        register("delete-selection", Command.DELETE_SELECTION);
        register("start-selection", Command.START_SELECTION);
        register("end-selection", Command.END_SELECTION);
        register("select-all", Command.SELECT_ALL);
        register("select-line", Command.SELECT_LINE);
        register("select-word", Command.SELECT_WORD);
        register("clear-selection", Command.CLEAR_SELECTION);
        register("undo", Command.UNDO);
        register("redo", Command.REDO);
        register("cut", Command.CUT);
        register("copy", Command.COPY);
        register("paste", Command.PASTE);
        register("find", Command.find(""));
        register("find-next", Command.FIND_NEXT);
        register("find-previous", Command.FIND_PREVIOUS);
        register("replace", new Command.Replace("", ""));
    }

    private CommandNames() {
    }

    private static void register(String name, Command command) {
        BY_NAME.put(name, command);
        BY_COMMAND.put(command, name);
    }

    private static String suffix(CursorMovement movement) {
        return switch (movement) {
            case LINE_START, LINE_END, DOCUMENT_START, DOCUMENT_END ->
                    "to-" + movement.name().toLowerCase(Locale.ROOT).replace('_', '-');
            default -> movement.name().toLowerCase(Locale.ROOT).replace('_', '-');
        };
    }

    /**
     * @return The command with that name, or {@code null} if there is none.
     */
    @Nullable
    public static Command forName(@NotNull String name) {
        return BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return The name of {@code command}, or {@code null} if it carries arguments that no name describes.
     */
    @Nullable
    public static String nameOf(@NotNull Command command) {
        return BY_COMMAND.get(command);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(BY_NAME.keySet());
    }
}
