package com.tyron.editcore.core.shortcuts;

import com.tyron.editcore.api.command.Command;
import com.tyron.editcore.api.command.CursorMovement;
import com.tyron.editcore.api.keys.Key;
import com.tyron.editcore.api.keys.KeyEvent;
import com.tyron.editcore.api.keys.Modifiers;
import com.tyron.editcore.api.keys.NamedKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps key events to {@link Command}s.
 * <p>
 * Lookup is exact on key and modifiers. A key event without a binding still produces a command when it is a
 * character typed with no modifiers or with shift only (inserts the character), or Enter, Tab or Space with no
 * modifiers (inserts {@code '\n'}, {@code '\t'} or {@code ' '}). Everything else unbound resolves to nothing.
 * </p>
 */
public final class ShortcutTable {

    private static final Logger LOG = Logger.getLogger(ShortcutTable.class.getName());

    private final Map<Shortcut, KeyBinding> bindings = new LinkedHashMap<>();

    public ShortcutTable() {
    }

    public static ShortcutTable createDefault() {
        return createDefault(isMacOs());
    }

    /**
     * @param mac also bind the macOS {@code cmd+arrow} line and document navigation
     */
    public static ShortcutTable createDefault(boolean mac) {
        ShortcutTable table = new ShortcutTable();

        table.bindMovement(NamedKey.ARROW_UP, Modifiers.NONE, CursorMovement.UP, "cursor up");
        table.bindMovement(NamedKey.ARROW_DOWN, Modifiers.NONE, CursorMovement.DOWN, "cursor down");
        table.bindMovement(NamedKey.ARROW_LEFT, Modifiers.NONE, CursorMovement.LEFT, "cursor left");
        table.bindMovement(NamedKey.ARROW_RIGHT, Modifiers.NONE, CursorMovement.RIGHT, "cursor right");
        table.bindMovement(NamedKey.ARROW_LEFT, Modifiers.CONTROL, CursorMovement.WORD_LEFT, "to previous word");
        table.bindMovement(NamedKey.ARROW_RIGHT, Modifiers.CONTROL, CursorMovement.WORD_RIGHT, "to next word");
        table.bindMovement(NamedKey.HOME, Modifiers.NONE, CursorMovement.LINE_START, "to line start");
        table.bindMovement(NamedKey.END, Modifiers.NONE, CursorMovement.LINE_END, "to line end");
        table.bindMovement(NamedKey.HOME, Modifiers.CONTROL, CursorMovement.DOCUMENT_START, "to document start");
        table.bindMovement(NamedKey.END, Modifiers.CONTROL, CursorMovement.DOCUMENT_END, "to document end");
        table.bindMovement(NamedKey.PAGE_UP, Modifiers.NONE, CursorMovement.PAGE_UP, "page up");
        table.bindMovement(NamedKey.PAGE_DOWN, Modifiers.NONE, CursorMovement.PAGE_DOWN, "page down");

        table.bind(Shortcut.plain(NamedKey.DELETE), Command.DELETE_CHAR, "Delete character");
        table.bind(Shortcut.plain(NamedKey.BACKSPACE), Command.DELETE_CHAR_BACKWARD, "Delete character backward");
        table.bind(Shortcut.ctrl(NamedKey.DELETE), Command.DELETE_WORD_FORWARD, "Delete word forward");
        table.bind(Shortcut.ctrl(NamedKey.BACKSPACE), Command.DELETE_WORD_BACKWARD, "Delete word backward");
        table.bind(Shortcut.ctrl('k'), Command.DELETE_LINE, "Delete line");
        table.bind(Shortcut.shift(NamedKey.TAB), Command.DELETE_TO_LINE_START, "Delete to line start");

        table.bind(Shortcut.ctrl('a'), Command.SELECT_ALL, "Select all");
        table.bind(Shortcut.ctrl('l'), Command.SELECT_LINE, "Select line");
        table.bind(Shortcut.plain(NamedKey.ESCAPE), Command.CLEAR_SELECTION, "Clear selection");

        table.bind(Shortcut.ctrl('z'), Command.UNDO, "Undo");
        table.bind(Shortcut.ctrl('y'), Command.REDO, "Redo");
        table.bind(Shortcut.ctrlShift('z'), Command.REDO, "Redo (alternative)");
        table.bind(Shortcut.ctrl('x'), Command.CUT, "Cut");
        table.bind(Shortcut.ctrl('c'), Command.COPY, "Copy");
        table.bind(Shortcut.ctrl('v'), Command.PASTE, "Paste");

        table.bind(Shortcut.plain(NamedKey.F3), Command.FIND_NEXT, "Find next");
        table.bind(Shortcut.shift(NamedKey.F3), Command.FIND_PREVIOUS, "Find previous");

        if (mac) {
            table.bindMovement(NamedKey.ARROW_LEFT, Modifiers.SUPER, CursorMovement.LINE_START, "to line start (macOS)");
            table.bindMovement(NamedKey.ARROW_RIGHT, Modifiers.SUPER, CursorMovement.LINE_END, "to line end (macOS)");
            table.bindMovement(NamedKey.ARROW_UP, Modifiers.SUPER, CursorMovement.DOCUMENT_START, "to document start (macOS)");
            table.bindMovement(NamedKey.ARROW_DOWN, Modifiers.SUPER, CursorMovement.DOCUMENT_END, "to document end (macOS)");
        }
        return table;
    }

    // Binds the plain movement and its shift-extended selection variant.
    private void bindMovement(NamedKey key, Modifiers modifiers, CursorMovement movement, String what) {
        bind(new Shortcut(Key.named(key), modifiers), Command.move(movement), "Move " + what);
        bind(new Shortcut(Key.named(key), modifiers.withShift()), Command.select(movement), "Select " + what);
    }

    static boolean isMacOs() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }

    /**
     * Adds or replaces the binding for the binding's shortcut.
     */
    public void bind(@NotNull KeyBinding binding) {
        Objects.requireNonNull(binding, "binding");
        bindings.put(binding.shortcut(), binding);
    }

    public void bind(@NotNull Shortcut shortcut, @NotNull Command command, @NotNull String description) {
        bind(new KeyBinding(shortcut, command, description));
    }

    /**
     * @return {@code true} if a binding was removed.
     */
    public boolean unbind(@NotNull Shortcut shortcut) {
        return bindings.remove(shortcut) != null;
    }

    /**
     * @return The command bound to exactly this shortcut, or {@code null}.
     */
    @Nullable
    public Command lookup(@NotNull Shortcut shortcut) {
        KeyBinding binding = bindings.get(shortcut);
        return binding != null ? binding.command() : null;
    }

    /**
     * @return The command for {@code event}, or {@code null} if it maps to nothing.
     */
    @Nullable
    public Command resolve(@NotNull KeyEvent event) {
        Command bound = lookup(Shortcut.of(event));
        if (bound != null) {
            return bound;
        }

        Modifiers modifiers = event.modifiers();
        Key key = event.key();
        if (key instanceof Key.Char c) {
            if (modifiers.isEmpty() || modifiers.isShiftOnly()) {
                return Command.insertChar(c.codePoint());
            }
            return null;
        }
        if (key instanceof Key.Named n && modifiers.isEmpty()) {
            return switch (n.key()) {
                case ENTER -> Command.insertChar('\n');
                case TAB -> Command.insertChar('\t');
                case SPACE -> Command.insertChar(' ');
                default -> null;
            };
        }
        return null;
    }

    /**
     * @return A snapshot of the bindings in registration order.
     */
    public List<KeyBinding> getBindings() {
        return new ArrayList<>(bindings.values());
    }

    public int size() {
        return bindings.size();
    }

    /**
     * Applies {@code keybindings} entries read from configuration. Each entry is a map with a {@code shortcut},
     * a {@code command} name (see {@link CommandNames}, or {@code none} to remove the binding) and an optional
     * {@code description}. Malformed entries are logged and skipped.
     *
     * @return The number of entries applied.
     */
    public int loadFromConfig(@Nullable List<?> entries) {
        if (entries == null) return 0;

        int applied = 0;
        for (Object item : entries) {
            if (!(item instanceof Map<?, ?> entry)) {
                warn("keybinding entry is not a map: " + item);
                continue;
            }
            Object shortcutValue = entry.get("shortcut");
            Object commandValue = entry.get("command");
            if (shortcutValue == null || commandValue == null) {
                warn("keybinding entry needs shortcut and command: " + entry);
                continue;
            }

            Shortcut shortcut;
            try {
                shortcut = Shortcut.parse(String.valueOf(shortcutValue));
            } catch (IllegalArgumentException e) {
                warn(e.getMessage());
                continue;
            }

            String commandName = String.valueOf(commandValue).trim();
            if ("none".equalsIgnoreCase(commandName)) {
                unbind(shortcut);
                applied++;
                continue;
            }

            Command command = CommandNames.forName(commandName);
            if (command == null) {
                warn("unknown command '" + commandName + "' for shortcut=" + shortcut);
                continue;
            }

            Object description = entry.get("description");
            bind(shortcut, command, description != null ? String.valueOf(description) : commandName);
            applied++;
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("keybindings applied=" + applied + " total=" + entries.size());
        }
        return applied;
    }

    private static void warn(String message) {
        if (LOG.isLoggable(Level.WARNING)) {
            LOG.warning("keybindings " + message);
        }
    }
}
