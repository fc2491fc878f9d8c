package behaviors.commands;

import java.util.Locale;

/// Keyboard modifiers that can be part of a [KeyGesture].
public enum ModifierKey {
    CTRL("ctrl", "control"),
    SHIFT("shift"),
    ALT("alt"),
    META("meta", "cmd", "win", "windows");

    private final String[] aliases;

    ModifierKey(String... aliases) {
        this.aliases = aliases;
    }

    /// Looks a modifier up by name or alias, ignoring case.
    /// @throws IllegalArgumentException if the text names no modifier
    public static ModifierKey fromText(String text) {
        final var lower = text.strip().toLowerCase(Locale.ROOT);
        for (final var modifier : values()) {
            for (final var alias : modifier.aliases) {
                if (alias.equals(lower)) {
                    return modifier;
                }
            }
        }
        throw new IllegalArgumentException("Unknown modifier key: " + text);
    }

    /// Display name used when rendering gestures.
    public String displayName() {
        final var name = aliases[0];
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
