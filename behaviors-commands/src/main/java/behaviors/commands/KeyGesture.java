package behaviors.commands;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// A key plus the exact set of modifiers that must be held, e.g. `Ctrl+Shift+S`.
///
/// @param key       the key name, upper case
/// @param modifiers the modifiers, possibly empty
public record KeyGesture(String key, Set<ModifierKey> modifiers) {

    public KeyGesture {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(modifiers, "modifiers must not be null");
        key = key.strip().toUpperCase(Locale.ROOT);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        modifiers = Set.copyOf(modifiers);
    }

    /// Parses a gesture such as `Ctrl+S` or `alt + shift + F4`. Case is ignored.
    /// @throws IllegalArgumentException if a modifier is unknown or the key is missing
    public static KeyGesture parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var parts = text.split("\\+", -1);
        final var modifiers = EnumSet.noneOf(ModifierKey.class);
        for (int i = 0; i < parts.length - 1; i++) {
            modifiers.add(ModifierKey.fromText(parts[i]));
        }
        final var key = parts[parts.length - 1].strip();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Missing key in gesture: " + text);
        }
        return new KeyGesture(key, modifiers);
    }

    /// Returns true when the event has this key and exactly these modifiers.
    public boolean matches(KeyEventArgs args) {
        return args != null && key.equals(args.getKey()) && modifiers.equals(args.getModifiers());
    }

    @Override
    public String toString() {
        final var prefix = modifiers.stream()
                .sorted()
                .map(m -> m.displayName() + "+")
                .collect(Collectors.joining());
        return prefix + key;
    }
}
