package behaviors.commands;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// Keyboard event data: the key, the modifiers held down and the handled flag.
///
/// Key names are compared case-insensitively and stored upper case.
public class KeyEventArgs implements HandledEvent {

    private final String key;
    private final Set<ModifierKey> modifiers;
    private boolean handled;

    public KeyEventArgs(String key, ModifierKey... modifiers) {
        this(key, modifiers.length == 0 ? Set.of() : EnumSet.of(modifiers[0], modifiers));
    }

    public KeyEventArgs(String key, Set<ModifierKey> modifiers) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(modifiers, "modifiers must not be null");
        this.key = key.strip().toUpperCase(Locale.ROOT);
        this.modifiers = modifiers.isEmpty() ? Set.of() : Set.copyOf(modifiers);
    }

    public String getKey() {
        return key;
    }

    public Set<ModifierKey> getModifiers() {
        return modifiers;
    }

    @Override
    public boolean isHandled() {
        return handled;
    }

    @Override
    public void setHandled(boolean handled) {
        this.handled = handled;
    }

    @Override
    public String toString() {
        return "KeyEventArgs[key=" + key + ", modifiers=" + modifiers + ", handled=" + handled + "]";
    }
}
