package behaviors.commands;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Parsing and matching of key gestures.
class KeyGestureTest extends CommandsLoggingConfig {

    private static final Logger LOG = Logger.getLogger(KeyGestureTest.class.getName());

    @Test
    void testParseWithModifiers() {
        LOG.info(() -> "TEST: testParseWithModifiers - Ctrl+Shift+s");
        final var gesture = KeyGesture.parse("Ctrl+Shift+s");
        assertThat(gesture.key()).isEqualTo("S");
        assertThat(gesture.modifiers()).containsExactlyInAnyOrder(ModifierKey.CTRL, ModifierKey.SHIFT);
        assertThat(gesture).hasToString("Ctrl+Shift+S");
    }

    @Test
    void testParseIsCaseAndSpaceInsensitive() {
        LOG.info(() -> "TEST: testParseIsCaseAndSpaceInsensitive");
        assertThat(KeyGesture.parse(" control + ALT + f4 ")).isEqualTo(
                new KeyGesture("F4", Set.of(ModifierKey.CTRL, ModifierKey.ALT)));
        assertThat(KeyGesture.parse("Cmd+Q").modifiers()).containsExactly(ModifierKey.META);
    }

    @Test
    void testParseKeyOnly() {
        LOG.info(() -> "TEST: testParseKeyOnly - Enter");
        final var gesture = KeyGesture.parse("Enter");
        assertThat(gesture.modifiers()).isEmpty();
        assertThat(gesture).hasToString("ENTER");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Ctrl+", "Hyper+S", "+", "Ctrl++S"})
    void testParseRejectsMalformedGestures(String text) {
        LOG.info(() -> "TEST: testParseRejectsMalformedGestures - '" + text + "'");
        assertThatThrownBy(() -> KeyGesture.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMatchRequiresExactModifiers() {
        LOG.info(() -> "TEST: testMatchRequiresExactModifiers");
        final var gesture = KeyGesture.parse("Ctrl+S");
        assertThat(gesture.matches(new KeyEventArgs("s", ModifierKey.CTRL))).isTrue();
        assertThat(gesture.matches(new KeyEventArgs("S"))).isFalse();
        assertThat(gesture.matches(new KeyEventArgs("S", ModifierKey.CTRL, ModifierKey.SHIFT))).isFalse();
        assertThat(gesture.matches(new KeyEventArgs("D", ModifierKey.CTRL))).isFalse();
        assertThat(gesture.matches(null)).isFalse();
    }
}
