package behaviors.commands;

/// Executes a command when a key event matches the configured [KeyGesture].
///
/// Without a gesture, or for event data that is not a [KeyEventArgs], the command never runs.
public class KeyToCommand extends EventToCommand {

    private KeyGesture gesture;

    @Override
    protected boolean canExecuteCommand(Object sender, Object eventArgs) {
        if (gesture == null || !(eventArgs instanceof KeyEventArgs keyEventArgs) || !gesture.matches(keyEventArgs)) {
            return false;
        }
        return super.canExecuteCommand(sender, eventArgs);
    }

    public KeyGesture getGesture() {
        return gesture;
    }

    public void setGesture(KeyGesture gesture) {
        this.gesture = gesture;
    }
}
