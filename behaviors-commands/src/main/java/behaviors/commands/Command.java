package behaviors.commands;

/// An executable action with an availability check, invoked with a single optional parameter.
public interface Command {

    /// Returns true when the command can run with the given parameter.
    boolean canExecute(Object parameter);

    /// Runs the command.
    void execute(Object parameter);
}
