package behaviors.commands;

import behaviors.pathexpr.PathExpressions;
import behaviors.pathexpr.ValueConverter;

import java.util.Locale;
import java.util.logging.Logger;

/// Turns an event into a [Command] execution.
///
/// The command parameter is resolved in this order:
/// 1. `commandParameter`, when set
/// 2. the value at `eventArgsParameterPath` in the event arguments, when the path is set
/// 3. the value at `senderParameterPath` in the sender, when the path is set
/// 4. `eventArgsConverter.convert(eventArgs, Object.class, sender, locale)`, when a converter is set
/// 5. the event arguments themselves, when `passEventArgsToCommand` is true
/// 6. null
///
/// Event subscription is left to the caller, which forwards each raised event to [#onEvent].
public class EventToCommand {

    private static final Logger LOG = Logger.getLogger(EventToCommand.class.getName());

    private Command command;
    private Object commandParameter;
    private String eventArgsParameterPath;
    private String senderParameterPath;
    private ValueConverter eventArgsConverter;
    private boolean passEventArgsToCommand;
    private boolean enabled = true;
    private boolean processHandledEvent;
    private boolean markEventHandled;

    /// Handles a raised event.
    /// @param sender    the object that raised the event, may be null
    /// @param eventArgs the event data, may be null
    /// @return true when the command was executed
    /// @throws behaviors.pathexpr.PathAccessException if a parameter path hits a failing getter
    public boolean onEvent(Object sender, Object eventArgs) {
        if (eventArgs instanceof HandledEvent handled && handled.isHandled() && !processHandledEvent) {
            LOG.finer(() -> "Skipping already handled event " + eventArgs);
            return false;
        }

        final var target = command;
        if (target == null || !canExecuteCommand(sender, eventArgs)) {
            LOG.finer(() -> "Command not executable for event " + eventArgs);
            return false;
        }

        final var parameter = resolveCommandParameter(sender, eventArgs);
        LOG.fine(() -> "Executing command with parameter " + parameter);
        target.execute(parameter);

        if (markEventHandled && eventArgs instanceof HandledEvent handled) {
            handled.setHandled(true);
        }
        return true;
    }

    /// Returns true when enabled and the command accepts the resolved parameter.
    protected boolean canExecuteCommand(Object sender, Object eventArgs) {
        final var target = command;
        return enabled && target != null && target.canExecute(resolveCommandParameter(sender, eventArgs));
    }

    /// Resolves the parameter handed to the command.
    protected Object resolveCommandParameter(Object sender, Object eventArgs) {
        if (commandParameter != null) {
            return commandParameter;
        }
        if (eventArgsParameterPath != null) {
            return PathExpressions.resolvePath(eventArgs, eventArgsParameterPath);
        }
        if (senderParameterPath != null) {
            return PathExpressions.resolvePath(sender, senderParameterPath);
        }
        if (eventArgsConverter != null) {
            return eventArgsConverter.convert(eventArgs, Object.class, sender, Locale.getDefault());
        }
        return passEventArgsToCommand ? eventArgs : null;
    }

    public Command getCommand() {
        return command;
    }

    public void setCommand(Command command) {
        this.command = command;
    }

    public Object getCommandParameter() {
        return commandParameter;
    }

    public void setCommandParameter(Object commandParameter) {
        this.commandParameter = commandParameter;
    }

    public String getEventArgsParameterPath() {
        return eventArgsParameterPath;
    }

    /// Path resolved against the event arguments to produce the command parameter.
    public void setEventArgsParameterPath(String eventArgsParameterPath) {
        this.eventArgsParameterPath = eventArgsParameterPath;
    }

    public String getSenderParameterPath() {
        return senderParameterPath;
    }

    /// Path resolved against the sender to produce the command parameter.
    public void setSenderParameterPath(String senderParameterPath) {
        this.senderParameterPath = senderParameterPath;
    }

    public ValueConverter getEventArgsConverter() {
        return eventArgsConverter;
    }

    public void setEventArgsConverter(ValueConverter eventArgsConverter) {
        this.eventArgsConverter = eventArgsConverter;
    }

    public boolean isPassEventArgsToCommand() {
        return passEventArgsToCommand;
    }

    public void setPassEventArgsToCommand(boolean passEventArgsToCommand) {
        this.passEventArgsToCommand = passEventArgsToCommand;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isProcessHandledEvent() {
        return processHandledEvent;
    }

    public void setProcessHandledEvent(boolean processHandledEvent) {
        this.processHandledEvent = processHandledEvent;
    }

    public boolean isMarkEventHandled() {
        return markEventHandled;
    }

    public void setMarkEventHandled(boolean markEventHandled) {
        this.markEventHandled = markEventHandled;
    }
}
