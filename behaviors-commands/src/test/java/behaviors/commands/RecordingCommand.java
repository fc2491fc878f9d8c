package behaviors.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/// Command that records every parameter it is executed with.
final class RecordingCommand implements Command {

    private final Predicate<Object> canExecute;
    final List<Object> executed = new ArrayList<>();
    final List<Object> checked = new ArrayList<>();

    RecordingCommand() {
        this(p -> true);
    }

    RecordingCommand(Predicate<Object> canExecute) {
        this.canExecute = canExecute;
    }

    @Override
    public boolean canExecute(Object parameter) {
        checked.add(parameter);
        return canExecute.test(parameter);
    }

    @Override
    public void execute(Object parameter) {
        executed.add(parameter);
    }
}
