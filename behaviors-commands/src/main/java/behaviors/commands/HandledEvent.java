package behaviors.commands;

/// Event arguments that carry a handled flag shared by every listener of the event.
public interface HandledEvent {

    boolean isHandled();

    void setHandled(boolean handled);
}
