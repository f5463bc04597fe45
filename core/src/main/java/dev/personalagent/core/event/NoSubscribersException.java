package dev.personalagent.core.event;

/**
 * Thrown by {@link EventBus#publish(AppEvent)} when nobody is subscribed. The
 * event is discarded. Expected while the application is still wiring up.
 */
public class NoSubscribersException extends EventBusException {

    private final transient AppEvent event;

    public NoSubscribersException(AppEvent event) {
        super("No subscribers for " + event.getClass().getSimpleName());
        this.event = event;
    }

    public AppEvent getEvent() {
        return event;
    }
}
