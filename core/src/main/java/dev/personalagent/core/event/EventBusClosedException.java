package dev.personalagent.core.event;

/**
 * Terminal for a subscriber: the bus was closed and everything buffered has
 * been delivered, or the subscriber itself was closed.
 */
public class EventBusClosedException extends EventBusException {

    public EventBusClosedException() {
        super("Event bus closed");
    }
}
