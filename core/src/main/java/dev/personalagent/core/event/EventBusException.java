package dev.personalagent.core.event;

/**
 * Base type for bus-level conditions. These are operational signals, never
 * shown to the end user.
 */
public class EventBusException extends Exception {

    public EventBusException(String message) {
        super(message);
    }
}
