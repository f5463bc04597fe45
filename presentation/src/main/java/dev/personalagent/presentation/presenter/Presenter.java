package dev.personalagent.presentation.presenter;

/**
 * Mediator between the event bus and one UI feature. A running presenter owns
 * exactly one background loop consuming its bus subscription in order.
 */
public interface Presenter {

    /**
     * Subscribes and starts the event loop. No-op while already running.
     */
    void start();

    /**
     * Asks the loop to stop. The loop notices on its next event, or when the
     * bus closes; it is never interrupted.
     */
    void stop();

    boolean isRunning();
}
