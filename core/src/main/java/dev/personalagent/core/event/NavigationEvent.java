package dev.personalagent.core.event;

/**
 * View stack changes, published by the UI thread. {@link Navigating} and
 * {@link Navigated} bracket a user-initiated change; presenter-driven changes
 * only produce {@link Navigated}.
 */
public interface NavigationEvent extends AppEvent {

    record Navigating(ViewId from, ViewId to) implements NavigationEvent {
    }

    record Navigated(ViewId view) implements NavigationEvent {
    }

    record Cancelled(String reason) implements NavigationEvent {
    }
}
