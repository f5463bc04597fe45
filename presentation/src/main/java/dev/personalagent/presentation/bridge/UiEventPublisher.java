package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.AppEvent;

/**
 * Publishes events that originate in the UI itself rather than in a user
 * action, such as view stack and popover changes. Called on the UI thread;
 * implementations must not block.
 */
@FunctionalInterface
public interface UiEventPublisher {

    UiEventPublisher NONE = event -> {
    };

    void publish(AppEvent event);
}
