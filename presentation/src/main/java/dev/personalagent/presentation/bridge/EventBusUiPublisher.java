package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.NoSubscribersException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes UI events straight onto the {@link EventBus}. Publishing never
 * waits for subscribers, so this is safe on the UI thread.
 */
public class EventBusUiPublisher implements UiEventPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(EventBusUiPublisher.class);

    private final EventBus eventBus;

    public EventBusUiPublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void publish(AppEvent event) {
        try {
            eventBus.publish(event);
        } catch (NoSubscribersException e) {
            LOG.debug("No subscribers for {}", event);
        } catch (IllegalStateException e) {
            LOG.debug("Dropping {}: {}", event, e.getMessage());
        }
    }
}
