package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.NoSubscribersException;
import dev.personalagent.core.event.UserEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Background task moving {@link UserEvent}s from the UI channel onto the
 * {@link EventBus}. Runs until the channel is closed and drained, the bus is
 * closed, or the thread is interrupted.
 */
public class UserEventForwarder implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(UserEventForwarder.class);

    private final BridgeChannel<UserEvent> userEvents;
    private final EventBus eventBus;

    public UserEventForwarder(BridgeChannel<UserEvent> userEvents, EventBus eventBus) {
        this.userEvents = userEvents;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        LOG.debug("User event forwarder started");
        try {
            while (true) {
                Optional<UserEvent> next = userEvents.receive();
                if (next.isEmpty()) {
                    break;
                }
                if (!forward(next.get())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("User event forwarder stopped");
    }

    private boolean forward(UserEvent event) {
        try {
            eventBus.publish(event);
            return true;
        } catch (NoSubscribersException e) {
            LOG.debug("No presenter listening for {}", event);
            return true;
        } catch (IllegalStateException e) {
            LOG.info("Event bus closed, stopping user event forwarding");
            return false;
        }
    }
}
