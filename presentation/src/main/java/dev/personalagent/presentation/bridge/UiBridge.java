package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.UserEvent;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The UI thread's end of the bridge. Every method returns immediately so a
 * render frame is never blocked.
 */
public class UiBridge {

    private static final Logger LOG = LoggerFactory.getLogger(UiBridge.class);

    private final BridgeChannel<UserEvent> userEvents;
    private final BridgeChannel<ViewCommand> viewCommands;

    public UiBridge(BridgeChannel<UserEvent> userEvents, BridgeChannel<ViewCommand> viewCommands) {
        this.userEvents = userEvents;
        this.viewCommands = viewCommands;
    }

    /**
     * Hands a user action to the background side.
     *
     * @return {@code false} if the event was dropped; the caller should not
     *         retry from the render loop
     */
    public boolean emit(UserEvent event) {
        SendResult result = userEvents.trySend(event);
        if (result == SendResult.SENT) {
            return true;
        }
        if (result == SendResult.FULL) {
            LOG.warn("User event channel full, dropping {}", event);
        } else {
            LOG.warn("User event channel closed, dropping {}", event);
        }
        return false;
    }

    /**
     * Removes every queued command, oldest first. Call once per frame.
     */
    public List<ViewCommand> drainCommands() {
        return viewCommands.drain();
    }

    public boolean hasPendingCommands() {
        return !viewCommands.isEmpty();
    }

    /**
     * Shuts the UI side down. The forwarder finishes what was already emitted
     * and exits; later view commands are dropped.
     */
    public void close() {
        userEvents.close();
        viewCommands.close();
    }
}
