package dev.personalagent.presentation.bridge;

import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Where presenters send their {@link ViewCommand}s. Shared by all presenters.
 *
 * <p>
 * The notifier runs after every send that reached an open channel, including
 * sends dropped because the channel was full, so the UI always wakes up and
 * drains what it can. Once the UI side has closed the channel nothing is
 * queued and nobody is woken.
 */
public class ViewCommandSink {

    private static final Logger LOG = LoggerFactory.getLogger(ViewCommandSink.class);

    private final BridgeChannel<ViewCommand> channel;
    private volatile ViewNotifier notifier;

    public ViewCommandSink(BridgeChannel<ViewCommand> channel, ViewNotifier notifier) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    /**
     * Queues {@code command} without blocking.
     *
     * @return {@code true} if the command was queued
     */
    public boolean send(ViewCommand command) {
        SendResult result = channel.trySend(command);
        if (result == SendResult.CLOSED) {
            LOG.info("UI side closed, dropping {}", command.getClass().getSimpleName());
            return false;
        }
        if (result == SendResult.FULL) {
            LOG.warn("View command channel full ({}), dropping {}", channel.capacity(),
                    command.getClass().getSimpleName());
        }
        wakeUi();
        return result == SendResult.SENT;
    }

    /**
     * Replaces the notifier, typically once the UI window exists.
     */
    public void setNotifier(ViewNotifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    private void wakeUi() {
        try {
            notifier.wake();
        } catch (RuntimeException e) {
            LOG.warn("View notifier failed", e);
        }
    }
}
