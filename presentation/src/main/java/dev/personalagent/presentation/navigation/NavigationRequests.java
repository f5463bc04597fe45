package dev.personalagent.presentation.navigation;

import dev.personalagent.core.event.ViewId;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single pending navigation request for views that navigate without going
 * through a presenter. Any thread may request; the UI thread takes the
 * request on its next frame. A newer request replaces an unconsumed one.
 */
public class NavigationRequests {

    private final AtomicReference<ViewId> pending = new AtomicReference<>();
    private volatile Runnable notifier = () -> {
    };

    public void request(ViewId view) {
        pending.set(view);
        notifier.run();
    }

    public Optional<ViewId> take() {
        return Optional.ofNullable(pending.getAndSet(null));
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    public void setNotifier(Runnable notifier) {
        this.notifier = notifier;
    }
}
