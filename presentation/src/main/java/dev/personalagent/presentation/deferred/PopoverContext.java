package dev.personalagent.presentation.deferred;

import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.presentation.bridge.UiEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Popover state owned by the top-level application and passed to whoever
 * needs to toggle the popover. Requests are recorded immediately and applied
 * by {@link #processPending()} on the next frame, so a click handler running
 * inside the popover's own event delivery never re-enters the toolkit.
 * Applied changes are announced as {@link SystemEvent.PopoverShown} and
 * {@link SystemEvent.PopoverHidden}.
 */
public class PopoverContext {

    private static final Logger LOG = LoggerFactory.getLogger(PopoverContext.class);

    private final OverlayHandle overlay;
    private final UiEventPublisher events;
    private final DeferredOperationQueue<PopoverOperation> pending = new DeferredOperationQueue<>();

    public PopoverContext(OverlayHandle overlay) {
        this(overlay, UiEventPublisher.NONE);
    }

    public PopoverContext(OverlayHandle overlay, UiEventPublisher events) {
        this.overlay = overlay;
        this.events = events;
    }

    public void requestShow(AnchorBounds anchor) {
        pending.request(new PopoverOperation.Show(anchor));
    }

    public void requestHide() {
        pending.request(new PopoverOperation.Hide());
    }

    /**
     * Shows the popover when it is hidden and hides it otherwise. Decided
     * against the visibility at request time.
     */
    public void requestToggle(AnchorBounds anchor) {
        if (overlay.isVisible()) {
            requestHide();
        } else {
            requestShow(anchor);
        }
    }

    public boolean hasPending() {
        return pending.hasPending();
    }

    /**
     * Applies the pending request, if any.
     *
     * @return {@code true} if the overlay was touched
     */
    public boolean processPending() {
        return pending.drainAndApply(this::apply);
    }

    private void apply(PopoverOperation operation) {
        if (operation instanceof PopoverOperation.Show show) {
            LOG.debug("Showing popover at {}", show.anchor());
            overlay.show(show.anchor());
            events.publish(new SystemEvent.PopoverShown());
        } else if (operation instanceof PopoverOperation.Hide) {
            LOG.debug("Hiding popover");
            overlay.hide();
            events.publish(new SystemEvent.PopoverHidden());
        }
    }
}
