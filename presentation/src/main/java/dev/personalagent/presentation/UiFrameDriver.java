package dev.personalagent.presentation;

import dev.personalagent.core.event.NavigationEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.presentation.bridge.UiBridge;
import dev.personalagent.presentation.bridge.UiEventPublisher;
import dev.personalagent.presentation.deferred.PopoverContext;
import dev.personalagent.presentation.navigation.NavigationRequests;
import dev.personalagent.presentation.navigation.NavigationState;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * What the render loop calls once per frame. Owns the UI thread's navigation
 * stack and keeps it in step with navigation commands coming from the
 * presenters.
 *
 * <p>
 * Order within a frame: drain view commands, apply each one (navigation
 * commands update the stack first), then run deferred popover operations and
 * direct navigation requests. Deferred work therefore never runs inside a
 * toolkit callback.
 *
 * <p>
 * Every change of the stack is published as a {@link NavigationEvent}.
 */
public class UiFrameDriver {

    private static final Logger LOG = LoggerFactory.getLogger(UiFrameDriver.class);

    private final UiBridge bridge;
    private final ViewCommandHandler handler;
    private final PopoverContext popover;
    private final NavigationRequests navigationRequests;
    private final UiEventPublisher events;
    private final NavigationState navigation = new NavigationState();

    public UiFrameDriver(UiBridge bridge, ViewCommandHandler handler, PopoverContext popover,
            NavigationRequests navigationRequests) {
        this(bridge, handler, popover, navigationRequests, UiEventPublisher.NONE);
    }

    public UiFrameDriver(UiBridge bridge, ViewCommandHandler handler, PopoverContext popover,
            NavigationRequests navigationRequests, UiEventPublisher events) {
        this.bridge = bridge;
        this.handler = handler;
        this.popover = popover;
        this.navigationRequests = navigationRequests;
        this.events = events;
    }

    /**
     * Runs one frame.
     *
     * @return {@code true} if anything changed and the frame should be
     *         redrawn
     */
    public boolean tick() {
        boolean dirty = false;

        List<ViewCommand> commands = bridge.drainCommands();
        for (ViewCommand command : commands) {
            applyNavigation(command);
            handler.apply(command, navigation);
        }
        dirty |= !commands.isEmpty();

        dirty |= popover.processPending();

        Optional<ViewId> requested = navigationRequests.take();
        if (requested.isPresent()) {
            navigate(requested.get());
            dirty = true;
        }
        return dirty;
    }

    public boolean needsRedraw() {
        return bridge.hasPendingCommands() || popover.hasPending() || navigationRequests.hasPending();
    }

    /**
     * User-initiated navigation: updates the stack immediately and tells the
     * presenters.
     */
    public void navigate(ViewId view) {
        ViewId from = navigation.current();
        if (from == view) {
            events.publish(new NavigationEvent.Cancelled("Already at " + view));
            return;
        }
        events.publish(new NavigationEvent.Navigating(from, view));
        navigation.navigate(view);
        bridge.emit(new UserEvent.Navigate(view));
        events.publish(new NavigationEvent.Navigated(view));
    }

    /**
     * User-initiated back navigation.
     *
     * @return {@code false} when already at the home view
     */
    public boolean back() {
        if (!navigation.canGoBack()) {
            events.publish(new NavigationEvent.Cancelled("Already at " + navigation.current()));
            return false;
        }
        List<ViewId> stack = navigation.snapshot();
        ViewId to = stack.get(stack.size() - 2);
        events.publish(new NavigationEvent.Navigating(navigation.current(), to));
        navigation.navigateBack();
        bridge.emit(new UserEvent.NavigateBack());
        events.publish(new NavigationEvent.Navigated(to));
        return true;
    }

    public NavigationState navigation() {
        return navigation;
    }

    private void applyNavigation(ViewCommand command) {
        if (command instanceof ViewCommand.NavigateTo navigateTo) {
            if (navigation.navigate(navigateTo.view())) {
                LOG.debug("Navigated to {}", navigation.current());
                events.publish(new NavigationEvent.Navigated(navigation.current()));
            }
        } else if (command instanceof ViewCommand.NavigateBack) {
            if (navigation.navigateBack()) {
                events.publish(new NavigationEvent.Navigated(navigation.current()));
            } else {
                LOG.debug("Ignoring back navigation at {}", navigation.current());
            }
        }
    }
}
