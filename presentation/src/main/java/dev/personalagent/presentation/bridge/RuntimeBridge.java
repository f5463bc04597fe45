package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.presentation.view.ViewCommand;

import java.util.concurrent.Executor;

/**
 * Both ends of the bridge, wired to one {@link EventBus}. The forwarder is
 * started on the given executor as soon as the bridge is created.
 */
public final class RuntimeBridge {

    private final UiBridge ui;
    private final ViewCommandSink sink;
    private final UiEventPublisher uiEvents;

    private RuntimeBridge(UiBridge ui, ViewCommandSink sink, UiEventPublisher uiEvents) {
        this.ui = ui;
        this.sink = sink;
        this.uiEvents = uiEvents;
    }

    public static RuntimeBridge create(EventBus eventBus, int userEventCapacity, int viewCommandCapacity,
            ViewNotifier notifier, Executor executor) {
        BridgeChannel<UserEvent> userEvents = new BridgeChannel<>(userEventCapacity);
        BridgeChannel<ViewCommand> viewCommands = new BridgeChannel<>(viewCommandCapacity);

        executor.execute(new UserEventForwarder(userEvents, eventBus));
        return new RuntimeBridge(new UiBridge(userEvents, viewCommands), new ViewCommandSink(viewCommands, notifier),
                new EventBusUiPublisher(eventBus));
    }

    public UiBridge ui() {
        return ui;
    }

    public ViewCommandSink sink() {
        return sink;
    }

    public UiEventPublisher uiEvents() {
        return uiEvents;
    }

    public void close() {
        ui.close();
    }
}
