package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.NavigationEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeBridgeTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void create_shouldConnectUiAndBusBothWays() throws Exception {
        var bus = new EventBus(16);
        var subscriber = bus.subscribe();
        var wakeUps = new AtomicInteger();
        var bridge = RuntimeBridge.create(bus, 8, 8, wakeUps::incrementAndGet, executor);

        assertTrue(bridge.ui().emit(new UserEvent.OpenModelSelector()));
        assertEquals(new UserEvent.OpenModelSelector(), subscriber.receive(Duration.ofSeconds(1)));

        bridge.sink().send(new ViewCommand.DismissModal());
        assertEquals(1, wakeUps.get());
        assertEquals(List.of(new ViewCommand.DismissModal()), bridge.ui().drainCommands());

        bridge.close();
        assertFalse(bridge.ui().emit(new UserEvent.OpenModelSelector()));
    }

    @Test
    void uiEvents_shouldPublishStraightOntoBus() throws Exception {
        var bus = new EventBus(16);
        var bridge = RuntimeBridge.create(bus, 8, 8, () -> {
        }, executor);

        assertDoesNotThrow(() -> bridge.uiEvents().publish(new NavigationEvent.Navigated(ViewId.SETTINGS)));

        var subscriber = bus.subscribe();
        bridge.uiEvents().publish(new NavigationEvent.Navigated(ViewId.HISTORY));
        assertEquals(new NavigationEvent.Navigated(ViewId.HISTORY), subscriber.receive(Duration.ofSeconds(1)));

        bus.close();
        assertDoesNotThrow(() -> bridge.uiEvents().publish(new NavigationEvent.Navigated(ViewId.CHAT)));
        bridge.close();
    }
}
