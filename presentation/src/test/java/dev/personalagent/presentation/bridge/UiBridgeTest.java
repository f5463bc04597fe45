package dev.personalagent.presentation.bridge;

import dev.personalagent.core.event.UserEvent;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UiBridgeTest {

    private final BridgeChannel<UserEvent> userEvents = new BridgeChannel<>(2);
    private final BridgeChannel<ViewCommand> viewCommands = new BridgeChannel<>(8);
    private final UiBridge bridge = new UiBridge(userEvents, viewCommands);

    @Test
    void emit_shouldReturnFalseOnceChannelIsFull() {
        assertTrue(bridge.emit(new UserEvent.NewConversation()));
        assertTrue(bridge.emit(new UserEvent.ToggleThinking()));
        assertFalse(bridge.emit(new UserEvent.StopStreaming()));

        assertEquals(List.of(new UserEvent.NewConversation(), new UserEvent.ToggleThinking()), userEvents.drain());
    }

    @Test
    void emit_afterClose_shouldReturnFalse() {
        bridge.close();
        assertFalse(bridge.emit(new UserEvent.NewConversation()));
    }

    @Test
    void drainCommands_shouldReturnFifoAndEmptyAfterwards() {
        assertFalse(bridge.hasPendingCommands());
        assertTrue(bridge.drainCommands().isEmpty());

        viewCommands.trySend(new ViewCommand.ShowThinking(null));
        viewCommands.trySend(new ViewCommand.HideThinking(null));

        assertTrue(bridge.hasPendingCommands());
        assertEquals(List.of(new ViewCommand.ShowThinking(null), new ViewCommand.HideThinking(null)),
                bridge.drainCommands());
        assertFalse(bridge.hasPendingCommands());
    }
}
