package dev.personalagent.app.console;

import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.presentation.navigation.NavigationState;
import dev.personalagent.presentation.view.ModalId;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;
    private NavigationState navigation;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        navigation = new NavigationState();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void apply_streamChunks_shouldPrintOnOneLine() {
        UUID id = UUID.randomUUID();

        renderer.apply(new ViewCommand.AppendStream(id, "Hel"), navigation);
        renderer.apply(new ViewCommand.AppendStream(id, "lo"), navigation);
        renderer.apply(new ViewCommand.FinalizeStream(id, 12), navigation);

        assertTrue(output().startsWith("assistant> Hello" + System.lineSeparator()));
        assertTrue(output().contains("[12 tokens]"));
    }

    @Test
    void apply_thinkingHidden_shouldNotPrintReasoning() {
        renderer.apply(new ViewCommand.AppendThinking(UUID.randomUUID(), "pondering"), navigation);

        assertEquals("", output());
    }

    @Test
    void apply_toggleThinking_shouldPrintReasoning() {
        renderer.apply(new ViewCommand.ToggleThinkingVisibility(), navigation);
        renderer.apply(new ViewCommand.AppendThinking(UUID.randomUUID(), "pondering"), navigation);

        assertTrue(output().contains("pondering"));
    }

    @Test
    void conversation_shouldResolveNumbersFromLastList() {
        var a = new ConversationSummary(UUID.randomUUID(), "First", Instant.now(), 2);
        var b = new ConversationSummary(UUID.randomUUID(), "Second", Instant.now(), 0);

        renderer.apply(new ViewCommand.ConversationListRefreshed(List.of(a, b)), navigation);

        assertEquals(b, renderer.conversation(2).orElseThrow());
        assertTrue(renderer.conversation(0).isEmpty());
        assertTrue(renderer.conversation(3).isEmpty());
        assertTrue(output().contains("1. First (2 messages)"));
    }

    @Test
    void apply_showAndDismissModal_shouldTrackOpenModal() {
        var modal = new ModalId(ModalId.Kind.CONFIRM_DELETE_PROFILE, UUID.randomUUID());

        renderer.apply(new ViewCommand.ShowModal(modal), navigation);
        assertEquals(modal, renderer.openModal().orElseThrow());

        renderer.apply(new ViewCommand.DismissModal(), navigation);
        assertTrue(renderer.openModal().isEmpty());
    }

    @Test
    void apply_conversationCreatedThenCleared_shouldTrackCurrentConversation() {
        UUID id = UUID.randomUUID();

        renderer.apply(new ViewCommand.ConversationCreated(id, null), navigation);
        assertEquals(id, renderer.currentConversation().orElseThrow());

        renderer.apply(new ViewCommand.ConversationCleared(), navigation);
        assertTrue(renderer.currentConversation().isEmpty());
    }
}
