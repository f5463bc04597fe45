package dev.personalagent.core.domain;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    @Test
    void create_blankTitle_shouldUseDefaultTitle() {
        var conversation = Conversation.create("  ", UUID.randomUUID());
        assertEquals(Conversation.DEFAULT_TITLE, conversation.title());
        assertTrue(conversation.messages().isEmpty());
    }

    @Test
    void withMessage_shouldAppendWithoutMutatingOriginal() {
        var conversation = Conversation.create("Plans", null);
        var message = Message.user("hi");

        var next = conversation.withMessage(message);

        assertEquals(0, conversation.messages().size());
        assertEquals(1, next.messages().size());
        assertEquals(message.timestamp(), next.updatedAt());
        assertEquals(1, next.toSummary().messageCount());
    }

    @Test
    void messages_shouldBeImmutable() {
        var conversation = Conversation.create("Plans", null).withMessage(Message.user("hi"));
        assertThrows(UnsupportedOperationException.class, () -> conversation.messages().clear());
    }
}
