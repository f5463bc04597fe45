package dev.personalagent.core.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of a conversation and its messages.
 */
public record Conversation(UUID id, String title, UUID profileId, Instant createdAt, Instant updatedAt,
        List<Message> messages) {

    public static final String DEFAULT_TITLE = "New Conversation";

    public Conversation {
        messages = List.copyOf(messages);
    }

    public static Conversation create(String title, UUID profileId) {
        Instant now = Instant.now();
        String effectiveTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        return new Conversation(UUID.randomUUID(), effectiveTitle, profileId, now, now, List.of());
    }

    public Conversation withMessage(Message message) {
        List<Message> next = new ArrayList<>(messages);
        next.add(message);
        return new Conversation(id, title, profileId, createdAt, message.timestamp(), next);
    }

    public Conversation withTitle(String newTitle) {
        return new Conversation(id, newTitle, profileId, createdAt, Instant.now(), messages);
    }

    public ConversationSummary toSummary() {
        return new ConversationSummary(id, title, updatedAt, messages.size());
    }
}
