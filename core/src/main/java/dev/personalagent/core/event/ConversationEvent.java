package dev.personalagent.core.event;

import java.util.UUID;

/**
 * Conversation store changes published by the conversation service.
 */
public interface ConversationEvent extends AppEvent {

    record Created(UUID id, String title) implements ConversationEvent {
    }

    record Loaded(UUID id) implements ConversationEvent {
    }

    record TitleUpdated(UUID id, String title) implements ConversationEvent {
    }

    record Deleted(UUID id) implements ConversationEvent {
    }

    record Activated(UUID id) implements ConversationEvent {
    }

    record Deactivated() implements ConversationEvent {
    }

    record ListRefreshed(int count) implements ConversationEvent {
    }
}
