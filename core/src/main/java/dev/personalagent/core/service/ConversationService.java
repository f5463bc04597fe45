package dev.personalagent.core.service;

import dev.personalagent.core.domain.Conversation;
import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.core.domain.Message;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Conversation store. Implementations publish the matching
 * {@link dev.personalagent.core.event.ConversationEvent}s.
 */
public interface ConversationService {

    /** {@code title} may be {@code null} for the default title. */
    CompletableFuture<Conversation> create(String title, UUID profileId);

    CompletableFuture<Conversation> load(UUID id);

    /** Most recently updated first. */
    CompletableFuture<List<ConversationSummary>> list(int limit, int offset);

    CompletableFuture<Message> addUserMessage(UUID conversationId, String content);

    CompletableFuture<Message> addAssistantMessage(UUID conversationId, String content, String thinking);

    CompletableFuture<Conversation> rename(UUID id, String title);

    CompletableFuture<Void> delete(UUID id);

    CompletableFuture<Void> setActive(UUID id);

    CompletableFuture<Optional<Conversation>> getActive();

    CompletableFuture<List<Message>> getMessages(UUID conversationId);
}
