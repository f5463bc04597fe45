package dev.personalagent.core.service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Streams assistant replies. Progress is published as
 * {@link dev.personalagent.core.event.ChatEvent}s; the returned future only
 * covers starting the stream.
 *
 * <p>
 * A failed future means the stream never started and no
 * {@code ChatEvent.StreamError} follows for it. Both the user message and the
 * assistant reply are persisted through {@link ConversationService}.
 */
public interface ChatService {

    CompletableFuture<Void> sendMessage(UUID conversationId, String text);

    /** Cancels the running stream, if any. */
    void cancel();

    boolean isStreaming();
}
