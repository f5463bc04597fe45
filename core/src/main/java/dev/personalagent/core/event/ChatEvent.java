package dev.personalagent.core.event;

import java.util.UUID;

/**
 * Progress of a streamed assistant reply, published by the chat service.
 */
public interface ChatEvent extends AppEvent {

    record StreamStarted(UUID conversationId, UUID messageId, String modelId) implements ChatEvent {
    }

    record TextDelta(String text) implements ChatEvent {
    }

    record ThinkingDelta(String text) implements ChatEvent {
    }

    record ToolCallStarted(String toolCallId, String toolName) implements ChatEvent {
    }

    record ToolCallCompleted(String toolCallId, String toolName, boolean success, String result,
            long durationMs) implements ChatEvent {
    }

    /** {@code totalTokens} is {@code null} when the provider does not report usage. */
    record StreamCompleted(UUID conversationId, UUID messageId, Integer totalTokens) implements ChatEvent {
    }

    record StreamCancelled(UUID conversationId, UUID messageId, String partialContent) implements ChatEvent {
    }

    record StreamError(UUID conversationId, String error, boolean recoverable) implements ChatEvent {
    }

    record MessageSaved(UUID conversationId, UUID messageId) implements ChatEvent {
    }
}
