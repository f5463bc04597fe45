package dev.personalagent.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a conversation. {@code thinking} holds the reasoning text of
 * an assistant reply and is {@code null} otherwise.
 */
public record Message(UUID id, MessageRole role, String content, String thinking, Instant timestamp) {

    public static Message user(String content) {
        return new Message(UUID.randomUUID(), MessageRole.USER, content, null, Instant.now());
    }

    public static Message assistant(String content, String thinking) {
        return new Message(UUID.randomUUID(), MessageRole.ASSISTANT, content, thinking, Instant.now());
    }
}
