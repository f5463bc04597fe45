package dev.personalagent.core.domain;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL
}
