package dev.personalagent.core.domain;

public enum McpAuthType {
    NONE,
    API_KEY,
    OAUTH
}
