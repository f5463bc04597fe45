package dev.personalagent.core.domain;

public enum McpStatus {
    STARTING,
    RUNNING,
    STOPPED,
    FAILED,
    UNHEALTHY
}
