package dev.personalagent.core.domain;

import java.util.UUID;

/**
 * A tool exposed by a running MCP server.
 */
public record ToolInfo(String name, String description, UUID mcpId) {
}
