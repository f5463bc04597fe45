package dev.personalagent.core.event;

import java.util.List;
import java.util.UUID;

/**
 * MCP server lifecycle as reported by the MCP service.
 */
public interface McpEvent extends AppEvent {

    record Starting(UUID id, String name) implements McpEvent {
    }

    record Started(UUID id, String name, List<String> tools, int toolCount) implements McpEvent {
        public Started {
            tools = List.copyOf(tools);
        }
    }

    record StartFailed(UUID id, String name, String error) implements McpEvent {
    }

    record Stopped(UUID id, String name) implements McpEvent {
    }

    record Unhealthy(UUID id, String name, String error) implements McpEvent {
    }

    record Recovered(UUID id, String name) implements McpEvent {
    }

    record Restarting(UUID id, String name) implements McpEvent {
    }

    record ToolCalled(UUID mcpId, String toolName, String toolCallId) implements McpEvent {
    }

    record ToolCompleted(UUID mcpId, String toolName, String toolCallId, boolean success,
            long durationMs) implements McpEvent {
    }

    record ConfigSaved(UUID id) implements McpEvent {
    }

    record Deleted(UUID id, String name) implements McpEvent {
    }
}
