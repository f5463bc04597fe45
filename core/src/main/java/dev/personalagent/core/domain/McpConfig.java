package dev.personalagent.core.domain;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A configured MCP server launched as a local process over stdio.
 *
 * @param source where the server came from, e.g. {@code "official: filesystem"}
 *               or {@code "manual"}
 */
public record McpConfig(UUID id, String name, String command, List<String> args, Map<String, String> env,
        boolean enabled, McpAuthType authType, String source) {

    public McpConfig {
        args = List.copyOf(args);
        env = Map.copyOf(env);
    }

    public McpConfig withEnabled(boolean value) {
        return new McpConfig(id, name, command, args, env, value, authType, source);
    }

    public McpConfig withId(UUID newId) {
        return new McpConfig(newId, name, command, args, env, enabled, authType, source);
    }

    public McpConfig withEnv(Map<String, String> newEnv) {
        return new McpConfig(id, name, command, args, newEnv, enabled, authType, source);
    }
}
