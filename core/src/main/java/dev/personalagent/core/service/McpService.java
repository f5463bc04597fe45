package dev.personalagent.core.service;

import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpStatus;
import dev.personalagent.core.domain.ToolInfo;

import java.net.URI;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Configured MCP servers and their runtime state. Implementations publish
 * {@link dev.personalagent.core.event.McpEvent}s.
 */
public interface McpService {

    CompletableFuture<List<McpConfig>> list();

    CompletableFuture<McpConfig> get(UUID id);

    CompletableFuture<McpStatus> getStatus(UUID id);

    /**
     * Starts or stops the server and persists the flag. A failed start is
     * reported as {@link dev.personalagent.core.event.McpEvent.StartFailed};
     * the returned future still completes normally.
     */
    CompletableFuture<Void> setEnabled(UUID id, boolean enabled);

    CompletableFuture<McpConfig> add(McpConfig config);

    CompletableFuture<McpConfig> update(McpConfig config);

    CompletableFuture<Void> delete(UUID id);

    CompletableFuture<Void> restart(UUID id);

    CompletableFuture<List<ToolInfo>> getAvailableTools();

    /**
     * Returns the authorization URL the user has to open to connect the
     * server with {@code provider}.
     */
    CompletableFuture<URI> beginOAuth(UUID id, String provider);
}
