package dev.personalagent.core.service;

import dev.personalagent.core.domain.McpRegistryEntry;
import dev.personalagent.core.domain.McpRegistrySource;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Catalogue of installable MCP servers.
 */
public interface McpRegistryService {

    CompletableFuture<List<McpRegistryEntry>> search(String query, McpRegistrySource source);

    CompletableFuture<Optional<McpRegistryEntry>> getDetails(String name);

    CompletableFuture<List<McpRegistryEntry>> listAll();

    CompletableFuture<List<McpRegistryEntry>> listByTag(String tag);

    CompletableFuture<List<McpRegistryEntry>> listTrending(int limit);

    CompletableFuture<Void> refresh();

    Optional<Instant> getLastRefresh();
}
