package dev.personalagent.services.mcp;

import com.google.inject.Singleton;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.ToolInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline mode: servers "run" without a process and offer no tools.
 */
@Singleton
public class OfflineMcpRuntime implements McpRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineMcpRuntime.class);

    private final Set<UUID> running = ConcurrentHashMap.newKeySet();

    @Override
    public List<ToolInfo> start(McpConfig config) {
        LOG.info("Offline mode: pretending to start MCP server '{}'", config.name());
        running.add(config.id());
        return List.of();
    }

    @Override
    public void stop(UUID id) {
        running.remove(id);
    }

    @Override
    public boolean isRunning(UUID id) {
        return running.contains(id);
    }

    @Override
    public void close() {
        running.clear();
    }
}
