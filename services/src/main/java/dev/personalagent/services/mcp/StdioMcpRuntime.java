package dev.personalagent.services.mcp;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.ToolInfo;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs MCP servers as child processes through the MCP Java SDK's stdio
 * transport. Starting a server initializes the client session and lists its
 * tools; the session stays open until the server is stopped.
 */
@Singleton
public class StdioMcpRuntime implements McpRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(StdioMcpRuntime.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final Function<McpConfig, McpSyncClient> clientFactory;
    private final Map<UUID, McpSyncClient> clients = new ConcurrentHashMap<>();

    @Inject
    public StdioMcpRuntime() {
        this(StdioMcpRuntime::buildClient);
    }

    StdioMcpRuntime(Function<McpConfig, McpSyncClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public List<ToolInfo> start(McpConfig config) throws IOException {
        stop(config.id());

        LOG.info("Starting MCP server '{}': {} {}", config.name(), config.command(), String.join(" ", config.args()));
        McpSyncClient client = null;
        try {
            client = clientFactory.apply(config);
            client.initialize();
            List<ToolInfo> tools = toToolInfos(config.id(), client.listTools().tools());
            clients.put(config.id(), client);
            LOG.info("MCP server '{}' ready with {} tool(s)", config.name(), tools.size());
            return tools;
        } catch (RuntimeException e) {
            // The SDK reports spawn failures, timeouts and protocol errors unchecked
            if (client != null) {
                closeQuietly(config.id(), client);
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new IOException("Failed to start MCP server '" + config.name() + "': " + message, e);
        }
    }

    @Override
    public void stop(UUID id) {
        McpSyncClient client = clients.remove(id);
        if (client != null) {
            closeQuietly(id, client);
        }
    }

    @Override
    public boolean isRunning(UUID id) {
        return clients.containsKey(id);
    }

    @Override
    public void close() {
        List.copyOf(clients.keySet()).forEach(this::stop);
    }

    static List<ToolInfo> toToolInfos(UUID mcpId, List<McpSchema.Tool> tools) {
        List<ToolInfo> infos = new ArrayList<>();
        if (tools == null) {
            return infos;
        }
        for (McpSchema.Tool tool : tools) {
            String description = tool.description() != null ? tool.description() : "";
            infos.add(new ToolInfo(tool.name(), description, mcpId));
        }
        return infos;
    }

    private static McpSyncClient buildClient(McpConfig config) {
        ServerParameters params = ServerParameters.builder(config.command())
                .args(config.args())
                .env(config.env())
                .build();
        return McpClient.sync(new StdioClientTransport(params))
                .loggingConsumer(notification -> LOG.debug("MCP server '{}': {}", config.name(), notification))
                .requestTimeout(REQUEST_TIMEOUT)
                .build();
    }

    private static void closeQuietly(UUID id, McpSyncClient client) {
        try {
            client.closeGracefully();
        } catch (RuntimeException e) {
            LOG.warn("MCP server {} did not shut down cleanly: {}", id, e.getMessage());
        }
    }
}
