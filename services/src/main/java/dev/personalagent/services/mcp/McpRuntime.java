package dev.personalagent.services.mcp;

import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.ToolInfo;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Starts and stops MCP server processes.
 */
public interface McpRuntime extends AutoCloseable {

    /**
     * Starts the server and performs the protocol handshake.
     *
     * @return the tools the server offers
     * @throws IOException if the process cannot be started or does not answer
     */
    List<ToolInfo> start(McpConfig config) throws IOException;

    void stop(UUID id);

    boolean isRunning(UUID id);

    /** Stops every running server. */
    @Override
    void close();
}
