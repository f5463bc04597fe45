package dev.personalagent.services.mcp;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpStatus;
import dev.personalagent.core.domain.ToolInfo;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.service.McpService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonDirectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * MCP server configurations stored as JSON files under {@code mcp/}, with
 * processes managed through an {@link McpRuntime}.
 *
 * <p>
 * Start failures are reported as {@link McpEvent.StartFailed} only; the
 * future of the call that triggered the start still completes normally.
 */
@Singleton
public class JsonMcpService extends AbstractAsyncService implements McpService, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(JsonMcpService.class);

    private final JsonDirectoryStore<McpConfig> store;
    private final McpRuntime runtime;
    private final OAuthUrlBuilder oauth = new OAuthUrlBuilder();
    private final Map<UUID, McpStatus> statuses = new ConcurrentHashMap<>();
    private final Map<UUID, List<ToolInfo>> tools = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    // Guarded by lock
    private Map<UUID, McpConfig> cache;

    @Inject
    public JsonMcpService(EventBus eventBus, @Named(EXECUTOR) Executor executor, AppDirectories directories,
            McpRuntime runtime) {
        this(eventBus, executor, directories.mcpServers(), runtime);
    }

    public JsonMcpService(EventBus eventBus, Executor executor, Path directory, McpRuntime runtime) {
        super(eventBus, executor);
        this.store = new JsonDirectoryStore<>(directory, McpConfig.class);
        this.runtime = runtime;
    }

    @Override
    public CompletableFuture<List<McpConfig>> list() {
        return async(() -> {
            synchronized (lock) {
                return new ArrayList<>(configs().values());
            }
        });
    }

    @Override
    public CompletableFuture<McpConfig> get(UUID id) {
        return async(() -> {
            synchronized (lock) {
                return require(id);
            }
        });
    }

    @Override
    public CompletableFuture<McpStatus> getStatus(UUID id) {
        return async(() -> {
            synchronized (lock) {
                require(id);
            }
            return statuses.getOrDefault(id, McpStatus.STOPPED);
        });
    }

    @Override
    public CompletableFuture<Void> setEnabled(UUID id, boolean enabled) {
        return run(() -> {
            McpConfig updated;
            synchronized (lock) {
                updated = require(id).withEnabled(enabled);
                persist(updated);
            }
            if (enabled) {
                startServer(updated);
            } else {
                stopServer(updated);
            }
        });
    }

    @Override
    public CompletableFuture<McpConfig> add(McpConfig config) {
        return async(() -> {
            validate(config);
            synchronized (lock) {
                if (configs().containsKey(config.id())) {
                    throw ServiceException.validation("MCP server already exists: " + config.id());
                }
                persist(config);
            }
            LOG.info("Added MCP server '{}' from {}", config.name(), config.source());
            if (config.enabled()) {
                startServer(config);
            }
            return config;
        });
    }

    @Override
    public CompletableFuture<McpConfig> update(McpConfig config) {
        return async(() -> {
            validate(config);
            synchronized (lock) {
                require(config.id());
                persist(config);
            }
            publish(new McpEvent.ConfigSaved(config.id()));
            boolean running = runtime.isRunning(config.id());
            if (config.enabled()) {
                if (running) {
                    publish(new McpEvent.Restarting(config.id(), config.name()));
                }
                startServer(config);
            } else if (running) {
                stopServer(config);
            }
            return config;
        });
    }

    @Override
    public CompletableFuture<Void> delete(UUID id) {
        return run(() -> {
            McpConfig removed;
            synchronized (lock) {
                removed = require(id);
                store.delete(id);
                configs().remove(id);
            }
            runtime.stop(id);
            statuses.remove(id);
            tools.remove(id);
            oauth.forget(id);
            LOG.info("Deleted MCP server '{}'", removed.name());
            publish(new McpEvent.Deleted(id, removed.name()));
        });
    }

    @Override
    public CompletableFuture<Void> restart(UUID id) {
        return run(() -> {
            McpConfig config;
            synchronized (lock) {
                config = require(id);
            }
            publish(new McpEvent.Restarting(id, config.name()));
            startServer(config);
        });
    }

    @Override
    public CompletableFuture<List<ToolInfo>> getAvailableTools() {
        return async(() -> {
            List<ToolInfo> available = new ArrayList<>();
            tools.forEach((id, serverTools) -> {
                if (statuses.get(id) == McpStatus.RUNNING) {
                    available.addAll(serverTools);
                }
            });
            return available;
        });
    }

    @Override
    public CompletableFuture<URI> beginOAuth(UUID id, String provider) {
        return async(() -> {
            McpConfig config;
            synchronized (lock) {
                config = require(id);
            }
            URI uri = oauth.build(config, provider);
            LOG.info("Authorization for MCP server '{}' via {} started", config.name(), provider);
            return uri;
        });
    }

    /**
     * Starts every enabled server. Called once at application startup.
     */
    public CompletableFuture<Void> startEnabled() {
        return run(() -> {
            List<McpConfig> enabled;
            synchronized (lock) {
                enabled = configs().values().stream().filter(McpConfig::enabled).toList();
            }
            LOG.info("Starting {} enabled MCP server(s)", enabled.size());
            for (McpConfig config : enabled) {
                startServer(config);
            }
        });
    }

    @Override
    public void close() {
        runtime.close();
    }

    // -- Lifecycle --

    private void startServer(McpConfig config) {
        statuses.put(config.id(), McpStatus.STARTING);
        publish(new McpEvent.Starting(config.id(), config.name()));
        try {
            List<ToolInfo> offered = runtime.start(config);
            tools.put(config.id(), List.copyOf(offered));
            statuses.put(config.id(), McpStatus.RUNNING);
            List<String> names = offered.stream().map(ToolInfo::name).toList();
            publish(new McpEvent.Started(config.id(), config.name(), names, names.size()));
        } catch (IOException e) {
            LOG.warn("MCP server '{}' failed to start: {}", config.name(), e.getMessage());
            tools.remove(config.id());
            statuses.put(config.id(), McpStatus.FAILED);
            publish(new McpEvent.StartFailed(config.id(), config.name(), e.getMessage()));
        }
    }

    private void stopServer(McpConfig config) {
        runtime.stop(config.id());
        tools.remove(config.id());
        statuses.put(config.id(), McpStatus.STOPPED);
        publish(new McpEvent.Stopped(config.id(), config.name()));
    }

    // -- Storage --

    private static void validate(McpConfig config) throws ServiceException {
        if (config.name() == null || config.name().isBlank()) {
            throw ServiceException.validation("MCP server name must not be empty");
        }
        if (config.command() == null || config.command().isBlank()) {
            throw ServiceException.validation("MCP server command must not be empty");
        }
    }

    private void persist(McpConfig config) throws ServiceException {
        store.save(config.id(), config);
        configs().put(config.id(), config);
    }

    private McpConfig require(UUID id) throws ServiceException {
        McpConfig config = configs().get(id);
        if (config == null) {
            throw ServiceException.notFound("MCP server", id);
        }
        return config;
    }

    private Map<UUID, McpConfig> configs() throws ServiceException {
        if (cache == null) {
            Map<UUID, McpConfig> loaded = new LinkedHashMap<>();
            for (McpConfig config : store.loadAll()) {
                loaded.put(config.id(), config);
            }
            cache = loaded;
            LOG.info("Loaded {} MCP server config(s) from {}", loaded.size(), store.directory());
        }
        return cache;
    }
}
