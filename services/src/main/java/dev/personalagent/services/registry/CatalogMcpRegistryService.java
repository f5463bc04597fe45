package dev.personalagent.services.registry;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.config.ApplicationMode;
import dev.personalagent.core.domain.McpRegistryEntry;
import dev.personalagent.core.domain.McpRegistrySource;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.McpRegistryService;
import dev.personalagent.core.service.SecretsService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * MCP server registry merging several registries; each entry names the
 * registry it came from. The official registry is downloaded and cached on
 * disk for a day, the {@code mcp-registry.json} bundled on the classpath
 * fills in what the download lacks and stands in when it fails. Searches
 * scoped to Smithery go to the Smithery API whenever an API key is stored.
 */
@Singleton
public class CatalogMcpRegistryService extends AbstractAsyncService implements McpRegistryService {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogMcpRegistryService.class);

    public static final String DEFAULT_CATALOGUE = "mcp-registry.json";
    public static final String CACHE_FILE = "mcp-registry.json";
    public static final String SMITHERY_API_KEY = "smithery.api-key";

    private static final Comparator<McpRegistryEntry> MOST_POPULAR =
            Comparator.comparingInt(McpRegistryEntry::popularity).reversed()
                    .thenComparing(McpRegistryEntry::name);

    record Catalogue(List<McpRegistryEntry> entries) {
    }

    private final CatalogSource bundled;
    private final RemoteCatalogue<List<McpRegistryEntry>> remote;
    private final RegistryCache<Catalogue> cache;
    private final SmitheryMcpRegistry smithery;
    private final SecretsService secrets;
    private volatile List<McpRegistryEntry> entries;
    private volatile Instant lastRefresh;

    @Inject
    public CatalogMcpRegistryService(EventBus eventBus, @Named(EXECUTOR) Executor executor,
                                     AppDirectories directories, ApplicationMode mode, SecretsService secrets) {
        this(eventBus, executor, CatalogSource.classpath(DEFAULT_CATALOGUE),
                mode.isOffline() ? null : new OfficialMcpRegistry(new HttpJsonClient()),
                new RegistryCache<>(directories.cache().resolve(CACHE_FILE), RegistryCache.DEFAULT_TTL,
                        Catalogue.class),
                mode.isOffline() ? null : new SmitheryMcpRegistry(new HttpJsonClient()),
                secrets);
    }

    /** Reads only the given catalogue, without network or disk cache. */
    public CatalogMcpRegistryService(EventBus eventBus, Executor executor, CatalogSource source) {
        this(eventBus, executor, source, null, null, null, null);
    }

    CatalogMcpRegistryService(EventBus eventBus, Executor executor, CatalogSource bundled,
                              RemoteCatalogue<List<McpRegistryEntry>> remote, RegistryCache<Catalogue> cache,
                              SmitheryMcpRegistry smithery, SecretsService secrets) {
        super(eventBus, executor);
        this.bundled = bundled;
        this.remote = remote;
        this.cache = cache;
        this.smithery = smithery;
        this.secrets = secrets;
    }

    /**
     * Entries matching {@code query} from the given registry, or from all
     * registries for {@link McpRegistrySource#all()}, most popular first.
     */
    @Override
    public CompletableFuture<List<McpRegistryEntry>> search(String query, McpRegistrySource registry) {
        if (smithery == null || secrets == null || registry == null
                || !SmitheryMcpRegistry.REGISTRY.equalsIgnoreCase(registry.name())) {
            return async(() -> searchCatalogue(query, registry));
        }
        return secrets.get(SMITHERY_API_KEY)
                .exceptionally(e -> {
                    LOG.warn("Could not read the Smithery API key: {}", e.getMessage());
                    return Optional.empty();
                })
                .thenCompose(key -> async(() -> key.isPresent()
                        ? searchSmithery(query, key.get(), registry)
                        : searchCatalogue(query, registry)));
    }

    @Override
    public CompletableFuture<Optional<McpRegistryEntry>> getDetails(String name) {
        return async(() -> current().stream()
                .filter(entry -> entry.name().equals(name))
                .findFirst());
    }

    @Override
    public CompletableFuture<List<McpRegistryEntry>> listAll() {
        return async(this::current);
    }

    @Override
    public CompletableFuture<List<McpRegistryEntry>> listByTag(String tag) {
        return async(() -> current().stream()
                .filter(entry -> entry.tags().stream().anyMatch(t -> t.equalsIgnoreCase(tag)))
                .sorted(MOST_POPULAR)
                .toList());
    }

    @Override
    public CompletableFuture<List<McpRegistryEntry>> listTrending(int limit) {
        return async(() -> current().stream()
                .sorted(MOST_POPULAR)
                .limit(Math.max(0, limit))
                .toList());
    }

    /** Downloads the official registry again, whatever the cache holds. */
    @Override
    public CompletableFuture<Void> refresh() {
        return run(() -> entries = load(true));
    }

    @Override
    public Optional<Instant> getLastRefresh() {
        return Optional.ofNullable(lastRefresh);
    }

    private List<McpRegistryEntry> searchCatalogue(String query, McpRegistrySource registry) throws ServiceException {
        return current().stream()
                .filter(entry -> registry == null || registry.matchesAll()
                        || registry.name().equalsIgnoreCase(entry.registry()))
                .filter(entry -> entry.matches(query))
                .sorted(MOST_POPULAR)
                .toList();
    }

    private List<McpRegistryEntry> searchSmithery(String query, String apiKey, McpRegistrySource registry)
            throws ServiceException {
        try {
            return smithery.search(query, apiKey).stream().sorted(MOST_POPULAR).toList();
        } catch (IOException e) {
            LOG.warn("Smithery search failed, using the catalogue: {}", e.getMessage());
            return searchCatalogue(query, registry);
        }
    }

    private List<McpRegistryEntry> current() throws ServiceException {
        List<McpRegistryEntry> current = entries;
        if (current == null) {
            synchronized (this) {
                if (entries == null) {
                    entries = load(false);
                }
                current = entries;
            }
        }
        return current;
    }

    private List<McpRegistryEntry> load(boolean preferRemote) throws ServiceException {
        List<McpRegistryEntry> downloaded = null;
        if (!preferRemote && cache != null) {
            downloaded = cache.readFresh().map(Catalogue::entries).orElse(null);
        }
        if (downloaded == null && remote != null) {
            try {
                downloaded = remote.fetch();
                if (cache != null) {
                    cache.write(new Catalogue(downloaded));
                }
            } catch (IOException e) {
                LOG.warn("Could not download the MCP registry, falling back: {}", e.getMessage());
            }
        }
        if (downloaded == null && cache != null) {
            downloaded = cache.readAny().map(Catalogue::entries).orElse(null);
        }

        List<McpRegistryEntry> loaded;
        if (downloaded == null) {
            loaded = readBundled();
        } else {
            List<McpRegistryEntry> extra;
            try {
                extra = readBundled();
            } catch (ServiceException e) {
                LOG.warn("Bundled MCP registry unavailable: {}", e.getMessage());
                extra = List.of();
            }
            loaded = merge(downloaded, extra);
        }
        lastRefresh = Instant.now();
        LOG.info("MCP registry loaded: {} entries", loaded.size());
        return loaded;
    }

    private List<McpRegistryEntry> readBundled() throws ServiceException {
        Catalogue catalogue;
        try (InputStream in = bundled.open()) {
            catalogue = JsonSupport.MAPPER.readValue(in, Catalogue.class);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.IO,
                    "Could not read MCP registry: " + e.getMessage(), e);
        }
        return catalogue.entries() == null ? List.of() : List.copyOf(catalogue.entries());
    }

    /** Downloaded entries win over bundled ones of the same name. */
    static List<McpRegistryEntry> merge(List<McpRegistryEntry> downloaded, List<McpRegistryEntry> bundled) {
        List<McpRegistryEntry> merged = new ArrayList<>(downloaded);
        Set<String> names = new HashSet<>();
        downloaded.forEach(entry -> names.add(entry.name()));
        for (McpRegistryEntry entry : bundled) {
            if (names.add(entry.name())) {
                merged.add(entry);
            }
        }
        return List.copyOf(merged);
    }
}
