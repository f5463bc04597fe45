package dev.personalagent.services.registry;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.config.ApplicationMode;
import dev.personalagent.core.domain.ModelInfo;
import dev.personalagent.core.domain.ProviderInfo;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.service.ModelsRegistryService;
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
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Providers and models from models.dev. The downloaded catalogue is cached
 * on disk for a day; when neither the network nor the cache can provide one,
 * the {@code models.json} bundled on the classpath is used. A refresh always
 * tries the network first.
 */
@Singleton
public class CatalogModelsRegistryService extends AbstractAsyncService implements ModelsRegistryService {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogModelsRegistryService.class);

    public static final String DEFAULT_CATALOGUE = "models.json";

    record Catalogue(List<ProviderEntry> providers) {
    }

    record ProviderEntry(String id, String name, String api, List<ModelEntry> models) {
    }

    record ModelEntry(String id, String name, Integer contextLength) {
    }

    private record Snapshot(List<ProviderInfo> providers, List<ModelInfo> models, Instant loadedAt) {
    }

    public static final String CACHE_FILE = "models.json";

    private final CatalogSource bundled;
    private final RemoteCatalogue<Catalogue> remote;
    private final RegistryCache<Catalogue> cache;
    private volatile Snapshot snapshot;

    @Inject
    public CatalogModelsRegistryService(EventBus eventBus, @Named(EXECUTOR) Executor executor,
                                        AppDirectories directories, ApplicationMode mode) {
        this(eventBus, executor, CatalogSource.classpath(DEFAULT_CATALOGUE),
                mode.isOffline() ? null : new ModelsDevCatalogue(new HttpJsonClient()),
                new RegistryCache<>(directories.cache().resolve(CACHE_FILE), RegistryCache.DEFAULT_TTL,
                        Catalogue.class));
    }

    /** Reads only the given catalogue, without network or disk cache. */
    public CatalogModelsRegistryService(EventBus eventBus, Executor executor, CatalogSource source) {
        this(eventBus, executor, source, null, null);
    }

    CatalogModelsRegistryService(EventBus eventBus, Executor executor, CatalogSource bundled,
                                 RemoteCatalogue<Catalogue> remote, RegistryCache<Catalogue> cache) {
        super(eventBus, executor);
        this.bundled = bundled;
        this.remote = remote;
        this.cache = cache;
    }

    @Override
    public CompletableFuture<Void> refresh() {
        return run(() -> {
            try {
                Snapshot loaded = load(true);
                snapshot = loaded;
                publish(new SystemEvent.ModelsRegistryRefreshed(loaded.providers().size(), loaded.models().size()));
            } catch (ServiceException e) {
                publish(new SystemEvent.ModelsRegistryRefreshFailed(e.getMessage()));
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<Optional<ModelInfo>> getModel(String providerId, String modelId) {
        return async(() -> current().models().stream()
                .filter(model -> model.providerId().equals(providerId) && model.modelId().equals(modelId))
                .findFirst());
    }

    @Override
    public CompletableFuture<Optional<ProviderInfo>> getProvider(String providerId) {
        return async(() -> current().providers().stream()
                .filter(provider -> provider.id().equals(providerId))
                .findFirst());
    }

    @Override
    public CompletableFuture<List<ProviderInfo>> listProviders() {
        return async(() -> current().providers());
    }

    @Override
    public CompletableFuture<List<ModelInfo>> listAll() {
        return async(() -> current().models());
    }

    @Override
    public CompletableFuture<List<ModelInfo>> listByProvider(String providerId) {
        return async(() -> current().models().stream()
                .filter(model -> model.providerId().equals(providerId))
                .toList());
    }

    /**
     * Case-insensitive match on model id, display name and provider id.
     */
    @Override
    public CompletableFuture<List<ModelInfo>> search(String query) {
        return async(() -> {
            String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
            return current().models().stream()
                    .filter(model -> q.isEmpty()
                            || model.modelId().toLowerCase(Locale.ROOT).contains(q)
                            || (model.name() != null && model.name().toLowerCase(Locale.ROOT).contains(q))
                            || model.providerId().toLowerCase(Locale.ROOT).contains(q))
                    .toList();
        });
    }

    @Override
    public Optional<Instant> getLastRefresh() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.of(current.loadedAt());
    }

    // -- Internal --

    private Snapshot current() throws ServiceException {
        Snapshot current = snapshot;
        if (current == null) {
            synchronized (this) {
                if (snapshot == null) {
                    snapshot = load(false);
                }
                current = snapshot;
            }
        }
        return current;
    }

    private Snapshot load(boolean preferRemote) throws ServiceException {
        Catalogue catalogue = null;
        if (!preferRemote && cache != null) {
            catalogue = cache.readFresh().orElse(null);
        }
        if (catalogue == null && remote != null) {
            try {
                catalogue = remote.fetch();
                if (cache != null) {
                    cache.write(catalogue);
                }
            } catch (IOException e) {
                LOG.warn("Could not download models catalogue, falling back: {}", e.getMessage());
            }
        }
        if (catalogue == null && cache != null) {
            catalogue = cache.readAny().orElse(null);
        }
        if (catalogue == null) {
            catalogue = readBundled();
        }
        return toSnapshot(catalogue);
    }

    private Catalogue readBundled() throws ServiceException {
        try (InputStream in = bundled.open()) {
            return JsonSupport.MAPPER.readValue(in, Catalogue.class);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.IO,
                    "Could not read models catalogue: " + e.getMessage(), e);
        }
    }

    private static Snapshot toSnapshot(Catalogue catalogue) {
        List<ProviderInfo> providers = new ArrayList<>();
        List<ModelInfo> models = new ArrayList<>();
        for (ProviderEntry provider : catalogue.providers() == null ? List.<ProviderEntry>of() : catalogue.providers()) {
            List<ModelEntry> entries = provider.models() == null ? List.of() : provider.models();
            providers.add(new ProviderInfo(provider.id(), provider.name(), provider.api(), entries.size()));
            for (ModelEntry entry : entries) {
                models.add(new ModelInfo(provider.id(), entry.id(), entry.name(), entry.contextLength()));
            }
        }
        LOG.info("Models catalogue loaded: {} providers, {} models", providers.size(), models.size());
        return new Snapshot(List.copyOf(providers), List.copyOf(models), Instant.now());
    }
}
