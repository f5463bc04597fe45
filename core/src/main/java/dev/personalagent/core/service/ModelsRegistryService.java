package dev.personalagent.core.service;

import dev.personalagent.core.domain.ModelInfo;
import dev.personalagent.core.domain.ProviderInfo;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Catalogue of known providers and their models. {@link #refresh()} publishes
 * {@link dev.personalagent.core.event.SystemEvent.ModelsRegistryRefreshed} or
 * {@link dev.personalagent.core.event.SystemEvent.ModelsRegistryRefreshFailed}.
 */
public interface ModelsRegistryService {

    CompletableFuture<Void> refresh();

    CompletableFuture<Optional<ModelInfo>> getModel(String providerId, String modelId);

    CompletableFuture<Optional<ProviderInfo>> getProvider(String providerId);

    CompletableFuture<List<ProviderInfo>> listProviders();

    CompletableFuture<List<ModelInfo>> listAll();

    CompletableFuture<List<ModelInfo>> listByProvider(String providerId);

    CompletableFuture<List<ModelInfo>> search(String query);

    Optional<Instant> getLastRefresh();
}
