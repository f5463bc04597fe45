package dev.personalagent.core.service;

import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelProfile;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Model profile store. Implementations publish the matching
 * {@link dev.personalagent.core.event.ProfileEvent}s.
 */
public interface ProfileService {

    CompletableFuture<List<ModelProfile>> list();

    CompletableFuture<ModelProfile> get(UUID id);

    /** Fails with {@link ServiceException.Kind#VALIDATION} for invalid profiles. */
    CompletableFuture<ModelProfile> create(ModelProfile profile);

    CompletableFuture<ModelProfile> update(ModelProfile profile);

    CompletableFuture<Void> delete(UUID id);

    /**
     * Probes the profile's endpoint. A failed probe completes normally with an
     * unsuccessful result; only a missing profile fails the future.
     */
    CompletableFuture<ConnectionTestResult> testConnection(UUID id);

    CompletableFuture<Optional<ModelProfile>> getDefault();

    CompletableFuture<Void> setDefault(UUID id);
}
