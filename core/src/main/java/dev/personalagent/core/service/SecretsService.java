package dev.personalagent.core.service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Key/value store for credentials. API keys are stored under a key derived
 * from the profile id.
 */
public interface SecretsService {

    CompletableFuture<Void> store(String key, String value);

    CompletableFuture<Optional<String>> get(String key);

    CompletableFuture<Void> delete(String key);

    CompletableFuture<List<String>> listKeys();

    CompletableFuture<Boolean> exists(String key);

    CompletableFuture<Void> storeApiKey(UUID profileId, String apiKey);

    CompletableFuture<Optional<String>> getApiKey(UUID profileId);

    CompletableFuture<Void> deleteApiKey(UUID profileId);

    static String apiKeyName(UUID profileId) {
        return "api_key:" + profileId;
    }
}
