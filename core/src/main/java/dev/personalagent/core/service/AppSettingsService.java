package dev.personalagent.core.service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Small persisted user preferences.
 */
public interface AppSettingsService {

    String DEFAULT_HOTKEY = "Cmd+Shift+Space";
    String DEFAULT_THEME = "dark";

    CompletableFuture<Optional<UUID>> getDefaultProfileId();

    CompletableFuture<Void> setDefaultProfileId(UUID id);

    CompletableFuture<Optional<UUID>> getCurrentConversationId();

    CompletableFuture<Void> setCurrentConversationId(UUID id);

    CompletableFuture<String> getHotkey();

    CompletableFuture<Void> setHotkey(String hotkey);

    CompletableFuture<String> getTheme();

    CompletableFuture<Void> setTheme(String theme);

    CompletableFuture<Optional<String>> getSetting(String key);

    CompletableFuture<Void> setSetting(String key, String value);

    CompletableFuture<Void> resetToDefaults();
}
