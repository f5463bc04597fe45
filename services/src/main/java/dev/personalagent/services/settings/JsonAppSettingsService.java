package dev.personalagent.services.settings;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.service.AppSettingsService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonKeyValueFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Application settings in {@code settings.json}. Every change is written
 * through immediately. User-facing changes (hotkey, theme, generic keys,
 * reset) publish {@link SystemEvent.ConfigSaved}; bookkeeping ids do not.
 */
@Singleton
public class JsonAppSettingsService extends AbstractAsyncService implements AppSettingsService {

    private static final Logger LOG = LoggerFactory.getLogger(JsonAppSettingsService.class);

    static final String DEFAULT_PROFILE_ID = "default_profile_id";
    static final String CURRENT_CONVERSATION_ID = "current_conversation_id";
    static final String HOTKEY = "hotkey";
    static final String THEME = "theme";

    private final JsonKeyValueFile file;
    private final Object lock = new Object();

    // Guarded by lock
    private Map<String, String> values;

    @Inject
    public JsonAppSettingsService(EventBus eventBus, @Named(EXECUTOR) Executor executor, AppDirectories directories) {
        this(eventBus, executor, directories.settingsFile());
    }

    public JsonAppSettingsService(EventBus eventBus, Executor executor, Path settingsFile) {
        super(eventBus, executor);
        this.file = new JsonKeyValueFile(settingsFile);
    }

    @Override
    public CompletableFuture<Optional<UUID>> getDefaultProfileId() {
        return async(() -> readId(DEFAULT_PROFILE_ID));
    }

    @Override
    public CompletableFuture<Void> setDefaultProfileId(UUID id) {
        return run(() -> write(DEFAULT_PROFILE_ID, id == null ? null : id.toString()));
    }

    @Override
    public CompletableFuture<Optional<UUID>> getCurrentConversationId() {
        return async(() -> readId(CURRENT_CONVERSATION_ID));
    }

    @Override
    public CompletableFuture<Void> setCurrentConversationId(UUID id) {
        return run(() -> write(CURRENT_CONVERSATION_ID, id == null ? null : id.toString()));
    }

    @Override
    public CompletableFuture<String> getHotkey() {
        return async(() -> read(HOTKEY).orElse(DEFAULT_HOTKEY));
    }

    @Override
    public CompletableFuture<Void> setHotkey(String hotkey) {
        return run(() -> {
            if (hotkey == null || hotkey.isBlank()) {
                throw ServiceException.validation("Hotkey must not be empty");
            }
            write(HOTKEY, hotkey.trim());
            publish(new SystemEvent.HotkeyChanged(hotkey.trim()));
            publish(new SystemEvent.ConfigSaved());
        });
    }

    @Override
    public CompletableFuture<String> getTheme() {
        return async(() -> read(THEME).orElse(DEFAULT_THEME));
    }

    @Override
    public CompletableFuture<Void> setTheme(String theme) {
        return run(() -> {
            write(THEME, theme);
            publish(new SystemEvent.ConfigSaved());
        });
    }

    @Override
    public CompletableFuture<Optional<String>> getSetting(String key) {
        return async(() -> read(key));
    }

    @Override
    public CompletableFuture<Void> setSetting(String key, String value) {
        return run(() -> {
            write(key, value);
            publish(new SystemEvent.ConfigSaved());
        });
    }

    @Override
    public CompletableFuture<Void> resetToDefaults() {
        return run(() -> {
            synchronized (lock) {
                values().clear();
                file.write(values());
            }
            LOG.info("Settings reset to defaults");
            publish(new SystemEvent.ConfigSaved());
        });
    }

    // -- Internal --

    private Optional<String> read(String key) throws ServiceException {
        synchronized (lock) {
            return Optional.ofNullable(values().get(key));
        }
    }

    private Optional<UUID> readId(String key) throws ServiceException {
        Optional<String> raw = read(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.get()));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring malformed {} '{}'", key, raw.get());
            return Optional.empty();
        }
    }

    /** A {@code null} value removes the key. */
    private void write(String key, String value) throws ServiceException {
        synchronized (lock) {
            if (value == null) {
                values().remove(key);
            } else {
                values().put(key, value);
            }
            file.write(values());
        }
    }

    private Map<String, String> values() throws ServiceException {
        if (values == null) {
            values = file.read();
            LOG.info("Loaded {} setting(s) from {}", values.size(), file.file());
            publish(new SystemEvent.ConfigLoaded());
        }
        return values;
    }
}
