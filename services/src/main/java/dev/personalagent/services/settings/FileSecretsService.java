package dev.personalagent.services.settings;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.SecretsService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonKeyValueFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Secrets in {@code secrets.json}, readable only by the owner on POSIX file
 * systems. Values are never logged.
 */
@Singleton
public class FileSecretsService extends AbstractAsyncService implements SecretsService {

    private static final Logger LOG = LoggerFactory.getLogger(FileSecretsService.class);

    private final JsonKeyValueFile file;
    private final Object lock = new Object();

    // Guarded by lock
    private Map<String, String> secrets;

    @Inject
    public FileSecretsService(EventBus eventBus, @Named(EXECUTOR) Executor executor, AppDirectories directories) {
        this(eventBus, executor, directories.secretsFile());
    }

    public FileSecretsService(EventBus eventBus, Executor executor, Path secretsFile) {
        super(eventBus, executor);
        this.file = new JsonKeyValueFile(secretsFile);
    }

    @Override
    public CompletableFuture<Void> store(String key, String value) {
        return run(() -> {
            requireKey(key);
            if (value == null) {
                throw ServiceException.validation("Secret value must not be null");
            }
            synchronized (lock) {
                secrets().put(key, value);
                persist();
            }
            LOG.info("Stored secret '{}'", key);
        });
    }

    @Override
    public CompletableFuture<Optional<String>> get(String key) {
        return async(() -> {
            synchronized (lock) {
                return Optional.ofNullable(secrets().get(key));
            }
        });
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        return run(() -> {
            synchronized (lock) {
                if (secrets().remove(key) != null) {
                    persist();
                    LOG.info("Deleted secret '{}'", key);
                }
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listKeys() {
        return async(() -> {
            synchronized (lock) {
                return new ArrayList<>(secrets().keySet());
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return async(() -> {
            synchronized (lock) {
                return secrets().containsKey(key);
            }
        });
    }

    @Override
    public CompletableFuture<Void> storeApiKey(UUID profileId, String apiKey) {
        return store(SecretsService.apiKeyName(profileId), apiKey);
    }

    @Override
    public CompletableFuture<Optional<String>> getApiKey(UUID profileId) {
        return get(SecretsService.apiKeyName(profileId));
    }

    @Override
    public CompletableFuture<Void> deleteApiKey(UUID profileId) {
        return delete(SecretsService.apiKeyName(profileId));
    }

    // -- Internal --

    private static void requireKey(String key) throws ServiceException {
        if (key == null || key.isBlank()) {
            throw ServiceException.validation("Secret key must not be empty");
        }
    }

    private void persist() throws ServiceException {
        file.write(secrets);
        restrictPermissions(file.file());
    }

    private static void restrictPermissions(Path path) throws ServiceException {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.STORAGE,
                    "Failed to restrict permissions of " + path + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> secrets() throws ServiceException {
        if (secrets == null) {
            secrets = file.read();
            LOG.debug("Loaded {} secret(s)", secrets.size());
        }
        return secrets;
    }
}
