package dev.personalagent.services.profile;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.ProfileEvent;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonDirectoryStore;
import dev.personalagent.services.storage.JsonKeyValueFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Model profiles stored as one JSON file each under {@code profiles/}, with
 * the default profile id kept next to them in {@code default.json}.
 *
 * <p>
 * The first profile created becomes the default. Deleting the default
 * profile leaves no default.
 */
@Singleton
public class JsonProfileService extends AbstractAsyncService implements ProfileService {

    private static final Logger LOG = LoggerFactory.getLogger(JsonProfileService.class);

    private static final String DEFAULT_KEY = "default_profile_id";

    private final JsonDirectoryStore<ModelProfile> store;
    private final JsonKeyValueFile defaultFile;
    private final ConnectionTester tester;
    private final Object lock = new Object();

    // Guarded by lock
    private Map<UUID, ModelProfile> cache;

    @Inject
    public JsonProfileService(EventBus eventBus, @Named(EXECUTOR) Executor executor, AppDirectories directories,
            ConnectionTester tester) {
        this(eventBus, executor, directories.profiles(), tester);
    }

    public JsonProfileService(EventBus eventBus, Executor executor, Path directory, ConnectionTester tester) {
        super(eventBus, executor);
        this.store = new JsonDirectoryStore<>(directory, ModelProfile.class);
        this.defaultFile = new JsonKeyValueFile(directory.resolve("default.json"));
        this.tester = tester;
    }

    @Override
    public CompletableFuture<List<ModelProfile>> list() {
        return async(() -> {
            synchronized (lock) {
                return new ArrayList<>(profiles().values());
            }
        });
    }

    @Override
    public CompletableFuture<ModelProfile> get(UUID id) {
        return async(() -> {
            synchronized (lock) {
                return require(id);
            }
        });
    }

    @Override
    public CompletableFuture<ModelProfile> create(ModelProfile profile) {
        return async(() -> {
            validate(profile);
            boolean becameDefault;
            synchronized (lock) {
                if (profiles().containsKey(profile.id())) {
                    throw ServiceException.validation("Profile already exists: " + profile.id());
                }
                store.save(profile.id(), profile);
                profiles().put(profile.id(), profile);
                becameDefault = readDefaultId().isEmpty();
                if (becameDefault) {
                    writeDefaultId(profile.id());
                }
            }
            LOG.info("Created profile '{}' ({}/{})", profile.name(), profile.providerId(), profile.modelId());
            publish(new ProfileEvent.Created(profile.id(), profile.name()));
            if (becameDefault) {
                publish(new ProfileEvent.DefaultChanged(profile.id()));
            }
            return profile;
        });
    }

    @Override
    public CompletableFuture<ModelProfile> update(ModelProfile profile) {
        return async(() -> {
            synchronized (lock) {
                require(profile.id());
            }
            validate(profile);
            synchronized (lock) {
                store.save(profile.id(), profile);
                profiles().put(profile.id(), profile);
            }
            LOG.info("Updated profile '{}'", profile.name());
            publish(new ProfileEvent.Updated(profile.id(), profile.name()));
            return profile;
        });
    }

    @Override
    public CompletableFuture<Void> delete(UUID id) {
        return run(() -> {
            ModelProfile removed;
            synchronized (lock) {
                removed = require(id);
                store.delete(id);
                profiles().remove(id);
                if (readDefaultId().filter(id::equals).isPresent()) {
                    defaultFile.write(new LinkedHashMap<>());
                }
            }
            LOG.info("Deleted profile '{}'", removed.name());
            publish(new ProfileEvent.Deleted(id, removed.name()));
        });
    }

    @Override
    public CompletableFuture<ConnectionTestResult> testConnection(UUID id) {
        return async(() -> {
            ModelProfile profile;
            synchronized (lock) {
                profile = require(id);
            }
            publish(new ProfileEvent.TestStarted(id));
            ConnectionTestResult result = tester.test(profile);
            publish(new ProfileEvent.TestCompleted(id, result.success(), result.responseTimeMs(), result.error()));
            return result;
        });
    }

    @Override
    public CompletableFuture<Optional<ModelProfile>> getDefault() {
        return async(() -> {
            synchronized (lock) {
                return readDefaultId().map(profiles()::get);
            }
        });
    }

    @Override
    public CompletableFuture<Void> setDefault(UUID id) {
        return run(() -> {
            synchronized (lock) {
                require(id);
                writeDefaultId(id);
            }
            publish(new ProfileEvent.DefaultChanged(id));
        });
    }

    // -- Internal --

    private void validate(ModelProfile profile) throws ServiceException {
        List<String> errors = profile.validate();
        if (!errors.isEmpty()) {
            publish(new ProfileEvent.ValidationFailed(profile.id(), errors));
            throw ServiceException.validation(String.join("; ", errors));
        }
    }

    private ModelProfile require(UUID id) throws ServiceException {
        ModelProfile profile = profiles().get(id);
        if (profile == null) {
            throw ServiceException.notFound("Profile", id);
        }
        return profile;
    }

    private Optional<UUID> readDefaultId() throws ServiceException {
        String raw = defaultFile.read().get(DEFAULT_KEY);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring malformed default profile id '{}'", raw);
            return Optional.empty();
        }
    }

    private void writeDefaultId(UUID id) throws ServiceException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(DEFAULT_KEY, id.toString());
        defaultFile.write(entries);
    }

    private Map<UUID, ModelProfile> profiles() throws ServiceException {
        if (cache == null) {
            Map<UUID, ModelProfile> loaded = new LinkedHashMap<>();
            for (ModelProfile profile : store.loadAll()) {
                loaded.put(profile.id(), profile);
            }
            cache = loaded;
            LOG.info("Loaded {} profile(s) from {}", loaded.size(), store.directory());
        }
        return cache;
    }
}
