package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.JavaType;
import dev.personalagent.services.storage.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One downloaded catalogue on disk, stamped with the time it was fetched.
 * A corrupt or unreadable file counts as no cache.
 */
public class RegistryCache<T> {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    record Entry<T>(Instant cachedAt, T data) {
    }

    private final Path file;
    private final Duration ttl;
    private final JavaType entryType;
    private final Clock clock;

    public RegistryCache(Path file, Duration ttl, Class<T> dataType) {
        this(file, ttl, dataType, Clock.systemUTC());
    }

    RegistryCache(Path file, Duration ttl, Class<T> dataType, Clock clock) {
        this.file = file;
        this.ttl = ttl;
        this.entryType = JsonSupport.MAPPER.getTypeFactory().constructParametricType(Entry.class, dataType);
        this.clock = clock;
    }

    /** The cached catalogue if it is younger than the TTL. */
    public Optional<T> readFresh() {
        return read().filter(entry -> !isExpired(entry.cachedAt())).map(Entry::data);
    }

    /** The cached catalogue however old it is. */
    public Optional<T> readAny() {
        return read().map(Entry::data);
    }

    public void write(T data) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            JsonSupport.MAPPER.writeValue(file.toFile(), new Entry<>(clock.instant(), data));
        } catch (IOException e) {
            LOG.warn("Could not write registry cache {}: {}", file, e.getMessage());
        }
    }

    private boolean isExpired(Instant cachedAt) {
        return Duration.between(cachedAt, clock.instant()).compareTo(ttl) > 0;
    }

    private Optional<Entry<T>> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Entry<T> entry = JsonSupport.MAPPER.readValue(file.toFile(), entryType);
            return entry.cachedAt() == null ? Optional.empty() : Optional.of(entry);
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable registry cache {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
