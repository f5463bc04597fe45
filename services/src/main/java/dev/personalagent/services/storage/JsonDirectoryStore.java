package dev.personalagent.services.storage;

import dev.personalagent.core.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * One JSON file per entity, named {@code <uuid>.json}, in a single
 * directory. Files whose name is not a UUID are left alone; unreadable
 * entity files are skipped with a warning so one corrupt file does not hide
 * the rest.
 */
public class JsonDirectoryStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDirectoryStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Class<T> type;

    public JsonDirectoryStore(Path directory, Class<T> type) {
        this.directory = directory;
        this.type = type;
    }

    public List<T> loadAll() throws ServiceException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<T> loaded = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!isEntityFile(file)) {
                    continue;
                }
                try {
                    loaded.add(JsonSupport.MAPPER.readValue(file.toFile(), type));
                } catch (IOException e) {
                    LOG.warn("Skipping unreadable {} file {}: {}", type.getSimpleName(), file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.STORAGE,
                    "Failed to read " + directory + ": " + e.getMessage(), e);
        }
        LOG.debug("Loaded {} {} file(s) from {}", loaded.size(), type.getSimpleName(), directory);
        return loaded;
    }

    /**
     * Writes through a temporary file so a crash never leaves half a file.
     */
    public void save(UUID id, T value) throws ServiceException {
        Path target = fileFor(id);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, id.toString(), ".tmp");
            JsonSupport.MAPPER.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.STORAGE,
                    "Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code false} if there was nothing to delete
     */
    public boolean delete(UUID id) throws ServiceException {
        Path target = fileFor(id);
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.STORAGE,
                    "Failed to delete " + target + ": " + e.getMessage(), e);
        }
    }

    public Path directory() {
        return directory;
    }

    private Path fileFor(UUID id) {
        return directory.resolve(id + SUFFIX);
    }

    private static boolean isEntityFile(Path file) {
        String name = file.getFileName().toString();
        if (!name.endsWith(SUFFIX)) {
            return false;
        }
        try {
            UUID.fromString(name.substring(0, name.length() - SUFFIX.length()));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
