package dev.personalagent.services.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.personalagent.core.service.ServiceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flat string map persisted as a single JSON object.
 */
public class JsonKeyValueFile {

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;

    public JsonKeyValueFile(Path file) {
        this.file = file;
    }

    /**
     * @return the stored entries, empty if the file does not exist yet
     */
    public Map<String, String> read() throws ServiceException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return JsonSupport.MAPPER.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.SERIALIZATION,
                    "Failed to parse " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public void write(Map<String, String> entries) throws ServiceException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            JsonSupport.MAPPER.writeValue(temp.toFile(), entries);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ServiceException(ServiceException.Kind.STORAGE,
                    "Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    public Path file() {
        return file;
    }
}
