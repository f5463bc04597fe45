package dev.personalagent.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link AppConfig} from a JSON file, writing the defaults first when
 * the file does not exist yet. Unknown keys are ignored so older builds can
 * read newer files.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConfigLoader() {
    }

    public static AppConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            AppConfig defaults = new AppConfig();
            save(file, defaults);
            LOG.info("Wrote default configuration to {}", file.toAbsolutePath());
            return defaults;
        }
        AppConfig config = MAPPER.readValue(file.toFile(), AppConfig.class);
        LOG.info("Loaded configuration from {}", file.toAbsolutePath());
        return config;
    }

    public static void save(Path file, AppConfig config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), config);
    }
}
