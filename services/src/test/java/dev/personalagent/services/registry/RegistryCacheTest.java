package dev.personalagent.services.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistryCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private RegistryCache<CatalogModelsRegistryService.Catalogue> cacheAt(Instant now) {
        return new RegistryCache<>(tempDir.resolve("cache/models.json"), Duration.ofHours(24),
                CatalogModelsRegistryService.Catalogue.class, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static CatalogModelsRegistryService.Catalogue catalogue() {
        return new CatalogModelsRegistryService.Catalogue(List.of(new CatalogModelsRegistryService.ProviderEntry(
                "openai", "OpenAI", null,
                List.of(new CatalogModelsRegistryService.ModelEntry("gpt-4o", "GPT-4o", 128000)))));
    }

    @Test
    void readFresh_withinTtl_shouldReturnWrittenCatalogue() {
        cacheAt(NOW).write(catalogue());

        var read = cacheAt(NOW.plus(Duration.ofHours(23))).readFresh();

        assertEquals(catalogue(), read.orElseThrow());
    }

    @Test
    void readFresh_afterTtl_shouldBeEmptyButReadAnyStillWorks() {
        cacheAt(NOW).write(catalogue());

        var later = cacheAt(NOW.plus(Duration.ofHours(25)));

        assertTrue(later.readFresh().isEmpty());
        assertEquals(catalogue(), later.readAny().orElseThrow());
    }

    @Test
    void read_corruptFile_shouldCountAsNoCache() throws Exception {
        Path file = tempDir.resolve("cache/models.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        assertTrue(cacheAt(NOW).readAny().isEmpty());
    }

    @Test
    void read_missingFile_shouldBeEmpty() {
        assertTrue(cacheAt(NOW).readFresh().isEmpty());
    }
}
