package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmitheryMcpRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_shouldLaunchThroughSmitheryCli() throws Exception {
        var json = "{\"servers\":[{\"qualifiedName\":\"@acme/notes\",\"displayName\":\"Notes\","
                + "\"description\":\"Notebook\",\"verified\":true,\"useCount\":42,\"remote\":true}]}";

        var entries = SmitheryMcpRegistry.parse(new ObjectMapper().readTree(json));

        var notes = entries.get(0);
        assertEquals("@acme/notes", notes.name());
        assertEquals("npx", notes.command());
        assertEquals(List.of("-y", "@smithery/cli@latest", "run", "@acme/notes"), notes.args());
        assertEquals(List.of("oauth", "verified"), notes.tags());
        assertEquals(42, notes.popularity());
        assertEquals("smithery", notes.registry());
    }

    @Test
    void resolveKey_shouldReadKeyFilesAndPassRawKeysThrough() throws Exception {
        Path keyFile = tempDir.resolve("smithery.key");
        Files.writeString(keyFile, "file-key\n");

        assertEquals("file-key", SmitheryMcpRegistry.resolveKey(keyFile.toAbsolutePath().toString()));
        assertEquals("raw-key", SmitheryMcpRegistry.resolveKey(" raw-key "));
    }
}
