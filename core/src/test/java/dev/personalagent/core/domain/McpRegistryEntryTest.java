package dev.personalagent.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class McpRegistryEntryTest {

    private final McpRegistryEntry entry = new McpRegistryEntry("filesystem", "Filesystem",
            "Read and write local files", "1.0.0", "MCP", "MIT", null, "npx", List.of(), null,
            List.of("files", "local"), "official", 10);

    @Test
    void matches_blankQuery_shouldMatchEverything() {
        assertTrue(entry.matches(""));
        assertTrue(entry.matches(null));
    }

    @Test
    void matches_shouldSearchNameDescriptionAndTags() {
        assertTrue(entry.matches("FILESYSTEM"));
        assertTrue(entry.matches("write"));
        assertTrue(entry.matches("local"));
        assertFalse(entry.matches("github"));
    }

    @Test
    void constructor_shouldReplaceNullCollections() {
        assertNotNull(entry.env());
        assertTrue(entry.env().isEmpty());
    }
}
