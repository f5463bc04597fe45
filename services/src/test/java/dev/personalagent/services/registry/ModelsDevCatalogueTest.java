package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelsDevCatalogueTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parse_shouldMapProvidersModelsAndContextLimit() throws Exception {
        var json = "{\"anthropic\":{\"id\":\"anthropic\",\"name\":\"Anthropic\",\"models\":{"
                + "\"claude-sonnet\":{\"id\":\"claude-sonnet\",\"name\":\"Claude Sonnet\",\"limit\":{\"context\":200000}}}},"
                + "\"ollama\":{\"name\":\"Ollama\",\"api\":\"http://localhost:11434\",\"models\":{"
                + "\"llama3.2\":{\"name\":\"Llama 3.2\"}}}}";

        var catalogue = ModelsDevCatalogue.parse(mapper.readTree(json));

        assertEquals(List.of("anthropic", "ollama"), catalogue.providers().stream()
                .map(CatalogModelsRegistryService.ProviderEntry::id).toList());
        var sonnet = catalogue.providers().get(0).models().get(0);
        assertEquals(200000, sonnet.contextLength());
        assertNull(catalogue.providers().get(0).api());

        var llama = catalogue.providers().get(1).models().get(0);
        assertEquals("llama3.2", llama.id());
        assertNull(llama.contextLength());
        assertEquals("http://localhost:11434", catalogue.providers().get(1).api());
    }

    @Test
    void parse_nonObject_shouldFail() {
        assertThrows(IOException.class, () -> ModelsDevCatalogue.parse(mapper.readTree("[]")));
    }
}
