package dev.personalagent.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ModelProfileTest {

    @Test
    void validate_validProfile_shouldReturnNoErrors() {
        var profile = ModelProfile.create("Local", "ollama", "llama3.2", "http://localhost:11434");
        assertTrue(profile.validate().isEmpty());
    }

    @Test
    void validate_shouldReportEveryProblem() {
        var profile = new ModelProfile(UUID.randomUUID(), " ", "", null, null,
                new ModelParameters(3.5, 0, false));

        List<String> errors = profile.validate();

        assertEquals(5, errors.size());
        assertTrue(errors.contains("Name must not be empty"));
        assertTrue(errors.contains("Temperature must be between 0.0 and 2.0"));
    }

    @Test
    void withModel_shouldKeepIdentity() {
        var profile = ModelProfile.create("Local", "ollama", "llama3.2", null);
        var changed = profile.withModel("anthropic", "claude-sonnet-4");

        assertEquals(profile.id(), changed.id());
        assertEquals("anthropic", changed.providerId());
        assertEquals("claude-sonnet-4", changed.modelId());
    }
}
