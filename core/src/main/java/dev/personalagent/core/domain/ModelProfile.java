package dev.personalagent.core.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A named model configuration the user can chat with. API keys are not part
 * of the profile; they live in the secrets store keyed by profile id.
 */
public record ModelProfile(UUID id, String name, String providerId, String modelId, String baseUrl,
        ModelParameters parameters) {

    public static ModelProfile create(String name, String providerId, String modelId, String baseUrl) {
        return new ModelProfile(UUID.randomUUID(), name, providerId, modelId, baseUrl, ModelParameters.defaults());
    }

    public ModelProfile withModel(String providerId, String modelId) {
        return new ModelProfile(id, name, providerId, modelId, baseUrl, parameters);
    }

    public ModelProfile withName(String name) {
        return new ModelProfile(id, name, providerId, modelId, baseUrl, parameters);
    }

    /**
     * Returns human readable problems with this profile, empty when valid.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (id == null) {
            errors.add("Profile id is missing");
        }
        if (name == null || name.isBlank()) {
            errors.add("Name must not be empty");
        }
        if (providerId == null || providerId.isBlank()) {
            errors.add("Provider must be selected");
        }
        if (modelId == null || modelId.isBlank()) {
            errors.add("Model must be selected");
        }
        if (parameters != null && (parameters.temperature() < 0.0 || parameters.temperature() > 2.0)) {
            errors.add("Temperature must be between 0.0 and 2.0");
        }
        if (parameters != null && parameters.maxTokens() != null && parameters.maxTokens() <= 0) {
            errors.add("Max tokens must be positive");
        }
        return errors;
    }
}
