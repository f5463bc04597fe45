package dev.personalagent.core.domain;

import java.util.UUID;

public record ProfileSummary(UUID id, String name, String providerId, String modelId, boolean isDefault) {

    public static ProfileSummary of(ModelProfile profile, boolean isDefault) {
        return new ProfileSummary(profile.id(), profile.name(), profile.providerId(), profile.modelId(), isDefault);
    }
}
