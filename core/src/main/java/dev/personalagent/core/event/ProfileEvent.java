package dev.personalagent.core.event;

import java.util.List;
import java.util.UUID;

/**
 * Model profile changes published by the profile service.
 */
public interface ProfileEvent extends AppEvent {

    record Created(UUID id, String name) implements ProfileEvent {
    }

    record Updated(UUID id, String name) implements ProfileEvent {
    }

    record Deleted(UUID id, String name) implements ProfileEvent {
    }

    /** {@code profileId} is {@code null} when no default remains. */
    record DefaultChanged(UUID profileId) implements ProfileEvent {
    }

    record TestStarted(UUID id) implements ProfileEvent {
    }

    record TestCompleted(UUID id, boolean success, Long responseTimeMs, String error) implements ProfileEvent {
    }

    record ValidationFailed(UUID id, List<String> errors) implements ProfileEvent {
        public ValidationFailed {
            errors = List.copyOf(errors);
        }
    }
}
