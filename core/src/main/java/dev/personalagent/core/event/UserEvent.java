package dev.personalagent.core.event;

import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpRegistrySource;
import dev.personalagent.core.domain.ModelProfile;

import java.util.Objects;
import java.util.UUID;

/**
 * Actions the user performed in the UI. Emitted through the bridge and
 * republished on the bus unchanged.
 */
public interface UserEvent extends AppEvent {

    // -- Chat --

    record SendMessage(String text) implements UserEvent {
        public SendMessage {
            Objects.requireNonNull(text, "text");
        }
    }

    record StopStreaming() implements UserEvent {
    }

    record NewConversation() implements UserEvent {
    }

    record SelectConversation(UUID id) implements UserEvent {
    }

    record ToggleThinking() implements UserEvent {
    }

    record StartRenameConversation(UUID id) implements UserEvent {
    }

    record ConfirmRenameConversation(UUID id, String title) implements UserEvent {
    }

    record CancelRenameConversation() implements UserEvent {
    }

    record DeleteConversation(UUID id) implements UserEvent {
    }

    record ConfirmDeleteConversation(UUID id) implements UserEvent {
    }

    // -- Profiles --

    record SelectProfile(UUID id) implements UserEvent {
    }

    record CreateProfile() implements UserEvent {
    }

    record EditProfile(UUID id) implements UserEvent {
    }

    /**
     * Saves a new or edited profile. {@code apiKey} is {@code null} when the
     * user left the key untouched.
     */
    record SaveProfile(ModelProfile profile, String apiKey) implements UserEvent {
        public SaveProfile(ModelProfile profile) {
            this(profile, null);
        }
    }

    record DeleteProfile(UUID id) implements UserEvent {
    }

    record ConfirmDeleteProfile(UUID id) implements UserEvent {
    }

    record TestProfileConnection(UUID id) implements UserEvent {
    }

    // -- MCP --

    record ToggleMcp(UUID id, boolean enabled) implements UserEvent {
    }

    record AddMcp() implements UserEvent {
    }

    record SearchMcpRegistry(String query, McpRegistrySource source) implements UserEvent {
    }

    record SelectMcpFromRegistry(McpRegistrySource source) implements UserEvent {
    }

    record ConfigureMcp(UUID id) implements UserEvent {
    }

    record SaveMcpConfig(UUID id, McpConfig config) implements UserEvent {
    }

    record DeleteMcp(UUID id) implements UserEvent {
    }

    record ConfirmDeleteMcp(UUID id) implements UserEvent {
    }

    record StartMcpOAuth(UUID id, String provider) implements UserEvent {
    }

    // -- Model selector --

    record OpenModelSelector() implements UserEvent {
    }

    record SearchModels(String query) implements UserEvent {
    }

    /** {@code providerId} of {@code null} clears the filter. */
    record FilterModelsByProvider(String providerId) implements UserEvent {
    }

    record SelectModel(String providerId, String modelId) implements UserEvent {
    }

    // -- Navigation --

    record Navigate(ViewId to) implements UserEvent {
        public Navigate {
            Objects.requireNonNull(to, "to");
        }
    }

    record NavigateBack() implements UserEvent {
    }
}
