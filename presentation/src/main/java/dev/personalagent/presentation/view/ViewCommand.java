package dev.personalagent.presentation.view;

import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpRegistryEntry;
import dev.personalagent.core.domain.McpStatus;
import dev.personalagent.core.domain.MessageRole;
import dev.personalagent.core.domain.ModelInfo;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.domain.ProfileSummary;
import dev.personalagent.core.domain.ProviderInfo;
import dev.personalagent.core.domain.ToolInfo;
import dev.personalagent.core.event.ViewId;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One UI mutation, produced by a presenter and applied by the render layer.
 * Commands are plain values and never carry callbacks.
 */
public interface ViewCommand {

    // -- Chat --

    record ConversationCreated(UUID id, UUID profileId) implements ViewCommand {
    }

    record MessageAppended(UUID conversationId, MessageRole role, String content) implements ViewCommand {
    }

    record ShowThinking(UUID conversationId) implements ViewCommand {
    }

    record HideThinking(UUID conversationId) implements ViewCommand {
    }

    record AppendStream(UUID conversationId, String chunk) implements ViewCommand {
    }

    /** {@code tokens} is {@code null} when usage was not reported. */
    record FinalizeStream(UUID conversationId, Integer tokens) implements ViewCommand {
    }

    record StreamCancelled(UUID conversationId, String partialContent) implements ViewCommand {
    }

    record StreamError(UUID conversationId, String error, boolean recoverable) implements ViewCommand {
    }

    record AppendThinking(UUID conversationId, String content) implements ViewCommand {
    }

    record ShowToolCall(UUID conversationId, String toolName, String status) implements ViewCommand {
    }

    record UpdateToolCall(UUID conversationId, String toolName, String status, String result,
            Long durationMs) implements ViewCommand {
    }

    record MessageSaved(UUID conversationId) implements ViewCommand {
    }

    record ToggleThinkingVisibility() implements ViewCommand {
    }

    /** {@code conversationId} of {@code null} leaves rename mode. */
    record RenameModeChanged(UUID conversationId) implements ViewCommand {
    }

    record ConversationRenamed(UUID id, String newTitle) implements ViewCommand {
    }

    record ConversationCleared() implements ViewCommand {
    }

    record HistoryUpdated(Integer count) implements ViewCommand {
    }

    // -- History --

    record ConversationListRefreshed(List<ConversationSummary> conversations) implements ViewCommand {
        public ConversationListRefreshed {
            conversations = List.copyOf(conversations);
        }
    }

    record ConversationActivated(UUID id) implements ViewCommand {
    }

    record ConversationDeleted(UUID id) implements ViewCommand {
    }

    record ConversationTitleUpdated(UUID id, String title) implements ViewCommand {
    }

    // -- Settings and profiles --

    record ShowSettings(List<ProfileSummary> profiles, List<McpConfig> mcpServers) implements ViewCommand {
        public ShowSettings {
            profiles = List.copyOf(profiles);
            mcpServers = List.copyOf(mcpServers);
        }
    }

    record ShowNotification(String message) implements ViewCommand {
    }

    record ProfileCreated(UUID id, String name) implements ViewCommand {
    }

    record ProfileUpdated(UUID id, String name) implements ViewCommand {
    }

    record ProfileDeleted(UUID id) implements ViewCommand {
    }

    record DefaultProfileChanged(UUID profileId) implements ViewCommand {
    }

    record ProfileTestStarted(UUID id) implements ViewCommand {
    }

    record ProfileTestCompleted(UUID id, boolean success, Long responseTimeMs, String error) implements ViewCommand {
    }

    /** {@code profile} is {@code null} when the editor opens for a new profile. */
    record ProfileEditorLoaded(ModelProfile profile, boolean hasApiKey) implements ViewCommand {
    }

    // -- MCP --

    record McpServerStarted(UUID id, int toolCount) implements ViewCommand {
    }

    record McpServerFailed(UUID id, String error) implements ViewCommand {
    }

    record McpToolsUpdated(List<ToolInfo> tools) implements ViewCommand {
        public McpToolsUpdated {
            tools = List.copyOf(tools);
        }
    }

    record McpStatusChanged(UUID id, McpStatus status) implements ViewCommand {
    }

    record McpConfigSaved(UUID id) implements ViewCommand {
    }

    record McpDeleted(UUID id) implements ViewCommand {
    }

    record McpServerAdded(UUID id, String name) implements ViewCommand {
    }

    record McpRegistryResults(List<McpRegistryEntry> entries) implements ViewCommand {
        public McpRegistryResults {
            entries = List.copyOf(entries);
        }
    }

    record McpConfigureLoaded(McpConfig config) implements ViewCommand {
    }

    record OpenExternalUrl(URI url) implements ViewCommand {
    }

    // -- Model selector --

    record ModelSearchResults(List<ModelInfo> models) implements ViewCommand {
        public ModelSearchResults {
            models = List.copyOf(models);
        }
    }

    record ModelProvidersLoaded(List<ProviderInfo> providers) implements ViewCommand {
        public ModelProvidersLoaded {
            providers = List.copyOf(providers);
        }
    }

    record ModelSelected(String providerId, String modelId, String name) implements ViewCommand {
    }

    // -- Errors --

    record ShowError(String title, String message, ErrorSeverity severity) implements ViewCommand {
        public ShowError {
            Objects.requireNonNull(severity, "severity");
        }
    }

    // -- Navigation --

    record NavigateTo(ViewId view) implements ViewCommand {
    }

    record NavigateBack() implements ViewCommand {
    }

    record ShowModal(ModalId modal) implements ViewCommand {
    }

    record DismissModal() implements ViewCommand {
    }
}
