package dev.personalagent.app.console;

import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpRegistryEntry;
import dev.personalagent.core.domain.ModelInfo;
import dev.personalagent.core.domain.ProfileSummary;
import dev.personalagent.presentation.ViewCommandHandler;
import dev.personalagent.presentation.navigation.NavigationState;
import dev.personalagent.presentation.view.ModalId;
import dev.personalagent.presentation.view.ViewCommand;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Renders view commands as plain text. Also remembers the lists last shown
 * so console input can refer to entries by their number. UI thread only.
 */
public class ConsoleRenderer implements ViewCommandHandler {

    private final PrintStream out;

    private boolean streaming;
    private boolean showThinking;
    private UUID currentConversation;
    private ModalId openModal;
    private List<ConversationSummary> conversations = List.of();
    private List<ProfileSummary> profiles = List.of();
    private List<McpConfig> mcpServers = List.of();

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public void apply(ViewCommand command, NavigationState navigation) {
        if (command instanceof ViewCommand.AppendStream append) {
            if (!streaming) {
                out.print("assistant> ");
                streaming = true;
            }
            out.print(append.chunk());
            out.flush();
            return;
        }
        if (command instanceof ViewCommand.AppendThinking thinking) {
            if (showThinking) {
                out.print(thinking.content());
                out.flush();
            }
            return;
        }
        endStreamLine();

        if (command instanceof ViewCommand.ConversationCreated created) {
            currentConversation = created.id();
            out.println("-- new conversation --");
        } else if (command instanceof ViewCommand.ConversationActivated activated) {
            currentConversation = activated.id();
        } else if (command instanceof ViewCommand.ConversationCleared) {
            currentConversation = null;
        } else if (command instanceof ViewCommand.MessageAppended appended) {
            out.println(appended.role().name().toLowerCase(Locale.ROOT) + "> " + appended.content());
        } else if (command instanceof ViewCommand.ShowThinking && showThinking) {
            out.print("(thinking) ");
        } else if (command instanceof ViewCommand.FinalizeStream finalize) {
            out.println(finalize.tokens() != null ? "[" + finalize.tokens() + " tokens]" : "[done]");
        } else if (command instanceof ViewCommand.StreamCancelled) {
            out.println("[stopped]");
        } else if (command instanceof ViewCommand.StreamError error) {
            out.println("[stream failed: " + error.error() + (error.recoverable() ? ", try again" : "") + "]");
        } else if (command instanceof ViewCommand.ToggleThinkingVisibility) {
            showThinking = !showThinking;
            out.println("thinking " + (showThinking ? "shown" : "hidden"));
        } else if (command instanceof ViewCommand.ConversationRenamed renamed) {
            out.println("renamed to '" + renamed.newTitle() + "'");
        } else if (command instanceof ViewCommand.ConversationListRefreshed refreshed) {
            conversations = refreshed.conversations();
            printConversations();
        } else if (command instanceof ViewCommand.ShowSettings settings) {
            profiles = settings.profiles();
            mcpServers = settings.mcpServers();
            printSettings();
        } else if (command instanceof ViewCommand.McpRegistryResults results) {
            printRegistry(results.entries());
        } else if (command instanceof ViewCommand.ModelSearchResults results) {
            printModels(results.models());
        } else if (command instanceof ViewCommand.ModelSelected selected) {
            out.println("model: " + selected.providerId() + "/" + selected.modelId());
        } else if (command instanceof ViewCommand.ProfileTestCompleted test) {
            out.println(test.success() ? "connection ok (" + test.responseTimeMs() + " ms)" : "connection failed");
        } else if (command instanceof ViewCommand.McpServerStarted started) {
            out.println("mcp server started with " + started.toolCount() + " tool(s)");
        } else if (command instanceof ViewCommand.McpServerFailed failed) {
            out.println("mcp server failed: " + failed.error());
        } else if (command instanceof ViewCommand.McpServerAdded added) {
            out.println("added mcp server '" + added.name() + "'");
        } else if (command instanceof ViewCommand.OpenExternalUrl open) {
            out.println("open in your browser: " + open.url());
        } else if (command instanceof ViewCommand.ShowNotification notification) {
            out.println("* " + notification.message());
        } else if (command instanceof ViewCommand.ShowError error) {
            out.println("[" + error.severity() + "] " + error.title() + ": " + error.message());
        } else if (command instanceof ViewCommand.ShowModal modal) {
            openModal = modal.modal();
            String what = modal.modal().kind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
            out.println(what + "? (/yes or /no)");
        } else if (command instanceof ViewCommand.DismissModal) {
            openModal = null;
        } else if (command instanceof ViewCommand.NavigateTo || command instanceof ViewCommand.NavigateBack) {
            out.println("[" + navigation.current().name().toLowerCase(Locale.ROOT) + "]");
        }
    }

    // -- State read by console input --

    public Optional<UUID> currentConversation() {
        return Optional.ofNullable(currentConversation);
    }

    public Optional<ModalId> openModal() {
        return Optional.ofNullable(openModal);
    }

    /** Closes the open confirmation without confirming it. */
    public void dismissModal() {
        openModal = null;
    }

    /** Numbers start at 1, as printed. */
    public Optional<ConversationSummary> conversation(int number) {
        return pick(conversations, number);
    }

    public Optional<ProfileSummary> profile(int number) {
        return pick(profiles, number);
    }

    public Optional<McpConfig> mcpServer(int number) {
        return pick(mcpServers, number);
    }

    // -- Printing --

    private void endStreamLine() {
        if (streaming) {
            out.println();
            streaming = false;
        }
    }

    private void printConversations() {
        if (conversations.isEmpty()) {
            out.println("no conversations yet");
        }
        for (int i = 0; i < conversations.size(); i++) {
            ConversationSummary summary = conversations.get(i);
            out.printf("%3d. %s (%d messages)%n", i + 1, summary.title(), summary.messageCount());
        }
    }

    private void printSettings() {
        out.println("profiles:");
        for (int i = 0; i < profiles.size(); i++) {
            ProfileSummary profile = profiles.get(i);
            out.printf("%3d. %s %s/%s%s%n", i + 1, profile.name(), profile.providerId(), profile.modelId(),
                    profile.isDefault() ? " (default)" : "");
        }
        out.println("mcp servers:");
        for (int i = 0; i < mcpServers.size(); i++) {
            McpConfig server = mcpServers.get(i);
            out.printf("%3d. %s [%s]%n", i + 1, server.name(), server.enabled() ? "on" : "off");
        }
    }

    private void printRegistry(List<McpRegistryEntry> entries) {
        for (McpRegistryEntry entry : entries) {
            out.printf("  %-16s %s (%s)%n", entry.name(), entry.description(), entry.registry());
        }
    }

    private void printModels(List<ModelInfo> models) {
        for (ModelInfo model : models) {
            out.printf("  %s/%s  %s%n", model.providerId(), model.modelId(), model.name());
        }
    }

    private static <T> Optional<T> pick(List<T> items, int number) {
        return number >= 1 && number <= items.size() ? Optional.of(items.get(number - 1)) : Optional.empty();
    }
}
