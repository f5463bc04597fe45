package dev.personalagent.app.console;

import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpRegistrySource;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.presentation.UiFrameDriver;
import dev.personalagent.presentation.bridge.UiBridge;
import dev.personalagent.presentation.deferred.AnchorBounds;
import dev.personalagent.presentation.deferred.PopoverContext;
import dev.personalagent.presentation.view.ModalId;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.IntFunction;

/**
 * Turns one line of console input into user events and UI-side navigation.
 * Runs on the UI thread, like a widget callback.
 */
public class ConsoleCommands {

    static final String HELP = String.join(System.lineSeparator(),
            "  <text>                         send a message",
            "  /new  /stop  /thinking         new conversation, stop reply, toggle reasoning",
            "  /history  /open N  /rename N T conversations",
            "  /delete N  /yes  /no           delete with confirmation",
            "  /settings                      profiles and MCP servers",
            "  /profile PROVIDER MODEL NAME   create a profile",
            "  /default N  /test N  /rmprofile N",
            "  /models [QUERY]  /use PROVIDER/MODEL",
            "  /mcp [QUERY]  /install NAME  /toggle N  /oauth N PROVIDER  /rmmcp N",
            "  /popover  /back  /help  /quit");

    private static final AnchorBounds TRAY_ANCHOR = new AnchorBounds(0, 0, 24, 24);

    private final UiBridge bridge;
    private final UiFrameDriver driver;
    private final PopoverContext popover;
    private final ConsoleRenderer renderer;
    private final PrintStream out;

    public ConsoleCommands(UiBridge bridge, UiFrameDriver driver, PopoverContext popover, ConsoleRenderer renderer,
            PrintStream out) {
        this.bridge = bridge;
        this.driver = driver;
        this.popover = popover;
        this.renderer = renderer;
        this.out = out;
    }

    /**
     * @return {@code false} when the user asked to quit
     */
    public boolean execute(String line) {
        String input = line.trim();
        if (input.isEmpty()) {
            return true;
        }
        if (!input.startsWith("/")) {
            bridge.emit(new UserEvent.SendMessage(input));
            return true;
        }

        String[] parts = input.substring(1).split("\\s+", 3);
        String command = parts[0];
        String first = parts.length > 1 ? parts[1] : "";
        String rest = parts.length > 2 ? parts[2] : "";

        switch (command) {
            case "quit":
            case "exit":
                return false;
            case "help":
                out.println(HELP);
                break;
            case "new":
                bridge.emit(new UserEvent.NewConversation());
                break;
            case "stop":
                bridge.emit(new UserEvent.StopStreaming());
                break;
            case "thinking":
                bridge.emit(new UserEvent.ToggleThinking());
                break;
            case "history":
                driver.navigate(ViewId.HISTORY);
                break;
            case "settings":
                driver.navigate(ViewId.SETTINGS);
                break;
            case "back":
                if (!driver.back()) {
                    out.println("already at " + ViewId.home().name().toLowerCase(Locale.ROOT));
                }
                break;
            case "popover":
                popover.requestToggle(TRAY_ANCHOR);
                break;
            case "open":
                conversationId(first).ifPresent(id -> bridge.emit(new UserEvent.SelectConversation(id)));
                break;
            case "rename":
                conversationId(first).ifPresent(id -> {
                    bridge.emit(new UserEvent.StartRenameConversation(id));
                    bridge.emit(new UserEvent.ConfirmRenameConversation(id, rest));
                });
                break;
            case "delete":
                conversationId(first).ifPresent(id -> bridge.emit(new UserEvent.DeleteConversation(id)));
                break;
            case "yes":
                confirm();
                break;
            case "no":
                renderer.dismissModal();
                break;
            case "profile":
                createProfile(first, rest);
                break;
            case "default":
                profileId(first).ifPresent(id -> bridge.emit(new UserEvent.SelectProfile(id)));
                break;
            case "test":
                profileId(first).ifPresent(id -> bridge.emit(new UserEvent.TestProfileConnection(id)));
                break;
            case "rmprofile":
                profileId(first).ifPresent(id -> bridge.emit(new UserEvent.DeleteProfile(id)));
                break;
            case "models":
                bridge.emit(new UserEvent.OpenModelSelector());
                if (!first.isEmpty()) {
                    bridge.emit(new UserEvent.SearchModels((first + " " + rest).trim()));
                }
                break;
            case "use":
                selectModel(first);
                break;
            case "mcp":
                driver.navigate(ViewId.MCP_ADD);
                if (!first.isEmpty()) {
                    bridge.emit(new UserEvent.SearchMcpRegistry((first + " " + rest).trim(), McpRegistrySource.all()));
                }
                break;
            case "install":
                bridge.emit(new UserEvent.SelectMcpFromRegistry(new McpRegistrySource(first)));
                break;
            case "toggle":
                mcpServer(first).ifPresent(server ->
                        bridge.emit(new UserEvent.ToggleMcp(server.id(), !server.enabled())));
                break;
            case "oauth":
                mcpServer(first).ifPresent(server -> bridge.emit(new UserEvent.StartMcpOAuth(server.id(), rest)));
                break;
            case "rmmcp":
                mcpServer(first).ifPresent(server -> bridge.emit(new UserEvent.DeleteMcp(server.id())));
                break;
            default:
                out.println("unknown command /" + command + ", try /help");
                break;
        }
        return true;
    }

    private void confirm() {
        Optional<ModalId> modal = renderer.openModal();
        if (modal.isEmpty()) {
            out.println("nothing to confirm");
            return;
        }
        UUID subject = modal.get().subject();
        switch (modal.get().kind()) {
            case CONFIRM_DELETE_CONVERSATION:
                bridge.emit(new UserEvent.ConfirmDeleteConversation(subject));
                break;
            case CONFIRM_DELETE_PROFILE:
                bridge.emit(new UserEvent.ConfirmDeleteProfile(subject));
                break;
            case CONFIRM_DELETE_MCP:
                bridge.emit(new UserEvent.ConfirmDeleteMcp(subject));
                break;
            default:
                break;
        }
    }

    private void createProfile(String provider, String modelAndName) {
        String[] words = modelAndName.split("\\s+", 2);
        if (provider.isEmpty() || words[0].isEmpty()) {
            out.println("usage: /profile PROVIDER MODEL NAME");
            return;
        }
        String name = words.length > 1 ? words[1] : words[0];
        bridge.emit(new UserEvent.CreateProfile());
        bridge.emit(new UserEvent.SaveProfile(ModelProfile.create(name, provider, words[0], null), null));
    }

    private void selectModel(String qualified) {
        int slash = qualified.indexOf('/');
        if (slash <= 0 || slash == qualified.length() - 1) {
            out.println("usage: /use PROVIDER/MODEL");
            return;
        }
        bridge.emit(new UserEvent.SelectModel(qualified.substring(0, slash), qualified.substring(slash + 1)));
    }

    // -- Numbered references --

    private Optional<UUID> conversationId(String number) {
        return resolve(number, "conversation", n -> renderer.conversation(n).map(c -> c.id()));
    }

    private Optional<UUID> profileId(String number) {
        return resolve(number, "profile", n -> renderer.profile(n).map(p -> p.id()));
    }

    private Optional<McpConfig> mcpServer(String number) {
        return resolve(number, "mcp server", renderer::mcpServer);
    }

    private <T> Optional<T> resolve(String number, String what, IntFunction<Optional<T>> lookup) {
        try {
            Optional<T> found = lookup.apply(Integer.parseInt(number));
            if (found.isEmpty()) {
                out.println("no " + what + " #" + number + ", list them first");
            }
            return found;
        } catch (NumberFormatException e) {
            out.println("expected a " + what + " number, got '" + number + "'");
            return Optional.empty();
        }
    }
}
