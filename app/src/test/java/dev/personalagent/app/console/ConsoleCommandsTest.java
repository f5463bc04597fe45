package dev.personalagent.app.console;

import dev.personalagent.core.domain.McpAuthType;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.ProfileSummary;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.presentation.UiFrameDriver;
import dev.personalagent.presentation.bridge.UiBridge;
import dev.personalagent.presentation.deferred.PopoverContext;
import dev.personalagent.presentation.navigation.NavigationState;
import dev.personalagent.presentation.view.ModalId;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsoleCommandsTest {

    @Mock
    private UiBridge bridge;

    @Mock
    private UiFrameDriver driver;

    @Mock
    private PopoverContext popover;

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;
    private ConsoleCommands commands;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        renderer = new ConsoleRenderer(out);
        commands = new ConsoleCommands(bridge, driver, popover, renderer, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void execute_plainText_shouldSendMessage() {
        assertTrue(commands.execute("  what is the weather  "));

        verify(bridge).emit(new UserEvent.SendMessage("what is the weather"));
    }

    @Test
    void execute_blankLine_shouldDoNothing() {
        assertTrue(commands.execute("   "));

        verifyNoInteractions(bridge, driver, popover);
    }

    @Test
    void execute_quit_shouldReturnFalse() {
        assertFalse(commands.execute("/quit"));
        assertFalse(commands.execute("/exit"));
    }

    @Test
    void execute_history_shouldNavigateOnTheUiSide() {
        commands.execute("/history");

        verify(driver).navigate(ViewId.HISTORY);
        verifyNoInteractions(bridge);
    }

    @Test
    void execute_backAtHome_shouldPrintNotice() {
        when(driver.back()).thenReturn(false);

        commands.execute("/back");

        assertTrue(output().contains("already at chat"));
    }

    @Test
    void execute_popover_shouldRequestToggle() {
        commands.execute("/popover");

        verify(popover).requestToggle(any());
    }

    @Test
    void execute_unknownNumber_shouldNotEmit() {
        commands.execute("/open 3");
        commands.execute("/delete x");

        verifyNoInteractions(bridge);
        assertTrue(output().contains("no conversation #3"));
        assertTrue(output().contains("expected a conversation number, got 'x'"));
    }

    @Test
    void execute_yesWithDeleteProfileModal_shouldConfirmThatProfile() {
        UUID id = UUID.randomUUID();
        renderer.apply(new ViewCommand.ShowModal(new ModalId(ModalId.Kind.CONFIRM_DELETE_PROFILE, id)),
                new NavigationState());

        commands.execute("/yes");

        verify(bridge).emit(new UserEvent.ConfirmDeleteProfile(id));
    }

    @Test
    void execute_yesWithoutModal_shouldNotEmit() {
        commands.execute("/yes");

        verifyNoInteractions(bridge);
        assertTrue(output().contains("nothing to confirm"));
    }

    @Test
    void execute_toggle_shouldFlipListedServer() {
        var server = new McpConfig(UUID.randomUUID(), "files", "npx", List.of(), Map.of(), true,
                McpAuthType.NONE, "manual");
        renderer.apply(new ViewCommand.ShowSettings(List.of(), List.of(server)), new NavigationState());

        commands.execute("/toggle 1");

        verify(bridge).emit(new UserEvent.ToggleMcp(server.id(), false));
    }

    @Test
    void execute_default_shouldSelectListedProfile() {
        var profile = new ProfileSummary(UUID.randomUUID(), "Local", "ollama", "llama3.2", false);
        renderer.apply(new ViewCommand.ShowSettings(List.of(profile), List.of()), new NavigationState());

        commands.execute("/default 1");

        verify(bridge).emit(new UserEvent.SelectProfile(profile.id()));
    }

    @Test
    void execute_profile_shouldCreateAndSave() {
        commands.execute("/profile ollama llama3.2 My Laptop");

        ArgumentCaptor<UserEvent> captor = ArgumentCaptor.forClass(UserEvent.class);
        verify(bridge, times(2)).emit(captor.capture());
        assertEquals(new UserEvent.CreateProfile(), captor.getAllValues().get(0));
        var save = (UserEvent.SaveProfile) captor.getAllValues().get(1);
        assertEquals("My Laptop", save.profile().name());
        assertEquals("llama3.2", save.profile().modelId());
        assertNull(save.apiKey());
    }

    @Test
    void execute_useWithoutSlash_shouldPrintUsage() {
        commands.execute("/use llama3.2");

        verifyNoInteractions(bridge);
        assertTrue(output().contains("usage: /use PROVIDER/MODEL"));
    }

    @Test
    void execute_use_shouldSelectModel() {
        commands.execute("/use ollama/qwen2.5:7b");

        verify(bridge).emit(new UserEvent.SelectModel("ollama", "qwen2.5:7b"));
    }

    @Test
    void execute_models_shouldOpenSelectorAndSearch() {
        commands.execute("/models qwen coder");

        verify(bridge).emit(new UserEvent.OpenModelSelector());
        verify(bridge).emit(new UserEvent.SearchModels("qwen coder"));
    }
}
