package dev.personalagent.presentation.presenter;

import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.event.ProfileEvent;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ErrorPresenterTest {

    private CommandRecorder recorder;
    private ErrorPresenter presenter;

    @BeforeEach
    void setUp() {
        recorder = new CommandRecorder();
        presenter = new ErrorPresenter(new EventBus(16), recorder.sink(), CommandRecorder.NOT_STARTED);
    }

    @Test
    void systemError_shouldBeCriticalWithContext() {
        presenter.handle(new SystemEvent.Error("Storage", "disk full", "saving settings.json"));

        assertEquals(List.of(new ViewCommand.ShowError("Storage Error",
                "Storage: disk full\n\nContext: saving settings.json", ErrorSeverity.CRITICAL)),
                recorder.commands());
    }

    @Test
    void systemErrorWithoutContext_shouldOmitContextSection() {
        presenter.handle(new SystemEvent.Error("Hotkey", "already registered"));

        assertEquals("Hotkey: already registered",
                recorder.commands(ViewCommand.ShowError.class).get(0).message());
    }

    @Test
    void streamError_severityShouldFollowRecoverability() {
        UUID id = UUID.randomUUID();

        presenter.handle(new ChatEvent.StreamError(id, "rate limited", true));
        presenter.handle(new ChatEvent.StreamError(id, "model not found", false));

        var errors = recorder.commands(ViewCommand.ShowError.class);
        assertEquals(ErrorSeverity.WARNING, errors.get(0).severity());
        assertEquals(ErrorSeverity.ERROR, errors.get(1).severity());
    }

    @Test
    void mcpFailures_shouldNameTheServer() {
        UUID id = UUID.randomUUID();

        presenter.handle(new McpEvent.StartFailed(id, "github", "exit code 1"));
        presenter.handle(new McpEvent.Unhealthy(id, "github", "no heartbeat"));

        assertEquals(List.of(
                new ViewCommand.ShowError("MCP Server Error", "Failed to start MCP server 'github': exit code 1",
                        ErrorSeverity.ERROR),
                new ViewCommand.ShowError("MCP Server Unhealthy", "MCP server 'github' is unhealthy: no heartbeat",
                        ErrorSeverity.WARNING)), recorder.commands());
    }

    @Test
    void registryRefreshFailure_shouldWarn() {
        presenter.handle(new SystemEvent.ModelsRegistryRefreshFailed("HTTP 503"));

        assertEquals(ErrorSeverity.WARNING, recorder.commands(ViewCommand.ShowError.class).get(0).severity());
    }

    @Test
    void unrelatedEvents_shouldProduceNothing() {
        presenter.handle(new ProfileEvent.TestStarted(UUID.randomUUID()));
        presenter.handle(new SystemEvent.AppLaunched());

        assertTrue(recorder.commands().isEmpty());
    }
}
