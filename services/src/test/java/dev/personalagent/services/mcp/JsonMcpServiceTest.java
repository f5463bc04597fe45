package dev.personalagent.services.mcp;

import com.google.common.util.concurrent.MoreExecutors;
import dev.personalagent.core.domain.McpAuthType;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpStatus;
import dev.personalagent.core.domain.ToolInfo;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.RecordedEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JsonMcpServiceTest {

    @TempDir
    Path dir;

    @Mock
    private McpRuntime runtime;

    private EventBus bus;
    private RecordedEvents events;
    private JsonMcpService service;

    @BeforeEach
    void setUp() {
        bus = new EventBus(64);
        events = new RecordedEvents(bus);
        service = new JsonMcpService(bus, MoreExecutors.directExecutor(), dir, runtime);
    }

    private static McpConfig config(String name, boolean enabled) {
        return new McpConfig(UUID.randomUUID(), name, "npx", List.of("-y", "server-" + name), Map.of(), enabled,
                McpAuthType.NONE, "manual");
    }

    @Test
    void add_enabledServer_shouldStartAndExposeTools() throws Exception {
        var config = config("files", true);
        when(runtime.start(config)).thenReturn(List.of(new ToolInfo("read_file", "Reads a file", config.id()),
                new ToolInfo("write_file", "Writes a file", config.id())));

        service.add(config).get();

        assertEquals(List.of(new McpEvent.Starting(config.id(), "files"),
                new McpEvent.Started(config.id(), "files", List.of("read_file", "write_file"), 2)), events.drain());
        assertEquals(McpStatus.RUNNING, service.getStatus(config.id()).get());
        assertEquals(2, service.getAvailableTools().get().size());
    }

    @Test
    void add_disabledServer_shouldOnlyPersist() throws Exception {
        var config = config("files", false);

        service.add(config).get();

        assertTrue(events.drain().isEmpty());
        verify(runtime, never()).start(any());
        var reopened = new JsonMcpService(bus, MoreExecutors.directExecutor(), dir, runtime);
        assertEquals(config, reopened.get(config.id()).get());
        assertEquals(McpStatus.STOPPED, reopened.getStatus(config.id()).get());
    }

    @Test
    void add_withBlankCommand_shouldFailWithValidation() {
        var config = new McpConfig(UUID.randomUUID(), "broken", " ", List.of(), Map.of(), true, McpAuthType.NONE,
                "manual");

        var ex = assertThrows(ExecutionException.class, () -> service.add(config).get());
        assertEquals(ServiceException.Kind.VALIDATION, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void setEnabled_whenStartFails_shouldPublishStartFailedAndStillComplete() throws Exception {
        var config = config("broken", false);
        service.add(config).get();
        when(runtime.start(any())).thenThrow(new IOException("command not found: npx"));

        service.setEnabled(config.id(), true).get();

        assertEquals(List.of(new McpEvent.Starting(config.id(), "broken"),
                new McpEvent.StartFailed(config.id(), "broken", "command not found: npx")), events.drain());
        assertEquals(McpStatus.FAILED, service.getStatus(config.id()).get());
        assertTrue(service.get(config.id()).get().enabled());
    }

    @Test
    void setEnabled_false_shouldStopAndHideTools() throws Exception {
        var config = config("files", true);
        when(runtime.start(any())).thenReturn(List.of(new ToolInfo("read_file", "", config.id())));
        service.add(config).get();
        events.drain();

        service.setEnabled(config.id(), false).get();

        verify(runtime).stop(config.id());
        assertEquals(List.of(new McpEvent.Stopped(config.id(), "files")), events.drain());
        assertTrue(service.getAvailableTools().get().isEmpty());
        assertFalse(service.get(config.id()).get().enabled());
    }

    @Test
    void update_ofRunningServer_shouldSaveAndRestart() throws Exception {
        var config = config("files", true);
        when(runtime.start(any())).thenReturn(List.of());
        service.add(config).get();
        events.drain();
        when(runtime.isRunning(config.id())).thenReturn(true);

        service.update(config.withEnv(Map.of("ROOT", "/tmp"))).get();

        assertEquals(List.of(new McpEvent.ConfigSaved(config.id()), new McpEvent.Restarting(config.id(), "files"),
                new McpEvent.Starting(config.id(), "files"),
                new McpEvent.Started(config.id(), "files", List.of(), 0)), events.drain());
        assertEquals(Map.of("ROOT", "/tmp"), service.get(config.id()).get().env());
    }

    @Test
    void delete_shouldStopRemoveAndPublish() throws Exception {
        var config = config("files", false);
        service.add(config).get();

        service.delete(config.id()).get();

        verify(runtime).stop(config.id());
        assertEquals(List.of(new McpEvent.Deleted(config.id(), "files")), events.drain());
        assertTrue(service.list().get().isEmpty());
    }

    @Test
    void restart_unknownServer_shouldFailWithNotFound() {
        var ex = assertThrows(ExecutionException.class, () -> service.restart(UUID.randomUUID()).get());
        assertEquals(ServiceException.Kind.NOT_FOUND, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void startEnabled_shouldStartOnlyEnabledServers() throws Exception {
        var enabled = config("enabled", true);
        var disabled = config("disabled", false);
        when(runtime.start(any())).thenReturn(List.of());
        service.add(enabled).get();
        service.add(disabled).get();
        var restarted = new JsonMcpService(bus, MoreExecutors.directExecutor(), dir, runtime);
        clearInvocations(runtime);

        restarted.startEnabled().get();

        verify(runtime).start(enabled);
        verify(runtime, never()).start(disabled);
    }

    @Test
    void beginOAuth_withSmithery_shouldUseQualifiedName() throws Exception {
        var config = new McpConfig(UUID.randomUUID(), "Slack", "npx", List.of(), Map.of(), false,
                McpAuthType.OAUTH, "smithery: slack");
        service.add(config).get();

        var uri = service.beginOAuth(config.id(), "smithery").get();

        assertTrue(uri.toString().startsWith("https://smithery.ai/server/slack/authorize?redirect_uri="));
    }
}
