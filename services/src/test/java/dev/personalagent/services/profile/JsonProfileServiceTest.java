package dev.personalagent.services.profile;

import com.google.common.util.concurrent.MoreExecutors;
import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelParameters;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.ProfileEvent;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.RecordedEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JsonProfileServiceTest {

    @TempDir
    Path dir;

    @Mock
    private ConnectionTester tester;

    private EventBus bus;
    private RecordedEvents events;
    private JsonProfileService service;

    @BeforeEach
    void setUp() {
        bus = new EventBus(64);
        events = new RecordedEvents(bus);
        service = new JsonProfileService(bus, MoreExecutors.directExecutor(), dir, tester);
    }

    private static ModelProfile profile(String name) {
        return ModelProfile.create(name, "ollama", "llama3.2", "http://localhost:11434");
    }

    @Test
    void create_firstProfile_shouldBecomeDefault() throws Exception {
        var first = profile("First");

        service.create(first).get();

        assertEquals(List.of(new ProfileEvent.Created(first.id(), "First"), new ProfileEvent.DefaultChanged(first.id())),
                events.drain());
        assertEquals(first.id(), service.getDefault().get().orElseThrow().id());
        assertTrue(Files.exists(dir.resolve("default.json")));
    }

    @Test
    void create_laterProfile_shouldKeepDefault() throws Exception {
        var first = profile("First");
        var second = profile("Second");
        service.create(first).get();
        events.drain();

        service.create(second).get();

        assertEquals(List.of(new ProfileEvent.Created(second.id(), "Second")), events.drain());
        assertEquals(first.id(), service.getDefault().get().orElseThrow().id());
    }

    @Test
    void create_invalidProfile_shouldPublishValidationFailedAndFail() throws Exception {
        var invalid = new ModelProfile(UUID.randomUUID(), " ", "ollama", "", null, ModelParameters.defaults());

        var ex = assertThrows(ExecutionException.class, () -> service.create(invalid).get());

        var cause = (ServiceException) ex.getCause();
        assertEquals(ServiceException.Kind.VALIDATION, cause.getKind());
        assertEquals("Name must not be empty; Model must be selected", cause.getMessage());
        var failed = events.drain(ProfileEvent.ValidationFailed.class);
        assertEquals(1, failed.size());
        assertEquals(List.of("Name must not be empty", "Model must be selected"), failed.get(0).errors());
        assertTrue(service.list().get().isEmpty());
    }

    @Test
    void create_duplicateId_shouldFail() throws Exception {
        var original = profile("Original");
        service.create(original).get();

        var ex = assertThrows(ExecutionException.class, () -> service.create(original.withName("Copy")).get());
        assertEquals(ServiceException.Kind.VALIDATION, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void update_shouldPersistAndPublish() throws Exception {
        var original = profile("Original");
        service.create(original).get();
        events.drain();

        service.update(original.withModel("ollama", "qwen2.5:7b")).get();

        assertEquals(List.of(new ProfileEvent.Updated(original.id(), "Original")), events.drain());
        var reopened = new JsonProfileService(bus, MoreExecutors.directExecutor(), dir, tester);
        assertEquals("qwen2.5:7b", reopened.get(original.id()).get().modelId());
    }

    @Test
    void update_unknownProfile_shouldFailWithNotFound() {
        var ex = assertThrows(ExecutionException.class, () -> service.update(profile("Ghost")).get());
        assertEquals(ServiceException.Kind.NOT_FOUND, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void delete_defaultProfile_shouldClearDefault() throws Exception {
        var first = profile("First");
        service.create(first).get();
        events.drain();

        service.delete(first.id()).get();

        assertEquals(List.of(new ProfileEvent.Deleted(first.id(), "First")), events.drain());
        assertTrue(service.getDefault().get().isEmpty());
    }

    @Test
    void setDefault_shouldPersistAcrossInstances() throws Exception {
        var first = profile("First");
        var second = profile("Second");
        service.create(first).get();
        service.create(second).get();
        events.drain();

        service.setDefault(second.id()).get();

        assertEquals(List.of(new ProfileEvent.DefaultChanged(second.id())), events.drain());
        var reopened = new JsonProfileService(bus, MoreExecutors.directExecutor(), dir, tester);
        assertEquals(second.id(), reopened.getDefault().get().orElseThrow().id());
    }

    @Test
    void testConnection_shouldPublishStartAndResult() throws Exception {
        var first = profile("First");
        service.create(first).get();
        events.drain();
        when(tester.test(any())).thenReturn(ConnectionTestResult.failed("connection refused"));

        var result = service.testConnection(first.id()).get();

        assertFalse(result.success());
        assertEquals(List.of(new ProfileEvent.TestStarted(first.id()),
                new ProfileEvent.TestCompleted(first.id(), false, null, "connection refused")), events.drain());
        verify(tester).test(first);
    }
}
