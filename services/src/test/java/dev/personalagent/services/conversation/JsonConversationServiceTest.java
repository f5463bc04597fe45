package dev.personalagent.services.conversation;

import com.google.common.util.concurrent.MoreExecutors;
import dev.personalagent.core.domain.MessageRole;
import dev.personalagent.core.event.ConversationEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.RecordedEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class JsonConversationServiceTest {

    @TempDir
    Path dir;

    private EventBus bus;
    private RecordedEvents events;
    private JsonConversationService service;

    @BeforeEach
    void setUp() {
        bus = new EventBus(64);
        events = new RecordedEvents(bus);
        service = new JsonConversationService(bus, MoreExecutors.directExecutor(), dir);
    }

    @Test
    void create_shouldPersistAndPublishCreated() throws Exception {
        var conversation = service.create(null, null).get();

        assertEquals("New Conversation", conversation.title());
        assertEquals(List.of(new ConversationEvent.Created(conversation.id(), "New Conversation")), events.drain());

        var reopened = new JsonConversationService(bus, MoreExecutors.directExecutor(), dir);
        assertEquals(conversation.id(), reopened.load(conversation.id()).get().id());
    }

    @Test
    void addMessages_shouldAppendInOrderAndSurviveReload() throws Exception {
        var conversation = service.create("Chat", null).get();

        service.addUserMessage(conversation.id(), "Hi").get();
        service.addAssistantMessage(conversation.id(), "Hello!", "greeting").get();

        var reopened = new JsonConversationService(bus, MoreExecutors.directExecutor(), dir);
        var messages = reopened.getMessages(conversation.id()).get();
        assertEquals(2, messages.size());
        assertEquals(MessageRole.USER, messages.get(0).role());
        assertEquals("Hi", messages.get(0).content());
        assertEquals(MessageRole.ASSISTANT, messages.get(1).role());
        assertEquals("greeting", messages.get(1).thinking());
    }

    @Test
    void list_shouldReturnMostRecentFirstAndPublishTotal() throws Exception {
        var older = service.create("Older", null).get();
        var newer = service.create("Newer", null).get();
        service.addUserMessage(older.id(), "bump").get();
        events.drain();

        var page = service.list(1, 0).get();

        assertEquals(1, page.size());
        assertEquals(older.id(), page.get(0).id());
        assertEquals(1, page.get(0).messageCount());
        assertEquals(List.of(new ConversationEvent.ListRefreshed(2)), events.drain());
        assertEquals(newer.id(), service.list(10, 1).get().get(0).id());
    }

    @Test
    void rename_shouldTrimTitleAndPublish() throws Exception {
        var conversation = service.create("Old", null).get();
        events.drain();

        var renamed = service.rename(conversation.id(), "  New name ").get();

        assertEquals("New name", renamed.title());
        assertEquals(List.of(new ConversationEvent.TitleUpdated(conversation.id(), "New name")), events.drain());
    }

    @Test
    void rename_withBlankTitle_shouldFailWithValidation() throws Exception {
        var conversation = service.create("Old", null).get();

        var ex = assertThrows(ExecutionException.class, () -> service.rename(conversation.id(), " ").get());
        assertEquals(ServiceException.Kind.VALIDATION, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void load_withUnknownId_shouldFailWithNotFound() {
        var ex = assertThrows(ExecutionException.class, () -> service.load(UUID.randomUUID()).get());
        assertEquals(ServiceException.Kind.NOT_FOUND, ((ServiceException) ex.getCause()).getKind());
    }

    @Test
    void delete_ofActiveConversation_shouldAlsoDeactivate() throws Exception {
        var conversation = service.create("Active", null).get();
        service.setActive(conversation.id()).get();
        events.drain();

        service.delete(conversation.id()).get();

        assertEquals(List.of(new ConversationEvent.Deleted(conversation.id()), new ConversationEvent.Deactivated()),
                events.drain());
        assertTrue(service.getActive().get().isEmpty());
        assertTrue(service.list(10, 0).get().isEmpty());
    }

    @Test
    void delete_ofInactiveConversation_shouldKeepActive() throws Exception {
        var active = service.create("Active", null).get();
        var other = service.create("Other", null).get();
        service.setActive(active.id()).get();
        events.drain();

        service.delete(other.id()).get();

        assertEquals(List.of(new ConversationEvent.Deleted(other.id())), events.drain());
        assertEquals(active.id(), service.getActive().get().orElseThrow().id());
    }

    @Test
    void setActive_shouldPublishActivated() throws Exception {
        var conversation = service.create("Chat", null).get();
        events.drain();

        service.setActive(conversation.id()).get();

        assertEquals(List.of(new ConversationEvent.Activated(conversation.id())), events.drain());
    }
}
