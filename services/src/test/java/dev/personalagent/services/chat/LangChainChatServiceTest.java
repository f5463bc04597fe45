package dev.personalagent.services.chat;

import com.google.common.util.concurrent.MoreExecutors;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.StreamingResponseHandler;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import dev.personalagent.core.config.ChatConfig;
import dev.personalagent.core.domain.Conversation;
import dev.personalagent.core.domain.Message;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.RecordedEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LangChainChatServiceTest {

    @Mock
    private ConversationService conversations;
    @Mock
    private ProfileService profiles;
    @Mock
    private StreamingModelFactory models;
    @Mock
    private StreamingChatLanguageModel model;

    private final ChatConfig chatConfig = new ChatConfig();
    private final ModelProfile profile = ModelProfile.create("Local", "ollama", "llama3.2", null);
    private final Conversation conversation = Conversation.create("Chat", null);
    private final AtomicReference<StreamingResponseHandler<AiMessage>> handler = new AtomicReference<>();

    private RecordedEvents events;
    private LangChainChatService service;

    @BeforeEach
    void setUp() {
        var bus = new EventBus(64);
        events = new RecordedEvents(bus);
        service = new LangChainChatService(bus, MoreExecutors.directExecutor(), conversations, profiles, models,
                chatConfig);
    }

    private void givenStartableStream() throws Exception {
        when(conversations.load(conversation.id())).thenReturn(CompletableFuture.completedFuture(conversation));
        when(profiles.getDefault()).thenReturn(CompletableFuture.completedFuture(Optional.of(profile)));
        when(models.create(profile)).thenReturn(model);
        when(conversations.addUserMessage(conversation.id(), "Hi"))
                .thenReturn(CompletableFuture.completedFuture(Message.user("Hi")));
        when(conversations.getMessages(conversation.id()))
                .thenReturn(CompletableFuture.completedFuture(List.of(Message.user("Hi"))));
        doAnswer(invocation -> {
            handler.set(invocation.getArgument(1));
            return null;
        }).when(model).generate(anyList(), ArgumentMatchers.<StreamingResponseHandler<AiMessage>>any());
    }

    private void givenReplySaved() {
        when(conversations.addAssistantMessage(eq(conversation.id()), anyString(), any()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        Message.assistant(invocation.getArgument(1), invocation.getArgument(2))));
    }

    @Test
    void sendMessage_shouldStreamTextAndThinkingThenSave() throws Exception {
        givenStartableStream();
        givenReplySaved();

        service.sendMessage(conversation.id(), "Hi").get();
        assertTrue(service.isStreaming());
        handler.get().onNext("<thi");
        handler.get().onNext("nk>hmm</think>Hel");
        handler.get().onNext("lo");
        handler.get().onComplete(Response.from(AiMessage.from("Hello"), new TokenUsage(3, 2)));

        var published = events.drain();
        var started = (ChatEvent.StreamStarted) published.get(0);
        assertEquals("llama3.2", started.modelId());
        assertEquals(List.of(new ChatEvent.ThinkingDelta("hmm"), new ChatEvent.TextDelta("Hel"),
                new ChatEvent.TextDelta("lo"),
                new ChatEvent.StreamCompleted(conversation.id(), started.messageId(), 5)), published.subList(1, 5));
        assertInstanceOf(ChatEvent.MessageSaved.class, published.get(5));
        assertFalse(service.isStreaming());
        verify(conversations).addAssistantMessage(conversation.id(), "Hello", "hmm");
    }

    @SuppressWarnings("unchecked")
    @Test
    void sendMessage_shouldPrependSystemPromptToHistory() throws Exception {
        givenStartableStream();

        service.sendMessage(conversation.id(), "Hi").get();

        ArgumentCaptor<List<ChatMessage>> history = ArgumentCaptor.forClass(List.class);
        verify(model).generate(history.capture(), ArgumentMatchers.<StreamingResponseHandler<AiMessage>>any());
        assertEquals(List.of(SystemMessage.from(chatConfig.getSystemPrompt()), UserMessage.from("Hi")),
                history.getValue());
    }

    @Test
    void sendMessage_whileStreaming_shouldFail() throws Exception {
        givenStartableStream();
        service.sendMessage(conversation.id(), "Hi").get();

        var ex = assertThrows(ExecutionException.class, () -> service.sendMessage(conversation.id(), "Again").get());

        assertEquals(ServiceException.Kind.VALIDATION, ((ServiceException) ex.getCause()).getKind());
        assertTrue(service.isStreaming());
    }

    @Test
    void sendMessage_whenModelCannotBeCreated_shouldFailWithoutStreamEvents() throws Exception {
        when(conversations.load(conversation.id())).thenReturn(CompletableFuture.completedFuture(conversation));
        when(profiles.getDefault()).thenReturn(CompletableFuture.completedFuture(Optional.of(profile)));
        when(models.create(profile))
                .thenThrow(new ServiceException(ServiceException.Kind.CONFIGURATION, "Unsupported provider"));

        var ex = assertThrows(ExecutionException.class, () -> service.sendMessage(conversation.id(), "Hi").get());

        assertEquals(ServiceException.Kind.CONFIGURATION, ((ServiceException) ex.getCause()).getKind());
        assertTrue(events.drain().isEmpty());
        assertFalse(service.isStreaming());
        verify(conversations, never()).addUserMessage(any(), any());
    }

    @Test
    void sendMessage_withoutAnyProfile_shouldFallBackToConfiguredModel() throws Exception {
        when(conversations.load(conversation.id())).thenReturn(CompletableFuture.completedFuture(conversation));
        when(profiles.getDefault()).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(models.create(any()))
                .thenThrow(new ServiceException(ServiceException.Kind.NETWORK, "stop here"));

        assertThrows(ExecutionException.class, () -> service.sendMessage(conversation.id(), "Hi").get());

        verify(models).create(argThat(p -> p.modelId().equals(chatConfig.getDefaultModel())
                && p.providerId().equals("ollama")));
    }

    @Test
    void sendMessage_withConversationProfile_shouldUseIt() throws Exception {
        var own = ModelProfile.create("Own", "ollama", "qwen2.5:7b", null);
        var pinned = new Conversation(conversation.id(), "Pinned", own.id(), conversation.createdAt(),
                conversation.updatedAt(), List.of());
        when(conversations.load(pinned.id())).thenReturn(CompletableFuture.completedFuture(pinned));
        when(profiles.list()).thenReturn(CompletableFuture.completedFuture(List.of(profile, own)));
        when(models.create(own)).thenThrow(new ServiceException(ServiceException.Kind.NETWORK, "stop here"));

        assertThrows(ExecutionException.class, () -> service.sendMessage(pinned.id(), "Hi").get());

        verify(models).create(own);
        verify(profiles, never()).getDefault();
    }

    @Test
    void cancel_shouldPublishPartialAndSaveIt() throws Exception {
        givenStartableStream();
        givenReplySaved();
        service.sendMessage(conversation.id(), "Hi").get();
        handler.get().onNext("Partial ans");
        events.drain();

        service.cancel();
        handler.get().onNext("wer");
        handler.get().onComplete(Response.from(AiMessage.from("Partial answer")));

        var published = events.drain();
        var cancelled = (ChatEvent.StreamCancelled) published.get(0);
        assertEquals("Partial ans", cancelled.partialContent());
        assertInstanceOf(ChatEvent.MessageSaved.class, published.get(1));
        assertEquals(2, published.size());
        verify(conversations).addAssistantMessage(conversation.id(), "Partial ans", null);
        assertFalse(service.isStreaming());
    }

    @Test
    void cancel_withoutStream_shouldDoNothing() throws Exception {
        service.cancel();

        assertTrue(events.drain().isEmpty());
    }

    @Test
    void onError_shouldPublishStreamErrorAndNotSave() throws Exception {
        givenStartableStream();
        service.sendMessage(conversation.id(), "Hi").get();
        events.drain();

        handler.get().onError(new RuntimeException("boom", new IOException("connection reset")));

        assertEquals(List.of(new ChatEvent.StreamError(conversation.id(), "boom", true)), events.drain());
        verify(conversations, never()).addAssistantMessage(any(), any(), any());
        assertFalse(service.isStreaming());
    }

    @Test
    void isRecoverable_shouldOnlyAcceptTransportFailures() {
        assertTrue(LangChainChatService.isRecoverable(new IOException("reset")));
        assertFalse(LangChainChatService.isRecoverable(new IllegalArgumentException("bad model")));
    }
}
