package dev.personalagent.services.chat;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.config.ChatConfig;
import dev.personalagent.core.domain.Conversation;
import dev.personalagent.core.domain.Message;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.service.ChatService;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.AbstractAsyncService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.StreamingResponseHandler;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static dev.personalagent.core.service.ServiceFutures.await;

/**
 * Streams replies through a langchain4j {@link StreamingChatLanguageModel}.
 *
 * <p>
 * One stream at a time. The conversation's profile picks the model, falling
 * back to the default profile and then to the configured Ollama model.
 * Reasoning wrapped in {@code <think>} tags is published as
 * {@link ChatEvent.ThinkingDelta}, everything else as
 * {@link ChatEvent.TextDelta}.
 */
@Singleton
public class LangChainChatService extends AbstractAsyncService implements ChatService {

    private static final Logger LOG = LoggerFactory.getLogger(LangChainChatService.class);

    private final ConversationService conversations;
    private final ProfileService profiles;
    private final StreamingModelFactory models;
    private final ChatConfig chatConfig;
    private final AtomicReference<ActiveStream> active = new AtomicReference<>();

    @Inject
    public LangChainChatService(EventBus eventBus, @Named(EXECUTOR) Executor executor,
            ConversationService conversations, ProfileService profiles, StreamingModelFactory models,
            ChatConfig chatConfig) {
        super(eventBus, executor);
        this.conversations = conversations;
        this.profiles = profiles;
        this.models = models;
        this.chatConfig = chatConfig;
    }

    @Override
    public CompletableFuture<Void> sendMessage(UUID conversationId, String text) {
        return run(() -> {
            ActiveStream stream = new ActiveStream(conversationId, UUID.randomUUID());
            if (!active.compareAndSet(null, stream)) {
                throw ServiceException.validation("A reply is still streaming");
            }
            try {
                Conversation conversation = await(conversations.load(conversationId));
                ModelProfile profile = resolveProfile(conversation);
                StreamingChatLanguageModel model = models.create(profile);

                await(conversations.addUserMessage(conversationId, text));
                List<ChatMessage> history = toChatMessages(await(conversations.getMessages(conversationId)));

                LOG.info("Streaming reply in {} with {}", conversationId, profile.modelId());
                publish(new ChatEvent.StreamStarted(conversationId, stream.messageId, profile.modelId()));
                model.generate(history, new StreamHandler(stream));
            } catch (ServiceException | RuntimeException e) {
                active.compareAndSet(stream, null);
                throw e;
            }
        });
    }

    @Override
    public void cancel() {
        ActiveStream stream = active.getAndSet(null);
        if (stream == null) {
            return;
        }
        String partial = stream.text.toString();
        LOG.info("Cancelled stream in {} after {} chars", stream.conversationId, partial.length());
        publish(new ChatEvent.StreamCancelled(stream.conversationId, stream.messageId, partial));
        if (!partial.isEmpty()) {
            persistReply(stream, partial);
        }
    }

    @Override
    public boolean isStreaming() {
        return active.get() != null;
    }

    // -- Internal --

    private ModelProfile resolveProfile(Conversation conversation) throws ServiceException {
        if (conversation.profileId() != null) {
            Optional<ModelProfile> own = await(profiles.list()).stream()
                    .filter(profile -> profile.id().equals(conversation.profileId()))
                    .findFirst();
            if (own.isPresent()) {
                return own.get();
            }
            LOG.warn("Profile {} of conversation {} is gone, using the default", conversation.profileId(),
                    conversation.id());
        }
        Optional<ModelProfile> fallback = await(profiles.getDefault());
        return fallback.orElseGet(() -> ModelProfile.create("Default", OllamaStreamingModelFactory.PROVIDER,
                chatConfig.getDefaultModel(), chatConfig.getOllamaBaseUrl()));
    }

    private List<ChatMessage> toChatMessages(List<Message> messages) {
        List<ChatMessage> history = new ArrayList<>();
        if (chatConfig.getSystemPrompt() != null && !chatConfig.getSystemPrompt().isBlank()) {
            history.add(SystemMessage.from(chatConfig.getSystemPrompt()));
        }
        for (Message message : messages) {
            switch (message.role()) {
                case USER:
                    history.add(UserMessage.from(message.content()));
                    break;
                case ASSISTANT:
                    history.add(AiMessage.from(message.content()));
                    break;
                case SYSTEM:
                    history.add(SystemMessage.from(message.content()));
                    break;
                default:
                    // tool results are not replayed
                    break;
            }
        }
        return history;
    }

    private void persistReply(ActiveStream stream, String text) {
        String thinking = stream.thinking.length() == 0 ? null : stream.thinking.toString();
        conversations.addAssistantMessage(stream.conversationId, text, thinking).whenComplete((saved, error) -> {
            if (error != null) {
                LOG.error("Could not save reply in {}", stream.conversationId, error);
                publish(new SystemEvent.Error("Chat", "Could not save the reply", String.valueOf(error.getMessage())));
            } else {
                publish(new ChatEvent.MessageSaved(stream.conversationId, saved.id()));
            }
        });
    }

    static boolean isRecoverable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static final class ActiveStream {
        private final UUID conversationId;
        private final UUID messageId;
        private final ThinkTagParser parser = new ThinkTagParser();
        private final StringBuffer text = new StringBuffer();
        private final StringBuffer thinking = new StringBuffer();

        private ActiveStream(UUID conversationId, UUID messageId) {
            this.conversationId = conversationId;
            this.messageId = messageId;
        }
    }

    private final class StreamHandler implements StreamingResponseHandler<AiMessage> {

        private final ActiveStream stream;

        private StreamHandler(ActiveStream stream) {
            this.stream = stream;
        }

        @Override
        public void onNext(String token) {
            if (active.get() != stream) {
                return;
            }
            publishSegments(stream.parser.feed(token));
        }

        @Override
        public void onComplete(Response<AiMessage> response) {
            if (!active.compareAndSet(stream, null)) {
                return;
            }
            publishSegments(stream.parser.flush());
            Integer totalTokens = response.tokenUsage() != null ? response.tokenUsage().totalTokenCount() : null;
            LOG.info("Stream in {} completed ({} tokens)", stream.conversationId, totalTokens);
            publish(new ChatEvent.StreamCompleted(stream.conversationId, stream.messageId, totalTokens));
            persistReply(stream, stream.text.toString());
        }

        @Override
        public void onError(Throwable error) {
            if (!active.compareAndSet(stream, null)) {
                return;
            }
            LOG.warn("Stream in {} failed: {}", stream.conversationId, error.getMessage());
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            publish(new ChatEvent.StreamError(stream.conversationId, message, isRecoverable(error)));
        }

        private void publishSegments(List<ThinkTagParser.Segment> segments) {
            for (ThinkTagParser.Segment segment : segments) {
                if (segment.thinking()) {
                    stream.thinking.append(segment.text());
                    publish(new ChatEvent.ThinkingDelta(segment.text()));
                } else {
                    stream.text.append(segment.text());
                    publish(new ChatEvent.TextDelta(segment.text()));
                }
            }
        }
    }
}
