package dev.personalagent.services.chat;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.Message;
import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.ChatService;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.services.AbstractAsyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static dev.personalagent.core.service.ServiceFutures.await;

/**
 * Chat service for offline mode. Replies by echoing the user's message word
 * by word, so the full event sequence can be exercised without a model.
 */
@Singleton
public class OfflineChatService extends AbstractAsyncService implements ChatService {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineChatService.class);

    static final String MODEL_ID = "offline-echo";

    private final ConversationService conversations;

    @Inject
    public OfflineChatService(EventBus eventBus, @Named(EXECUTOR) Executor executor,
            ConversationService conversations) {
        super(eventBus, executor);
        this.conversations = conversations;
    }

    @Override
    public CompletableFuture<Void> sendMessage(UUID conversationId, String text) {
        return run(() -> {
            await(conversations.addUserMessage(conversationId, text));
            UUID messageId = UUID.randomUUID();
            LOG.debug("Echoing {} chars in {}", text.length(), conversationId);
            publish(new ChatEvent.StreamStarted(conversationId, messageId, MODEL_ID));

            String reply = "Echo: " + text;
            String[] words = reply.split(" ");
            for (int i = 0; i < words.length; i++) {
                publish(new ChatEvent.TextDelta(i == 0 ? words[i] : " " + words[i]));
            }
            publish(new ChatEvent.StreamCompleted(conversationId, messageId, null));
            save(conversationId, reply);
        });
    }

    @Override
    public void cancel() {
        // replies complete synchronously, nothing to cancel
    }

    @Override
    public boolean isStreaming() {
        return false;
    }

    private void save(UUID conversationId, String reply) throws ServiceException {
        Message saved = await(conversations.addAssistantMessage(conversationId, reply, null));
        publish(new ChatEvent.MessageSaved(conversationId, saved.id()));
    }
}
