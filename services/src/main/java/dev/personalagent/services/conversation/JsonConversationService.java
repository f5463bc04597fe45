package dev.personalagent.services.conversation;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.Conversation;
import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.core.domain.Message;
import dev.personalagent.core.event.ConversationEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.storage.JsonDirectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Conversations stored as one JSON file each, cached in memory after the
 * first access. The active conversation is session state and not persisted.
 */
@Singleton
public class JsonConversationService extends AbstractAsyncService implements ConversationService {

    private static final Logger LOG = LoggerFactory.getLogger(JsonConversationService.class);

    private final JsonDirectoryStore<Conversation> store;
    private final Object lock = new Object();

    // Guarded by lock
    private Map<UUID, Conversation> cache;
    private UUID activeId;

    @Inject
    public JsonConversationService(EventBus eventBus, @Named(EXECUTOR) Executor executor, AppDirectories directories) {
        this(eventBus, executor, directories.conversations());
    }

    public JsonConversationService(EventBus eventBus, Executor executor, Path directory) {
        super(eventBus, executor);
        this.store = new JsonDirectoryStore<>(directory, Conversation.class);
    }

    @Override
    public CompletableFuture<Conversation> create(String title, UUID profileId) {
        return async(() -> {
            Conversation conversation = Conversation.create(title, profileId);
            synchronized (lock) {
                store.save(conversation.id(), conversation);
                conversations().put(conversation.id(), conversation);
            }
            LOG.info("Created conversation {} '{}'", conversation.id(), conversation.title());
            publish(new ConversationEvent.Created(conversation.id(), conversation.title()));
            return conversation;
        });
    }

    @Override
    public CompletableFuture<Conversation> load(UUID id) {
        return async(() -> {
            Conversation conversation;
            synchronized (lock) {
                conversation = require(id);
            }
            publish(new ConversationEvent.Loaded(id));
            return conversation;
        });
    }

    @Override
    public CompletableFuture<List<ConversationSummary>> list(int limit, int offset) {
        return async(() -> {
            List<ConversationSummary> page;
            int total;
            synchronized (lock) {
                total = conversations().size();
                page = conversations().values().stream()
                        .sorted(Comparator.comparing(Conversation::updatedAt).reversed())
                        .skip(Math.max(0, offset))
                        .limit(Math.max(0, limit))
                        .map(Conversation::toSummary)
                        .toList();
            }
            publish(new ConversationEvent.ListRefreshed(total));
            return page;
        });
    }

    @Override
    public CompletableFuture<Message> addUserMessage(UUID conversationId, String content) {
        return async(() -> append(conversationId, Message.user(content)));
    }

    @Override
    public CompletableFuture<Message> addAssistantMessage(UUID conversationId, String content, String thinking) {
        return async(() -> append(conversationId, Message.assistant(content, thinking)));
    }

    @Override
    public CompletableFuture<Conversation> rename(UUID id, String title) {
        return async(() -> {
            if (title == null || title.isBlank()) {
                throw ServiceException.validation("Title must not be empty");
            }
            String trimmed = title.trim();
            Conversation renamed = modify(id, conversation -> conversation.withTitle(trimmed));
            publish(new ConversationEvent.TitleUpdated(id, trimmed));
            return renamed;
        });
    }

    @Override
    public CompletableFuture<Void> delete(UUID id) {
        return run(() -> {
            boolean wasActive;
            synchronized (lock) {
                require(id);
                store.delete(id);
                conversations().remove(id);
                wasActive = id.equals(activeId);
                if (wasActive) {
                    activeId = null;
                }
            }
            LOG.info("Deleted conversation {}", id);
            publish(new ConversationEvent.Deleted(id));
            if (wasActive) {
                publish(new ConversationEvent.Deactivated());
            }
        });
    }

    @Override
    public CompletableFuture<Void> setActive(UUID id) {
        return run(() -> {
            synchronized (lock) {
                require(id);
                activeId = id;
            }
            publish(new ConversationEvent.Activated(id));
        });
    }

    @Override
    public CompletableFuture<Optional<Conversation>> getActive() {
        return async(() -> {
            synchronized (lock) {
                return Optional.ofNullable(activeId).map(conversations()::get);
            }
        });
    }

    @Override
    public CompletableFuture<List<Message>> getMessages(UUID conversationId) {
        return async(() -> {
            synchronized (lock) {
                return require(conversationId).messages();
            }
        });
    }

    // -- Internal --

    private Message append(UUID conversationId, Message message) throws ServiceException {
        modify(conversationId, conversation -> conversation.withMessage(message));
        return message;
    }

    private Conversation modify(UUID id, UnaryOperator<Conversation> change) throws ServiceException {
        synchronized (lock) {
            Conversation updated = change.apply(require(id));
            store.save(id, updated);
            conversations().put(id, updated);
            return updated;
        }
    }

    private Conversation require(UUID id) throws ServiceException {
        Conversation conversation = conversations().get(id);
        if (conversation == null) {
            throw ServiceException.notFound("Conversation", id);
        }
        return conversation;
    }

    private Map<UUID, Conversation> conversations() throws ServiceException {
        if (cache == null) {
            Map<UUID, Conversation> loaded = new LinkedHashMap<>();
            for (Conversation conversation : store.loadAll()) {
                loaded.put(conversation.id(), conversation);
            }
            cache = loaded;
            LOG.info("Loaded {} conversation(s) from {}", loaded.size(), store.directory());
        }
        return cache;
    }
}
