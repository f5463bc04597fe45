package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.Conversation;
import dev.personalagent.core.domain.Message;
import dev.personalagent.core.domain.MessageRole;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.ConversationEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.service.ChatService;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.service.ServiceFutures;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the chat panel: sending messages, the streamed reply, renaming and
 * switching the displayed conversation.
 */
@Singleton
public class ChatPresenter extends AbstractPresenter {

    private static final Logger LOG = LoggerFactory.getLogger(ChatPresenter.class);

    private final ConversationService conversations;
    private final ChatService chat;
    private final ProfileService profiles;

    // Only touched from the event loop
    private UUID displayedConversationId;
    // Also cleared by a failed send
    private final AtomicReference<UUID> streamingConversationId = new AtomicReference<>();

    @Inject
    public ChatPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            ConversationService conversations, ChatService chat, ProfileService profiles) {
        super(eventBus, sink, executor);
        this.conversations = conversations;
        this.chat = chat;
        this.profiles = profiles;
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent userEvent) {
            onUserEvent(userEvent);
        } else if (event instanceof ChatEvent chatEvent) {
            onChatEvent(chatEvent);
        } else if (event instanceof ConversationEvent conversationEvent) {
            onConversationEvent(conversationEvent);
        }
    }

    // -- User Events --

    private void onUserEvent(UserEvent event) {
        if (event instanceof UserEvent.SendMessage send) {
            sendMessage(send.text());
        } else if (event instanceof UserEvent.StopStreaming) {
            LOG.info("Stopping stream for {}", streamingConversationId.get());
            chat.cancel();
        } else if (event instanceof UserEvent.NewConversation) {
            attempt("Could Not Create Conversation", ErrorSeverity.ERROR, this::newConversation);
        } else if (event instanceof UserEvent.ToggleThinking) {
            send(new ViewCommand.ToggleThinkingVisibility());
        } else if (event instanceof UserEvent.StartRenameConversation start) {
            send(new ViewCommand.RenameModeChanged(start.id()));
        } else if (event instanceof UserEvent.CancelRenameConversation) {
            send(new ViewCommand.RenameModeChanged(null));
        } else if (event instanceof UserEvent.ConfirmRenameConversation confirm) {
            rename(confirm.id(), confirm.title());
        }
    }

    private void sendMessage(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            LOG.debug("Ignoring empty message");
            return;
        }
        if (chat.isStreaming()) {
            showError("Message Not Sent", "A reply is still streaming", ErrorSeverity.WARNING);
            return;
        }

        UUID conversationId;
        try {
            conversationId = activeOrCreateConversation().id();
        } catch (ServiceException e) {
            LOG.warn("Sending message failed: {}", e.getMessage());
            showError("Message Failed", "Could not send message: " + e.getMessage(),
                    severityFor(e, ErrorSeverity.ERROR));
            return;
        }

        send(new ViewCommand.MessageAppended(conversationId, MessageRole.USER, text));
        send(new ViewCommand.ShowThinking(conversationId));
        streamingConversationId.set(conversationId);
        // The reply arrives as ChatEvents on this loop, so the send is not awaited here
        chat.sendMessage(conversationId, text).whenComplete((ignored, error) -> {
            if (error != null) {
                sendFailed(conversationId, ServiceFutures.unwrap(error));
            }
        });
    }

    /**
     * Runs on the thread completing the send. A rejected send never started a
     * stream, so the live one is left alone.
     */
    private void sendFailed(UUID conversationId, ServiceException e) {
        LOG.warn("Sending message failed: {}", e.getMessage());
        if (e.getKind() != ServiceException.Kind.VALIDATION) {
            streamingConversationId.compareAndSet(conversationId, null);
            send(new ViewCommand.StreamError(conversationId, e.getMessage(), true));
            send(new ViewCommand.HideThinking(conversationId));
        }
        showError("Message Failed", "Could not send message: " + e.getMessage(), severityFor(e, ErrorSeverity.ERROR));
    }

    private Conversation activeOrCreateConversation() throws ServiceException {
        Optional<Conversation> active = await(conversations.getActive());
        if (active.isPresent()) {
            return active.get();
        }
        return createAndActivate();
    }

    private void newConversation() throws ServiceException {
        createAndActivate();
    }

    private Conversation createAndActivate() throws ServiceException {
        UUID profileId = await(profiles.getDefault()).map(ModelProfile::id).orElse(null);
        Conversation created = await(conversations.create(null, profileId));
        displayedConversationId = created.id();
        send(new ViewCommand.ConversationCleared());
        send(new ViewCommand.ConversationCreated(created.id(), profileId));
        await(conversations.setActive(created.id()));
        return created;
    }

    private void rename(UUID id, String title) {
        String trimmed = title == null ? "" : title.trim();
        if (trimmed.isEmpty()) {
            showError("Rename Failed", "Title must not be empty", ErrorSeverity.WARNING);
            return;
        }
        attempt("Rename Failed", ErrorSeverity.ERROR, () -> {
            await(conversations.rename(id, trimmed));
            send(new ViewCommand.ConversationRenamed(id, trimmed));
            send(new ViewCommand.RenameModeChanged(null));
        });
    }

    // -- Chat Events --

    private void onChatEvent(ChatEvent event) {
        if (event instanceof ChatEvent.StreamStarted started) {
            streamingConversationId.set(started.conversationId());
        } else if (event instanceof ChatEvent.TextDelta delta) {
            send(new ViewCommand.AppendStream(streamingConversationId.get(), delta.text()));
        } else if (event instanceof ChatEvent.ThinkingDelta delta) {
            send(new ViewCommand.AppendThinking(streamingConversationId.get(), delta.text()));
        } else if (event instanceof ChatEvent.ToolCallStarted tool) {
            send(new ViewCommand.ShowToolCall(streamingConversationId.get(), tool.toolName(), "running"));
        } else if (event instanceof ChatEvent.ToolCallCompleted tool) {
            send(new ViewCommand.UpdateToolCall(streamingConversationId.get(), tool.toolName(),
                    tool.success() ? "completed" : "failed", tool.result(), tool.durationMs()));
        } else if (event instanceof ChatEvent.StreamCompleted completed) {
            send(new ViewCommand.FinalizeStream(completed.conversationId(), completed.totalTokens()));
            send(new ViewCommand.HideThinking(completed.conversationId()));
            streamingConversationId.set(null);
        } else if (event instanceof ChatEvent.StreamCancelled cancelled) {
            send(new ViewCommand.StreamCancelled(cancelled.conversationId(), cancelled.partialContent()));
            send(new ViewCommand.HideThinking(cancelled.conversationId()));
            streamingConversationId.set(null);
        } else if (event instanceof ChatEvent.StreamError error) {
            // The dialog comes from ErrorPresenter
            send(new ViewCommand.StreamError(error.conversationId(), error.error(), error.recoverable()));
            send(new ViewCommand.HideThinking(error.conversationId()));
            streamingConversationId.set(null);
        } else if (event instanceof ChatEvent.MessageSaved saved) {
            send(new ViewCommand.MessageSaved(saved.conversationId()));
        }
    }

    // -- Conversation Events --

    private void onConversationEvent(ConversationEvent event) {
        if (event instanceof ConversationEvent.Activated activated) {
            showConversation(activated.id());
        } else if (event instanceof ConversationEvent.Deleted deleted) {
            if (deleted.id().equals(displayedConversationId)) {
                displayedConversationId = null;
                send(new ViewCommand.ConversationCleared());
            }
        } else if (event instanceof ConversationEvent.Deactivated) {
            displayedConversationId = null;
            send(new ViewCommand.ConversationCleared());
        } else if (event instanceof ConversationEvent.ListRefreshed refreshed) {
            send(new ViewCommand.HistoryUpdated(refreshed.count()));
        }
    }

    private void showConversation(UUID id) {
        if (id.equals(displayedConversationId)) {
            send(new ViewCommand.ConversationActivated(id));
            return;
        }
        attempt("Could Not Load Conversation", ErrorSeverity.ERROR, () -> {
            List<Message> messages = await(conversations.getMessages(id));
            displayedConversationId = id;
            send(new ViewCommand.ConversationCleared());
            send(new ViewCommand.ConversationActivated(id));
            for (Message message : messages) {
                send(new ViewCommand.MessageAppended(id, message.role(), message.content()));
            }
        });
    }
}
