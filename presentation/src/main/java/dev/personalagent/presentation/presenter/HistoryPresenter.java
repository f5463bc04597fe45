package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.config.UiConfig;
import dev.personalagent.core.domain.ConversationSummary;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.ConversationEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ModalId;
import dev.personalagent.presentation.view.ViewCommand;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Keeps the conversation list current and handles opening and deleting
 * conversations from it.
 */
@Singleton
public class HistoryPresenter extends AbstractPresenter {

    private final ConversationService conversations;
    private final int pageSize;

    @Inject
    public HistoryPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            ConversationService conversations, UiConfig uiConfig) {
        super(eventBus, sink, executor);
        this.conversations = conversations;
        this.pageSize = uiConfig.getHistoryPageSize();
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent.Navigate navigate && navigate.to() == ViewId.HISTORY) {
            refreshList();
        } else if (event instanceof UserEvent.SelectConversation select) {
            openConversation(select.id());
        } else if (event instanceof UserEvent.DeleteConversation delete) {
            send(new ViewCommand.ShowModal(new ModalId(ModalId.Kind.CONFIRM_DELETE_CONVERSATION, delete.id())));
        } else if (event instanceof UserEvent.ConfirmDeleteConversation confirm) {
            send(new ViewCommand.DismissModal());
            attempt("Could Not Delete Conversation", ErrorSeverity.ERROR,
                    () -> await(conversations.delete(confirm.id())));
        } else if (event instanceof ConversationEvent conversationEvent) {
            onConversationEvent(conversationEvent);
        }
    }

    private void openConversation(UUID id) {
        attempt("Could Not Open Conversation", ErrorSeverity.ERROR, () -> {
            await(conversations.setActive(id));
            send(new ViewCommand.NavigateBack());
        });
    }

    private void onConversationEvent(ConversationEvent event) {
        if (event instanceof ConversationEvent.Created) {
            refreshList();
        } else if (event instanceof ConversationEvent.TitleUpdated updated) {
            send(new ViewCommand.ConversationTitleUpdated(updated.id(), updated.title()));
        } else if (event instanceof ConversationEvent.Deleted deleted) {
            send(new ViewCommand.ConversationDeleted(deleted.id()));
            refreshList();
        }
    }

    private void refreshList() {
        attempt("Could Not Load History", ErrorSeverity.ERROR, () -> {
            List<ConversationSummary> summaries = await(conversations.list(pageSize, 0));
            send(new ViewCommand.ConversationListRefreshed(summaries));
        });
    }
}
