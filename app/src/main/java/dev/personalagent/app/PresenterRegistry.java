package dev.personalagent.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import dev.personalagent.presentation.presenter.ChatPresenter;
import dev.personalagent.presentation.presenter.ErrorPresenter;
import dev.personalagent.presentation.presenter.HistoryPresenter;
import dev.personalagent.presentation.presenter.McpAddPresenter;
import dev.personalagent.presentation.presenter.McpConfigurePresenter;
import dev.personalagent.presentation.presenter.ModelSelectorPresenter;
import dev.personalagent.presentation.presenter.Presenter;
import dev.personalagent.presentation.presenter.ProfileEditorPresenter;
import dev.personalagent.presentation.presenter.SettingsPresenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Owns the presenters of one application run and starts or stops them
 * together.
 */
@Singleton
public class PresenterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PresenterRegistry.class);

    private final List<Presenter> presenters;

    @Inject
    public PresenterRegistry(ChatPresenter chat, HistoryPresenter history, SettingsPresenter settings,
            ProfileEditorPresenter profileEditor, McpAddPresenter mcpAdd, McpConfigurePresenter mcpConfigure,
            ModelSelectorPresenter modelSelector, ErrorPresenter error) {
        this(List.of(chat, history, settings, profileEditor, mcpAdd, mcpConfigure, modelSelector, error));
    }

    PresenterRegistry(List<Presenter> presenters) {
        this.presenters = List.copyOf(presenters);
    }

    /**
     * Subscribes every presenter. Events published after this returns reach
     * all of them.
     */
    public void startAll() {
        presenters.forEach(Presenter::start);
        LOG.info("Started {} presenters", presenters.size());
    }

    public void stopAll() {
        presenters.forEach(Presenter::stop);
        LOG.info("Stopped {} presenters", presenters.size());
    }

    public long runningCount() {
        return presenters.stream().filter(Presenter::isRunning).count();
    }

    public List<Presenter> presenters() {
        return presenters;
    }
}
