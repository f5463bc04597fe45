package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.ProfileEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.SecretsService;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Profile editor: loading a profile for editing, saving it together with its
 * API key, and connection tests.
 */
@Singleton
public class ProfileEditorPresenter extends AbstractPresenter {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileEditorPresenter.class);

    private final ProfileService profiles;
    private final SecretsService secrets;

    // id of the stored profile being edited, null while creating a new one
    private UUID editingId;

    @Inject
    public ProfileEditorPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            ProfileService profiles, SecretsService secrets) {
        super(eventBus, sink, executor);
        this.profiles = profiles;
        this.secrets = secrets;
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent.CreateProfile) {
            editingId = null;
            send(new ViewCommand.ProfileEditorLoaded(null, false));
        } else if (event instanceof UserEvent.EditProfile edit) {
            loadForEditing(edit.id());
        } else if (event instanceof UserEvent.SaveProfile save) {
            save(save.profile(), save.apiKey());
        } else if (event instanceof UserEvent.TestProfileConnection test) {
            attempt("Connection Test Failed", ErrorSeverity.ERROR, () -> await(profiles.testConnection(test.id())));
        } else if (event instanceof ProfileEvent profileEvent) {
            onProfileEvent(profileEvent);
        }
    }

    private void loadForEditing(UUID id) {
        attempt("Could Not Load Profile", ErrorSeverity.ERROR, () -> {
            ModelProfile profile = await(profiles.get(id));
            boolean hasApiKey = await(secrets.getApiKey(id)).isPresent();
            editingId = id;
            send(new ViewCommand.ProfileEditorLoaded(profile, hasApiKey));
        });
    }

    private void save(ModelProfile profile, String apiKey) {
        attempt("Could Not Save Profile", ErrorSeverity.ERROR, () -> {
            boolean existing = profile.id().equals(editingId);
            ModelProfile saved = existing ? await(profiles.update(profile)) : await(profiles.create(profile));
            if (apiKey != null && !apiKey.isBlank()) {
                await(secrets.storeApiKey(saved.id(), apiKey.trim()));
            }
            LOG.info("{} profile '{}'", existing ? "Updated" : "Created", saved.name());
            editingId = null;
            send(new ViewCommand.NavigateBack());
        });
    }

    private void onProfileEvent(ProfileEvent event) {
        if (event instanceof ProfileEvent.TestStarted started) {
            send(new ViewCommand.ProfileTestStarted(started.id()));
        } else if (event instanceof ProfileEvent.TestCompleted completed) {
            send(new ViewCommand.ProfileTestCompleted(completed.id(), completed.success(),
                    completed.responseTimeMs(), completed.error()));
            if (!completed.success()) {
                showError("Connection Failed", completed.error(), ErrorSeverity.WARNING);
            }
        } else if (event instanceof ProfileEvent.Deleted deleted) {
            attempt("Could Not Remove API Key", ErrorSeverity.WARNING,
                    () -> await(secrets.deleteApiKey(deleted.id())));
        }
    }
}
