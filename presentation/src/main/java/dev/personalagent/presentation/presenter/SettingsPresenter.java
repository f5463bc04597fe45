package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpStatus;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.domain.ProfileSummary;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.event.ProfileEvent;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.core.service.AppSettingsService;
import dev.personalagent.core.service.McpService;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ModalId;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Settings screen: profile list and default profile, MCP server list and
 * status, and the entry points into the editors.
 *
 * <p>
 * Failures reported as events ({@link McpEvent.StartFailed},
 * {@link McpEvent.Unhealthy}, {@link SystemEvent.Error}) only update status
 * here; {@link ErrorPresenter} raises the dialog for them.
 */
@Singleton
public class SettingsPresenter extends AbstractPresenter {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsPresenter.class);

    private final ProfileService profiles;
    private final AppSettingsService settings;
    private final McpService mcp;

    @Inject
    public SettingsPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            ProfileService profiles, AppSettingsService settings, McpService mcp) {
        super(eventBus, sink, executor);
        this.profiles = profiles;
        this.settings = settings;
        this.mcp = mcp;
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent userEvent) {
            onUserEvent(userEvent);
        } else if (event instanceof ProfileEvent profileEvent) {
            onProfileEvent(profileEvent);
        } else if (event instanceof McpEvent mcpEvent) {
            onMcpEvent(mcpEvent);
        } else if (event instanceof SystemEvent systemEvent) {
            onSystemEvent(systemEvent);
        }
    }

    // -- User Events --

    private void onUserEvent(UserEvent event) {
        if (event instanceof UserEvent.Navigate navigate && navigate.to() == ViewId.SETTINGS) {
            loadSettings();
        } else if (event instanceof UserEvent.SelectProfile select) {
            attempt("Could Not Change Default Profile", ErrorSeverity.ERROR, () -> {
                await(profiles.setDefault(select.id()));
                await(settings.setDefaultProfileId(select.id()));
            });
        } else if (event instanceof UserEvent.CreateProfile || event instanceof UserEvent.EditProfile) {
            send(new ViewCommand.NavigateTo(ViewId.PROFILE_EDITOR));
        } else if (event instanceof UserEvent.DeleteProfile delete) {
            send(new ViewCommand.ShowModal(new ModalId(ModalId.Kind.CONFIRM_DELETE_PROFILE, delete.id())));
        } else if (event instanceof UserEvent.ConfirmDeleteProfile confirm) {
            send(new ViewCommand.DismissModal());
            attempt("Could Not Delete Profile", ErrorSeverity.ERROR, () -> await(profiles.delete(confirm.id())));
        } else if (event instanceof UserEvent.ToggleMcp toggle) {
            attempt("Could Not Update MCP Server", ErrorSeverity.ERROR,
                    () -> await(mcp.setEnabled(toggle.id(), toggle.enabled())));
        } else if (event instanceof UserEvent.AddMcp) {
            send(new ViewCommand.NavigateTo(ViewId.MCP_ADD));
        } else if (event instanceof UserEvent.ConfigureMcp) {
            send(new ViewCommand.NavigateTo(ViewId.MCP_CONFIGURE));
        } else if (event instanceof UserEvent.DeleteMcp delete) {
            send(new ViewCommand.ShowModal(new ModalId(ModalId.Kind.CONFIRM_DELETE_MCP, delete.id())));
        } else if (event instanceof UserEvent.ConfirmDeleteMcp confirm) {
            send(new ViewCommand.DismissModal());
            attempt("Could Not Delete MCP Server", ErrorSeverity.ERROR, () -> await(mcp.delete(confirm.id())));
        }
    }

    private void loadSettings() {
        attempt("Could Not Load Settings", ErrorSeverity.ERROR, this::sendSettings);
    }

    private void sendSettings() throws ServiceException {
        List<ModelProfile> all = await(profiles.list());
        Optional<UUID> defaultId = await(profiles.getDefault()).map(ModelProfile::id);
        List<ProfileSummary> summaries = all.stream()
                .map(profile -> ProfileSummary.of(profile, defaultId.filter(profile.id()::equals).isPresent()))
                .toList();
        List<McpConfig> servers = await(mcp.list());
        send(new ViewCommand.ShowSettings(summaries, servers));
    }

    // -- Profile Events --

    private void onProfileEvent(ProfileEvent event) {
        if (event instanceof ProfileEvent.Created created) {
            send(new ViewCommand.ProfileCreated(created.id(), created.name()));
            loadSettings();
        } else if (event instanceof ProfileEvent.Updated updated) {
            send(new ViewCommand.ProfileUpdated(updated.id(), updated.name()));
            loadSettings();
        } else if (event instanceof ProfileEvent.Deleted deleted) {
            send(new ViewCommand.ProfileDeleted(deleted.id()));
            loadSettings();
        } else if (event instanceof ProfileEvent.DefaultChanged changed) {
            send(new ViewCommand.DefaultProfileChanged(changed.profileId()));
        }
    }

    // -- MCP Events --

    private void onMcpEvent(McpEvent event) {
        if (event instanceof McpEvent.Starting starting) {
            send(new ViewCommand.McpStatusChanged(starting.id(), McpStatus.STARTING));
        } else if (event instanceof McpEvent.Started started) {
            send(new ViewCommand.McpServerStarted(started.id(), started.toolCount()));
            send(new ViewCommand.McpStatusChanged(started.id(), McpStatus.RUNNING));
            refreshTools();
        } else if (event instanceof McpEvent.StartFailed failed) {
            send(new ViewCommand.McpServerFailed(failed.id(), failed.error()));
            send(new ViewCommand.McpStatusChanged(failed.id(), McpStatus.FAILED));
        } else if (event instanceof McpEvent.Stopped stopped) {
            send(new ViewCommand.McpStatusChanged(stopped.id(), McpStatus.STOPPED));
            refreshTools();
        } else if (event instanceof McpEvent.Unhealthy unhealthy) {
            send(new ViewCommand.McpStatusChanged(unhealthy.id(), McpStatus.UNHEALTHY));
        } else if (event instanceof McpEvent.Recovered recovered) {
            send(new ViewCommand.McpStatusChanged(recovered.id(), McpStatus.RUNNING));
            send(new ViewCommand.ShowNotification("MCP server '" + recovered.name() + "' recovered"));
        } else if (event instanceof McpEvent.Restarting restarting) {
            send(new ViewCommand.McpStatusChanged(restarting.id(), McpStatus.STARTING));
        } else if (event instanceof McpEvent.Deleted deleted) {
            send(new ViewCommand.McpDeleted(deleted.id()));
            loadSettings();
        }
    }

    private void refreshTools() {
        attempt("Could Not Load MCP Tools", ErrorSeverity.WARNING,
                () -> send(new ViewCommand.McpToolsUpdated(await(mcp.getAvailableTools()))));
    }

    // -- System Events --

    private void onSystemEvent(SystemEvent event) {
        if (event instanceof SystemEvent.ConfigLoaded) {
            send(new ViewCommand.ShowNotification("Configuration loaded"));
        } else if (event instanceof SystemEvent.ConfigSaved) {
            send(new ViewCommand.ShowNotification("Settings saved"));
        } else if (event instanceof SystemEvent.HotkeyChanged changed) {
            send(new ViewCommand.ShowNotification("Hotkey changed to " + changed.hotkey()));
        } else if (event instanceof SystemEvent.ModelsRegistryRefreshed refreshed) {
            LOG.info("Models registry refreshed: {} providers, {} models",
                    refreshed.providerCount(), refreshed.modelCount());
            send(new ViewCommand.ShowNotification("Models registry refreshed: "
                    + refreshed.providerCount() + " providers, " + refreshed.modelCount() + " models"));
        }
    }
}
