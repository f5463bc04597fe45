package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.service.McpService;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;

import java.util.concurrent.Executor;

/**
 * Configure-MCP screen: editing a server's command and environment and
 * starting OAuth authorization.
 */
@Singleton
public class McpConfigurePresenter extends AbstractPresenter {

    private final McpService mcp;

    @Inject
    public McpConfigurePresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            McpService mcp) {
        super(eventBus, sink, executor);
        this.mcp = mcp;
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent.ConfigureMcp configure) {
            attempt("Could Not Load MCP Server", ErrorSeverity.ERROR,
                    () -> send(new ViewCommand.McpConfigureLoaded(await(mcp.get(configure.id())))));
        } else if (event instanceof UserEvent.SaveMcpConfig save) {
            attempt("Could Not Save MCP Server", ErrorSeverity.ERROR, () -> {
                await(mcp.update(save.config().withId(save.id())));
                send(new ViewCommand.NavigateBack());
            });
        } else if (event instanceof UserEvent.StartMcpOAuth oauth) {
            attempt("Authorization Failed", ErrorSeverity.ERROR,
                    () -> send(new ViewCommand.OpenExternalUrl(await(mcp.beginOAuth(oauth.id(), oauth.provider())))));
        } else if (event instanceof McpEvent.ConfigSaved saved) {
            send(new ViewCommand.McpConfigSaved(saved.id()));
        }
    }
}
