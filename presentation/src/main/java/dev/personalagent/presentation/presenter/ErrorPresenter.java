package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.ChatEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.McpEvent;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;

import java.util.concurrent.Executor;

/**
 * Turns failures that arrive as events into error dialogs. Calls no services.
 */
@Singleton
public class ErrorPresenter extends AbstractPresenter {

    @Inject
    public ErrorPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor) {
        super(eventBus, sink, executor);
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof SystemEvent.Error error) {
            StringBuilder message = new StringBuilder(error.source()).append(": ").append(error.error());
            if (error.context() != null && !error.context().isBlank()) {
                message.append("\n\nContext: ").append(error.context());
            }
            showError(error.source() + " Error", message.toString(), ErrorSeverity.CRITICAL);
        } else if (event instanceof SystemEvent.ModelsRegistryRefreshFailed failed) {
            showError("Models Registry", "Could not refresh the models registry: " + failed.error(),
                    ErrorSeverity.WARNING);
        } else if (event instanceof ChatEvent.StreamError error) {
            showError("Chat Error", error.error(), error.recoverable() ? ErrorSeverity.WARNING : ErrorSeverity.ERROR);
        } else if (event instanceof McpEvent.StartFailed failed) {
            showError("MCP Server Error", "Failed to start MCP server '" + failed.name() + "': " + failed.error(),
                    ErrorSeverity.ERROR);
        } else if (event instanceof McpEvent.Unhealthy unhealthy) {
            showError("MCP Server Unhealthy",
                    "MCP server '" + unhealthy.name() + "' is unhealthy: " + unhealthy.error(),
                    ErrorSeverity.WARNING);
        }
    }
}
