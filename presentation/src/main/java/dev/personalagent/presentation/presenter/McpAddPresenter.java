package dev.personalagent.presentation.presenter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import dev.personalagent.core.config.UiConfig;
import dev.personalagent.core.domain.McpAuthType;
import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.domain.McpRegistryEntry;
import dev.personalagent.core.domain.McpRegistrySource;
import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.event.ViewId;
import dev.personalagent.core.service.McpRegistryService;
import dev.personalagent.core.service.McpService;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Add-MCP screen: registry browsing and installing a server from a registry
 * entry. Entries that need credentials are added disabled and the configure
 * screen is opened for them.
 */
@Singleton
public class McpAddPresenter extends AbstractPresenter {

    private static final Logger LOG = LoggerFactory.getLogger(McpAddPresenter.class);

    private final McpRegistryService registry;
    private final McpService mcp;
    private final int trendingCount;

    @Inject
    public McpAddPresenter(EventBus eventBus, ViewCommandSink sink, @Named(EXECUTOR) Executor executor,
            McpRegistryService registry, McpService mcp, UiConfig uiConfig) {
        super(eventBus, sink, executor);
        this.registry = registry;
        this.mcp = mcp;
        this.trendingCount = uiConfig.getTrendingMcpCount();
    }

    @Override
    protected void handle(AppEvent event) {
        if (event instanceof UserEvent.AddMcp
                || event instanceof UserEvent.Navigate navigate && navigate.to() == ViewId.MCP_ADD) {
            attempt("Could Not Load MCP Registry", ErrorSeverity.ERROR,
                    () -> send(new ViewCommand.McpRegistryResults(await(registry.listTrending(trendingCount)))));
        } else if (event instanceof UserEvent.SearchMcpRegistry search) {
            LOG.debug("Searching MCP registry '{}' for '{}'", search.source(), search.query());
            attempt("MCP Registry Search Failed", ErrorSeverity.ERROR, () -> send(
                    new ViewCommand.McpRegistryResults(await(registry.search(search.query(), search.source())))));
        } else if (event instanceof UserEvent.SelectMcpFromRegistry select) {
            install(select.source());
        }
    }

    private void install(McpRegistrySource source) {
        attempt("Could Not Add MCP Server", ErrorSeverity.ERROR, () -> {
            Optional<McpRegistryEntry> entry = await(registry.getDetails(source.name()));
            if (entry.isEmpty()) {
                showError("MCP Server Not Found", "No registry entry named '" + source.name() + "'",
                        ErrorSeverity.WARNING);
                return;
            }
            installEntry(entry.get());
        });
    }

    private void installEntry(McpRegistryEntry entry) throws ServiceException {
        boolean needsCredentials = entry.env().values().stream().anyMatch(String::isBlank);
        McpConfig config = new McpConfig(UUID.randomUUID(),
                entry.displayName() != null ? entry.displayName() : entry.name(),
                entry.command(), entry.args(), entry.env(), !needsCredentials,
                needsCredentials ? authTypeFor(entry) : McpAuthType.NONE,
                entry.registry() + ": " + entry.name());

        McpConfig added = await(mcp.add(config));
        send(new ViewCommand.McpServerAdded(added.id(), added.name()));
        if (needsCredentials) {
            send(new ViewCommand.McpConfigureLoaded(added));
            send(new ViewCommand.NavigateTo(ViewId.MCP_CONFIGURE));
        } else {
            send(new ViewCommand.NavigateBack());
        }
    }

    private static McpAuthType authTypeFor(McpRegistryEntry entry) {
        boolean oauth = entry.tags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).equals("oauth"));
        return oauth ? McpAuthType.OAUTH : McpAuthType.API_KEY;
    }
}
