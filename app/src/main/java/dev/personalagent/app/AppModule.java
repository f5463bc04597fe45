package dev.personalagent.app;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Key;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.inject.name.Names;
import dev.personalagent.core.config.AppConfig;
import dev.personalagent.core.config.ApplicationMode;
import dev.personalagent.core.config.BusConfig;
import dev.personalagent.core.config.ChatConfig;
import dev.personalagent.core.config.ConfigLoader;
import dev.personalagent.core.config.UiConfig;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.service.AppSettingsService;
import dev.personalagent.core.service.ChatService;
import dev.personalagent.core.service.ConversationService;
import dev.personalagent.core.service.McpRegistryService;
import dev.personalagent.core.service.McpService;
import dev.personalagent.core.service.ModelsRegistryService;
import dev.personalagent.core.service.ProfileService;
import dev.personalagent.core.service.SecretsService;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.presentation.bridge.RuntimeBridge;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.bridge.ViewNotifier;
import dev.personalagent.presentation.presenter.AbstractPresenter;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.chat.LangChainChatService;
import dev.personalagent.services.chat.OfflineChatService;
import dev.personalagent.services.chat.OllamaStreamingModelFactory;
import dev.personalagent.services.chat.StreamingModelFactory;
import dev.personalagent.services.conversation.JsonConversationService;
import dev.personalagent.services.mcp.JsonMcpService;
import dev.personalagent.services.mcp.McpRuntime;
import dev.personalagent.services.mcp.OfflineMcpRuntime;
import dev.personalagent.services.mcp.StdioMcpRuntime;
import dev.personalagent.services.profile.ConnectionTester;
import dev.personalagent.services.profile.JsonProfileService;
import dev.personalagent.services.profile.OfflineConnectionTester;
import dev.personalagent.services.profile.OllamaConnectionTester;
import dev.personalagent.services.registry.CatalogMcpRegistryService;
import dev.personalagent.services.registry.CatalogModelsRegistryService;
import dev.personalagent.services.settings.FileSecretsService;
import dev.personalagent.services.settings.JsonAppSettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Guice module wiring configuration, the event bus, the bridge, services and
 * presenters.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final AppDirectories directories;
    private final ApplicationMode mode;

    public AppModule() {
        this(AppDirectories.forCurrentPlatform(), ApplicationMode.get());
    }

    public AppModule(AppDirectories directories, ApplicationMode mode) {
        this.directories = directories;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        AppConfig config;
        try {
            directories.ensureCreated();
            LOG.info("Loading configuration from: {}", directories.configFile());
            config = ConfigLoader.load(directories.configFile());
        } catch (IOException e) {
            // Config is vital, fail fast
            throw new RuntimeException("Failed to load application configuration", e);
        }

        bind(AppDirectories.class).toInstance(directories);
        bind(AppConfig.class).toInstance(config);
        bind(BusConfig.class).toInstance(config.getBus());
        bind(ChatConfig.class).toInstance(config.getChat());
        bind(UiConfig.class).toInstance(config.getUi());
        bind(ApplicationMode.class).toInstance(mode);

        bind(Executor.class).annotatedWith(Names.named(AbstractPresenter.EXECUTOR))
                .to(Key.get(ExecutorService.class, Names.named(AbstractPresenter.EXECUTOR)));
        bind(Executor.class).annotatedWith(Names.named(AbstractAsyncService.EXECUTOR))
                .to(Key.get(ExecutorService.class, Names.named(AbstractAsyncService.EXECUTOR)));

        bind(ConversationService.class).to(JsonConversationService.class);
        bind(ProfileService.class).to(JsonProfileService.class);
        bind(McpService.class).to(JsonMcpService.class);
        bind(McpRegistryService.class).to(CatalogMcpRegistryService.class);
        bind(ModelsRegistryService.class).to(CatalogModelsRegistryService.class);
        bind(AppSettingsService.class).to(JsonAppSettingsService.class);
        bind(SecretsService.class).to(FileSecretsService.class);
        bind(StreamingModelFactory.class).to(OllamaStreamingModelFactory.class);

        LOG.info("Application mode initialized: {}", mode);
        if (mode.isOffline()) {
            // No model server, no MCP processes
            bind(ChatService.class).to(OfflineChatService.class);
            bind(ConnectionTester.class).to(OfflineConnectionTester.class);
            bind(McpRuntime.class).to(OfflineMcpRuntime.class);
        } else {
            bind(ChatService.class).to(LangChainChatService.class);
            bind(ConnectionTester.class).to(OllamaConnectionTester.class);
            bind(McpRuntime.class).to(StdioMcpRuntime.class);
        }
    }

    @Provides
    @Singleton
    EventBus eventBus(BusConfig busConfig) {
        return new EventBus(busConfig.getCapacity());
    }

    @Provides
    @Singleton
    @Named(AbstractPresenter.EXECUTOR)
    ExecutorService presenterExecutor() {
        return daemonPool("presenter-%d");
    }

    @Provides
    @Singleton
    @Named(AbstractAsyncService.EXECUTOR)
    ExecutorService serviceExecutor() {
        return daemonPool("service-%d");
    }

    @Provides
    @Singleton
    RuntimeBridge runtimeBridge(EventBus eventBus, BusConfig busConfig,
            @Named(AbstractPresenter.EXECUTOR) ExecutorService executor) {
        return RuntimeBridge.create(eventBus, busConfig.getUserEventCapacity(), busConfig.getViewCommandCapacity(),
                ViewNotifier.NONE, executor);
    }

    @Provides
    ViewCommandSink viewCommandSink(RuntimeBridge bridge) {
        return bridge.sink();
    }

    private static ExecutorService daemonPool(String nameFormat) {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .build());
    }
}
