package dev.personalagent.app;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import dev.personalagent.app.console.ConsoleFrontEnd;
import dev.personalagent.core.config.UiConfig;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.NoSubscribersException;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.service.McpRegistryService;
import dev.personalagent.core.service.ModelsRegistryService;
import dev.personalagent.core.util.AppDirectories;
import dev.personalagent.presentation.bridge.RuntimeBridge;
import dev.personalagent.presentation.presenter.AbstractPresenter;
import dev.personalagent.services.AbstractAsyncService;
import dev.personalagent.services.mcp.JsonMcpService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

public class PersonalAgentApp {

    static {
        // Logback reads LOG_DIR, so it has to be set before the first logger exists
        Path logDir = AppDirectories.forCurrentPlatform().logs();
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PersonalAgentApp.class);

    private final Injector injector;

    PersonalAgentApp(Injector injector) {
        this.injector = injector;
    }

    public static void main(String[] args) throws Exception {
        LOG.info("Initializing...");
        PersonalAgentApp app = new PersonalAgentApp(Guice.createInjector(new AppModule()));
        app.launch();
        try {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ConsoleFrontEnd(app.injector.getInstance(RuntimeBridge.class), in, System.out,
                    app.injector.getInstance(UiConfig.class).getFrameIntervalMillis()).run();
        } finally {
            app.shutdown();
        }
    }

    /**
     * Starts the presenters, then announces the launch and kicks off the
     * background loading that does not block the first frame.
     */
    void launch() {
        injector.getInstance(PresenterRegistry.class).startAll();
        publish(new SystemEvent.AppLaunched());

        injector.getInstance(ModelsRegistryService.class).refresh()
                .exceptionally(e -> logFailure("Models registry refresh", e));
        injector.getInstance(McpRegistryService.class).refresh()
                .exceptionally(e -> logFailure("MCP registry refresh", e));
        injector.getInstance(JsonMcpService.class).startEnabled()
                .exceptionally(e -> logFailure("Starting MCP servers", e));
        LOG.info("Launched");
    }

    /**
     * Tells the presenters to wind down, closes the bus and both thread pools
     * and stops MCP processes.
     */
    void shutdown() {
        LOG.info("Shutting down...");
        publish(new SystemEvent.AppWillTerminate());
        injector.getInstance(PresenterRegistry.class).stopAll();
        injector.getInstance(RuntimeBridge.class).close();
        injector.getInstance(EventBus.class).close();
        injector.getInstance(JsonMcpService.class).close();

        MoreExecutors.shutdownAndAwaitTermination(executor(AbstractPresenter.EXECUTOR), 2, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(executor(AbstractAsyncService.EXECUTOR), 2, TimeUnit.SECONDS);
    }

    private void publish(SystemEvent event) {
        try {
            injector.getInstance(EventBus.class).publish(event);
        } catch (NoSubscribersException e) {
            LOG.warn("Nobody received {}", event);
        }
    }

    private ExecutorService executor(String name) {
        return injector.getInstance(Key.get(ExecutorService.class, Names.named(name)));
    }

    private static Void logFailure(String what, Throwable error) {
        LOG.warn("{} failed: {}", what, error.getMessage());
        return null;
    }
}
