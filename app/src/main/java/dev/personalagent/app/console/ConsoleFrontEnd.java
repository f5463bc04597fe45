package dev.personalagent.app.console;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.personalagent.presentation.UiFrameDriver;
import dev.personalagent.presentation.bridge.RuntimeBridge;
import dev.personalagent.presentation.bridge.ViewNotifier;
import dev.personalagent.presentation.deferred.PopoverContext;
import dev.personalagent.presentation.navigation.NavigationRequests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Headless front end. A single "ui" thread plays the render loop: it ticks
 * the {@link UiFrameDriver} at the configured frame interval and runs every
 * input line, so view commands and user events only ever touch that thread.
 * The calling thread just reads input.
 */
public class ConsoleFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleFrontEnd.class);

    private final RuntimeBridge bridge;
    private final BufferedReader in;
    private final PrintStream out;
    private final long frameIntervalMillis;

    public ConsoleFrontEnd(RuntimeBridge bridge, BufferedReader in, PrintStream out, long frameIntervalMillis) {
        this.bridge = bridge;
        this.in = in;
        this.out = out;
        this.frameIntervalMillis = frameIntervalMillis;
    }

    /**
     * Runs until the user quits or input ends.
     */
    public void run() throws IOException, InterruptedException {
        ScheduledExecutorService ui = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("ui")
                .setDaemon(true)
                .build());
        try {
            ConsoleRenderer renderer = new ConsoleRenderer(out);
            PopoverContext popover = new PopoverContext(new ConsoleOverlay(out), bridge.uiEvents());
            NavigationRequests navigationRequests = new NavigationRequests();
            UiFrameDriver driver = new UiFrameDriver(bridge.ui(), renderer, popover, navigationRequests,
                    bridge.uiEvents());
            ConsoleCommands commands = new ConsoleCommands(bridge.ui(), driver, popover, renderer, out);

            // Wake-ups render right away instead of waiting for the next frame
            bridge.sink().setNotifier(() -> ui.execute(() -> tick(driver)));
            ui.scheduleWithFixedDelay(() -> tick(driver), 0, frameIntervalMillis, TimeUnit.MILLISECONDS);
            out.println("Type a message, or /help for commands.");

            String line;
            while ((line = in.readLine()) != null) {
                String input = line;
                CompletableFuture<Boolean> result = CompletableFuture.supplyAsync(() -> commands.execute(input), ui);
                if (!await(result)) {
                    break;
                }
            }
        } finally {
            bridge.sink().setNotifier(ViewNotifier.NONE);
            ui.shutdownNow();
        }
    }

    private void tick(UiFrameDriver driver) {
        try {
            driver.tick();
        } catch (RuntimeException e) {
            // a failing frame must not cancel the schedule
            LOG.error("Frame failed", e);
        }
    }

    private static boolean await(CompletableFuture<Boolean> result) throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            LOG.error("Console command failed", e.getCause());
            return true;
        }
    }
}
