package dev.personalagent.presentation.presenter;

import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.EventBusClosedException;
import dev.personalagent.core.event.SubscriberLaggedException;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.core.service.ServiceFutures;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event loop shared by all presenters.
 *
 * <p>
 * {@link #start()} subscribes on the calling thread, so every event published
 * after it returns is seen, then runs the loop on the executor. The loop hands
 * events to {@link #handle(AppEvent)} one at a time in publish order. Lag is
 * logged and skipped over; the loop ends when the bus closes, when
 * {@link #stop()} was called and the next event arrives, or after
 * {@link SystemEvent.AppWillTerminate} has been handled.
 *
 * <p>
 * Subclasses call services through {@link #await(CompletableFuture)} and turn
 * each {@link ServiceException} into a single {@link ViewCommand.ShowError},
 * usually via {@link #attempt(String, ErrorSeverity, ServiceAction)}.
 */
public abstract class AbstractPresenter implements Presenter {

    public static final String EXECUTOR = "presenter-executor";

    private static final Logger LOG = LoggerFactory.getLogger(AbstractPresenter.class);

    private final EventBus eventBus;
    private final ViewCommandSink sink;
    private final Executor executor;
    private final AtomicReference<LoopHandle> loop = new AtomicReference<>();

    protected AbstractPresenter(EventBus eventBus, ViewCommandSink sink, Executor executor) {
        this.eventBus = eventBus;
        this.sink = sink;
        this.executor = executor;
    }

    // -- Lifecycle --

    @Override
    public final synchronized void start() {
        if (isRunning()) {
            return;
        }
        LoopHandle handle = new LoopHandle(eventBus.subscribe());
        loop.set(handle);
        executor.execute(() -> runLoop(handle));
        LOG.debug("{} started", name());
    }

    @Override
    public final void stop() {
        LoopHandle handle = loop.get();
        if (handle != null) {
            handle.running.set(false);
            LOG.debug("{} stop requested", name());
        }
    }

    @Override
    public final boolean isRunning() {
        LoopHandle handle = loop.get();
        return handle != null && handle.running.get();
    }

    protected String name() {
        return getClass().getSimpleName();
    }

    // -- Dispatch --

    /**
     * Reacts to one event. Unknown variants are ignored.
     */
    protected abstract void handle(AppEvent event);

    protected final void send(ViewCommand command) {
        sink.send(command);
    }

    protected final void showError(String title, String message, ErrorSeverity severity) {
        send(new ViewCommand.ShowError(title, message, severity));
    }

    /**
     * Runs {@code action} and converts a {@link ServiceException} into one
     * {@link ViewCommand.ShowError} with the given title. Validation failures
     * are downgraded to {@link ErrorSeverity#WARNING}.
     */
    protected final void attempt(String errorTitle, ErrorSeverity severity, ServiceAction action) {
        try {
            action.run();
        } catch (ServiceException e) {
            LOG.warn("{}: {} ({})", name(), errorTitle, e.getMessage());
            showError(errorTitle, e.getMessage(), severityFor(e, severity));
        }
    }

    protected static ErrorSeverity severityFor(ServiceException e, ErrorSeverity severity) {
        return e.getKind() == ServiceException.Kind.VALIDATION ? ErrorSeverity.WARNING : severity;
    }

    /**
     * Waits for a service call and unwraps its failure.
     */
    protected static <T> T await(CompletableFuture<T> future) throws ServiceException {
        return ServiceFutures.await(future);
    }

    @FunctionalInterface
    protected interface ServiceAction {
        void run() throws ServiceException;
    }

    // -- Internal --

    private void runLoop(LoopHandle handle) {
        LOG.debug("{} event loop running", name());
        try (EventBus.Subscriber subscriber = handle.subscriber) {
            while (handle.running.get()) {
                AppEvent event;
                try {
                    event = subscriber.receive();
                } catch (SubscriberLaggedException e) {
                    LOG.warn("{} lagged behind, skipped {} events", name(), e.getSkipped());
                    continue;
                } catch (EventBusClosedException e) {
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }

                if (!handle.running.get()) {
                    break;
                }
                dispatch(event);
                if (event instanceof SystemEvent.AppWillTerminate) {
                    break;
                }
            }
        } finally {
            handle.running.set(false);
            LOG.info("{} event loop ended", name());
        }
    }

    private void dispatch(AppEvent event) {
        try {
            handle(event);
        } catch (RuntimeException e) {
            LOG.error("{} failed to handle {}", name(), event, e);
            showError("Unexpected Error", name() + " failed: " + e, ErrorSeverity.CRITICAL);
        }
    }

    private static final class LoopHandle {
        private final EventBus.Subscriber subscriber;
        private final AtomicBoolean running = new AtomicBoolean(true);

        private LoopHandle(EventBus.Subscriber subscriber) {
            this.subscriber = subscriber;
        }
    }
}
