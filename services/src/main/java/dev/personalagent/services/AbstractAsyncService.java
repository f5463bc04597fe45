package dev.personalagent.services;

import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.NoSubscribersException;
import dev.personalagent.core.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Base for the service implementations: runs calls on the service executor
 * and publishes domain events without caring whether anyone listens.
 */
public abstract class AbstractAsyncService {

    public static final String EXECUTOR = "service-executor";

    private static final Logger LOG = LoggerFactory.getLogger(AbstractAsyncService.class);

    private final EventBus eventBus;
    private final Executor executor;

    protected AbstractAsyncService(EventBus eventBus, Executor executor) {
        this.eventBus = eventBus;
        this.executor = executor;
    }

    @FunctionalInterface
    protected interface ServiceCall<T> {
        T call() throws ServiceException;
    }

    @FunctionalInterface
    protected interface ServiceAction {
        void run() throws ServiceException;
    }

    /**
     * Runs {@code call} on the service executor. Runtime exceptions become
     * {@link ServiceException.Kind#INTERNAL} failures.
     */
    protected <T> CompletableFuture<T> async(ServiceCall<T> call) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(call.call());
                } catch (ServiceException e) {
                    future.completeExceptionally(e);
                } catch (RuntimeException e) {
                    LOG.error("{} failed unexpectedly", getClass().getSimpleName(), e);
                    future.completeExceptionally(new ServiceException(ServiceException.Kind.INTERNAL,
                            String.valueOf(e.getMessage()), e));
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new ServiceException(ServiceException.Kind.INTERNAL,
                    "Service executor is shut down", e));
        }
        return future;
    }

    protected CompletableFuture<Void> run(ServiceAction action) {
        return async(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Publishes a domain event. Nobody listening and a closed bus are both
     * normal during startup and shutdown.
     */
    protected void publish(AppEvent event) {
        try {
            eventBus.publish(event);
        } catch (NoSubscribersException e) {
            LOG.debug("No subscribers for {}", event);
        } catch (IllegalStateException e) {
            LOG.debug("Dropping {}: {}", event, e.getMessage());
        }
    }
}
