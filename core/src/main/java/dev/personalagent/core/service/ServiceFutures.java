package dev.personalagent.core.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ServiceFutures {

    private ServiceFutures() {
    }

    /**
     * Waits for a service call and unwraps its failure. Interruption and
     * cancellation become {@link ServiceException.Kind#CANCELLED}, causes that
     * are not service exceptions become {@link ServiceException.Kind#INTERNAL}.
     */
    public static <T> T await(CompletableFuture<T> future) throws ServiceException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ServiceException.Kind.CANCELLED, "Interrupted while waiting for a service", e);
        } catch (CancellationException e) {
            throw new ServiceException(ServiceException.Kind.CANCELLED, "Service call was cancelled", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * The {@link ServiceException} behind a failed future, for callbacks such
     * as {@code whenComplete} that see the raw throwable.
     */
    public static ServiceException unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (cause instanceof CancellationException) {
            return new ServiceException(ServiceException.Kind.CANCELLED, "Service call was cancelled", cause);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return new ServiceException(ServiceException.Kind.INTERNAL, message, cause);
    }
}
