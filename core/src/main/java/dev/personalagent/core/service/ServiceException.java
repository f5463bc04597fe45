package dev.personalagent.core.service;

/**
 * Failure of a domain service call. Carried as the cause of a failed
 * {@link java.util.concurrent.CompletableFuture}.
 */
public class ServiceException extends Exception {

    public enum Kind {
        NOT_FOUND,
        VALIDATION,
        IO,
        SERIALIZATION,
        STORAGE,
        NETWORK,
        AUTHENTICATION,
        CONFIGURATION,
        CANCELLED,
        INTERNAL
    }

    private final Kind kind;

    public ServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ServiceException notFound(String what, Object id) {
        return new ServiceException(Kind.NOT_FOUND, what + " not found: " + id);
    }

    public static ServiceException validation(String message) {
        return new ServiceException(Kind.VALIDATION, message);
    }

    public Kind getKind() {
        return kind;
    }
}
