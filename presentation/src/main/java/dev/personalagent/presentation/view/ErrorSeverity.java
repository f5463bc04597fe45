package dev.personalagent.presentation.view;

/**
 * How bad a user-visible error is. {@link #CRITICAL} means the application
 * cannot recover on its own; {@link #WARNING} means an operation degraded but
 * the application carries on.
 */
public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
