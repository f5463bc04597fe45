package dev.personalagent.presentation.bridge;

/**
 * Outcome of a non-blocking send into a {@link BridgeChannel}.
 */
public enum SendResult {
    SENT,
    /** The channel was at capacity and the value was dropped. */
    FULL,
    /** The channel was closed and the value was dropped. */
    CLOSED
}
