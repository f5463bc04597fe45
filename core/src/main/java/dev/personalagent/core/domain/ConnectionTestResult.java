package dev.personalagent.core.domain;

/**
 * Outcome of probing a model profile. {@code responseTimeMs} is only set on
 * success, {@code error} only on failure.
 */
public record ConnectionTestResult(boolean success, Long responseTimeMs, String error) {

    public static ConnectionTestResult ok(long responseTimeMs) {
        return new ConnectionTestResult(true, responseTimeMs, null);
    }

    public static ConnectionTestResult failed(String error) {
        return new ConnectionTestResult(false, null, error);
    }
}
