package dev.personalagent.core.domain;

/**
 * Sampling settings attached to a {@link ModelProfile}.
 *
 * @param temperature  sampling temperature, 0.0 to 2.0
 * @param maxTokens    response token limit, {@code null} for the provider default
 * @param showThinking whether reasoning output is shown in the chat
 */
public record ModelParameters(double temperature, Integer maxTokens, boolean showThinking) {

    public static ModelParameters defaults() {
        return new ModelParameters(0.7, null, false);
    }
}
