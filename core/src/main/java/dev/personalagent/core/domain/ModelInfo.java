package dev.personalagent.core.domain;

/**
 * A model from the models registry. {@code contextLength} is {@code null}
 * when unknown.
 */
public record ModelInfo(String providerId, String modelId, String name, Integer contextLength) {
}
