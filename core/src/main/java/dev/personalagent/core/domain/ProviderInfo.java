package dev.personalagent.core.domain;

/**
 * A provider from the models registry.
 */
public record ProviderInfo(String id, String name, String apiBaseUrl, int modelCount) {
}
