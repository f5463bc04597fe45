package dev.personalagent.core.domain;

/**
 * Names a registry catalogue when searching ({@code "official"},
 * {@code "smithery"}, blank for all) or a registry entry when selecting one.
 */
public record McpRegistrySource(String name) {

    public static final String ALL = "";

    public static McpRegistrySource all() {
        return new McpRegistrySource(ALL);
    }

    public boolean matchesAll() {
        return name == null || name.isBlank();
    }
}
