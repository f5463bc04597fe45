package dev.personalagent.core.domain;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A server listed in an MCP registry catalogue.
 *
 * @param registry catalogue the entry belongs to, e.g. {@code "official"}
 * @param env      environment variables the server expects, with their
 *                 default values (blank when the user has to provide one)
 */
public record McpRegistryEntry(String name, String displayName, String description, String version, String author,
        String license, String repository, String command, List<String> args, Map<String, String> env,
        List<String> tags, String registry, int popularity) {

    public McpRegistryEntry {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Case-insensitive match against name, display name, description and
     * tags. A blank query matches everything.
     */
    public boolean matches(String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String q = query.toLowerCase(Locale.ROOT).trim();
        return contains(name, q) || contains(displayName, q) || contains(description, q)
                || tags.stream().anyMatch(tag -> contains(tag, q));
    }

    private static boolean contains(String value, String q) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(q);
    }
}
