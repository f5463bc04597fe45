package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.JsonNode;
import dev.personalagent.core.domain.McpRegistryEntry;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Live search against the Smithery registry. Every call needs an API key;
 * Smithery servers are launched through the Smithery CLI.
 */
public class SmitheryMcpRegistry {

    public static final String REGISTRY = "smithery";
    public static final String API_URL = "https://registry.smithery.ai/servers";

    private final HttpJsonClient http;
    private final String url;

    public SmitheryMcpRegistry(HttpJsonClient http) {
        this(http, API_URL);
    }

    public SmitheryMcpRegistry(HttpJsonClient http, String url) {
        this.http = http;
        this.url = url;
    }

    public List<McpRegistryEntry> search(String query, String apiKey) throws IOException {
        String q = URLEncoder.encode(query == null ? "" : query.trim(), StandardCharsets.UTF_8);
        JsonNode root = http.get(url + "?q=" + q, Map.of("Authorization", "Bearer " + resolveKey(apiKey)));
        return parse(root);
    }

    /**
     * The stored key is either the key itself or the path of a file holding
     * it ({@code /}, {@code ~/} or {@code ./} prefix).
     */
    static String resolveKey(String stored) throws IOException {
        String key = stored.trim();
        if (key.startsWith("~/")) {
            return Files.readString(Path.of(System.getProperty("user.home"), key.substring(2))).trim();
        }
        if (key.startsWith("/") || key.startsWith("./")) {
            return Files.readString(Path.of(key)).trim();
        }
        return key;
    }

    static List<McpRegistryEntry> parse(JsonNode root) throws IOException {
        JsonNode servers = root.path("servers");
        if (!servers.isArray()) {
            throw new IOException("Unexpected Smithery response: no servers array");
        }
        List<McpRegistryEntry> entries = new ArrayList<>();
        for (JsonNode server : servers) {
            String name = server.path("qualifiedName").asText("");
            if (name.isEmpty()) {
                continue;
            }
            List<String> tags = new ArrayList<>();
            if (server.path("remote").asBoolean(false)) {
                tags.add("oauth");
            }
            if (server.path("verified").asBoolean(false)) {
                tags.add("verified");
            }
            entries.add(new McpRegistryEntry(name, server.path("displayName").asText(name),
                    server.path("description").asText(""), null, null, null, null,
                    "npx", List.of("-y", "@smithery/cli@latest", "run", name), Map.of(), tags,
                    REGISTRY, server.path("useCount").asInt(0)));
        }
        return entries;
    }
}
