package dev.personalagent.services.registry;

import com.fasterxml.jackson.databind.JsonNode;
import dev.personalagent.core.domain.McpRegistryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Server list of the official MCP registry. Only servers shipped as an npm
 * or OCI package speaking stdio can be launched locally, the rest are
 * skipped.
 */
public class OfficialMcpRegistry implements RemoteCatalogue<List<McpRegistryEntry>> {

    private static final Logger LOG = LoggerFactory.getLogger(OfficialMcpRegistry.class);

    public static final String REGISTRY = "official";
    public static final String API_URL = "https://registry.modelcontextprotocol.io/v0.1/servers?limit=100";

    private final HttpJsonClient http;
    private final String url;

    public OfficialMcpRegistry(HttpJsonClient http) {
        this(http, API_URL);
    }

    public OfficialMcpRegistry(HttpJsonClient http, String url) {
        this.http = http;
        this.url = url;
    }

    @Override
    public List<McpRegistryEntry> fetch() throws IOException {
        return parse(http.get(url, Map.of()));
    }

    static List<McpRegistryEntry> parse(JsonNode root) throws IOException {
        JsonNode servers = root.path("servers");
        if (!servers.isArray()) {
            throw new IOException("Unexpected registry response: no servers array");
        }
        List<McpRegistryEntry> entries = new ArrayList<>();
        // The registry lists every published version of a server
        Set<String> seen = new HashSet<>();
        for (JsonNode wrapper : servers) {
            JsonNode server = wrapper.has("server") ? wrapper.get("server") : wrapper;
            String name = server.path("name").asText("");
            if (name.isEmpty() || !seen.add(name)) {
                continue;
            }
            McpRegistryEntry entry = toEntry(server);
            if (entry != null) {
                entries.add(entry);
            }
        }
        LOG.debug("Official registry returned {} launchable servers", entries.size());
        return entries;
    }

    private static McpRegistryEntry toEntry(JsonNode server) {
        for (JsonNode pkg : server.path("packages")) {
            if (!"stdio".equals(pkg.path("transport").path("type").asText("stdio"))) {
                continue;
            }
            String identifier = pkg.path("identifier").asText("");
            String command;
            List<String> args = new ArrayList<>();
            switch (pkg.path("registryType").asText("")) {
                case "npm":
                    command = "npx";
                    args.add("-y");
                    args.add(identifier);
                    break;
                case "oci":
                    command = "docker";
                    args.addAll(List.of("run", "-i", "--rm", identifier));
                    break;
                default:
                    continue;
            }

            Map<String, String> env = new LinkedHashMap<>();
            boolean needsSecret = false;
            for (JsonNode variable : pkg.path("environmentVariables")) {
                env.put(variable.path("name").asText(), variable.path("default").asText(""));
                needsSecret |= variable.path("isSecret").asBoolean(false);
            }

            String name = server.path("name").asText();
            String shortName = name.substring(name.lastIndexOf('/') + 1);
            return new McpRegistryEntry(name, shortName, server.path("description").asText(""),
                    server.path("version").asText(null), null, null,
                    server.path("repository").path("url").asText(null), command, args, env,
                    needsSecret ? List.of("api-key") : List.of(), REGISTRY, 0);
        }
        return null;
    }
}
