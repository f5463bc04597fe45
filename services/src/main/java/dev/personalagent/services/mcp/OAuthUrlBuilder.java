package dev.personalagent.services.mcp;

import dev.personalagent.core.domain.McpConfig;
import dev.personalagent.core.service.ServiceException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the authorization URL a user opens to connect an MCP server and
 * remembers which server a pending {@code state} belongs to.
 *
 * <p>
 * Smithery-hosted servers authorize on smithery.ai by qualified name; the
 * other providers use a standard authorization-code request whose client id
 * comes from the server's {@code OAUTH_CLIENT_ID} environment entry.
 */
public class OAuthUrlBuilder {

    public static final String REDIRECT_URI = "http://localhost:8765/oauth/callback";
    static final String CLIENT_ID_ENV = "OAUTH_CLIENT_ID";

    private static final Map<String, String> AUTHORIZE_ENDPOINTS = Map.of(
            "github", "https://github.com/login/oauth/authorize",
            "google", "https://accounts.google.com/o/oauth2/v2/auth",
            "slack", "https://slack.com/oauth/v2/authorize",
            "notion", "https://api.notion.com/v1/oauth/authorize");

    private final Map<String, UUID> pendingStates = new ConcurrentHashMap<>();

    public URI build(McpConfig config, String provider) throws ServiceException {
        if (provider == null || provider.isBlank()) {
            throw ServiceException.validation("OAuth provider must be given");
        }
        String key = provider.trim().toLowerCase(Locale.ROOT);
        if (key.equals("smithery")) {
            return URI.create("https://smithery.ai/server/" + encode(qualifiedName(config))
                    + "/authorize?redirect_uri=" + encode(REDIRECT_URI));
        }

        String endpoint = AUTHORIZE_ENDPOINTS.get(key);
        if (endpoint == null) {
            throw new ServiceException(ServiceException.Kind.CONFIGURATION,
                    "Unsupported OAuth provider: " + provider);
        }
        String clientId = config.env().get(CLIENT_ID_ENV);
        if (clientId == null || clientId.isBlank()) {
            throw new ServiceException(ServiceException.Kind.CONFIGURATION,
                    "MCP server '" + config.name() + "' has no " + CLIENT_ID_ENV + " configured");
        }
        String state = UUID.randomUUID().toString();
        pendingStates.put(state, config.id());
        return URI.create(endpoint + "?response_type=code&client_id=" + encode(clientId)
                + "&redirect_uri=" + encode(REDIRECT_URI) + "&state=" + encode(state));
    }

    /**
     * Resolves and forgets a pending authorization.
     *
     * @return the server the state was issued for, or {@code null}
     */
    public UUID completeState(String state) {
        return pendingStates.remove(state);
    }

    public void forget(UUID mcpId) {
        pendingStates.values().removeIf(mcpId::equals);
    }

    // "smithery: @owner/server" -> "@owner/server", falling back to the display name
    private static String qualifiedName(McpConfig config) {
        String source = config.source();
        if (source != null) {
            int colon = source.indexOf(':');
            if (colon >= 0 && colon + 1 < source.length()) {
                return source.substring(colon + 1).trim();
            }
        }
        return config.name();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
