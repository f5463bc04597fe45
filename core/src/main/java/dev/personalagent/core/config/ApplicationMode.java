package dev.personalagent.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the application. {@link #OFFLINE} replaces every network
 * backed collaborator (model streaming, connection probes and registry
 * downloads) with local stand-ins so the UI can be exercised without a
 * model server.
 */
public enum ApplicationMode {

    PROD,
    OFFLINE;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "agent.mode";
    static final String ENV = "AGENT_MODE";

    /**
     * Resolves the mode from the {@code agent.mode} system property, then the
     * {@code AGENT_MODE} environment variable. Defaults to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv(ENV);
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isEmpty()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', using PROD", mode);
            return PROD;
        }
    }

    public boolean isOffline() {
        return this == OFFLINE;
    }
}
