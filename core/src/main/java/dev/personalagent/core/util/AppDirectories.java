package dev.personalagent.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Locations of the application's files, rooted at the platform's native
 * application data directory:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback
 * {@code ~/.local/share})</li>
 * </ul>
 * Nothing is created until {@link #ensureCreated()} is called.
 */
public final class AppDirectories {

    public static final String APP_NAME = "personal-agent";

    private final Path root;

    public AppDirectories(Path root) {
        this.root = root.toAbsolutePath();
    }

    public static AppDirectories forCurrentPlatform() {
        return new AppDirectories(platformDataDir(APP_NAME, System.getProperty("os.name", "generic"),
                System.getenv(), System.getProperty("user.home")));
    }

    static Path platformDataDir(String appName, String osName, Map<String, String> env, String userHome) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgData = env.get("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(userHome, ".local", "share", appName);
    }

    public Path root() {
        return root;
    }

    public Path logs() {
        return root.resolve("logs");
    }

    public Path configFile() {
        return root.resolve("config.json");
    }

    public Path settingsFile() {
        return root.resolve("settings.json");
    }

    public Path secretsFile() {
        return root.resolve("secrets.json");
    }

    public Path conversations() {
        return root.resolve("conversations");
    }

    public Path profiles() {
        return root.resolve("profiles");
    }

    public Path mcpServers() {
        return root.resolve("mcp");
    }

    /** Downloaded registry catalogues. Safe to delete. */
    public Path cache() {
        return root.resolve("cache");
    }

    public AppDirectories ensureCreated() throws IOException {
        Files.createDirectories(root);
        Files.createDirectories(logs());
        Files.createDirectories(conversations());
        Files.createDirectories(profiles());
        Files.createDirectories(mcpServers());
        Files.createDirectories(cache());
        return this;
    }
}
