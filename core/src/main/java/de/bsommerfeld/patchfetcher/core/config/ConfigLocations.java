package de.bsommerfeld.patchfetcher.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Decides which configuration file a run reads.
 *
 * <ol>
 * <li>the file given on the command line</li>
 * <li>{@value #FILE_NAME} in the working directory</li>
 * <li>{@value #FILE_NAME} in the user's configuration directory:
 * {@code ~/Library/Application Support/<app>} on macOS,
 * {@code %APPDATA%\<app>} on Windows, {@code $XDG_CONFIG_HOME/<app>}
 * (fallback {@code ~/.config/<app>}) elsewhere</li>
 * </ol>
 */
public final class ConfigLocations {

    public static final String FILE_NAME = "config.json";

    private final String osName;
    private final String userHome;
    private final Map<String, String> env;
    private final Path workingDir;

    ConfigLocations(String osName, String userHome, Map<String, String> env, Path workingDir) {
        this.osName = osName.toLowerCase(Locale.ENGLISH);
        this.userHome = userHome;
        this.env = env;
        this.workingDir = workingDir;
    }

    public static ConfigLocations system() {
        return new ConfigLocations(System.getProperty("os.name", "generic"), System.getProperty("user.home"),
                System.getenv(), Path.of("").toAbsolutePath());
    }

    /**
     * @param explicit file named on the command line, {@code null} if none
     */
    public Path resolve(String appName, Path explicit) {
        if (explicit != null) {
            return explicit;
        }
        Path local = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            return local;
        }
        return userConfigDir(appName).resolve(FILE_NAME);
    }

    /** Per-user configuration directory for {@code appName}. Not created. */
    public Path userConfigDir(String appName) {
        if (osName.contains("mac") || osName.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (osName.contains("win")) {
            String appData = env.get("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgConfig = env.get("XDG_CONFIG_HOME");
        return xdgConfig != null && !xdgConfig.isEmpty()
                ? Paths.get(xdgConfig, appName)
                : Paths.get(userHome, ".config", appName);
    }
}
