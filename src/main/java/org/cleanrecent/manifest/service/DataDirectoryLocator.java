package org.cleanrecent.manifest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the per-user data directory the desktop keeps {@code recently-used.xbel} in.
 * <ul>
 *     <li>Linux / BSD – {@code $XDG_DATA_HOME} if absolute, else {@code $HOME/.local/share}</li>
 *     <li>macOS – {@code $HOME/Library/Application Support}</li>
 *     <li>Windows – {@code %APPDATA%}</li>
 * </ul>
 */
@Component
public class DataDirectoryLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataDirectoryLocator.class);

    private final Map<String, String> env;
    private final String osName;
    private final String userHome;

    public DataDirectoryLocator() {
        this(System.getenv(), System.getProperty("os.name", ""), System.getProperty("user.home"));
    }

    DataDirectoryLocator(Map<String, String> env, String osName, String userHome) {
        this.env = env;
        this.osName = osName.toLowerCase(Locale.ROOT);
        this.userHome = userHome;
    }

    /**
     * @return the data directory
     * @throws IllegalStateException if no home directory can be determined
     */
    public Path dataDirectory() {
        if (osName.startsWith("windows")) {
            String appData = env.get("APPDATA");
            if (isBlank(appData)) throw new IllegalStateException("no base directories: APPDATA is not set");
            return Paths.get(appData);
        }

        Path home = home();
        if (osName.startsWith("mac")) {
            return home.resolve("Library").resolve("Application Support");
        }

        String xdg = env.get("XDG_DATA_HOME");
        if (!isBlank(xdg)) {
            Path p = Paths.get(xdg);
            if (p.isAbsolute()) return p;
            LOGGER.warn("Ignoring relative XDG_DATA_HOME: {}", xdg);
        }
        return home.resolve(".local").resolve("share");
    }

    private Path home() {
        String home = env.get("HOME");
        if (isBlank(home)) home = userHome;
        if (isBlank(home)) throw new IllegalStateException("no base directories: home directory is unknown");
        return Paths.get(home);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
