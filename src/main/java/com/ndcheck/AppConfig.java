package com.ndcheck;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: listening port, log location and console logging.
 */
public class AppConfig {

    private static final String APP_NAME = "Fitch-Checker";
    private static final String LOG_FILE = "fitch-checker.log";
    static final int DEFAULT_PORT = 5000;

    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path logPath, int port, boolean devMode) {
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Fitch-Checker\logs
     * macOS: ~/Library/Logs/Fitch-Checker
     * Linux: ~/.local/share/Fitch-Checker/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    /**
     * Find an available port, starting with the preferred port.
     * If the preferred port is in use, finds the next available port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Last resort: return the preferred port and let it fail later with a clear error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Builder for AppConfig. Command-line flags win over the PORT environment variable.
     */
    public static class Builder {
        private Path logDirectory = null;
        private Integer preferredPort = null;
        private boolean devMode = false;
        private String portEnv = System.getenv("PORT");

        public Builder logDirectory(String path) {
            if (path != null && !path.isEmpty()) {
                this.logDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        Builder portEnv(String value) {
            this.portEnv = value;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --log-dir=value or --log-dir value
                if (arg.startsWith("--log-dir=")) {
                    logDirectory(arg.substring("--log-dir=".length()));
                } else if ("--log-dir".equals(arg) && i + 1 < args.length) {
                    logDirectory(args[++i]);
                }

                // Handle --port=value or --port value
                else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        int resolvePort() {
            if (preferredPort != null) {
                return preferredPort;
            }
            if (portEnv != null && !portEnv.isBlank()) {
                return parsePort(portEnv.trim());
            }
            return DEFAULT_PORT;
        }

        boolean isDevMode() {
            return devMode;
        }

        Path resolveLogDirectory() {
            return logDirectory != null ? logDirectory : getLogDirectory();
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(resolvePort());

            Path logDir = resolveLogDirectory();
            Files.createDirectories(logDir);

            return new AppConfig(logDir.resolve(LOG_FILE), port, devMode);
        }

        private static int parsePort(String value) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65535) {
                    throw new IllegalArgumentException("Port out of range: " + value);
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }
    }
}
