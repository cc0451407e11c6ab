package com.indentlint.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging for the linter and hands out per-class loggers.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;
    private static Path logFilePath = Paths.get("indent-lint.log");

    /**
     * Reads {@code /logging.properties} from the classpath, or falls back to a console and
     * file handler pair when the resource is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                _installFallbackHandlers();
            }
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static void _installFallbackHandlers() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(consoleLevel);
        console.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(console);
        rootLogger.addHandler(_fileHandler(logFilePath));
        rootLogger.setLevel(Level.INFO);
    }

    private static FileHandler _fileHandler(Path path) throws IOException {
        FileHandler handler = new FileHandler(path.toString(), true);
        handler.setLevel(Level.ALL);
        handler.setFormatter(new SimpleFormatter());
        return handler;
    }

    /**
     * Sets the level of every console handler, e.g. FINE for {@code --verbose}.
     */
    public static synchronized void setConsoleLevel(Level level) {
        initialize();
        consoleLevel = level;

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        // the root level gates records before any handler sees them
        if (level.intValue() < rootLogger.getLevel().intValue()) {
            rootLogger.setLevel(level);
        }
    }

    /**
     * Swaps the file handler for one writing to {@code path}.
     */
    public static synchronized void setLogFilePath(Path path) {
        initialize();
        logFilePath = path;

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }
        try {
            rootLogger.addHandler(_fileHandler(path));
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to switch log file to " + path, e);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        initialize();
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all root handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
