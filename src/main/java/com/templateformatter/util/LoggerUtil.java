package com.templateformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter and hands out per-class loggers.
 *
 * <p>The bundled {@code /logging.properties} installs a single {@link ConsoleHandler} on the root
 * logger at WARNING with a one-line format, and sets the {@value #BASE_LOGGER} logger to INFO.
 * Engines log per-node decisions at FINE, so they only reach the console when the CLI lowers
 * both levels for {@code --verbose}. An optional {@link FileHandler} records everything.
 */
public class LoggerUtil {
    public static final String BASE_LOGGER = "com.templateformatter";

    private static final Logger rootLogger = Logger.getLogger("");
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    /**
     * Reads {@code /logging.properties}. Without the resource, or when it declares no console
     * handler, a console handler at the current console level is installed instead.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            System.err.println("Failed to read " + LOG_CONFIG_RESOURCE + ": " + e.getMessage());
        }

        if (_consoleHandler() == null) {
            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setLevel(consoleLevel);
            consoleHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(consoleHandler);
        }
        initialized = true;
    }

    private static Handler _consoleHandler() {
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return handler;
            }
        }
        return null;
    }

    /**
     * Sets the level of the console handler and of the {@value #BASE_LOGGER} logger. The CLI
     * uses FINE for {@code --verbose} and WARNING otherwise.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();

        Handler console = _consoleHandler();
        if (console != null) {
            console.setLevel(level);
        }
        Logger.getLogger(BASE_LOGGER).setLevel(level);
    }

    public static Level getConsoleLevel() {
        return consoleLevel;
    }

    /**
     * Also writes every record to {@code path}, replacing a log file opened earlier.
     */
    public static synchronized void enableFileLogging(Path path) {
        initialize();

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }

        try {
            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file " + path, e);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        initialize();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes all handlers; file handlers are detached so a later run can open a new
     * log file.
     */
    public static synchronized void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
            }
        }
    }
}
