package com.vyperformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter and hands out per-class loggers.
 * <p>
 * The bundled {@code /logging.properties} is used when present. Otherwise a single
 * console handler writing to standard error is installed, so formatted output on
 * standard out stays clean.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            configureBasicLogging();
            initialized = true;
        }
    }

    private static void configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the level of every console handler. The root logger is lowered with it so
     * that records below the configured default still reach the handler.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        if (!initialized) {
            initialize();
        }

        if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
