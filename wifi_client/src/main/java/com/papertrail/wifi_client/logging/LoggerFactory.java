package com.papertrail.wifi_client.logging;

/**
 * Factory for creating platform-specific Logger instances.
 * Picks SLF4J when a binding is on the class path, console output otherwise.
 */
public class LoggerFactory {

    private static final String SLF4J_MARKER_CLASS = "org.slf4j.LoggerFactory";

    /**
     * Create a logger instance for the current platform
     * @return Logger instance
     */
    public static Logger createLogger() {
        return createLoggerForPlatform();
    }

    /**
     * Create an SLF4J-backed logger
     * @return Slf4jLogger instance
     */
    public static Logger createSlf4jLogger() {
        return new Slf4jLogger();
    }

    /**
     * Create a console logger for environments without SLF4J
     * @return ConsoleLogger instance
     */
    public static Logger createConsoleLogger() {
        return new ConsoleLogger();
    }

    /**
     * Detect platform and create appropriate logger
     * @return Platform-specific logger
     */
    private static Logger createLoggerForPlatform() {
        try {
            Class.forName(SLF4J_MARKER_CLASS);
            return new Slf4jLogger();
        } catch (ClassNotFoundException e) {
            // No SLF4J on the class path
            return new ConsoleLogger();
        }
    }
}
