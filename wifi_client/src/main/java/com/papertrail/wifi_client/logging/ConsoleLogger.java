package com.papertrail.wifi_client.logging;

/**
 * Console-based implementation of Logger for environments without SLF4J.
 * Follows Single Responsibility Principle by handling only logging.
 */
public class ConsoleLogger implements Logger {
    private static final String DEFAULT_TAG = "WiFi_Client";

    @Override
    public void debug(String tag, String message) {
        System.out.println("[DEBUG] " + resolveTag(tag) + ": " + message);
    }

    @Override
    public void info(String tag, String message) {
        System.out.println("[INFO] " + resolveTag(tag) + ": " + message);
    }

    @Override
    public void warn(String tag, String message) {
        System.err.println("[WARN] " + resolveTag(tag) + ": " + message);
    }

    @Override
    public void error(String tag, String message) {
        System.err.println("[ERROR] " + resolveTag(tag) + ": " + message);
    }

    @Override
    public void error(String tag, String message, Throwable throwable) {
        System.err.println("[ERROR] " + resolveTag(tag) + ": " + message);
        if (throwable != null) {
            throwable.printStackTrace();
        }
    }

    private static String resolveTag(String tag) {
        return tag != null ? tag : DEFAULT_TAG;
    }
}
