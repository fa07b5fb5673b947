package com.papertrail.wifi_client.logging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SLF4J implementation of Logger. Each tag maps to its own SLF4J logger
 * so the backend configuration can tune components by name.
 */
public class Slf4jLogger implements Logger {
    private static final String DEFAULT_TAG = "WiFi_Client";

    private final Map<String, org.slf4j.Logger> delegates = new ConcurrentHashMap<>();

    @Override
    public void debug(String tag, String message) {
        delegate(tag).debug(message);
    }

    @Override
    public void info(String tag, String message) {
        delegate(tag).info(message);
    }

    @Override
    public void warn(String tag, String message) {
        delegate(tag).warn(message);
    }

    @Override
    public void error(String tag, String message) {
        delegate(tag).error(message);
    }

    @Override
    public void error(String tag, String message, Throwable throwable) {
        delegate(tag).error(message, throwable);
    }

    private org.slf4j.Logger delegate(String tag) {
        String name = tag != null ? tag : DEFAULT_TAG;
        return delegates.computeIfAbsent(name, org.slf4j.LoggerFactory::getLogger);
    }
}
