package com.papertrail.wifi_client.io.network.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checked failure of a WiFi operation.
 * Carries an error code, whether a retry may succeed, and diagnostic context.
 */
public class WifiException extends Exception {

    private final WifiErrorCode errorCode;
    private final boolean recoverable;
    private final Map<String, Object> context;

    public WifiException(String message, WifiErrorCode errorCode, boolean recoverable) {
        this(message, errorCode, recoverable, Collections.emptyMap(), null);
    }

    public WifiException(String message, WifiErrorCode errorCode, boolean recoverable,
                         Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.recoverable = recoverable;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public WifiErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public static WifiException notInitialized() {
        return new WifiException("WiFi service not initialized", WifiErrorCode.NOT_INITIALIZED, true);
    }

    public static WifiException scanFailed(Throwable cause) {
        return new WifiException("Failed to scan networks: " + cause.getMessage(),
                WifiErrorCode.SCAN_FAILED, true,
                context("originalError", cause.getMessage()), cause);
    }

    public static WifiException networkNotFound(String ssid) {
        return new WifiException("Network \"" + ssid + "\" not found",
                WifiErrorCode.NETWORK_NOT_FOUND, true, context("ssid", ssid), null);
    }

    public static WifiException authFailed(String ssid) {
        return new WifiException("Authentication failed for \"" + ssid + "\"",
                WifiErrorCode.AUTH_FAILED, true, context("ssid", ssid), null);
    }

    public static WifiException connectionFailed(String ssid, Throwable cause) {
        String reason = cause != null ? cause.getMessage() : "unknown error";
        return new WifiException("Failed to connect to \"" + ssid + "\": " + reason,
                WifiErrorCode.CONNECTION_FAILED, true,
                context("ssid", ssid, "originalError", reason), cause);
    }

    public static WifiException connectionFailed(String ssid, String reason) {
        return new WifiException("Failed to connect to \"" + ssid + "\": " + reason,
                WifiErrorCode.CONNECTION_FAILED, true,
                context("ssid", ssid, "originalError", reason), null);
    }

    public static WifiException timeout(String operation, long timeoutMs) {
        return new WifiException("WiFi operation timed out after " + timeoutMs + "ms: " + operation,
                WifiErrorCode.TIMEOUT, true,
                context("operation", operation, "timeoutMs", timeoutMs), null);
    }

    public static WifiException notConnected() {
        return new WifiException("Not connected to any WiFi network", WifiErrorCode.NOT_CONNECTED, true);
    }

    public static WifiException alreadyInProgress() {
        return new WifiException("A hotspot connection attempt is already in progress",
                WifiErrorCode.ALREADY_IN_PROGRESS, true);
    }

    public static WifiException hotspotConnectionTimeout(String ssid, long timeoutMs) {
        return new WifiException("Timed out after " + timeoutMs + "ms connecting to hotspot \"" + ssid + "\"",
                WifiErrorCode.HOTSPOT_CONNECTION_TIMEOUT, true,
                context("ssid", ssid, "timeoutMs", timeoutMs), null);
    }

    public static WifiException fallbackReconnectFailed(String ssid, Throwable cause) {
        String reason = cause != null ? cause.getMessage() : "unknown error";
        return new WifiException("Failed to reconnect to fallback network \"" + ssid + "\": " + reason,
                WifiErrorCode.FALLBACK_RECONNECT_FAILED, true,
                context("ssid", ssid, "originalError", reason), cause);
    }

    public static WifiException driverNotAvailable() {
        return new WifiException("NetworkManager (nmcli) not found. WiFi management requires NetworkManager.",
                WifiErrorCode.DRIVER_NOT_AVAILABLE, false);
    }

    public static WifiException invalidConfig(String message) {
        return new WifiException(message, WifiErrorCode.INVALID_CONFIG, true);
    }

    public static WifiException unknown(String message) {
        return new WifiException(message, WifiErrorCode.UNKNOWN, true);
    }

    public static WifiException unknown(String message, Throwable cause) {
        String reason = cause != null ? cause.getMessage() : "unknown error";
        return new WifiException(message + ": " + reason, WifiErrorCode.UNKNOWN, true,
                context("originalError", reason), cause);
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
