package com.papertrail.wifi_client.io.network.core;

/**
 * Error codes for WiFi operations.
 */
public enum WifiErrorCode {
    NOT_INITIALIZED("WIFI_NOT_INITIALIZED"),
    SCAN_FAILED("WIFI_SCAN_FAILED"),
    NETWORK_NOT_FOUND("WIFI_NETWORK_NOT_FOUND"),
    AUTH_FAILED("WIFI_AUTH_FAILED"),
    CONNECTION_FAILED("WIFI_CONNECTION_FAILED"),
    TIMEOUT("WIFI_TIMEOUT"),
    NOT_CONNECTED("WIFI_NOT_CONNECTED"),
    ALREADY_IN_PROGRESS("WIFI_ALREADY_IN_PROGRESS"),
    HOTSPOT_CONNECTION_TIMEOUT("WIFI_HOTSPOT_CONNECTION_TIMEOUT"),
    FALLBACK_RECONNECT_FAILED("WIFI_FALLBACK_RECONNECT_FAILED"),
    DRIVER_NOT_AVAILABLE("WIFI_DRIVER_NOT_AVAILABLE"),
    INVALID_CONFIG("WIFI_INVALID_CONFIG"),
    UNKNOWN("WIFI_UNKNOWN");

    private final String code;

    WifiErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
