package com.papertrail.wifi_client.io.network.models;

/**
 * Normalized security label of a scanned network.
 */
public enum WifiSecurity {
    OPEN("Open"),
    WEP("WEP"),
    WPA("WPA"),
    WPA2("WPA2"),
    WPA3("WPA3"),
    UNKNOWN("Unknown");

    private final String label;

    WifiSecurity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
