package com.papertrail.wifi_client.io.network.models;

/**
 * Device mode derived from the number of attached UI clients.
 */
public enum WifiMode {
    /** At least one UI client is attached, someone is likely near the device. */
    STOPPED("stopped"),
    /** No UI client attached. */
    DRIVING("driving");

    private final String name;

    WifiMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static WifiMode forClientCount(int clientCount) {
        return clientCount > 0 ? STOPPED : DRIVING;
    }
}
