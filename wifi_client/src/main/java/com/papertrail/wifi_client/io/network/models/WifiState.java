package com.papertrail.wifi_client.io.network.models;

/**
 * Connectivity states of the WiFi state machine.
 * Only the state machine mutates the current state; everything else reads it.
 */
public enum WifiState {
    IDLE,
    CONNECTING,
    CONNECTED,
    WAITING_FOR_HOTSPOT,
    RECONNECTING_FALLBACK,
    DISCONNECTED,
    ERROR
}
