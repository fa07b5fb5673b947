package com.papertrail.wifi_client.events;

import com.papertrail.wifi_client.io.network.models.WifiState;

/**
 * EventBus event for WiFi state machine transitions.
 * Posted on every transition and on CONNECTED re-emissions.
 */
public class WifiStateChangedEvent {
    private final WifiState state;
    private final WifiState previousState;
    private final long timestamp;

    public WifiStateChangedEvent(WifiState state, WifiState previousState, long timestamp) {
        this.state = state;
        this.previousState = previousState;
        this.timestamp = timestamp;
    }

    public WifiState getState() {
        return state;
    }

    public WifiState getPreviousState() {
        return previousState;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isReEmission() {
        return state == previousState;
    }

    @Override
    public String toString() {
        return "WifiStateChangedEvent{" +
                "state=" + state +
                ", previousState=" + previousState +
                ", timestamp=" + timestamp +
                '}';
    }
}
