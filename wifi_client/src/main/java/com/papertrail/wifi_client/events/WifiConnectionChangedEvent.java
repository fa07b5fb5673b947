package com.papertrail.wifi_client.events;

/**
 * EventBus event for connected/disconnected flips seen by the connection monitor
 */
public class WifiConnectionChangedEvent {
    private final boolean connected;
    private final long timestamp;

    public WifiConnectionChangedEvent(boolean connected, long timestamp) {
        this.connected = connected;
        this.timestamp = timestamp;
    }

    public boolean isConnected() {
        return connected;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "WifiConnectionChangedEvent{" +
                "connected=" + connected +
                ", timestamp=" + timestamp +
                '}';
    }
}
