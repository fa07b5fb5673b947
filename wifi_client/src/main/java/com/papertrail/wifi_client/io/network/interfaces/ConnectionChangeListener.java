package com.papertrail.wifi_client.io.network.interfaces;

/**
 * Listener for connected/disconnected flips observed by the connection monitor.
 */
@FunctionalInterface
public interface ConnectionChangeListener {
    void onConnectionChanged(boolean connected);
}
