package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.models.WifiState;

/**
 * Listener for state machine transitions.
 * A CONNECTED to CONNECTED notification is a UI retry signal, not a transition.
 */
@FunctionalInterface
public interface WifiStateListener {
    void onStateChanged(WifiState state, WifiState previousState);
}
