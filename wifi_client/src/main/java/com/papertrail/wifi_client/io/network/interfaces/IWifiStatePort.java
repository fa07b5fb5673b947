package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.models.WifiState;

/**
 * Narrow handle through which managers request state transitions
 * from the state machine.
 */
@FunctionalInterface
public interface IWifiStatePort {
    void setState(WifiState state);
}
