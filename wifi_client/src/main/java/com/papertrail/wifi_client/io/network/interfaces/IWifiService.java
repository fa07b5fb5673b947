package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;
import com.papertrail.wifi_client.io.network.models.WifiConnection;
import com.papertrail.wifi_client.io.network.models.WifiMode;
import com.papertrail.wifi_client.io.network.models.WifiNetwork;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;
import com.papertrail.wifi_client.io.network.models.WifiState;

import java.util.List;

/**
 * WiFi operations exposed to the rest of the device software.
 */
public interface IWifiService {

    /**
     * Check the driver, start monitoring and polling, and derive the initial state.
     */
    void initialize() throws WifiException;

    /**
     * Stop all timers, abort any attempt, and drop every listener.
     */
    void dispose();

    // Scanning

    List<WifiNetwork> scanNetworks() throws WifiException;

    // Connection management

    /**
     * @return the active connection, or null when not connected
     */
    WifiConnection getCurrentConnection() throws WifiException;

    boolean isConnected() throws WifiException;

    void connect(String ssid, String password) throws WifiException;

    void disconnect() throws WifiException;

    // Profiles held by the driver

    void saveNetwork(WifiNetworkConfig config) throws WifiException;

    List<WifiNetworkConfig> getSavedNetworks() throws WifiException;

    void removeNetwork(String ssid) throws WifiException;

    /**
     * @return a handle that unsubscribes the listener when run
     */
    Runnable onConnectionChange(ConnectionChangeListener listener);

    // State machine

    WifiState getState();

    /**
     * @return a handle that unsubscribes the listener when run
     */
    Runnable onStateChange(WifiStateListener listener);

    void setWebSocketClientCount(int count);

    WifiMode getMode();

    // Hotspot

    boolean isConnectedToMobileHotspot() throws WifiException;

    void attemptMobileHotspotConnection() throws WifiException;

    boolean isConnectionAttemptInProgress();

    void abortConnectionAttempt();

    String getMobileHotspotSSID();

    HotspotConfig getHotspotConfig();

    void setHotspotConfig(String ssid, String password) throws WifiException;

    void notifyConnectedScreenDisplayed();

    boolean hasConnectedScreenBeenDisplayed();
}
