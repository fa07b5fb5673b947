package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.ConnectionChangeListener;
import com.papertrail.wifi_client.io.network.interfaces.IWifiConfigStore;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.interfaces.IWifiService;
import com.papertrail.wifi_client.io.network.interfaces.WifiStateListener;
import com.papertrail.wifi_client.io.network.managers.ConnectionManager;
import com.papertrail.wifi_client.io.network.managers.HotspotManager;
import com.papertrail.wifi_client.io.network.managers.NetworkScanner;
import com.papertrail.wifi_client.io.network.managers.WifiStateMachine;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;
import com.papertrail.wifi_client.io.network.models.WifiConnection;
import com.papertrail.wifi_client.io.network.models.WifiMode;
import com.papertrail.wifi_client.io.network.models.WifiNetwork;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;
import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.domains.WifiReporting;

import org.greenrobot.eventbus.EventBus;

import java.time.Clock;
import java.util.List;

/**
 * Facade over the WiFi components.
 * Owns the scanner, connection manager, hotspot manager and state machine and
 * drives their lifecycle; every exposed operation is delegated.
 */
public class WifiService implements IWifiService {
    private static final String TAG = "WifiService";

    private final IWifiDriver driver;
    private final Logger logger;

    private final NetworkScanner networkScanner;
    private final ConnectionManager connectionManager;
    private final HotspotManager hotspotManager;
    private WifiStateMachine stateMachine; // Set after hotspotManager, which reports state through it

    private volatile boolean initialized = false;

    public WifiService(IWifiDriver driver,
                       IWifiConfigStore configStore,
                       WifiConfig config,
                       EventBus eventBus,
                       Clock clock,
                       Logger logger) {
        this.driver = driver;
        this.logger = logger;

        this.networkScanner = new NetworkScanner(driver, this::isInitialized, logger);
        this.connectionManager = new ConnectionManager(driver, networkScanner, config,
                this::isInitialized, eventBus, clock, logger);
        this.hotspotManager = new HotspotManager(config, configStore, networkScanner,
                connectionManager, state -> stateMachine.setState(state), clock, logger);
        this.stateMachine = new WifiStateMachine(config, configStore, networkScanner,
                connectionManager, hotspotManager, eventBus, clock, logger);
    }

    @Override
    public synchronized void initialize() throws WifiException {
        if (initialized) {
            logger.debug(TAG, "Already initialized");
            return;
        }
        logger.info(TAG, "Initializing WiFi service");

        if (!driver.isAvailable()) {
            logger.error(TAG, "WiFi driver not available");
            throw WifiException.driverNotAvailable();
        }

        initialized = true;
        connectionManager.startConnectionMonitoring();
        stateMachine.start();
        stateMachine.syncInitialState();

        WifiReporting.reportServiceEvent("initialized");
        logger.info(TAG, "✅ WiFi service initialized, state " + stateMachine.getState());
    }

    @Override
    public synchronized void dispose() {
        if (!initialized) {
            return;
        }
        logger.info(TAG, "Disposing WiFi service");

        stateMachine.stop();
        connectionManager.stopConnectionMonitoring();
        hotspotManager.abortConnectionAttempt();
        connectionManager.clearCallbacks();
        stateMachine.reset();
        initialized = false;

        WifiReporting.reportServiceEvent("disposed");
        logger.info(TAG, "WiFi service disposed");
    }

    public boolean isInitialized() {
        return initialized;
    }

    // Scanning

    @Override
    public List<WifiNetwork> scanNetworks() throws WifiException {
        return networkScanner.scanNetworks();
    }

    // Connection management

    @Override
    public WifiConnection getCurrentConnection() throws WifiException {
        return connectionManager.getCurrentConnection();
    }

    @Override
    public boolean isConnected() throws WifiException {
        return connectionManager.isConnected();
    }

    @Override
    public void connect(String ssid, String password) throws WifiException {
        connectionManager.connect(ssid, password);
    }

    @Override
    public void disconnect() throws WifiException {
        connectionManager.disconnect();
    }

    @Override
    public void saveNetwork(WifiNetworkConfig config) throws WifiException {
        connectionManager.saveNetwork(config);
    }

    @Override
    public List<WifiNetworkConfig> getSavedNetworks() throws WifiException {
        return connectionManager.getSavedNetworks();
    }

    @Override
    public void removeNetwork(String ssid) throws WifiException {
        connectionManager.removeNetwork(ssid);
    }

    @Override
    public Runnable onConnectionChange(ConnectionChangeListener listener) {
        return connectionManager.onConnectionChange(listener);
    }

    // State machine

    @Override
    public WifiState getState() {
        return stateMachine.getState();
    }

    @Override
    public Runnable onStateChange(WifiStateListener listener) {
        return stateMachine.onStateChange(listener);
    }

    @Override
    public void setWebSocketClientCount(int count) {
        stateMachine.setWebSocketClientCount(count);
    }

    @Override
    public WifiMode getMode() {
        return stateMachine.getMode();
    }

    // Hotspot

    @Override
    public boolean isConnectedToMobileHotspot() throws WifiException {
        return hotspotManager.isConnectedToMobileHotspot();
    }

    @Override
    public void attemptMobileHotspotConnection() throws WifiException {
        ensureInitialized();
        hotspotManager.attemptMobileHotspotConnection();
    }

    @Override
    public boolean isConnectionAttemptInProgress() {
        return hotspotManager.isConnectionAttemptInProgress();
    }

    @Override
    public void abortConnectionAttempt() {
        hotspotManager.abortConnectionAttempt();
    }

    @Override
    public String getMobileHotspotSSID() {
        return hotspotManager.getMobileHotspotSSID();
    }

    @Override
    public HotspotConfig getHotspotConfig() {
        return hotspotManager.getHotspotConfig();
    }

    @Override
    public void setHotspotConfig(String ssid, String password) throws WifiException {
        ensureInitialized();
        hotspotManager.setHotspotConfig(ssid, password);
    }

    @Override
    public void notifyConnectedScreenDisplayed() {
        hotspotManager.notifyConnectedScreenDisplayed();
    }

    @Override
    public boolean hasConnectedScreenBeenDisplayed() {
        return hotspotManager.hasConnectedScreenBeenDisplayed();
    }

    private void ensureInitialized() throws WifiException {
        if (!initialized) {
            throw WifiException.notInitialized();
        }
    }

    WifiStateMachine getStateMachine() {
        return stateMachine;
    }

    HotspotManager getHotspotManager() {
        return hotspotManager;
    }
}
