package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.events.WifiConnectionChangedEvent;
import com.papertrail.wifi_client.io.network.core.DriverException;
import com.papertrail.wifi_client.io.network.core.NamedThreadFactory;
import com.papertrail.wifi_client.io.network.core.TerseOutputParser;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.interfaces.ConnectionChangeListener;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.models.WifiConnection;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.domains.WifiReporting;

import org.greenrobot.eventbus.EventBus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Connects, disconnects and manages driver profiles.
 * Owns the periodic connection monitor and its change notifications.
 */
public class ConnectionManager {
    private static final String TAG = "ConnectionManager";

    static final String WIFI_PROFILE_TYPE = "802-11-wireless";
    private static final String KEY_CONNECTION = "GENERAL.CONNECTION";
    private static final String KEY_IP4_ADDRESS = "IP4.ADDRESS";
    private static final String KEY_HWADDR = "GENERAL.HWADDR";

    private final IWifiDriver driver;
    private final NetworkScanner networkScanner;
    private final WifiConfig config;
    private final BooleanSupplier initialized;
    private final EventBus eventBus;
    private final Clock clock;
    private final Logger logger;

    private final List<ConnectionChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ThreadFactory activationThreads = new NamedThreadFactory("wifi-activate");
    // one thread per activation; a timed-out activation keeps running to completion
    private final Executor activationRunner = task -> activationThreads.newThread(task).start();

    private ScheduledExecutorService monitorScheduler;
    private ScheduledFuture<?> monitorTask;
    private volatile boolean lastConnected = false;

    public ConnectionManager(IWifiDriver driver,
                             NetworkScanner networkScanner,
                             WifiConfig config,
                             BooleanSupplier initialized,
                             EventBus eventBus,
                             Clock clock,
                             Logger logger) {
        this.driver = driver;
        this.networkScanner = networkScanner;
        this.config = config;
        this.initialized = initialized;
        this.eventBus = eventBus;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Snapshot of the active connection.
     *
     * @return the connection, or null when disconnected or the status query fails
     * @throws WifiException only when the service is not initialized
     */
    public WifiConnection getCurrentConnection() throws WifiException {
        ensureInitialized();

        List<String> lines;
        try {
            lines = driver.showDeviceStatus();
        } catch (DriverException e) {
            logger.debug(TAG, "Device status query failed, treating as not connected: " + e.getMessage());
            return null;
        }

        String name = null;
        String ipAddress = null;
        String macAddress = null;
        for (String line : lines) {
            String[] record = TerseOutputParser.splitFirst(line);
            String key = record[0];
            String value = record[1];
            if (KEY_CONNECTION.equals(key)) {
                name = value;
            } else if (key.startsWith(KEY_IP4_ADDRESS) && ipAddress == null) {
                int slash = value.indexOf('/');
                ipAddress = slash >= 0 ? value.substring(0, slash) : value;
            } else if (KEY_HWADDR.equals(key)) {
                macAddress = value;
            }
        }

        if (name == null || name.isEmpty() || "--".equals(name)) {
            return null;
        }

        int signal = networkScanner.getSignalStrength(name);
        return new WifiConnection(name, ipAddress, macAddress, signal, clock.millis());
    }

    public boolean isConnected() throws WifiException {
        return getCurrentConnection() != null;
    }

    /**
     * Recreate the profile for the SSID and activate it within the configured timeout.
     *
     * @throws WifiException AUTH_FAILED when the driver rejects the secret, TIMEOUT when
     *                       activation outlives the timeout, CONNECTION_FAILED otherwise
     */
    public void connect(String ssid, String password) throws WifiException {
        ensureInitialized();
        logger.info(TAG, "📶 Connecting to \"" + ssid + "\"");

        removeStaleProfile(ssid);
        try {
            driver.addWifiProfile(ssid, password);
        } catch (DriverException e) {
            throw classifyConnectFailure(ssid, e);
        }

        CompletableFuture<Void> activation = CompletableFuture.runAsync(() -> {
            try {
                driver.activateProfile(ssid);
            } catch (DriverException e) {
                throw new CompletionException(e);
            }
        }, activationRunner);

        long timeoutMs = config.getConnectionTimeoutMs();
        try {
            activation.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn(TAG, "Activation of \"" + ssid + "\" timed out after " + timeoutMs + "ms");
            throw WifiException.timeout("connect", timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriverException) {
                throw classifyConnectFailure(ssid, (DriverException) cause);
            }
            throw WifiException.connectionFailed(ssid, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw WifiException.unknown("Interrupted while connecting to \"" + ssid + "\"");
        }

        logger.info(TAG, "✅ Connected to \"" + ssid + "\"");
    }

    /**
     * Best-effort removal of a profile about to be recreated.
     */
    private void removeStaleProfile(String ssid) {
        try {
            if (driver.profileExists(ssid)) {
                logger.debug(TAG, "Removing existing profile for \"" + ssid + "\"");
                driver.deleteProfile(ssid);
            }
        } catch (DriverException e) {
            logger.debug(TAG, "Could not remove existing profile for \"" + ssid + "\": " + e.getMessage());
        }
    }

    /**
     * Bring an existing profile up again without resupplying its secret.
     */
    public void activateSavedNetwork(String name) throws WifiException {
        ensureInitialized();
        try {
            driver.activateProfile(name);
            logger.info(TAG, "Activated saved profile \"" + name + "\"");
        } catch (DriverException e) {
            throw WifiException.connectionFailed(name, e);
        }
    }

    /**
     * @throws WifiException NOT_CONNECTED when there is nothing to disconnect from
     */
    public void disconnect() throws WifiException {
        ensureInitialized();
        if (!isConnected()) {
            throw WifiException.notConnected();
        }
        try {
            driver.disconnectDevice();
            logger.info(TAG, "Disconnected from WiFi");
        } catch (DriverException e) {
            throw WifiException.unknown("Failed to disconnect", e);
        }
    }

    public void saveNetwork(WifiNetworkConfig networkConfig) throws WifiException {
        ensureInitialized();
        try {
            if (driver.profileExists(networkConfig.getSsid())) {
                driver.deleteProfile(networkConfig.getSsid());
            }
            driver.addWifiProfile(networkConfig);
            logger.info(TAG, "Saved network " + networkConfig);
        } catch (DriverException e) {
            throw WifiException.unknown("Failed to save network \"" + networkConfig.getSsid() + "\"", e);
        }
    }

    /**
     * @return WiFi profiles only, each with an empty password
     */
    public List<WifiNetworkConfig> getSavedNetworks() throws WifiException {
        ensureInitialized();
        List<String> lines;
        try {
            lines = driver.listProfiles();
        } catch (DriverException e) {
            throw WifiException.unknown("Failed to list saved networks", e);
        }

        List<WifiNetworkConfig> networks = new ArrayList<>();
        for (String line : lines) {
            List<String> fields = TerseOutputParser.splitFields(line);
            if (fields.size() < 2 || !WIFI_PROFILE_TYPE.equals(fields.get(1))) {
                continue;
            }
            boolean autoConnect = fields.size() > 2 && "yes".equalsIgnoreCase(fields.get(2));
            int priority = fields.size() > 3 ? TerseOutputParser.parseIntOrZero(fields.get(3)) : 0;
            networks.add(new WifiNetworkConfig(fields.get(0), "", priority, autoConnect));
        }
        return networks;
    }

    /**
     * @throws WifiException NETWORK_NOT_FOUND when no profile carries that name
     */
    public void removeNetwork(String ssid) throws WifiException {
        ensureInitialized();
        try {
            if (!driver.profileExists(ssid)) {
                throw WifiException.networkNotFound(ssid);
            }
            driver.deleteProfile(ssid);
            logger.info(TAG, "Removed network \"" + ssid + "\"");
        } catch (DriverException e) {
            throw WifiException.unknown("Failed to remove network \"" + ssid + "\"", e);
        }
    }

    public synchronized void startConnectionMonitoring() {
        if (monitorScheduler != null) {
            logger.debug(TAG, "Connection monitoring already running");
            return;
        }
        lastConnected = false;
        long interval = config.getMonitorIntervalMs();
        monitorScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("wifi-monitor"));
        monitorTask = monitorScheduler.scheduleAtFixedRate(this::checkConnection, interval, interval, TimeUnit.MILLISECONDS);
        logger.info(TAG, "Connection monitoring started (" + interval + "ms interval)");
    }

    public synchronized void stopConnectionMonitoring() {
        if (monitorTask != null) {
            monitorTask.cancel(false);
            monitorTask = null;
        }
        if (monitorScheduler != null) {
            monitorScheduler.shutdown();
            try {
                if (!monitorScheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                    monitorScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                monitorScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            monitorScheduler = null;
            logger.info(TAG, "Connection monitoring stopped");
        }
    }

    /**
     * One monitor tick. Compares the current connected flag with the last one seen.
     */
    void checkConnection() {
        try {
            boolean connected = isConnected();
            if (connected != lastConnected) {
                logger.info(TAG, "WiFi connection changed: " + (lastConnected ? "connected" : "disconnected")
                        + " -> " + (connected ? "connected" : "disconnected"));
                lastConnected = connected;
                notifyConnectionChange(connected);
            }
        } catch (Exception e) {
            logger.error(TAG, "Error in connection monitor tick", e);
            WifiReporting.reportBackgroundTaskFailed("connection_monitor", e);
        }
    }

    /**
     * @return handle that removes the listener when run
     */
    public Runnable onConnectionChange(ConnectionChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void clearCallbacks() {
        listeners.clear();
    }

    private void notifyConnectionChange(boolean connected) {
        for (ConnectionChangeListener listener : listeners) {
            try {
                listener.onConnectionChanged(connected);
            } catch (Exception e) {
                logger.error(TAG, "Error notifying listener", e);
            }
        }
        try {
            eventBus.post(new WifiConnectionChangedEvent(connected, clock.millis()));
        } catch (Exception e) {
            logger.error(TAG, "Error posting connection event", e);
        }
    }

    private WifiException classifyConnectFailure(String ssid, DriverException e) {
        String detail = (e.getStderr() + " " + e.getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains("secrets were required")
                || detail.contains("802-11-wireless-security")
                || detail.contains("authentication")) {
            logger.warn(TAG, "Authentication rejected for \"" + ssid + "\"");
            WifiReporting.reportAuthFailed(ssid);
            return WifiException.authFailed(ssid);
        }
        logger.error(TAG, "Connection to \"" + ssid + "\" failed: " + e.getMessage());
        return WifiException.connectionFailed(ssid, e);
    }

    private void ensureInitialized() throws WifiException {
        if (!initialized.getAsBoolean()) {
            throw WifiException.notInitialized();
        }
    }
}
