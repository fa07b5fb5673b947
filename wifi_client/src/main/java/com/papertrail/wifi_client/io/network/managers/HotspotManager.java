package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.io.network.core.NamedThreadFactory;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiErrorCode;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.interfaces.IWifiConfigStore;
import com.papertrail.wifi_client.io.network.interfaces.IWifiStatePort;
import com.papertrail.wifi_client.io.network.models.FallbackNetwork;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;
import com.papertrail.wifi_client.io.network.models.WifiConnection;
import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.domains.WifiReporting;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs the mobile hotspot connection protocol and keeps the fallback network record.
 *
 * <p>At most one attempt runs at a time. An attempt checks visibility without
 * disconnecting, races the connect against a timeout and an abort signal, verifies
 * the result, and on timeout returns the device to the network it was on before.
 *
 * <p>State changes go through the {@link IWifiStatePort} handed in at construction.
 */
public class HotspotManager {
    private static final String TAG = "HotspotManager";
    private static final int MIN_PASSWORD_LENGTH = 8;

    private final WifiConfig config;
    private final IWifiConfigStore configStore;
    private final NetworkScanner networkScanner;
    private final ConnectionManager connectionManager;
    private final IWifiStatePort statePort;
    private final Clock clock;
    private final Logger logger;

    private final AtomicBoolean attemptInProgress = new AtomicBoolean(false);
    private volatile CompletableFuture<Void> abortSignal;
    private volatile boolean connectedScreenDisplayed = false;

    private final ThreadFactory connectThreads = new NamedThreadFactory("hotspot-connect");
    private final Executor connectRunner = task -> connectThreads.newThread(task).start();

    /**
     * @param configStore persisted overrides, may be null when the device has no settings storage
     */
    public HotspotManager(WifiConfig config,
                          IWifiConfigStore configStore,
                          NetworkScanner networkScanner,
                          ConnectionManager connectionManager,
                          IWifiStatePort statePort,
                          Clock clock,
                          Logger logger) {
        this.config = config;
        this.configStore = configStore;
        this.networkScanner = networkScanner;
        this.connectionManager = connectionManager;
        this.statePort = statePort;
        this.clock = clock;
        this.logger = logger;
    }

    public boolean isConnectedToMobileHotspot() throws WifiException {
        WifiConnection connection = connectionManager.getCurrentConnection();
        return connection != null && getEffectiveHotspotSsid().equals(connection.getSsid());
    }

    /**
     * Single attempt to join the mobile hotspot.
     *
     * @throws WifiException ALREADY_IN_PROGRESS, NETWORK_NOT_FOUND, CONNECTION_FAILED,
     *                       HOTSPOT_CONNECTION_TIMEOUT or UNKNOWN (aborted)
     */
    public void attemptMobileHotspotConnection() throws WifiException {
        if (!attemptInProgress.compareAndSet(false, true)) {
            logger.warn(TAG, "Hotspot connection attempt already in progress");
            throw WifiException.alreadyInProgress();
        }
        CompletableFuture<Void> abort = new CompletableFuture<>();
        abortSignal = abort;

        String ssid = getEffectiveHotspotSsid();
        String password = getEffectiveHotspotPassword();
        try {
            logger.info(TAG, "📶 Attempting hotspot connection to \"" + ssid + "\"");

            if (!networkScanner.isNetworkVisible(ssid)) {
                logger.info(TAG, "Hotspot \"" + ssid + "\" not visible, staying on current network");
                throw WifiException.networkNotFound(ssid);
            }
            if (abort.isDone()) {
                throw aborted();
            }

            statePort.setState(WifiState.CONNECTING);
            raceConnect(ssid, password, abort);

            if (!verifyHotspotConnection()) {
                logger.warn(TAG, "Connected but not on \"" + ssid + "\", will retry on a later poll");
                statePort.setState(WifiState.WAITING_FOR_HOTSPOT);
                throw WifiException.connectionFailed(ssid, "connection could not be verified");
            }

            logger.info(TAG, "✅ Connected to hotspot \"" + ssid + "\"");
            statePort.setState(WifiState.CONNECTED);
            clearFallbackNetwork();
        } finally {
            attemptInProgress.set(false);
            abortSignal = null;
        }
    }

    /**
     * Race the connect against the hotspot timeout and the abort signal.
     */
    private void raceConnect(String ssid, String password, CompletableFuture<Void> abort) throws WifiException {
        CompletableFuture<Void> connect = CompletableFuture.runAsync(() -> {
            try {
                connectionManager.connect(ssid, password);
            } catch (WifiException e) {
                throw new CompletionException(e);
            }
        }, connectRunner);

        long timeoutMs = config.getHotspotConnectionTimeoutMs();
        try {
            CompletableFuture.anyOf(connect, abort).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handleConnectTimeout(ssid, timeoutMs);
        } catch (ExecutionException e) {
            if (abort.isDone()) {
                throw aborted();
            }
            Throwable cause = e.getCause();
            logger.error(TAG, "Hotspot connection to \"" + ssid + "\" failed: " + cause.getMessage());
            statePort.setState(WifiState.ERROR);
            throw WifiException.connectionFailed(ssid, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw WifiException.unknown("Interrupted while connecting to hotspot");
        }

        if (abort.isDone()) {
            throw aborted();
        }
    }

    /**
     * Put the device back where it was and surface the timeout.
     */
    private void handleConnectTimeout(String ssid, long timeoutMs) throws WifiException {
        logger.warn(TAG, "⏱ Hotspot connection timed out after " + timeoutMs + "ms, returning to fallback");
        statePort.setState(WifiState.RECONNECTING_FALLBACK);

        boolean restored;
        try {
            reconnectToFallback();
            restored = true;
            statePort.setState(WifiState.DISCONNECTED);
        } catch (WifiException e) {
            logger.error(TAG, "Fallback recovery failed: " + e.getMessage());
            restored = false;
            statePort.setState(WifiState.ERROR);
        }

        WifiReporting.reportHotspotTimeout(ssid, timeoutMs, restored);
        throw WifiException.hotspotConnectionTimeout(ssid, timeoutMs);
    }

    /**
     * Check after the settle delay, then once more after the retry delay.
     */
    private boolean verifyHotspotConnection() throws WifiException {
        pause(config.getSettleDelayMs());
        if (isConnectedQuietly()) {
            return true;
        }
        logger.debug(TAG, "Hotspot not verified yet, retrying in " + config.getVerifyRetryDelayMs() + "ms");
        pause(config.getVerifyRetryDelayMs());
        return isConnectedQuietly();
    }

    private boolean isConnectedQuietly() {
        try {
            return isConnectedToMobileHotspot();
        } catch (WifiException e) {
            logger.warn(TAG, "Hotspot verification failed: " + e.getMessage());
            return false;
        }
    }

    /**
     * Fire the abort signal of the running attempt. No-op when nothing is in flight.
     */
    public void abortConnectionAttempt() {
        CompletableFuture<Void> signal = abortSignal;
        if (signal != null && attemptInProgress.get()) {
            logger.info(TAG, "Aborting in-progress hotspot connection attempt");
            signal.complete(null);
        }
    }

    public boolean isConnectionAttemptInProgress() {
        return attemptInProgress.get();
    }

    public String getMobileHotspotSSID() {
        return getEffectiveHotspotSsid();
    }

    /**
     * @return the persisted override, or the compiled default stamped with the current time
     */
    public HotspotConfig getHotspotConfig() {
        HotspotConfig saved = configStore != null ? configStore.getHotspotConfig() : null;
        if (saved != null) {
            return saved;
        }
        return new HotspotConfig(config.getPrimarySsid(), config.getPrimaryPassword(), clock.millis());
    }

    /**
     * Persist a new hotspot identity and force renegotiation against it.
     *
     * @throws WifiException INVALID_CONFIG for an empty SSID or a password shorter than 8 characters
     */
    public void setHotspotConfig(String ssid, String password) throws WifiException {
        if (ssid == null || ssid.trim().isEmpty()) {
            throw WifiException.invalidConfig("Hotspot SSID cannot be empty");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw WifiException.invalidConfig("Hotspot password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (configStore == null) {
            throw WifiException.unknown("No settings storage available for hotspot config");
        }

        String trimmed = ssid.trim();
        HotspotConfig previousConfig = configStore.getHotspotConfig();
        FallbackNetwork previousFallback = configStore.getFallbackNetwork();

        configStore.setHotspotConfig(new HotspotConfig(trimmed, password, clock.millis()));
        if (previousFallback != null && previousFallback.getSsid().equals(trimmed)) {
            logger.info(TAG, "Dropping fallback \"" + trimmed + "\", it is now the hotspot");
            configStore.setFallbackNetwork(null);
        }
        try {
            configStore.save();
        } catch (IOException e) {
            configStore.setHotspotConfig(previousConfig);
            configStore.setFallbackNetwork(previousFallback);
            throw new WifiException("Failed to persist hotspot config", WifiErrorCode.UNKNOWN, true,
                    Collections.singletonMap("ssid", trimmed), e);
        }
        logger.info(TAG, "Hotspot config updated to \"" + trimmed + "\"");

        saveFallbackNetwork();
        try {
            connectionManager.disconnect();
        } catch (WifiException e) {
            logger.debug(TAG, "Disconnect before renegotiation skipped: " + e.getMessage());
        }
        statePort.setState(WifiState.WAITING_FOR_HOTSPOT);
        connectedScreenDisplayed = false;
    }

    public void notifyConnectedScreenDisplayed() {
        logger.debug(TAG, "Connected screen displayed");
        connectedScreenDisplayed = true;
    }

    public boolean hasConnectedScreenBeenDisplayed() {
        return connectedScreenDisplayed;
    }

    public void resetConnectedScreenDisplayed() {
        connectedScreenDisplayed = false;
    }

    /**
     * Record the current network as the one to return to. Never records the hotspot itself.
     */
    public void saveFallbackNetwork() {
        if (configStore == null) {
            return;
        }
        WifiConnection connection;
        try {
            connection = connectionManager.getCurrentConnection();
        } catch (WifiException e) {
            logger.warn(TAG, "Cannot read current connection for fallback: " + e.getMessage());
            return;
        }
        if (connection == null) {
            logger.debug(TAG, "Not connected, no fallback network to save");
            return;
        }
        if (connection.getSsid().equals(getEffectiveHotspotSsid())) {
            logger.debug(TAG, "Connected to the hotspot itself, not saving it as fallback");
            return;
        }

        configStore.setFallbackNetwork(new FallbackNetwork(connection.getSsid(), clock.millis()));
        persistQuietly("fallback network");
        logger.info(TAG, "Saved fallback network \"" + connection.getSsid() + "\"");
    }

    public void clearFallbackNetwork() {
        if (configStore == null || configStore.getFallbackNetwork() == null) {
            return;
        }
        configStore.setFallbackNetwork(null);
        persistQuietly("fallback network");
        logger.debug(TAG, "Cleared fallback network");
    }

    /**
     * Return to the recorded fallback network.
     * The fallback profile must have connected once before: no secret is resupplied.
     * A record naming the hotspot itself is discarded rather than reactivated.
     *
     * @throws WifiException FALLBACK_RECONNECT_FAILED when the profile cannot be brought up
     */
    public void reconnectToFallback() throws WifiException {
        FallbackNetwork fallback = configStore != null ? configStore.getFallbackNetwork() : null;
        if (fallback == null) {
            logger.info(TAG, "No fallback network recorded, nothing to reconnect");
            return;
        }
        if (fallback.getSsid().equals(getEffectiveHotspotSsid())) {
            logger.warn(TAG, "Fallback record names the hotspot \"" + fallback.getSsid() + "\", discarding it");
            clearFallbackNetwork();
            return;
        }

        logger.info(TAG, "Reconnecting to fallback network \"" + fallback.getSsid() + "\"");
        try {
            connectionManager.disconnect();
        } catch (WifiException e) {
            logger.debug(TAG, "Disconnect before fallback skipped: " + e.getMessage());
        }

        try {
            connectionManager.activateSavedNetwork(fallback.getSsid());
        } catch (WifiException e) {
            WifiReporting.reportFallbackReconnectFailed(fallback.getSsid(), e);
            throw WifiException.fallbackReconnectFailed(fallback.getSsid(), e);
        }
        logger.info(TAG, "Back on fallback network \"" + fallback.getSsid() + "\"");
    }

    public String getEffectiveHotspotSsid() {
        return resolveHotspot(HotspotConfig::getSsid, config.getPrimarySsid());
    }

    public String getEffectiveHotspotPassword() {
        return resolveHotspot(HotspotConfig::getPassword, config.getPrimaryPassword());
    }

    /**
     * Persisted override if present, compiled default otherwise.
     */
    private <T> T resolveHotspot(Function<HotspotConfig, T> field, T defaultValue) {
        return Optional.ofNullable(configStore)
                .map(IWifiConfigStore::getHotspotConfig)
                .map(field)
                .orElse(defaultValue);
    }

    private void persistQuietly(String what) {
        try {
            configStore.save();
        } catch (IOException e) {
            logger.error(TAG, "Failed to persist " + what, e);
        }
    }

    private static WifiException aborted() {
        return WifiException.unknown("Connection attempt aborted");
    }

    private static void pause(long millis) throws WifiException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw WifiException.unknown("Interrupted while verifying hotspot connection");
        }
    }
}
