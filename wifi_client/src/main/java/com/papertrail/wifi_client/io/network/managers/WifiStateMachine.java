package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.events.WifiStateChangedEvent;
import com.papertrail.wifi_client.io.network.core.NamedThreadFactory;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.interfaces.IWifiConfigStore;
import com.papertrail.wifi_client.io.network.interfaces.IWifiStatePort;
import com.papertrail.wifi_client.io.network.interfaces.WifiStateListener;
import com.papertrail.wifi_client.io.network.models.WifiMode;
import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.domains.WifiReporting;

import org.greenrobot.eventbus.EventBus;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the authoritative {@link WifiState} and the hotspot poll loop.
 *
 * <p>The mode is derived from the number of attached UI clients: with at least one
 * client the device is stopped and actively joins the hotspot; with none it is driving
 * and only mirrors generic connectivity. Until onboarding completes, driving behaves
 * like stopped.
 *
 * <p>Follows Single Responsibility Principle: transitions and scheduling live here,
 * the managers below do the driver work.
 */
public class WifiStateMachine implements IWifiStatePort {
    private static final String TAG = "WifiStateMachine";
    private static final long SHUTDOWN_TIMEOUT_MS = 1000;

    private final WifiConfig config;
    private final IWifiConfigStore configStore;
    private final NetworkScanner networkScanner;
    private final ConnectionManager connectionManager;
    private final HotspotManager hotspotManager;
    private final EventBus eventBus;
    private final Clock clock;
    private final Logger logger;

    private final List<WifiStateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger webSocketClientCount = new AtomicInteger(0);
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);

    private volatile WifiState currentState = WifiState.IDLE;
    private volatile long connectedStateEnteredAt = -1;

    private ScheduledExecutorService scheduler;
    private ExecutorService attemptExecutor;
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> pendingAttempt;

    /**
     * @param configStore settings store used for the onboarding flag, may be null
     */
    public WifiStateMachine(WifiConfig config,
                            IWifiConfigStore configStore,
                            NetworkScanner networkScanner,
                            ConnectionManager connectionManager,
                            HotspotManager hotspotManager,
                            EventBus eventBus,
                            Clock clock,
                            Logger logger) {
        this.config = config;
        this.configStore = configStore;
        this.networkScanner = networkScanner;
        this.connectionManager = connectionManager;
        this.hotspotManager = hotspotManager;
        this.eventBus = eventBus;
        this.clock = clock;
        this.logger = logger;
    }

    // ---------------------------------------------
    // State
    // ---------------------------------------------

    public WifiState getState() {
        return currentState;
    }

    @Override
    public synchronized void setState(WifiState newState) {
        WifiState previousState = currentState;
        if (newState == previousState) {
            logger.debug(TAG, "State already " + newState + ", no change");
            return;
        }

        currentState = newState;
        if (newState == WifiState.CONNECTED) {
            connectedStateEnteredAt = clock.millis();
            hotspotManager.resetConnectedScreenDisplayed();
        } else {
            connectedStateEnteredAt = -1;
        }

        logger.info(TAG, "🔄 WiFi state: " + previousState + " -> " + newState);
        WifiReporting.reportStateTransition(previousState, newState);
        notifyStateChange(newState, previousState);
    }

    /**
     * @return a handle that removes the listener when run
     */
    public Runnable onStateChange(WifiStateListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void clearCallbacks() {
        logger.debug(TAG, "Clearing " + listeners.size() + " state listeners");
        listeners.clear();
    }

    private void notifyStateChange(WifiState state, WifiState previousState) {
        for (WifiStateListener listener : listeners) {
            try {
                listener.onStateChanged(state, previousState);
            } catch (Exception e) {
                logger.error(TAG, "Error notifying listener", e);
            }
        }
        try {
            eventBus.post(new WifiStateChangedEvent(state, previousState, clock.millis()));
        } catch (Exception e) {
            logger.error(TAG, "Error posting state event", e);
        }
    }

    // ---------------------------------------------
    // Mode
    // ---------------------------------------------

    public void setWebSocketClientCount(int count) {
        int previousCount = webSocketClientCount.getAndSet(Math.max(0, count));
        logger.info(TAG, "WebSocket clients: " + previousCount + " -> " + count);

        if (previousCount == 0 && count > 0) {
            logger.info(TAG, "Mode: driving -> stopped, running hotspot check now");
            triggerImmediateTick();
        } else if (previousCount > 0 && count <= 0) {
            logger.info(TAG, "Mode: stopped -> driving");
            cancelPendingAttempt();
            hotspotManager.abortConnectionAttempt();
            WifiState state = currentState;
            if (state == WifiState.WAITING_FOR_HOTSPOT || state == WifiState.CONNECTING) {
                setState(WifiState.IDLE);
            }
        }
    }

    public int getWebSocketClientCount() {
        return webSocketClientCount.get();
    }

    public WifiMode getMode() {
        return WifiMode.forClientCount(webSocketClientCount.get());
    }

    private synchronized void triggerImmediateTick() {
        if (scheduler == null) {
            return;
        }
        try {
            scheduler.execute(this::pollTick);
        } catch (RejectedExecutionException e) {
            logger.debug(TAG, "Poll scheduler shutting down, immediate tick skipped");
        }
    }

    // ---------------------------------------------
    // Lifecycle
    // ---------------------------------------------

    /**
     * Derive the first state from current connectivity.
     */
    public void syncInitialState() {
        try {
            if (hotspotManager.isConnectedToMobileHotspot()) {
                setState(WifiState.CONNECTED);
            } else if (connectionManager.isConnected()) {
                setState(WifiState.IDLE);
            } else {
                setState(WifiState.DISCONNECTED);
            }
        } catch (WifiException e) {
            logger.warn(TAG, "Could not read initial connectivity, staying " + currentState + ": " + e.getMessage());
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            logger.debug(TAG, "Hotspot polling already running");
            return;
        }
        long interval = config.getPollIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("wifi-poll"));
        attemptExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("hotspot-attempt"));
        pollTask = scheduler.scheduleAtFixedRate(this::pollTick, interval, interval, TimeUnit.MILLISECONDS);
        logger.info(TAG, "Hotspot polling started (" + interval + "ms interval)");
    }

    public void stop() {
        ScheduledExecutorService pollScheduler;
        ExecutorService attempts;
        synchronized (this) {
            if (scheduler == null) {
                return;
            }
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
            cancelPendingAttempt();
            pollScheduler = scheduler;
            attempts = attemptExecutor;
            scheduler = null;
            attemptExecutor = null;
        }
        shutdownExecutor(pollScheduler);
        shutdownExecutor(attempts);
        logger.info(TAG, "Hotspot polling stopped");
    }

    /**
     * Drop every listener and return to IDLE without notifying anyone.
     */
    public synchronized void reset() {
        listeners.clear();
        currentState = WifiState.IDLE;
        connectedStateEnteredAt = -1;
        webSocketClientCount.set(0);
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------
    // Poll loop
    // ---------------------------------------------

    /**
     * One evaluation of the hotspot state. Overlapping calls are skipped and
     * failures are logged so the timer keeps running.
     */
    public void pollTick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            logger.debug(TAG, "Previous poll tick still running, skipping");
            return;
        }
        try {
            evaluate();
        } catch (Exception e) {
            logger.error(TAG, "Hotspot poll tick failed", e);
            WifiReporting.reportBackgroundTaskFailed("hotspot-poll", e);
        } finally {
            tickInProgress.set(false);
        }
    }

    private void evaluate() throws WifiException {
        logger.debug(TAG, "Poll tick: state=" + currentState + ", clients=" + webSocketClientCount.get());

        if (hotspotManager.isConnectedToMobileHotspot()) {
            onHotspotConnected();
            return;
        }

        if (currentState == WifiState.CONNECTED) {
            long enteredAt = connectedStateEnteredAt;
            long connectedFor = enteredAt < 0 ? Long.MAX_VALUE : clock.millis() - enteredAt;
            if (connectedFor < config.getGracePeriodMs()) {
                logger.debug(TAG, "Hotspot not seen " + connectedFor + "ms after CONNECTED, within grace period");
                return;
            }
            logger.info(TAG, "Lost hotspot connection, waiting for hotspot again");
            setState(WifiState.WAITING_FOR_HOTSPOT);
        }

        if (webSocketClientCount.get() > 0) {
            pursueHotspot(false);
        } else if (!isOnboardingCompleted()) {
            logger.debug(TAG, "Onboarding not complete, pursuing hotspot without clients");
            pursueHotspot(true);
        } else {
            mirrorConnectivity();
        }
    }

    private void onHotspotConnected() {
        if (currentState != WifiState.CONNECTED) {
            setState(WifiState.CONNECTED);
        } else if (webSocketClientCount.get() == 0 && !hotspotManager.hasConnectedScreenBeenDisplayed()) {
            logger.debug(TAG, "Connected screen not shown yet, re-emitting CONNECTED");
            synchronized (this) {
                notifyStateChange(WifiState.CONNECTED, WifiState.CONNECTED);
            }
        }
    }

    /**
     * Stopped mode, and driving mode while onboarding: join the hotspot once it shows up.
     */
    private void pursueHotspot(boolean onboarding) {
        if (currentState == WifiState.ERROR) {
            logger.info(TAG, "Resetting from ERROR to allow retry");
            setState(WifiState.IDLE);
        }

        WifiState state = currentState;
        if (state == WifiState.CONNECTING || state == WifiState.RECONNECTING_FALLBACK) {
            logger.debug(TAG, "Operation in flight (" + state + "), not interfering");
            return;
        }

        String ssid = hotspotManager.getEffectiveHotspotSsid();
        if (!networkScanner.isNetworkVisible(ssid)) {
            logger.debug(TAG, "Hotspot \"" + ssid + "\" not visible");
            setState(WifiState.WAITING_FOR_HOTSPOT);
            return;
        }

        logger.info(TAG, "Hotspot \"" + ssid + "\" visible, preparing connection");
        hotspotManager.saveFallbackNetwork();
        setState(WifiState.WAITING_FOR_HOTSPOT);
        scheduleAttempt(onboarding);
    }

    /**
     * Driving mode: never initiates an attempt, only reflects connectivity.
     */
    private void mirrorConnectivity() throws WifiException {
        WifiState state = currentState;
        if (state != WifiState.IDLE && state != WifiState.DISCONNECTED) {
            setState(connectionManager.isConnected() ? WifiState.IDLE : WifiState.DISCONNECTED);
        }
    }

    private synchronized void scheduleAttempt(boolean onboarding) {
        if (scheduler == null) {
            logger.debug(TAG, "Polling not started, hotspot attempt not scheduled");
            return;
        }
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
        }
        long delay = config.getDebounceDelayMs();
        logger.debug(TAG, "Hotspot attempt scheduled in " + delay + "ms");
        try {
            pendingAttempt = scheduler.schedule(() -> fireAttempt(onboarding), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug(TAG, "Poll scheduler shutting down, hotspot attempt not scheduled");
        }
    }

    private synchronized void cancelPendingAttempt() {
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
    }

    private synchronized void fireAttempt(boolean onboarding) {
        pendingAttempt = null;
        if (attemptExecutor == null) {
            return;
        }
        boolean stillWanted = currentState == WifiState.WAITING_FOR_HOTSPOT
                && (onboarding || webSocketClientCount.get() > 0);
        if (!stillWanted) {
            logger.debug(TAG, "Skipping hotspot attempt (state=" + currentState
                    + ", clients=" + webSocketClientCount.get() + ")");
            return;
        }
        try {
            attemptExecutor.execute(this::runAttempt);
        } catch (RejectedExecutionException e) {
            logger.debug(TAG, "Attempt executor shutting down, hotspot attempt dropped");
        }
    }

    private void runAttempt() {
        try {
            hotspotManager.attemptMobileHotspotConnection();
        } catch (WifiException e) {
            logger.info(TAG, "Hotspot attempt ended: " + e.getErrorCode() + " " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error(TAG, "Hotspot attempt crashed", e);
            WifiReporting.reportBackgroundTaskFailed("hotspot-attempt", e);
        }
    }

    private boolean isOnboardingCompleted() {
        if (configStore == null) {
            return true;
        }
        Boolean completed = configStore.isOnboardingCompleted();
        return completed == null || completed;
    }
}
