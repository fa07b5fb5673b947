package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.io.network.core.DriverException;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiErrorCode;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.models.FallbackNetwork;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;
import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.logging.LoggerFactory;
import com.papertrail.wifi_client.testutil.FakeWifiDriver;
import com.papertrail.wifi_client.testutil.InMemoryConfigStore;
import com.papertrail.wifi_client.testutil.MutableClock;

import org.greenrobot.eventbus.EventBus;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

@RunWith(org.junit.runners.JUnit4.class)
public class HotspotManagerTest {

    private static final String HOTSPOT = "Phone-AP";
    private static final String HOME = "HomeNet";

    private FakeWifiDriver driver;
    private InMemoryConfigStore store;
    private MutableClock clock;
    private List<WifiState> states;
    private HotspotManager hotspotManager;
    private CountDownLatch heldActivation;

    @Before
    public void setup() {
        driver = new FakeWifiDriver();
        store = new InMemoryConfigStore();
        clock = new MutableClock(1_700_000_000_000L);
        states = new CopyOnWriteArrayList<>();
        Logger logger = LoggerFactory.createLogger();

        WifiConfig config = new WifiConfig.Builder()
                .primarySsid(HOTSPOT)
                .primaryPassword("phone-pass")
                .connectionTimeoutMs(5000)
                .hotspotConnectionTimeoutMs(300)
                .settleDelayMs(0)
                .verifyRetryDelayMs(0)
                .build();
        NetworkScanner scanner = new NetworkScanner(driver, () -> true, logger);
        ConnectionManager connectionManager = new ConnectionManager(driver, scanner, config, () -> true,
                EventBus.builder().logNoSubscriberMessages(false).build(), clock, logger);
        hotspotManager = new HotspotManager(config, store, scanner, connectionManager, states::add, clock, logger);

        driver.addProfile(HOME, FakeWifiDriver.WIFI_TYPE);
        driver.setActiveConnection(HOME);
    }

    @After
    public void tearDown() {
        if (heldActivation != null) {
            heldActivation.countDown();
        }
    }

    @Test
    public void testSuccessfulAttemptConnectsAndClearsFallback() throws Exception {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        store.setFallbackNetwork(new FallbackNetwork(HOME, clock.millis()));

        hotspotManager.attemptMobileHotspotConnection();

        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING, WifiState.CONNECTED), states);
        Assert.assertNull(store.getFallbackNetwork());
        Assert.assertTrue(hotspotManager.isConnectedToMobileHotspot());
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testInvisibleHotspotLeavesCurrentNetworkAlone() {
        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected NETWORK_NOT_FOUND");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.NETWORK_NOT_FOUND, e.getErrorCode());
        }
        Assert.assertTrue(states.isEmpty());
        Assert.assertTrue(driver.getCalls().isEmpty());
        Assert.assertEquals(HOME, driver.getActiveConnection());
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testSecondAttemptWhileInFlightIsRejected() throws Exception {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        heldActivation = driver.blockActivation(HOTSPOT);
        AtomicReference<Exception> firstOutcome = new AtomicReference<>();
        Thread first = new Thread(() -> {
            try {
                hotspotManager.attemptMobileHotspotConnection();
            } catch (Exception e) {
                firstOutcome.set(e);
            }
        });
        first.start();
        Assert.assertTrue(driver.awaitActivationStarted(2000));
        Assert.assertTrue(hotspotManager.isConnectionAttemptInProgress());

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected ALREADY_IN_PROGRESS");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.ALREADY_IN_PROGRESS, e.getErrorCode());
        }
        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING), states);

        heldActivation.countDown();
        first.join(5000);
        Assert.assertNull(firstOutcome.get());
        Assert.assertEquals(WifiState.CONNECTED, states.get(states.size() - 1));
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testTimeoutReturnsToFallbackNetwork() {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        store.setFallbackNetwork(new FallbackNetwork(HOME, clock.millis()));
        heldActivation = driver.blockActivation(HOTSPOT);

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected HOTSPOT_CONNECTION_TIMEOUT");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.HOTSPOT_CONNECTION_TIMEOUT, e.getErrorCode());
        }

        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING, WifiState.RECONNECTING_FALLBACK,
                WifiState.DISCONNECTED), states);
        Assert.assertEquals(HOME, driver.getActiveConnection());
        Assert.assertTrue(driver.getCalls().contains("activate:" + HOME));
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testTimeoutWithFailedFallbackEndsInError() {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        store.setFallbackNetwork(new FallbackNetwork("ForgottenNet", clock.millis()));
        heldActivation = driver.blockActivation(HOTSPOT);

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected HOTSPOT_CONNECTION_TIMEOUT");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.HOTSPOT_CONNECTION_TIMEOUT, e.getErrorCode());
        }

        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING, WifiState.RECONNECTING_FALLBACK,
                WifiState.ERROR), states);
    }

    @Test
    public void testTimeoutWithoutFallbackEndsDisconnected() {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        heldActivation = driver.blockActivation(HOTSPOT);

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected HOTSPOT_CONNECTION_TIMEOUT");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.HOTSPOT_CONNECTION_TIMEOUT, e.getErrorCode());
        }
        Assert.assertEquals(WifiState.DISCONNECTED, states.get(states.size() - 1));
    }

    @Test
    public void testAbortEndsAttemptWithoutStateChange() throws Exception {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        heldActivation = driver.blockActivation(HOTSPOT);
        AtomicReference<Exception> outcome = new AtomicReference<>();
        Thread attempt = new Thread(() -> {
            try {
                hotspotManager.attemptMobileHotspotConnection();
            } catch (Exception e) {
                outcome.set(e);
            }
        });
        attempt.start();
        Assert.assertTrue(driver.awaitActivationStarted(2000));

        hotspotManager.abortConnectionAttempt();
        attempt.join(2000);

        Assert.assertFalse(attempt.isAlive());
        Assert.assertTrue(outcome.get() instanceof WifiException);
        Assert.assertEquals(WifiErrorCode.UNKNOWN, ((WifiException) outcome.get()).getErrorCode());
        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING), states);
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testAbortWithoutAttemptIsNoOp() {
        hotspotManager.abortConnectionAttempt();

        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
        Assert.assertTrue(states.isEmpty());
    }

    @Test
    public void testUnverifiedConnectionGoesBackToWaiting() {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        driver.setActivationConnects(false);

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected CONNECTION_FAILED");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.CONNECTION_FAILED, e.getErrorCode());
        }
        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING, WifiState.WAITING_FOR_HOTSPOT), states);
    }

    @Test
    public void testConnectFailureEndsInError() {
        driver.addVisibleNetwork(HOTSPOT, 90, "WPA2", 2437);
        driver.failActivation(new DriverException("activation failed", 4,
                "Error: Connection activation failed: Secrets were required, but not provided."));

        try {
            hotspotManager.attemptMobileHotspotConnection();
            Assert.fail("Expected CONNECTION_FAILED");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.CONNECTION_FAILED, e.getErrorCode());
        }
        Assert.assertEquals(Arrays.asList(WifiState.CONNECTING, WifiState.ERROR), states);
        Assert.assertFalse(hotspotManager.isConnectionAttemptInProgress());
    }

    @Test
    public void testSetHotspotConfigRejectsEmptySsid() {
        try {
            hotspotManager.setHotspotConfig("", "longenough1");
            Assert.fail("Expected INVALID_CONFIG");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.INVALID_CONFIG, e.getErrorCode());
        }
        Assert.assertNull(store.getHotspotConfig());
    }

    @Test
    public void testSetHotspotConfigRejectsShortPassword() {
        try {
            hotspotManager.setHotspotConfig("Valid", "short");
            Assert.fail("Expected INVALID_CONFIG");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.INVALID_CONFIG, e.getErrorCode());
        }
        Assert.assertNull(store.getHotspotConfig());
    }

    @Test
    public void testSetHotspotConfigPersistsAndForcesRenegotiation() throws Exception {
        hotspotManager.notifyConnectedScreenDisplayed();

        hotspotManager.setHotspotConfig("Valid", "longenough1");

        HotspotConfig saved = store.getHotspotConfig();
        Assert.assertEquals("Valid", saved.getSsid());
        Assert.assertEquals("longenough1", saved.getPassword());
        Assert.assertEquals(clock.millis(), saved.getUpdatedAt());
        Assert.assertTrue(store.getSaveCount() > 0);
        Assert.assertEquals(HOME, store.getFallbackNetwork().getSsid());
        Assert.assertTrue(driver.getCalls().contains("disconnect"));
        Assert.assertEquals(Arrays.asList(WifiState.WAITING_FOR_HOTSPOT), states);
        Assert.assertFalse(hotspotManager.hasConnectedScreenBeenDisplayed());
        Assert.assertEquals("Valid", hotspotManager.getMobileHotspotSSID());
    }

    @Test
    public void testSetHotspotConfigSurfacesPersistFailure() {
        store.setFailSaves(true);
        try {
            hotspotManager.setHotspotConfig("Valid", "longenough1");
            Assert.fail("Expected UNKNOWN");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.UNKNOWN, e.getErrorCode());
        }
        Assert.assertTrue(states.isEmpty());
        Assert.assertEquals(HOTSPOT, hotspotManager.getEffectiveHotspotSsid());
        Assert.assertEquals("phone-pass", hotspotManager.getEffectiveHotspotPassword());
        Assert.assertNull(store.getHotspotConfig());
    }

    @Test
    public void testFailedPersistKeepsPreviousOverrideAndFallback() {
        store.setHotspotConfig(new HotspotConfig("Old-AP", "old-password", 5L));
        store.setFallbackNetwork(new FallbackNetwork(HOME, 7L));
        store.setFailSaves(true);

        try {
            hotspotManager.setHotspotConfig(HOME, "longenough1");
            Assert.fail("Expected UNKNOWN");
        } catch (WifiException e) {
            Assert.assertEquals(WifiErrorCode.UNKNOWN, e.getErrorCode());
        }

        Assert.assertEquals("Old-AP", hotspotManager.getEffectiveHotspotSsid());
        Assert.assertEquals("old-password", hotspotManager.getEffectiveHotspotPassword());
        Assert.assertEquals(HOME, store.getFallbackNetwork().getSsid());
    }

    @Test
    public void testNewHotspotMatchingFallbackDropsFallback() throws Exception {
        driver.setActiveConnection(null);
        store.setFallbackNetwork(new FallbackNetwork(HOME, 1L));

        hotspotManager.setHotspotConfig(HOME, "longenough1");

        Assert.assertEquals(HOME, hotspotManager.getEffectiveHotspotSsid());
        Assert.assertNull(store.getFallbackNetwork());
        Assert.assertEquals(Arrays.asList(WifiState.WAITING_FOR_HOTSPOT), states);
    }

    @Test
    public void testReconnectDiscardsFallbackNamingTheHotspot() throws Exception {
        store.setFallbackNetwork(new FallbackNetwork(HOTSPOT, 1L));

        hotspotManager.reconnectToFallback();

        Assert.assertNull(store.getFallbackNetwork());
        Assert.assertTrue(driver.getCalls().isEmpty());
        Assert.assertEquals(HOME, driver.getActiveConnection());
    }

    @Test
    public void testEffectiveHotspotFallsBackToDefault() {
        Assert.assertEquals(HOTSPOT, hotspotManager.getEffectiveHotspotSsid());
        Assert.assertEquals("phone-pass", hotspotManager.getEffectiveHotspotPassword());

        HotspotConfig defaults = hotspotManager.getHotspotConfig();
        Assert.assertEquals(HOTSPOT, defaults.getSsid());
        Assert.assertEquals(clock.millis(), defaults.getUpdatedAt());

        store.setHotspotConfig(new HotspotConfig("Custom-AP", "custom-pass", 5L));
        Assert.assertEquals("Custom-AP", hotspotManager.getEffectiveHotspotSsid());
        Assert.assertEquals("custom-pass", hotspotManager.getEffectiveHotspotPassword());
        Assert.assertEquals(5L, hotspotManager.getHotspotConfig().getUpdatedAt());
    }

    @Test
    public void testFallbackNeverRecordsTheHotspot() {
        driver.setActiveConnection(HOTSPOT);

        hotspotManager.saveFallbackNetwork();
        Assert.assertNull(store.getFallbackNetwork());

        driver.setActiveConnection(HOME);
        hotspotManager.saveFallbackNetwork();
        Assert.assertEquals(HOME, store.getFallbackNetwork().getSsid());

        hotspotManager.clearFallbackNetwork();
        Assert.assertNull(store.getFallbackNetwork());
    }

    @Test
    public void testReconnectWithoutFallbackDoesNothing() throws Exception {
        hotspotManager.reconnectToFallback();

        Assert.assertTrue(driver.getCalls().isEmpty());
    }

    @Test
    public void testConnectedScreenFlag() {
        Assert.assertFalse(hotspotManager.hasConnectedScreenBeenDisplayed());
        hotspotManager.notifyConnectedScreenDisplayed();
        Assert.assertTrue(hotspotManager.hasConnectedScreenBeenDisplayed());
        hotspotManager.resetConnectedScreenDisplayed();
        Assert.assertFalse(hotspotManager.hasConnectedScreenBeenDisplayed());
    }
}
