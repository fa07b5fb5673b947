package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.events.WifiStateChangedEvent;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiErrorCode;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.interfaces.IWifiConfigStore;
import com.papertrail.wifi_client.io.network.models.WifiMode;
import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.logging.LoggerFactory;
import com.papertrail.wifi_client.testutil.MutableClock;

import org.greenrobot.eventbus.EventBus;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(org.junit.runners.JUnit4.class)
public class WifiStateMachineTest {

    private static final String HOTSPOT = "Phone-AP";

    @Mock
    private NetworkScanner networkScanner;
    @Mock
    private ConnectionManager connectionManager;
    @Mock
    private HotspotManager hotspotManager;
    @Mock
    private IWifiConfigStore configStore;
    @Mock
    private EventBus eventBus;

    private AutoCloseable mocks;
    private MutableClock clock;
    private WifiConfig config;
    private List<String> transitions;

    @Before
    public void setup() {
        mocks = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(1_700_000_000_000L);
        config = new WifiConfig.Builder()
                .pollIntervalMs(60_000)
                .debounceDelayMs(50)
                .gracePeriodMs(5000)
                .build();
        transitions = new CopyOnWriteArrayList<>();
        when(hotspotManager.getEffectiveHotspotSsid()).thenReturn(HOTSPOT);
    }

    @After
    public void tearDown() throws Exception {
        mocks.close();
    }

    private WifiStateMachine newStateMachine(IWifiConfigStore store) {
        WifiStateMachine stateMachine = new WifiStateMachine(config, store, networkScanner, connectionManager,
                hotspotManager, eventBus, clock, LoggerFactory.createLogger());
        stateMachine.onStateChange((state, previous) -> transitions.add(previous + "->" + state));
        return stateMachine;
    }

    @Test
    public void testSetStateNotifiesOnlyOnChange() {
        WifiStateMachine stateMachine = newStateMachine(null);

        stateMachine.setState(WifiState.WAITING_FOR_HOTSPOT);
        stateMachine.setState(WifiState.WAITING_FOR_HOTSPOT);

        Assert.assertEquals(Arrays.asList("IDLE->WAITING_FOR_HOTSPOT"), transitions);
        ArgumentCaptor<WifiStateChangedEvent> captor = ArgumentCaptor.forClass(WifiStateChangedEvent.class);
        verify(eventBus, times(1)).post(captor.capture());
        Assert.assertEquals(WifiState.WAITING_FOR_HOTSPOT, captor.getValue().getState());
        Assert.assertEquals(WifiState.IDLE, captor.getValue().getPreviousState());
    }

    @Test
    public void testEnteringConnectedResetsScreenFlag() {
        WifiStateMachine stateMachine = newStateMachine(null);

        stateMachine.setState(WifiState.CONNECTED);

        verify(hotspotManager).resetConnectedScreenDisplayed();
    }

    @Test
    public void testThrowingListenerIsIsolated() {
        WifiStateMachine stateMachine = newStateMachine(null);
        List<WifiState> seen = new ArrayList<>();
        stateMachine.onStateChange((state, previous) -> {
            throw new IllegalStateException("listener bug");
        });
        stateMachine.onStateChange((state, previous) -> seen.add(state));

        stateMachine.setState(WifiState.DISCONNECTED);

        Assert.assertEquals(Arrays.asList(WifiState.DISCONNECTED), seen);
        Assert.assertEquals(WifiState.DISCONNECTED, stateMachine.getState());
    }

    @Test
    public void testUnsubscribe() {
        WifiStateMachine stateMachine = newStateMachine(null);
        List<WifiState> seen = new ArrayList<>();
        Runnable unsubscribe = stateMachine.onStateChange((state, previous) -> seen.add(state));

        unsubscribe.run();
        stateMachine.setState(WifiState.ERROR);

        Assert.assertTrue(seen.isEmpty());
    }

    @Test
    public void testModeFollowsClientCount() {
        WifiStateMachine stateMachine = newStateMachine(null);
        Assert.assertEquals(WifiMode.DRIVING, stateMachine.getMode());

        stateMachine.setWebSocketClientCount(2);
        Assert.assertEquals(WifiMode.STOPPED, stateMachine.getMode());

        stateMachine.setWebSocketClientCount(0);
        Assert.assertEquals(WifiMode.DRIVING, stateMachine.getMode());
    }

    @Test
    public void testGracePeriodAfterEnteringConnected() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.CONNECTED);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(false);

        clock.advance(4999);
        stateMachine.pollTick();
        Assert.assertEquals(WifiState.CONNECTED, stateMachine.getState());

        clock.advance(2);
        stateMachine.pollTick();
        Assert.assertEquals(WifiState.WAITING_FOR_HOTSPOT, stateMachine.getState());
        Assert.assertEquals(Arrays.asList("IDLE->CONNECTED", "CONNECTED->WAITING_FOR_HOTSPOT"), transitions);
    }

    @Test
    public void testClientsLeavingResetsPendingConnection() {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.WAITING_FOR_HOTSPOT);

        stateMachine.setWebSocketClientCount(0);

        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());
        verify(hotspotManager).abortConnectionAttempt();
    }

    @Test
    public void testClientsLeavingWhileConnectingResetsToIdle() {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.CONNECTING);

        stateMachine.setWebSocketClientCount(0);

        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());
        verify(hotspotManager).abortConnectionAttempt();
    }

    @Test
    public void testClientsLeavingWhileConnectedKeepsState() {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.CONNECTED);

        stateMachine.setWebSocketClientCount(0);

        Assert.assertEquals(WifiState.CONNECTED, stateMachine.getState());
    }

    @Test
    public void testConnectedIsReEmittedUntilScreenShown() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setState(WifiState.CONNECTED);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(true);
        when(hotspotManager.hasConnectedScreenBeenDisplayed()).thenReturn(false);

        stateMachine.pollTick();
        Assert.assertEquals(Arrays.asList("IDLE->CONNECTED", "CONNECTED->CONNECTED"), transitions);

        when(hotspotManager.hasConnectedScreenBeenDisplayed()).thenReturn(true);
        stateMachine.pollTick();
        Assert.assertEquals(2, transitions.size());
    }

    @Test
    public void testNoReEmissionWithClientsAttached() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.CONNECTED);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(true);

        stateMachine.pollTick();

        Assert.assertEquals(Arrays.asList("IDLE->CONNECTED"), transitions);
    }

    @Test
    public void testStoppedModeWaitsWhenHotspotInvisible() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(false);

        stateMachine.pollTick();

        Assert.assertEquals(WifiState.WAITING_FOR_HOTSPOT, stateMachine.getState());
        verify(hotspotManager, never()).saveFallbackNetwork();
    }

    @Test
    public void testStoppedModeResetsErrorBeforeRetrying() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.ERROR);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(false);

        stateMachine.pollTick();

        Assert.assertEquals(Arrays.asList("IDLE->ERROR", "ERROR->IDLE", "IDLE->WAITING_FOR_HOTSPOT"), transitions);
    }

    @Test
    public void testStoppedModeLeavesInFlightOperationsAlone() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.setState(WifiState.RECONNECTING_FALLBACK);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);

        stateMachine.pollTick();

        Assert.assertEquals(WifiState.RECONNECTING_FALLBACK, stateMachine.getState());
        verify(networkScanner, never()).isNetworkVisible(anyString());
    }

    @Test
    public void testVisibleHotspotSchedulesDebouncedAttempt() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(true);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.start();
        try {

            stateMachine.pollTick();

            Assert.assertEquals(WifiState.WAITING_FOR_HOTSPOT, stateMachine.getState());
            verify(hotspotManager).saveFallbackNetwork();
            verify(hotspotManager, timeout(2000)).attemptMobileHotspotConnection();
        } finally {
            stateMachine.stop();
        }
    }

    @Test
    public void testDebouncedAttemptSkippedWhenClientsLeave() throws Exception {
        config = new WifiConfig.Builder()
                .pollIntervalMs(60_000)
                .debounceDelayMs(200)
                .build();
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(true);
        stateMachine.setWebSocketClientCount(1);
        stateMachine.start();
        try {

            stateMachine.pollTick();
            stateMachine.setWebSocketClientCount(0);

            Assert.assertEquals(WifiState.IDLE, stateMachine.getState());
            verify(hotspotManager, after(500).never()).attemptMobileHotspotConnection();
        } finally {
            stateMachine.stop();
        }
    }

    @Test
    public void testDrivingModeNeverAttemptsHotspot() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(configStore);
        when(configStore.isOnboardingCompleted()).thenReturn(true);
        stateMachine.setState(WifiState.DISCONNECTED);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(false);

        for (int i = 0; i < 5; i++) {
            stateMachine.pollTick();
            clock.advance(10_000);
        }

        Assert.assertEquals(WifiState.DISCONNECTED, stateMachine.getState());
        verify(hotspotManager, never()).attemptMobileHotspotConnection();
        verify(hotspotManager, never()).saveFallbackNetwork();
    }

    @Test
    public void testDrivingModeMirrorsConnectivity() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        stateMachine.setState(WifiState.ERROR);

        when(connectionManager.isConnected()).thenReturn(true);
        stateMachine.pollTick();
        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());

        when(connectionManager.isConnected()).thenReturn(false);
        stateMachine.pollTick();
        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());
    }

    @Test
    public void testDrivingModeAfterLosingHotspotEndsDisconnected() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setState(WifiState.CONNECTED);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(false);

        clock.advance(6000);
        stateMachine.pollTick();

        Assert.assertEquals(WifiState.DISCONNECTED, stateMachine.getState());
        Assert.assertEquals(Arrays.asList("IDLE->CONNECTED", "CONNECTED->WAITING_FOR_HOTSPOT",
                "WAITING_FOR_HOTSPOT->DISCONNECTED"), transitions);
    }

    @Test
    public void testOnboardingPursuesHotspotWithoutClients() throws Exception {
        when(configStore.isOnboardingCompleted()).thenReturn(false);
        WifiStateMachine stateMachine = newStateMachine(configStore);
        stateMachine.start();
        try {
            when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
            when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(true);

            stateMachine.pollTick();

            Assert.assertEquals(WifiState.WAITING_FOR_HOTSPOT, stateMachine.getState());
            verify(hotspotManager, timeout(2000)).attemptMobileHotspotConnection();
        } finally {
            stateMachine.stop();
        }
    }

    @Test
    public void testMissingOnboardingFlagCountsAsCompleted() throws Exception {
        when(configStore.isOnboardingCompleted()).thenReturn(null);
        WifiStateMachine stateMachine = newStateMachine(configStore);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(true);

        stateMachine.pollTick();

        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());
        verify(networkScanner, never()).isNetworkVisible(anyString());
    }

    @Test
    public void testFirstClientTriggersImmediateTick() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(networkScanner.isNetworkVisible(HOTSPOT)).thenReturn(false);
        stateMachine.start();
        try {
            stateMachine.setWebSocketClientCount(1);

            verify(networkScanner, timeout(2000)).isNetworkVisible(HOTSPOT);
        } finally {
            stateMachine.stop();
        }
    }

    @Test
    public void testTickSurvivesFailures() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot())
                .thenThrow(new WifiException("boom", WifiErrorCode.UNKNOWN, true))
                .thenThrow(new IllegalStateException("bug"))
                .thenReturn(true);

        stateMachine.pollTick();
        stateMachine.pollTick();
        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());

        stateMachine.pollTick();
        Assert.assertEquals(WifiState.CONNECTED, stateMachine.getState());
    }

    @Test
    public void testOverlappingTicksAreSkipped() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(hotspotManager.isConnectedToMobileHotspot()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(2, TimeUnit.SECONDS);
            return true;
        });

        Thread slowTick = new Thread(stateMachine::pollTick);
        slowTick.start();
        Assert.assertTrue(entered.await(2, TimeUnit.SECONDS));

        stateMachine.pollTick();
        release.countDown();
        slowTick.join(2000);

        verify(hotspotManager, times(1)).isConnectedToMobileHotspot();
        Assert.assertEquals(WifiState.CONNECTED, stateMachine.getState());
    }

    @Test
    public void testSyncInitialState() throws Exception {
        WifiStateMachine stateMachine = newStateMachine(null);
        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(false);
        when(connectionManager.isConnected()).thenReturn(false);
        stateMachine.syncInitialState();
        Assert.assertEquals(WifiState.DISCONNECTED, stateMachine.getState());

        when(connectionManager.isConnected()).thenReturn(true);
        stateMachine.syncInitialState();
        Assert.assertEquals(WifiState.IDLE, stateMachine.getState());

        when(hotspotManager.isConnectedToMobileHotspot()).thenReturn(true);
        stateMachine.syncInitialState();
        Assert.assertEquals(WifiState.CONNECTED, stateMachine.getState());
    }

    @Test
    public void testResetReturnsToIdleAndDropsListeners() {
        WifiStateMachine stateMachine = newStateMachine(null);
        stateMachine.setWebSocketClientCount(3);
        stateMachine.setState(WifiState.CONNECTED);
        transitions.clear();

        stateMachine.reset();
        stateMachine.setState(WifiState.DISCONNECTED);

        Assert.assertEquals(0, stateMachine.getWebSocketClientCount());
        Assert.assertTrue(transitions.isEmpty());
    }
}
