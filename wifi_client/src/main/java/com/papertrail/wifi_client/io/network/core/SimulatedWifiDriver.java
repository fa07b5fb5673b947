package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;
import com.papertrail.wifi_client.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory WiFi driver for development hosts without NetworkManager.
 *
 * <p>Reports a fixed set of nearby networks, including the configured hotspot, and
 * answers in the same terse format as nmcli so the managers run unchanged on top of it.
 * Every activation of a known profile succeeds after a short delay.
 */
public class SimulatedWifiDriver implements IWifiDriver {
    private static final String TAG = "SimulatedWifiDriver";

    static final String WIFI_TYPE = "802-11-wireless";
    static final String IP_ADDRESS = "192.168.4.2/24";
    static final String MAC_ADDRESS = "AA:BB:CC:DD:EE:FF";
    private static final int UNKNOWN_CONNECTION_EXIT = 10;

    private final Logger logger;
    private final long activationDelayMs;

    private final Map<String, String> visibleNetworks = new LinkedHashMap<>();
    private final Map<String, String[]> profiles = new LinkedHashMap<>();
    private volatile String activeConnection;

    public SimulatedWifiDriver(WifiConfig config, long activationDelayMs, Logger logger) {
        this.logger = logger;
        this.activationDelayMs = activationDelayMs;

        addVisibleNetwork(config.getPrimarySsid(), 85, "WPA2", 2412);
        addVisibleNetwork("Home-Network", 72, "WPA2", 2437);
        addVisibleNetwork("Coffee-Shop-WiFi", 45, "--", 2462);
        addVisibleNetwork("Neighbor-5G", 60, "WPA3", 5180);
        logger.info(TAG, "Simulated WiFi driver created with " + visibleNetworks.size() + " networks");
    }

    /**
     * Make another network show up in scans, replacing any entry with the same SSID.
     */
    public synchronized void addVisibleNetwork(String ssid, int signal, String security, int frequency) {
        visibleNetworks.put(ssid, TerseOutputParser.escape(ssid) + ":" + signal + ":" + security + ":" + frequency + " MHz");
    }

    public synchronized void removeVisibleNetwork(String ssid) {
        visibleNetworks.remove(ssid);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized List<String> rescanAndList() {
        logger.debug(TAG, "Simulated scan: " + visibleNetworks.size() + " networks");
        return new ArrayList<>(visibleNetworks.values());
    }

    @Override
    public synchronized List<String> rescanAndListSsids() {
        List<String> ssids = new ArrayList<>();
        for (String ssid : visibleNetworks.keySet()) {
            ssids.add(TerseOutputParser.escape(ssid));
        }
        return ssids;
    }

    @Override
    public List<String> showDeviceStatus() {
        String active = activeConnection;
        List<String> lines = new ArrayList<>();
        lines.add("GENERAL.CONNECTION:" + (active != null ? active : "--"));
        if (active != null) {
            lines.add("IP4.ADDRESS[1]:" + IP_ADDRESS);
        }
        lines.add("GENERAL.HWADDR:" + TerseOutputParser.escape(MAC_ADDRESS));
        return lines;
    }

    @Override
    public synchronized boolean profileExists(String name) {
        return profiles.containsKey(name);
    }

    @Override
    public synchronized void addWifiProfile(String ssid, String password) {
        profiles.put(ssid, new String[]{WIFI_TYPE, "yes", "0"});
        logger.debug(TAG, "Simulated profile added: " + ssid);
    }

    @Override
    public synchronized void addWifiProfile(WifiNetworkConfig config) {
        profiles.put(config.getSsid(), new String[]{
                WIFI_TYPE, config.isAutoConnect() ? "yes" : "no", String.valueOf(config.getPriority())});
        logger.debug(TAG, "Simulated profile saved: " + config.getSsid());
    }

    @Override
    public synchronized void deleteProfile(String name) throws DriverException {
        if (profiles.remove(name) == null) {
            throw unknownConnection(name);
        }
        if (name.equals(activeConnection)) {
            activeConnection = null;
        }
    }

    @Override
    public void activateProfile(String name) throws DriverException {
        if (!profileExists(name)) {
            throw unknownConnection(name);
        }
        if (activationDelayMs > 0) {
            try {
                Thread.sleep(activationDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("Simulated activation interrupted", e);
            }
        }
        activeConnection = name;
        logger.info(TAG, "Simulated connection to \"" + name + "\"");
    }

    @Override
    public synchronized List<String> listProfiles() {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String[]> entry : profiles.entrySet()) {
            String[] profile = entry.getValue();
            lines.add(TerseOutputParser.escape(entry.getKey()) + ":" + profile[0] + ":" + profile[1] + ":" + profile[2]);
        }
        return lines;
    }

    @Override
    public void disconnectDevice() {
        logger.info(TAG, "Simulated disconnect from \"" + activeConnection + "\"");
        activeConnection = null;
    }

    private static DriverException unknownConnection(String name) {
        return new DriverException("no such connection profile", UNKNOWN_CONNECTION_EXIT,
                "Error: unknown connection '" + name + "'.");
    }
}
