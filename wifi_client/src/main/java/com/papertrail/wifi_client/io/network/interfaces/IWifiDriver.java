package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.core.DriverException;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;

import java.util.List;

/**
 * Boundary to the underlying network management layer.
 * Implementations return the driver's raw terse output lines; parsing and
 * failure classification belong to the managers.
 */
public interface IWifiDriver {

    /**
     * @return true if the driver binary can be invoked on this device
     */
    boolean isAvailable();

    /**
     * Trigger a rescan and list visible networks.
     * @return lines of {@code SSID:SIGNAL:SECURITY:FREQ}
     */
    List<String> rescanAndList() throws DriverException;

    /**
     * Trigger a rescan and list only the SSID column.
     * @return one SSID per line
     */
    List<String> rescanAndListSsids() throws DriverException;

    /**
     * Query the WiFi device status.
     * @return {@code KEY:value} lines including GENERAL.CONNECTION, IP4.ADDRESS and GENERAL.HWADDR
     */
    List<String> showDeviceStatus() throws DriverException;

    boolean profileExists(String name) throws DriverException;

    /**
     * Create a WPA-PSK profile named after the SSID.
     */
    void addWifiProfile(String ssid, String password) throws DriverException;

    /**
     * Create a WPA-PSK profile with explicit autoconnect settings.
     */
    void addWifiProfile(WifiNetworkConfig config) throws DriverException;

    void deleteProfile(String name) throws DriverException;

    /**
     * Bring a stored profile up. Blocks until the driver reports the outcome.
     */
    void activateProfile(String name) throws DriverException;

    /**
     * @return lines of {@code NAME:TYPE:AUTOCONNECT:AUTOCONNECT-PRIORITY} for every profile type
     */
    List<String> listProfiles() throws DriverException;

    void disconnectDevice() throws DriverException;
}
