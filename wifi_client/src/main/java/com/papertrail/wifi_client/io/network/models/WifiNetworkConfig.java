package com.papertrail.wifi_client.io.network.models;

/**
 * Saved profile descriptor. The password is write-only: profiles read back
 * from the driver always carry an empty password.
 */
public class WifiNetworkConfig {
    private final String ssid;
    private final String password;
    private final int priority;
    private final boolean autoConnect;

    public WifiNetworkConfig(String ssid, String password, int priority, boolean autoConnect) {
        this.ssid = ssid;
        this.password = password != null ? password : "";
        this.priority = priority;
        this.autoConnect = autoConnect;
    }

    public WifiNetworkConfig(String ssid, String password) {
        this(ssid, password, 0, true);
    }

    public String getSsid() {
        return ssid;
    }

    public String getPassword() {
        return password;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    @Override
    public String toString() {
        // password deliberately left out
        return "WifiNetworkConfig{ssid='" + ssid + "', priority=" + priority + ", autoConnect=" + autoConnect + "}";
    }
}
