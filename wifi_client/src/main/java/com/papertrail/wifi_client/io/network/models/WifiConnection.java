package com.papertrail.wifi_client.io.network.models;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Point-in-time snapshot of the active connection.
 * Recreated on every query, never cached.
 */
public class WifiConnection {
    private final String ssid;
    private final String ipAddress;
    private final String macAddress;
    private final int signalStrength;
    private final long connectedAt;

    public WifiConnection(String ssid, String ipAddress, String macAddress, int signalStrength, long connectedAt) {
        this.ssid = ssid;
        this.ipAddress = ipAddress != null ? ipAddress : "";
        this.macAddress = macAddress != null ? macAddress : "";
        this.signalStrength = signalStrength;
        this.connectedAt = connectedAt;
    }

    public String getSsid() {
        return ssid;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getMacAddress() {
        return macAddress;
    }

    public int getSignalStrength() {
        return signalStrength;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public JSONObject toJson() throws JSONException {
        JSONObject json = new JSONObject();
        json.put("ssid", ssid);
        json.put("ipAddress", ipAddress);
        json.put("macAddress", macAddress);
        json.put("signalStrength", signalStrength);
        json.put("connectedAt", connectedAt);
        return json;
    }

    @Override
    public String toString() {
        return "WifiConnection{" +
                "ssid='" + ssid + '\'' +
                ", ipAddress='" + ipAddress + '\'' +
                ", macAddress='" + macAddress + '\'' +
                ", signalStrength=" + signalStrength +
                ", connectedAt=" + connectedAt +
                '}';
    }
}
