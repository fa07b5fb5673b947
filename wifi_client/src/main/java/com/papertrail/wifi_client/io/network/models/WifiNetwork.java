package com.papertrail.wifi_client.io.network.models;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Objects;

/**
 * A network seen in a scan.
 */
public class WifiNetwork {
    private final String ssid;
    private final int signalStrength; // percent, 0-100
    private final WifiSecurity security;
    private final int frequency; // MHz

    public WifiNetwork(String ssid, int signalStrength, WifiSecurity security, int frequency) {
        this.ssid = ssid != null ? ssid : "";
        this.signalStrength = signalStrength;
        this.security = security != null ? security : WifiSecurity.UNKNOWN;
        this.frequency = frequency;
    }

    public String getSsid() {
        return ssid;
    }

    public int getSignalStrength() {
        return signalStrength;
    }

    public WifiSecurity getSecurity() {
        return security;
    }

    public int getFrequency() {
        return frequency;
    }

    /**
     * Convert to JSON object for the dashboard layer
     */
    public JSONObject toJson() throws JSONException {
        JSONObject json = new JSONObject();
        json.put("ssid", ssid);
        json.put("signalStrength", signalStrength);
        json.put("security", security.getLabel());
        json.put("frequency", frequency);
        return json;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        WifiNetwork that = (WifiNetwork) obj;
        return signalStrength == that.signalStrength
                && frequency == that.frequency
                && ssid.equals(that.ssid)
                && security == that.security;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ssid, signalStrength, security, frequency);
    }

    @Override
    public String toString() {
        return String.format("WifiNetwork{ssid='%s', strength=%d%%, security=%s, frequency=%dMHz}",
                ssid, signalStrength, security.getLabel(), frequency);
    }
}
