package com.papertrail.wifi_client.io.network.models;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * User-overridable identity of the mobile hotspot.
 */
public class HotspotConfig {
    private final String ssid;
    private final String password;
    private final long updatedAt;

    public HotspotConfig(String ssid, String password, long updatedAt) {
        this.ssid = ssid;
        this.password = password;
        this.updatedAt = updatedAt;
    }

    public String getSsid() {
        return ssid;
    }

    public String getPassword() {
        return password;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public JSONObject toJson() throws JSONException {
        JSONObject json = new JSONObject();
        json.put("ssid", ssid);
        json.put("password", password);
        json.put("updatedAt", updatedAt);
        return json;
    }

    /**
     * @return the parsed config, or null when the object lacks an SSID
     */
    public static HotspotConfig fromJson(JSONObject json) {
        if (json == null) {
            return null;
        }
        String ssid = json.optString("ssid", "");
        if (ssid.isEmpty()) {
            return null;
        }
        return new HotspotConfig(ssid, json.optString("password", ""), json.optLong("updatedAt", 0L));
    }

    @Override
    public String toString() {
        return "HotspotConfig{ssid='" + ssid + "', updatedAt=" + updatedAt + "}";
    }
}
