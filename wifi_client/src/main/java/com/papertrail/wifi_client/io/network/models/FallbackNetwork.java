package com.papertrail.wifi_client.io.network.models;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * The network to return to when a hotspot attempt fails.
 */
public class FallbackNetwork {
    private final String ssid;
    private final long savedAt;

    public FallbackNetwork(String ssid, long savedAt) {
        this.ssid = ssid;
        this.savedAt = savedAt;
    }

    public String getSsid() {
        return ssid;
    }

    public long getSavedAt() {
        return savedAt;
    }

    public JSONObject toJson() throws JSONException {
        JSONObject json = new JSONObject();
        json.put("ssid", ssid);
        json.put("savedAt", savedAt);
        return json;
    }

    public static FallbackNetwork fromJson(JSONObject json) {
        if (json == null) {
            return null;
        }
        String ssid = json.optString("ssid", "");
        if (ssid.isEmpty()) {
            return null;
        }
        return new FallbackNetwork(ssid, json.optLong("savedAt", 0L));
    }

    @Override
    public String toString() {
        return "FallbackNetwork{ssid='" + ssid + "', savedAt=" + savedAt + "}";
    }
}
