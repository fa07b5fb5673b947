package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.models.FallbackNetwork;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;

import java.io.IOException;

/**
 * Persistent storage for WiFi related settings.
 * Setters change the in-memory copy; {@link #save()} persists it.
 */
public interface IWifiConfigStore {

    /**
     * @return the hotspot override, or null when the compiled default applies
     */
    HotspotConfig getHotspotConfig();

    void setHotspotConfig(HotspotConfig config);

    /**
     * @return the recorded fallback network, or null
     */
    FallbackNetwork getFallbackNetwork();

    /**
     * @param network the network to record, or null to clear the record
     */
    void setFallbackNetwork(FallbackNetwork network);

    /**
     * @return whether onboarding finished, or null when unknown
     */
    Boolean isOnboardingCompleted();

    void save() throws IOException;
}
