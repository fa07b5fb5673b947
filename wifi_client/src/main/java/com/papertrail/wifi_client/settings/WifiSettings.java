package com.papertrail.wifi_client.settings;

import com.papertrail.wifi_client.io.network.interfaces.IWifiConfigStore;
import com.papertrail.wifi_client.io.network.models.FallbackNetwork;
import com.papertrail.wifi_client.io.network.models.HotspotConfig;
import com.papertrail.wifi_client.logging.Logger;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Settings manager for the WiFi client.
 * Keeps hotspot override, fallback network and onboarding flag in a JSON file.
 */
public class WifiSettings implements IWifiConfigStore {
    private static final String TAG = "WifiSettings";

    private static final String KEY_HOTSPOT = "hotspot";
    private static final String KEY_FALLBACK_NETWORK = "fallbackNetwork";
    private static final String KEY_ONBOARDING_COMPLETED = "onboardingCompleted";

    private final Path file;
    private final Logger logger;

    private HotspotConfig hotspotConfig;
    private FallbackNetwork fallbackNetwork;
    private Boolean onboardingCompleted;

    public WifiSettings(Path file, Logger logger) {
        this.file = file;
        this.logger = logger;
        load();
        logger.debug(TAG, "WifiSettings initialized from " + file);
    }

    @Override
    public synchronized HotspotConfig getHotspotConfig() {
        return hotspotConfig;
    }

    @Override
    public synchronized void setHotspotConfig(HotspotConfig config) {
        logger.debug(TAG, "Setting hotspot config to: " + config);
        this.hotspotConfig = config;
    }

    @Override
    public synchronized FallbackNetwork getFallbackNetwork() {
        return fallbackNetwork;
    }

    @Override
    public synchronized void setFallbackNetwork(FallbackNetwork network) {
        logger.debug(TAG, "Setting fallback network to: " + network);
        this.fallbackNetwork = network;
    }

    @Override
    public synchronized Boolean isOnboardingCompleted() {
        return onboardingCompleted;
    }

    public synchronized void setOnboardingCompleted(boolean completed) {
        logger.debug(TAG, "Onboarding completed: " + completed);
        this.onboardingCompleted = completed;
    }

    /**
     * Write to a temp file next to the target, then move it over the target.
     */
    @Override
    public synchronized void save() throws IOException {
        JSONObject json = new JSONObject();
        try {
            if (hotspotConfig != null) {
                json.put(KEY_HOTSPOT, hotspotConfig.toJson());
            }
            if (fallbackNetwork != null) {
                json.put(KEY_FALLBACK_NETWORK, fallbackNetwork.toJson());
            }
            if (onboardingCompleted != null) {
                json.put(KEY_ONBOARDING_COMPLETED, onboardingCompleted.booleanValue());
            }
        } catch (JSONException e) {
            throw new IOException("Failed to serialize WiFi settings", e);
        }

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(temp, json.toString(2).getBytes(StandardCharsets.UTF_8));
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug(TAG, "WiFi settings saved to " + file);
    }

    private void load() {
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            logger.info(TAG, "No settings file at " + file + ", starting empty");
            return;
        } catch (IOException e) {
            logger.warn(TAG, "Could not read settings file " + file + ": " + e.getMessage());
            return;
        }

        try {
            JSONObject json = new JSONObject(content);
            hotspotConfig = HotspotConfig.fromJson(json.optJSONObject(KEY_HOTSPOT));
            fallbackNetwork = FallbackNetwork.fromJson(json.optJSONObject(KEY_FALLBACK_NETWORK));
            onboardingCompleted = json.has(KEY_ONBOARDING_COMPLETED)
                    ? json.optBoolean(KEY_ONBOARDING_COMPLETED, true)
                    : null;
        } catch (JSONException e) {
            logger.warn(TAG, "Corrupt settings file " + file + ", starting empty: " + e.getMessage());
            hotspotConfig = null;
            fallbackNetwork = null;
            onboardingCompleted = null;
        }
    }
}
