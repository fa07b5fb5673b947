package com.papertrail.wifi_client.reporting.domains;

import com.papertrail.wifi_client.io.network.models.WifiState;
import com.papertrail.wifi_client.reporting.core.ReportData;
import com.papertrail.wifi_client.reporting.core.ReportLevel;
import com.papertrail.wifi_client.reporting.core.ReportManager;

/**
 * WiFi reporting methods
 * Follows Single Responsibility Principle - only handles WiFi reporting
 */
public class WifiReporting {

    private static final String CATEGORY = "wifi";

    /**
     * Record a state transition as a breadcrumb for later reports
     */
    public static void reportStateTransition(WifiState previousState, WifiState state) {
        ReportManager.getInstance().addBreadcrumb(
                "WiFi state " + previousState + " -> " + state, CATEGORY + ".state", ReportLevel.INFO);
    }

    public static void reportAuthFailed(String ssid) {
        ReportManager.getInstance().report(
            new ReportData.Builder()
                .message("WiFi authentication rejected")
                .level(ReportLevel.WARNING)
                .category(CATEGORY + ".connection")
                .operation("connect")
                .tag("ssid", ssid)
        );
    }

    public static void reportHotspotTimeout(String ssid, long timeoutMs, boolean fallbackRestored) {
        ReportManager.getInstance().report(
            new ReportData.Builder()
                .message("Hotspot connection timed out after " + timeoutMs + "ms")
                .level(fallbackRestored ? ReportLevel.WARNING : ReportLevel.ERROR)
                .category(CATEGORY + ".hotspot")
                .operation("attempt_hotspot")
                .tag("ssid", ssid)
                .tag("fallback_restored", fallbackRestored)
                .context("timeout_ms", timeoutMs)
        );
    }

    public static void reportFallbackReconnectFailed(String ssid, Throwable error) {
        ReportManager.getInstance().report(
            new ReportData.Builder()
                .message("Fallback network reconnect failed")
                .level(ReportLevel.ERROR)
                .category(CATEGORY + ".hotspot")
                .operation("reconnect_fallback")
                .tag("ssid", ssid)
                .exception(error)
        );
    }

    public static void reportBackgroundTaskFailed(String task, Throwable error) {
        ReportManager.getInstance().report(
            new ReportData.Builder()
                .message("WiFi background task failed: " + task)
                .level(ReportLevel.ERROR)
                .category(CATEGORY + ".background")
                .operation(task)
                .exception(error)
        );
    }

    public static void reportServiceEvent(String event) {
        ReportManager.getInstance().report(
            new ReportData.Builder()
                .message("WiFi service - " + event)
                .level(ReportLevel.INFO)
                .category("service.lifecycle")
                .operation(event)
                .tag("service_name", "WifiService")
        );
    }
}
