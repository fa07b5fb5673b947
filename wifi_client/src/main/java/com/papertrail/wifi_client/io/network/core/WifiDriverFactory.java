package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.ICommandExecutor;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.logging.Logger;

import java.util.Locale;

/**
 * Factory class that creates the appropriate WiFi driver for the current host.
 */
public class WifiDriverFactory {
    private static final String TAG = "WifiDriverFactory";

    static final long SIMULATED_ACTIVATION_DELAY_MS = 1000;

    private WifiDriverFactory() {
    }

    /**
     * Get the driver for this host
     * @param config WiFi configuration, {@code wifi.mock} forces the simulated driver
     * @param executor command runner used by the nmcli driver
     * @param logger logger handed to the driver
     * @return the nmcli driver on Linux, the simulated driver otherwise
     */
    public static IWifiDriver createDriver(WifiConfig config, ICommandExecutor executor, Logger logger) {
        return createDriver(config, executor, System.getProperty("os.name", ""), logger);
    }

    static IWifiDriver createDriver(WifiConfig config, ICommandExecutor executor, String osName, Logger logger) {
        if (config.isMockDriver()) {
            logger.info(TAG, "Simulated driver forced by configuration");
            return new SimulatedWifiDriver(config, SIMULATED_ACTIVATION_DELAY_MS, logger);
        }
        if (!isLinux(osName)) {
            logger.warn(TAG, "Host OS \"" + osName + "\" has no NetworkManager, using simulated driver");
            return new SimulatedWifiDriver(config, SIMULATED_ACTIVATION_DELAY_MS, logger);
        }
        logger.info(TAG, "Linux host detected, using NmcliWifiDriver");
        return new NmcliWifiDriver(executor, config, logger);
    }

    static boolean isLinux(String osName) {
        return osName != null && osName.toLowerCase(Locale.ROOT).startsWith("linux");
    }
}
