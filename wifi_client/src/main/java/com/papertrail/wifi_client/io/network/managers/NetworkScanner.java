package com.papertrail.wifi_client.io.network.managers;

import com.papertrail.wifi_client.io.network.core.DriverException;
import com.papertrail.wifi_client.io.network.core.TerseOutputParser;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.models.WifiNetwork;
import com.papertrail.wifi_client.io.network.models.WifiSecurity;
import com.papertrail.wifi_client.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Answers what is visible and how strong it is.
 * Scanning never disconnects from the current network.
 */
public class NetworkScanner {
    private static final String TAG = "NetworkScanner";

    private static final int FIELD_SSID = 0;
    private static final int FIELD_SIGNAL = 1;
    private static final int FIELD_SECURITY = 2;
    private static final int FIELD_FREQUENCY = 3;

    private final IWifiDriver driver;
    private final BooleanSupplier initialized;
    private final Logger logger;

    public NetworkScanner(IWifiDriver driver, BooleanSupplier initialized, Logger logger) {
        this.driver = driver;
        this.initialized = initialized;
        this.logger = logger;
    }

    /**
     * Trigger a fresh scan and return every visible, non-hidden network.
     *
     * @throws WifiException NOT_INITIALIZED, or SCAN_FAILED when the driver invocation fails
     */
    public List<WifiNetwork> scanNetworks() throws WifiException {
        if (!initialized.getAsBoolean()) {
            throw WifiException.notInitialized();
        }

        List<String> lines;
        try {
            lines = driver.rescanAndList();
        } catch (DriverException e) {
            logger.error(TAG, "Failed to scan networks", e);
            throw WifiException.scanFailed(e);
        }

        List<WifiNetwork> networks = new ArrayList<>();
        for (String line : lines) {
            WifiNetwork network = parseNetwork(line);
            if (network != null) {
                networks.add(network);
            }
        }
        logger.info(TAG, "📶 Scan found " + networks.size() + " networks");
        for (WifiNetwork network : networks) {
            logger.debug(TAG, "  - " + network);
        }
        return networks;
    }

    /**
     * Rescan and check for an exact, case-sensitive SSID match.
     * A driver failure reads as "not visible".
     */
    public boolean isNetworkVisible(String ssid) {
        if (ssid == null || ssid.isEmpty()) {
            return false;
        }
        try {
            for (String line : driver.rescanAndListSsids()) {
                String listed = line.trim();
                if (listed.equals(ssid) || TerseOutputParser.unescape(listed).equals(ssid)) {
                    logger.debug(TAG, "Network \"" + ssid + "\" is visible");
                    return true;
                }
            }
            logger.debug(TAG, "Network \"" + ssid + "\" is NOT visible");
            return false;
        } catch (DriverException e) {
            logger.warn(TAG, "Visibility check for \"" + ssid + "\" failed, assuming not visible: " + e.getMessage());
            return false;
        }
    }

    /**
     * @return signal percentage of the SSID, or 0 when absent, unparsable or the scan fails
     */
    public int getSignalStrength(String ssid) {
        try {
            for (String line : driver.rescanAndList()) {
                List<String> fields = TerseOutputParser.splitFields(line);
                if (fields.size() > FIELD_SIGNAL && fields.get(FIELD_SSID).equals(ssid)) {
                    return clampPercent(TerseOutputParser.parseIntOrZero(fields.get(FIELD_SIGNAL)));
                }
            }
        } catch (DriverException e) {
            logger.debug(TAG, "Could not get signal strength for \"" + ssid + "\" - defaulting to 0");
        }
        return 0;
    }

    private WifiNetwork parseNetwork(String line) {
        List<String> fields = TerseOutputParser.splitFields(line);
        String ssid = fields.get(FIELD_SSID);
        if (ssid.isEmpty()) {
            // hidden network
            return null;
        }
        int signal = fields.size() > FIELD_SIGNAL ? TerseOutputParser.parseIntOrZero(fields.get(FIELD_SIGNAL)) : 0;
        String security = fields.size() > FIELD_SECURITY ? fields.get(FIELD_SECURITY) : "";
        int frequency = fields.size() > FIELD_FREQUENCY ? parseFrequency(fields.get(FIELD_FREQUENCY)) : 0;
        return new WifiNetwork(ssid, clampPercent(signal), parseSecurity(security), frequency);
    }

    /**
     * Normalize the driver's security label by substring priority.
     */
    static WifiSecurity parseSecurity(String security) {
        if (security == null || security.trim().isEmpty() || "--".equals(security.trim())) {
            return WifiSecurity.OPEN;
        }
        if (security.contains("WPA3")) return WifiSecurity.WPA3;
        if (security.contains("WPA2")) return WifiSecurity.WPA2;
        if (security.contains("WPA")) return WifiSecurity.WPA;
        if (security.contains("WEP")) return WifiSecurity.WEP;
        return WifiSecurity.UNKNOWN;
    }

    // nmcli prints "2437 MHz" unless told otherwise
    private static int parseFrequency(String raw) {
        String digits = raw.trim();
        int space = digits.indexOf(' ');
        if (space > 0) {
            digits = digits.substring(0, space);
        }
        return TerseOutputParser.parseIntOrZero(digits);
    }

    private static int clampPercent(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
