package com.papertrail.wifi_client.settings;

import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolves WiFi configuration from layered sources.
 *
 * Priority per key:
 * 1. Environment variable (WIFI_PRIMARY_SSID for wifi.primary_ssid)
 * 2. Properties file on the class path
 * 3. Builder default
 */
public class WifiConfigLoader {

    private static final String TAG = "WifiConfigLoader";

    public static final String DEFAULT_PROPERTIES_FILE = "wifi_client.properties";
    public static final String DEFAULT_SETTINGS_FILE = "/var/lib/papertrail/wifi_settings.json";

    static final String KEY_ENABLED = "wifi.enabled";
    static final String KEY_PRIMARY_SSID = "wifi.primary_ssid";
    static final String KEY_PRIMARY_PASSWORD = "wifi.primary_password";
    static final String KEY_INTERFACE = "wifi.interface";
    static final String KEY_USE_SUDO = "wifi.use_sudo";
    static final String KEY_MOCK = "wifi.mock";
    static final String KEY_SCAN_INTERVAL_MS = "wifi.scan_interval_ms";
    static final String KEY_CONNECTION_TIMEOUT_MS = "wifi.connection_timeout_ms";
    static final String KEY_HOTSPOT_CONNECTION_TIMEOUT_MS = "wifi.hotspot_connection_timeout_ms";
    static final String KEY_SETTLE_DELAY_MS = "wifi.settle_delay_ms";
    static final String KEY_VERIFY_RETRY_DELAY_MS = "wifi.verify_retry_delay_ms";
    static final String KEY_DEBOUNCE_DELAY_MS = "wifi.debounce_delay_ms";
    static final String KEY_GRACE_PERIOD_MS = "wifi.grace_period_ms";
    static final String KEY_POLL_INTERVAL_MS = "wifi.poll_interval_ms";
    static final String KEY_MONITOR_INTERVAL_MS = "wifi.monitor_interval_ms";
    static final String KEY_COMMAND_TIMEOUT_MS = "wifi.command_timeout_ms";
    static final String KEY_SETTINGS_FILE = "wifi.settings_file";

    private final Logger logger;
    private final Function<String, String> environment;
    private final Properties properties;

    public WifiConfigLoader(Logger logger) {
        this(logger, System::getenv, DEFAULT_PROPERTIES_FILE);
    }

    public WifiConfigLoader(Logger logger, Function<String, String> environment, String propertiesFile) {
        this.logger = logger;
        this.environment = environment;
        this.properties = loadProperties(propertiesFile);
    }

    /**
     * Build the effective configuration
     */
    public WifiConfig load() {
        WifiConfig.Builder builder = new WifiConfig.Builder();

        String ssid = getString(KEY_PRIMARY_SSID);
        if (ssid != null) builder.primarySsid(ssid);
        String password = getString(KEY_PRIMARY_PASSWORD);
        if (password != null) builder.primaryPassword(password);
        String iface = getString(KEY_INTERFACE);
        if (iface != null) builder.interfaceName(iface);

        Boolean enabled = getBoolean(KEY_ENABLED);
        if (enabled != null) builder.enabled(enabled);
        Boolean useSudo = getBoolean(KEY_USE_SUDO);
        if (useSudo != null) builder.useSudo(useSudo);
        Boolean mock = getBoolean(KEY_MOCK);
        if (mock != null) builder.mockDriver(mock);

        Long value;
        if ((value = getLong(KEY_SCAN_INTERVAL_MS)) != null) builder.scanIntervalMs(value);
        if ((value = getLong(KEY_CONNECTION_TIMEOUT_MS)) != null) builder.connectionTimeoutMs(value);
        if ((value = getLong(KEY_HOTSPOT_CONNECTION_TIMEOUT_MS)) != null) builder.hotspotConnectionTimeoutMs(value);
        if ((value = getLong(KEY_SETTLE_DELAY_MS)) != null) builder.settleDelayMs(value);
        if ((value = getLong(KEY_VERIFY_RETRY_DELAY_MS)) != null) builder.verifyRetryDelayMs(value);
        if ((value = getLong(KEY_DEBOUNCE_DELAY_MS)) != null) builder.debounceDelayMs(value);
        if ((value = getLong(KEY_GRACE_PERIOD_MS)) != null) builder.gracePeriodMs(value);
        if ((value = getInterval(KEY_POLL_INTERVAL_MS)) != null) builder.pollIntervalMs(value);
        if ((value = getInterval(KEY_MONITOR_INTERVAL_MS)) != null) builder.monitorIntervalMs(value);
        if ((value = getLong(KEY_COMMAND_TIMEOUT_MS)) != null) builder.commandTimeoutMs(value);

        WifiConfig config = builder.build();
        logger.info(TAG, "Loaded " + config);
        return config;
    }

    /**
     * Location of the persisted WiFi settings file
     */
    public Path getSettingsPath() {
        String path = getString(KEY_SETTINGS_FILE);
        return Paths.get(path != null ? path : DEFAULT_SETTINGS_FILE);
    }

    static String toEnvName(String key) {
        return key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private String getString(String key) {
        String env = environment.apply(toEnvName(key));
        if (env != null && !env.trim().isEmpty()) {
            return env.trim();
        }
        String prop = properties.getProperty(key);
        if (prop != null && !prop.trim().isEmpty()) {
            return prop.trim();
        }
        return null;
    }

    private Boolean getBoolean(String key) {
        String raw = getString(key);
        return raw != null ? Boolean.parseBoolean(raw) : null;
    }

    private Long getLong(String key) {
        String raw = getString(key);
        if (raw == null) {
            return null;
        }
        try {
            long parsed = Long.parseLong(raw);
            if (parsed < 0) {
                logger.warn(TAG, "Negative value for " + key + ": " + raw + ", using default");
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn(TAG, "Invalid number for " + key + ": " + raw + ", using default");
            return null;
        }
    }

    // timer periods must be positive
    private Long getInterval(String key) {
        Long value = getLong(key);
        if (value != null && value == 0) {
            logger.warn(TAG, "Zero interval for " + key + ", using default");
            return null;
        }
        return value;
    }

    private Properties loadProperties(String fileName) {
        Properties loaded = new Properties();
        if (fileName == null) {
            return loaded;
        }
        try (InputStream input = WifiConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (input != null) {
                loaded.load(input);
                logger.info(TAG, "Successfully loaded properties from: " + fileName);
            } else {
                logger.debug(TAG, "Properties file not found: " + fileName);
            }
        } catch (IOException e) {
            logger.warn(TAG, "Error loading properties from " + fileName + ": " + e.getMessage());
        }
        return loaded;
    }
}
