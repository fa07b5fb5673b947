package com.papertrail.wifi_client.reporting.config;

import com.papertrail.wifi_client.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.function.Function;

/**
 * Sentry configuration resolved from layered sources.
 *
 * Priority: environment variable, then sentry.properties on the class path, then defaults.
 * Defaults are safe for open source: disabled, no DSN.
 */
public class SentryConfig {

    private static final String TAG = "SentryConfig";

    private static final String KEY_SENTRY_DSN = "sentry.dsn";
    private static final String KEY_SENTRY_ENABLED = "sentry.enabled";
    private static final String KEY_SENTRY_SAMPLE_RATE = "sentry.sample_rate";
    private static final String KEY_SENTRY_ENVIRONMENT = "sentry.environment";
    private static final String KEY_SENTRY_RELEASE = "sentry.release";

    private static final String ENV_SENTRY_DSN = "SENTRY_DSN";
    private static final String ENV_SENTRY_ENABLED = "SENTRY_ENABLED";
    private static final String ENV_SENTRY_SAMPLE_RATE = "SENTRY_SAMPLE_RATE";
    private static final String ENV_SENTRY_ENVIRONMENT = "SENTRY_ENVIRONMENT";
    private static final String ENV_SENTRY_RELEASE = "SENTRY_RELEASE";

    private static final boolean DEFAULT_ENABLED = false;
    private static final double DEFAULT_SAMPLE_RATE = 1.0;
    private static final String DEFAULT_ENVIRONMENT = "development";
    private static final String DEFAULT_RELEASE = "papertrail-wifi@1.0.0";

    public static final String DEFAULT_PROPERTIES_FILE = "sentry.properties";

    private final Logger logger;
    private final Function<String, String> environment;
    private final Properties properties;

    public SentryConfig(Logger logger) {
        this(logger, System::getenv, DEFAULT_PROPERTIES_FILE);
    }

    public SentryConfig(Logger logger, Function<String, String> environment, String propertiesFile) {
        this.logger = logger;
        this.environment = environment;
        this.properties = loadProperties(propertiesFile);
    }

    public String getSentryDsn() {
        return resolve(ENV_SENTRY_DSN, KEY_SENTRY_DSN, null);
    }

    public boolean isSentryEnabled() {
        String raw = resolve(ENV_SENTRY_ENABLED, KEY_SENTRY_ENABLED, null);
        return raw != null ? Boolean.parseBoolean(raw) : DEFAULT_ENABLED;
    }

    /**
     * @return sample rate clamped to [0, 1]
     */
    public double getSampleRate() {
        String raw = resolve(ENV_SENTRY_SAMPLE_RATE, KEY_SENTRY_SAMPLE_RATE, null);
        if (raw == null) {
            return DEFAULT_SAMPLE_RATE;
        }
        try {
            double rate = Double.parseDouble(raw);
            return Math.max(0.0, Math.min(1.0, rate));
        } catch (NumberFormatException e) {
            logger.warn(TAG, "Invalid Sentry sample rate: " + raw);
            return DEFAULT_SAMPLE_RATE;
        }
    }

    public String getEnvironment() {
        return resolve(ENV_SENTRY_ENVIRONMENT, KEY_SENTRY_ENVIRONMENT, DEFAULT_ENVIRONMENT);
    }

    public String getRelease() {
        return resolve(ENV_SENTRY_RELEASE, KEY_SENTRY_RELEASE, DEFAULT_RELEASE);
    }

    /**
     * Returns true if Sentry is enabled and has a plausible DSN
     */
    public boolean isValidConfiguration() {
        if (!isSentryEnabled()) {
            return false;
        }
        String dsn = getSentryDsn();
        return dsn != null && dsn.startsWith("https://") && dsn.contains("@");
    }

    public void logConfigurationStatus() {
        logger.info(TAG, "Sentry enabled: " + isSentryEnabled()
                + ", environment: " + getEnvironment()
                + ", release: " + getRelease()
                + ", sample rate: " + getSampleRate());
        if (isValidConfiguration()) {
            logger.info(TAG, "✓ Sentry configuration is valid and ready");
        } else if (isSentryEnabled()) {
            logger.warn(TAG, "✗ Sentry is enabled but DSN is not configured");
        } else {
            logger.debug(TAG, "Sentry is disabled");
        }
    }

    private String resolve(String envName, String key, String defaultValue) {
        String env = environment.apply(envName);
        if (env != null && !env.trim().isEmpty()) {
            return env.trim();
        }
        String prop = properties.getProperty(key);
        if (prop != null && !prop.trim().isEmpty()) {
            return prop.trim();
        }
        return defaultValue;
    }

    private Properties loadProperties(String fileName) {
        Properties loaded = new Properties();
        if (fileName == null) {
            return loaded;
        }
        try (InputStream input = SentryConfig.class.getClassLoader().getResourceAsStream(fileName)) {
            if (input != null) {
                loaded.load(input);
                logger.debug(TAG, "Loaded Sentry properties from: " + fileName);
            }
        } catch (IOException e) {
            logger.warn(TAG, "Error loading properties from " + fileName + ": " + e.getMessage());
        }
        return loaded;
    }
}
