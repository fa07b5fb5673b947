package com.papertrail.wifi_client.reporting.providers;

import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.config.SentryConfig;
import com.papertrail.wifi_client.reporting.core.IReportProvider;
import com.papertrail.wifi_client.reporting.core.ReportData;
import com.papertrail.wifi_client.reporting.core.ReportLevel;

import io.sentry.Breadcrumb;
import io.sentry.Sentry;
import io.sentry.SentryLevel;

import java.util.Map;

/**
 * Sentry implementation of the report provider
 * Follows Single Responsibility Principle - only handles Sentry-specific logic
 */
public class SentryReportProvider implements IReportProvider {

    private static final String TAG = "SentryReportProvider";

    private final SentryConfig config;
    private final Logger logger;
    private volatile boolean isEnabled = true;
    private volatile boolean isInitialized = false;

    public SentryReportProvider(SentryConfig config, Logger logger) {
        this.config = config;
        this.logger = logger;
    }

    @Override
    public boolean initialize() {
        if (isInitialized) {
            logger.warn(TAG, "Sentry already initialized");
            return true;
        }

        if (!config.isValidConfiguration()) {
            logger.info(TAG, "Sentry configuration is invalid or disabled - skipping initialization");
            config.logConfigurationStatus();
            return false;
        }

        try {
            String environment = config.getEnvironment();
            Sentry.init(options -> {
                options.setDsn(config.getSentryDsn());
                options.setEnvironment(environment);
                options.setRelease(config.getRelease());
                options.setSampleRate(config.getSampleRate());
                options.setDebug("development".equals(environment));
                options.setSendDefaultPii(false);
            });

            Sentry.setTag("os_name", System.getProperty("os.name", "unknown"));
            Sentry.setTag("os_arch", System.getProperty("os.arch", "unknown"));
            Sentry.setTag("java_version", System.getProperty("java.version", "unknown"));

            isInitialized = true;
            logger.info(TAG, "Sentry initialized successfully");
            config.logConfigurationStatus();
            return true;
        } catch (Exception e) {
            logger.error(TAG, "Failed to initialize Sentry", e);
            return false;
        }
    }

    @Override
    public void report(ReportData reportData) {
        if (!isEnabled()) {
            return;
        }

        try {
            Sentry.withScope(scope -> {
                scope.setLevel(convertLevel(reportData.getLevel()));
                scope.setTag("category", reportData.getCategory());
                if (!reportData.getOperation().isEmpty()) {
                    scope.setTag("operation", reportData.getOperation());
                }
                for (Map.Entry<String, Object> tag : reportData.getTags().entrySet()) {
                    scope.setTag(tag.getKey(), String.valueOf(tag.getValue()));
                }
                for (Map.Entry<String, Object> entry : reportData.getContext().entrySet()) {
                    scope.setExtra(entry.getKey(), String.valueOf(entry.getValue()));
                }

                if (reportData.getException() != null) {
                    Sentry.captureException(reportData.getException());
                } else {
                    Sentry.captureMessage(reportData.getMessage(), convertLevel(reportData.getLevel()));
                }
            });
            logger.debug(TAG, "Reported to Sentry: " + reportData.getMessage());
        } catch (Exception e) {
            logger.error(TAG, "Failed to report to Sentry", e);
        }
    }

    @Override
    public void addBreadcrumb(String message, String category, ReportLevel level) {
        if (!isEnabled()) return;

        try {
            Breadcrumb breadcrumb = new Breadcrumb();
            breadcrumb.setCategory(category);
            breadcrumb.setType("default");
            breadcrumb.setMessage(message);
            breadcrumb.setLevel(convertLevel(level));
            Sentry.addBreadcrumb(breadcrumb);
        } catch (Exception e) {
            logger.error(TAG, "Failed to add breadcrumb", e);
        }
    }

    @Override
    public boolean isEnabled() {
        return isEnabled && isInitialized;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.isEnabled = enabled;
        logger.info(TAG, "Sentry " + (enabled ? "enabled" : "disabled"));
    }

    @Override
    public String getProviderName() {
        return "Sentry";
    }

    @Override
    public void close() {
        if (isInitialized) {
            Sentry.close();
            isInitialized = false;
        }
    }

    private SentryLevel convertLevel(ReportLevel level) {
        switch (level) {
            case DEBUG: return SentryLevel.DEBUG;
            case WARNING: return SentryLevel.WARNING;
            case ERROR: return SentryLevel.ERROR;
            case CRITICAL: return SentryLevel.FATAL;
            case INFO:
            default: return SentryLevel.INFO;
        }
    }
}
