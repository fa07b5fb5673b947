package com.papertrail.wifi_client.reporting.providers;

import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.reporting.core.IReportProvider;
import com.papertrail.wifi_client.reporting.core.ReportData;
import com.papertrail.wifi_client.reporting.core.ReportLevel;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Report provider that writes reports to the application log.
 */
public class ConsoleReportProvider implements IReportProvider {

    private static final String TAG = "ConsoleReportProvider";

    private final Logger logger;
    private volatile boolean isEnabled = true;
    private volatile boolean isInitialized = false;

    public ConsoleReportProvider(Logger logger) {
        this.logger = logger;
    }

    @Override
    public boolean initialize() {
        isInitialized = true;
        logger.debug(TAG, "Console report provider initialized");
        return true;
    }

    @Override
    public void report(ReportData reportData) {
        if (!isEnabled()) return;

        String line = format(reportData);
        switch (reportData.getLevel()) {
            case DEBUG:
                logger.debug(TAG, line);
                break;
            case INFO:
                logger.info(TAG, line);
                break;
            case WARNING:
                logger.warn(TAG, line);
                break;
            case ERROR:
            case CRITICAL:
                if (reportData.getException() != null) {
                    logger.error(TAG, line, reportData.getException());
                } else {
                    logger.error(TAG, line);
                }
                break;
        }
    }

    @Override
    public void addBreadcrumb(String message, String category, ReportLevel level) {
        if (!isEnabled()) return;
        logger.debug(TAG, "Breadcrumb [" + category + "] [" + level.getName() + "]: " + message);
    }

    @Override
    public boolean isEnabled() {
        return isEnabled && isInitialized;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.isEnabled = enabled;
    }

    @Override
    public String getProviderName() {
        return "Console";
    }

    static String format(ReportData reportData) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(Instant.ofEpochMilli(reportData.getTimestamp())).append("] ");
        sb.append('[').append(reportData.getLevel().getName().toUpperCase()).append("] ");
        sb.append('[').append(reportData.getCategory()).append("] ");
        if (!reportData.getOperation().isEmpty()) {
            sb.append('[').append(reportData.getOperation()).append("] ");
        }
        sb.append(reportData.getMessage());
        if (!reportData.getTags().isEmpty()) {
            sb.append(" | Tags: ").append(new TreeMap<>(reportData.getTags()));
        }
        Map<String, Object> context = reportData.getContext();
        if (!context.isEmpty()) {
            sb.append(" | Context: ").append(new TreeMap<>(context));
        }
        return sb.toString();
    }
}
