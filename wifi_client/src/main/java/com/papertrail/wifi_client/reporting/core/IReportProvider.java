package com.papertrail.wifi_client.reporting.core;

/**
 * Contract for report sinks (error tracking services, console).
 */
public interface IReportProvider {

    /**
     * @return true if the provider is ready to accept reports
     */
    boolean initialize();

    void report(ReportData reportData);

    void addBreadcrumb(String message, String category, ReportLevel level);

    boolean isEnabled();

    void setEnabled(boolean enabled);

    String getProviderName();

    /**
     * Flush pending data and release resources
     */
    default void close() {
    }
}
