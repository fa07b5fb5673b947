package com.papertrail.wifi_client.reporting.core;

import com.papertrail.wifi_client.io.network.core.NamedThreadFactory;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.logging.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fans reports out to every registered provider.
 * Follows Dependency Inversion Principle - depends on abstractions, not concretions
 */
public class ReportManager {

    private static final String TAG = "ReportManager";
    private static ReportManager instance;

    private final List<IReportProvider> providers = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;
    private final Logger logger;

    ReportManager(Logger logger) {
        this.logger = logger;
        this.executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("report-dispatch"));
    }

    /**
     * Get singleton instance
     */
    public static synchronized ReportManager getInstance() {
        if (instance == null) {
            instance = new ReportManager(LoggerFactory.createLogger());
        }
        return instance;
    }

    public void addProvider(IReportProvider provider) {
        if (provider == null) {
            logger.warn(TAG, "Cannot add null provider");
            return;
        }

        try {
            if (provider.initialize()) {
                providers.add(provider);
                logger.info(TAG, "Provider added: " + provider.getProviderName());
            } else {
                logger.warn(TAG, "Provider not initialized, skipping: " + provider.getProviderName());
            }
        } catch (Exception e) {
            logger.error(TAG, "Error adding provider: " + provider.getProviderName(), e);
        }
    }

    public void removeProvider(String providerName) {
        providers.removeIf(provider -> {
            if (provider.getProviderName().equals(providerName)) {
                logger.info(TAG, "Provider removed: " + providerName);
                provider.close();
                return true;
            }
            return false;
        });
    }

    /**
     * Report data to all enabled providers asynchronously.
     * Sensitive values are filtered once here for every provider.
     */
    public void report(ReportData reportData) {
        if (reportData == null) {
            logger.warn(TAG, "Cannot report null data");
            return;
        }
        if (providers.isEmpty()) {
            return;
        }

        ReportData filtered = DataFilter.filterReportData(reportData);
        try {
            executor.execute(() -> {
                for (IReportProvider provider : providers) {
                    if (provider.isEnabled()) {
                        try {
                            provider.report(filtered);
                        } catch (Exception e) {
                            logger.error(TAG, "Error reporting to " + provider.getProviderName(), e);
                        }
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn(TAG, "Report dropped after shutdown: " + filtered.getMessage());
        }
    }

    /**
     * Convenience method for reporting with builder pattern
     */
    public void report(ReportData.Builder builder) {
        report(builder.build());
    }

    public void addBreadcrumb(String message, String category, ReportLevel level) {
        for (IReportProvider provider : providers) {
            if (provider.isEnabled()) {
                try {
                    provider.addBreadcrumb(DataFilter.filterSensitiveText(message), category, level);
                } catch (Exception e) {
                    logger.error(TAG, "Error adding breadcrumb to " + provider.getProviderName(), e);
                }
            }
        }
    }

    public List<String> getProviderNames() {
        List<String> names = new ArrayList<>();
        for (IReportProvider provider : providers) {
            names.add(provider.getProviderName());
        }
        return names;
    }

    /**
     * Drain queued reports, then close every provider
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (IReportProvider provider : providers) {
            provider.close();
        }
        logger.info(TAG, "Report manager shutdown");
    }
}
