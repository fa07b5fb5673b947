package com.papertrail.wifi_client.service.core;

import com.papertrail.wifi_client.io.network.core.ProcessCommandExecutor;
import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.io.network.core.WifiDriverFactory;
import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.io.network.core.WifiService;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.interfaces.IWifiService;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.logging.LoggerFactory;
import com.papertrail.wifi_client.reporting.config.SentryConfig;
import com.papertrail.wifi_client.reporting.core.ReportManager;
import com.papertrail.wifi_client.reporting.providers.ConsoleReportProvider;
import com.papertrail.wifi_client.reporting.providers.SentryReportProvider;
import com.papertrail.wifi_client.settings.WifiConfigLoader;
import com.papertrail.wifi_client.settings.WifiSettings;

import org.greenrobot.eventbus.EventBus;

import java.time.Clock;

/**
 * Dependency injection container for the WiFi client.
 * Follows Dependency Inversion Principle by handing out components through their interfaces.
 */
public class ServiceContainer {
    private static final String TAG = "ServiceContainer";

    private final Logger logger;
    private final WifiConfig config;
    private final WifiSettings settings;
    private final ProcessCommandExecutor commandExecutor;
    private final IWifiDriver driver;
    private final EventBus eventBus;
    private final IWifiService wifiService;

    public ServiceContainer() {
        this.logger = LoggerFactory.createLogger();

        WifiConfigLoader configLoader = new WifiConfigLoader(logger);
        this.config = configLoader.load();
        this.settings = new WifiSettings(configLoader.getSettingsPath(), logger);

        this.commandExecutor = new ProcessCommandExecutor(logger);
        this.driver = WifiDriverFactory.createDriver(config, commandExecutor, logger);
        this.eventBus = EventBus.builder()
                .logNoSubscriberMessages(false)
                .sendNoSubscriberEvent(false)
                .build();

        this.wifiService = new WifiService(driver, settings, config, eventBus, Clock.systemUTC(), logger);
    }

    public Logger getLogger() {
        return logger;
    }

    public WifiConfig getConfig() {
        return config;
    }

    public WifiSettings getSettings() {
        return settings;
    }

    public IWifiDriver getDriver() {
        return driver;
    }

    /**
     * Get the event bus carrying WiFi state and connection events
     */
    public EventBus getEventBus() {
        return eventBus;
    }

    public IWifiService getWifiService() {
        return wifiService;
    }

    /**
     * Initialize reporting, then the WiFi service unless it is disabled in configuration
     */
    public void initialize() throws WifiException {
        logger.debug(TAG, "Initializing service container");
        initializeReporting();

        if (!config.isEnabled()) {
            logger.warn(TAG, "WiFi management disabled by configuration, not starting");
            return;
        }
        wifiService.initialize();

        logger.debug(TAG, "Service container initialized successfully");
    }

    private void initializeReporting() {
        ReportManager reportManager = ReportManager.getInstance();
        reportManager.addProvider(new ConsoleReportProvider(logger));

        SentryConfig sentryConfig = new SentryConfig(logger);
        sentryConfig.logConfigurationStatus();
        if (sentryConfig.isValidConfiguration()) {
            reportManager.addProvider(new SentryReportProvider(sentryConfig, logger));
        }
    }

    /**
     * Clean up all components
     */
    public void cleanup() {
        logger.debug(TAG, "Cleaning up service container");

        wifiService.dispose();
        ReportManager.getInstance().shutdown();
        commandExecutor.shutdown();

        logger.debug(TAG, "Service container cleanup completed");
    }
}
