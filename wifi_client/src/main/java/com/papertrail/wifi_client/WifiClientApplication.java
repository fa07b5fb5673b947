package com.papertrail.wifi_client;

import com.papertrail.wifi_client.io.network.core.WifiException;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.service.core.ServiceContainer;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: starts the WiFi client and keeps it running until the JVM is asked to stop.
 */
public class WifiClientApplication {
    private static final String TAG = "WifiClientApplication";

    public static void main(String[] args) {
        ServiceContainer container = new ServiceContainer();
        Logger logger = container.getLogger();
        CountDownLatch shutdownLatch = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info(TAG, "Shutdown requested");
            container.cleanup();
            shutdownLatch.countDown();
        }, "wifi-shutdown"));

        try {
            container.initialize();
        } catch (WifiException e) {
            logger.error(TAG, "Failed to start WiFi client [" + e.getErrorCode().getCode() + "]", e);
            System.exit(1);
        }

        logger.info(TAG, "WiFi client running");
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn(TAG, "Main thread interrupted, exiting");
        }
    }
}
