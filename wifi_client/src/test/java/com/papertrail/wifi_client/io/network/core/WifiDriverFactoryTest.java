package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.ICommandExecutor;
import com.papertrail.wifi_client.logging.Logger;
import com.papertrail.wifi_client.logging.LoggerFactory;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;

import static org.mockito.Mockito.mock;

@RunWith(org.junit.runners.JUnit4.class)
public class WifiDriverFactoryTest {

    private final ICommandExecutor executor = mock(ICommandExecutor.class);
    private final Logger logger = LoggerFactory.createLogger();

    @Test
    public void testLinuxUsesNmcli() {
        Assert.assertTrue(WifiDriverFactory.createDriver(WifiConfig.defaults(), executor, "Linux", logger)
                instanceof NmcliWifiDriver);
    }

    @Test
    public void testOtherHostsUseSimulatedDriver() {
        Assert.assertTrue(WifiDriverFactory.createDriver(WifiConfig.defaults(), executor, "Mac OS X", logger)
                instanceof SimulatedWifiDriver);
        Assert.assertTrue(WifiDriverFactory.createDriver(WifiConfig.defaults(), executor, "Windows 11", logger)
                instanceof SimulatedWifiDriver);
    }

    @Test
    public void testConfigurationForcesSimulatedDriverOnLinux() {
        WifiConfig config = new WifiConfig.Builder().mockDriver(true).build();

        Assert.assertTrue(WifiDriverFactory.createDriver(config, executor, "Linux", logger)
                instanceof SimulatedWifiDriver);
    }

    @Test
    public void testLinuxDetection() {
        Assert.assertTrue(WifiDriverFactory.isLinux("linux"));
        Assert.assertFalse(WifiDriverFactory.isLinux("FreeBSD"));
        Assert.assertFalse(WifiDriverFactory.isLinux(null));
    }
}
