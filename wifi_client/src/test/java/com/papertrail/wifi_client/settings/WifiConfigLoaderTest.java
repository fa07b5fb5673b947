package com.papertrail.wifi_client.settings;

import com.papertrail.wifi_client.io.network.core.WifiConfig;
import com.papertrail.wifi_client.logging.LoggerFactory;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

@RunWith(org.junit.runners.JUnit4.class)
public class WifiConfigLoaderTest {

    private static final String TEST_PROPERTIES = "wifi_client_test.properties";

    private final Map<String, String> env = new HashMap<>();

    private WifiConfigLoader loader(String propertiesFile) {
        return new WifiConfigLoader(LoggerFactory.createLogger(), env::get, propertiesFile);
    }

    @Test
    public void testDefaultsWithoutAnySource() {
        WifiConfig config = loader("does_not_exist.properties").load();

        Assert.assertTrue(config.isEnabled());
        Assert.assertEquals(WifiConfig.DEFAULT_PRIMARY_SSID, config.getPrimarySsid());
        Assert.assertEquals(WifiConfig.DEFAULT_PRIMARY_PASSWORD, config.getPrimaryPassword());
        Assert.assertEquals("wlan0", config.getInterfaceName());
        Assert.assertEquals(10000, config.getPollIntervalMs());
        Assert.assertEquals(60000, config.getHotspotConnectionTimeoutMs());
        Assert.assertFalse(config.isMockDriver());
        Assert.assertEquals(Paths.get(WifiConfigLoader.DEFAULT_SETTINGS_FILE),
                loader("does_not_exist.properties").getSettingsPath());
    }

    @Test
    public void testPropertiesFileOverridesDefaults() {
        WifiConfigLoader loader = loader(TEST_PROPERTIES);
        WifiConfig config = loader.load();

        Assert.assertEquals("Props-AP", config.getPrimarySsid());
        Assert.assertEquals("props-pass", config.getPrimaryPassword());
        Assert.assertEquals("wlan9", config.getInterfaceName());
        Assert.assertFalse(config.isUseSudo());
        Assert.assertEquals(2500, config.getPollIntervalMs());
        Assert.assertEquals(Paths.get("/tmp/papertrail/test_settings.json"), loader.getSettingsPath());
    }

    @Test
    public void testInvalidNumbersFallBackToDefaults() {
        WifiConfig config = loader(TEST_PROPERTIES).load();

        Assert.assertEquals(5000, config.getDebounceDelayMs());
        Assert.assertEquals(5000, config.getGracePeriodMs());
        Assert.assertEquals(5000, config.getMonitorIntervalMs());
    }

    @Test
    public void testEnvironmentWinsOverProperties() {
        env.put("WIFI_PRIMARY_SSID", "Env-AP");
        env.put("WIFI_POLL_INTERVAL_MS", "7000");
        env.put("WIFI_ENABLED", "false");
        env.put("WIFI_INTERFACE", "   ");

        WifiConfig config = loader(TEST_PROPERTIES).load();

        Assert.assertEquals("Env-AP", config.getPrimarySsid());
        Assert.assertEquals(7000, config.getPollIntervalMs());
        Assert.assertFalse(config.isEnabled());
        Assert.assertEquals("wlan9", config.getInterfaceName());
    }

    @Test
    public void testMockDriverSwitch() {
        Assert.assertFalse(loader(TEST_PROPERTIES).load().isMockDriver());

        env.put("WIFI_MOCK", "true");

        Assert.assertTrue(loader(TEST_PROPERTIES).load().isMockDriver());
    }

    @Test
    public void testEnvironmentNames() {
        Assert.assertEquals("WIFI_PRIMARY_SSID", WifiConfigLoader.toEnvName("wifi.primary_ssid"));
        Assert.assertEquals("WIFI_HOTSPOT_CONNECTION_TIMEOUT_MS",
                WifiConfigLoader.toEnvName("wifi.hotspot_connection_timeout_ms"));
    }
}
