package com.papertrail.wifi_client.io.network.core;

/**
 * Immutable WiFi configuration.
 * Follows Single Responsibility Principle by handling only configuration.
 */
public class WifiConfig {
    public static final String DEFAULT_PRIMARY_SSID = "Papertrail-Setup";
    public static final String DEFAULT_PRIMARY_PASSWORD = "papertrail123";

    private final boolean enabled;
    private final String primarySsid;
    private final String primaryPassword;
    private final String interfaceName;
    private final boolean useSudo;
    private final boolean mockDriver;
    private final long scanIntervalMs;
    private final long connectionTimeoutMs;
    private final long hotspotConnectionTimeoutMs;
    private final long settleDelayMs;
    private final long verifyRetryDelayMs;
    private final long debounceDelayMs;
    private final long gracePeriodMs;
    private final long pollIntervalMs;
    private final long monitorIntervalMs;
    private final long commandTimeoutMs;

    private WifiConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.primarySsid = builder.primarySsid;
        this.primaryPassword = builder.primaryPassword;
        this.interfaceName = builder.interfaceName;
        this.useSudo = builder.useSudo;
        this.mockDriver = builder.mockDriver;
        this.scanIntervalMs = builder.scanIntervalMs;
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.hotspotConnectionTimeoutMs = builder.hotspotConnectionTimeoutMs;
        this.settleDelayMs = builder.settleDelayMs;
        this.verifyRetryDelayMs = builder.verifyRetryDelayMs;
        this.debounceDelayMs = builder.debounceDelayMs;
        this.gracePeriodMs = builder.gracePeriodMs;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.monitorIntervalMs = builder.monitorIntervalMs;
        this.commandTimeoutMs = builder.commandTimeoutMs;
    }

    public static WifiConfig defaults() {
        return new Builder().build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Compiled-in hotspot SSID used when no override is persisted. */
    public String getPrimarySsid() {
        return primarySsid;
    }

    public String getPrimaryPassword() {
        return primaryPassword;
    }

    public String getInterfaceName() {
        return interfaceName;
    }

    public boolean isUseSudo() {
        return useSudo;
    }

    /** Force the simulated driver even where nmcli exists. */
    public boolean isMockDriver() {
        return mockDriver;
    }

    public long getScanIntervalMs() {
        return scanIntervalMs;
    }

    /** Limit for a single profile activation. */
    public long getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    /** Limit for the whole connect step of a hotspot attempt. */
    public long getHotspotConnectionTimeoutMs() {
        return hotspotConnectionTimeoutMs;
    }

    public long getSettleDelayMs() {
        return settleDelayMs;
    }

    public long getVerifyRetryDelayMs() {
        return verifyRetryDelayMs;
    }

    public long getDebounceDelayMs() {
        return debounceDelayMs;
    }

    public long getGracePeriodMs() {
        return gracePeriodMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public long getMonitorIntervalMs() {
        return monitorIntervalMs;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    @Override
    public String toString() {
        return "WifiConfig{" +
                "enabled=" + enabled +
                ", primarySsid='" + primarySsid + '\'' +
                ", interfaceName='" + interfaceName + '\'' +
                ", useSudo=" + useSudo +
                ", mockDriver=" + mockDriver +
                ", connectionTimeoutMs=" + connectionTimeoutMs +
                ", hotspotConnectionTimeoutMs=" + hotspotConnectionTimeoutMs +
                ", pollIntervalMs=" + pollIntervalMs +
                ", monitorIntervalMs=" + monitorIntervalMs +
                '}';
    }

    /**
     * Builder for creating WifiConfig instances
     */
    public static class Builder {
        private boolean enabled = true;
        private String primarySsid = DEFAULT_PRIMARY_SSID;
        private String primaryPassword = DEFAULT_PRIMARY_PASSWORD;
        private String interfaceName = "wlan0";
        private boolean useSudo = true;
        private boolean mockDriver = false;
        private long scanIntervalMs = 30000;
        private long connectionTimeoutMs = 60000;
        private long hotspotConnectionTimeoutMs = 60000;
        private long settleDelayMs = 2000;
        private long verifyRetryDelayMs = 3000;
        private long debounceDelayMs = 5000;
        private long gracePeriodMs = 5000;
        private long pollIntervalMs = 10000;
        private long monitorIntervalMs = 5000;
        private long commandTimeoutMs = 90000;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder primarySsid(String primarySsid) {
            this.primarySsid = primarySsid;
            return this;
        }

        public Builder primaryPassword(String primaryPassword) {
            this.primaryPassword = primaryPassword;
            return this;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder useSudo(boolean useSudo) {
            this.useSudo = useSudo;
            return this;
        }

        public Builder scanIntervalMs(long scanIntervalMs) {
            this.scanIntervalMs = scanIntervalMs;
            return this;
        }

        public Builder connectionTimeoutMs(long connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
            return this;
        }

        public Builder hotspotConnectionTimeoutMs(long hotspotConnectionTimeoutMs) {
            this.hotspotConnectionTimeoutMs = hotspotConnectionTimeoutMs;
            return this;
        }

        public Builder settleDelayMs(long settleDelayMs) {
            this.settleDelayMs = settleDelayMs;
            return this;
        }

        public Builder verifyRetryDelayMs(long verifyRetryDelayMs) {
            this.verifyRetryDelayMs = verifyRetryDelayMs;
            return this;
        }

        public Builder mockDriver(boolean mockDriver) {
            this.mockDriver = mockDriver;
            return this;
        }

        public Builder debounceDelayMs(long debounceDelayMs) {
            this.debounceDelayMs = debounceDelayMs;
            return this;
        }

        public Builder gracePeriodMs(long gracePeriodMs) {
            this.gracePeriodMs = gracePeriodMs;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder monitorIntervalMs(long monitorIntervalMs) {
            this.monitorIntervalMs = monitorIntervalMs;
            return this;
        }

        public Builder commandTimeoutMs(long commandTimeoutMs) {
            this.commandTimeoutMs = commandTimeoutMs;
            return this;
        }

        public WifiConfig build() {
            if (primarySsid == null || primarySsid.trim().isEmpty()) {
                throw new IllegalArgumentException("Primary SSID cannot be null or empty");
            }
            if (interfaceName == null || interfaceName.trim().isEmpty()) {
                throw new IllegalArgumentException("Interface name cannot be null or empty");
            }
            if (pollIntervalMs <= 0 || monitorIntervalMs <= 0) {
                throw new IllegalArgumentException("Poll and monitor intervals must be positive");
            }
            return new WifiConfig(this);
        }
    }
}
