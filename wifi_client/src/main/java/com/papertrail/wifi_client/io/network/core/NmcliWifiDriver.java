package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.ICommandExecutor;
import com.papertrail.wifi_client.io.network.interfaces.IWifiDriver;
import com.papertrail.wifi_client.io.network.models.CommandResult;
import com.papertrail.wifi_client.io.network.models.WifiNetworkConfig;
import com.papertrail.wifi_client.logging.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * WiFi driver backed by NetworkManager's command line client.
 */
public class NmcliWifiDriver implements IWifiDriver {
    private static final String TAG = "NmcliWifiDriver";
    private static final String NMCLI = "nmcli";

    private final ICommandExecutor executor;
    private final WifiConfig config;
    private final Logger logger;

    public NmcliWifiDriver(ICommandExecutor executor, WifiConfig config, Logger logger) {
        this.executor = executor;
        this.config = config;
        this.logger = logger;
    }

    @Override
    public boolean isAvailable() {
        try {
            CommandResult result = executor.execute(Arrays.asList("which", NMCLI), config.getCommandTimeoutMs());
            return result.isSuccess();
        } catch (IOException e) {
            logger.warn(TAG, "nmcli lookup failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<String> rescanAndList() throws DriverException {
        rescan();
        return lines(run("-t", "-f", "SSID,SIGNAL,SECURITY,FREQ", "device", "wifi", "list"));
    }

    @Override
    public List<String> rescanAndListSsids() throws DriverException {
        rescan();
        return lines(run("-t", "-f", "SSID", "device", "wifi", "list"));
    }

    @Override
    public List<String> showDeviceStatus() throws DriverException {
        return lines(run("-t", "-f", "GENERAL.CONNECTION,IP4.ADDRESS,GENERAL.HWADDR",
                "device", "show", config.getInterfaceName()));
    }

    @Override
    public boolean profileExists(String name) throws DriverException {
        return execute(command("connection", "show", name)).isSuccess();
    }

    @Override
    public void addWifiProfile(String ssid, String password) throws DriverException {
        run(addProfileArgs(ssid, password).toArray(new String[0]));
    }

    @Override
    public void addWifiProfile(WifiNetworkConfig networkConfig) throws DriverException {
        List<String> args = addProfileArgs(networkConfig.getSsid(), networkConfig.getPassword());
        args.add("connection.autoconnect");
        args.add(networkConfig.isAutoConnect() ? "yes" : "no");
        args.add("connection.autoconnect-priority");
        args.add(String.valueOf(networkConfig.getPriority()));
        run(args.toArray(new String[0]));
    }

    @Override
    public void deleteProfile(String name) throws DriverException {
        run("connection", "delete", name);
    }

    @Override
    public void activateProfile(String name) throws DriverException {
        run("connection", "up", name);
    }

    @Override
    public List<String> listProfiles() throws DriverException {
        return lines(run("-t", "-f", "NAME,TYPE,AUTOCONNECT,AUTOCONNECT-PRIORITY", "connection", "show"));
    }

    @Override
    public void disconnectDevice() throws DriverException {
        run("device", "disconnect", config.getInterfaceName());
    }

    private void rescan() throws DriverException {
        run("device", "wifi", "rescan");
    }

    private List<String> addProfileArgs(String ssid, String password) {
        return new ArrayList<>(Arrays.asList(
                "connection", "add",
                "type", "wifi",
                "con-name", ssid,
                "ifname", config.getInterfaceName(),
                "ssid", ssid,
                "wifi-sec.key-mgmt", "wpa-psk",
                "wifi-sec.psk", password));
    }

    /**
     * Run an nmcli subcommand and fail on a non-zero exit code.
     */
    private String run(String... args) throws DriverException {
        List<String> command = command(args);
        CommandResult result = execute(command);
        if (!result.isSuccess()) {
            String stderr = result.getStderr().trim();
            throw new DriverException("nmcli " + args[0] + " failed (exit " + result.getExitCode() + "): " + stderr,
                    result.getExitCode(), stderr);
        }
        return result.getStdout();
    }

    private CommandResult execute(List<String> command) throws DriverException {
        try {
            return executor.execute(command, config.getCommandTimeoutMs());
        } catch (IOException e) {
            throw new DriverException("Failed to run nmcli: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Interrupted while running nmcli", e);
        }
    }

    private List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        if (config.isUseSudo()) {
            command.add("sudo");
        }
        command.add(NMCLI);
        command.addAll(Arrays.asList(args));
        return command;
    }

    private static List<String> lines(String output) {
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.trim().isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }
}
