package com.papertrail.wifi_client.io.network.core;

/**
 * Failure of a WiFi driver invocation. Keeps the exit code and stderr so
 * callers can classify the failure.
 */
public class DriverException extends Exception {

    private final int exitCode;
    private final String stderr;

    public DriverException(String message, int exitCode, String stderr) {
        super(message);
        this.exitCode = exitCode;
        this.stderr = stderr != null ? stderr : "";
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.stderr = "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
