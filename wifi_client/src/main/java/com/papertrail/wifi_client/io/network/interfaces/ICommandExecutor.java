package com.papertrail.wifi_client.io.network.interfaces;

import com.papertrail.wifi_client.io.network.models.CommandResult;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command and captures its output.
 */
public interface ICommandExecutor {

    /**
     * @param command program and arguments
     * @param timeoutMs hard limit after which the process is destroyed
     * @return the exit code and captured output
     * @throws IOException if the process cannot be started or exceeds the timeout
     */
    CommandResult execute(List<String> command, long timeoutMs) throws IOException, InterruptedException;
}
