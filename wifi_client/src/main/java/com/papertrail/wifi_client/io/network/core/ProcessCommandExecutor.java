package com.papertrail.wifi_client.io.network.core;

import com.papertrail.wifi_client.io.network.interfaces.ICommandExecutor;
import com.papertrail.wifi_client.io.network.models.CommandResult;
import com.papertrail.wifi_client.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through {@link ProcessBuilder}.
 * Output streams are drained on a private pool so a chatty process cannot block on a full pipe.
 */
public class ProcessCommandExecutor implements ICommandExecutor {
    private static final String TAG = "ProcessCommandExecutor";

    private final Logger logger;
    private final ExecutorService streamReaders;

    public ProcessCommandExecutor(Logger logger) {
        this.logger = logger;
        this.streamReaders = Executors.newCachedThreadPool(new NamedThreadFactory("cmd-output"));
    }

    @Override
    public CommandResult execute(List<String> command, long timeoutMs) throws IOException, InterruptedException {
        logger.debug(TAG, "Executing: " + String.join(" ", redact(command)));

        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), streamReaders);

        if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + timeoutMs + "ms: " + command.get(0));
        }

        try {
            return new CommandResult(process.exitValue(), stdout.join(), stderr.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException) {
                throw ((UncheckedIOException) e.getCause()).getCause();
            }
            throw new IOException("Failed to read command output", e.getCause());
        }
    }

    /**
     * Stop the output reader pool
     */
    public void shutdown() {
        streamReaders.shutdownNow();
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Replace the argument following a psk key so secrets stay out of logs.
     */
    static List<String> redact(List<String> command) {
        String[] copy = command.toArray(new String[0]);
        for (int i = 0; i < copy.length - 1; i++) {
            if ("wifi-sec.psk".equals(copy[i])) {
                copy[i + 1] = "********";
            }
        }
        return List.of(copy);
    }
}
