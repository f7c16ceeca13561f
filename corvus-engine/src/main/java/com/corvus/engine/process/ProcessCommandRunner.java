package com.corvus.engine.process;

import com.corvus.core.exception.CommandExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained concurrently so a chatty child never blocks on a full pipe.
 * The child inherits no stdin.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Duration timeout;

    /**
     * @param timeout maximum time to wait for the process; {@link Duration#ZERO} waits forever
     */
    public ProcessCommandRunner(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.timeout = timeout;
    }

    @Override
    public CommandResult run(List<String> command) throws CommandExecutionException {
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .start();
        } catch (IOException e) {
            throw new CommandExecutionException(command,
                    "Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            if (!waitFor(process)) {
                process.destroyForcibly();
                throw new CommandExecutionException(command,
                        -1, command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            int exitCode = process.exitValue();
            CommandResult result = new CommandResult(command, exitCode, stdout.get(), stderr.get());
            if (!result.isSuccess()) {
                log.debug("{} exited with code {}", command.get(0), exitCode);
            }
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException(command, "Interrupted while waiting for " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new CommandExecutionException(command,
                    "Failed to read output of " + command.get(0), e.getCause());
        }
    }

    private boolean waitFor(Process process) throws InterruptedException {
        if (timeout.isZero()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
