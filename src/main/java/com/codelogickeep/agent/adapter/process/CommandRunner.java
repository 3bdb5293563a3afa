package com.codelogickeep.agent.adapter.process;

import com.codelogickeep.agent.adapter.exception.AdapterException;
import com.codelogickeep.agent.adapter.exception.AdapterException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a bounded wait and full output capture.
 * <p>
 * Never throws for a missing executable or a timeout; those are reported through
 * {@link CommandResult#notFound()} and {@link CommandResult#timedOut()}. Any other
 * operating-system failure becomes an {@link CommandResult#infrastructureFailure(String)}.
 * Instances hold no state and may be shared between threads.
 */
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public CommandResult run(List<String> command, Path workingDir, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
        if (workingDir == null || !Files.isDirectory(workingDir)) {
            return CommandResult.infrastructureFailure(new AdapterException(ErrorCode.INFRASTRUCTURE_ERROR,
                    "Working directory does not exist: " + workingDir).toTranscriptLine());
        }

        log.debug("Executing: {} (cwd={}, timeout={}s)", String.join(" ", command), workingDir, timeout.toSeconds());
        long start = System.nanoTime();

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            process = pb.start();
        } catch (IOException e) {
            if (isNotFound(e)) {
                log.warn("Command not found: {}", command.get(0));
                return CommandResult.notFound(command.get(0));
            }
            log.error("Failed to start {}", command.get(0), e);
            return CommandResult.infrastructureFailure(new AdapterException(ErrorCode.INFRASTRUCTURE_ERROR,
                    "Failed to start process: " + e.getMessage(), command.get(0), e).toTranscriptLine());
        }

        // Drain both streams concurrently so a chatty child cannot block on a full pipe.
        StringBuilder outBuilder = new StringBuilder();
        StringBuilder errBuilder = new StringBuilder();
        Thread outThread = startReader(process.getInputStream(), outBuilder, "stdout");
        Thread errThread = startReader(process.getErrorStream(), errBuilder, "stderr");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                joinQuietly(outThread);
                joinQuietly(errThread);
                double elapsed = elapsedMs(start);
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), command.get(0));
                return CommandResult.timeout(timeout.toMillis() / 1000.0, snapshot(outBuilder), elapsed);
            }
            outThread.join();
            errThread.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.infrastructureFailure(new AdapterException(ErrorCode.INFRASTRUCTURE_ERROR,
                    "Interrupted while waiting for " + command.get(0)).toTranscriptLine());
        }

        double elapsed = elapsedMs(start);
        int exitCode = process.exitValue();
        log.debug("Command finished with exit code {} in {}ms", exitCode, (long) elapsed);
        return CommandResult.completed(exitCode, snapshot(outBuilder), snapshot(errBuilder), elapsed);
    }

    private Thread startReader(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                // Stream closes underneath us when a timed-out process is killed.
                log.debug("Stopped reading {}: {}", name, e.getMessage());
            }
        }, "command-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }

    private static void joinQuietly(Thread thread) throws InterruptedException {
        thread.join(TimeUnit.SECONDS.toMillis(2));
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    static boolean isNotFound(IOException e) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        return message.contains("error=2,")
                || message.contains("no such file or directory")
                || message.contains("cannot find the file");
    }
}
