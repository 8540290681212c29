package io.shotmatrix.device;

import io.shotmatrix.error.JobCancelledException;
import io.shotmatrix.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external tools (xcrun, adb, emulator, appium). Child processes are polled so a
 * cancelled run or an expired timeout kills them instead of leaving them behind.
 */
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);
    private static final long POLL_MS = 100L;
    private static final AtomicInteger READER_SEQ = new AtomicInteger();
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cmd-output-" + READER_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public CommandResult run(List<String> command, Duration timeout, CancellationToken token) throws TimeoutException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long started = System.nanoTime();
        log.debug("exec: {} (timeout {})", String.join(" ", command), timeout);
        Process process;
        try {
            process = new ProcessBuilder(new ArrayList<>(command)).start();
        } catch (IOException e) {
            throw new UncheckedIOException("spawn failed: " + command.get(0) + ": " + e.getMessage(), e);
        }
        closeQuietly(process);
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        long deadline = started + timeout.toNanos();
        try {
            while (!process.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (token != null && token.isCancelled()) {
                    kill(process);
                    throw new JobCancelledException("Command cancelled: " + command.get(0));
                }
                if (System.nanoTime() >= deadline) {
                    kill(process);
                    throw new TimeoutException("Command '" + String.join(" ", command) + "' timed out after " + timeout);
                }
            }
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while running " + command.get(0));
        }

        CommandResult result = new CommandResult(
                process.exitValue(),
                collect(stdout),
                collect(stderr),
                Duration.ofNanos(System.nanoTime() - started)
        );
        if (!result.ok()) {
            log.debug("exit={} from {}: {}", result.exitCode(), command.get(0), result.errorSummary());
        }
        return result;
    }

    /**
     * Starts a long-lived child (emulator, automation server) without waiting for it.
     */
    public Process start(List<String> command) {
        log.debug("spawn: {}", String.join(" ", command));
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            return pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("spawn failed: " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("output stream closed early: {}", e.getMessage());
                return "";
            }
        }, READERS);
    }

    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("output collection failed: {}", e.getMessage());
            return "";
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("stdin close failed: {}", e.getMessage());
        }
    }
}
