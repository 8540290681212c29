package io.shotmatrix.cli;

import io.shotmatrix.process.DrainOutcome;
import io.shotmatrix.process.ProcessRegistry;
import io.shotmatrix.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Owns the run's process lifetime. A JVM shutdown (Ctrl-C, SIGTERM) or an uncaught exception
 * cancels the run and drains the registry; normal completion drains on {@link #close()}.
 */
public final class LifecycleGuard implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LifecycleGuard.class);

    private final ProcessRegistry registry;
    private final CancellationToken token;
    private final Duration drainTimeout;
    private final CountDownLatch completed = new CountDownLatch(1);
    private final Thread shutdownHook;
    private Thread.UncaughtExceptionHandler previousHandler;
    private boolean installed;

    LifecycleGuard(ProcessRegistry registry, CancellationToken token, Duration drainTimeout) {
        this.registry = registry;
        this.token = token;
        this.drainTimeout = drainTimeout;
        this.shutdownHook = new Thread(this::onShutdown, "shotmatrix-shutdown-hook");
    }

    public static LifecycleGuard install(ProcessRegistry registry, CancellationToken token, Duration drainTimeout) {
        LifecycleGuard guard = new LifecycleGuard(registry, token, drainTimeout);
        Runtime.getRuntime().addShutdownHook(guard.shutdownHook);
        guard.previousHandler = Thread.getDefaultUncaughtExceptionHandler();
        Thread.setDefaultUncaughtExceptionHandler(guard::onUncaught);
        guard.installed = true;
        return guard;
    }

    public synchronized DrainOutcome drain() {
        DrainOutcome outcome = registry.drain(drainTimeout);
        if (!outcome.clean()) {
            log.warn("{} resource(s) could not be stopped cleanly: failed={} timedOut={}",
                    outcome.failed().size() + outcome.timedOut().size(), outcome.failed(), outcome.timedOut());
        }
        return outcome;
    }

    @Override
    public void close() {
        completed.countDown();
        drain();
        if (!installed) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; hook stays registered");
        }
        Thread.setDefaultUncaughtExceptionHandler(previousHandler);
    }

    void onShutdown() {
        if (completed.getCount() == 0) {
            return;
        }
        token.cancel("shutdown signal");
        try {
            // Give running jobs a chance to tear down their own devices first.
            if (!completed.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not finish within {} after shutdown signal", drainTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        drain();
    }

    void onUncaught(Thread thread, Throwable error) {
        log.error("Uncaught exception in {}: {}", thread.getName(), error.toString(), error);
        token.cancel("uncaught exception in " + thread.getName());
        drain();
        if (previousHandler != null) {
            previousHandler.uncaughtException(thread, error);
        }
    }
}
