package io.shotmatrix.runtime;

import io.shotmatrix.error.JobCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide cancellation signal shared by every job. Cancelling is idempotent.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel(String why) {
        if (!reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why)) {
            return;
        }
        cancelled.countDown();
        log.info("Cancellation requested: {}", reason.get());
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException("Run cancelled: " + reason.get());
        }
    }

    /**
     * Sleeps for the given duration or until cancellation, whichever comes first.
     *
     * @throws JobCancelledException when the token fires before or during the sleep
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while waiting");
        }
    }

    /**
     * Registers a callback run once on cancellation; runs immediately when already cancelled.
     * Close the returned registration once the callback is no longer wanted.
     */
    public Registration onCancel(Runnable callback) {
        AtomicBoolean ran = new AtomicBoolean();
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        if (isCancelled()) {
            once.run();
        }
        return () -> {
            ran.set(true);
            callbacks.remove(once);
        };
    }

    int callbackCount() {
        return callbacks.size();
    }

    /**
     * Handle for a cancellation callback. Closing it drops the callback; a callback already run is unaffected.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
