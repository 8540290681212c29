package io.shotmatrix.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Every device and automation server started by a run, keyed by job. Jobs unregister their own
 * resources during teardown; {@link #drain(Duration)} stops whatever is left.
 */
public final class ProcessRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();

    public void register(String id, ManagedResource resource) {
        ManagedResource previous = resources.put(id, resource);
        if (previous != null && previous != resource) {
            log.warn("Resource id {} re-registered; previous {} is no longer tracked", id, previous.description());
        }
        log.debug("Registered {} as {}", resource.description(), id);
    }

    public ManagedResource unregister(String id) {
        return resources.remove(id);
    }

    public int size() {
        return resources.size();
    }

    public Collection<String> registeredIds() {
        return new TreeSet<>(resources.keySet());
    }

    /**
     * Stops every registered resource in parallel and clears the registry.
     */
    public DrainOutcome drain(Duration timeout) {
        Map<String, ManagedResource> snapshot = new LinkedHashMap<>();
        for (String id : registeredIds()) {
            ManagedResource resource = resources.remove(id);
            if (resource != null) {
                snapshot.put(id, resource);
            }
        }
        if (snapshot.isEmpty()) {
            return DrainOutcome.empty();
        }
        log.info("Draining {} managed resource(s)", snapshot.size());
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(snapshot.size(), 8), r -> {
            Thread t = new Thread(r, "registry-drain");
            t.setDaemon(true);
            return t;
        });
        Map<String, CompletableFuture<Void>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, ManagedResource> entry : snapshot.entrySet()) {
            futures.put(entry.getKey(), CompletableFuture.runAsync(() -> stopUnchecked(entry.getValue()), pool));
        }
        List<String> stopped = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> timedOut = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (Map.Entry<String, CompletableFuture<Void>> entry : futures.entrySet()) {
                String id = entry.getKey();
                long remaining = Math.max(0L, deadline - System.nanoTime());
                try {
                    entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                    stopped.add(id);
                } catch (TimeoutException e) {
                    timedOut.add(id);
                    log.warn("{} did not stop within {}", snapshot.get(id).description(), timeout);
                } catch (ExecutionException e) {
                    failed.add(id);
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Failed to stop {}: {}", snapshot.get(id).description(), cause.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    timedOut.add(id);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        DrainOutcome outcome = new DrainOutcome(stopped, failed, timedOut);
        log.info("Drain finished: {} stopped, {} failed, {} timed out", stopped.size(), failed.size(), timedOut.size());
        return outcome;
    }

    private static void stopUnchecked(ManagedResource resource) {
        try {
            resource.stop();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
