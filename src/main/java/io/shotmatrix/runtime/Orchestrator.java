package io.shotmatrix.runtime;

import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.model.EnvironmentInfo;
import io.shotmatrix.model.JobResult;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import io.shotmatrix.model.RunResult;
import io.shotmatrix.model.RunStatus;
import io.shotmatrix.model.RunSummary;
import io.shotmatrix.observability.RunEventLog;
import io.shotmatrix.planning.RunPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs a plan's jobs on a bounded worker pool and folds the results into a {@link RunResult}.
 */
public final class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final JobExecutor executor;
    private final String runId;
    private final EnvironmentInfo environment;
    private final RunEventLog eventLog;
    private final int availableProcessors;

    public Orchestrator(JobExecutor executor, String runId, EnvironmentInfo environment, RunEventLog eventLog) {
        this(executor, runId, environment, eventLog, Runtime.getRuntime().availableProcessors());
    }

    public Orchestrator(
            JobExecutor executor,
            String runId,
            EnvironmentInfo environment,
            RunEventLog eventLog,
            int availableProcessors
    ) {
        this.executor = executor;
        this.runId = runId == null || runId.isBlank() ? newRunId() : runId;
        this.environment = environment;
        this.eventLog = eventLog;
        this.availableProcessors = Math.max(1, availableProcessors);
    }

    public static String newRunId() {
        return "run-" + RUN_ID_TIME.format(Instant.now()) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public int parallelismFor(int jobCount, RunOverrides overrides) {
        Integer requested = overrides == null ? null : overrides.maxParallelism();
        if (requested != null && requested > 0) {
            return Math.max(1, Math.min(requested, Math.max(1, jobCount)));
        }
        return Defaults.parallelismFor(jobCount, availableProcessors);
    }

    public RunResult execute(RunPlan plan, RootConfig config, RunOverrides overrides, CancellationToken token) {
        Instant startedAt = Instant.now();
        List<RunJob> jobs = plan.jobs();
        Map<String, List<RunJob>> lanes = deviceLanes(jobs);
        int parallelism = Math.max(1, Math.min(parallelismFor(jobs.size(), overrides), lanes.size()));
        log.info("Run {} starting: {} job(s) on {} device(s), parallelism {}", runId, jobs.size(), lanes.size(),
                parallelism);
        event("run.started", "RUNNING", Map.of("jobs", jobs.size(), "devices", lanes.size(),
                "parallelism", parallelism));

        AtomicReferenceArray<JobResult> slots = new AtomicReferenceArray<>(jobs.size());
        ThreadPoolExecutor pool = newPool(parallelism);
        try {
            // One worker per device at a time; a simulator or AVD cannot host two jobs.
            for (List<RunJob> lane : lanes.values()) {
                pool.execute(() -> {
                    for (RunJob job : lane) {
                        slots.set(job.index(), runSlot(job, config, overrides, token));
                    }
                });
            }
        } finally {
            pool.shutdown();
        }
        awaitAll(pool, token);

        List<JobResult> results = new ArrayList<>(jobs.size());
        for (RunJob job : jobs) {
            JobResult result = slots.get(job.index());
            results.add(result == null ? JobResult.cancelledBeforeStart(job) : result);
        }
        RunSummary summary = RunSummary.of(results);
        RunStatus status = statusOf(summary, token.isCancelled());
        boolean success = status == RunStatus.SUCCESS;
        String errorMessage = success ? null : describeFailure(summary, token);
        RunResult result = new RunResult(runId, startedAt, Instant.now(), status, success, results, summary,
                environment, errorMessage);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("successful", summary.successfulJobs());
        details.put("failed", summary.failedJobs());
        details.put("cancelled", summary.cancelledJobs());
        details.put("screenshots", summary.totalScreenshots());
        event("run.finished", status.name(), details);
        log.info("Run {} finished {}: {}/{} job(s) succeeded, {} screenshot(s) in {} s", runId, status,
                summary.successfulJobs(), summary.totalJobs(), summary.totalScreenshots(),
                result.duration().toSeconds());
        return result;
    }

    static Map<String, List<RunJob>> deviceLanes(List<RunJob> jobs) {
        Map<String, List<RunJob>> lanes = new LinkedHashMap<>();
        for (RunJob job : jobs) {
            lanes.computeIfAbsent(job.deviceKey(), key -> new ArrayList<>()).add(job);
        }
        return lanes;
    }

    private JobResult runSlot(RunJob job, RootConfig config, RunOverrides overrides, CancellationToken token) {
        if (token.isCancelled()) {
            return JobResult.cancelledBeforeStart(job);
        }
        Instant started = Instant.now();
        try {
            return executor.execute(job, config, overrides, token);
        } catch (RuntimeException | Error e) {
            log.error("[{}] worker crashed: {}", job.jobId(), e.toString());
            return JobResult.crashed(job, started, e);
        }
    }

    static RunStatus statusOf(RunSummary summary, boolean cancelled) {
        if (summary.totalJobs() > 0 && summary.successfulJobs() == summary.totalJobs()) {
            return RunStatus.SUCCESS;
        }
        if (cancelled && summary.cancelledJobs() > 0) {
            return RunStatus.CANCELLED;
        }
        if (summary.successfulJobs() == 0) {
            return RunStatus.FAILED;
        }
        return RunStatus.PARTIAL_SUCCESS;
    }

    private static String describeFailure(RunSummary summary, CancellationToken token) {
        if (token.isCancelled()) {
            return "Run cancelled: " + token.reason();
        }
        return summary.failedJobs() + " of " + summary.totalJobs() + " job(s) failed";
    }

    private static void awaitAll(ThreadPoolExecutor pool, CancellationToken token) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                // Jobs still own live devices; stop them through the token and keep waiting.
                interrupted = true;
                token.cancel("interrupted");
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadPoolExecutor newPool(int parallelism) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(parallelism, parallelism, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "shotmatrix-job-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    private void event(String action, String result, Map<String, Object> details) {
        if (eventLog == null) {
            return;
        }
        try {
            eventLog.log(RunEventLog.RunEvent.run(action, result, details));
        } catch (RuntimeException e) {
            log.warn("Event log write failed: {}", e.getMessage());
        }
    }

    public String runId() {
        return runId;
    }
}
