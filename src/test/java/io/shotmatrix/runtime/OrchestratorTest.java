package io.shotmatrix.runtime;

import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.model.EnvironmentInfo;
import io.shotmatrix.model.JobResult;
import io.shotmatrix.model.JobState;
import io.shotmatrix.model.JobStatus;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import io.shotmatrix.model.RunResult;
import io.shotmatrix.model.RunStatus;
import io.shotmatrix.model.RunSummary;
import io.shotmatrix.observability.RunEventLog;
import io.shotmatrix.planning.PlanFilters;
import io.shotmatrix.planning.PortAllocator;
import io.shotmatrix.planning.RunPlan;
import io.shotmatrix.planning.RunPlanBuilder;
import io.shotmatrix.process.ProcessRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class OrchestratorTest {
    private static final EnvironmentInfo ENV = new EnvironmentInfo("Linux 6.1", "17.0.11", "ci-host", "/work", "dev", "cafe");

    private static RunPlan homePlan(Path outputRoot) {
        PlanFilters onlyHome = new PlanFilters(null, null, null, List.of("home"));
        return new RunPlanBuilder((platform, build) -> Optional.of(outputRoot.resolve("app-" + platform.key())), true, 8)
                .build(ConfigFixtures.config(), outputRoot, onlyHome, new PortAllocator(), RunOverrides.none());
    }

    @Test
    void aggregatesResultsInPlanOrder() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-orch-ok-");
        try {
            RuntimeFakes.Harness harness = new RuntimeFakes.Harness();
            ProcessRegistry registry = new ProcessRegistry();
            RunEventLog eventLog = new RunEventLog(dir.resolve(RunEventLog.FILE_NAME), "run-agg");
            Orchestrator orchestrator = new Orchestrator(RuntimeFakes.executor(harness, registry, eventLog),
                    "run-agg", ENV, eventLog, 8);
            RunPlan plan = homePlan(dir);

            RunResult result = orchestrator.execute(plan, ConfigFixtures.config(), RunOverrides.none(), new CancellationToken());

            Assertions.assertTrue(result.success());
            Assertions.assertEquals(RunStatus.SUCCESS, result.status());
            Assertions.assertNull(result.errorMessage());
            Assertions.assertEquals("run-agg", result.runId());
            Assertions.assertEquals(4, result.jobResults().size());
            for (int i = 0; i < 4; i++) {
                Assertions.assertEquals(i, result.jobResults().get(i).job().index());
            }
            RunSummary summary = result.summary();
            Assertions.assertEquals(4, summary.totalJobs());
            Assertions.assertEquals(4, summary.successfulJobs());
            Assertions.assertEquals(4, summary.totalScreenshots());
            Assertions.assertEquals(List.of("Android", "iOS"), summary.platforms());
            Assertions.assertEquals(List.of("de-DE", "en-US"), summary.languages());
            Assertions.assertEquals(100.0d, summary.successRatePercent());
            Assertions.assertEquals(0, registry.size());
            Assertions.assertTrue(harness.server.running.isEmpty());
            Assertions.assertEquals(2 + 4 * 4, RunEventLog.verify(eventLog.file()));
            Assertions.assertSame(ENV, result.environment());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void crashedWorkerDoesNotAffectOtherJobs() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-orch-crash-");
        try {
            RuntimeFakes.Harness harness = new RuntimeFakes.Harness();
            ProcessRegistry registry = new ProcessRegistry();
            // No Android profile: those jobs throw before the executor's own error handling.
            JobExecutor iosOnly = new JobExecutor(List.of(new IosProfile(harness.ios)), harness.server,
                    harness.sessions, harness.images, registry, harness.resetTracker, null);
            Orchestrator orchestrator = new Orchestrator(iosOnly, "run-crash", ENV, null, 8);

            RunResult result = orchestrator.execute(homePlan(dir), ConfigFixtures.config(), RunOverrides.none(),
                    new CancellationToken());

            Assertions.assertFalse(result.success());
            Assertions.assertEquals(RunStatus.PARTIAL_SUCCESS, result.status());
            Assertions.assertEquals(2, result.summary().successfulJobs());
            Assertions.assertEquals(2, result.summary().failedJobs());
            Assertions.assertEquals(50.0d, result.summary().successRatePercent());
            for (JobResult failed : result.failedJobs()) {
                Assertions.assertEquals(Platform.ANDROID, failed.job().platform());
                Assertions.assertEquals(List.of(JobState.PENDING, JobState.FAILED), failed.stateHistory());
                Assertions.assertEquals("IllegalStateException", failed.errorType());
            }
            Assertions.assertEquals("2 of 4 job(s) failed", result.errorMessage());
            Assertions.assertEquals(0, registry.size());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void cancelMidRunLeavesEveryJobTerminalAndRegistryEmpty() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-orch-cancel-");
        try {
            RuntimeFakes.Harness harness = new RuntimeFakes.Harness();
            harness.ios.bootBlocksUntilCancelled = true;
            harness.android.bootBlocksUntilCancelled = true;
            ProcessRegistry registry = new ProcessRegistry();
            Orchestrator orchestrator = new Orchestrator(RuntimeFakes.executor(harness, registry, null),
                    "run-cancel", ENV, null, 8);
            RunPlan plan = homePlan(dir);
            RootConfig config = ConfigFixtures.config();
            CancellationToken token = new CancellationToken();
            RunOverrides twoAtATime = new RunOverrides(null, null, null, null, null, 2, null);

            CompletableFuture<RunResult> pending = CompletableFuture.supplyAsync(
                    () -> orchestrator.execute(plan, config, twoAtATime, token));
            Assertions.assertTrue(harness.ios.bootStarted.await(5, TimeUnit.SECONDS));
            token.cancel("operator interrupt");
            RunResult result = pending.get(10, TimeUnit.SECONDS);

            Assertions.assertEquals(RunStatus.CANCELLED, result.status());
            Assertions.assertFalse(result.success());
            Assertions.assertEquals(4, result.jobResults().size());
            for (JobResult job : result.jobResults()) {
                Assertions.assertEquals(JobStatus.CANCELLED, job.status(), job.job().jobId());
                Assertions.assertTrue(job.stateHistory().get(job.stateHistory().size() - 1).terminal());
            }
            Assertions.assertEquals(4, result.summary().cancelledJobs());
            Assertions.assertEquals("Run cancelled: operator interrupt", result.errorMessage());
            Assertions.assertEquals(0, registry.size());
            Assertions.assertTrue(harness.server.running.isEmpty());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void jobsOnTheSameDeviceNeverOverlap() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-orch-lanes-");
        try {
            RuntimeFakes.Harness harness = new RuntimeFakes.Harness();
            harness.ios.bootDelay = Duration.ofMillis(150);
            harness.android.bootDelay = Duration.ofMillis(150);
            ProcessRegistry registry = new ProcessRegistry();
            Orchestrator orchestrator = new Orchestrator(RuntimeFakes.executor(harness, registry, null),
                    "run-lanes", ENV, null, 8);

            RunResult result = orchestrator.execute(homePlan(dir), ConfigFixtures.config(), RunOverrides.none(),
                    new CancellationToken());

            Assertions.assertEquals(RunStatus.SUCCESS, result.status());
            Assertions.assertEquals(2, harness.ios.boots.get());
            Assertions.assertEquals(2, harness.android.boots.get());
            Assertions.assertEquals(1, harness.ios.mostLive.get());
            Assertions.assertEquals(1, harness.android.mostLive.get());
            Assertions.assertEquals(List.of("boot job-0", "boot job-1"), harness.ios.calls.stream()
                    .filter(call -> call.startsWith("boot ")).toList());
            Assertions.assertEquals(0, registry.size());
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void lanesGroupJobsByDeviceInPlanOrder() {
        RunPlan plan = homePlan(Path.of("build", "lanes"));

        Map<String, List<RunJob>> lanes = Orchestrator.deviceLanes(plan.jobs());

        Assertions.assertEquals(List.of("ios/SIM-UDID-1", "android/Pixel_7_API_34"), List.copyOf(lanes.keySet()));
        Assertions.assertEquals(List.of(0, 1), lanes.get("ios/SIM-UDID-1").stream().map(RunJob::index).toList());
        Assertions.assertEquals(List.of(2, 3),
                lanes.get("android/Pixel_7_API_34").stream().map(RunJob::index).toList());
    }

    @Test
    void runStatusReflectsJobOutcomes() {
        Assertions.assertEquals(RunStatus.SUCCESS, Orchestrator.statusOf(summary(4, 4, 0, 0), false));
        Assertions.assertEquals(RunStatus.PARTIAL_SUCCESS, Orchestrator.statusOf(summary(4, 3, 1, 0), false));
        Assertions.assertEquals(RunStatus.FAILED, Orchestrator.statusOf(summary(4, 0, 4, 0), false));
        Assertions.assertEquals(RunStatus.CANCELLED, Orchestrator.statusOf(summary(4, 1, 0, 3), true));
        Assertions.assertEquals(RunStatus.FAILED, Orchestrator.statusOf(summary(0, 0, 0, 0), false));
    }

    @Test
    void parallelismDefaultsToHalfTheProcessors() {
        Orchestrator orchestrator = new Orchestrator(null, "run-p", ENV, null, 8);

        Assertions.assertEquals(4, orchestrator.parallelismFor(10, RunOverrides.none()));
        Assertions.assertEquals(2, orchestrator.parallelismFor(2, RunOverrides.none()));
        Assertions.assertEquals(3, orchestrator.parallelismFor(10, new RunOverrides(null, null, null, null, null, 3, null)));
        Assertions.assertEquals(1, orchestrator.parallelismFor(1, null));
    }

    @Test
    void generatedRunIdsAreTimestampedAndUnique() {
        String first = Orchestrator.newRunId();
        String second = Orchestrator.newRunId();

        Assertions.assertTrue(first.matches("run-\\d{8}-\\d{6}-[0-9a-f]{8}"), first);
        Assertions.assertNotEquals(first, second);
        Assertions.assertTrue(new Orchestrator(null, " ", ENV, null, 2).runId().startsWith("run-"));
    }

    private static RunSummary summary(int total, int ok, int failed, int cancelled) {
        return new RunSummary(total, ok, failed, cancelled, 0, 0, List.of(), List.of(), List.of(),
                total == 0 ? 0.0d : ok * 100.0d / total);
    }
}
