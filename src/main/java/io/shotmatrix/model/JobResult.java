package io.shotmatrix.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record JobResult(
        RunJob job,
        JobStatus status,
        List<ScreenshotResult> screenshots,
        Instant startedAt,
        Instant finishedAt,
        String errorMessage,
        String errorType,
        List<FailureArtifact> failureArtifacts,
        List<JobState> stateHistory,
        List<String> warnings
) {
    public JobResult {
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        failureArtifacts = failureArtifacts == null ? List.of() : List.copyOf(failureArtifacts);
        stateHistory = stateHistory == null ? List.of() : List.copyOf(stateHistory);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Result for a job that never got a worker because the run was cancelled first.
     */
    public static JobResult cancelledBeforeStart(RunJob job) {
        Instant now = Instant.now();
        return new JobResult(job, JobStatus.CANCELLED, List.of(), now, now,
                "Run cancelled before job started", "JobCancelled", List.of(),
                List.of(JobState.PENDING, JobState.CANCELLED), List.of());
    }

    /**
     * Result for a job whose worker died outside the executor's own error handling.
     */
    public static JobResult crashed(RunJob job, Instant startedAt, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new JobResult(job, JobStatus.FAILED, List.of(), startedAt, Instant.now(),
                message, error.getClass().getSimpleName(), List.of(),
                List.of(JobState.PENDING, JobState.FAILED), List.of());
    }

    public boolean success() {
        return status == JobStatus.SUCCESS;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
