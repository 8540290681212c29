package io.shotmatrix.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record RunResult(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        boolean success,
        List<JobResult> jobResults,
        RunSummary summary,
        EnvironmentInfo environment,
        String errorMessage
) {
    public RunResult {
        jobResults = jobResults == null ? List.of() : List.copyOf(jobResults);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public List<JobResult> failedJobs() {
        return jobResults.stream().filter(r -> r.status() == JobStatus.FAILED).toList();
    }
}
