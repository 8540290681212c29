package io.shotmatrix.model;

import java.util.List;
import java.util.TreeSet;

public record RunSummary(
        int totalJobs,
        int successfulJobs,
        int failedJobs,
        int cancelledJobs,
        int totalScreenshots,
        int totalFailureArtifacts,
        List<String> platforms,
        List<String> devices,
        List<String> languages,
        double successRatePercent
) {
    public static RunSummary of(List<JobResult> results) {
        int successful = 0;
        int failed = 0;
        int cancelled = 0;
        int screenshots = 0;
        int artifacts = 0;
        TreeSet<String> platforms = new TreeSet<>();
        TreeSet<String> devices = new TreeSet<>();
        TreeSet<String> languages = new TreeSet<>();
        for (JobResult result : results) {
            switch (result.status()) {
                case SUCCESS -> successful++;
                case CANCELLED -> cancelled++;
                default -> failed++;
            }
            screenshots += result.screenshots().size();
            artifacts += result.failureArtifacts().size();
            RunJob job = result.job();
            platforms.add(job.platform().displayName());
            devices.add(job.deviceName());
            languages.add(job.language());
        }
        double rate = results.isEmpty() ? 0.0d : Math.round(successful * 10_000.0d / results.size()) / 100.0d;
        return new RunSummary(results.size(), successful, failed, cancelled, screenshots, artifacts,
                List.copyOf(platforms), List.copyOf(devices), List.copyOf(languages), rate);
    }
}
