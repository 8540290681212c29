package io.shotmatrix.report;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.model.EnvironmentInfo;
import io.shotmatrix.model.FailureArtifact;
import io.shotmatrix.model.JobResult;
import io.shotmatrix.model.JobState;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunResult;
import io.shotmatrix.model.RunSummary;
import io.shotmatrix.model.ScreenshotResult;
import io.shotmatrix.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes {@code run_manifest.json} and {@code run_summary.txt} next to the screenshots.
 */
public final class ManifestWriter {
    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);
    public static final String MANIFEST_FILE = "run_manifest.json";
    public static final String SUMMARY_FILE = "run_summary.txt";
    private static final int SCREENSHOTS_LISTED_PER_JOB = 3;
    private static final DateTimeFormatter SUMMARY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    public Written write(RunResult result, Path outputRoot) {
        Path manifest = outputRoot.resolve(MANIFEST_FILE);
        Path summary = outputRoot.resolve(SUMMARY_FILE);
        try {
            Files.createDirectories(outputRoot);
            Files.writeString(manifest, Jsons.toJson(manifest(result)), StandardCharsets.UTF_8);
            Files.writeString(summary, summaryText(result), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run manifest to " + outputRoot, e);
        }
        log.info("Run manifest written to {}", manifest);
        return new Written(manifest, summary);
    }

    public ObjectNode manifest(RunResult result) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("run_id", result.runId());
        root.put("started_at", result.startedAt().toString());
        root.put("finished_at", result.finishedAt().toString());
        root.put("duration_seconds", result.duration().toMillis() / 1000.0d);
        root.put("status", result.status().name());
        root.put("success", result.success());
        if (result.errorMessage() != null) {
            root.put("error_message", result.errorMessage());
        }

        EnvironmentInfo env = result.environment();
        if (env != null) {
            ObjectNode environment = root.putObject("environment");
            environment.put("operating_system", env.operatingSystem());
            environment.put("java_version", env.javaVersion());
            environment.put("hostname", env.hostname());
            environment.put("working_directory", env.workingDirectory());
            environment.put("tool_version", env.toolVersion());
            environment.put("config_hash", env.configHash());
        }

        RunSummary s = result.summary();
        ObjectNode summary = root.putObject("summary");
        summary.put("total_jobs", s.totalJobs());
        summary.put("successful_jobs", s.successfulJobs());
        summary.put("failed_jobs", s.failedJobs());
        summary.put("cancelled_jobs", s.cancelledJobs());
        summary.put("total_screenshots", s.totalScreenshots());
        summary.put("total_failure_artifacts", s.totalFailureArtifacts());
        summary.put("success_rate_percent", s.successRatePercent());
        s.platforms().forEach(summary.putArray("platforms")::add);
        s.devices().forEach(summary.putArray("devices")::add);
        s.languages().forEach(summary.putArray("languages")::add);

        ArrayNode jobs = root.putArray("jobs");
        for (JobResult jobResult : result.jobResults()) {
            jobs.add(job(jobResult));
        }
        return root;
    }

    private ObjectNode job(JobResult jobResult) {
        RunJob job = jobResult.job();
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("job_id", job.jobId());
        node.put("platform", job.platform().displayName());
        node.put("device", job.deviceName());
        node.put("device_folder", job.deviceFolder());
        node.put("language", job.language());
        node.put("output_dir", job.outputDirectory().toString());
        node.put("status", jobResult.status().name());
        node.put("success", jobResult.success());
        node.put("started_at", jobResult.startedAt() == null ? null : jobResult.startedAt().toString());
        node.put("finished_at", jobResult.finishedAt() == null ? null : jobResult.finishedAt().toString());
        node.put("duration_seconds", jobResult.duration().toMillis() / 1000.0d);
        if (jobResult.errorMessage() != null) {
            node.put("error_message", jobResult.errorMessage());
            node.put("error_type", jobResult.errorType());
        }
        ArrayNode states = node.putArray("state_history");
        for (JobState state : jobResult.stateHistory()) {
            states.add(state.name());
        }
        ArrayNode warnings = node.putArray("warnings");
        jobResult.warnings().forEach(warnings::add);

        ArrayNode screenshots = node.putArray("screenshots");
        for (ScreenshotResult shot : jobResult.screenshots()) {
            ObjectNode row = screenshots.addObject();
            row.put("name", shot.name());
            row.put("language", shot.language());
            row.put("path", shot.path().toString());
            row.put("orientation", shot.orientation());
            if (shot.hasDimensions()) {
                row.put("width", shot.width());
                row.put("height", shot.height());
            }
            row.put("size_bytes", shot.sizeBytes());
            row.put("captured_at", shot.capturedAt().toString());
            row.put("success", shot.success());
            if (shot.errorMessage() != null) {
                row.put("error_message", shot.errorMessage());
            }
        }

        ArrayNode artifacts = node.putArray("failure_artifacts");
        for (FailureArtifact artifact : jobResult.failureArtifacts()) {
            ObjectNode row = artifacts.addObject();
            row.put("type", artifact.type().name().toLowerCase(Locale.ROOT));
            row.put("path", artifact.path().toString());
            row.put("captured_at", artifact.capturedAt().toString());
            row.put("size_bytes", artifact.sizeBytes());
        }
        return node;
    }

    public String summaryText(RunResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("ShotMatrix Run Summary\n");
        sb.append("======================\n\n");
        sb.append("Run ID: ").append(result.runId()).append('\n');
        sb.append("Start Time: ").append(SUMMARY_TIME.format(result.startedAt())).append('\n');
        sb.append("End Time: ").append(SUMMARY_TIME.format(result.finishedAt())).append('\n');
        sb.append("Duration: ").append(seconds(result.duration().toMillis())).append(" seconds\n");
        sb.append("Status: ").append(result.status()).append('\n');
        if (result.errorMessage() != null) {
            sb.append("Run Error: ").append(result.errorMessage()).append('\n');
        }
        sb.append('\n');

        EnvironmentInfo env = result.environment();
        if (env != null) {
            sb.append("Environment:\n");
            sb.append("  OS: ").append(env.operatingSystem()).append('\n');
            sb.append("  Java: ").append(env.javaVersion()).append('\n');
            sb.append("  Host: ").append(env.hostname()).append('\n');
            sb.append("  Version: ").append(env.toolVersion()).append("\n\n");
        }

        RunSummary s = result.summary();
        sb.append("Summary:\n");
        sb.append("  Total Jobs: ").append(s.totalJobs()).append('\n');
        sb.append("  Successful: ").append(s.successfulJobs()).append('\n');
        sb.append("  Failed: ").append(s.failedJobs()).append('\n');
        sb.append("  Cancelled: ").append(s.cancelledJobs()).append('\n');
        sb.append("  Screenshots: ").append(s.totalScreenshots()).append('\n');
        sb.append("  Failure Artifacts: ").append(s.totalFailureArtifacts()).append("\n\n");

        sb.append("Job Results:\n");
        for (JobResult jobResult : result.jobResults()) {
            RunJob job = jobResult.job();
            sb.append("  [").append(jobResult.status()).append("] ")
                    .append(job.platform().displayName()).append(' ')
                    .append(job.deviceFolder()).append(' ')
                    .append(job.language())
                    .append(" (").append(seconds(jobResult.duration().toMillis())).append("s)\n");
            if (jobResult.errorMessage() != null) {
                sb.append("    Error: ").append(jobResult.errorMessage()).append('\n');
            }
            if (!jobResult.screenshots().isEmpty()) {
                sb.append("    Screenshots: ").append(jobResult.screenshots().size()).append('\n');
                int listed = 0;
                for (ScreenshotResult shot : jobResult.screenshots()) {
                    if (listed++ == SCREENSHOTS_LISTED_PER_JOB) {
                        sb.append("      ... and ").append(jobResult.screenshots().size() - SCREENSHOTS_LISTED_PER_JOB)
                                .append(" more\n");
                        break;
                    }
                    sb.append("      ").append(shot.success() ? "ok " : "bad ").append(shot.name()).append('\n');
                }
            }
            if (!jobResult.failureArtifacts().isEmpty()) {
                sb.append("    Failure Artifacts: ").append(jobResult.failureArtifacts().size()).append('\n');
                for (FailureArtifact artifact : jobResult.failureArtifacts()) {
                    sb.append("      ").append(artifact.type()).append(": ")
                            .append(artifact.path().getFileName()).append('\n');
                }
            }
            for (String warning : jobResult.warnings()) {
                sb.append("    Warning: ").append(warning).append('\n');
            }
        }
        sb.append('\n');
        if (result.success()) {
            sb.append("All jobs completed successfully.\n");
        } else {
            sb.append(s.failedJobs()).append(" job(s) failed, ").append(s.cancelledJobs())
                    .append(" cancelled. See failure artifacts above.\n");
        }
        return sb.toString();
    }

    private static String seconds(long millis) {
        return String.format(Locale.ROOT, "%.1f", millis / 1000.0d);
    }

    public record Written(Path manifest, Path summary) {
    }
}
