package io.shotmatrix.runtime;

import io.shotmatrix.automation.AutomationSession;
import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.device.DeviceDriver;
import io.shotmatrix.model.FailureArtifact;
import io.shotmatrix.model.FailureArtifactType;
import io.shotmatrix.model.RunJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort diagnostics after a job failure. Every capture is independent of the others.
 */
final class FailureArtifactCollector {
    private static final Logger log = LoggerFactory.getLogger(FailureArtifactCollector.class);

    static final String PAGE_SOURCE_FILE = "page_source.xml";
    static final String SCREENSHOT_FILE = "failure_screenshot.png";
    static final String DEVICE_LOGS_FILE = "device_logs.txt";

    List<FailureArtifact> collect(
            RunJob job,
            RootConfig config,
            AutomationSession session,
            DeviceDriver driver,
            String deviceId
    ) {
        RootConfig.FailureArtifacts settings = config.failureArtifactsOrDefault();
        Path dir = artifactsDirectory(job, settings);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.debug("[{}] cannot create artifact directory {}: {}", job.jobId(), dir, e.getMessage());
            return List.of();
        }
        List<FailureArtifact> out = new ArrayList<>();
        if (settings.pageSourceEnabled() && session != null) {
            try {
                Path file = dir.resolve(PAGE_SOURCE_FILE);
                Files.writeString(file, session.pageSource(), StandardCharsets.UTF_8);
                out.add(artifact(FailureArtifactType.PAGE_SOURCE, file));
            } catch (IOException | RuntimeException e) {
                log.debug("[{}] page source capture failed: {}", job.jobId(), e.getMessage());
            }
        }
        if (settings.screenshotEnabled() && deviceId != null) {
            try {
                Path file = dir.resolve(SCREENSHOT_FILE);
                driver.takeScreenshot(deviceId, file, new CancellationToken());
                out.add(artifact(FailureArtifactType.SCREENSHOT, file));
            } catch (IOException | RuntimeException e) {
                log.debug("[{}] failure screenshot capture failed: {}", job.jobId(), e.getMessage());
            }
        }
        if (settings.deviceLogsEnabled() && deviceId != null) {
            try {
                Path file = dir.resolve(DEVICE_LOGS_FILE);
                Files.writeString(file, truncateLog(driver.captureLogs(deviceId)), StandardCharsets.UTF_8);
                out.add(artifact(FailureArtifactType.DEVICE_LOGS, file));
            } catch (IOException | RuntimeException e) {
                log.debug("[{}] device log capture failed: {}", job.jobId(), e.getMessage());
            }
        }
        if (!out.isEmpty()) {
            log.info("[{}] saved {} failure artifact(s) to {}", job.jobId(), out.size(), dir);
        }
        return out;
    }

    static Path artifactsDirectory(RunJob job, RootConfig.FailureArtifacts settings) {
        if (settings.artifactsDir() == null || settings.artifactsDir().isBlank()) {
            return job.outputDirectory().resolve("failure_artifacts");
        }
        // One sub folder per job under a shared directory.
        return Path.of(settings.artifactsDir()).toAbsolutePath().resolve(job.jobId());
    }

    /**
     * Keeps at most the last {@link Defaults#MAX_DEVICE_LOG_BYTES} UTF-8 bytes behind the truncation marker,
     * starting on a character boundary.
     */
    static String truncateLog(String logs) {
        if (logs == null) {
            return "";
        }
        byte[] bytes = logs.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= Defaults.MAX_DEVICE_LOG_BYTES) {
            return logs;
        }
        int start = bytes.length - Defaults.MAX_DEVICE_LOG_BYTES;
        // Skip continuation bytes of a character split by the cut.
        while (start < bytes.length && (bytes[start] & 0xC0) == 0x80) {
            start++;
        }
        return Defaults.LOG_TRUNCATION_MARKER + new String(bytes, start, bytes.length - start, StandardCharsets.UTF_8);
    }

    private static FailureArtifact artifact(FailureArtifactType type, Path file) throws IOException {
        return new FailureArtifact(type, file, Instant.now(), Files.size(file));
    }
}
