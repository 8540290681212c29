package io.shotmatrix.device;

import java.time.Duration;

public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        Duration elapsed
) {
    public boolean ok() {
        return exitCode == 0;
    }

    /**
     * Single-line, length-capped error detail for exception messages.
     */
    public String errorSummary() {
        String raw = stderr == null || stderr.isBlank() ? stdout : stderr;
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= 512) {
            return normalized;
        }
        return normalized.substring(0, 512) + "...";
    }
}
