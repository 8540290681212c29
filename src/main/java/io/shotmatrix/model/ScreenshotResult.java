package io.shotmatrix.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One captured image. Width and height stay null until the validation pass has read them.
 */
public record ScreenshotResult(
        String name,
        String language,
        Path path,
        Integer width,
        Integer height,
        long sizeBytes,
        Instant capturedAt,
        boolean success,
        String errorMessage,
        String orientation
) {
    public static ScreenshotResult captured(String name, String language, Path path, long sizeBytes, String orientation) {
        return new ScreenshotResult(name, language, path, null, null, sizeBytes, Instant.now(), true, null, orientation);
    }

    public ScreenshotResult withDimensions(int width, int height) {
        return new ScreenshotResult(name, language, path, width, height, sizeBytes, capturedAt, success, errorMessage, orientation);
    }

    public ScreenshotResult withError(String error) {
        return new ScreenshotResult(name, language, path, width, height, sizeBytes, capturedAt, false, error, orientation);
    }

    public boolean hasDimensions() {
        return width != null && height != null;
    }
}
