package io.shotmatrix.model;

import java.nio.file.Path;
import java.time.Instant;

public record FailureArtifact(
        FailureArtifactType type,
        Path path,
        Instant capturedAt,
        long sizeBytes
) {
}
