package io.shotmatrix.model;

public record EnvironmentInfo(
        String operatingSystem,
        String javaVersion,
        String hostname,
        String workingDirectory,
        String toolVersion,
        String configHash
) {
}
