package io.shotmatrix.model;

import java.nio.file.Path;

/**
 * Command-line values that take precedence over the configuration file.
 */
public record RunOverrides(
        Path iosAppPath,
        Path androidAppPath,
        Path outputDirectory,
        Integer basePort,
        String serverUrl,
        Integer maxParallelism,
        Path configFile
) {
    public static RunOverrides none() {
        return new RunOverrides(null, null, null, null, null, null, null);
    }

    public Path appPathFor(Platform platform) {
        return platform == Platform.IOS ? iosAppPath : androidAppPath;
    }

    public boolean externalServer() {
        return serverUrl != null && !serverUrl.isBlank();
    }
}
