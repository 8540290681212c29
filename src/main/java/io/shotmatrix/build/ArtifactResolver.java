package io.shotmatrix.build;

import io.shotmatrix.config.RootConfig;
import io.shotmatrix.model.Platform;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates an already built application binary. Building is out of scope.
 */
public interface ArtifactResolver {
    Optional<Path> resolve(Platform platform, RootConfig.PlatformBuildConfig buildConfig);
}
