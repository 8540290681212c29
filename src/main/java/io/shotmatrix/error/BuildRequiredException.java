package io.shotmatrix.error;

import io.shotmatrix.model.Platform;

public final class BuildRequiredException extends ConfigurationException {
    private final Platform platform;

    public BuildRequiredException(Platform platform) {
        super("No application artifact found for " + platform.displayName()
                + "; pass --" + platform.key() + "-app or build the app first");
        this.platform = platform;
    }

    public Platform platform() {
        return platform;
    }
}
