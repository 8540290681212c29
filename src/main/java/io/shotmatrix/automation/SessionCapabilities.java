package io.shotmatrix.automation;

import io.shotmatrix.model.Platform;

import java.util.Map;

/**
 * Typed session settings per platform. Provider-specific keys go in {@link #extras()}.
 */
public interface SessionCapabilities {
    Platform platform();

    String deviceName();

    String app();

    String locale();

    Map<String, Object> extras();
}
