package io.shotmatrix.automation;

import io.shotmatrix.model.Platform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AndroidCapabilities(
        String deviceName,
        String avd,
        String udid,
        String platformVersion,
        String app,
        String locale,
        int systemPort,
        Map<String, Object> extras
) implements SessionCapabilities {
    public AndroidCapabilities {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    @Override
    public Platform platform() {
        return Platform.ANDROID;
    }
}
