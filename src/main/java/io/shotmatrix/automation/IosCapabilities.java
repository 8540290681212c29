package io.shotmatrix.automation;

import io.shotmatrix.model.Platform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record IosCapabilities(
        String deviceName,
        String udid,
        String platformVersion,
        String app,
        String locale,
        int wdaLocalPort,
        Map<String, Object> extras
) implements SessionCapabilities {
    public IosCapabilities {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    @Override
    public Platform platform() {
        return Platform.IOS;
    }
}
