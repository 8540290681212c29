package io.shotmatrix.runtime;

import io.shotmatrix.automation.AndroidCapabilities;
import io.shotmatrix.automation.SessionCapabilities;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.device.DeviceDriver;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;

public final class AndroidProfile extends PlatformProfile {
    public AndroidProfile(DeviceDriver driver) {
        super(driver);
    }

    @Override
    public Platform platform() {
        return Platform.ANDROID;
    }

    @Override
    public SessionCapabilities capabilities(RunJob job, String deviceId, RootConfig config) {
        RootConfig.AndroidDevice device = job.androidDevice();
        return new AndroidCapabilities(
                device.name(),
                device.avd(),
                deviceId,
                device.platformVersion(),
                job.appPath() == null ? null : job.appPath().toString(),
                locale(job),
                job.ports().auxPortFor(Platform.ANDROID),
                config.capabilityExtrasFor(Platform.ANDROID)
        );
    }
}
