package io.shotmatrix.runtime;

import io.shotmatrix.automation.IosCapabilities;
import io.shotmatrix.automation.SessionCapabilities;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.device.DeviceDriver;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;

public final class IosProfile extends PlatformProfile {
    public IosProfile(DeviceDriver driver) {
        super(driver);
    }

    @Override
    public Platform platform() {
        return Platform.IOS;
    }

    @Override
    public SessionCapabilities capabilities(RunJob job, String deviceId, RootConfig config) {
        RootConfig.IosDevice device = job.iosDevice();
        return new IosCapabilities(
                device.name(),
                device.udid(),
                device.platformVersion(),
                job.appPath() == null ? null : job.appPath().toString(),
                locale(job),
                job.ports().auxPortFor(Platform.IOS),
                config.capabilityExtrasFor(Platform.IOS)
        );
    }
}
