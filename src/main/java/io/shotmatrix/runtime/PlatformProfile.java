package io.shotmatrix.runtime;

import io.shotmatrix.automation.SessionCapabilities;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.config.Selector;
import io.shotmatrix.device.DeviceDriver;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;

import java.util.List;

/**
 * Everything that differs between iOS and Android jobs, chosen once per job.
 */
public abstract class PlatformProfile {
    private final DeviceDriver driver;

    protected PlatformProfile(DeviceDriver driver) {
        if (driver.platform() != platform()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " needs a " + platform().displayName()
                    + " driver, got " + driver.platform().displayName());
        }
        this.driver = driver;
    }

    public abstract Platform platform();

    public abstract SessionCapabilities capabilities(RunJob job, String deviceId, RootConfig config);

    public DeviceDriver driver() {
        return driver;
    }

    public String locale(RunJob job) {
        return job.locale();
    }

    /**
     * Bundle id or package name used to clear app state, if configured.
     */
    public String appIdentifier(RootConfig config) {
        RootConfig.PlatformBuildConfig build = config.buildConfigFor(platform());
        return build == null ? null : build.packageName();
    }

    public Selector assertion(ScreenshotPlan plan) {
        return plan.assertionFor(platform());
    }

    /**
     * Plan-level dismissors replace the global list rather than adding to it.
     */
    public List<Selector> dismissors(ScreenshotPlan plan, RootConfig config) {
        List<Selector> planLevel = plan.dismissorsFor(platform());
        return planLevel.isEmpty() ? config.globalDismissorsFor(platform()) : planLevel;
    }

    public RootConfig.DeviceSize expectedSize(RunJob job, RootConfig config) {
        return config.validation() == null ? null : config.validation().sizeFor(platform(), job.deviceFolder());
    }
}
