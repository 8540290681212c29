package io.shotmatrix.device;

import io.shotmatrix.config.RootConfig;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.runtime.CancellationToken;

import java.nio.file.Path;

/**
 * Platform tooling for one kind of simulator or emulator. Implementations raise
 * {@link io.shotmatrix.error.ProvisioningException} for setup failures and
 * {@link io.shotmatrix.error.ActionException} for screenshot failures.
 */
public interface DeviceDriver {
    Platform platform();

    /**
     * Boots the job's device and waits until it is usable.
     *
     * @return identifier used by the other calls (UDID, simulator name or adb serial)
     */
    String boot(RunJob job, CancellationToken token);

    void setLocale(String deviceId, String locale, CancellationToken token);

    /**
     * Clears application data so the next launch starts fresh.
     */
    void resetApp(String deviceId, String appIdentifier, CancellationToken token);

    void installApp(String deviceId, Path app, CancellationToken token);

    void applyStatusBar(String deviceId, RootConfig.StatusBar statusBar, CancellationToken token);

    /**
     * Writes a PNG of the current screen to {@code output}.
     */
    void takeScreenshot(String deviceId, Path output, CancellationToken token);

    String captureLogs(String deviceId);

    void shutdown(String deviceId);
}
