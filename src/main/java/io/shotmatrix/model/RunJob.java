package io.shotmatrix.model;

import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One cell of the matrix: a device, a language and the screenshot plans to run there.
 */
public record RunJob(
        int index,
        Platform platform,
        RootConfig.IosDevice iosDevice,
        RootConfig.AndroidDevice androidDevice,
        String language,
        RootConfig.LocaleMapping localeMapping,
        List<ScreenshotPlan> screenshots,
        Path outputDirectory,
        PortAllocation ports,
        Path appPath
) {
    public RunJob {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(ports, "ports");
        if (index < 0) {
            throw new IllegalArgumentException("job index must be >= 0: " + index);
        }
        if (platform == Platform.IOS && (iosDevice == null || androidDevice != null)) {
            throw new IllegalArgumentException("iOS job needs exactly an iOS device");
        }
        if (platform == Platform.ANDROID && (androidDevice == null || iosDevice != null)) {
            throw new IllegalArgumentException("Android job needs exactly an Android device");
        }
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
    }

    public String jobId() {
        return "job-" + index;
    }

    public String deviceName() {
        return platform == Platform.IOS ? iosDevice.name() : androidDevice.name();
    }

    public String deviceFolder() {
        return platform == Platform.IOS ? iosDevice.folder() : androidDevice.folder();
    }

    /**
     * Identifies the simulator or AVD this job boots. Jobs sharing a key must not run at the same time.
     */
    public String deviceKey() {
        if (platform == Platform.IOS) {
            return "ios/" + iosDevice.reference();
        }
        String avd = androidDevice.avd();
        return "android/" + (avd == null || avd.isBlank() ? androidDevice.name() : avd);
    }

    public String platformVersion() {
        return platform == Platform.IOS ? iosDevice.platformVersion() : androidDevice.platformVersion();
    }

    public String locale() {
        return localeMapping == null ? language : localeMapping.forPlatform(platform);
    }

    public String describe() {
        return jobId() + " " + platform.displayName() + "/" + deviceName() + "/" + language;
    }
}
