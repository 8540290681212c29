package io.shotmatrix.automation;

import io.appium.java_client.android.options.UiAutomator2Options;
import io.appium.java_client.ios.options.XCUITestOptions;
import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.device.AdbDeviceDriver;
import io.shotmatrix.device.CommandRunner;
import io.shotmatrix.device.SimctlDeviceDriver;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.runtime.AndroidProfile;
import io.shotmatrix.runtime.IosProfile;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

final class AppiumSessionProviderTest {
    private final RootConfig config = ConfigFixtures.config();

    @Test
    void iosSessionUsesTheJobsOwnWebDriverAgentPort() {
        RunJob job = ConfigFixtures.iosJob(config, 1, "de-DE", Path.of("out"), List.of(), Path.of("App.app"));
        IosCapabilities caps = (IosCapabilities) new IosProfile(new SimctlDeviceDriver(new CommandRunner()))
                .capabilities(job, "SIM-UDID-1", config);

        XCUITestOptions options = AppiumSessionProvider.iosOptions(caps);

        Assertions.assertEquals(4734, caps.wdaLocalPort());
        Assertions.assertEquals(4734, options.getCapability("appium:wdaLocalPort"));
        Assertions.assertEquals("SIM-UDID-1", options.getCapability("appium:udid"));
        Assertions.assertEquals("de_DE", options.getCapability("appium:locale"));
    }

    @Test
    void androidSessionUsesTheJobsOwnSystemPort() {
        RunJob job = ConfigFixtures.androidJob(config, 2, "en-US", Path.of("out"), List.of(), Path.of("app.apk"));
        AndroidCapabilities caps = (AndroidCapabilities) new AndroidProfile(new AdbDeviceDriver(new CommandRunner(), "emulator"))
                .capabilities(job, "emulator-5558", config);

        UiAutomator2Options options = AppiumSessionProvider.androidOptions(caps);

        Assertions.assertEquals(4745, caps.systemPort());
        Assertions.assertEquals(4745, options.getCapability("appium:systemPort"));
        Assertions.assertEquals("Pixel_7_API_34", options.getCapability("appium:avd"));
    }

    @Test
    void parallelJobsNeverShareAnAuxiliaryPort() {
        RunJob first = ConfigFixtures.iosJob(config, 0, "en-US", Path.of("out"), List.of(), null);
        RunJob second = ConfigFixtures.iosJob(config, 1, "de-DE", Path.of("out"), List.of(), null);
        IosProfile profile = new IosProfile(new SimctlDeviceDriver(new CommandRunner()));

        Object firstPort = AppiumSessionProvider.iosOptions(
                (IosCapabilities) profile.capabilities(first, "SIM-UDID-1", config)).getCapability("appium:wdaLocalPort");
        Object secondPort = AppiumSessionProvider.iosOptions(
                (IosCapabilities) profile.capabilities(second, "SIM-UDID-1", config)).getCapability("appium:wdaLocalPort");

        Assertions.assertEquals(4724, firstPort);
        Assertions.assertNotEquals(firstPort, secondPort);
    }
}
