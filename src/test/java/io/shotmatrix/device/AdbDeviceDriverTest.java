package io.shotmatrix.device;

import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.runtime.CancellationToken;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class AdbDeviceDriverTest {

    @Test
    void emulatorPortsAreEvenAndWrapInsideTheConsoleRange() {
        Assertions.assertEquals(5554, AdbDeviceDriver.emulatorPortFor(0));
        Assertions.assertEquals(5556, AdbDeviceDriver.emulatorPortFor(1));
        Assertions.assertEquals(5680, AdbDeviceDriver.emulatorPortFor(63));
        Assertions.assertEquals(5554, AdbDeviceDriver.emulatorPortFor(64));
    }

    @Test
    void localeIsSetThroughSystemProperty() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner();

        new AdbDeviceDriver(runner, "emulator").setLocale("emulator-5554", "de_DE", new CancellationToken());

        Assertions.assertEquals(List.of(
                "adb -s emulator-5554 shell setprop persist.sys.locale de_DE",
                "adb -s emulator-5554 shell am broadcast -a android.intent.action.LOCALE_CHANGED"
        ), runner.joined());
    }

    @Test
    void failedSetpropIsProvisioningError() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner()
                .on("adb -s emulator-5554 shell setprop", 1, "", "device offline");
        AdbDeviceDriver driver = new AdbDeviceDriver(runner, "emulator");

        ProvisioningException e = Assertions.assertThrows(ProvisioningException.class,
                () -> driver.setLocale("emulator-5554", "de_DE", new CancellationToken()));
        Assertions.assertTrue(e.getMessage().contains("device offline"));
    }

    @Test
    void demoModeStatusBarSendsOneBroadcastPerSetting() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner();
        RootConfig.StatusBar statusBar = new RootConfig.StatusBar(null,
                new RootConfig.AndroidStatusBar(true, "1200", 100, "4", "false"));

        new AdbDeviceDriver(runner, "emulator").applyStatusBar("emulator-5554", statusBar, new CancellationToken());

        List<String> commands = runner.joined();
        Assertions.assertEquals(6, commands.size());
        Assertions.assertEquals("adb -s emulator-5554 shell settings put global sysui_demo_allowed 1", commands.get(0));
        Assertions.assertTrue(commands.get(1).endsWith("-e command enter"));
        Assertions.assertTrue(commands.get(2).endsWith("-e command clock -e hhmm 1200"));
        Assertions.assertTrue(commands.get(3).contains("-e level 100"));
        Assertions.assertTrue(commands.get(4).endsWith("-e wifi show -e level 4"));
        Assertions.assertTrue(commands.get(5).endsWith("-e visible false"));
    }

    @Test
    void demoModeIsSkippedUnlessEnabled() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner();
        RootConfig.StatusBar statusBar = new RootConfig.StatusBar(null,
                new RootConfig.AndroidStatusBar(false, "1200", null, null, null));

        new AdbDeviceDriver(runner, "emulator").applyStatusBar("emulator-5554", statusBar, new CancellationToken());

        Assertions.assertTrue(runner.commands.isEmpty());
    }

    @Test
    void screenshotIsCapturedOnDevicePulledAndRemoved() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-adb-shot-");
        try {
            ScriptedCommandRunner runner = new ScriptedCommandRunner()
                    .on("adb -s emulator-5554 pull", command -> {
                        SimctlDeviceDriverTest.writePng(Path.of(command.get(command.size() - 1)));
                        return ScriptedCommandRunner.result(0, "1 file pulled", "");
                    });
            Path output = dir.resolve("home_en-US.png");

            new AdbDeviceDriver(runner, "emulator").takeScreenshot("emulator-5554", output, new CancellationToken());

            Assertions.assertTrue(Files.exists(output));
            List<String> commands = runner.joined();
            Assertions.assertTrue(commands.get(0).contains("shell screencap -p"));
            Assertions.assertTrue(commands.get(1).contains(" pull "));
            Assertions.assertTrue(commands.get(2).contains("shell rm"));
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void resetClearsPackageData() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner();
        AdbDeviceDriver driver = new AdbDeviceDriver(runner, "emulator");

        driver.resetApp("emulator-5554", "com.example.app", new CancellationToken());
        driver.resetApp("emulator-5554", " ", new CancellationToken());

        Assertions.assertEquals(List.of("adb -s emulator-5554 shell pm clear com.example.app"), runner.joined());
    }

    @Test
    void installRejectsMissingApk() {
        AdbDeviceDriver driver = new AdbDeviceDriver(new ScriptedCommandRunner(), "emulator");

        Assertions.assertThrows(ProvisioningException.class,
                () -> driver.installApp("emulator-5554", Path.of("missing.apk"), new CancellationToken()));
    }

    @Test
    void logsFallBackToFailureText() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner()
                .on("adb -s emulator-5554 logcat", 1, "", "no devices/emulators found");

        String logs = new AdbDeviceDriver(runner, "emulator").captureLogs("emulator-5554");

        Assertions.assertTrue(logs.startsWith("Failed to capture Android logs"));
        Assertions.assertTrue(logs.contains("no devices"));
    }
}
