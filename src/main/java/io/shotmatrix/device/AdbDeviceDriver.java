package io.shotmatrix.device;

import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.error.ActionException;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Android emulators through the SDK {@code emulator} binary and {@code adb}.
 */
public final class AdbDeviceDriver implements DeviceDriver {
    private static final Logger log = LoggerFactory.getLogger(AdbDeviceDriver.class);
    private static final String DEVICE_SCREENSHOT_PATH = "/sdcard/shotmatrix_screen.png";

    private final CommandRunner runner;
    private final String emulatorBinary;
    private final Map<String, Process> emulators = new ConcurrentHashMap<>();

    public AdbDeviceDriver(CommandRunner runner) {
        this(runner, defaultEmulatorBinary());
    }

    public AdbDeviceDriver(CommandRunner runner, String emulatorBinary) {
        this.runner = runner;
        this.emulatorBinary = emulatorBinary;
    }

    @Override
    public Platform platform() {
        return Platform.ANDROID;
    }

    /**
     * Console ports must be even, and each job owns its own, so parallel jobs never race for one.
     */
    public static int emulatorPortFor(int jobIndex) {
        int slots = (Defaults.EMULATOR_END_PORT - Defaults.EMULATOR_START_PORT) / 2 + 1;
        return Defaults.EMULATOR_START_PORT + 2 * (jobIndex % slots);
    }

    @Override
    public String boot(RunJob job, CancellationToken token) {
        int port = emulatorPortFor(job.index());
        String serial = "emulator-" + port;
        String avd = job.androidDevice().avd();
        Process process;
        try {
            process = runner.start(List.of(emulatorBinary, "-avd", avd, "-port", String.valueOf(port),
                    "-no-window", "-no-audio", "-no-snapshot-save"));
        } catch (UncheckedIOException e) {
            throw new ProvisioningException("Failed to start emulator " + avd + ": " + e.getMessage(), e);
        }
        emulators.put(serial, process);
        try {
            awaitBoot(serial, avd, process, token);
        } catch (RuntimeException e) {
            // The device never became usable, so nobody else will stop it.
            emulators.remove(serial);
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
        log.info("Emulator {} ({}) booted", serial, avd);
        return serial;
    }

    @Override
    public void setLocale(String deviceId, String locale, CancellationToken token) {
        require(adb(deviceId, List.of("shell", "setprop", "persist.sys.locale", locale), token),
                "set locale " + locale + " on " + deviceId);
        CommandResult broadcast = adb(deviceId, List.of("shell", "am", "broadcast", "-a",
                "android.intent.action.LOCALE_CHANGED"), token);
        if (!broadcast.ok()) {
            log.debug("LOCALE_CHANGED broadcast failed on {}: {}", deviceId, broadcast.errorSummary());
        }
    }

    @Override
    public void resetApp(String deviceId, String appIdentifier, CancellationToken token) {
        if (appIdentifier == null || appIdentifier.isBlank()) {
            log.debug("No package configured, skipping reset on {}", deviceId);
            return;
        }
        CommandResult clear = adb(deviceId, List.of("shell", "pm", "clear", appIdentifier), token);
        if (!clear.ok()) {
            // Not installed yet.
            log.debug("pm clear {} on {} failed: {}", appIdentifier, deviceId, clear.errorSummary());
        }
    }

    @Override
    public void installApp(String deviceId, Path app, CancellationToken token) {
        if (app == null || !Files.isRegularFile(app)) {
            throw new ProvisioningException("Android APK not found: " + app);
        }
        require(adb(deviceId, List.of("install", "-r", app.toString()), Defaults.DEVICE_OPERATION_TIMEOUT, token),
                "install " + app.getFileName() + " on " + deviceId);
    }

    @Override
    public void applyStatusBar(String deviceId, RootConfig.StatusBar statusBar, CancellationToken token) {
        RootConfig.AndroidStatusBar android = statusBar == null ? null : statusBar.android();
        if (android == null || !Boolean.TRUE.equals(android.demoMode())) {
            return;
        }
        require(adb(deviceId, List.of("shell", "settings", "put", "global", "sysui_demo_allowed", "1"), token),
                "enable demo mode on " + deviceId);
        List<List<String>> commands = new ArrayList<>();
        commands.add(demo("enter"));
        if (android.clock() != null) {
            commands.add(demo("clock", "-e", "hhmm", android.clock()));
        }
        if (android.battery() != null) {
            commands.add(demo("battery", "-e", "level", String.valueOf(android.battery()), "-e", "plugged", "false"));
        }
        if (android.wifi() != null) {
            commands.add(demo("network", "-e", "wifi", "show", "-e", "level", android.wifi()));
        }
        if (android.notifications() != null) {
            commands.add(demo("notifications", "-e", "visible", android.notifications()));
        }
        for (List<String> command : commands) {
            CommandResult result = adb(deviceId, command, token);
            if (!result.ok()) {
                log.warn("Demo mode command {} failed on {}: {}", command.get(command.size() - 1), deviceId, result.errorSummary());
            }
        }
    }

    @Override
    public void takeScreenshot(String deviceId, Path output, CancellationToken token) {
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            requireAction(adb(deviceId, List.of("shell", "screencap", "-p", DEVICE_SCREENSHOT_PATH), token), "screencap");
            requireAction(adb(deviceId, List.of("pull", DEVICE_SCREENSHOT_PATH, output.toString()), token), "pull screenshot");
        } catch (IOException e) {
            throw new ActionException("Cannot create screenshot directory for " + output, e);
        } catch (ProvisioningException e) {
            throw new ActionException("Screenshot failed on " + deviceId + ": " + e.getMessage(), e);
        }
        CommandResult cleanup = adb(deviceId, List.of("shell", "rm", DEVICE_SCREENSHOT_PATH), token);
        if (!cleanup.ok()) {
            log.debug("Could not remove device screenshot on {}", deviceId);
        }
        if (!Files.exists(output)) {
            throw new ActionException("Screenshot was not created at " + output);
        }
    }

    @Override
    public String captureLogs(String deviceId) {
        try {
            CommandResult result = runner.run(List.of("adb", "-s", deviceId, "logcat", "-d", "-v", "time", "*:W",
                    "System.err:V"), Defaults.SHORT_OPERATION_TIMEOUT, null);
            return result.ok() ? result.stdout() : "Failed to capture Android logs: " + result.errorSummary();
        } catch (TimeoutException | RuntimeException e) {
            return "Failed to capture Android logs: " + e.getMessage();
        }
    }

    @Override
    public void shutdown(String deviceId) {
        ProvisioningException failure = null;
        try {
            CommandResult kill = adb(deviceId, List.of("emu", "kill"), null);
            if (!kill.ok()) {
                failure = new ProvisioningException("emu kill failed for " + deviceId + ": " + kill.errorSummary());
            }
        } catch (ProvisioningException e) {
            failure = e;
        }
        Process process = emulators.remove(deviceId);
        if (process != null && process.isAlive()) {
            try {
                if (!process.waitFor(10, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
            return;
        }
        if (failure != null && process == null) {
            throw failure;
        }
    }

    private void awaitBoot(String serial, String avd, Process process, CancellationToken token) {
        long deadline = System.nanoTime() + Defaults.DEVICE_OPERATION_TIMEOUT.toNanos();
        while (!bootCompleted(serial, token)) {
            if (!process.isAlive()) {
                throw new ProvisioningException("Emulator " + avd + " exited during boot with code " + process.exitValue());
            }
            if (System.nanoTime() >= deadline) {
                throw new ProvisioningException("Emulator " + serial + " did not finish booting within "
                        + Defaults.DEVICE_OPERATION_TIMEOUT);
            }
            token.sleep(Defaults.DEVICE_POLL_INTERVAL);
        }
    }

    private boolean bootCompleted(String serial, CancellationToken token) {
        try {
            CommandResult result = adb(serial, List.of("shell", "getprop", "sys.boot_completed"), token);
            return result.ok() && "1".equals(result.stdout().trim());
        } catch (ProvisioningException e) {
            log.debug("boot probe for {} failed: {}", serial, e.getMessage());
            return false;
        }
    }

    private static List<String> demo(String command, String... extras) {
        List<String> out = new ArrayList<>(List.of("shell", "am", "broadcast", "-a", "com.android.systemui.demo",
                "-e", "command", command));
        out.addAll(List.of(extras));
        return out;
    }

    private CommandResult adb(String serial, List<String> args, CancellationToken token) {
        return adb(serial, args, Defaults.SHORT_OPERATION_TIMEOUT, token);
    }

    private CommandResult adb(String serial, List<String> args, Duration timeout, CancellationToken token) {
        List<String> command = new ArrayList<>(List.of("adb", "-s", serial));
        command.addAll(args);
        try {
            return runner.run(command, timeout, token);
        } catch (TimeoutException e) {
            throw new ProvisioningException(e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new ProvisioningException("adb is not available: " + e.getMessage(), e);
        }
    }

    private static void require(CommandResult result, String what) {
        if (!result.ok()) {
            throw new ProvisioningException("Failed to " + what + ": " + result.errorSummary());
        }
    }

    private static void requireAction(CommandResult result, String what) {
        if (!result.ok()) {
            throw new ActionException("Failed to " + what + ": " + result.errorSummary());
        }
    }

    private static String defaultEmulatorBinary() {
        String androidHome = System.getenv("ANDROID_HOME");
        if (androidHome == null || androidHome.isBlank()) {
            androidHome = System.getenv("ANDROID_SDK_ROOT");
        }
        if (androidHome == null || androidHome.isBlank()) {
            return "emulator";
        }
        return Path.of(androidHome, "emulator", "emulator").toString();
    }
}
