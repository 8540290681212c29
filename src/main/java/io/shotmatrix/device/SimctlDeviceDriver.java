package io.shotmatrix.device;

import com.fasterxml.jackson.databind.JsonNode;
import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.error.ActionException;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.runtime.CancellationToken;
import io.shotmatrix.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * iOS simulators through {@code xcrun simctl}.
 */
public final class SimctlDeviceDriver implements DeviceDriver {
    private static final Logger log = LoggerFactory.getLogger(SimctlDeviceDriver.class);

    private final CommandRunner runner;

    public SimctlDeviceDriver(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public Platform platform() {
        return Platform.IOS;
    }

    @Override
    public String boot(RunJob job, CancellationToken token) {
        String device = job.iosDevice().reference();
        // A stale simulator from an earlier run would reject the boot.
        simctlQuietly(List.of("shutdown", device));
        CommandResult boot = simctl(List.of("boot", device), Defaults.DEVICE_OPERATION_TIMEOUT, token);
        if (!boot.ok() && !boot.errorSummary().contains("current state: Booted")) {
            throw new ProvisioningException("Failed to boot simulator " + device + ": " + boot.errorSummary());
        }
        long deadline = System.nanoTime() + Defaults.DEVICE_OPERATION_TIMEOUT.toNanos();
        try {
            while (!isBooted(device, token)) {
                if (System.nanoTime() >= deadline) {
                    throw new ProvisioningException("Simulator " + device + " did not reach Booted within "
                            + Defaults.DEVICE_OPERATION_TIMEOUT);
                }
                token.sleep(Defaults.DEVICE_POLL_INTERVAL);
            }
        } catch (RuntimeException e) {
            // No ManagedDevice owns this simulator yet.
            simctlQuietly(List.of("shutdown", device));
            throw e;
        }
        log.info("Simulator {} booted", device);
        return device;
    }

    @Override
    public void setLocale(String deviceId, String locale, CancellationToken token) {
        require(simctl(List.of("spawn", deviceId, "defaults", "write", "-g", "AppleLanguages", "-array", locale),
                Defaults.SHORT_OPERATION_TIMEOUT, token), "set AppleLanguages on " + deviceId);
        require(simctl(List.of("spawn", deviceId, "defaults", "write", "-g", "AppleLocale", locale),
                Defaults.SHORT_OPERATION_TIMEOUT, token), "set AppleLocale on " + deviceId);
    }

    @Override
    public void resetApp(String deviceId, String appIdentifier, CancellationToken token) {
        if (appIdentifier == null || appIdentifier.isBlank()) {
            log.debug("No bundle id configured, skipping reset on {}", deviceId);
            return;
        }
        CommandResult uninstall = simctl(List.of("uninstall", deviceId, appIdentifier), Defaults.SHORT_OPERATION_TIMEOUT, token);
        if (!uninstall.ok()) {
            log.debug("uninstall {} on {} failed: {}", appIdentifier, deviceId, uninstall.errorSummary());
        }
        CommandResult privacy = simctl(List.of("privacy", deviceId, "reset", "all", appIdentifier),
                Defaults.SHORT_OPERATION_TIMEOUT, token);
        if (!privacy.ok()) {
            log.debug("privacy reset {} on {} failed: {}", appIdentifier, deviceId, privacy.errorSummary());
        }
    }

    @Override
    public void installApp(String deviceId, Path app, CancellationToken token) {
        if (app == null || !Files.exists(app)) {
            throw new ProvisioningException("iOS app not found: " + app);
        }
        require(simctl(List.of("install", deviceId, app.toString()), Defaults.DEVICE_OPERATION_TIMEOUT, token),
                "install " + app.getFileName() + " on " + deviceId);
    }

    @Override
    public void applyStatusBar(String deviceId, RootConfig.StatusBar statusBar, CancellationToken token) {
        RootConfig.IosStatusBar ios = statusBar == null ? null : statusBar.ios();
        if (ios == null) {
            return;
        }
        List<String> args = new ArrayList<>(List.of("status_bar", deviceId, "override"));
        if (ios.time() != null) {
            args.addAll(List.of("--time", ios.time()));
        }
        if (ios.wifiBars() != null) {
            args.addAll(List.of("--wifiBars", String.valueOf(ios.wifiBars())));
        }
        if (ios.cellularBars() != null) {
            args.addAll(List.of("--cellularBars", String.valueOf(ios.cellularBars())));
        }
        if (ios.batteryState() != null) {
            args.addAll(List.of("--batteryState", ios.batteryState()));
        }
        if (args.size() == 3) {
            return;
        }
        require(simctl(args, Defaults.SHORT_OPERATION_TIMEOUT, token), "override status bar on " + deviceId);
    }

    @Override
    public void takeScreenshot(String deviceId, Path output, CancellationToken token) {
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new ActionException("Cannot create screenshot directory for " + output, e);
        }
        CommandResult result;
        try {
            result = simctl(List.of("io", deviceId, "screenshot", output.toString()), Defaults.SHORT_OPERATION_TIMEOUT, token);
        } catch (ProvisioningException e) {
            throw new ActionException("Screenshot failed on " + deviceId + ": " + e.getMessage(), e);
        }
        if (!result.ok() || !Files.exists(output)) {
            throw new ActionException("Screenshot failed on " + deviceId + ": " + result.errorSummary());
        }
    }

    @Override
    public String captureLogs(String deviceId) {
        try {
            CommandResult result = runner.run(List.of("xcrun", "simctl", "spawn", deviceId, "log", "show",
                    "--style", "compact", "--last", "5m"), Defaults.SHORT_OPERATION_TIMEOUT, null);
            return result.ok() ? result.stdout() : "Failed to capture iOS logs: " + result.errorSummary();
        } catch (TimeoutException | RuntimeException e) {
            return "Failed to capture iOS logs: " + e.getMessage();
        }
    }

    @Override
    public void shutdown(String deviceId) {
        CommandResult result = simctlQuietly(List.of("shutdown", deviceId));
        if (result != null && !result.ok() && !result.errorSummary().contains("current state: Shutdown")) {
            throw new ProvisioningException("Failed to shut down simulator " + deviceId + ": " + result.errorSummary());
        }
    }

    private boolean isBooted(String device, CancellationToken token) {
        CommandResult list = simctl(List.of("list", "devices", "-j"), Defaults.SHORT_OPERATION_TIMEOUT, token);
        if (!list.ok()) {
            return false;
        }
        try {
            JsonNode runtimes = Jsons.mapper().readTree(list.stdout()).path("devices");
            for (JsonNode devices : runtimes) {
                for (JsonNode entry : devices) {
                    boolean matches = device.equals(entry.path("udid").asText())
                            || device.equals(entry.path("name").asText());
                    if (matches && "Booted".equals(entry.path("state").asText())) {
                        return true;
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Unreadable simctl device list: {}", e.getMessage());
        }
        return false;
    }

    private CommandResult simctl(List<String> args, Duration timeout, CancellationToken token) {
        List<String> command = new ArrayList<>(List.of("xcrun", "simctl"));
        command.addAll(args);
        try {
            return runner.run(command, timeout, token);
        } catch (TimeoutException e) {
            throw new ProvisioningException(e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new ProvisioningException("xcrun is not available: " + e.getMessage(), e);
        }
    }

    private CommandResult simctlQuietly(List<String> args) {
        try {
            return simctl(args, Defaults.SHORT_OPERATION_TIMEOUT, null);
        } catch (ProvisioningException e) {
            log.debug("simctl {} failed: {}", args.get(0), e.getMessage());
            return null;
        }
    }

    private static void require(CommandResult result, String what) {
        if (!result.ok()) {
            throw new ProvisioningException("Failed to " + what + ": " + result.errorSummary());
        }
    }
}
