package io.shotmatrix.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.shotmatrix.error.ConfigurationException;
import io.shotmatrix.model.Platform;
import io.shotmatrix.util.Hashing;
import io.shotmatrix.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Binds the JSON matrix configuration and checks it before any planning happens.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Set<String> ORIENTATIONS = Set.of("portrait", "landscape");

    public RootConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        RootConfig config;
        try {
            config = Jsons.mapper().readValue(file.toFile(), RootConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration file is empty: " + file);
        }
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration " + file, problems);
        }
        log.debug("Loaded configuration {} ({} iOS devices, {} Android devices, {} languages, {} screenshot plans)",
                file, config.devices().ios().size(), config.devices().android().size(),
                config.languages().size(), config.screenshots().size());
        return config;
    }

    /**
     * SHA-256 over the canonical, compact JSON form of the file, so formatting changes do not alter it.
     */
    public String fingerprint(Path file) {
        try {
            JsonNode tree = Jsons.mapper().readTree(file.toFile());
            return Hashing.sha256Hex(Jsons.toCompactJson(tree));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + file, e);
        }
    }

    public List<String> validate(RootConfig config) {
        List<String> problems = new ArrayList<>();
        validateLanguages(config, problems);
        validateDevices(config, problems);
        validateScreenshots(config, problems);
        validatePorts(config, problems);
        validateMisc(config, problems);
        return problems;
    }

    private void validateLanguages(RootConfig config, List<String> problems) {
        if (config.languages().isEmpty()) {
            problems.add("languages must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String language : config.languages()) {
            if (language == null || language.isBlank()) {
                problems.add("languages contains a blank entry");
                continue;
            }
            if (!seen.add(language)) {
                problems.add("duplicate language: " + language);
            }
            RootConfig.LocaleMapping mapping = config.localeMapping().get(language);
            if (mapping == null) {
                problems.add("language '" + language + "' has no locale_mapping entry");
            } else if (blank(mapping.ios()) || blank(mapping.android())) {
                problems.add("locale_mapping for '" + language + "' needs both ios and android values");
            }
        }
    }

    private void validateDevices(RootConfig config, List<String> problems) {
        RootConfig.Devices devices = config.devices();
        if (devices.ios().isEmpty() && devices.android().isEmpty()) {
            problems.add("at least one device is required under devices.ios or devices.android");
        }
        Set<String> folders = new HashSet<>();
        for (RootConfig.IosDevice device : devices.ios()) {
            if (device == null) {
                problems.add("devices.ios contains a null entry");
                continue;
            }
            if (blank(device.name())) {
                problems.add("iOS device name must not be blank");
            }
            checkFolder(device.folder(), "iOS device '" + device.name() + "'", folders, problems);
        }
        for (RootConfig.AndroidDevice device : devices.android()) {
            if (device == null) {
                problems.add("devices.android contains a null entry");
                continue;
            }
            if (blank(device.name())) {
                problems.add("Android device name must not be blank");
            }
            if (blank(device.avd())) {
                problems.add("Android device '" + device.name() + "' needs an avd");
            }
            checkFolder(device.folder(), "Android device '" + device.name() + "'", folders, problems);
        }
    }

    private void checkFolder(String folder, String owner, Set<String> folders, List<String> problems) {
        if (blank(folder)) {
            problems.add(owner + " needs a folder");
        } else if (!folders.add(folder)) {
            problems.add("device folder '" + folder + "' is used more than once");
        }
    }

    private void validateScreenshots(RootConfig config, List<String> problems) {
        if (config.screenshots().isEmpty()) {
            problems.add("screenshots must not be empty");
        }
        Set<String> names = new HashSet<>();
        for (ScreenshotPlan plan : config.screenshots()) {
            if (plan == null) {
                problems.add("screenshots contains a null entry");
                continue;
            }
            String label = "screenshot plan '" + plan.name() + "'";
            if (blank(plan.name())) {
                problems.add("screenshot plan name must not be blank");
            } else if (!names.add(plan.name())) {
                problems.add("duplicate screenshot plan name: " + plan.name());
            }
            if (plan.orientation() != null && !ORIENTATIONS.contains(plan.orientation().trim().toLowerCase(Locale.ROOT))) {
                problems.add(label + " has unsupported orientation '" + plan.orientation() + "'");
            }
            if (plan.actions().isEmpty()) {
                problems.add(label + " has no actions");
            }
            for (int i = 0; i < plan.actions().size(); i++) {
                validateAction(plan.actions().get(i), label + " action " + i, problems);
            }
            checkSelector(plan.assertionFor(Platform.IOS), label + " assert.ios", problems);
            checkSelector(plan.assertionFor(Platform.ANDROID), label + " assert.android", problems);
            for (Selector selector : plan.dismissorsFor(Platform.IOS)) {
                checkSelector(selector, label + " dismissors.ios", problems);
            }
            for (Selector selector : plan.dismissorsFor(Platform.ANDROID)) {
                checkSelector(selector, label + " dismissors.android", problems);
            }
        }
    }

    private void validateAction(ScreenshotPlan.ScreenshotAction action, String label, List<String> problems) {
        if (action == null) {
            problems.add(label + " is empty");
            return;
        }
        if (action.declaredTypes().size() != 1) {
            problems.add(label + " must declare exactly one of tap|wait|wait_for|capture");
            return;
        }
        switch (action.type()) {
            case TAP -> checkSelector(action.tap(), label + " tap", problems);
            case WAIT -> {
                Double seconds = action.pause().seconds();
                if (seconds != null && seconds < 0) {
                    problems.add(label + " wait seconds must not be negative");
                }
            }
            case WAIT_FOR -> {
                if (action.waitFor().selector() == null) {
                    problems.add(label + " wait_for needs a selector");
                } else {
                    checkSelector(action.waitFor().selector(), label + " wait_for", problems);
                }
                Integer timeout = action.waitFor().timeout();
                if (timeout != null && timeout <= 0) {
                    problems.add(label + " wait_for timeout must be positive");
                }
            }
            case CAPTURE -> {
                if (blank(action.capture().name())) {
                    problems.add(label + " capture needs a name");
                }
            }
        }
    }

    private void checkSelector(Selector selector, String label, List<String> problems) {
        if (selector == null) {
            return;
        }
        int count = selector.strategies().size();
        if (count != 1) {
            problems.add(label + " selector must set exactly one strategy, found " + count);
        }
    }

    private void validatePorts(RootConfig config, List<String> problems) {
        int base = config.basePort();
        int offset = config.portOffset();
        if (base < Defaults.MIN_PORT || base > Defaults.MAX_PORT) {
            problems.add("ports.base_port must be between " + Defaults.MIN_PORT + " and " + Defaults.MAX_PORT);
        }
        if (offset < Defaults.PORTS_PER_JOB || offset > Defaults.MAX_PORT_OFFSET) {
            problems.add("ports.port_offset must be between " + Defaults.PORTS_PER_JOB + " and " + Defaults.MAX_PORT_OFFSET);
        }
    }

    private void validateMisc(RootConfig config, List<String> problems) {
        if (config.appReset() != null) {
            try {
                RootConfig.AppReset.Policy.fromString(config.appReset().policy());
            } catch (IllegalArgumentException e) {
                problems.add("app_reset.policy: " + e.getMessage());
            }
        }
        RootConfig.Timeouts timeouts = config.timeouts();
        if (timeouts != null && timeouts.defaultWaitMs() != null && timeouts.defaultWaitMs() <= 0) {
            problems.add("timeouts.default_wait_ms must be positive");
        }
        for (Platform platform : Platform.values()) {
            for (Selector selector : config.globalDismissorsFor(platform)) {
                checkSelector(selector, "dismissors." + platform.key(), problems);
            }
        }
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
