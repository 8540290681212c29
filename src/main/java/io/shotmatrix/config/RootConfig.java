package io.shotmatrix.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shotmatrix.model.Platform;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound form of the matrix configuration document. Keys in the file are snake_case.
 */
public record RootConfig(
        Devices devices,
        List<String> languages,
        @JsonProperty("locale_mapping") Map<String, LocaleMapping> localeMapping,
        List<ScreenshotPlan> screenshots,
        @JsonProperty("build_config") BuildConfig buildConfig,
        Timeouts timeouts,
        Ports ports,
        @JsonProperty("app_reset") AppReset appReset,
        @JsonProperty("failure_artifacts") FailureArtifacts failureArtifacts,
        @JsonProperty("status_bar") StatusBar statusBar,
        Validation validation,
        Capabilities capabilities,
        Dismissors dismissors
) {
    public RootConfig {
        devices = devices == null ? new Devices(List.of(), List.of()) : devices;
        languages = languages == null ? List.of() : List.copyOf(languages);
        localeMapping = localeMapping == null ? Map.of() : new LinkedHashMap<>(localeMapping);
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
    }

    public int basePort() {
        return ports == null || ports.basePort() == null ? Defaults.BASE_PORT : ports.basePort();
    }

    public int portOffset() {
        return ports == null || ports.portOffset() == null ? Defaults.PORT_OFFSET : ports.portOffset();
    }

    public AppReset.Policy resetPolicy() {
        return appReset == null ? AppReset.Policy.NEVER : AppReset.Policy.fromString(appReset.policy());
    }

    public FailureArtifacts failureArtifactsOrDefault() {
        return failureArtifacts == null ? FailureArtifacts.defaults() : failureArtifacts;
    }

    public PlatformBuildConfig buildConfigFor(Platform platform) {
        if (buildConfig == null) {
            return null;
        }
        return platform == Platform.IOS ? buildConfig.ios() : buildConfig.android();
    }

    public List<Selector> globalDismissorsFor(Platform platform) {
        if (dismissors == null) {
            return List.of();
        }
        List<Selector> selected = platform == Platform.IOS ? dismissors.ios() : dismissors.android();
        return selected == null ? List.of() : selected;
    }

    public Map<String, Object> capabilityExtrasFor(Platform platform) {
        if (capabilities == null) {
            return Map.of();
        }
        Map<String, Object> selected = platform == Platform.IOS ? capabilities.ios() : capabilities.android();
        return selected == null ? Map.of() : selected;
    }

    public record Devices(List<IosDevice> ios, List<AndroidDevice> android) {
        public Devices {
            ios = ios == null ? List.of() : List.copyOf(ios);
            android = android == null ? List.of() : List.copyOf(android);
        }
    }

    public record IosDevice(
            String name,
            String udid,
            String folder,
            @JsonProperty("platform_version") String platformVersion
    ) {
        /**
         * simctl accepts either the UDID or the simulator name.
         */
        public String reference() {
            return udid == null || udid.isBlank() ? name : udid;
        }
    }

    public record AndroidDevice(
            String name,
            String avd,
            String folder,
            @JsonProperty("platform_version") String platformVersion
    ) {
    }

    public record LocaleMapping(String ios, String android) {
        public String forPlatform(Platform platform) {
            return platform == Platform.IOS ? ios : android;
        }
    }

    public record BuildConfig(PlatformBuildConfig ios, PlatformBuildConfig android) {
    }

    public record PlatformBuildConfig(
            String project,
            @JsonProperty("artifact_glob") String artifactGlob,
            @JsonProperty("package") String packageName
    ) {
    }

    public record Timeouts(
            @JsonProperty("default_wait_ms") Integer defaultWaitMs,
            @JsonProperty("implicit_wait_ms") Integer implicitWaitMs,
            @JsonProperty("page_load_timeout_ms") Integer pageLoadTimeoutMs
    ) {
    }

    public record Ports(
            @JsonProperty("base_port") Integer basePort,
            @JsonProperty("port_offset") Integer portOffset
    ) {
    }

    public record AppReset(String policy) {
        public enum Policy {
            NEVER,
            ON_LANGUAGE_CHANGE,
            ALWAYS;

            public static Policy fromString(String raw) {
                if (raw == null || raw.isBlank()) {
                    return NEVER;
                }
                String value = raw.trim().toLowerCase().replace('-', '_');
                for (Policy policy : values()) {
                    if (policy.name().equalsIgnoreCase(value)) {
                        return policy;
                    }
                }
                throw new IllegalArgumentException("Unknown app reset policy: " + raw);
            }
        }
    }

    public record FailureArtifacts(
            @JsonProperty("save_page_source") Boolean savePageSource,
            @JsonProperty("save_screenshot") Boolean saveScreenshot,
            @JsonProperty("save_device_logs") Boolean saveDeviceLogs,
            @JsonProperty("artifacts_dir") String artifactsDir
    ) {
        public static FailureArtifacts defaults() {
            return new FailureArtifacts(true, true, true, null);
        }

        public boolean pageSourceEnabled() {
            return savePageSource == null || savePageSource;
        }

        public boolean screenshotEnabled() {
            return saveScreenshot == null || saveScreenshot;
        }

        public boolean deviceLogsEnabled() {
            return saveDeviceLogs == null || saveDeviceLogs;
        }
    }

    public record StatusBar(IosStatusBar ios, AndroidStatusBar android) {
    }

    public record IosStatusBar(
            String time,
            @JsonProperty("wifi_bars") Integer wifiBars,
            @JsonProperty("cellular_bars") Integer cellularBars,
            @JsonProperty("battery_state") String batteryState
    ) {
    }

    public record AndroidStatusBar(
            @JsonProperty("demo_mode") Boolean demoMode,
            String clock,
            Integer battery,
            String wifi,
            String notifications
    ) {
    }

    public record Validation(
            @JsonProperty("enforce_image_size") Boolean enforceImageSize,
            @JsonProperty("expected_sizes") ExpectedSizes expectedSizes
    ) {
        public boolean enforced() {
            return Boolean.TRUE.equals(enforceImageSize);
        }

        public DeviceSize sizeFor(Platform platform, String deviceFolder) {
            if (expectedSizes == null) {
                return null;
            }
            Map<String, DeviceSize> byFolder = platform == Platform.IOS ? expectedSizes.ios() : expectedSizes.android();
            return byFolder == null ? null : byFolder.get(deviceFolder);
        }
    }

    public record ExpectedSizes(Map<String, DeviceSize> ios, Map<String, DeviceSize> android) {
    }

    /**
     * Expected {@code [width, height]} per orientation.
     */
    public record DeviceSize(int[] portrait, int[] landscape) {
        public int[] forOrientation(String orientation) {
            if (orientation != null && "landscape".equalsIgnoreCase(orientation.trim())) {
                return landscape;
            }
            return portrait;
        }
    }

    public record Capabilities(Map<String, Object> ios, Map<String, Object> android) {
    }

    public record Dismissors(List<Selector> ios, List<Selector> android) {
    }
}
