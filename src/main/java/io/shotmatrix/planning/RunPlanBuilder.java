package io.shotmatrix.planning;

import io.shotmatrix.build.ArtifactResolver;
import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.error.BuildRequiredException;
import io.shotmatrix.error.ConfigurationException;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands configuration into the ordered job list: platform, then device, then language.
 */
public final class RunPlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(RunPlanBuilder.class);

    private final ArtifactResolver artifactResolver;
    private final boolean requireArtifacts;
    private final int availableProcessors;

    public RunPlanBuilder(ArtifactResolver artifactResolver) {
        this(artifactResolver, true, Runtime.getRuntime().availableProcessors());
    }

    public RunPlanBuilder(ArtifactResolver artifactResolver, boolean requireArtifacts, int availableProcessors) {
        this.artifactResolver = artifactResolver;
        this.requireArtifacts = requireArtifacts;
        this.availableProcessors = Math.max(1, availableProcessors);
    }

    /**
     * Builder for matrix export and plan previews, where the app may not be built yet.
     * Jobs get an app path only when one is found.
     */
    public static RunPlanBuilder planOnly(ArtifactResolver artifactResolver) {
        return new RunPlanBuilder(artifactResolver, false, Runtime.getRuntime().availableProcessors());
    }

    public RunPlan build(
            RootConfig config,
            Path outputRoot,
            PlanFilters filters,
            PortAllocator ports,
            RunOverrides overrides
    ) {
        PlanFilters safeFilters = filters == null ? PlanFilters.none() : filters;
        RunOverrides safeOverrides = overrides == null ? RunOverrides.none() : overrides;
        Set<Platform> platforms = selectPlatforms(safeFilters);
        List<String> languages = selectLanguages(config, safeFilters);
        List<ScreenshotPlan> screenshots = selectScreenshots(config, safeFilters);

        List<DeviceSlot> slots = new ArrayList<>();
        if (platforms.contains(Platform.IOS)) {
            for (RootConfig.IosDevice device : config.devices().ios()) {
                if (safeFilters.allowsDevice(device.name(), device.folder())) {
                    slots.add(new DeviceSlot(Platform.IOS, device, null));
                }
            }
        }
        if (platforms.contains(Platform.ANDROID)) {
            for (RootConfig.AndroidDevice device : config.devices().android()) {
                if (safeFilters.allowsDevice(device.name(), device.folder())) {
                    slots.add(new DeviceSlot(Platform.ANDROID, null, device));
                }
            }
        }
        if (slots.isEmpty() || languages.isEmpty()) {
            throw new ConfigurationException("No jobs match the selected platforms, devices and languages");
        }

        Map<Platform, Path> artifacts = new EnumMap<>(Platform.class);
        Set<Platform> jobPlatforms = EnumSet.noneOf(Platform.class);
        for (DeviceSlot slot : slots) {
            if (jobPlatforms.add(slot.platform())) {
                Path artifact = resolveArtifact(config, slot.platform(), safeOverrides);
                if (artifact != null) {
                    artifacts.put(slot.platform(), artifact);
                }
            }
        }

        Path root = outputRoot.toAbsolutePath().normalize();
        List<RunJob> jobs = new ArrayList<>(slots.size() * languages.size());
        Set<String> deviceNames = new LinkedHashSet<>();
        for (DeviceSlot slot : slots) {
            for (String language : languages) {
                int index = jobs.size();
                String folder = slot.platform() == Platform.IOS ? slot.ios().folder() : slot.android().folder();
                Path outputDirectory = root.resolve(slot.platform().displayName()).resolve(folder).resolve(language);
                jobs.add(new RunJob(
                        index,
                        slot.platform(),
                        slot.ios(),
                        slot.android(),
                        language,
                        config.localeMapping().get(language),
                        screenshots,
                        outputDirectory,
                        ports.allocate(index),
                        artifacts.get(slot.platform())
                ));
                deviceNames.add(slot.platform().key() + ":" + folder);
            }
        }

        long lanes = jobs.stream().map(RunJob::deviceKey).distinct().count();
        int parallelism = (int) Math.max(1, Math.min(effectiveParallelism(jobs.size(), safeOverrides.maxParallelism()),
                lanes));
        long waves = (jobs.size() + parallelism - 1) / parallelism;
        Duration estimate = Defaults.ESTIMATED_JOB_DURATION.multipliedBy(waves);
        RunPlan plan = new RunPlan(
                jobs,
                jobPlatforms.size(),
                deviceNames.size(),
                languages.size(),
                screenshots.size(),
                estimate,
                artifacts
        );
        log.info("Planned {} jobs across {} platform(s), {} device(s), {} language(s); estimated {}",
                jobs.size(), plan.totalPlatforms(), plan.totalDevices(), plan.totalLanguages(), estimate);
        return plan;
    }

    int effectiveParallelism(int jobCount, Integer requested) {
        if (requested != null && requested > 0) {
            return Math.max(1, Math.min(requested, Math.max(1, jobCount)));
        }
        return Defaults.parallelismFor(jobCount, availableProcessors);
    }

    private Set<Platform> selectPlatforms(PlanFilters filters) {
        if (filters.platforms().isEmpty()) {
            return EnumSet.allOf(Platform.class);
        }
        Set<Platform> selected = EnumSet.noneOf(Platform.class);
        for (String raw : filters.platforms()) {
            try {
                selected.add(Platform.fromString(raw));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown platform filter '" + raw + "'; expected ios or android", e);
            }
        }
        return selected;
    }

    private List<String> selectLanguages(RootConfig config, PlanFilters filters) {
        List<String> out = new ArrayList<>();
        for (String language : config.languages()) {
            if (!filters.allowsLanguage(language)) {
                continue;
            }
            if (!config.localeMapping().containsKey(language)) {
                throw new ConfigurationException("Language '" + language + "' has no locale_mapping entry");
            }
            out.add(language);
        }
        return out;
    }

    private List<ScreenshotPlan> selectScreenshots(RootConfig config, PlanFilters filters) {
        List<ScreenshotPlan> out = new ArrayList<>();
        for (ScreenshotPlan plan : config.screenshots()) {
            if (filters.allowsScreenshot(plan.name())) {
                out.add(plan);
            }
        }
        if (out.isEmpty()) {
            throw new ConfigurationException(filters.screenshots().isEmpty()
                    ? "Configuration defines no screenshot plans"
                    : "Screenshot filter " + filters.screenshots() + " matches no configured plan");
        }
        return out;
    }

    private Path resolveArtifact(RootConfig config, Platform platform, RunOverrides overrides) {
        Path override = overrides.appPathFor(platform);
        if (override != null) {
            if (!Files.exists(override)) {
                throw new ConfigurationException(platform.displayName() + " app path does not exist: " + override);
            }
            return override.toAbsolutePath().normalize();
        }
        Optional<Path> resolved = artifactResolver == null
                ? Optional.empty()
                : artifactResolver.resolve(platform, config.buildConfigFor(platform));
        if (resolved.isEmpty() && requireArtifacts) {
            throw new BuildRequiredException(platform);
        }
        return resolved.orElse(null);
    }

    private record DeviceSlot(Platform platform, RootConfig.IosDevice ios, RootConfig.AndroidDevice android) {
    }
}
