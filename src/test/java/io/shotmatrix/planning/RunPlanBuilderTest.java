package io.shotmatrix.planning;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.ConfigFixtures;
import io.shotmatrix.build.ArtifactResolver;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.error.BuildRequiredException;
import io.shotmatrix.error.ConfigurationException;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.PortAllocation;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

final class RunPlanBuilderTest {
    private static final Path OUTPUT = Path.of("build", "screens");
    private static final ArtifactResolver FOUND = (platform, build) ->
            Optional.of(Path.of("/builds", platform == Platform.IOS ? "App.app" : "app-release.apk"));
    private static final ArtifactResolver MISSING = (platform, build) -> Optional.empty();

    @Test
    void oneDevicePerPlatformAndTwoLanguagesYieldFourJobs() {
        RunPlan plan = new RunPlanBuilder(FOUND, true, 8)
                .build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), RunOverrides.none());

        Assertions.assertEquals(4, plan.size());
        List<RunJob> jobs = plan.jobs();
        for (int i = 0; i < jobs.size(); i++) {
            Assertions.assertEquals(i, jobs.get(i).index());
            Assertions.assertEquals("job-" + i, jobs.get(i).jobId());
        }
        Assertions.assertEquals(Platform.IOS, jobs.get(0).platform());
        Assertions.assertEquals("en-US", jobs.get(0).language());
        Assertions.assertEquals("de-DE", jobs.get(1).language());
        Assertions.assertEquals(Platform.ANDROID, jobs.get(2).platform());
        Assertions.assertEquals("Pixel 7", jobs.get(3).deviceName());

        List<PortAllocation> ports = jobs.stream().map(RunJob::ports).toList();
        Assertions.assertTrue(PortAllocator.allDisjoint(ports));
        Assertions.assertEquals(4753, jobs.get(3).ports().automationPort());

        Path root = OUTPUT.toAbsolutePath().normalize();
        Assertions.assertEquals(root.resolve("iOS").resolve("iphone_15_pro").resolve("en-US"), jobs.get(0).outputDirectory());
        Assertions.assertEquals(root.resolve("Android").resolve("pixel_7").resolve("de-DE"), jobs.get(3).outputDirectory());

        Assertions.assertEquals(2, plan.totalPlatforms());
        Assertions.assertEquals(2, plan.totalDevices());
        Assertions.assertEquals(2, plan.totalLanguages());
        Assertions.assertEquals(2, plan.totalScreenshots());
        // Two devices, two languages each: the second job on each device waits for the first.
        Assertions.assertEquals(Duration.ofMinutes(4), plan.estimatedDuration());
        Assertions.assertEquals(Path.of("/builds", "App.app"), plan.artifactPaths().get(Platform.IOS));
        Assertions.assertEquals(Path.of("/builds", "app-release.apk"), jobs.get(2).appPath());
    }

    @Test
    void iosFilterProducesNoAndroidJobs() {
        PlanFilters filters = new PlanFilters(List.of("ios"), null, null, null);

        RunPlan plan = new RunPlanBuilder(FOUND, true, 8)
                .build(ConfigFixtures.config(), OUTPUT, filters, new PortAllocator(), RunOverrides.none());

        Assertions.assertEquals(2, plan.size());
        Assertions.assertTrue(plan.jobs().stream().allMatch(job -> job.platform() == Platform.IOS));
        Assertions.assertEquals(List.of(0, 1), plan.jobs().stream().map(RunJob::index).toList());
        Assertions.assertEquals(1, plan.totalPlatforms());
        Assertions.assertFalse(plan.artifactPaths().containsKey(Platform.ANDROID));
    }

    @Test
    void filtersKeepIndicesContiguous() {
        PlanFilters filters = new PlanFilters(null, List.of("pixel_7"), List.of("de-DE"), List.of("settings"));

        RunPlan plan = new RunPlanBuilder(FOUND, true, 8)
                .build(ConfigFixtures.config(), OUTPUT, filters, new PortAllocator(), RunOverrides.none());

        Assertions.assertEquals(1, plan.size());
        RunJob job = plan.jobs().get(0);
        Assertions.assertEquals(0, job.index());
        Assertions.assertEquals(Platform.ANDROID, job.platform());
        Assertions.assertEquals("de-DE", job.language());
        Assertions.assertEquals("de_DE", job.locale());
        Assertions.assertEquals(List.of("settings"), job.screenshots().stream().map(s -> s.name()).toList());
        Assertions.assertEquals(4723, job.ports().automationPort());
    }

    @Test
    void unknownPlatformFilterIsAConfigurationError() {
        PlanFilters filters = new PlanFilters(List.of("windows"), null, null, null);
        RunPlanBuilder builder = new RunPlanBuilder(FOUND, true, 8);

        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class, () ->
                builder.build(ConfigFixtures.config(), OUTPUT, filters, new PortAllocator(), RunOverrides.none()));
        Assertions.assertTrue(e.getMessage().contains("windows"));
    }

    @Test
    void languageWithoutLocaleMappingIsAConfigurationError() {
        ObjectNode tree = ConfigFixtures.tree();
        ((ObjectNode) tree.get("locale_mapping")).remove("de-DE");
        RootConfig config = ConfigFixtures.bind(tree);
        RunPlanBuilder builder = new RunPlanBuilder(FOUND, true, 8);

        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class, () ->
                builder.build(config, OUTPUT, PlanFilters.none(), new PortAllocator(), RunOverrides.none()));
        Assertions.assertTrue(e.getMessage().contains("de-DE"));
    }

    @Test
    void screenshotFilterMatchingNothingIsAConfigurationError() {
        PlanFilters filters = new PlanFilters(null, null, null, List.of("checkout"));
        RunPlanBuilder builder = new RunPlanBuilder(FOUND, true, 8);

        Assertions.assertThrows(ConfigurationException.class, () ->
                builder.build(ConfigFixtures.config(), OUTPUT, filters, new PortAllocator(), RunOverrides.none()));
    }

    @Test
    void missingArtifactRequiresBuild() {
        RunPlanBuilder builder = new RunPlanBuilder(MISSING, true, 8);

        BuildRequiredException e = Assertions.assertThrows(BuildRequiredException.class, () ->
                builder.build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), RunOverrides.none()));
        Assertions.assertEquals(Platform.IOS, e.platform());
    }

    @Test
    void planOnlyBuilderToleratesMissingArtifacts() {
        RunPlan plan = RunPlanBuilder.planOnly(MISSING)
                .build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), RunOverrides.none());

        Assertions.assertEquals(4, plan.size());
        Assertions.assertTrue(plan.artifactPaths().isEmpty());
        Assertions.assertTrue(plan.jobs().stream().allMatch(job -> job.appPath() == null));
    }

    @Test
    void appPathOverrideWinsOverResolver() throws Exception {
        Path dir = Files.createTempDirectory("shotmatrix-plan-override-");
        try {
            Path apk = Files.writeString(dir.resolve("custom.apk"), "apk");
            RunOverrides overrides = new RunOverrides(null, apk, null, null, null, null, null);

            RunPlan plan = new RunPlanBuilder(FOUND, true, 8)
                    .build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), overrides);

            Assertions.assertEquals(apk.toAbsolutePath().normalize(), plan.artifactPaths().get(Platform.ANDROID));
            Assertions.assertEquals(Path.of("/builds", "App.app"), plan.artifactPaths().get(Platform.IOS));

            RunOverrides missing = new RunOverrides(null, dir.resolve("absent.apk"), null, null, null, null, null);
            RunPlanBuilder builder = new RunPlanBuilder(FOUND, true, 8);
            Assertions.assertThrows(ConfigurationException.class, () ->
                    builder.build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), missing));
        } finally {
            ConfigFixtures.deleteRecursively(dir);
        }
    }

    @Test
    void estimateScalesWithWavesOfParallelJobs() {
        RunOverrides sequential = new RunOverrides(null, null, null, null, null, 1, null);

        RunPlan plan = new RunPlanBuilder(FOUND, true, 8)
                .build(ConfigFixtures.config(), OUTPUT, PlanFilters.none(), new PortAllocator(), sequential);

        Assertions.assertEquals(Duration.ofMinutes(8), plan.estimatedDuration());
    }

    @Test
    void requestedParallelismIsCappedByJobCount() {
        RunPlanBuilder builder = new RunPlanBuilder(FOUND, true, 16);

        Assertions.assertEquals(2, builder.effectiveParallelism(4, 2));
        Assertions.assertEquals(4, builder.effectiveParallelism(4, 10));
        Assertions.assertEquals(4, builder.effectiveParallelism(4, null));
        Assertions.assertEquals(1, builder.effectiveParallelism(1, null));
    }
}
