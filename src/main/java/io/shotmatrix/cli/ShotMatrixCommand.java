package io.shotmatrix.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotmatrix.automation.AppiumServerController;
import io.shotmatrix.automation.AppiumSessionProvider;
import io.shotmatrix.build.GlobArtifactResolver;
import io.shotmatrix.config.ConfigLoader;
import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.device.AdbDeviceDriver;
import io.shotmatrix.device.CommandRunner;
import io.shotmatrix.device.SimctlDeviceDriver;
import io.shotmatrix.error.ConfigurationException;
import io.shotmatrix.error.PortRangeException;
import io.shotmatrix.image.ImageIoInspector;
import io.shotmatrix.model.EnvironmentInfo;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import io.shotmatrix.model.RunResult;
import io.shotmatrix.observability.RunEventLog;
import io.shotmatrix.planning.MatrixExporter;
import io.shotmatrix.planning.MatrixFormat;
import io.shotmatrix.planning.PlanFilters;
import io.shotmatrix.planning.PortAllocator;
import io.shotmatrix.planning.RunPlan;
import io.shotmatrix.planning.RunPlanBuilder;
import io.shotmatrix.process.ProcessRegistry;
import io.shotmatrix.report.ManifestWriter;
import io.shotmatrix.runtime.AndroidProfile;
import io.shotmatrix.runtime.AppResetTracker;
import io.shotmatrix.runtime.CancellationToken;
import io.shotmatrix.runtime.IosProfile;
import io.shotmatrix.runtime.JobExecutor;
import io.shotmatrix.runtime.Orchestrator;
import io.shotmatrix.util.Jsons;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "shotmatrix",
        mixinStandardHelpOptions = true,
        description = "Plan and run localized app screenshot jobs across simulators and emulators",
        subcommands = {
                ShotMatrixCommand.RunCommand.class,
                ShotMatrixCommand.PlanCommand.class,
                ShotMatrixCommand.GenerateMatrixCommand.class,
                ShotMatrixCommand.ValidateConfigCommand.class
        }
)
public final class ShotMatrixCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Option(names = {"--verbose", "-v"}, description = "Enable debug logging")
    boolean verbose;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | plan | generate-matrix | validate-config");
    }

    void applyLogLevel() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("io.shotmatrix")).setLevel(Level.DEBUG);
        }
    }

    /**
     * Options shared by every subcommand that builds a plan from a config file.
     */
    abstract static class ConfiguredCommand implements Callable<Integer> {
        @ParentCommand
        ShotMatrixCommand parent;

        @Option(names = {"--config", "-c"}, required = true, description = "Path to the JSON configuration file")
        Path configFile;

        @Option(names = {"--platforms"}, split = ",", description = "Only these platforms: ios,android")
        List<String> platforms;

        @Option(names = {"--devices"}, split = ",", description = "Only these device names or folders")
        List<String> devices;

        @Option(names = {"--langs"}, split = ",", description = "Only these languages")
        List<String> languages;

        @Option(names = {"--screens"}, split = ",", description = "Only these screenshot plans")
        List<String> screens;

        @Option(names = {"--output", "-o"}, description = "Output root directory (default: Screenshots)")
        Path output;

        @Option(names = {"--ios-app"}, description = "Prebuilt iOS .app bundle")
        Path iosApp;

        @Option(names = {"--android-app"}, description = "Prebuilt Android .apk")
        Path androidApp;

        @Option(names = {"--base-port"}, description = "First automation server port")
        Integer basePort;

        @Option(names = {"--server-url"}, description = "Use an already running automation server")
        String serverUrl;

        @Option(names = {"--parallel"}, description = "Maximum number of concurrent jobs")
        Integer parallel;

        final ConfigLoader loader = new ConfigLoader();

        @Override
        public final Integer call() {
            parent.applyLogLevel();
            try {
                return execute();
            } catch (ConfigurationException e) {
                System.err.println("Configuration error: " + e.getMessage());
                for (String problem : e.problems()) {
                    if (!problem.equals(e.getMessage())) {
                        System.err.println("  - " + problem);
                    }
                }
                return EXIT_CONFIG_ERROR;
            } catch (PortRangeException e) {
                System.err.println("Port configuration error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }

        abstract Integer execute();

        PlanFilters filters() {
            return new PlanFilters(platforms, devices, languages, screens);
        }

        RunOverrides overrides() {
            return new RunOverrides(iosApp, androidApp, output, basePort, serverUrl, parallel, configFile);
        }

        Path outputRoot() {
            return output != null ? output : Paths.get(Defaults.OUTPUT_ROOT);
        }

        PortAllocator ports(RootConfig config) {
            int base = basePort != null ? basePort : config.basePort();
            return new PortAllocator(base, config.portOffset());
        }

        RunPlan plan(RootConfig config, RunPlanBuilder builder) {
            return builder.build(config, outputRoot(), filters(), ports(config), overrides());
        }
    }

    @Command(name = "run", description = "Run the screenshot matrix")
    static final class RunCommand extends ConfiguredCommand {
        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Resolve and print the plan without running it")
        boolean dryRun;

        @Override
        Integer execute() {
            RootConfig config = loader.load(configFile);
            String configHash = loader.fingerprint(configFile);
            if (dryRun) {
                RunPlan plan = plan(config, RunPlanBuilder.planOnly(new GlobArtifactResolver()));
                System.out.println(Jsons.toJson(planJson(plan)));
                return EXIT_OK;
            }
            RunPlan plan = plan(config, new RunPlanBuilder(new GlobArtifactResolver()));
            Path outputRoot = outputRoot().toAbsolutePath().normalize();
            String runId = Orchestrator.newRunId();
            RunEventLog eventLog = new RunEventLog(outputRoot.resolve(RunEventLog.FILE_NAME), runId);

            CommandRunner runner = new CommandRunner();
            ProcessRegistry registry = new ProcessRegistry();
            CancellationToken token = new CancellationToken();
            RunResult result;
            try (LifecycleGuard guard = LifecycleGuard.install(registry, token, Defaults.DRAIN_TIMEOUT)) {
                JobExecutor executor = new JobExecutor(
                        List.of(new IosProfile(new SimctlDeviceDriver(runner)),
                                new AndroidProfile(new AdbDeviceDriver(runner))),
                        new AppiumServerController(runner),
                        new AppiumSessionProvider(),
                        new ImageIoInspector(),
                        registry,
                        new AppResetTracker(),
                        eventLog
                );
                Orchestrator orchestrator = new Orchestrator(executor, runId, environment(configHash), eventLog);
                result = orchestrator.execute(plan, config, overrides(), token);
            }

            ManifestWriter manifestWriter = new ManifestWriter();
            ManifestWriter.Written written = manifestWriter.write(result, outputRoot);
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("run_id", result.runId());
            out.put("status", result.status().name());
            out.put("success", result.success());
            out.set("summary", manifestWriter.manifest(result).get("summary"));
            out.put("manifest", written.manifest().toString());
            out.put("summary_file", written.summary().toString());
            out.put("event_log", eventLog.file().toString());
            if (result.errorMessage() != null) {
                out.put("error", result.errorMessage());
            }
            System.out.println(Jsons.toJson(out));
            return result.success() ? EXIT_OK : EXIT_RUN_FAILED;
        }
    }

    @Command(name = "plan", description = "Print the resolved job plan as JSON")
    static final class PlanCommand extends ConfiguredCommand {
        @Override
        Integer execute() {
            RootConfig config = loader.load(configFile);
            RunPlan plan = plan(config, RunPlanBuilder.planOnly(new GlobArtifactResolver()));
            System.out.println(Jsons.toJson(planJson(plan)));
            return EXIT_OK;
        }
    }

    @Command(name = "generate-matrix", description = "Export the job plan as a CI matrix")
    static final class GenerateMatrixCommand extends ConfiguredCommand {
        @Option(names = {"--format"}, defaultValue = "github", description = "Matrix format: github|gitlab|azure")
        String format;

        @Override
        Integer execute() {
            MatrixFormat matrixFormat;
            try {
                matrixFormat = MatrixFormat.fromString(format);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
            RootConfig config = loader.load(configFile);
            RunPlan plan = plan(config, RunPlanBuilder.planOnly(new GlobArtifactResolver()));
            System.out.println(Jsons.toJson(new MatrixExporter().export(plan, matrixFormat)));
            return EXIT_OK;
        }
    }

    @Command(name = "validate-config", description = "Validate the configuration file and exit")
    static final class ValidateConfigCommand extends ConfiguredCommand {
        @Override
        Integer execute() {
            RootConfig config = loader.load(configFile);
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("valid", true);
            out.put("config", configFile.toAbsolutePath().normalize().toString());
            out.put("config_hash", loader.fingerprint(configFile));
            out.put("ios_devices", config.devices().ios().size());
            out.put("android_devices", config.devices().android().size());
            out.put("languages", config.languages().size());
            out.put("screenshots", config.screenshots().size());
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    static ObjectNode planJson(RunPlan plan) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("total_jobs", plan.size());
        root.put("total_platforms", plan.totalPlatforms());
        root.put("total_devices", plan.totalDevices());
        root.put("total_languages", plan.totalLanguages());
        root.put("total_screenshots", plan.totalScreenshots());
        root.put("estimated_duration_seconds", plan.estimatedDuration().toSeconds());
        ObjectNode artifacts = root.putObject("artifacts");
        for (Map.Entry<Platform, Path> entry : plan.artifactPaths().entrySet()) {
            artifacts.put(entry.getKey().key(), entry.getValue().toString());
        }
        ArrayNode jobs = root.putArray("jobs");
        for (RunJob job : plan.jobs()) {
            ObjectNode row = jobs.addObject();
            row.put("job_id", job.jobId());
            row.put("index", job.index());
            row.put("platform", job.platform().key());
            row.put("device", job.deviceName());
            row.put("device_folder", job.deviceFolder());
            row.put("language", job.language());
            row.put("locale", job.locale());
            ArrayNode ports = row.putArray("ports");
            job.ports().ports().forEach(ports::add);
            ArrayNode screens = row.putArray("screenshots");
            for (ScreenshotPlan screenshot : job.screenshots()) {
                screens.add(screenshot.name());
            }
            row.put("output_dir", job.outputDirectory().toString());
            if (job.appPath() != null) {
                row.put("app", job.appPath().toString());
            }
        }
        return root;
    }

    static EnvironmentInfo environment(String configHash) {
        String version = ShotMatrixCommand.class.getPackage().getImplementationVersion();
        return new EnvironmentInfo(
                System.getProperty("os.name") + " " + System.getProperty("os.version"),
                System.getProperty("java.version"),
                hostname(),
                Paths.get("").toAbsolutePath().toString(),
                version == null ? "dev" : version,
                configHash
        );
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env == null || env.isBlank() ? "unknown" : env;
        }
    }
}
