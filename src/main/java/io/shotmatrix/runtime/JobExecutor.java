package io.shotmatrix.runtime;

import io.shotmatrix.automation.AutomationServerController;
import io.shotmatrix.automation.AutomationSession;
import io.shotmatrix.automation.SessionProvider;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.error.JobCancelledException;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.error.ShotMatrixException;
import io.shotmatrix.error.TeardownException;
import io.shotmatrix.image.ImageInspector;
import io.shotmatrix.model.FailureArtifact;
import io.shotmatrix.model.JobResult;
import io.shotmatrix.model.JobState;
import io.shotmatrix.model.Platform;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.RunOverrides;
import io.shotmatrix.model.ScreenshotResult;
import io.shotmatrix.observability.RunEventLog;
import io.shotmatrix.process.ManagedAutomationServer;
import io.shotmatrix.process.ManagedDevice;
import io.shotmatrix.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one job through provisioning, actions and validation. Never throws: every outcome,
 * including cancellation, comes back as a {@link JobResult}.
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final Map<Platform, PlatformProfile> profiles;
    private final AutomationServerController serverController;
    private final SessionProvider sessionProvider;
    private final ScreenshotValidator validator;
    private final FailureArtifactCollector artifactCollector = new FailureArtifactCollector();
    private final ProcessRegistry registry;
    private final AppResetTracker resetTracker;
    private final RunEventLog eventLog;

    public JobExecutor(
            List<PlatformProfile> profiles,
            AutomationServerController serverController,
            SessionProvider sessionProvider,
            ImageInspector imageInspector,
            ProcessRegistry registry,
            AppResetTracker resetTracker,
            RunEventLog eventLog
    ) {
        this.profiles = new EnumMap<>(Platform.class);
        for (PlatformProfile profile : profiles) {
            this.profiles.put(profile.platform(), profile);
        }
        this.serverController = serverController;
        this.sessionProvider = sessionProvider;
        this.validator = new ScreenshotValidator(imageInspector);
        this.registry = registry;
        this.resetTracker = resetTracker;
        this.eventLog = eventLog;
    }

    public JobResult execute(RunJob job, RootConfig config, RunOverrides overrides, CancellationToken token) {
        PlatformProfile profile = profiles.get(job.platform());
        if (profile == null) {
            throw new IllegalStateException("No platform profile registered for " + job.platform().displayName());
        }
        return new Attempt(job, config, overrides == null ? RunOverrides.none() : overrides, token, profile).run();
    }

    /**
     * State of a single execution. Confined to the worker thread running the job.
     */
    private final class Attempt {
        private final RunJob job;
        private final RootConfig config;
        private final RunOverrides overrides;
        private final CancellationToken token;
        private final PlatformProfile profile;
        private final List<JobState> history = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<ScreenshotResult> screenshots = new ArrayList<>();
        private final List<FailureArtifact> failureArtifacts = new ArrayList<>();
        private final Instant startedAt = Instant.now();
        private JobState state = JobState.PENDING;
        private ManagedAutomationServer server;
        private ManagedDevice device;
        private AutomationSession session;
        private boolean artifactsCaptured;
        private boolean tornDown;

        Attempt(RunJob job, RootConfig config, RunOverrides overrides, CancellationToken token, PlatformProfile profile) {
            this.job = job;
            this.config = config;
            this.overrides = overrides;
            this.token = token;
            this.profile = profile;
            history.add(JobState.PENDING);
        }

        JobResult run() {
            String errorMessage = null;
            String errorType = null;
            try {
                token.throwIfCancelled();
                transition(JobState.PROVISIONING);
                provision();

                transition(JobState.EXECUTING);
                ActionRunner runner = new ActionRunner(job, config, profile, session,
                        device.deviceId(), token, warnings);
                for (ScreenshotPlan plan : job.screenshots()) {
                    screenshots.addAll(runner.run(plan));
                }

                transition(JobState.VALIDATING);
                ScreenshotValidator.Outcome outcome = validator.validate(job, config, profile,
                        List.copyOf(screenshots), warnings);
                screenshots.clear();
                screenshots.addAll(outcome.screenshots());
                outcome.throwIfFailed();

                transition(JobState.SUCCEEDED);
            } catch (JobCancelledException e) {
                errorMessage = e.getMessage();
                errorType = e.errorType();
                transition(JobState.CANCELLED);
            } catch (RuntimeException e) {
                errorMessage = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                errorType = e instanceof ShotMatrixException sme ? sme.errorType() : e.getClass().getSimpleName();
                if (token.isCancelled()) {
                    // Tools killed by cancellation fail in their own ways.
                    log.debug("[{}] failure after cancellation: {}", job.jobId(), errorMessage);
                    errorMessage = "Run cancelled: " + token.reason();
                    errorType = "JobCancelled";
                    transition(JobState.CANCELLED);
                } else {
                    log.error("[{}] failed in {}: {}", job.jobId(), state, errorMessage);
                    captureArtifactsOnce();
                    transition(JobState.FAILED);
                }
            } finally {
                teardown();
            }
            JobResult result = new JobResult(
                    job,
                    state.toStatus(),
                    screenshots,
                    startedAt,
                    Instant.now(),
                    errorMessage,
                    errorType,
                    failureArtifacts,
                    history,
                    warnings
            );
            log.info("[{}] {} in {} ms ({} screenshot(s))", job.describe(), result.status(),
                    result.duration().toMillis(), screenshots.size());
            return result;
        }

        private void provision() {
            URI serverUrl;
            if (overrides.externalServer()) {
                serverUrl = URI.create(overrides.serverUrl());
            } else {
                int port = job.ports().automationPort();
                // Registered first so a drain during startup still stops it.
                server = new ManagedAutomationServer(serverController, port);
                registry.register(ManagedAutomationServer.registryId(job.jobId()), server);
                serverUrl = serverController.start(port, token);
            }

            token.throwIfCancelled();
            String deviceId = profile.driver().boot(job, token);
            device = new ManagedDevice(profile.driver(), deviceId);
            registry.register(ManagedDevice.registryId(job.jobId()), device);

            profile.driver().setLocale(deviceId, profile.locale(job), token);
            applyResetPolicy(deviceId);

            if (job.appPath() == null) {
                throw new ProvisioningException("No application artifact for " + job.platform().displayName());
            }
            profile.driver().installApp(deviceId, job.appPath(), token);
            profile.driver().applyStatusBar(deviceId, config.statusBar(), token);

            token.throwIfCancelled();
            session = sessionProvider.open(serverUrl, profile.capabilities(job, deviceId, config), token);
            try {
                Files.createDirectories(job.outputDirectory());
            } catch (IOException e) {
                throw new ProvisioningException("Cannot create output directory " + job.outputDirectory(), e);
            }
        }

        private void applyResetPolicy(String deviceId) {
            String deviceKey = job.platform().key() + "/" + job.deviceFolder();
            boolean changed = resetTracker.languageChanged(deviceKey, job.language());
            boolean reset = switch (config.resetPolicy()) {
                case ALWAYS -> true;
                case ON_LANGUAGE_CHANGE -> changed;
                case NEVER -> false;
            };
            if (reset) {
                log.debug("[{}] resetting app state ({})", job.jobId(), config.resetPolicy());
                profile.driver().resetApp(deviceId, profile.appIdentifier(config), token);
            }
        }

        private void transition(JobState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal job transition " + state + " -> " + next + " for " + job.jobId());
            }
            state = next;
            history.add(next);
            if (eventLog != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("platform", job.platform().key());
                details.put("device", job.deviceName());
                details.put("language", job.language());
                try {
                    eventLog.log(RunEventLog.RunEvent.job("job." + next.name().toLowerCase(), job.jobId(), next.name(), details));
                } catch (RuntimeException e) {
                    log.warn("[{}] event log write failed: {}", job.jobId(), e.getMessage());
                }
            }
        }

        private void captureArtifactsOnce() {
            if (artifactsCaptured) {
                return;
            }
            artifactsCaptured = true;
            failureArtifacts.addAll(artifactCollector.collect(job, config, session, profile.driver(),
                    device == null ? null : device.deviceId()));
        }

        private void teardown() {
            if (tornDown) {
                return;
            }
            tornDown = true;
            if (session != null) {
                try {
                    session.close();
                } catch (RuntimeException e) {
                    warnTeardown(new TeardownException("Failed to close session", e));
                }
            }
            if (server != null) {
                try {
                    server.stop();
                } catch (RuntimeException e) {
                    warnTeardown(new TeardownException("Failed to stop " + server.description(), e));
                } finally {
                    registry.unregister(ManagedAutomationServer.registryId(job.jobId()));
                }
            }
            if (device != null) {
                try {
                    device.stop();
                } catch (RuntimeException e) {
                    warnTeardown(new TeardownException("Failed to shut down " + device.description(), e));
                } finally {
                    registry.unregister(ManagedDevice.registryId(job.jobId()));
                }
            }
        }

        private void warnTeardown(TeardownException e) {
            Throwable cause = e.getCause();
            log.warn("[{}] {}: {}", job.jobId(), e.getMessage(), cause == null ? "" : cause.getMessage());
        }
    }
}
