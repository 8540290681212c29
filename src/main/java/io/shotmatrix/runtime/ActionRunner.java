package io.shotmatrix.runtime;

import io.shotmatrix.automation.AutomationElement;
import io.shotmatrix.automation.AutomationSession;
import io.shotmatrix.automation.Orientation;
import io.shotmatrix.config.Defaults;
import io.shotmatrix.config.RootConfig;
import io.shotmatrix.config.ScreenshotPlan;
import io.shotmatrix.config.Selector;
import io.shotmatrix.error.ActionException;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.ScreenshotResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one screenshot plan on a live session: orientation, dismissors, actions, assertion.
 */
final class ActionRunner {
    private static final Logger log = LoggerFactory.getLogger(ActionRunner.class);

    private final RunJob job;
    private final RootConfig config;
    private final PlatformProfile profile;
    private final AutomationSession session;
    private final String deviceId;
    private final CancellationToken token;
    private final List<String> warnings;

    ActionRunner(
            RunJob job,
            RootConfig config,
            PlatformProfile profile,
            AutomationSession session,
            String deviceId,
            CancellationToken token,
            List<String> warnings
    ) {
        this.job = job;
        this.config = config;
        this.profile = profile;
        this.session = session;
        this.deviceId = deviceId;
        this.token = token;
        this.warnings = warnings;
    }

    List<ScreenshotResult> run(ScreenshotPlan plan) {
        log.debug("[{}] plan {}", job.jobId(), plan.name());
        Orientation orientation = Orientation.fromString(plan.orientation());
        token.throwIfCancelled();
        session.rotate(orientation);
        token.sleep(Defaults.ORIENTATION_SETTLE);

        dismiss(profile.dismissors(plan, config));

        List<ScreenshotResult> captured = new ArrayList<>();
        for (ScreenshotPlan.ScreenshotAction action : plan.actions()) {
            token.throwIfCancelled();
            switch (action.type()) {
                case TAP -> tap(action.tap());
                case WAIT -> pause(action.pause());
                case WAIT_FOR -> waitFor(action.waitFor());
                case CAPTURE -> captured.add(capture(action.capture().name(), orientation));
            }
        }

        Selector assertion = profile.assertion(plan);
        if (assertion != null && poll(assertion, Defaults.ELEMENT_TIMEOUT).isEmpty()) {
            String warning = "Assertion " + assertion.describe() + " not found after plan '" + plan.name() + "'";
            log.warn("[{}] {}", job.jobId(), warning);
            warnings.add(warning);
        }
        return captured;
    }

    private void dismiss(List<Selector> dismissors) {
        for (Selector selector : dismissors) {
            Optional<AutomationElement> element = poll(selector, Defaults.DISMISSOR_TIMEOUT);
            if (element.isEmpty()) {
                continue;
            }
            try {
                element.get().click();
                log.debug("[{}] dismissed {}", job.jobId(), selector.describe());
                token.sleep(Defaults.DISMISSOR_SETTLE);
            } catch (ActionException e) {
                log.debug("[{}] dismissor {} not clickable: {}", job.jobId(), selector.describe(), e.getMessage());
            }
        }
    }

    private void tap(Selector selector) {
        AutomationElement element = poll(selector, Defaults.ELEMENT_TIMEOUT)
                .orElseThrow(() -> new ActionException("Element not found within "
                        + Defaults.ELEMENT_TIMEOUT.toSeconds() + "s: " + selector.describe()));
        element.click();
    }

    private void pause(ScreenshotPlan.WaitConfig wait) {
        double seconds = wait.seconds() == null ? Defaults.DEFAULT_WAIT_SECONDS : wait.seconds();
        token.sleep(Duration.ofMillis(Math.round(seconds * 1000.0d)));
    }

    private void waitFor(ScreenshotPlan.WaitForConfig waitFor) {
        Duration timeout = waitForTimeout(waitFor);
        if (poll(waitFor.selector(), timeout).isEmpty()) {
            throw new ActionException("Timed out after " + timeout.toSeconds() + "s waiting for "
                    + waitFor.selector().describe());
        }
    }

    private Duration waitForTimeout(ScreenshotPlan.WaitForConfig waitFor) {
        if (waitFor.timeout() != null) {
            return Duration.ofSeconds(waitFor.timeout());
        }
        RootConfig.Timeouts timeouts = config.timeouts();
        if (timeouts != null && timeouts.defaultWaitMs() != null) {
            return Duration.ofMillis(timeouts.defaultWaitMs());
        }
        return Defaults.ELEMENT_TIMEOUT;
    }

    private ScreenshotResult capture(String name, Orientation orientation) {
        Path output = job.outputDirectory().resolve(name + "_" + job.language() + ".png");
        profile.driver().takeScreenshot(deviceId, output, token);
        long size;
        try {
            size = Files.size(output);
        } catch (IOException e) {
            throw new ActionException("Screenshot missing after capture: " + output, e);
        }
        log.info("[{}] captured {}", job.jobId(), output.getFileName());
        return ScreenshotResult.captured(name, job.language(), output, size, orientation.key());
    }

    /**
     * Polls until the element is present or the timeout passes; always tries at least once.
     */
    private Optional<AutomationElement> poll(Selector selector, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            token.throwIfCancelled();
            Optional<AutomationElement> found = session.findNow(selector);
            if (found.isPresent()) {
                return found;
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            token.sleep(Defaults.ELEMENT_POLL_INTERVAL);
        }
    }
}
