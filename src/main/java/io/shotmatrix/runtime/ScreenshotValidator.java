package io.shotmatrix.runtime;

import io.shotmatrix.config.RootConfig;
import io.shotmatrix.error.ValidationException;
import io.shotmatrix.image.ImageInspector;
import io.shotmatrix.model.RunJob;
import io.shotmatrix.model.ScreenshotResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads captured image sizes and compares them with {@code validation.expected_sizes}.
 */
final class ScreenshotValidator {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotValidator.class);

    private final ImageInspector inspector;

    ScreenshotValidator(ImageInspector inspector) {
        this.inspector = inspector;
    }

    Outcome validate(
            RunJob job,
            RootConfig config,
            PlatformProfile profile,
            List<ScreenshotResult> screenshots,
            List<String> warnings
    ) {
        boolean enforce = config.validation() != null && config.validation().enforced();
        RootConfig.DeviceSize expected = profile.expectedSize(job, config);
        List<ScreenshotResult> out = new ArrayList<>(screenshots.size());
        List<String> mismatches = new ArrayList<>();
        for (ScreenshotResult screenshot : screenshots) {
            Optional<ImageInspector.ImageDimensions> dims = inspector.dimensions(screenshot.path());
            if (dims.isEmpty()) {
                String problem = "Cannot read dimensions of " + screenshot.path().getFileName();
                if (enforce && expected != null) {
                    mismatches.add(problem);
                } else {
                    warnings.add(problem);
                }
                out.add(screenshot);
                continue;
            }
            ImageInspector.ImageDimensions actual = dims.get();
            ScreenshotResult measured = screenshot.withDimensions(actual.width(), actual.height());
            int[] size = expected == null ? null : expected.forOrientation(screenshot.orientation());
            if (size != null && size.length == 2 && !actual.matches(size[0], size[1])) {
                String problem = screenshot.path().getFileName() + " is " + actual + ", expected "
                        + size[0] + "x" + size[1] + " (" + screenshot.orientation() + ")";
                if (enforce) {
                    mismatches.add(problem);
                    measured = measured.withError(problem);
                } else {
                    warnings.add(problem);
                    log.warn("[{}] {}", job.jobId(), problem);
                }
            }
            out.add(measured);
        }
        return new Outcome(out, mismatches);
    }

    record Outcome(List<ScreenshotResult> screenshots, List<String> mismatches) {
        void throwIfFailed() {
            if (!mismatches.isEmpty()) {
                throw new ValidationException("Screenshot size validation failed: " + String.join("; ", mismatches));
            }
        }
    }
}
