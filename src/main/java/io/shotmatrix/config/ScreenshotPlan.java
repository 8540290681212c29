package io.shotmatrix.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shotmatrix.model.Platform;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered actions that lead to one or more captured screenshots.
 */
public record ScreenshotPlan(
        String name,
        String orientation,
        List<ScreenshotAction> actions,
        @JsonProperty("assert") PlatformAssertions assertions,
        PlatformDismissors dismissors
) {
    public ScreenshotPlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public Selector assertionFor(Platform platform) {
        if (assertions == null) {
            return null;
        }
        return platform == Platform.IOS ? assertions.ios() : assertions.android();
    }

    public List<Selector> dismissorsFor(Platform platform) {
        if (dismissors == null) {
            return List.of();
        }
        List<Selector> selected = platform == Platform.IOS ? dismissors.ios() : dismissors.android();
        return selected == null ? List.of() : selected;
    }

    public record PlatformAssertions(Selector ios, Selector android) {
    }

    public record PlatformDismissors(List<Selector> ios, List<Selector> android) {
    }

    public enum ActionType {
        TAP,
        WAIT,
        WAIT_FOR,
        CAPTURE
    }

    /**
     * Mirrors the config document: one of the four fields is set.
     */
    public record ScreenshotAction(
            Selector tap,
            @JsonProperty("wait") WaitConfig pause,
            @JsonProperty("wait_for") WaitForConfig waitFor,
            CaptureConfig capture
    ) {
        public static ScreenshotAction tap(Selector selector) {
            return new ScreenshotAction(selector, null, null, null);
        }

        public static ScreenshotAction waitSeconds(double seconds) {
            return new ScreenshotAction(null, new WaitConfig(seconds), null, null);
        }

        public static ScreenshotAction waitFor(Selector selector, Integer timeoutSeconds) {
            return new ScreenshotAction(null, null, new WaitForConfig(selector, timeoutSeconds), null);
        }

        public static ScreenshotAction capture(String name) {
            return new ScreenshotAction(null, null, null, new CaptureConfig(name));
        }

        public List<ActionType> declaredTypes() {
            List<ActionType> out = new ArrayList<>();
            if (tap != null) {
                out.add(ActionType.TAP);
            }
            if (pause != null) {
                out.add(ActionType.WAIT);
            }
            if (waitFor != null) {
                out.add(ActionType.WAIT_FOR);
            }
            if (capture != null) {
                out.add(ActionType.CAPTURE);
            }
            return out;
        }

        public ActionType type() {
            List<ActionType> declared = declaredTypes();
            if (declared.size() != 1) {
                throw new IllegalStateException("Action must declare exactly one of tap|wait|wait_for|capture");
            }
            return declared.get(0);
        }
    }

    public record WaitConfig(Double seconds) {
    }

    public record WaitForConfig(Selector selector, Integer timeout) {
    }

    public record CaptureConfig(String name) {
    }
}
