package io.shotmatrix.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Element locator. Exactly one strategy is expected to be set.
 */
public record Selector(
        @JsonProperty("accessibility_id") String accessibilityId,
        @JsonProperty("ios_class_chain") String iosClassChain,
        @JsonProperty("android_uiautomator") String androidUiautomator,
        @JsonProperty("xpath") String xpath,
        @JsonProperty("id") String id
) {
    public enum Strategy {
        ACCESSIBILITY_ID,
        IOS_CLASS_CHAIN,
        ANDROID_UIAUTOMATOR,
        XPATH,
        ID
    }

    public static Selector accessibility(String value) {
        return new Selector(value, null, null, null, null);
    }

    public static Selector byId(String value) {
        return new Selector(null, null, null, null, value);
    }

    public List<Strategy> strategies() {
        List<Strategy> out = new ArrayList<>();
        if (present(accessibilityId)) {
            out.add(Strategy.ACCESSIBILITY_ID);
        }
        if (present(iosClassChain)) {
            out.add(Strategy.IOS_CLASS_CHAIN);
        }
        if (present(androidUiautomator)) {
            out.add(Strategy.ANDROID_UIAUTOMATOR);
        }
        if (present(xpath)) {
            out.add(Strategy.XPATH);
        }
        if (present(id)) {
            out.add(Strategy.ID);
        }
        return out;
    }

    public Strategy strategy() {
        List<Strategy> all = strategies();
        if (all.size() != 1) {
            throw new IllegalStateException("Selector must define exactly one strategy, found " + all.size());
        }
        return all.get(0);
    }

    public String value() {
        return switch (strategy()) {
            case ACCESSIBILITY_ID -> accessibilityId;
            case IOS_CLASS_CHAIN -> iosClassChain;
            case ANDROID_UIAUTOMATOR -> androidUiautomator;
            case XPATH -> xpath;
            case ID -> id;
        };
    }

    public String describe() {
        List<Strategy> all = strategies();
        if (all.size() != 1) {
            return "selector(invalid)";
        }
        return all.get(0).name().toLowerCase() + "=" + value();
    }

    private static boolean present(String raw) {
        return raw != null && !raw.isBlank();
    }
}
