package io.shotmatrix.automation;

import io.shotmatrix.error.ActionException;

import java.util.Locale;

public enum Orientation {
    PORTRAIT,
    LANDSCAPE;

    /**
     * Missing values mean portrait; anything other than portrait or landscape is an action failure.
     */
    public static Orientation fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PORTRAIT;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "portrait" -> PORTRAIT;
            case "landscape" -> LANDSCAPE;
            default -> throw new ActionException("Unsupported orientation: " + raw);
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
