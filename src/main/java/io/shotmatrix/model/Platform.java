package io.shotmatrix.model;

import java.util.Locale;

public enum Platform {
    IOS("iOS", "ios"),
    ANDROID("Android", "android");

    private final String displayName;
    private final String key;

    Platform(String displayName, String key) {
        this.displayName = displayName;
        this.key = key;
    }

    /**
     * Name used for output folders and reports, e.g. {@code iOS}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Lowercase name used by filters and matrix views, e.g. {@code ios}.
     */
    public String key() {
        return key;
    }

    public static Platform fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Platform cannot be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.key.equals(value) || platform.name().equalsIgnoreCase(value)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + raw);
    }
}
