package io.shotmatrix.planning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive allow-lists. A null or empty list keeps everything.
 */
public record PlanFilters(
        List<String> platforms,
        List<String> devices,
        List<String> languages,
        List<String> screenshots
) {
    public PlanFilters {
        platforms = normalize(platforms);
        devices = normalize(devices);
        languages = normalize(languages);
        screenshots = normalize(screenshots);
    }

    public static PlanFilters none() {
        return new PlanFilters(null, null, null, null);
    }

    public boolean allowsDevice(String name, String folder) {
        return devices.isEmpty() || contains(devices, name) || contains(devices, folder);
    }

    public boolean allowsLanguage(String language) {
        return languages.isEmpty() || contains(languages, language);
    }

    public boolean allowsScreenshot(String name) {
        return screenshots.isEmpty() || contains(screenshots, name);
    }

    private static boolean contains(List<String> allowed, String value) {
        return value != null && allowed.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Accepts repeated values as well as comma-separated ones.
     */
    private static List<String> normalize(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                String value = part.trim().toLowerCase(Locale.ROOT);
                if (!value.isEmpty() && !out.contains(value)) {
                    out.add(value);
                }
            }
        }
        return List.copyOf(out);
    }
}
