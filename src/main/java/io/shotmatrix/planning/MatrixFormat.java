package io.shotmatrix.planning;

import java.util.Locale;

public enum MatrixFormat {
    GITHUB,
    GITLAB,
    AZURE;

    public static MatrixFormat fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return GITHUB;
        }
        try {
            return MatrixFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown matrix format: " + raw + " (expected github|gitlab|azure)", e);
        }
    }
}
