package io.shotmatrix.error;

import java.util.List;

/**
 * Bad or missing configuration detected before any job starts.
 */
public class ConfigurationException extends ShotMatrixException {
    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigurationException(String summary, List<String> problems) {
        super(summary + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
