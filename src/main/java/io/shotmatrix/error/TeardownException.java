package io.shotmatrix.error;

/**
 * Raised by resource shutdown paths. Always logged, never turned into a job failure.
 */
public final class TeardownException extends ShotMatrixException {
    public TeardownException(String message, Throwable cause) {
        super(message, cause);
    }
}
