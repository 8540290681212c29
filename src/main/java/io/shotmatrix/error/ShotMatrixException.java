package io.shotmatrix.error;

/**
 * Root of the failures raised while planning or running a screenshot matrix.
 */
public class ShotMatrixException extends RuntimeException {
    public ShotMatrixException(String message) {
        super(message);
    }

    public ShotMatrixException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable name used in manifests and event logs.
     */
    public String errorType() {
        return getClass().getSimpleName().replace("Exception", "");
    }
}
