package io.shotmatrix.error;

/**
 * A screenshot-plan action could not complete: element missing, timeout, bad orientation.
 */
public final class ActionException extends ShotMatrixException {
    public ActionException(String message) {
        super(message);
    }

    public ActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
