package io.shotmatrix.error;

public final class JobCancelledException extends ShotMatrixException {
    public JobCancelledException(String message) {
        super(message);
    }
}
