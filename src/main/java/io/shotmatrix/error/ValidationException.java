package io.shotmatrix.error;

public final class ValidationException extends ShotMatrixException {
    public ValidationException(String message) {
        super(message);
    }
}
