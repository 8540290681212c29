package io.shotmatrix.error;

public final class PortRangeException extends ShotMatrixException {
    public PortRangeException(String message) {
        super(message);
    }
}
