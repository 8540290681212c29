package io.shotmatrix.error;

/**
 * Device boot, locale, install or automation-server failure. Terminal for the job only.
 */
public final class ProvisioningException extends ShotMatrixException {
    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
