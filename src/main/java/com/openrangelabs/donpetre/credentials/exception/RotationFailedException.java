package com.openrangelabs.donpetre.credentials.exception;

/**
 * Raised inside a rotation once the old secret has been snapshotted; it triggers the
 * rollback and is reported on the rotation result rather than propagated.
 */
public class RotationFailedException extends CredentialException {

    public RotationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
