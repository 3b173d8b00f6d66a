package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when encryption or key derivation fails.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialEncryptionException extends CredentialException {

    public CredentialEncryptionException(String message) {
        super(message);
    }

    public CredentialEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
