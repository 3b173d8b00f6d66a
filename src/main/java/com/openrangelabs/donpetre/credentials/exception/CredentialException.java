package com.openrangelabs.donpetre.credentials.exception;

/**
 * Base exception for credential storage and key management failures.
 *
 * <p>Every storage operation that fails signals a subclass of this exception through
 * its reactive type; validation failures are reported on result objects instead.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialException extends RuntimeException {

    /**
     * @param message the detail message
     */
    public CredentialException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause the cause
     */
    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
