package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when a storage operation fails for a reason other than a precondition.
 */
public class CredentialStorageException extends CredentialException {

    public CredentialStorageException(String message) {
        super(message);
    }

    public CredentialStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
