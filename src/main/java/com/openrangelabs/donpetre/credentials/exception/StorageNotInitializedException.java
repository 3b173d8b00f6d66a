package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when a data operation is attempted before storage is initialized and ready.
 */
public class StorageNotInitializedException extends CredentialException {

    public static final String MESSAGE = "API key storage not initialized. Call initializeStorage() first.";

    public StorageNotInitializedException() {
        super(MESSAGE);
    }

    public StorageNotInitializedException(String message) {
        super(message);
    }
}
