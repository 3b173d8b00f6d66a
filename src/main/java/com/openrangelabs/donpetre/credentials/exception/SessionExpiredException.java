package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when the encryption session has timed out or was locked.
 */
public class SessionExpiredException extends CredentialException {

    public SessionExpiredException() {
        super("Session expired. Please reinitialize the service.");
    }
}
