package com.openrangelabs.donpetre.credentials.exception;

import java.util.List;

/**
 * Thrown when a key fails format validation for its provider.
 */
public class InvalidKeyFormatException extends CredentialException {

    private final List<String> errors;

    public InvalidKeyFormatException(List<String> errors) {
        super("Invalid API key format: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
