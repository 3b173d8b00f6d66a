package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when the raw key being stored is already stored under another record.
 *
 * <p>Detection is by key hash, so the message names the existing record id and never
 * the key itself.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialAlreadyExistsException extends CredentialException {

    private final String existingKeyId;

    /**
     * @param existingKeyId id of the record that already holds the key
     */
    public CredentialAlreadyExistsException(String existingKeyId) {
        super(String.format("API key already exists with ID: %s", existingKeyId));
        this.existingKeyId = existingKeyId;
    }

    public String getExistingKeyId() {
        return existingKeyId;
    }
}
