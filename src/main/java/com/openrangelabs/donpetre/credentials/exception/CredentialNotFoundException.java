package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when no stored key exists under the requested id.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialNotFoundException extends CredentialException {

    private final String keyId;

    /**
     * @param keyId the id that was not found
     */
    public CredentialNotFoundException(String keyId) {
        super(String.format("API key not found: %s", keyId));
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
