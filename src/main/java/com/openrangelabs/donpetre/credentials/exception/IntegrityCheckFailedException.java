package com.openrangelabs.donpetre.credentials.exception;

/**
 * Thrown when a stored payload no longer matches its checksum or cannot be decrypted.
 */
public class IntegrityCheckFailedException extends CredentialException {

    private final String keyId;

    public IntegrityCheckFailedException(String keyId) {
        super("Data integrity check failed");
        this.keyId = keyId;
    }

    public IntegrityCheckFailedException(String keyId, Throwable cause) {
        super("Data integrity check failed", cause);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
