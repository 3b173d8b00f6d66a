package com.openrangelabs.donpetre.credentials.crypto;

import com.openrangelabs.donpetre.credentials.model.CipherBlob;

/**
 * Passphrase-keyed encryption session used by credential storage.
 *
 * <p>The session must be {@link #initialize initialized} before any encrypt or decrypt.
 * Implementations expire the session after a period of inactivity; an expired or locked
 * session refuses to encrypt or decrypt until initialized again.
 */
public interface CryptoService {

    /**
     * Derives the session key from the passphrase and starts a new session.
     */
    void initialize(String passphrase);

    boolean isInitialized();

    boolean isSessionActive();

    /**
     * Restarts the idle timer of an active session.
     */
    void refreshSession();

    CipherBlob encrypt(byte[] plaintext);

    byte[] decrypt(CipherBlob blob);

    /**
     * Integrity digest over the algorithm, version, IV and cipher bytes of a blob, as hex.
     */
    String checksum(CipherBlob blob);

    default boolean verifyChecksum(CipherBlob blob, String expected) {
        return expected != null && expected.equals(checksum(blob));
    }

    /**
     * One-way digest used for duplicate detection, as hex.
     */
    String hash(byte[] data);

    /**
     * Ends the session but keeps the service initialized for a later re-initialize.
     */
    void lock();

    /**
     * Ends the session and forgets all derived key material.
     */
    void shutdown();
}
