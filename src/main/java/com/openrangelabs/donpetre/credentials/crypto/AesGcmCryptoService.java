package com.openrangelabs.donpetre.credentials.crypto;

import com.openrangelabs.donpetre.credentials.exception.CredentialEncryptionException;
import com.openrangelabs.donpetre.credentials.exception.SessionExpiredException;
import com.openrangelabs.donpetre.credentials.exception.StorageNotInitializedException;
import com.openrangelabs.donpetre.credentials.model.CipherBlob;
import com.openrangelabs.donpetre.credentials.support.Digests;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.encrypt.AesBytesEncryptor;
import org.springframework.security.crypto.encrypt.BytesEncryptor;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * AES-256-GCM encryption keyed by a PBKDF2 derivation of the storage passphrase,
 * backed by Spring Security's {@link AesBytesEncryptor}.
 *
 * <p>Each encryption uses a fresh 16-byte IV. The encryptor emits IV and cipher text
 * concatenated; they are split into {@link CipherBlob#getIv()} and
 * {@link CipherBlob#getCipher()} and joined again on decrypt.
 */
@Slf4j
public class AesGcmCryptoService implements CryptoService {

    public static final String ALGORITHM = "AES-GCM-256";
    public static final int PAYLOAD_VERSION = 1;
    private static final int IV_LENGTH = 16;

    private final String salt;
    private final Duration sessionTimeout;
    private final Clock clock;

    private volatile BytesEncryptor encryptor;
    private volatile boolean initialized;
    private volatile Instant lastActivity;

    public AesGcmCryptoService(String hexSalt, Duration sessionTimeout, Clock clock) {
        this.salt = hexSalt;
        this.sessionTimeout = sessionTimeout;
        this.clock = clock;
    }

    @Override
    public synchronized void initialize(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new CredentialEncryptionException("Passphrase is required");
        }
        try {
            this.encryptor = new AesBytesEncryptor(passphrase, salt,
                    KeyGenerators.secureRandom(IV_LENGTH), AesBytesEncryptor.CipherAlgorithm.GCM);
        } catch (RuntimeException e) {
            throw new CredentialEncryptionException("Failed to derive encryption key", e);
        }
        this.initialized = true;
        this.lastActivity = clock.instant();
        log.info("Encryption session started");
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public boolean isSessionActive() {
        Instant last = lastActivity;
        return initialized && encryptor != null && last != null
                && clock.instant().isBefore(last.plus(sessionTimeout));
    }

    @Override
    public void refreshSession() {
        if (isSessionActive()) {
            lastActivity = clock.instant();
        }
    }

    @Override
    public CipherBlob encrypt(byte[] plaintext) {
        BytesEncryptor active = activeEncryptor();
        byte[] combined;
        try {
            combined = active.encrypt(plaintext);
        } catch (RuntimeException e) {
            throw new CredentialEncryptionException("Encryption failed", e);
        }
        return CipherBlob.builder()
                .iv(Arrays.copyOfRange(combined, 0, IV_LENGTH))
                .cipher(Arrays.copyOfRange(combined, IV_LENGTH, combined.length))
                .algorithm(ALGORITHM)
                .version(PAYLOAD_VERSION)
                .build();
    }

    @Override
    public byte[] decrypt(CipherBlob blob) {
        BytesEncryptor active = activeEncryptor();
        if (blob == null || blob.getIv() == null || blob.getCipher() == null) {
            throw new CredentialEncryptionException("Cipher payload is incomplete");
        }
        byte[] combined = new byte[blob.getIv().length + blob.getCipher().length];
        System.arraycopy(blob.getIv(), 0, combined, 0, blob.getIv().length);
        System.arraycopy(blob.getCipher(), 0, combined, blob.getIv().length, blob.getCipher().length);
        try {
            return active.decrypt(combined);
        } catch (RuntimeException e) {
            throw new CredentialEncryptionException("Decryption failed", e);
        }
    }

    @Override
    public String checksum(CipherBlob blob) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeField(out, blob.getAlgorithm() == null ? new byte[0] : blob.getAlgorithm().getBytes(StandardCharsets.UTF_8));
        writeField(out, Integer.toString(blob.getVersion()).getBytes(StandardCharsets.UTF_8));
        writeField(out, blob.getIv() == null ? new byte[0] : blob.getIv());
        writeField(out, blob.getCipher() == null ? new byte[0] : blob.getCipher());
        return Digests.sha256Hex(out.toByteArray());
    }

    @Override
    public String hash(byte[] data) {
        return Digests.sha256Hex(data);
    }

    @Override
    public synchronized void lock() {
        this.encryptor = null;
        this.lastActivity = null;
        log.info("Encryption session locked");
    }

    @Override
    public synchronized void shutdown() {
        this.encryptor = null;
        this.lastActivity = null;
        this.initialized = false;
        log.info("Encryption service shut down");
    }

    private BytesEncryptor activeEncryptor() {
        if (!initialized) {
            throw new StorageNotInitializedException("Encryption service not initialized");
        }
        BytesEncryptor active = encryptor;
        if (active == null || !isSessionActive()) {
            throw new SessionExpiredException();
        }
        lastActivity = clock.instant();
        return active;
    }

    // length-prefixed so field boundaries cannot shift
    private static void writeField(ByteArrayOutputStream out, byte[] field) {
        int length = field.length;
        out.write((length >>> 24) & 0xFF);
        out.write((length >>> 16) & 0xFF);
        out.write((length >>> 8) & 0xFF);
        out.write(length & 0xFF);
        out.write(field, 0, field.length);
    }
}
