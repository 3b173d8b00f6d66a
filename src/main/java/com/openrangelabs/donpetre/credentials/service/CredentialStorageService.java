package com.openrangelabs.donpetre.credentials.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.donpetre.credentials.config.CredentialVaultProperties;
import com.openrangelabs.donpetre.credentials.crypto.CryptoService;
import com.openrangelabs.donpetre.credentials.exception.CredentialAlreadyExistsException;
import com.openrangelabs.donpetre.credentials.exception.CredentialEncryptionException;
import com.openrangelabs.donpetre.credentials.exception.CredentialException;
import com.openrangelabs.donpetre.credentials.exception.CredentialNotFoundException;
import com.openrangelabs.donpetre.credentials.exception.CredentialStorageException;
import com.openrangelabs.donpetre.credentials.exception.IntegrityCheckFailedException;
import com.openrangelabs.donpetre.credentials.exception.InvalidKeyFormatException;
import com.openrangelabs.donpetre.credentials.exception.RotationFailedException;
import com.openrangelabs.donpetre.credentials.exception.SessionExpiredException;
import com.openrangelabs.donpetre.credentials.exception.StorageNotInitializedException;
import com.openrangelabs.donpetre.credentials.model.CipherBlob;
import com.openrangelabs.donpetre.credentials.model.ConnectionTestResult;
import com.openrangelabs.donpetre.credentials.model.CreateKeyInput;
import com.openrangelabs.donpetre.credentials.model.CredentialConfiguration;
import com.openrangelabs.donpetre.credentials.model.CredentialMetadata;
import com.openrangelabs.donpetre.credentials.model.EncryptedCredential;
import com.openrangelabs.donpetre.credentials.model.ExportBundle;
import com.openrangelabs.donpetre.credentials.model.HealthCheckResult;
import com.openrangelabs.donpetre.credentials.model.HealthCheckResult.HealthCheck;
import com.openrangelabs.donpetre.credentials.model.ImportResult;
import com.openrangelabs.donpetre.credentials.model.KeyListResult;
import com.openrangelabs.donpetre.credentials.model.KeyPermission;
import com.openrangelabs.donpetre.credentials.model.KeyQueryOptions;
import com.openrangelabs.donpetre.credentials.model.KeyRotationResult;
import com.openrangelabs.donpetre.credentials.model.KeyStatus;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.model.RotationState;
import com.openrangelabs.donpetre.credentials.model.RotationStatus;
import com.openrangelabs.donpetre.credentials.model.RotationStatus.RotationHistoryEntry;
import com.openrangelabs.donpetre.credentials.model.StorageMetrics;
import com.openrangelabs.donpetre.credentials.model.StorageState;
import com.openrangelabs.donpetre.credentials.model.UpdateKeyInput;
import com.openrangelabs.donpetre.credentials.model.UsageRecord;
import com.openrangelabs.donpetre.credentials.model.UsageStats;
import com.openrangelabs.donpetre.credentials.store.BlobStore;
import com.openrangelabs.donpetre.credentials.store.IndexStore;
import com.openrangelabs.donpetre.credentials.store.QueryOptions;
import com.openrangelabs.donpetre.credentials.support.ExpiringCache;
import com.openrangelabs.donpetre.credentials.support.KeyIdGenerator;
import com.openrangelabs.donpetre.credentials.support.KeyMasker;
import com.openrangelabs.donpetre.credentials.support.RotationPolicy;
import com.openrangelabs.donpetre.credentials.validation.ApiKeyValidationService;
import com.openrangelabs.donpetre.credentials.validation.KeySanitizer;
import com.openrangelabs.donpetre.credentials.validation.LiveValidationOptions;
import com.openrangelabs.donpetre.credentials.validation.ProviderRules;
import com.openrangelabs.donpetre.credentials.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Encrypted storage of provider API keys.
 *
 * <p>Metadata lives in the {@link IndexStore}; the encrypted record and the
 * key-hash duplicate index live in the {@link BlobStore}. Every data operation first
 * checks that storage is ready and the encryption session is active, and fails with
 * {@link StorageNotInitializedException} or {@link SessionExpiredException} without
 * touching either store otherwise.
 *
 * <p>A single record is the unit of atomicity: add and rotate either commit fully or
 * undo their partial writes before reporting failure.
 */
@Service
public class CredentialStorageService {

    private static final Logger logger = LoggerFactory.getLogger(CredentialStorageService.class);

    private final IndexStore indexStore;
    private final BlobStore blobStore;
    private final CryptoService cryptoService;
    private final ApiKeyValidationService validationService;
    private final CredentialRecordCodec codec;
    private final CredentialAuditLogger auditLogger;
    private final KeyIdGenerator idGenerator;
    private final Clock clock;
    private final CredentialVaultProperties.Storage settings;

    private final ExpiringCache<String, EncryptedCredential> recordCache;
    private final AtomicReference<StorageState> state = new AtomicReference<>(StorageState.UNINITIALIZED);
    private final AtomicLong totalKeys = new AtomicLong();
    private final Map<String, AtomicLong> operationCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();

    public CredentialStorageService(IndexStore indexStore,
                                    BlobStore blobStore,
                                    CryptoService cryptoService,
                                    ApiKeyValidationService validationService,
                                    CredentialRecordCodec codec,
                                    CredentialAuditLogger auditLogger,
                                    KeyIdGenerator idGenerator,
                                    Clock clock,
                                    CredentialVaultProperties properties) {
        this.indexStore = indexStore;
        this.blobStore = blobStore;
        this.cryptoService = cryptoService;
        this.validationService = validationService;
        this.codec = codec;
        this.auditLogger = auditLogger;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.settings = properties.getStorage();
        this.recordCache = new ExpiringCache<>(settings.getRecordCacheTtl(), settings.getRecordCacheCapacity(), clock);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Derives the session key from the passphrase and makes storage ready. Allowed from
     * the uninitialized and locked states only.
     */
    public Mono<Void> initializeStorage(String passphrase) {
        return Mono.defer(() -> {
            StorageState current = state.get();
            if (current != StorageState.UNINITIALIZED && current != StorageState.LOCKED) {
                return Mono.error(new CredentialStorageException("API key storage already initialized"));
            }
            if (passphrase == null || passphrase.length() < settings.getMinPassphraseLength()) {
                return Mono.error(new IllegalArgumentException(String.format(
                        "Password too weak. Must be at least %d characters long", settings.getMinPassphraseLength())));
            }
            if (!state.compareAndSet(current, StorageState.INITIALIZING)) {
                return Mono.error(new CredentialStorageException("API key storage is already initializing"));
            }
            return Mono.fromRunnable(() -> cryptoService.initialize(passphrase))
                    .then(indexStore.getAll(StorageKeys.METADATA_COLLECTION).count())
                    .doOnNext(count -> {
                        totalKeys.set(count);
                        state.set(StorageState.READY);
                        auditLogger.record("storage_initialized", null, Map.of("keys", count));
                        logger.info("API key storage initialized with {} stored keys", count);
                    })
                    .then()
                    .onErrorResume(e -> {
                        state.set(StorageState.UNINITIALIZED);
                        logger.error("Failed to initialize API key storage", e);
                        return Mono.error(new CredentialStorageException(
                                "Failed to initialize API key storage: " + e.getMessage(), e));
                    });
        });
    }

    /**
     * Ends the encryption session. Stored data is kept; {@link #initializeStorage} with
     * the same passphrase resumes access.
     */
    public Mono<Void> lock() {
        return Mono.fromRunnable(() -> {
            if (state.compareAndSet(StorageState.READY, StorageState.LOCKED)) {
                cryptoService.lock();
                recordCache.clear();
                auditLogger.record("storage_locked", null);
                logger.info("API key storage locked");
            }
        });
    }

    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            recordCache.clear();
            cryptoService.shutdown();
            state.set(StorageState.UNINITIALIZED);
            auditLogger.record("storage_shutdown", null);
            logger.info("API key storage shut down");
        });
    }

    public StorageState getState() {
        return state.get();
    }

    // ---------------------------------------------------------------------
    // CRUD
    // ---------------------------------------------------------------------

    /**
     * Validates, encrypts and stores a new key. The provider is detected from the key
     * when the input does not name one.
     *
     * @throws InvalidKeyFormatException if the key fails its provider's format rules
     * @throws CredentialAlreadyExistsException if the same key is already stored
     * @throws CredentialStorageException if encryption or a store write fails
     */
    public Mono<EncryptedCredential> addKey(CreateKeyInput input) {
        return requireReady().then(Mono.defer(() -> {
            count("add");
            String key = KeySanitizer.sanitize(input.getKey());
            Provider provider = input.getProvider() != null
                    ? input.getProvider()
                    : ProviderRules.detect(key).orElse(null);
            if (provider == null) {
                return Mono.<EncryptedCredential>error(
                        new InvalidKeyFormatException(List.of("could not detect provider")));
            }
            ValidationResult validation = validationService.validateFormat(key, provider);
            if (!validation.isValid()) {
                return Mono.<EncryptedCredential>error(new InvalidKeyFormatException(validation.getErrors()));
            }
            String keyHash = cryptoService.hash(key.getBytes(StandardCharsets.UTF_8));
            return blobStore.get(StorageKeys.hashKey(keyHash))
                    .flatMap(existing -> Mono.<EncryptedCredential>error(
                            new CredentialAlreadyExistsException(codec.hashEntryId(existing))))
                    .switchIfEmpty(Mono.defer(() -> storeNew(input, key, provider, validation, keyHash)))
                    .onErrorResume(e -> {
                        countError("add");
                        auditLogger.record("key_add_failed", null, Map.of(
                                "provider", provider.getTag(), "error", String.valueOf(e.getMessage())));
                        if (isPassThrough(e)) {
                            return Mono.error(e);
                        }
                        return Mono.error(new CredentialStorageException("Failed to add API key: " + e.getMessage(), e));
                    });
        }));
    }

    private Mono<EncryptedCredential> storeNew(CreateKeyInput input, String key, Provider provider,
                                               ValidationResult validation, String keyHash) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            CipherBlob payload = cryptoService.encrypt(key.getBytes(StandardCharsets.UTF_8));
            String id = idGenerator.generate(provider, keyHash);
            CredentialMetadata metadata = CredentialMetadata.builder()
                    .id(id)
                    .provider(provider)
                    .keyType(validation.getKeyType())
                    .status(KeyStatus.ACTIVE)
                    .name(input.getName())
                    .description(input.getDescription())
                    .createdAt(now)
                    .lastUsed(now)
                    .expiresAt(input.getExpiresAt())
                    .maskedKey(KeyMasker.mask(key))
                    .permissions(input.getPermissions() != null && !input.getPermissions().isEmpty()
                            ? new ArrayList<>(input.getPermissions())
                            : new ArrayList<>(List.of(KeyPermission.READ, KeyPermission.WRITE)))
                    .tags(input.getTags() != null ? new ArrayList<>(input.getTags()) : new ArrayList<>())
                    .userId(input.getUserId())
                    .organizationId(input.getOrganizationId())
                    .build();
            return EncryptedCredential.builder()
                    .id(id)
                    .metadata(metadata)
                    .payload(payload)
                    .keyHash(keyHash)
                    .checksum(cryptoService.checksum(payload))
                    .configuration(CredentialConfiguration.defaults().merge(input.getConfiguration()))
                    .usageStats(UsageStats.empty(now))
                    .rotationStatus(RotationStatus.none())
                    .build();
        }).flatMap(record -> writeNew(record)
                .doOnSuccess(v -> {
                    totalKeys.incrementAndGet();
                    auditLogger.record("key_added", record.getId(), Map.of(
                            "provider", provider.getTag(),
                            "tags", record.getMetadata().getTags().size()));
                    logger.info("Stored API key {} for provider {}", record.getId(), provider);
                })
                .thenReturn(record));
    }

    /**
     * Writes metadata, record and hash entry in that order, undoing earlier writes when a
     * later one fails.
     */
    private Mono<Void> writeNew(EncryptedCredential record) {
        String id = record.getId();
        Mono<Void> undoMetadata = compensate(indexStore.delete(StorageKeys.METADATA_COLLECTION, id), id);
        Mono<Void> undoBlob = compensate(blobStore.remove(StorageKeys.blobKey(id)), id);

        return indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(record.getMetadata()))
                .then(blobStore.set(StorageKeys.blobKey(id), codec.recordNode(record))
                        .onErrorResume(e -> undoMetadata.then(Mono.error(e))))
                .then(blobStore.set(StorageKeys.hashKey(record.getKeyHash()), codec.hashEntry(id))
                        .onErrorResume(e -> undoBlob.then(undoMetadata).then(Mono.error(e))));
    }

    private Mono<Void> compensate(Mono<Boolean> undo, String id) {
        return undo.doOnNext(removed -> logger.warn("Rolled back partial write of key {}", id))
                .onErrorResume(e -> {
                    logger.error("Rollback of partial write for key {} failed", id, e);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Loads a key and proves its payload is intact and decryptable. Empty when no key has
     * this id.
     *
     * @throws IntegrityCheckFailedException if the payload does not match its checksum or
     *                                       cannot be decrypted
     */
    public Mono<EncryptedCredential> getKey(String id) {
        return requireReady().then(Mono.defer(() -> {
            count("get");
            Optional<EncryptedCredential> cached = recordCache.get(id);
            if (cached.isPresent()) {
                logger.debug("Record cache hit for key {}", id);
                // a hit skips the last-used write, never the integrity check
                return loadVerified(id)
                        .doOnSuccess(record -> {
                            if (record == null) {
                                recordCache.invalidate(id);
                            } else {
                                recordCache.put(id, record);
                            }
                        });
            }
            return loadVerified(id)
                    .flatMap(this::touchLastUsed)
                    .doOnNext(record -> recordCache.put(id, record));
        }));
    }

    private Mono<EncryptedCredential> loadVerified(String id) {
        return loadRecord(id).map(record -> {
            if (!record.hasPayload() || !cryptoService.verifyChecksum(record.getPayload(), record.getChecksum())) {
                throw integrityFailure(id, null);
            }
            try {
                byte[] plaintext = cryptoService.decrypt(record.getPayload());
                Arrays.fill(plaintext, (byte) 0);
            } catch (CredentialEncryptionException e) {
                throw integrityFailure(id, e);
            }
            return record;
        });
    }

    private IntegrityCheckFailedException integrityFailure(String id, Throwable cause) {
        countError("integrity");
        recordCache.invalidate(id);
        auditLogger.record("integrity_check_failed", id);
        logger.warn("Integrity check failed for key {}", id);
        return cause == null ? new IntegrityCheckFailedException(id) : new IntegrityCheckFailedException(id, cause);
    }

    private Mono<EncryptedCredential> touchLastUsed(EncryptedCredential record) {
        CredentialMetadata touched = record.getMetadata().toBuilder().lastUsed(clock.instant()).build();
        return indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(touched))
                .thenReturn(record.toBuilder().metadata(touched).build())
                .onErrorResume(e -> {
                    logger.warn("Could not update last-used time of key {}: {}", record.getId(), e.getMessage());
                    return Mono.just(record);
                });
    }

    /**
     * Merges metadata fields and configuration sections; the secret is never touched.
     */
    public Mono<EncryptedCredential> updateKey(String id, UpdateKeyInput patch) {
        return requireReady().then(Mono.defer(() -> {
            count("update");
            return loadRecord(id)
                    .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                    .flatMap(existing -> {
                        CredentialMetadata current = existing.getMetadata();
                        CredentialMetadata merged = current.toBuilder()
                                .name(patch.getName() != null ? patch.getName() : current.getName())
                                .description(patch.getDescription() != null
                                        ? patch.getDescription() : current.getDescription())
                                .tags(patch.getTags() != null ? new ArrayList<>(patch.getTags()) : current.getTags())
                                .permissions(patch.getPermissions() != null
                                        ? new ArrayList<>(patch.getPermissions()) : current.getPermissions())
                                .status(patch.getStatus() != null ? patch.getStatus() : current.getStatus())
                                .expiresAt(patch.getExpiresAt() != null ? patch.getExpiresAt() : current.getExpiresAt())
                                .build();
                        CredentialConfiguration configuration = existing.getConfiguration() != null
                                ? existing.getConfiguration().merge(patch.getConfiguration())
                                : CredentialConfiguration.defaults().merge(patch.getConfiguration());
                        EncryptedCredential updated = existing.toBuilder()
                                .metadata(merged)
                                .configuration(configuration)
                                .build();
                        return writeRecord(existing, updated)
                                .doOnSuccess(v -> {
                                    auditLogger.record("key_updated", id);
                                    logger.info("Updated API key {}", id);
                                })
                                .thenReturn(updated);
                    })
                    .doOnError(e -> countError("update"));
        }));
    }

    /**
     * Removes metadata, record and hash entry.
     *
     * @return false if no key has this id
     */
    public Mono<Boolean> deleteKey(String id) {
        return requireReady().then(Mono.defer(() -> {
            count("delete");
            return loadRecord(id)
                    .flatMap(existing -> indexStore.delete(StorageKeys.METADATA_COLLECTION, id)
                            .then(blobStore.remove(StorageKeys.blobKey(id)))
                            .then(releaseHash(existing.getKeyHash(), id))
                            .then(Mono.fromRunnable(() -> {
                                recordCache.invalidate(id);
                                totalKeys.updateAndGet(n -> Math.max(0, n - 1));
                                auditLogger.record("key_deleted", id);
                                logger.info("Deleted API key {}", id);
                            }))
                            .thenReturn(true))
                    .defaultIfEmpty(false)
                    .doOnError(e -> countError("delete"))
                    .onErrorMap(e -> !(e instanceof CredentialException),
                            e -> new CredentialStorageException("Failed to delete API key: " + e.getMessage(), e));
        }));
    }

    /**
     * Marks a key revoked and keeps the record.
     *
     * @return false if no key has this id
     */
    public Mono<Boolean> revokeKey(String id) {
        return requireReady().then(Mono.defer(() -> {
            count("revoke");
            return loadRecord(id)
                    .flatMap(existing -> {
                        EncryptedCredential revoked = existing.toBuilder()
                                .metadata(existing.getMetadata().toBuilder().status(KeyStatus.REVOKED).build())
                                .build();
                        return writeRecord(existing, revoked)
                                .doOnSuccess(v -> {
                                    auditLogger.record("key_revoked", id);
                                    logger.info("Revoked API key {}", id);
                                })
                                .thenReturn(true);
                    })
                    .defaultIfEmpty(false);
        }));
    }

    /**
     * Writes the record then its metadata. If the metadata write fails the previous record
     * is written back.
     */
    private Mono<Void> writeRecord(EncryptedCredential previous, EncryptedCredential updated) {
        String id = updated.getId();
        return blobStore.set(StorageKeys.blobKey(id), codec.recordNode(updated))
                .then(indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(updated.getMetadata()))
                        .onErrorResume(e -> blobStore.set(StorageKeys.blobKey(id), codec.recordNode(previous))
                                .onErrorResume(undo -> {
                                    logger.error("Could not restore record of key {}", id, undo);
                                    return Mono.empty();
                                })
                                .then(Mono.error(e))))
                .doFinally(signal -> recordCache.invalidate(id))
                .onErrorMap(e -> !(e instanceof CredentialException),
                        e -> new CredentialStorageException("Failed to update API key: " + e.getMessage(), e));
    }

    // ---------------------------------------------------------------------
    // Rotation
    // ---------------------------------------------------------------------

    /**
     * Replaces the secret of a key while keeping its id, metadata and history.
     *
     * <p>A new key that fails format validation or already belongs to another record is
     * rejected before anything is written. Once the current record is snapshotted, any
     * failure restores it, records a failed history entry and reports
     * {@code rollbackAvailable=true}.
     */
    public Mono<KeyRotationResult> rotateKey(String id, String newRawKey) {
        return requireReady().then(Mono.defer(() -> {
            count("rotate");
            String newKey = KeySanitizer.sanitize(newRawKey);
            return loadRecord(id)
                    .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                    .flatMap(existing -> {
                        Provider provider = existing.getMetadata().getProvider();
                        ValidationResult validation = validationService.validateFormat(newKey, provider);
                        if (!validation.isValid()) {
                            auditLogger.record("key_rotation_rejected", id, Map.of("reason", "invalid format"));
                            return Mono.just(KeyRotationResult.rejected(
                                    "Invalid API key format: " + String.join(", ", validation.getErrors())));
                        }
                        String newHash = cryptoService.hash(newKey.getBytes(StandardCharsets.UTF_8));
                        return blobStore.get(StorageKeys.hashKey(newHash))
                                .flatMap(entry -> Mono.justOrEmpty(codec.hashEntryId(entry)))
                                .filter(owner -> !id.equals(owner))
                                .map(owner -> KeyRotationResult.rejected("API key already exists with ID: " + owner))
                                .switchIfEmpty(Mono.defer(() -> performRotation(existing, newKey, newHash)));
                    });
        }));
    }

    private Mono<KeyRotationResult> performRotation(EncryptedCredential snapshot, String newKey, String newHash) {
        String id = snapshot.getId();
        String oldHash = snapshot.getKeyHash();
        RotationStatus previousRotation = snapshot.getRotationStatus() != null
                ? snapshot.getRotationStatus() : RotationStatus.none();
        CredentialMetadata rotatingMetadata = snapshot.getMetadata().toBuilder().status(KeyStatus.ROTATING).build();

        return indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(rotatingMetadata))
                .then(Mono.fromCallable(() -> {
                    Instant now = clock.instant();
                    CipherBlob payload = cryptoService.encrypt(newKey.getBytes(StandardCharsets.UTF_8));
                    RotationStatus completed = previousRotation
                            .append(RotationHistoryEntry.builder()
                                    .timestamp(now)
                                    .success(true)
                                    .reason("Manual rotation")
                                    .oldKeyId(id)
                                    .newKeyId(id)
                                    .build())
                            .toBuilder()
                            .state(RotationState.COMPLETED)
                            .lastRotation(now)
                            .nextScheduledRotation(nextRotation(snapshot.getConfiguration(), now))
                            .build();
                    return snapshot.toBuilder()
                            .metadata(snapshot.getMetadata().toBuilder().maskedKey(KeyMasker.mask(newKey)).build())
                            .payload(payload)
                            .checksum(cryptoService.checksum(payload))
                            .keyHash(newHash)
                            .rotationStatus(completed)
                            .build();
                }))
                .flatMap(rotated -> blobStore.set(StorageKeys.blobKey(id), codec.recordNode(rotated))
                        .then(indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(rotated.getMetadata())))
                        .then(blobStore.set(StorageKeys.hashKey(newHash), codec.hashEntry(id)))
                        .then(newHash.equals(oldHash) ? Mono.<Void>empty() : releaseHash(oldHash, id))
                        .thenReturn(rotated))
                .map(rotated -> {
                    recordCache.invalidate(id);
                    auditLogger.record("key_rotated", id, Map.of("maskedKey", rotated.getMetadata().getMaskedKey()));
                    logger.info("Rotated API key {}", id);
                    return KeyRotationResult.succeeded(id);
                })
                .onErrorMap(e -> !(e instanceof RotationFailedException),
                        e -> new RotationFailedException("Rotation failed: " + e.getMessage(), e))
                .onErrorResume(RotationFailedException.class, e -> rollback(snapshot, newHash, e));
    }

    private Mono<KeyRotationResult> rollback(EncryptedCredential snapshot, String newHash, RotationFailedException failure) {
        String id = snapshot.getId();
        String oldHash = snapshot.getKeyHash();
        String reason = failure.getCause() != null ? failure.getCause().getMessage() : failure.getMessage();
        RotationStatus previous = snapshot.getRotationStatus() != null ? snapshot.getRotationStatus() : RotationStatus.none();
        EncryptedCredential restored = snapshot.toBuilder()
                .rotationStatus(previous
                        .append(RotationHistoryEntry.builder()
                                .timestamp(clock.instant())
                                .success(false)
                                .reason(reason)
                                .oldKeyId(id)
                                .build())
                        .toBuilder()
                        .state(RotationState.FAILED)
                        .build())
                .build();

        Mono<Void> restoreHash = oldHash != null
                ? blobStore.set(StorageKeys.hashKey(oldHash), codec.hashEntry(id))
                : Mono.empty();
        Mono<Void> releaseNew = newHash.equals(oldHash) ? Mono.empty() : releaseHash(newHash, id);

        return blobStore.set(StorageKeys.blobKey(id), codec.recordNode(restored))
                .then(indexStore.put(StorageKeys.METADATA_COLLECTION, codec.metadataNode(snapshot.getMetadata())))
                .then(restoreHash)
                .then(releaseNew)
                .then(Mono.fromCallable(() -> {
                    countError("rotate");
                    recordCache.invalidate(id);
                    auditLogger.record("key_rotation_failed", id, Map.of("error", String.valueOf(reason)));
                    logger.warn("Rotation of key {} failed and was rolled back: {}", id, reason);
                    return KeyRotationResult.rolledBack(reason);
                }))
                .onErrorResume(e -> {
                    logger.error("Rollback of rotation for key {} failed", id, e);
                    return Mono.error(new CredentialStorageException(
                            "Rotation failed and rollback did not complete: " + e.getMessage(), e));
                });
    }

    private Instant nextRotation(CredentialConfiguration configuration, Instant now) {
        if (configuration == null || configuration.getRotation() == null
                || !configuration.getRotation().isEnabled() || configuration.getRotation().getIntervalDays() == null) {
            return null;
        }
        return now.plus(Duration.ofDays(configuration.getRotation().getIntervalDays()));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Filters, sorts and pages the stored metadata. Secrets are never read.
     */
    public Mono<KeyListResult> listKeys(KeyQueryOptions options) {
        KeyQueryOptions opts = options != null ? options : KeyQueryOptions.all();
        return requireReady().then(Mono.defer(() -> {
            count("list");
            int offset = parseOffset(opts);
            Instant now = clock.instant();
            Flux<ObjectNode> source = opts.getProvider() != null
                    ? indexStore.query(StorageKeys.METADATA_COLLECTION, "provider",
                            opts.getProvider().getTag(), QueryOptions.unbounded())
                    : indexStore.getAll(StorageKeys.METADATA_COLLECTION);
            return source.map(codec::metadata)
                    .map(metadata -> metadata.toBuilder().status(metadata.effectiveStatus(now)).build())
                    .filter(metadata -> matches(metadata, opts))
                    .collectList()
                    .map(matching -> {
                        matching.sort(comparator(opts));
                        int total = matching.size();
                        int from = Math.min(offset, total);
                        int to = opts.getLimit() != null ? Math.min(total, from + Math.max(0, opts.getLimit())) : total;
                        boolean hasMore = to < total;
                        return KeyListResult.builder()
                                .keys(List.copyOf(matching.subList(from, to)))
                                .total(total)
                                .hasMore(hasMore)
                                .nextCursor(hasMore ? String.valueOf(to) : null)
                                .build();
                    });
        }));
    }

    public Flux<CredentialMetadata> getKeysByProvider(Provider provider) {
        return listKeys(KeyQueryOptions.builder().provider(provider).build())
                .flatMapIterable(KeyListResult::getKeys);
    }

    /**
     * Active keys whose expiry falls within the next {@code days} days.
     */
    public Flux<CredentialMetadata> getExpiringKeys(int days) {
        Duration window = Duration.ofDays(days);
        return listKeys(KeyQueryOptions.all())
                .flatMapIterable(KeyListResult::getKeys)
                .filter(metadata -> metadata.getStatus() == KeyStatus.ACTIVE)
                .filter(metadata -> metadata.isExpiringWithin(window, clock.instant()));
    }

    /**
     * Active keys whose rotation settings say they are due: expiring within the warning
     * window or older than the rotation interval.
     */
    public Flux<CredentialMetadata> getKeysDueForRotation() {
        return listKeys(KeyQueryOptions.builder().status(KeyStatus.ACTIVE).build())
                .flatMapIterable(KeyListResult::getKeys)
                .concatMap(metadata -> loadRecord(metadata.getId()))
                .filter(record -> record.getConfiguration() != null
                        && RotationPolicy.needsRotation(record.getMetadata(),
                                record.getConfiguration().getRotation(), clock.instant()))
                .map(EncryptedCredential::getMetadata);
    }

    private static int parseOffset(KeyQueryOptions opts) {
        if (opts.getCursor() == null || opts.getCursor().isBlank()) {
            return Math.max(0, opts.getOffset());
        }
        try {
            return Math.max(0, Integer.parseInt(opts.getCursor().trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + opts.getCursor(), e);
        }
    }

    private static boolean matches(CredentialMetadata metadata, KeyQueryOptions opts) {
        if (opts.getProvider() != null && metadata.getProvider() != opts.getProvider()) {
            return false;
        }
        if (opts.getStatus() != null && metadata.getStatus() != opts.getStatus()) {
            return false;
        }
        if (opts.getKeyType() != null && metadata.getKeyType() != opts.getKeyType()) {
            return false;
        }
        if (opts.getTags() != null && !opts.getTags().isEmpty()) {
            List<String> tags = metadata.getTags() != null ? metadata.getTags() : List.of();
            if (opts.getTags().stream().noneMatch(tags::contains)) {
                return false;
            }
        }
        if (opts.getSearch() != null && !opts.getSearch().isBlank()) {
            String needle = opts.getSearch().toLowerCase(Locale.ROOT);
            String haystack = (nullToEmpty(metadata.getName()) + " " + nullToEmpty(metadata.getDescription()))
                    .toLowerCase(Locale.ROOT);
            return haystack.contains(needle);
        }
        return true;
    }

    private static Comparator<CredentialMetadata> comparator(KeyQueryOptions opts) {
        Comparator<CredentialMetadata> comparator;
        switch (opts.getSortBy() != null ? opts.getSortBy() : KeyQueryOptions.SortField.CREATED_AT) {
            case NAME:
                comparator = Comparator.comparing(CredentialMetadata::getName,
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));
                break;
            case LAST_USED:
                comparator = Comparator.comparing(CredentialMetadata::getLastUsed,
                        Comparator.nullsLast(Comparator.naturalOrder()));
                break;
            case PROVIDER:
                comparator = Comparator.comparing(metadata -> metadata.getProvider().getTag());
                break;
            case CREATED_AT:
            default:
                comparator = Comparator.comparing(CredentialMetadata::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder()));
                break;
        }
        comparator = comparator.thenComparing(CredentialMetadata::getId);
        return opts.getSortOrder() == KeyQueryOptions.SortOrder.DESC ? comparator.reversed() : comparator;
    }

    // ---------------------------------------------------------------------
    // Usage
    // ---------------------------------------------------------------------

    public Mono<UsageStats> recordUsage(String id, UsageRecord usage) {
        return requireReady().then(Mono.defer(() -> {
            count("usage");
            return loadRecord(id)
                    .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                    .flatMap(existing -> {
                        Instant now = clock.instant();
                        EncryptedCredential updated = existing.toBuilder()
                                .usageStats(UsageRollup.apply(existing.getUsageStats(), usage, now))
                                .metadata(existing.getMetadata().toBuilder().lastUsed(now).build())
                                .build();
                        return writeRecord(existing, updated).thenReturn(updated.getUsageStats());
                    })
                    .doOnNext(stats -> logger.debug("Recorded usage for key {}", id));
        }));
    }

    public Mono<UsageStats> getKeyUsageStats(String id) {
        return requireReady().then(Mono.defer(() -> loadRecord(id)
                .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                .map(record -> record.getUsageStats() != null
                        ? record.getUsageStats()
                        : UsageStats.empty(record.getMetadata().getCreatedAt()))));
    }

    public Mono<UsageStats> resetUsageStats(String id) {
        return requireReady().then(Mono.defer(() -> loadRecord(id)
                .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                .flatMap(existing -> {
                    EncryptedCredential reset = existing.toBuilder()
                            .usageStats(UsageStats.empty(clock.instant()))
                            .build();
                    return writeRecord(existing, reset)
                            .doOnSuccess(v -> auditLogger.record("usage_reset", id))
                            .thenReturn(reset.getUsageStats());
                })));
    }

    // ---------------------------------------------------------------------
    // Connection test
    // ---------------------------------------------------------------------

    /**
     * Probes the provider with the stored key. The key is decrypted in memory for the
     * probe only and is never logged or returned.
     */
    public Mono<ConnectionTestResult> testKeyConnection(String id) {
        return requireReady().then(Mono.defer(() -> {
            count("test");
            return loadVerified(id)
                    .switchIfEmpty(Mono.error(new CredentialNotFoundException(id)))
                    .flatMap(record -> {
                        byte[] plaintext = cryptoService.decrypt(record.getPayload());
                        String key = new String(plaintext, StandardCharsets.UTF_8);
                        Arrays.fill(plaintext, (byte) 0);
                        return validationService.validateLive(key, record.getMetadata().getProvider(),
                                        liveOptions(record.getConfiguration()))
                                .flatMap(live -> {
                                    Map<String, String> metadata = new LinkedHashMap<>();
                                    metadata.put("endpoint", live.getEndpoint());
                                    if (live.getStatusCode() != null) {
                                        metadata.put("statusCode", String.valueOf(live.getStatusCode()));
                                    }
                                    if (live.getMetadata() != null) {
                                        metadata.putAll(live.getMetadata());
                                    }
                                    ConnectionTestResult result = ConnectionTestResult.builder()
                                            .success(live.isValid())
                                            .responseTime(live.getResponseTime())
                                            .error(live.getError())
                                            .metadata(metadata)
                                            .build();
                                    auditLogger.record("key_connection_tested", id, Map.of("success", live.isValid()));
                                    return live.isValid()
                                            ? touchLastUsed(record).thenReturn(result)
                                            : Mono.just(result);
                                });
                    });
        }));
    }

    private static LiveValidationOptions liveOptions(CredentialConfiguration configuration) {
        LiveValidationOptions.LiveValidationOptionsBuilder builder = LiveValidationOptions.builder();
        if (configuration != null && configuration.getEndpoint() != null) {
            CredentialConfiguration.EndpointSettings endpoint = configuration.getEndpoint();
            builder.customEndpoint(endpoint.getBaseUrl());
            builder.customHeaders(endpoint.getCustomHeaders());
            if (endpoint.getTimeoutMs() != null) {
                builder.timeout(Duration.ofMillis(endpoint.getTimeoutMs()));
            }
        }
        return builder.build();
    }

    // ---------------------------------------------------------------------
    // Import / export
    // ---------------------------------------------------------------------

    /**
     * Exports every stored key. Without secrets each entry is metadata only; with secrets
     * it is the full encrypted record, still encrypted.
     */
    public Mono<ExportBundle> exportKeys(boolean includeSecrets) {
        return requireReady().then(Mono.defer(() -> {
            count("export");
            return indexStore.getAll(StorageKeys.METADATA_COLLECTION)
                    .map(codec::metadata)
                    .concatMap(metadata -> includeSecrets
                            ? loadRecord(metadata.getId())
                            : Mono.just(EncryptedCredential.builder().id(metadata.getId()).metadata(metadata).build()))
                    .collectList()
                    .map(keys -> ExportBundle.builder()
                            .timestamp(clock.instant())
                            .includeSecrets(includeSecrets)
                            .keys(keys)
                            .build())
                    .doOnNext(bundle -> {
                        auditLogger.record("keys_exported", null, Map.of(
                                "count", bundle.getKeys().size(), "includeSecrets", includeSecrets));
                        logger.info("Exported {} API keys (secrets included: {})", bundle.getKeys().size(), includeSecrets);
                    });
        }));
    }

    /**
     * Imports encrypted records one by one. An entry that fails is reported in the result
     * and does not stop the others.
     */
    public Mono<ImportResult> importKeys(ExportBundle bundle) {
        return requireReady().then(Mono.defer(() -> {
            count("import");
            List<EncryptedCredential> entries = bundle != null && bundle.getKeys() != null ? bundle.getKeys() : List.of();
            return Flux.fromIterable(entries)
                    .concatMap(entry -> importEntry(entry)
                            .thenReturn(Optional.<ImportResult.ImportError>empty())
                            .onErrorResume(e -> Mono.just(Optional.of(new ImportResult.ImportError(
                                    entry != null && entry.getId() != null ? entry.getId() : "unknown",
                                    e.getMessage())))))
                    .collectList()
                    .map(outcomes -> {
                        List<ImportResult.ImportError> errors = outcomes.stream()
                                .flatMap(Optional::stream)
                                .collect(Collectors.toList());
                        return ImportResult.builder()
                                .success(outcomes.size() - errors.size())
                                .failed(errors.size())
                                .errors(errors)
                                .build();
                    })
                    .doOnNext(result -> {
                        auditLogger.record("keys_imported", null, Map.of(
                                "success", result.getSuccess(), "failed", result.getFailed()));
                        logger.info("Imported {} API keys, {} failed", result.getSuccess(), result.getFailed());
                    });
        }));
    }

    private Mono<Void> importEntry(EncryptedCredential entry) {
        if (entry == null || entry.getId() == null || entry.getMetadata() == null) {
            return Mono.error(new CredentialStorageException("Entry is missing id or metadata"));
        }
        if (!entry.hasPayload() || entry.getKeyHash() == null) {
            return Mono.error(new CredentialStorageException("Entry has no encrypted payload"));
        }
        if (!cryptoService.verifyChecksum(entry.getPayload(), entry.getChecksum())) {
            return Mono.error(new IntegrityCheckFailedException(entry.getId()));
        }
        String id = entry.getId();
        EncryptedCredential record = entry.toBuilder()
                .metadata(entry.getMetadata().toBuilder().id(id).build())
                .usageStats(entry.getUsageStats() != null ? entry.getUsageStats() : UsageStats.empty(clock.instant()))
                .rotationStatus(entry.getRotationStatus() != null ? entry.getRotationStatus() : RotationStatus.none())
                .build();
        return indexStore.get(StorageKeys.METADATA_COLLECTION, id)
                .flatMap(existing -> Mono.<Void>error(new CredentialAlreadyExistsException(id)))
                .switchIfEmpty(Mono.defer(() -> blobStore.get(StorageKeys.hashKey(entry.getKeyHash()))
                        .flatMap(owner -> Mono.<Void>error(new CredentialAlreadyExistsException(codec.hashEntryId(owner))))
                        .switchIfEmpty(Mono.defer(() -> writeNew(record)
                                .doOnSuccess(v -> {
                                    totalKeys.incrementAndGet();
                                    auditLogger.record("key_imported", id);
                                })))));
    }

    // ---------------------------------------------------------------------
    // Validation, cache, health, metrics
    // ---------------------------------------------------------------------

    public ValidationResult validateKey(String rawKey, Provider provider) {
        return validationService.validateFormat(rawKey, provider);
    }

    public Mono<Void> clearCache() {
        return Mono.fromRunnable(() -> {
            recordCache.clear();
            validationService.clearCaches();
            logger.info("Record and validation caches cleared");
        });
    }

    /**
     * Reports one check per subsystem; healthy only if all pass. Never fails.
     */
    public Mono<HealthCheckResult> getHealthStatus() {
        HealthCheck encryption = cryptoService.isInitialized()
                ? HealthCheck.pass("encryption_service", "Encryption service initialized")
                : HealthCheck.fail("encryption_service", "Encryption service not initialized");
        HealthCheck session = state.get() == StorageState.READY && cryptoService.isSessionActive()
                ? HealthCheck.pass("session_status", "Session active")
                : HealthCheck.fail("session_status", "Session inactive (" + state.get() + ")");
        return Mono.zip(
                        storeCheck("index_store", indexStore.ping()),
                        storeCheck("blob_store", blobStore.ping()))
                .map(stores -> HealthCheckResult.of(List.of(encryption, session, stores.getT1(), stores.getT2())));
    }

    private static Mono<HealthCheck> storeCheck(String name, Mono<Boolean> ping) {
        return ping.map(ok -> ok
                        ? HealthCheck.pass(name, "Reachable")
                        : HealthCheck.fail(name, "Ping failed"))
                .defaultIfEmpty(HealthCheck.fail(name, "No response"))
                .onErrorResume(e -> Mono.just(HealthCheck.fail(name, "Unreachable: " + e.getMessage())));
    }

    public StorageMetrics getMetrics() {
        return StorageMetrics.builder()
                .state(state.get())
                .totalKeys(totalKeys.get())
                .cachedRecords(recordCache.size())
                .cacheHits(recordCache.hits())
                .cacheMisses(recordCache.misses())
                .operations(snapshot(operationCounts))
                .errors(snapshot(errorCounts))
                .build();
    }

    /**
     * Drops expired record cache entries.
     */
    public int purgeExpiredCache() {
        return recordCache.purgeExpired();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Mono<Void> requireReady() {
        return Mono.defer(() -> {
            StorageState current = state.get();
            if (current == StorageState.LOCKED) {
                return Mono.error(new SessionExpiredException());
            }
            if (current != StorageState.READY || !cryptoService.isInitialized()) {
                return Mono.error(new StorageNotInitializedException());
            }
            if (!cryptoService.isSessionActive()) {
                // idle timeout: lock so the passphrase can be supplied again
                if (state.compareAndSet(StorageState.READY, StorageState.LOCKED)) {
                    cryptoService.lock();
                    recordCache.clear();
                    auditLogger.record("session_expired", null);
                    logger.info("Encryption session expired, API key storage locked");
                }
                return Mono.error(new SessionExpiredException());
            }
            cryptoService.refreshSession();
            return Mono.empty();
        });
    }

    /**
     * Metadata from the index merged with the stored record. Empty when the index has no
     * entry; a record without its blob is returned without payload.
     */
    private Mono<EncryptedCredential> loadRecord(String id) {
        return indexStore.get(StorageKeys.METADATA_COLLECTION, id)
                .map(codec::metadata)
                .flatMap(metadata -> blobStore.get(StorageKeys.blobKey(id))
                        .map(codec::record)
                        .map(record -> record.toBuilder().id(id).metadata(metadata).build())
                        .defaultIfEmpty(EncryptedCredential.builder().id(id).metadata(metadata).build()));
    }

    private Mono<Void> releaseHash(String keyHash, String id) {
        if (keyHash == null) {
            return Mono.empty();
        }
        String hashKey = StorageKeys.hashKey(keyHash);
        return blobStore.get(hashKey)
                .filter(entry -> id.equals(codec.hashEntryId(entry)))
                .flatMap(entry -> blobStore.remove(hashKey))
                .then();
    }

    private static boolean isPassThrough(Throwable e) {
        return e instanceof InvalidKeyFormatException
                || e instanceof CredentialAlreadyExistsException
                || e instanceof StorageNotInitializedException
                || e instanceof SessionExpiredException;
    }

    private void count(String operation) {
        operationCounts.computeIfAbsent(operation, k -> new AtomicLong()).incrementAndGet();
    }

    private void countError(String operation) {
        errorCounts.computeIfAbsent(operation, k -> new AtomicLong()).incrementAndGet();
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        Map<String, Long> copy = new LinkedHashMap<>();
        counters.forEach((key, value) -> copy.put(key, value.get()));
        return copy;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
