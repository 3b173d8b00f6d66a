package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The persisted unit: metadata plus the encrypted secret and everything owned by it.
 *
 * <p>{@code keyHash} is a one-way digest of the raw key used only for duplicate
 * detection; {@code checksum} is an integrity digest over {@code payload}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EncryptedCredential {

    public static final int STORAGE_VERSION = 1;

    private String id;
    private CredentialMetadata metadata;
    private CipherBlob payload;
    private String keyHash;
    private String checksum;

    @Builder.Default
    private int storageVersion = STORAGE_VERSION;

    private CredentialConfiguration configuration;
    private UsageStats usageStats;
    private RotationStatus rotationStatus;

    @JsonIgnore
    public boolean hasPayload() {
        return payload != null && payload.getCipher() != null;
    }

    /**
     * Copy carrying only identity, metadata and configuration; used wherever secrets
     * must not leave the storage layer.
     */
    public EncryptedCredential withoutSecrets() {
        return EncryptedCredential.builder()
                .id(id)
                .metadata(metadata)
                .storageVersion(storageVersion)
                .configuration(configuration)
                .usageStats(usageStats)
                .rotationStatus(rotationStatus)
                .build();
    }
}
