package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.model.CredentialMetadata;
import com.openrangelabs.donpetre.credentials.model.EncryptedCredential;
import com.openrangelabs.donpetre.credentials.model.KeyPermission;
import com.openrangelabs.donpetre.credentials.model.KeyStatus;
import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.model.RotationState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Response DTO for key operations.
 *
 * <p>Contains key metadata and the masked key but never the secret or its ciphertext.
 * Includes expiration analysis computed at conversion time.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Stored key metadata (excludes the secret)")
public class CredentialResponseDto {

    @Schema(description = "Key identifier", example = "openai-1735689600000-k3j9x2-1a2b3c4d")
    String id;

    @Schema(description = "Provider", example = "openai")
    Provider provider;

    KeyType keyType;

    @Schema(description = "Effective status; EXPIRED once the expiry has passed", example = "ACTIVE")
    KeyStatus status;

    String name;

    String description;

    @Schema(description = "Masked key", example = "sk-p...9xYz")
    String maskedKey;

    List<String> tags;

    List<KeyPermission> permissions;

    Instant createdAt;

    Instant lastUsed;

    Instant expiresAt;

    @Schema(description = "Whole days until expiry, rounded up (null if no expiration)", example = "45")
    Long daysUntilExpiration;

    @Schema(description = "Human-readable expiration status", example = "HEALTHY",
            allowableValues = {"HEALTHY", "EXPIRING_SOON", "EXPIRED", "NO_EXPIRATION"})
    String expirationStatus;

    @Schema(description = "Rotation state, when the full record was loaded")
    RotationState rotationState;

    String userId;

    String organizationId;

    /**
     * Creates a response from a full record.
     *
     * @param credential the stored record
     * @param now evaluation instant for the expiry fields
     * @param warningDays window for EXPIRING_SOON
     * @return response without secret material
     */
    public static CredentialResponseDto fromEntity(EncryptedCredential credential, Instant now, int warningDays) {
        CredentialResponseDto dto = fromMetadata(credential.getMetadata(), now, warningDays);
        if (credential.getRotationStatus() == null) {
            return dto;
        }
        return dto.toBuilder().rotationState(credential.getRotationStatus().getState()).build();
    }

    public static CredentialResponseDto fromMetadata(CredentialMetadata metadata, Instant now, int warningDays) {
        String expirationStatus;
        if (metadata.getExpiresAt() == null) {
            expirationStatus = "NO_EXPIRATION";
        } else if (metadata.isExpiredAt(now)) {
            expirationStatus = "EXPIRED";
        } else if (metadata.isExpiringWithin(Duration.ofDays(warningDays), now)) {
            expirationStatus = "EXPIRING_SOON";
        } else {
            expirationStatus = "HEALTHY";
        }

        return CredentialResponseDto.builder()
                .id(metadata.getId())
                .provider(metadata.getProvider())
                .keyType(metadata.getKeyType())
                .status(metadata.effectiveStatus(now))
                .name(metadata.getName())
                .description(metadata.getDescription())
                .maskedKey(metadata.getMaskedKey())
                .tags(metadata.getTags())
                .permissions(metadata.getPermissions())
                .createdAt(metadata.getCreatedAt())
                .lastUsed(metadata.getLastUsed())
                .expiresAt(metadata.getExpiresAt())
                .daysUntilExpiration(metadata.daysUntilExpiration(now))
                .expirationStatus(expirationStatus)
                .userId(metadata.getUserId())
                .organizationId(metadata.getOrganizationId())
                .build();
    }
}
