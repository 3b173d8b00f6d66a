package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Unencrypted, indexable description of a stored API key.
 *
 * <p>{@code maskedKey} is an irreversible truncation of the raw key (first and last
 * few characters only); it is never an encryption of it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CredentialMetadata {

    private String id;
    private Provider provider;
    private KeyType keyType;
    private KeyStatus status;
    private String name;
    private String description;
    private Instant createdAt;
    private Instant lastUsed;
    private Instant expiresAt;
    private String maskedKey;

    @Builder.Default
    private List<KeyPermission> permissions = new ArrayList<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String userId;
    private String organizationId;

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Status as seen at {@code now}: an active key past its expiry reports {@link KeyStatus#EXPIRED}.
     */
    @JsonIgnore
    public KeyStatus effectiveStatus(Instant now) {
        if (status == KeyStatus.ACTIVE && isExpiredAt(now)) {
            return KeyStatus.EXPIRED;
        }
        return status;
    }

    /**
     * Whole days until expiry, rounded up, or {@code null} when the key never expires.
     */
    @JsonIgnore
    public Long daysUntilExpiration(Instant now) {
        if (expiresAt == null) {
            return null;
        }
        long millis = Duration.between(now, expiresAt).toMillis();
        long day = Duration.ofDays(1).toMillis();
        return Math.floorDiv(millis + day - 1, day);
    }

    @JsonIgnore
    public boolean isExpiringWithin(Duration window, Instant now) {
        return expiresAt != null && !isExpiredAt(now) && !expiresAt.isAfter(now.plus(window));
    }
}
