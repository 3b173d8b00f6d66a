package com.openrangelabs.donpetre.credentials.support;

import com.openrangelabs.donpetre.credentials.model.CredentialConfiguration.RotationSettings;
import com.openrangelabs.donpetre.credentials.model.CredentialMetadata;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a key is due for rotation under its rotation settings.
 */
public final class RotationPolicy {

    private RotationPolicy() {
    }

    /**
     * A key needs rotation when rotation is enabled and either the key expires within
     * {@code warnDays} or it is older than {@code intervalDays}.
     */
    public static boolean needsRotation(CredentialMetadata metadata, RotationSettings rotation, Instant now) {
        if (metadata == null || rotation == null || !rotation.isEnabled()) {
            return false;
        }
        if (metadata.getExpiresAt() != null && rotation.getWarnDays() != null) {
            Instant warnFrom = metadata.getExpiresAt().minus(Duration.ofDays(rotation.getWarnDays()));
            if (!now.isBefore(warnFrom)) {
                return true;
            }
        }
        if (metadata.getCreatedAt() != null && rotation.getIntervalDays() != null) {
            Instant due = metadata.getCreatedAt().plus(Duration.ofDays(rotation.getIntervalDays()));
            return !now.isBefore(due);
        }
        return false;
    }
}
