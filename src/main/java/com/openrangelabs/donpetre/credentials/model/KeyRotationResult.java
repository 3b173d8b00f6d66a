package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a rotation. {@code rollbackAvailable} is true only when a failure happened
 * after the previous secret was snapshotted and restored.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeyRotationResult {

    boolean success;
    String newKeyId;
    String error;
    boolean rollbackAvailable;

    public static KeyRotationResult succeeded(String keyId) {
        return KeyRotationResult.builder().success(true).newKeyId(keyId).build();
    }

    public static KeyRotationResult rejected(String error) {
        return KeyRotationResult.builder().success(false).error(error).rollbackAvailable(false).build();
    }

    public static KeyRotationResult rolledBack(String error) {
        return KeyRotationResult.builder().success(false).error(error).rollbackAvailable(true).build();
    }
}
