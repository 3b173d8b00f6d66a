package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of a format check. {@code provider} is the detected provider when one was
 * detected, otherwise the declared one.
 */
@Value
@Builder(toBuilder = true)
public class ValidationResult {

    boolean valid;
    List<String> errors;
    List<String> warnings;
    Provider provider;
    KeyType keyType;
    KeyType estimatedTier;
    boolean fromCache;

    public ValidationResult cached() {
        return toBuilder().fromCache(true).build();
    }
}
