package com.openrangelabs.donpetre.credentials.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a comprehensive validation: the format result plus whichever optional
 * analyses were requested.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtendedValidationResult {

    /** Caller-supplied id, echoed back by batch validation. */
    String id;
    boolean valid;
    List<String> errors;
    List<String> warnings;
    Provider provider;
    KeyType keyType;
    KeyType estimatedTier;
    ValidationResult formatValidation;
    LiveValidationResult liveValidation;
    List<String> securityWarnings;
    List<String> recommendations;
    Timing performance;

    public static ExtendedValidationResult failure(String error, long totalMs) {
        return ExtendedValidationResult.builder()
                .valid(false)
                .errors(List.of(error))
                .warnings(List.of())
                .securityWarnings(List.of())
                .performance(new Timing(null, null, totalMs))
                .build();
    }

    public ExtendedValidationResult withId(String id) {
        return toBuilder().id(id).build();
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Timing {
        Long formatValidationMs;
        Long liveValidationMs;
        long totalMs;
    }
}
