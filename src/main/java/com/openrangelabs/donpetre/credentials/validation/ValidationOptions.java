package com.openrangelabs.donpetre.credentials.validation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Switches for a comprehensive validation. Everything optional is off by default.
 */
@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    boolean testLive;
    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;
    boolean checkForExposedKeys;
    boolean checkEntropy;
    boolean provideRecommendations;
    @Builder.Default
    boolean enableCache = true;
    boolean enableRateLimit;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }
}
