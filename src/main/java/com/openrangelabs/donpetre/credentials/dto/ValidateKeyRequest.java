package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.validation.ValidationOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Request to validate a key without storing it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Key validation request; the key is never stored")
public class ValidateKeyRequest {

    @NotNull(message = "API key is required")
    @Schema(description = "The raw API key", required = true)
    private String key;

    @Schema(description = "Provider tag; detected from the key when omitted", example = "anthropic")
    private String provider;

    private boolean testLive;

    private boolean checkForExposedKeys;

    private boolean checkEntropy;

    private boolean provideRecommendations;

    @Min(value = 100, message = "Timeout must be at least 100 ms")
    @Max(value = 60000, message = "Timeout cannot exceed 60000 ms")
    @Schema(description = "Live probe timeout in milliseconds", example = "10000")
    private Long timeoutMs;

    public ValidationOptions toOptions() {
        return ValidationOptions.builder()
                .testLive(testLive)
                .checkForExposedKeys(checkForExposedKeys)
                .checkEntropy(checkEntropy)
                .provideRecommendations(provideRecommendations)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : ValidationOptions.DEFAULT_TIMEOUT)
                .enableRateLimit(true)
                .build();
    }

    @Override
    public String toString() {
        return "ValidateKeyRequest(provider=" + provider + ", testLive=" + testLive + ")";
    }
}
