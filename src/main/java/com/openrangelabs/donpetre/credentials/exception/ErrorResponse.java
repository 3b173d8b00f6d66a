package com.openrangelabs.donpetre.credentials.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2025-01-15T10:30:00Z")
    Instant timestamp;

    @Schema(description = "HTTP status code", example = "404")
    int status;

    @Schema(description = "Error type", example = "API Key Not Found")
    String error;

    @Schema(description = "Detailed error message", example = "API key not found: openai-1736935800000-k3x9q2")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/keys/openai-1736935800000-k3x9q2")
    String path;

    @Schema(description = "Unique trace ID for debugging", example = "a1b2c3d4")
    String traceId;

    @Schema(description = "Individual validation errors, when the key format was rejected")
    List<String> details;
}
