package com.openrangelabs.donpetre.credentials.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Request binding failure with per-field messages.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Validation error response with field details")
public class ValidationErrorResponse {

    Instant timestamp;
    int status;
    String error;
    String message;
    String path;
    String traceId;

    @Schema(description = "Field-specific validation errors",
            example = "{\"passphrase\": \"size must be between 8 and 1024\"}")
    Map<String, String> fieldErrors;
}
