package com.openrangelabs.donpetre.credentials.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Result of probing a provider endpoint with a key. {@code responseTime} is in milliseconds.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveValidationResult {

    public static final String NO_ENDPOINT = "none";

    boolean valid;
    long responseTime;
    String endpoint;
    Integer statusCode;
    String error;
    ProbeErrorCode errorCode;
    Map<String, String> metadata;
    boolean fromCache;

    public static LiveValidationResult failure(String endpoint, long responseTime, ProbeErrorCode code, String error) {
        return LiveValidationResult.builder()
                .valid(false)
                .endpoint(endpoint)
                .responseTime(responseTime)
                .errorCode(code)
                .error(error)
                .build();
    }

    public LiveValidationResult cached() {
        return toBuilder().fromCache(true).build();
    }
}
