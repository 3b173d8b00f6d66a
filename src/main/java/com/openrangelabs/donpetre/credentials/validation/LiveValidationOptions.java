package com.openrangelabs.donpetre.credentials.validation;

import lombok.Builder;
import lombok.Value;
import org.reactivestreams.Publisher;

import java.time.Duration;
import java.util.Map;

/**
 * Options for a live probe. When {@code cancelSignal} emits or completes before the
 * probe finishes, the probe is disposed and the result reports
 * {@link ProbeErrorCode#ABORTED}. {@code rateLimitAcquired} means the caller already took
 * this request's slot from the shared limiter.
 */
@Value
@Builder(toBuilder = true)
public class LiveValidationOptions {

    @Builder.Default
    Duration timeout = ValidationOptions.DEFAULT_TIMEOUT;
    @Builder.Default
    boolean enableCache = true;
    String customEndpoint;
    Map<String, String> customHeaders;
    Publisher<?> cancelSignal;
    boolean rateLimitAcquired;

    public static LiveValidationOptions defaults() {
        return LiveValidationOptions.builder().build();
    }
}
