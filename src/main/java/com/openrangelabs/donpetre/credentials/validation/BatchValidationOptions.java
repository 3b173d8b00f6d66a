package com.openrangelabs.donpetre.credentials.validation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class BatchValidationOptions {

    @Builder.Default
    int batchSize = 10;
    @Builder.Default
    int concurrency = 5;
    boolean includeLiveValidation;
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);
    boolean failFast;
    @Builder.Default
    Duration interBatchDelay = Duration.ofMillis(100);

    public static BatchValidationOptions defaults() {
        return BatchValidationOptions.builder().build();
    }
}
