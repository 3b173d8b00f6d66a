package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One usage event reported for a key.
 */
@Value
@Builder
public class UsageRecord {

    @Builder.Default
    long requests = 1;
    long tokens;
    long inputTokens;
    long outputTokens;
    @Builder.Default
    BigDecimal cost = BigDecimal.ZERO;
    /** Response time in milliseconds, averaged per request. */
    double responseTime;
    @Builder.Default
    boolean success = true;
}
