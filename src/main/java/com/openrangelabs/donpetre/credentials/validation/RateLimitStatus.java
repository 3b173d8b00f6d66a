package com.openrangelabs.donpetre.credentials.validation;

import java.time.Instant;

/**
 * Window state for one rate-limit key.
 */
public class RateLimitStatus {

    private final int limit;
    private final int remaining;
    private final Instant resetTime;

    public RateLimitStatus(int limit, int remaining, Instant resetTime) {
        this.limit = limit;
        this.remaining = remaining;
        this.resetTime = resetTime;
    }

    public boolean isExceeded() {
        return remaining <= 0;
    }

    public int getLimit() { return limit; }
    public int getRemaining() { return remaining; }
    public Instant getResetTime() { return resetTime; }

    @Override
    public String toString() {
        return "RateLimitStatus{" +
                "limit=" + limit +
                ", remaining=" + remaining +
                ", resetTime=" + resetTime +
                '}';
    }
}
