package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SlidingWindowRateLimiterTest {

    private MutableClock clock;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        limiter = new SlidingWindowRateLimiter(3, Duration.ofSeconds(60), clock);
    }

    @Test
    void tryAcquire_BeyondLimit_IsRejected() {
        assertThat(limiter.tryAcquire("openai:abc")).isTrue();
        assertThat(limiter.tryAcquire("openai:abc")).isTrue();
        assertThat(limiter.tryAcquire("openai:abc")).isTrue();
        assertThat(limiter.tryAcquire("openai:abc")).isFalse();

        // other keys have their own window
        assertThat(limiter.tryAcquire("openai:def")).isTrue();
    }

    @Test
    void tryAcquire_AfterWindowSlides_AllowsAgain() {
        limiter.tryAcquire("k");
        clock.advance(Duration.ofSeconds(30));
        limiter.tryAcquire("k");
        limiter.tryAcquire("k");
        assertThat(limiter.tryAcquire("k")).isFalse();

        clock.advance(Duration.ofSeconds(31));

        assertThat(limiter.tryAcquire("k")).isTrue();
        assertThat(limiter.tryAcquire("k")).isFalse();
    }

    @Test
    void status_ReportsRemainingAndReset() {
        limiter.tryAcquire("k");
        clock.advance(Duration.ofSeconds(10));
        limiter.tryAcquire("k");

        RateLimitStatus status = limiter.status("k");

        assertThat(status.getLimit()).isEqualTo(3);
        assertThat(status.getRemaining()).isEqualTo(1);
        assertThat(status.getResetTime()).isEqualTo(Instant.parse("2025-03-01T10:01:00Z"));
        assertThat(status.isExceeded()).isFalse();
    }

    @Test
    void purgeIdle_RemovesKeysWithNoRecentRequests() {
        limiter.tryAcquire("old");
        clock.advance(Duration.ofSeconds(45));
        limiter.tryAcquire("recent");
        clock.advance(Duration.ofSeconds(20));

        assertThat(limiter.purgeIdle()).isEqualTo(1);
        assertThat(limiter.trackedKeys()).isEqualTo(1);
    }

    @Test
    void tryAcquire_LedgerFull_DropsOldestKeysFirst() {
        // Arrange
        SlidingWindowRateLimiter bounded = new SlidingWindowRateLimiter(1, Duration.ofSeconds(60), 5, clock);
        for (int i = 0; i < 5; i++) {
            assertThat(bounded.tryAcquire("k" + i)).isTrue();
        }

        // Act
        assertThat(bounded.tryAcquire("k5")).isTrue();

        // Assert
        assertThat(bounded.trackedKeys()).isEqualTo(5);
        assertThat(bounded.tryAcquire("k1")).isFalse();
        // k0 was dropped, so it starts a fresh window
        assertThat(bounded.tryAcquire("k0")).isTrue();
        assertThat(bounded.trackedKeys()).isEqualTo(5);
    }
}
