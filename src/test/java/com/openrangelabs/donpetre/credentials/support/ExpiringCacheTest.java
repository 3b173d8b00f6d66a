package com.openrangelabs.donpetre.credentials.support;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpiringCacheTest {

    private MutableClock clock;
    private ExpiringCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new ExpiringCache<>(Duration.ofMinutes(1), 10, clock);
    }

    @Test
    void get_BeforeTtl_ReturnsValueAndCountsHit() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(59));

        assertThat(cache.get("a")).contains("1");
        assertThat(cache.hits()).isEqualTo(1);
    }

    @Test
    void get_AtTtl_EntryIsGone() {
        cache.put("a", "1");
        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    void put_OverCapacity_EvictsOldestDownToEightyPercent() {
        // Arrange
        for (int i = 0; i < 10; i++) {
            cache.put("k" + i, "v" + i);
        }

        // Act
        cache.put("k10", "v10");

        // Assert
        assertThat(cache.size()).isEqualTo(8);
        assertThat(cache.get("k0")).isEmpty();
        assertThat(cache.get("k2")).isEmpty();
        assertThat(cache.get("k3")).contains("v3");
        assertThat(cache.get("k10")).contains("v10");
    }

    @Test
    void put_ExistingKey_RefreshesInsertionAge() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(40));
        cache.put("a", "2");
        clock.advance(Duration.ofSeconds(40));

        assertThat(cache.get("a")).contains("2");
    }

    @Test
    void purgeExpired_RemovesOnlyExpiredEntries() {
        cache.put("old", "1");
        clock.advance(Duration.ofSeconds(30));
        cache.put("new", "2");
        clock.advance(Duration.ofSeconds(30));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get("new")).contains("2");
    }

    @Test
    void constructor_NonPositiveCapacity_Rejected() {
        assertThatThrownBy(() -> new ExpiringCache<String, String>(Duration.ofMinutes(1), 0, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
