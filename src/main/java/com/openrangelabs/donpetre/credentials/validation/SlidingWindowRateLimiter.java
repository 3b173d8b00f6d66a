package com.openrangelabs.donpetre.credentials.validation;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory sliding-window limiter. Each key keeps the timestamps of its accepted
 * requests; timestamps older than the window are dropped before counting.
 *
 * <p>At most {@code maxKeys} keys are tracked. Admitting a new key into a full ledger
 * first drops the oldest keys, by first use, down to 80% of {@code maxKeys}.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    public static final int DEFAULT_MAX_KEYS = 10_000;
    private static final double EVICTION_TARGET = 0.8;

    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final Queue<String> firstUse = new ConcurrentLinkedQueue<>();
    private final int maxRequests;
    private final Duration window;
    private final int maxKeys;
    private final Clock clock;

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        this(maxRequests, window, DEFAULT_MAX_KEYS, clock);
    }

    public SlidingWindowRateLimiter(int maxRequests, Duration window, int maxKeys, Clock clock) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("Rate limiter key capacity must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.maxKeys = maxKeys;
        this.clock = clock;
    }

    /**
     * Records a request for {@code key} if the window has room.
     *
     * @return false when the key already used up its window
     */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        Deque<Instant> timestamps = windows.get(key);
        if (timestamps == null) {
            timestamps = admit(key);
        }
        synchronized (timestamps) {
            evictExpired(timestamps, now);
            if (timestamps.size() >= maxRequests) {
                log.debug("Rate limit reached for {} ({}/{})", key, timestamps.size(), maxRequests);
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    public RateLimitStatus status(String key) {
        Instant now = clock.instant();
        Deque<Instant> timestamps = windows.get(key);
        if (timestamps == null) {
            return new RateLimitStatus(maxRequests, maxRequests, now);
        }
        synchronized (timestamps) {
            evictExpired(timestamps, now);
            Instant oldest = timestamps.peekFirst();
            Instant reset = oldest == null ? now : oldest.plus(window);
            return new RateLimitStatus(maxRequests, Math.max(0, maxRequests - timestamps.size()), reset);
        }
    }

    /**
     * Drops windows with no request inside the current window.
     *
     * @return number of keys removed
     */
    public int purgeIdle() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> {
            Deque<Instant> timestamps = entry.getValue();
            synchronized (timestamps) {
                evictExpired(timestamps, now);
                return timestamps.isEmpty();
            }
        });
        firstUse.removeIf(key -> !windows.containsKey(key));
        return before - windows.size();
    }

    public void clear() {
        windows.clear();
        firstUse.clear();
    }

    public int trackedKeys() {
        return windows.size();
    }

    private Deque<Instant> admit(String key) {
        if (windows.size() >= maxKeys) {
            evictOldest();
        }
        Deque<Instant> created = new ConcurrentLinkedDeque<>();
        Deque<Instant> existing = windows.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        firstUse.add(key);
        return created;
    }

    private void evictOldest() {
        int target = (int) Math.floor(maxKeys * EVICTION_TARGET);
        int evicted = 0;
        while (windows.size() > target) {
            String oldest = firstUse.poll();
            if (oldest == null) {
                break;
            }
            if (windows.remove(oldest) != null) {
                evicted++;
            }
        }
        log.debug("Rate limiter ledger full, dropped {} oldest keys", evicted);
    }

    private void evictExpired(Deque<Instant> timestamps, Instant now) {
        Instant windowStart = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(windowStart)) {
            timestamps.pollFirst();
        }
    }
}
