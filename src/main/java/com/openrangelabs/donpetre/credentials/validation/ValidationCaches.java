package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.support.ExpiringCache;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The caches and the rate limiter shared by the validation engine.
 */
@Getter
public class ValidationCaches {

    private final ExpiringCache<String, ValidationResult> formatCache;
    private final ExpiringCache<String, LiveValidationResult> liveCache;
    private final ExpiringCache<String, KeyInfo> keyInfoCache;
    private final SlidingWindowRateLimiter rateLimiter;

    public ValidationCaches(ExpiringCache<String, ValidationResult> formatCache,
                            ExpiringCache<String, LiveValidationResult> liveCache,
                            ExpiringCache<String, KeyInfo> keyInfoCache,
                            SlidingWindowRateLimiter rateLimiter) {
        this.formatCache = formatCache;
        this.liveCache = liveCache;
        this.keyInfoCache = keyInfoCache;
        this.rateLimiter = rateLimiter;
    }

    public void clear() {
        formatCache.clear();
        liveCache.clear();
        keyInfoCache.clear();
        rateLimiter.clear();
    }

    /**
     * @return number of cache entries and idle rate-limit windows removed
     */
    public int purgeExpired() {
        return formatCache.purgeExpired()
                + liveCache.purgeExpired()
                + keyInfoCache.purgeExpired()
                + rateLimiter.purgeIdle();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("formatValidation", cacheStats(formatCache));
        stats.put("liveValidation", cacheStats(liveCache));
        stats.put("keyInfo", cacheStats(keyInfoCache));
        stats.put("rateLimitedKeys", rateLimiter.trackedKeys());
        return stats;
    }

    private static Map<String, Object> cacheStats(ExpiringCache<?, ?> cache) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("size", cache.size());
        stats.put("capacity", cache.capacity());
        stats.put("ttlSeconds", cache.ttl().toSeconds());
        stats.put("hits", cache.hits());
        stats.put("misses", cache.misses());
        return stats;
    }
}
