package com.openrangelabs.donpetre.credentials.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated usage counters for a key, with daily, weekly and monthly rollups.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UsageStats {

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long totalTokens;
    private long inputTokens;
    private long outputTokens;
    @Builder.Default
    private BigDecimal totalCost = BigDecimal.ZERO;
    private double averageResponseTime;
    private Instant lastResetAt;

    @Builder.Default
    private List<UsagePeriod> dailyUsage = new ArrayList<>();
    @Builder.Default
    private List<UsagePeriod> weeklyUsage = new ArrayList<>();
    @Builder.Default
    private List<UsagePeriod> monthlyUsage = new ArrayList<>();

    public static UsageStats empty(Instant now) {
        return UsageStats.builder().lastResetAt(now).build();
    }

    /**
     * Usage within one calendar period. {@code period} is an ISO date, ISO week
     * ({@code 2025-W03}) or year-month, depending on the rollup it belongs to.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsagePeriod {
        private String period;
        private long requests;
        private long tokens;
        @Builder.Default
        private BigDecimal cost = BigDecimal.ZERO;
    }
}
