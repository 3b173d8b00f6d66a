package com.openrangelabs.donpetre.credentials.service;

import com.openrangelabs.donpetre.credentials.model.UsageRecord;
import com.openrangelabs.donpetre.credentials.model.UsageStats;
import com.openrangelabs.donpetre.credentials.model.UsageStats.UsagePeriod;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds a usage record into accumulated stats.
 */
final class UsageRollup {

    static final int DAYS_KEPT = 30;
    static final int WEEKS_KEPT = 12;
    static final int MONTHS_KEPT = 12;

    private UsageRollup() {
    }

    static UsageStats apply(UsageStats current, UsageRecord usage, Instant now) {
        UsageStats stats = current != null ? current : UsageStats.empty(now);
        long previous = stats.getTotalRequests();
        long requests = Math.max(0, usage.getRequests());
        BigDecimal cost = usage.getCost() != null ? usage.getCost() : BigDecimal.ZERO;

        double average = previous + requests == 0
                ? stats.getAverageResponseTime()
                : (stats.getAverageResponseTime() * previous + usage.getResponseTime() * requests)
                        / (previous + requests);

        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
        String dayKey = day.toString();
        String weekKey = String.format("%d-W%02d",
                day.get(IsoFields.WEEK_BASED_YEAR), day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        String monthKey = YearMonth.from(day).toString();

        UsageStats.UsageStatsBuilder builder = stats.toBuilder()
                .totalRequests(previous + requests)
                .totalTokens(stats.getTotalTokens() + usage.getTokens())
                .inputTokens(stats.getInputTokens() + usage.getInputTokens())
                .outputTokens(stats.getOutputTokens() + usage.getOutputTokens())
                .totalCost(nonNull(stats.getTotalCost()).add(cost))
                .averageResponseTime(average)
                .dailyUsage(roll(stats.getDailyUsage(), dayKey, requests, usage.getTokens(), cost, DAYS_KEPT))
                .weeklyUsage(roll(stats.getWeeklyUsage(), weekKey, requests, usage.getTokens(), cost, WEEKS_KEPT))
                .monthlyUsage(roll(stats.getMonthlyUsage(), monthKey, requests, usage.getTokens(), cost, MONTHS_KEPT));
        if (usage.isSuccess()) {
            builder.successfulRequests(stats.getSuccessfulRequests() + requests);
        } else {
            builder.failedRequests(stats.getFailedRequests() + requests);
        }
        return builder.build();
    }

    private static List<UsagePeriod> roll(List<UsagePeriod> periods, String key, long requests, long tokens,
                                          BigDecimal cost, int keep) {
        List<UsagePeriod> updated = new ArrayList<>(periods != null ? periods : List.of());
        int last = updated.size() - 1;
        if (last >= 0 && key.equals(updated.get(last).getPeriod())) {
            UsagePeriod current = updated.get(last);
            updated.set(last, current.toBuilder()
                    .requests(current.getRequests() + requests)
                    .tokens(current.getTokens() + tokens)
                    .cost(nonNull(current.getCost()).add(cost))
                    .build());
        } else {
            updated.add(UsagePeriod.builder().period(key).requests(requests).tokens(tokens).cost(cost).build());
        }
        while (updated.size() > keep) {
            updated.remove(0);
        }
        return updated;
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
