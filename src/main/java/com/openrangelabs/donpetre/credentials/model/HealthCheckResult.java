package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Storage health report; {@code healthy} holds only when every check passed.
 */
@Value
@Builder
public class HealthCheckResult {

    boolean healthy;
    List<HealthCheck> checks;

    public static HealthCheckResult of(List<HealthCheck> checks) {
        boolean healthy = checks.stream().allMatch(check -> check.getStatus() == CheckStatus.PASS);
        return HealthCheckResult.builder().healthy(healthy).checks(List.copyOf(checks)).build();
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HealthCheck {
        String name;
        CheckStatus status;
        String message;

        public static HealthCheck pass(String name, String message) {
            return new HealthCheck(name, CheckStatus.PASS, message);
        }

        public static HealthCheck fail(String name, String message) {
            return new HealthCheck(name, CheckStatus.FAIL, message);
        }
    }
}
