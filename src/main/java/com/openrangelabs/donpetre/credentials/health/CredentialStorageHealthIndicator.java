package com.openrangelabs.donpetre.credentials.health;

import com.openrangelabs.donpetre.credentials.model.CheckStatus;
import com.openrangelabs.donpetre.credentials.model.HealthCheckResult;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Publishes the storage health report under {@code /actuator/health}. A locked or
 * uninitialized vault reports OUT_OF_SERVICE rather than DOWN.
 */
@Component("credentialStorage")
public class CredentialStorageHealthIndicator implements ReactiveHealthIndicator {

    private final CredentialStorageService storageService;

    public CredentialStorageHealthIndicator(CredentialStorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Mono<Health> health() {
        return storageService.getHealthStatus().map(this::toHealth);
    }

    private Health toHealth(HealthCheckResult result) {
        Health.Builder builder;
        if (result.isHealthy()) {
            builder = Health.up();
        } else if (storesReachable(result)) {
            builder = Health.outOfService();
        } else {
            builder = Health.down();
        }
        builder.withDetail("state", storageService.getState());
        result.getChecks().forEach(check -> builder.withDetail(check.getName(), check.getStatus() + ": " + check.getMessage()));
        return builder.build();
    }

    private static boolean storesReachable(HealthCheckResult result) {
        return result.getChecks().stream()
                .filter(check -> check.getName().endsWith("_store"))
                .allMatch(check -> check.getStatus() == CheckStatus.PASS);
    }
}
