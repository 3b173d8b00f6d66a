package com.openrangelabs.donpetre.credentials.health;

import com.openrangelabs.donpetre.credentials.model.HealthCheckResult;
import com.openrangelabs.donpetre.credentials.model.HealthCheckResult.HealthCheck;
import com.openrangelabs.donpetre.credentials.model.StorageState;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialStorageHealthIndicatorTest {

    @Mock
    private CredentialStorageService storageService;

    private CredentialStorageHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new CredentialStorageHealthIndicator(storageService);
    }

    @Test
    void health_AllChecksPass_Up() {
        stub(StorageState.READY,
            HealthCheck.pass("encryption_service", "Encryption service initialized"),
            HealthCheck.pass("index_store", "Reachable"));

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> {
                assertThat(health.getStatus()).isEqualTo(Status.UP);
                assertThat(health.getDetails()).containsEntry("state", StorageState.READY)
                    .containsEntry("index_store", "PASS: Reachable");
            })
            .verifyComplete();
    }

    @Test
    void health_LockedWithReachableStores_OutOfService() {
        stub(StorageState.LOCKED,
            HealthCheck.fail("session_status", "Session inactive (LOCKED)"),
            HealthCheck.pass("index_store", "Reachable"),
            HealthCheck.pass("blob_store", "Reachable"));

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE))
            .verifyComplete();
    }

    @Test
    void health_StoreUnreachable_Down() {
        stub(StorageState.READY,
            HealthCheck.pass("session_status", "Session active"),
            HealthCheck.fail("blob_store", "Unreachable: connection refused"));

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
            .verifyComplete();
    }

    private void stub(StorageState state, HealthCheck... checks) {
        when(storageService.getHealthStatus()).thenReturn(Mono.just(HealthCheckResult.of(List.of(checks))));
        when(storageService.getState()).thenReturn(state);
    }
}
