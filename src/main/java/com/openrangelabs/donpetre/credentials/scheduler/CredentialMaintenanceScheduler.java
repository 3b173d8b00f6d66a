package com.openrangelabs.donpetre.credentials.scheduler;

import com.openrangelabs.donpetre.credentials.config.CredentialVaultProperties;
import com.openrangelabs.donpetre.credentials.model.StorageState;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import com.openrangelabs.donpetre.credentials.validation.ApiKeyValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Scheduler for cache housekeeping and key expiry checks
 */
@Component
@ConditionalOnProperty(prefix = "credential-vault.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CredentialMaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CredentialMaintenanceScheduler.class);

    private final CredentialStorageService storageService;
    private final ApiKeyValidationService validationService;
    private final int expiryWarningDays;

    public CredentialMaintenanceScheduler(CredentialStorageService storageService,
                                          ApiKeyValidationService validationService,
                                          CredentialVaultProperties properties) {
        this.storageService = storageService;
        this.validationService = validationService;
        this.expiryWarningDays = properties.getStorage().getExpiryWarningDays();
    }

    /**
     * Drop expired cache entries and idle rate-limit windows
     * Runs every 5 minutes
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public void purgeExpiredCaches() {
        int validationEntries = validationService.purgeExpired();
        int records = storageService.purgeExpiredCache();
        logger.debug("Purged {} validation cache entries and {} cached records", validationEntries, records);
    }

    /**
     * Check for expiring keys and keys due for rotation
     * Runs daily at 8 AM
     */
    @Scheduled(cron = "0 0 8 * * ?")
    public void checkExpiringKeys() {
        runExpiryCheck().subscribe(
                count -> logger.debug("Completed key expiry check: {} keys need attention", count),
                error -> logger.error("Error checking expiring keys: {}", error.getMessage()));
    }

    /**
     * Expiry and rotation check. Emits the number of keys that need attention; emits 0
     * without touching storage while it is not ready.
     */
    public Mono<Long> runExpiryCheck() {
        if (storageService.getState() != StorageState.READY) {
            logger.debug("Storage is {}, skipping key expiry check", storageService.getState());
            return Mono.just(0L);
        }

        logger.info("Checking for API keys expiring within {} days", expiryWarningDays);

        Mono<Long> expiring = storageService.getExpiringKeys(expiryWarningDays)
                .doOnNext(key -> logger.warn("API key {} ({}) expires at {}",
                        key.getId(), key.getProvider(), key.getExpiresAt()))
                .count();
        Mono<Long> dueForRotation = storageService.getKeysDueForRotation()
                .doOnNext(key -> logger.warn("API key {} ({}) is due for rotation", key.getId(), key.getProvider()))
                .count();

        return Mono.zip(expiring, dueForRotation)
                .map(counts -> {
                    if (counts.getT1() == 0 && counts.getT2() == 0) {
                        logger.info("No API keys expiring soon or due for rotation");
                    } else {
                        logger.warn("Found {} API keys expiring soon and {} due for rotation",
                                counts.getT1(), counts.getT2());
                    }
                    return counts.getT1() + counts.getT2();
                });
    }
}
