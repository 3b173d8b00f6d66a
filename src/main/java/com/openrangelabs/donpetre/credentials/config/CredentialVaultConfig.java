package com.openrangelabs.donpetre.credentials.config;

import com.openrangelabs.donpetre.credentials.crypto.AesGcmCryptoService;
import com.openrangelabs.donpetre.credentials.crypto.CryptoService;
import com.openrangelabs.donpetre.credentials.store.BlobStore;
import com.openrangelabs.donpetre.credentials.store.InMemoryBlobStore;
import com.openrangelabs.donpetre.credentials.store.InMemoryIndexStore;
import com.openrangelabs.donpetre.credentials.store.IndexStore;
import com.openrangelabs.donpetre.credentials.support.ExpiringCache;
import com.openrangelabs.donpetre.credentials.support.KeyIdGenerator;
import com.openrangelabs.donpetre.credentials.validation.SlidingWindowRateLimiter;
import com.openrangelabs.donpetre.credentials.validation.ValidationCaches;
import com.openrangelabs.donpetre.credentials.validation.probe.ProbeClient;
import com.openrangelabs.donpetre.credentials.validation.probe.WebClientProbeClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the stores, crypto session, caches and probe client.
 */
@Configuration
@EnableConfigurationProperties(CredentialVaultProperties.class)
public class CredentialVaultConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CryptoService cryptoService(CredentialVaultProperties properties, Clock clock) {
        CredentialVaultProperties.Crypto crypto = properties.getCrypto();
        return new AesGcmCryptoService(crypto.getSalt(), crypto.getSessionTimeout(), clock);
    }

    @Bean
    public IndexStore indexStore() {
        return new InMemoryIndexStore();
    }

    @Bean
    public BlobStore blobStore() {
        return new InMemoryBlobStore();
    }

    @Bean
    public ProbeClient probeClient(WebClient.Builder webClientBuilder) {
        return new WebClientProbeClient(webClientBuilder.build());
    }

    @Bean
    public ValidationCaches validationCaches(CredentialVaultProperties properties, Clock clock) {
        CredentialVaultProperties.Validation validation = properties.getValidation();
        return new ValidationCaches(
                new ExpiringCache<>(validation.getFormatCacheTtl(), validation.getCacheCapacity(), clock),
                new ExpiringCache<>(validation.getLiveCacheTtl(), validation.getCacheCapacity(), clock),
                new ExpiringCache<>(validation.getFormatCacheTtl(), validation.getCacheCapacity(), clock),
                new SlidingWindowRateLimiter(validation.getRateLimitMaxRequests(), validation.getRateLimitWindow(),
                        validation.getRateLimitMaxKeys(), clock));
    }

    @Bean
    public KeyIdGenerator keyIdGenerator(Clock clock) {
        return new KeyIdGenerator(clock);
    }
}
