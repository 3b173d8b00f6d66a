package com.openrangelabs.donpetre.credentials.config;

import com.openrangelabs.donpetre.credentials.model.Provider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Settings bound from {@code credential-vault.*}.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Data
@ConfigurationProperties(prefix = "credential-vault")
public class CredentialVaultProperties {

    private Validation validation = new Validation();
    private Storage storage = new Storage();
    private Crypto crypto = new Crypto();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Validation {
        private Duration formatCacheTtl = Duration.ofMinutes(5);
        private Duration liveCacheTtl = Duration.ofMinutes(15);
        private int cacheCapacity = 1000;
        private int rateLimitMaxRequests = 30;
        private Duration rateLimitWindow = Duration.ofMinutes(1);
        private int rateLimitMaxKeys = 10_000;
        private Duration liveTimeout = Duration.ofSeconds(10);
        private String userAgent = "credential-vault/1.0";
        private String anthropicVersion = "2023-06-01";
        private Batch batch = new Batch();
        private Map<Provider, String> endpoints = defaultEndpoints();

        private static Map<Provider, String> defaultEndpoints() {
            Map<Provider, String> endpoints = new EnumMap<>(Provider.class);
            endpoints.put(Provider.OPENAI, "https://api.openai.com/v1/models");
            endpoints.put(Provider.ANTHROPIC, "https://api.anthropic.com/v1/models");
            endpoints.put(Provider.GOOGLE, "https://generativelanguage.googleapis.com/v1beta/models");
            return endpoints;
        }
    }

    @Data
    public static class Batch {
        private int batchSize = 10;
        private int concurrency = 5;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration interBatchDelay = Duration.ofMillis(100);
    }

    @Data
    public static class Storage {
        private Duration recordCacheTtl = Duration.ofMinutes(30);
        private int recordCacheCapacity = 100;
        private int minPassphraseLength = 8;
        private int expiryWarningDays = 7;
    }

    @Data
    public static class Crypto {
        private Duration sessionTimeout = Duration.ofMinutes(30);
        /** Hex-encoded PBKDF2 salt. */
        private String salt = "5c0744940b5c369b";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
    }
}
