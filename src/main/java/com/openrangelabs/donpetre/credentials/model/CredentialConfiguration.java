package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-key operational settings. Every section is optional; {@link #merge} overlays a
 * partial configuration section by section.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CredentialConfiguration {

    private RateLimitSettings rateLimit;
    private EndpointSettings endpoint;
    private ProxySettings proxy;
    private RotationSettings rotation;
    private SecuritySettings security;

    public static CredentialConfiguration defaults() {
        return CredentialConfiguration.builder()
                .security(SecuritySettings.builder().encryptionLevel(EncryptionLevel.STANDARD).build())
                .build();
    }

    /**
     * Returns a new configuration where each non-null section of {@code patch} replaces
     * the corresponding section of this one.
     */
    public CredentialConfiguration merge(CredentialConfiguration patch) {
        if (patch == null) {
            return toBuilder().build();
        }
        return CredentialConfiguration.builder()
                .rateLimit(patch.rateLimit != null ? patch.rateLimit : rateLimit)
                .endpoint(patch.endpoint != null ? patch.endpoint : endpoint)
                .proxy(patch.proxy != null ? patch.proxy : proxy)
                .rotation(patch.rotation != null ? patch.rotation : rotation)
                .security(patch.security != null ? patch.security : security)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RateLimitSettings {
        private Integer requestsPerMinute;
        private Integer requestsPerHour;
        private Integer requestsPerDay;
        private Integer tokensPerMinute;
        private Integer tokensPerHour;
        private Integer tokensPerDay;
        private boolean enforceLimit;
        private Integer gracePeriodSeconds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EndpointSettings {
        private String baseUrl;
        @Builder.Default
        private Map<String, String> customHeaders = new LinkedHashMap<>();
        private Long timeoutMs;
        private Integer retryAttempts;
        private Long retryDelayMs;
        private Boolean keepAlive;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProxySettings {
        private boolean enabled;
        private String host;
        private Integer port;
        private String protocol;
        private String username;
        private String password;
        @Builder.Default
        private List<String> bypass = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RotationSettings {
        private boolean enabled;
        private Integer intervalDays;
        private Integer warnDays;
        private boolean autoRotate;
        private Integer keepOldKeys;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SecuritySettings {
        @Builder.Default
        private List<String> allowedOrigins = new ArrayList<>();
        @Builder.Default
        private List<String> ipWhitelist = new ArrayList<>();
        private boolean requireHttps;
        private EncryptionLevel encryptionLevel;
        private Long maxAgeSeconds;
        private boolean auditLogging;
    }
}
