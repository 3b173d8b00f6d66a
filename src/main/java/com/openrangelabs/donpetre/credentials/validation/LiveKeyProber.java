package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.config.CredentialVaultProperties;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.support.Digests;
import com.openrangelabs.donpetre.credentials.support.KeyMasker;
import com.openrangelabs.donpetre.credentials.validation.probe.ProbeClient;
import com.openrangelabs.donpetre.credentials.validation.probe.ProbeResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Checks a key against its provider's API with one authenticated GET.
 *
 * <p>Every outcome, including timeouts, transport errors and cancellation, is reported
 * as a {@link LiveValidationResult}; the returned {@link Mono} never errors.
 */
@Slf4j
@Component
public class LiveKeyProber {

    private final ProbeClient probeClient;
    private final ValidationCaches caches;
    private final CredentialVaultProperties.Validation settings;

    public LiveKeyProber(ProbeClient probeClient, ValidationCaches caches, CredentialVaultProperties properties) {
        this.probeClient = probeClient;
        this.caches = caches;
        this.settings = properties.getValidation();
    }

    public Mono<LiveValidationResult> probe(String key, Provider provider, LiveValidationOptions options) {
        LiveValidationOptions opts = options != null ? options : LiveValidationOptions.defaults();
        String endpoint = opts.getCustomEndpoint() != null ? opts.getCustomEndpoint() : endpointFor(provider);
        if (endpoint == null) {
            return Mono.just(LiveValidationResult.failure(LiveValidationResult.NO_ENDPOINT, 0,
                    ProbeErrorCode.UNSUPPORTED, "Live validation not supported for provider: " + provider));
        }

        String limiterKey = rateLimitKey(provider, key);
        if (!opts.isRateLimitAcquired() && !caches.getRateLimiter().tryAcquire(limiterKey)) {
            log.warn("Live validation rate limited for {} key {}", provider, KeyMasker.mask(key));
            return Mono.just(LiveValidationResult.failure(endpoint, 0,
                    ProbeErrorCode.RATE_LIMITED, "Rate limit exceeded"));
        }

        String cacheKey = "live:" + limiterKey;
        if (opts.isEnableCache()) {
            Optional<LiveValidationResult> cached = caches.getLiveCache().get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Live validation cache hit for {}", provider);
                return Mono.just(cached.get().cached());
            }
        }

        Duration timeout = opts.getTimeout() != null ? opts.getTimeout() : settings.getLiveTimeout();
        Map<String, String> headers = headers(key, provider, opts.getCustomHeaders());

        Mono<LiveValidationResult> result = Mono.defer(() -> {
            long start = System.nanoTime();
            return probeClient.get(endpoint, headers, timeout)
                    .timeout(timeout)
                    .map(response -> toResult(endpoint, response, elapsedMs(start)))
                    .onErrorResume(TimeoutException.class, e -> Mono.just(LiveValidationResult.failure(
                            endpoint, elapsedMs(start), ProbeErrorCode.TIMEOUT, "Request timeout")))
                    .onErrorResume(e -> Mono.just(LiveValidationResult.failure(
                            endpoint, elapsedMs(start), ProbeErrorCode.NETWORK, errorMessage(e))))
                    .switchIfEmpty(Mono.fromSupplier(() -> LiveValidationResult.failure(
                            endpoint, elapsedMs(start), ProbeErrorCode.NETWORK, "Empty response")));
        });

        if (opts.getCancelSignal() != null) {
            result = result.takeUntilOther(opts.getCancelSignal())
                    .switchIfEmpty(Mono.fromSupplier(() -> LiveValidationResult.failure(
                            endpoint, 0, ProbeErrorCode.ABORTED, "Request aborted")));
        }

        return result.doOnNext(live -> {
            if (opts.isEnableCache() && live.isValid()) {
                caches.getLiveCache().put(cacheKey, live);
            }
        });
    }

    /**
     * Request headers for a provider. Caller headers go in first so the auth headers
     * always win.
     */
    Map<String, String> headers(String key, Provider provider, Map<String, String> customHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (customHeaders != null) {
            headers.putAll(customHeaders);
        }
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        headers.put(HttpHeaders.USER_AGENT, settings.getUserAgent());
        switch (provider) {
            case ANTHROPIC:
                headers.put("x-api-key", key);
                headers.put("anthropic-version", settings.getAnthropicVersion());
                break;
            case OPENAI:
            case GOOGLE:
            case CUSTOM:
            default:
                headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + key);
                break;
        }
        return headers;
    }

    String endpointFor(Provider provider) {
        if (provider == null || provider == Provider.CUSTOM) {
            return null;
        }
        return settings.getEndpoints().get(provider);
    }

    static String rateLimitKey(Provider provider, String key) {
        return provider + ":" + Digests.sha256Hex(key);
    }

    private static LiveValidationResult toResult(String endpoint, ProbeResponse response, long elapsed) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (response.getContentType() != null) {
            metadata.put("contentType", response.getContentType());
        }
        if (response.getServer() != null) {
            metadata.put("server", response.getServer());
        }
        LiveValidationResult.LiveValidationResultBuilder builder = LiveValidationResult.builder()
                .valid(response.isOk())
                .endpoint(endpoint)
                .statusCode(response.getStatus())
                .responseTime(elapsed)
                .metadata(metadata);
        if (!response.isOk()) {
            String reason = response.getStatusText() == null ? "" : response.getStatusText();
            builder.errorCode(ProbeErrorCode.HTTP_ERROR).error((response.getStatus() + " " + reason).trim());
        }
        return builder.build();
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
