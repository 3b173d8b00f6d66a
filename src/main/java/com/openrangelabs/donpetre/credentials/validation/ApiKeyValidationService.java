package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.support.KeyMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validation engine for provider API keys: cached format checks, live probes,
 * comprehensive analysis and batch validation.
 *
 * <p>No operation of this service signals an error; every failure is reported on the
 * returned result.
 */
@Service
public class ApiKeyValidationService {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyValidationService.class);

    private final ValidationCaches caches;
    private final LiveKeyProber prober;

    public ApiKeyValidationService(ValidationCaches caches, LiveKeyProber prober) {
        this.caches = caches;
        this.prober = prober;
    }

    /**
     * Format check with memoization by provider and sanitized key.
     */
    public ValidationResult validateFormat(String rawKey, Provider provider) {
        String key = KeySanitizer.sanitize(rawKey);
        Provider declared = provider != null ? provider : Provider.CUSTOM;
        String cacheKey = declared + ":" + key;

        Optional<ValidationResult> cached = caches.getFormatCache().get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Format validation cache hit for {}", declared);
            return cached.get().cached();
        }

        ValidationResult result = KeyFormatValidator.validate(key, declared);
        caches.getFormatCache().put(cacheKey, result);
        return result;
    }

    /**
     * Probes the provider's API with the key. Rate limited per provider and key.
     */
    public Mono<LiveValidationResult> validateLive(String rawKey, Provider provider, LiveValidationOptions options) {
        return prober.probe(KeySanitizer.sanitize(rawKey), provider, options);
    }

    public Mono<ExtendedValidationResult> validateComprehensive(String rawKey, Provider provider,
                                                                ValidationOptions options) {
        return validateComprehensive(rawKey, provider != null ? provider.getTag() : null, options);
    }

    /**
     * Full validation. Short-circuits without running any check when the key is null or empty,
     * the provider tag is unknown or the key is empty after sanitizing.
     */
    public Mono<ExtendedValidationResult> validateComprehensive(String rawKey, String providerTag,
                                                                ValidationOptions options) {
        long start = System.nanoTime();
        ValidationOptions opts = options != null ? options : ValidationOptions.defaults();

        if (rawKey == null || rawKey.isEmpty()) {
            return Mono.just(ExtendedValidationResult.failure("Invalid key input", elapsedMs(start)));
        }
        Optional<Provider> parsed = Provider.fromTag(providerTag);
        if (parsed.isEmpty()) {
            return Mono.just(ExtendedValidationResult.failure("Invalid provider", elapsedMs(start)));
        }
        Provider provider = parsed.get();

        String sanitized = KeySanitizer.sanitize(rawKey);
        if (sanitized.isEmpty()) {
            return Mono.just(ExtendedValidationResult.failure("Key is empty after sanitization", elapsedMs(start)));
        }
        if (opts.isEnableRateLimit()
                && !caches.getRateLimiter().tryAcquire(LiveKeyProber.rateLimitKey(provider, sanitized))) {
            logger.warn("Validation rate limited for {} key {}", provider, KeyMasker.mask(sanitized));
            return Mono.just(ExtendedValidationResult.failure("Rate limit exceeded", elapsedMs(start)));
        }

        return Mono.defer(() -> runComprehensive(sanitized, provider, opts, start))
                .onErrorResume(e -> {
                    logger.error("Validation failed for {} key", provider, e);
                    return Mono.just(ExtendedValidationResult.failure(
                            "Validation failed: " + e.getMessage(), elapsedMs(start)));
                });
    }

    private Mono<ExtendedValidationResult> runComprehensive(String key, Provider provider,
                                                            ValidationOptions opts, long start) {
        long formatStart = System.nanoTime();
        ValidationResult format = opts.isEnableCache()
                ? validateFormat(key, provider)
                : KeyFormatValidator.validate(key, provider);
        long formatMs = elapsedMs(formatStart);

        List<String> securityWarnings = new ArrayList<>();
        if (opts.isCheckEntropy()) {
            securityWarnings.addAll(EntropyAnalyzer.entropyWarnings(key));
        }
        if (opts.isCheckForExposedKeys()) {
            securityWarnings.addAll(EntropyAnalyzer.exposedKeyWarnings(key));
        }

        ExtendedValidationResult.ExtendedValidationResultBuilder builder = ExtendedValidationResult.builder()
                .valid(format.isValid())
                .warnings(format.getWarnings())
                .provider(format.getProvider())
                .keyType(format.getKeyType())
                .estimatedTier(format.getEstimatedTier())
                .formatValidation(format)
                .securityWarnings(List.copyOf(securityWarnings));

        Mono<Optional<LiveValidationResult>> live = opts.isTestLive() && format.isValid()
                ? prober.probe(key, provider, LiveValidationOptions.builder()
                        .timeout(opts.getTimeout())
                        .enableCache(opts.isEnableCache())
                        .rateLimitAcquired(opts.isEnableRateLimit())
                        .build())
                    .map(Optional::of)
                : Mono.just(Optional.empty());

        long liveStart = System.nanoTime();
        return live.map(liveResult -> {
            List<String> errors = new ArrayList<>(format.getErrors());
            Long liveMs = null;
            boolean valid = format.isValid();
            if (liveResult.isPresent()) {
                liveMs = elapsedMs(liveStart);
                LiveValidationResult result = liveResult.get();
                builder.liveValidation(result);
                if (!result.isValid()) {
                    valid = false;
                    String error = result.getError() != null ? result.getError() : "Unknown error";
                    errors.add("Live validation failed: " + error);
                }
            }
            if (opts.isProvideRecommendations()) {
                builder.recommendations(EntropyAnalyzer.recommendations(provider, !securityWarnings.isEmpty()));
            }
            return builder.valid(valid)
                    .errors(List.copyOf(errors))
                    .performance(new ExtendedValidationResult.Timing(formatMs, liveMs, elapsedMs(start)))
                    .build();
        });
    }

    /**
     * Validates entries batch by batch. Each batch runs with bounded concurrency and
     * completes before the next one starts. Results keep input order.
     */
    public Flux<ExtendedValidationResult> batchValidate(List<BatchValidationInput> entries,
                                                        BatchValidationOptions options) {
        BatchValidationOptions opts = options != null ? options : BatchValidationOptions.defaults();
        List<List<BatchValidationInput>> batches = chunk(entries, Math.max(1, opts.getBatchSize()));
        ValidationOptions entryOptions = ValidationOptions.builder()
                .testLive(opts.isIncludeLiveValidation())
                .timeout(opts.getTimeout())
                .enableCache(true)
                .enableRateLimit(true)
                .build();

        return Flux.range(0, batches.size())
                .concatMap(index -> {
                    Mono<List<ExtendedValidationResult>> batch = runBatch(batches.get(index), entryOptions, opts);
                    if (index == 0 || opts.getInterBatchDelay().isZero()) {
                        return batch;
                    }
                    return Mono.delay(opts.getInterBatchDelay()).then(batch);
                })
                .takeUntil(results -> opts.isFailFast() && results.stream().anyMatch(r -> !r.isValid()))
                .concatMapIterable(results -> results);
    }

    private Mono<List<ExtendedValidationResult>> runBatch(List<BatchValidationInput> batch,
                                                          ValidationOptions entryOptions,
                                                          BatchValidationOptions opts) {
        return Flux.fromIterable(batch)
                .flatMapSequential(input -> Mono.defer(
                                        () -> validateComprehensive(input.getKey(), input.getProvider(), entryOptions))
                                .onErrorResume(e -> {
                                    logger.warn("Batch entry {} failed: {}", input.getId(), e.getMessage());
                                    return Mono.just(ExtendedValidationResult.failure(
                                            "Batch validation error: " + e.getMessage(), 0));
                                })
                                .map(result -> result.withId(input.getId())),
                        Math.max(1, opts.getConcurrency()))
                .collectList();
    }

    /**
     * Provider-independent facts about a key; unrecognized keys are described as custom.
     */
    public KeyInfo describeKey(String rawKey) {
        String key = KeySanitizer.sanitize(rawKey);
        String cacheKey = "info:" + key;
        Optional<KeyInfo> cached = caches.getKeyInfoCache().get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        Provider provider = ProviderRules.detect(key).orElse(Provider.CUSTOM);
        KeyType keyType = ProviderRules.detectKeyType(key, provider);
        ProviderRule rule = ProviderRules.rule(provider);
        double entropy = EntropyAnalyzer.entropy(key);
        KeyInfo info = KeyInfo.builder()
                .provider(provider)
                .keyType(keyType)
                .estimatedTier(keyType)
                .prefix(rule.hasPrefix() ? rule.getRequiredPrefix() : "")
                .maskedKey(KeyMasker.mask(key))
                .hasChecksum(false)
                .entropy(entropy)
                .entropyLevel(KeyInfo.EntropyLevel.of(entropy))
                .length(key.length())
                .characterSet(new KeyInfo.CharacterSet(
                        key.chars().anyMatch(c -> c >= 'a' && c <= 'z'),
                        key.chars().anyMatch(c -> c >= 'A' && c <= 'Z'),
                        key.chars().anyMatch(c -> c >= '0' && c <= '9'),
                        key.chars().anyMatch(c -> !Character.isLetterOrDigit(c) || c > 127)))
                .build();
        caches.getKeyInfoCache().put(cacheKey, info);
        return info;
    }

    public String normalize(String rawKey, Provider provider) {
        return KeySanitizer.normalize(rawKey, provider);
    }

    public void clearCaches() {
        caches.clear();
        logger.info("Validation caches cleared");
    }

    public Map<String, Object> cacheStats() {
        return caches.stats();
    }

    public int purgeExpired() {
        return caches.purgeExpired();
    }

    private static <T> List<List<T>> chunk(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return chunks;
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
