package com.openrangelabs.donpetre.credentials.controller;

import com.openrangelabs.donpetre.credentials.config.CredentialVaultProperties;
import com.openrangelabs.donpetre.credentials.dto.BatchValidateRequest;
import com.openrangelabs.donpetre.credentials.dto.ValidateKeyRequest;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.validation.ApiKeyValidationService;
import com.openrangelabs.donpetre.credentials.validation.BatchValidationOptions;
import com.openrangelabs.donpetre.credentials.validation.ExtendedValidationResult;
import com.openrangelabs.donpetre.credentials.validation.KeyInfo;
import com.openrangelabs.donpetre.credentials.validation.LiveValidationOptions;
import com.openrangelabs.donpetre.credentials.validation.LiveValidationResult;
import com.openrangelabs.donpetre.credentials.validation.ValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * REST controller for validating keys without storing them.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/validation", produces = MediaType.APPLICATION_JSON_VALUE)
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Validation", description = "Format, entropy and live validation of provider API keys")
@SecurityRequirement(name = "basicAuth")
public class ValidationController {

    private final ApiKeyValidationService validationService;
    private final BatchValidationOptions batchDefaults;

    public ValidationController(ApiKeyValidationService validationService, CredentialVaultProperties properties) {
        this.validationService = validationService;
        CredentialVaultProperties.Batch batch = properties.getValidation().getBatch();
        this.batchDefaults = BatchValidationOptions.builder()
                .batchSize(batch.getBatchSize())
                .concurrency(batch.getConcurrency())
                .timeout(batch.getTimeout())
                .interBatchDelay(batch.getInterBatchDelay())
                .build();
    }

    @Operation(summary = "Validate key format", description = "Checks the key against its provider's format rules")
    @PostMapping(value = "/format", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ValidationResult> validateFormat(@Valid @RequestBody ValidateKeyRequest request) {
        return Mono.fromSupplier(() -> validationService.validateFormat(request.getKey(), providerOrNull(request)));
    }

    @Operation(summary = "Comprehensive validation",
            description = "Format check plus optional entropy, exposure, recommendation and live checks")
    @PostMapping(value = "/comprehensive", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExtendedValidationResult> validateComprehensive(@Valid @RequestBody ValidateKeyRequest request) {
        log.debug("Comprehensive validation requested for provider {}", request.getProvider());
        String providerTag = request.getProvider() != null
                ? request.getProvider()
                : validationService.describeKey(request.getKey()).getProvider().getTag();
        return validationService.validateComprehensive(request.getKey(), providerTag, request.toOptions());
    }

    @Operation(summary = "Live validation", description = "Probes the provider's API with the key")
    @PostMapping(value = "/live", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LiveValidationResult> validateLive(@Valid @RequestBody ValidateKeyRequest request) {
        Provider provider = request.getProvider() != null
                ? CredentialController.parseProvider(request.getProvider())
                : validationService.describeKey(request.getKey()).getProvider();
        LiveValidationOptions.LiveValidationOptionsBuilder options = LiveValidationOptions.builder();
        if (request.getTimeoutMs() != null) {
            options.timeout(Duration.ofMillis(request.getTimeoutMs()));
        }
        return validationService.validateLive(request.getKey(), provider, options.build());
    }

    @Operation(summary = "Batch validation",
            description = "Validates entries in batches with bounded concurrency; results keep entry order")
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Flux<ExtendedValidationResult> batchValidate(@Valid @RequestBody BatchValidateRequest request) {
        log.info("Batch validation of {} entries", request.getEntries().size());
        return validationService.batchValidate(request.toInputs(), request.toOptions(batchDefaults));
    }

    @Operation(summary = "Describe key", description = "Provider, entropy and character-set analysis of a key")
    @PostMapping(value = "/describe", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<KeyInfo> describeKey(@Valid @RequestBody ValidateKeyRequest request) {
        return Mono.fromSupplier(() -> validationService.describeKey(request.getKey()));
    }

    @Operation(summary = "Validation cache statistics")
    @GetMapping("/cache")
    public Mono<Map<String, Object>> cacheStats() {
        return Mono.fromSupplier(validationService::cacheStats);
    }

    @Operation(summary = "Clear validation caches")
    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Void>> clearCache() {
        log.info("Clearing validation caches");
        validationService.clearCaches();
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static Provider providerOrNull(ValidateKeyRequest request) {
        return request.getProvider() != null ? CredentialController.parseProvider(request.getProvider()) : null;
    }
}
