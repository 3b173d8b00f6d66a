package com.openrangelabs.donpetre.credentials.controller;

import com.openrangelabs.donpetre.credentials.dto.InitializeStorageRequest;
import com.openrangelabs.donpetre.credentials.model.HealthCheckResult;
import com.openrangelabs.donpetre.credentials.model.StorageMetrics;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller for the storage lifecycle: opening and closing the encryption
 * session, health, metrics and cache control.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/storage", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Storage", description = "Encryption session lifecycle and storage diagnostics")
@SecurityRequirement(name = "basicAuth")
public class StorageController {

    private final CredentialStorageService storageService;

    @Operation(summary = "Initialize storage",
            description = "Derives the session key from the passphrase. Allowed when uninitialized or locked.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Storage ready"),
            @ApiResponse(responseCode = "400", description = "Passphrase too weak"),
            @ApiResponse(responseCode = "500", description = "Storage already initialized or initialization failed")
    })
    @PostMapping(value = "/initialize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> initialize(@Valid @RequestBody InitializeStorageRequest request) {
        log.info("Initializing API key storage");
        return storageService.initializeStorage(request.getPassphrase())
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(
                        Map.<String, Object>of("state", storageService.getState()))));
    }

    @Operation(summary = "Lock storage", description = "Ends the encryption session; data is kept")
    @PostMapping("/lock")
    public Mono<ResponseEntity<Map<String, Object>>> lock() {
        log.info("Locking API key storage");
        return storageService.lock()
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(
                        Map.<String, Object>of("state", storageService.getState()))));
    }

    @Operation(summary = "Shut down storage", description = "Clears caches and the session key")
    @PostMapping("/shutdown")
    public Mono<ResponseEntity<Void>> shutdown() {
        log.info("Shutting down API key storage");
        return storageService.shutdown().thenReturn(ResponseEntity.noContent().build());
    }

    @Operation(summary = "Storage health",
            description = "Encryption service, session and store reachability. Returns 503 when any check fails.")
    @GetMapping("/health")
    @PreAuthorize("permitAll()")
    public Mono<ResponseEntity<HealthCheckResult>> health() {
        return storageService.getHealthStatus()
                .map(result -> ResponseEntity
                        .status(result.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(result));
    }

    @Operation(summary = "Storage metrics")
    @GetMapping("/metrics")
    public Mono<StorageMetrics> metrics() {
        return Mono.fromSupplier(storageService::getMetrics);
    }

    @Operation(summary = "Clear caches", description = "Drops the record cache and every validation cache")
    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Void>> clearCache() {
        log.info("Clearing storage and validation caches");
        return storageService.clearCache().thenReturn(ResponseEntity.noContent().build());
    }
}
