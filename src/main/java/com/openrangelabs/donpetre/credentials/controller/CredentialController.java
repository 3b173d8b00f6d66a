package com.openrangelabs.donpetre.credentials.controller;

import com.openrangelabs.donpetre.credentials.config.CredentialVaultProperties;
import com.openrangelabs.donpetre.credentials.dto.CreateKeyRequest;
import com.openrangelabs.donpetre.credentials.dto.CredentialResponseDto;
import com.openrangelabs.donpetre.credentials.dto.RecordUsageRequest;
import com.openrangelabs.donpetre.credentials.dto.RotateKeyRequest;
import com.openrangelabs.donpetre.credentials.dto.UpdateKeyRequest;
import com.openrangelabs.donpetre.credentials.exception.CredentialNotFoundException;
import com.openrangelabs.donpetre.credentials.model.ConnectionTestResult;
import com.openrangelabs.donpetre.credentials.model.ExportBundle;
import com.openrangelabs.donpetre.credentials.model.ImportResult;
import com.openrangelabs.donpetre.credentials.model.KeyListResult;
import com.openrangelabs.donpetre.credentials.model.KeyQueryOptions;
import com.openrangelabs.donpetre.credentials.model.KeyRotationResult;
import com.openrangelabs.donpetre.credentials.model.KeyStatus;
import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.model.UsageStats;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * REST controller for stored API keys.
 *
 * <p>Covers the full key lifecycle:
 * <ul>
 *   <li>Encrypted storage with format validation and duplicate detection</li>
 *   <li>Metadata updates, revocation and deletion</li>
 *   <li>Rotation with automatic rollback</li>
 *   <li>Usage tracking and live connection tests</li>
 *   <li>Encrypted import and export</li>
 * </ul>
 *
 * <p><strong>Security Note:</strong> All endpoints require ADMIN role. Secrets are never
 * returned; responses carry the masked key only.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping(value = "/api/keys", produces = MediaType.APPLICATION_JSON_VALUE)
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "API Keys", description = "Encrypted provider API key storage and lifecycle")
@SecurityRequirement(name = "basicAuth")
public class CredentialController {

    private final CredentialStorageService storageService;
    private final Clock clock;
    private final int warningDays;

    public CredentialController(CredentialStorageService storageService, Clock clock,
                                CredentialVaultProperties properties) {
        this.storageService = storageService;
        this.clock = clock;
        this.warningDays = properties.getStorage().getExpiryWarningDays();
    }

    /**
     * Stores a new encrypted key.
     *
     * @param request the key and its metadata
     * @return metadata of the stored key
     */
    @Operation(summary = "Store new API key",
            description = "Validates the key format, rejects duplicates and stores the key encrypted")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Key stored",
                    content = @Content(schema = @Schema(implementation = CredentialResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid key format or request data"),
            @ApiResponse(responseCode = "409", description = "Key already stored"),
            @ApiResponse(responseCode = "423", description = "Storage not initialized or session expired")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CredentialResponseDto>> addKey(@Valid @RequestBody CreateKeyRequest request) {
        log.info("Storing API key '{}' for provider {}", request.getName(), request.getProvider());
        return storageService.addKey(request.toInput())
                .map(record -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(CredentialResponseDto.fromEntity(record, clock.instant(), warningDays)))
                .doOnError(error -> log.error("Failed to store API key '{}': {}", request.getName(), error.getMessage()));
    }

    @Operation(summary = "List API keys", description = "Filters, sorts and pages stored key metadata")
    @GetMapping
    public Mono<KeyListResult> listKeys(
            @Parameter(description = "Provider tag") @RequestParam(required = false) String provider,
            @RequestParam(required = false) KeyStatus status,
            @RequestParam(required = false) KeyType keyType,
            @Parameter(description = "Matches keys carrying any of these tags") @RequestParam(required = false) List<String> tags,
            @Parameter(description = "Case-insensitive match on name and description") @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "CREATED_AT") String sortBy,
            @RequestParam(defaultValue = "DESC") String sortOrder,
            @RequestParam(required = false) @Min(0) @Max(1000) Integer limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @Parameter(description = "Opaque cursor from a previous page") @RequestParam(required = false) String cursor) {

        KeyQueryOptions options = KeyQueryOptions.builder()
                .provider(provider != null ? parseProvider(provider) : null)
                .status(status)
                .keyType(keyType)
                .tags(tags)
                .search(search)
                .sortBy(parseEnum(KeyQueryOptions.SortField.class, sortBy, "sortBy"))
                .sortOrder(parseEnum(KeyQueryOptions.SortOrder.class, sortOrder, "sortOrder"))
                .limit(limit)
                .offset(offset)
                .cursor(cursor)
                .build();
        return storageService.listKeys(options);
    }

    @Operation(summary = "Keys expiring soon", description = "Active keys whose expiry falls within the window")
    @GetMapping("/expiring")
    public Flux<CredentialResponseDto> getExpiringKeys(
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days) {
        return storageService.getExpiringKeys(days)
                .map(metadata -> CredentialResponseDto.fromMetadata(metadata, clock.instant(), warningDays));
    }

    @Operation(summary = "Export keys",
            description = "Exports metadata, or full encrypted records when includeSecrets is true")
    @GetMapping("/export")
    public Mono<ExportBundle> exportKeys(@RequestParam(defaultValue = "false") boolean includeSecrets) {
        log.info("Exporting API keys (includeSecrets={})", includeSecrets);
        return storageService.exportKeys(includeSecrets);
    }

    @Operation(summary = "Import keys",
            description = "Imports encrypted records; each entry succeeds or fails on its own")
    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ImportResult> importKeys(@RequestBody ExportBundle bundle) {
        log.info("Importing {} API keys", bundle.getKeys() != null ? bundle.getKeys().size() : 0);
        return storageService.importKeys(bundle);
    }

    @Operation(summary = "Get API key", description = "Loads a key after verifying its integrity")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Key found"),
            @ApiResponse(responseCode = "404", description = "Key not found"),
            @ApiResponse(responseCode = "500", description = "Integrity check failed")
    })
    @GetMapping("/{keyId}")
    public Mono<CredentialResponseDto> getKey(@PathVariable String keyId) {
        return storageService.getKey(keyId)
                .switchIfEmpty(Mono.error(new CredentialNotFoundException(keyId)))
                .map(record -> CredentialResponseDto.fromEntity(record, clock.instant(), warningDays));
    }

    @Operation(summary = "Update API key", description = "Merges metadata and configuration; the secret is unchanged")
    @PatchMapping(value = "/{keyId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CredentialResponseDto> updateKey(@PathVariable String keyId,
                                                 @Valid @RequestBody UpdateKeyRequest request) {
        log.info("Updating API key {}", keyId);
        return storageService.updateKey(keyId, request.toInput())
                .map(record -> CredentialResponseDto.fromEntity(record, clock.instant(), warningDays));
    }

    @Operation(summary = "Delete API key")
    @DeleteMapping("/{keyId}")
    public Mono<ResponseEntity<Void>> deleteKey(@PathVariable String keyId) {
        log.info("Deleting API key {}", keyId);
        return storageService.deleteKey(keyId)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @Operation(summary = "Revoke API key", description = "Marks the key revoked and keeps the record")
    @PostMapping("/{keyId}/revoke")
    public Mono<ResponseEntity<Void>> revokeKey(@PathVariable String keyId) {
        log.info("Revoking API key {}", keyId);
        return storageService.revokeKey(keyId)
                .map(revoked -> revoked
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @Operation(summary = "Rotate API key",
            description = "Replaces the secret in place. Failures after the snapshot are rolled back.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rotation succeeded"),
            @ApiResponse(responseCode = "404", description = "Key not found"),
            @ApiResponse(responseCode = "422", description = "Rotation rejected or rolled back")
    })
    @PostMapping(value = "/{keyId}/rotate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<KeyRotationResult>> rotateKey(@PathVariable String keyId,
                                                             @Valid @RequestBody RotateKeyRequest request) {
        log.info("Rotating API key {}", keyId);
        return storageService.rotateKey(keyId, request.getNewKey())
                .map(result -> ResponseEntity
                        .status(result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                        .body(result));
    }

    @Operation(summary = "Usage statistics")
    @GetMapping("/{keyId}/usage")
    public Mono<UsageStats> getUsage(@PathVariable String keyId) {
        return storageService.getKeyUsageStats(keyId);
    }

    @Operation(summary = "Record usage", description = "Folds one usage sample into the key's statistics")
    @PostMapping(value = "/{keyId}/usage", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UsageStats> recordUsage(@PathVariable String keyId, @Valid @RequestBody RecordUsageRequest request) {
        return storageService.recordUsage(keyId, request.toRecord());
    }

    @Operation(summary = "Reset usage statistics")
    @DeleteMapping("/{keyId}/usage")
    public Mono<UsageStats> resetUsage(@PathVariable String keyId) {
        log.info("Resetting usage statistics of API key {}", keyId);
        return storageService.resetUsageStats(keyId);
    }

    @Operation(summary = "Test connection", description = "Probes the provider with the stored key")
    @PostMapping("/{keyId}/test")
    public Mono<ConnectionTestResult> testConnection(@PathVariable String keyId) {
        log.info("Testing connection of API key {}", keyId);
        return storageService.testKeyConnection(keyId);
    }

    static Provider parseProvider(String tag) {
        return Provider.fromTag(tag)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + tag));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String name) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
