package com.openrangelabs.donpetre.credentials.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps credential exceptions to HTTP responses.
 *
 * <p>Locked or expired storage answers 423 so clients know to initialize again;
 * encryption and storage internals are never echoed back.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(StorageNotInitializedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotInitialized(
            StorageNotInitializedException ex, ServerWebExchange exchange) {
        log.warn("Storage not ready: {}", ex.getMessage());
        return respond(HttpStatus.LOCKED, "Storage Not Initialized", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(SessionExpiredException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSessionExpired(
            SessionExpiredException ex, ServerWebExchange exchange) {
        log.warn("Session expired on {}", exchange.getRequest().getPath());
        return respond(HttpStatus.LOCKED, "Session Expired", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(InvalidKeyFormatException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidFormat(
            InvalidKeyFormatException ex, ServerWebExchange exchange) {
        log.warn("Rejected API key format: {}", ex.getErrors());
        return respond(HttpStatus.BAD_REQUEST, "Invalid API Key Format", ex.getMessage(), ex.getErrors(), exchange);
    }

    @ExceptionHandler(CredentialNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(
            CredentialNotFoundException ex, ServerWebExchange exchange) {
        log.warn("API key not found: {}", ex.getKeyId());
        return respond(HttpStatus.NOT_FOUND, "API Key Not Found", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(CredentialAlreadyExistsException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAlreadyExists(
            CredentialAlreadyExistsException ex, ServerWebExchange exchange) {
        log.warn("Duplicate API key: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "API Key Already Exists", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(IntegrityCheckFailedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIntegrity(
            IntegrityCheckFailedException ex, ServerWebExchange exchange) {
        log.error("Integrity check failed for key {}", ex.getKeyId());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Data Integrity Failure", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(CredentialEncryptionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleEncryption(
            CredentialEncryptionException ex, ServerWebExchange exchange) {
        log.error("Credential encryption error: {}", ex.getMessage(), ex);
        // internal details stay in the log
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Credential Processing Error",
                "Unable to process credential. Please try again.", null, exchange);
    }

    @ExceptionHandler(CredentialStorageException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStorage(
            CredentialStorageException ex, ServerWebExchange exchange) {
        log.error("Credential storage error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Operation Failed", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(CredentialException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCredentialException(
            CredentialException ex, ServerWebExchange exchange) {
        log.error("Credential operation failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_REQUEST, "Credential Operation Failed", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {
        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(field, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", null, exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", null, exchange);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String title, String message,
                                                        List<String> details, ServerWebExchange exchange) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(title)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .details(details)
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
