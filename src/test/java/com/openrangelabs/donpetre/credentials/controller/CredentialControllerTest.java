package com.openrangelabs.donpetre.credentials.controller;

import com.openrangelabs.donpetre.credentials.TestKeys;
import com.openrangelabs.donpetre.credentials.exception.CredentialAlreadyExistsException;
import com.openrangelabs.donpetre.credentials.exception.InvalidKeyFormatException;
import com.openrangelabs.donpetre.credentials.exception.StorageNotInitializedException;
import com.openrangelabs.donpetre.credentials.model.CreateKeyInput;
import com.openrangelabs.donpetre.credentials.model.CredentialMetadata;
import com.openrangelabs.donpetre.credentials.model.EncryptedCredential;
import com.openrangelabs.donpetre.credentials.model.KeyListResult;
import com.openrangelabs.donpetre.credentials.model.KeyQueryOptions;
import com.openrangelabs.donpetre.credentials.model.KeyRotationResult;
import com.openrangelabs.donpetre.credentials.model.KeyStatus;
import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.model.RotationStatus;
import com.openrangelabs.donpetre.credentials.service.CredentialStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(CredentialController.class)
@Import(ControllerTestConfiguration.class)
class CredentialControllerTest {

    private static final String KEY_ID = "openai-1740823200000-a1b2c3-0f1e2d3c";

    @Autowired
    private WebTestClient webTestClient;

    @org.springframework.boot.test.mock.mockito.MockBean
    private CredentialStorageService storageService;

    private EncryptedCredential stored;

    @BeforeEach
    void setUp() {
        CredentialMetadata metadata = CredentialMetadata.builder()
            .id(KEY_ID)
            .provider(Provider.OPENAI)
            .keyType(KeyType.STANDARD)
            .status(KeyStatus.ACTIVE)
            .name("Production OpenAI key")
            .maskedKey("sk-A...5Ef6")
            .createdAt(ControllerTestConfiguration.NOW)
            .expiresAt(ControllerTestConfiguration.NOW.plus(Duration.ofDays(3)))
            .build();
        stored = EncryptedCredential.builder()
            .id(KEY_ID)
            .metadata(metadata)
            .rotationStatus(RotationStatus.none())
            .build();
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void addKey_Success_CreatedWithMaskedKeyOnly() {
        // Arrange
        when(storageService.addKey(any(CreateKeyInput.class))).thenReturn(Mono.just(stored));

        // Act & Assert
        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "name", "Production OpenAI key", "tags", List.of("prod")))
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.id").isEqualTo(KEY_ID)
            .jsonPath("$.maskedKey").isEqualTo("sk-A...5Ef6")
            .jsonPath("$.provider").isEqualTo("openai")
            .jsonPath("$.expirationStatus").isEqualTo("EXPIRING_SOON")
            .jsonPath("$.daysUntilExpiration").isEqualTo(3)
            .jsonPath("$.rotationState").isEqualTo("NONE")
            .jsonPath("$.key").doesNotExist();

        ArgumentCaptor<CreateKeyInput> input = ArgumentCaptor.forClass(CreateKeyInput.class);
        verify(storageService).addKey(input.capture());
        assertThat(input.getValue().getKey()).isEqualTo(TestKeys.OPENAI);
        assertThat(input.getValue().getProvider()).isNull();
        assertThat(input.getValue().getTags()).containsExactly("prod");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void addKey_MissingName_BadRequest() {
        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI))
            .exchange()
            .expectStatus().isBadRequest();

        verify(storageService, never()).addKey(any());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void addKey_InvalidFormat_BadRequestWithDetails() {
        when(storageService.addKey(any(CreateKeyInput.class)))
            .thenReturn(Mono.error(new InvalidKeyFormatException(List.of("Key must start with \"sk-\""))));

        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", "pk-123", "name", "bad", "provider", "openai"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Invalid API Key Format")
            .jsonPath("$.details[0]").isEqualTo("Key must start with \"sk-\"");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void addKey_Duplicate_Conflict() {
        when(storageService.addKey(any(CreateKeyInput.class)))
            .thenReturn(Mono.error(new CredentialAlreadyExistsException(KEY_ID)));

        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "name", "copy"))
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.message").isEqualTo("API key already exists with ID: " + KEY_ID);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void addKey_StorageNotInitialized_Locked() {
        when(storageService.addKey(any(CreateKeyInput.class)))
            .thenReturn(Mono.error(new StorageNotInitializedException()));

        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "name", "main"))
            .exchange()
            .expectStatus().isEqualTo(423);
    }

    @Test
    @WithMockUser(roles = "USER")
    void addKey_InsufficientPermissions_Forbidden() {
        webTestClient.post()
            .uri("/api/keys")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "name", "main"))
            .exchange()
            .expectStatus().isForbidden();

        verify(storageService, never()).addKey(any());
    }

    @Test
    void listKeys_Unauthenticated_Unauthorized() {
        webTestClient.get()
            .uri("/api/keys")
            .exchange()
            .expectStatus().isUnauthorized();
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void listKeys_PassesFiltersToStorage() {
        // Arrange
        when(storageService.listKeys(any(KeyQueryOptions.class))).thenReturn(Mono.just(KeyListResult.builder()
            .keys(List.of(stored.getMetadata()))
            .total(1)
            .hasMore(false)
            .build()));

        // Act & Assert
        webTestClient.get()
            .uri(uri -> uri.path("/api/keys")
                .queryParam("provider", "OpenAI")
                .queryParam("tags", "prod", "team-a")
                .queryParam("sortBy", "name")
                .queryParam("sortOrder", "asc")
                .queryParam("limit", 10)
                .queryParam("cursor", "20")
                .build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total").isEqualTo(1)
            .jsonPath("$.keys[0].id").isEqualTo(KEY_ID);

        ArgumentCaptor<KeyQueryOptions> options = ArgumentCaptor.forClass(KeyQueryOptions.class);
        verify(storageService).listKeys(options.capture());
        assertThat(options.getValue().getProvider()).isEqualTo(Provider.OPENAI);
        assertThat(options.getValue().getTags()).containsExactly("prod", "team-a");
        assertThat(options.getValue().getSortBy()).isEqualTo(KeyQueryOptions.SortField.NAME);
        assertThat(options.getValue().getSortOrder()).isEqualTo(KeyQueryOptions.SortOrder.ASC);
        assertThat(options.getValue().getLimit()).isEqualTo(10);
        assertThat(options.getValue().getCursor()).isEqualTo("20");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void listKeys_UnknownProvider_BadRequest() {
        webTestClient.get()
            .uri("/api/keys?provider=mistral")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Unknown provider: mistral");

        verify(storageService, never()).listKeys(any());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void getKey_Missing_NotFound() {
        when(storageService.getKey(anyString())).thenReturn(Mono.empty());

        webTestClient.get()
            .uri("/api/keys/{id}", "openai-0-missing")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("API Key Not Found");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void deleteKey_ExistingAndMissing() {
        when(storageService.deleteKey(KEY_ID)).thenReturn(Mono.just(true));
        when(storageService.deleteKey("missing")).thenReturn(Mono.just(false));

        webTestClient.delete().uri("/api/keys/{id}", KEY_ID).exchange().expectStatus().isNoContent();
        webTestClient.delete().uri("/api/keys/{id}", "missing").exchange().expectStatus().isNotFound();
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void rotateKey_Success_Ok() {
        when(storageService.rotateKey(eq(KEY_ID), eq(TestKeys.OPENAI_ALT)))
            .thenReturn(Mono.just(KeyRotationResult.succeeded(KEY_ID)));

        webTestClient.post()
            .uri("/api/keys/{id}/rotate", KEY_ID)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("newKey", TestKeys.OPENAI_ALT))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.success").isEqualTo(true)
            .jsonPath("$.newKeyId").isEqualTo(KEY_ID);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void rotateKey_RolledBack_UnprocessableEntity() {
        when(storageService.rotateKey(eq(KEY_ID), anyString()))
            .thenReturn(Mono.just(KeyRotationResult.rolledBack("Encryption failed")));

        webTestClient.post()
            .uri("/api/keys/{id}/rotate", KEY_ID)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("newKey", TestKeys.OPENAI_ALT))
            .exchange()
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.success").isEqualTo(false)
            .jsonPath("$.rollbackAvailable").isEqualTo(true)
            .jsonPath("$.error").isEqualTo("Encryption failed");
    }
}
