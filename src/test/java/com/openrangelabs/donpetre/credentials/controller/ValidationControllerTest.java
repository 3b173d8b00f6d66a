package com.openrangelabs.donpetre.credentials.controller;

import com.openrangelabs.donpetre.credentials.TestKeys;
import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import com.openrangelabs.donpetre.credentials.validation.ApiKeyValidationService;
import com.openrangelabs.donpetre.credentials.validation.BatchValidationInput;
import com.openrangelabs.donpetre.credentials.validation.BatchValidationOptions;
import com.openrangelabs.donpetre.credentials.validation.ExtendedValidationResult;
import com.openrangelabs.donpetre.credentials.validation.KeyInfo;
import com.openrangelabs.donpetre.credentials.validation.ValidationOptions;
import com.openrangelabs.donpetre.credentials.validation.ValidationResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(ValidationController.class)
@Import(ControllerTestConfiguration.class)
class ValidationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @org.springframework.boot.test.mock.mockito.MockBean
    private ApiKeyValidationService validationService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void validateFormat_DeclaredProvider_ReturnsResult() {
        // Arrange
        when(validationService.validateFormat(TestKeys.OPENAI, Provider.OPENAI)).thenReturn(ValidationResult.builder()
            .valid(true)
            .errors(List.of())
            .warnings(List.of())
            .provider(Provider.OPENAI)
            .keyType(KeyType.STANDARD)
            .build());

        // Act & Assert
        webTestClient.post()
            .uri("/api/validation/format")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "provider", "openai"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.valid").isEqualTo(true)
            .jsonPath("$.provider").isEqualTo("openai");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void validateFormat_UnknownProvider_BadRequest() {
        webTestClient.post()
            .uri("/api/validation/format")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.OPENAI, "provider", "mistral"))
            .exchange()
            .expectStatus().isBadRequest();

        verify(validationService, never()).validateFormat(any(), any());
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void validateComprehensive_NoProvider_UsesDetectedProvider() {
        // Arrange
        when(validationService.describeKey(TestKeys.ANTHROPIC))
            .thenReturn(KeyInfo.builder().provider(Provider.ANTHROPIC).build());
        when(validationService.validateComprehensive(eq(TestKeys.ANTHROPIC), eq("anthropic"), any(ValidationOptions.class)))
            .thenReturn(Mono.just(ExtendedValidationResult.builder()
                .valid(true)
                .provider(Provider.ANTHROPIC)
                .errors(List.of())
                .build()));

        // Act & Assert
        webTestClient.post()
            .uri("/api/validation/comprehensive")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("key", TestKeys.ANTHROPIC, "checkEntropy", true))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.valid").isEqualTo(true)
            .jsonPath("$.provider").isEqualTo("anthropic");

        ArgumentCaptor<ValidationOptions> options = ArgumentCaptor.forClass(ValidationOptions.class);
        verify(validationService).validateComprehensive(eq(TestKeys.ANTHROPIC), eq("anthropic"), options.capture());
        assertThat(options.getValue().isCheckEntropy()).isTrue();
        assertThat(options.getValue().isTestLive()).isFalse();
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void validateComprehensive_MissingKey_BadRequest() {
        webTestClient.post()
            .uri("/api/validation/comprehensive")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("provider", "openai"))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void batchValidate_StreamsResultsInOrder() {
        // Arrange
        when(validationService.batchValidate(anyList(), any(BatchValidationOptions.class))).thenReturn(Flux.just(
            ExtendedValidationResult.failure("Invalid provider", 0).withId("first"),
            ExtendedValidationResult.builder().id("second").valid(true).errors(List.of()).build()));

        // Act & Assert
        webTestClient.post()
            .uri("/api/validation/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of(
                "entries", List.of(
                    Map.of("id", "first", "key", TestKeys.OPENAI, "provider", "mistral"),
                    Map.of("id", "second", "key", TestKeys.GOOGLE, "provider", "google")),
                "batchSize", 1,
                "failFast", false))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].id").isEqualTo("first")
            .jsonPath("$[0].errors[0]").isEqualTo("Invalid provider")
            .jsonPath("$[1].id").isEqualTo("second");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<BatchValidationInput>> inputs = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<BatchValidationOptions> options = ArgumentCaptor.forClass(BatchValidationOptions.class);
        verify(validationService).batchValidate(inputs.capture(), options.capture());
        assertThat(inputs.getValue()).extracting(BatchValidationInput::getProvider).containsExactly("mistral", "google");
        assertThat(options.getValue().getBatchSize()).isEqualTo(1);
        assertThat(options.getValue().getConcurrency()).isEqualTo(5);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void clearCache_NoContent() {
        webTestClient.delete()
            .uri("/api/validation/cache")
            .exchange()
            .expectStatus().isNoContent();

        verify(validationService).clearCaches();
    }
}
