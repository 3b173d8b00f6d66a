package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.model.CreateKeyInput;
import com.openrangelabs.donpetre.credentials.model.CredentialConfiguration;
import com.openrangelabs.donpetre.credentials.model.KeyPermission;
import com.openrangelabs.donpetre.credentials.model.Provider;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for storing a new provider API key.
 *
 * <p><strong>Security Note:</strong> The 'key' field contains the raw secret. It is
 * encrypted before storage and excluded from {@link #toString()}.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for storing an encrypted provider API key")
public class CreateKeyRequest {

    @NotBlank(message = "API key is required")
    @Size(max = 2048, message = "API key cannot exceed 2048 characters")
    @Schema(description = "The raw API key (will be encrypted)", example = "sk-proj-abc123...", required = true)
    private String key;

    @Schema(description = "Provider; detected from the key when omitted", example = "openai",
            allowableValues = {"openai", "anthropic", "google", "custom"})
    private Provider provider;

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name cannot exceed 100 characters")
    @Schema(description = "Display name", example = "Production OpenAI key", required = true)
    private String name;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    @Schema(description = "Optional description", example = "Used by the summarization pipeline")
    private String description;

    @Schema(description = "Free-form tags", example = "[\"prod\", \"team-a\"]")
    private List<String> tags;

    @Schema(description = "Permissions granted to the key; defaults to READ and WRITE")
    private List<KeyPermission> permissions;

    @Schema(description = "Optional expiry instant", example = "2026-12-31T23:59:59Z")
    private Instant expiresAt;

    @Schema(description = "Owning user")
    private String userId;

    @Schema(description = "Owning organization")
    private String organizationId;

    @Schema(description = "Per-key operational configuration")
    private CredentialConfiguration configuration;

    public CreateKeyInput toInput() {
        return CreateKeyInput.builder()
                .key(key)
                .provider(provider)
                .name(name)
                .description(description)
                .tags(tags)
                .permissions(permissions)
                .expiresAt(expiresAt)
                .userId(userId)
                .organizationId(organizationId)
                .configuration(configuration)
                .build();
    }

    @Override
    public String toString() {
        return "CreateKeyRequest(provider=" + provider + ", name=" + name + ")";
    }
}
