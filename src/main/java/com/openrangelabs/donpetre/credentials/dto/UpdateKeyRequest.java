package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.model.CredentialConfiguration;
import com.openrangelabs.donpetre.credentials.model.KeyPermission;
import com.openrangelabs.donpetre.credentials.model.KeyStatus;
import com.openrangelabs.donpetre.credentials.model.UpdateKeyInput;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of key metadata and configuration. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial update of a stored key; the secret itself cannot be changed here")
public class UpdateKeyRequest {

    @Size(max = 100, message = "Name cannot exceed 100 characters")
    private String name;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;

    private List<String> tags;

    private List<KeyPermission> permissions;

    @Schema(description = "New status", allowableValues = {"ACTIVE", "INACTIVE", "REVOKED"})
    private KeyStatus status;

    private Instant expiresAt;

    private CredentialConfiguration configuration;

    public UpdateKeyInput toInput() {
        return UpdateKeyInput.builder()
                .name(name)
                .description(description)
                .tags(tags)
                .permissions(permissions)
                .status(status)
                .expiresAt(expiresAt)
                .configuration(configuration)
                .build();
    }
}
