package com.openrangelabs.donpetre.credentials.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Replacement secret for an existing key")
public class RotateKeyRequest {

    @NotBlank(message = "New API key is required")
    @Size(max = 2048, message = "API key cannot exceed 2048 characters")
    @Schema(description = "The new raw API key (will be encrypted)", required = true)
    private String newKey;

    @Override
    public String toString() {
        return "RotateKeyRequest(newKey=***)";
    }
}
