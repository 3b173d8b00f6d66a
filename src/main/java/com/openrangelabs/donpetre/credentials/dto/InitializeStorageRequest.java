package com.openrangelabs.donpetre.credentials.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to open the encryption session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Passphrase used to derive the storage encryption key")
public class InitializeStorageRequest {

    @NotBlank(message = "Passphrase is required")
    @Schema(description = "Storage passphrase (at least 8 characters)", required = true)
    private String passphrase;

    @Override
    public String toString() {
        return "InitializeStorageRequest(passphrase=***)";
    }
}
