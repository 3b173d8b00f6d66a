package com.openrangelabs.donpetre.credentials.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Portable set of stored keys. With {@code includeSecrets} the entries carry their
 * encrypted payloads and checksums; secrets are never decrypted for export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportBundle {

    public static final String CURRENT_VERSION = "1.0";

    @Builder.Default
    private String version = CURRENT_VERSION;
    private Instant timestamp;
    private boolean includeSecrets;
    @Builder.Default
    private List<EncryptedCredential> keys = new ArrayList<>();
}
