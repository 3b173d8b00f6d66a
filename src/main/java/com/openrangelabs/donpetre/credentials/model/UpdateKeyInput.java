package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Metadata-only patch. Null fields are left unchanged.
 */
@Value
@Builder
public class UpdateKeyInput {

    String name;
    String description;
    List<String> tags;
    List<KeyPermission> permissions;
    KeyStatus status;
    Instant expiresAt;
    CredentialConfiguration configuration;
}
