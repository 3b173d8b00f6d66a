package com.openrangelabs.donpetre.credentials.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Input for storing a new key. {@code provider} may be null, in which case it is
 * detected from the key.
 */
@Value
@Builder
public class CreateKeyInput {

    String key;
    Provider provider;
    String name;
    String description;
    List<String> tags;
    List<KeyPermission> permissions;
    Instant expiresAt;
    String userId;
    String organizationId;
    CredentialConfiguration configuration;

    @Override
    public String toString() {
        return "CreateKeyInput(provider=" + provider + ", name=" + name + ")";
    }
}
