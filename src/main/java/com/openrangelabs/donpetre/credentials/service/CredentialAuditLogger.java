package com.openrangelabs.donpetre.credentials.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes key lifecycle events to the {@code AUDIT} logger. Details never contain key
 * material.
 */
@Component
public class CredentialAuditLogger {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    public void record(String action, String keyId) {
        record(action, keyId, Map.of());
    }

    public void record(String action, String keyId, Map<String, ?> details) {
        audit.info("action={} keyId={} details={}", action, keyId != null ? keyId : "unknown", details);
    }
}
