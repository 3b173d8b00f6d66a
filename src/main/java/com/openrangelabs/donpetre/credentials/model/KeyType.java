package com.openrangelabs.donpetre.credentials.model;

/**
 * Tier of an API key as inferred from its shape.
 */
public enum KeyType {
    STANDARD,
    PRO,
    ENTERPRISE
}
