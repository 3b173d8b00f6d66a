package com.openrangelabs.donpetre.credentials.model;

/**
 * Readiness of the credential storage service.
 *
 * <pre>
 * UNINITIALIZED -> INITIALIZING -> READY -> LOCKED
 * </pre>
 */
public enum StorageState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    LOCKED
}
