package com.openrangelabs.donpetre.credentials.model;

/**
 * Lifecycle status of a stored credential.
 *
 * <p>{@link #EXPIRED} is derived from the expiry timestamp and {@link #ROTATING}
 * is only held while a rotation is in flight; every other transition is caller driven.
 */
public enum KeyStatus {
    ACTIVE,
    INACTIVE,
    EXPIRED,
    REVOKED,
    ROTATING
}
