package com.openrangelabs.donpetre.credentials.model;

public enum EncryptionLevel {
    STANDARD,
    HIGH,
    MAXIMUM
}
