package com.openrangelabs.donpetre.credentials.model;

public enum KeyPermission {
    READ,
    WRITE,
    DELETE,
    ADMIN
}
