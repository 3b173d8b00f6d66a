package com.openrangelabs.donpetre.credentials.model;

public enum CheckStatus {
    PASS,
    FAIL,
    WARN
}
