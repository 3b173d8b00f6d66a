package com.openrangelabs.donpetre.credentials.model;

public enum RotationState {
    NONE,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
