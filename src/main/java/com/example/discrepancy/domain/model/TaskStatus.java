package com.example.discrepancy.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a submitted report. A task leaves {@link #PENDING} exactly once.
 */
public enum TaskStatus {
    PENDING,
    SUCCESS,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFinished() {
        return this != PENDING;
    }
}
