package com.chronofill.backend.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Operator-facing status of a backfill, derived from the request status and its chunks.
 */
public enum EffectiveStatus {
    PENDING,
    RUNNING,
    PAUSED,
    FAILED,
    COMPLETED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EffectiveStatus fromValue(String raw) {
        return Arrays.stream(values())
                .filter(status -> status.getValue().equalsIgnoreCase(raw == null ? "" : raw.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown status filter: " + raw));
    }
}
