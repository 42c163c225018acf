package com.chronofill.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum SourceSystem {
    SHOPIFY("shopify"),
    FACEBOOK("facebook"),
    GOOGLE("google"),
    TIKTOK("tiktok"),
    PINTEREST("pinterest"),
    SNAPCHAT("snapchat"),
    AMAZON("amazon"),
    KLAVIYO("klaviyo"),
    RECHARGE("recharge"),
    GA4("ga4");

    private final String value;

    SourceSystem(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SourceSystem fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("source_system is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported source system: " + raw));
    }
}
