package com.chronofill.backend.service;

import com.chronofill.backend.model.SourceSystem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    /**
     * SHA-256 hex of {@code tenant|source|start|end} with ISO dates.
     */
    public static String forBackfill(String tenantId, SourceSystem source, LocalDate startDate, LocalDate endDate) {
        String raw = tenantId + "|" + source.getValue() + "|" + startDate + "|" + endDate;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
