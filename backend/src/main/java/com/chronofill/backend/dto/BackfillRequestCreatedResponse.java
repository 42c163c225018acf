package com.chronofill.backend.dto;

public record BackfillRequestCreatedResponse(
        BackfillRequestResponse backfillRequest,
        boolean created,
        String message
) {}
