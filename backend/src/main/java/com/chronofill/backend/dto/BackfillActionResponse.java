package com.chronofill.backend.dto;

import com.chronofill.backend.model.BackfillRequest;

public record BackfillActionResponse(
        Long requestId,
        String action,
        BackfillRequest.Status status,
        int affectedChunks,
        String message
) {}
