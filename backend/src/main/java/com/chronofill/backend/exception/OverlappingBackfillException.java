package com.chronofill.backend.exception;

public class OverlappingBackfillException extends BackfillValidationException {

    private final Long existingRequestId;

    public OverlappingBackfillException(Long existingRequestId, Enum<?> existingStatus) {
        super("OVERLAPPING_BACKFILL", "Overlaps with active backfill request " + existingRequestId
                + " (status: " + existingStatus + ")");
        this.existingRequestId = existingRequestId;
    }

    public Long getExistingRequestId() {
        return existingRequestId;
    }
}
