package com.chronofill.backend.dto;

import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequestResponse {
    private Long id;
    private String tenantId;
    private SourceSystem sourceSystem;
    private LocalDate startDate;
    private LocalDate endDate;
    private BackfillRequest.Status status;
    private String reason;
    private String requestedBy;
    private String idempotencyKey;
    private String reviewedBy;
    private Instant reviewedAt;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;
    private Instant createdAt;
    private Instant updatedAt;

    public static BackfillRequestResponse from(BackfillRequest request) {
        return BackfillRequestResponse.builder()
                .id(request.getId())
                .tenantId(request.getTenantId())
                .sourceSystem(request.getSourceSystem())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .status(request.getStatus())
                .reason(request.getReason())
                .requestedBy(request.getRequestedBy())
                .idempotencyKey(request.getIdempotencyKey())
                .reviewedBy(request.getReviewedBy())
                .reviewedAt(request.getReviewedAt())
                .startedAt(request.getStartedAt())
                .completedAt(request.getCompletedAt())
                .errorMessage(request.getErrorMessage())
                .createdAt(request.getCreatedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
