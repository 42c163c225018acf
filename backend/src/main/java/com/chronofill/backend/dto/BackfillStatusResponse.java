package com.chronofill.backend.dto;

import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.service.EffectiveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillStatusResponse {
    private Long id;
    private String tenantId;
    private SourceSystem sourceSystem;
    private LocalDate startDate;
    private LocalDate endDate;
    private EffectiveStatus status;
    private BackfillRequest.Status rawStatus;
    private double percentComplete;
    private int totalChunks;
    private int completedChunks;
    private int failedChunks;
    private ChunkStatusResponse currentChunk;
    private List<String> failureReasons;
    private Double estimatedSecondsRemaining;
    private String reason;
    private String requestedBy;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
    private Instant createdAt;
}
