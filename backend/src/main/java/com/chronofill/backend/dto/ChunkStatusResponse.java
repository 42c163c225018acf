package com.chronofill.backend.dto;

import com.chronofill.backend.model.BackfillJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkStatusResponse {
    private int chunkIndex;
    private LocalDate chunkStartDate;
    private LocalDate chunkEndDate;
    private BackfillJob.Status status;
    private int attempt;
    private Double durationSeconds;
    private Long rowsAffected;
    private String errorMessage;

    public static ChunkStatusResponse from(BackfillJob job) {
        return ChunkStatusResponse.builder()
                .chunkIndex(job.getChunkIndex())
                .chunkStartDate(job.getChunkStartDate())
                .chunkEndDate(job.getChunkEndDate())
                .status(job.getStatus())
                .attempt(job.getAttempt())
                .durationSeconds(job.getDurationSeconds())
                .rowsAffected(job.getRowsAffected())
                .errorMessage(job.getErrorMessage())
                .build();
    }
}
