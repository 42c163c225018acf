package com.chronofill.backend.service.transform;

import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.SourceSystem;

import java.time.LocalDate;

public record ChunkTransformRequest(
        Long jobId,
        Long requestId,
        String tenantId,
        SourceSystem sourceSystem,
        LocalDate chunkStartDate,
        LocalDate chunkEndDate,
        int chunkIndex,
        int attempt
) {

    public static ChunkTransformRequest from(BackfillJob job) {
        return new ChunkTransformRequest(
                job.getId(),
                job.getRequestId(),
                job.getTenantId(),
                job.getSourceSystem(),
                job.getChunkStartDate(),
                job.getChunkEndDate(),
                job.getChunkIndex(),
                job.getAttempt());
    }
}
