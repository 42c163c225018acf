package com.chronofill.backend.service;

import com.chronofill.backend.model.BackfillDeadLetter;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.repository.BackfillDeadLetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterQueueService {

    private final BackfillDeadLetterRepository repo;

    public BackfillDeadLetter logFailure(BackfillJob job) {
        log.error("DLQ entry: backfill job {} (request {}, chunk {}) exhausted {} attempts -> {}",
                job.getId(), job.getRequestId(), job.getChunkIndex(), job.getAttempt(), job.getErrorMessage());

        BackfillDeadLetter entry = BackfillDeadLetter.builder()
                .jobId(job.getId())
                .requestId(job.getRequestId())
                .tenantId(job.getTenantId())
                .chunkIndex(job.getChunkIndex())
                .attempts(job.getAttempt())
                .errorMessage(job.getErrorMessage())
                .resolved(false)
                .createdAt(Instant.now())
                .build();

        return repo.save(entry);
    }

    public int resolveForRequest(Long requestId) {
        List<BackfillDeadLetter> open = repo.findByRequestIdAndResolvedFalse(requestId);
        Instant now = Instant.now();
        for (BackfillDeadLetter entry : open) {
            entry.setResolved(true);
            entry.setResolvedAt(now);
        }
        repo.saveAll(open);
        if (!open.isEmpty()) {
            log.info("DLQ entries for backfill request {} marked as resolved: {}", requestId, open.size());
        }
        return open.size();
    }
}
