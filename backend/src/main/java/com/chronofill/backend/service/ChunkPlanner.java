package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.repository.BackfillJobRepository;
import com.chronofill.backend.repository.BackfillRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkPlanner {

    private final BackfillRequestRepository requestRepository;
    private final BackfillJobRepository jobRepository;
    private final BackfillProperties properties;

    /**
     * Splits {@code [start, end]} into contiguous inclusive ranges of at most {@code widthDays} days.
     * The last range is shorter when the total is not a multiple of the width.
     */
    public static List<ChunkRange> computeChunks(LocalDate start, LocalDate end, int widthDays) {
        if (widthDays < 1) {
            throw new IllegalArgumentException("Chunk width must be at least one day");
        }
        List<ChunkRange> chunks = new ArrayList<>();
        LocalDate current = start;
        while (!current.isAfter(end)) {
            LocalDate chunkEnd = current.plusDays(widthDays - 1L);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }
            chunks.add(new ChunkRange(current, chunkEnd));
            current = chunkEnd.plusDays(1);
        }
        return chunks;
    }

    @Transactional(readOnly = true)
    public List<Long> findRequestsAwaitingPlanning() {
        return requestRepository.findByStatusWithoutJobs(BackfillRequest.Status.APPROVED).stream()
                .map(BackfillRequest::getId)
                .toList();
    }

    /**
     * Materializes QUEUED chunk jobs for an APPROVED request and moves it to RUNNING in one transaction.
     * Returns empty when the request is not APPROVED or already has jobs.
     */
    @Transactional
    public Optional<PlannedRequest> planRequest(Long requestId) {
        BackfillRequest request = requestRepository.findById(requestId).orElse(null);
        if (request == null || request.getStatus() != BackfillRequest.Status.APPROVED) {
            return Optional.empty();
        }
        if (jobRepository.existsByRequestId(requestId)) {
            log.warn("Backfill request {} already has chunk jobs, skipping planning", requestId);
            return Optional.empty();
        }

        List<ChunkRange> chunks = computeChunks(request.getStartDate(), request.getEndDate(),
                properties.getChunking().getChunkSizeDays());
        Instant now = Instant.now();
        List<BackfillJob> jobs = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            ChunkRange chunk = chunks.get(i);
            jobs.add(BackfillJob.builder()
                    .requestId(request.getId())
                    .tenantId(request.getTenantId())
                    .sourceSystem(request.getSourceSystem())
                    .chunkStartDate(chunk.start())
                    .chunkEndDate(chunk.end())
                    .chunkIndex(i)
                    .status(BackfillJob.Status.QUEUED)
                    .attempt(0)
                    .maxRetries(properties.getRetry().getMaxRetries())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        jobRepository.saveAll(jobs);

        request.transitionTo(BackfillRequest.Status.RUNNING);
        requestRepository.save(request);
        log.info("Planned backfill request {} tenantId={} into {} chunks", requestId, request.getTenantId(),
                jobs.size());
        return Optional.of(new PlannedRequest(request, jobs.size()));
    }

    public record ChunkRange(LocalDate start, LocalDate end) {}

    public record PlannedRequest(BackfillRequest request, int totalChunks) {}
}
