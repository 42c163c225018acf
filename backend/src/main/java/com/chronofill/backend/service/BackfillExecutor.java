package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.service.transform.ChunkTransformRequest;
import com.chronofill.backend.service.transform.ChunkTransformResult;
import com.chronofill.backend.service.transform.ChunkTransformRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One polling cycle of the backfill worker: reclaim stale chunks, plan approved requests,
 * then claim and run queued chunks with at most one RUNNING chunk per tenant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillExecutor {

    private final BackfillJobStore jobStore;
    private final ChunkPlanner chunkPlanner;
    private final ChunkTransformRunner transformRunner;
    private final BackfillAuditEmitter auditEmitter;
    private final BackfillMetrics metrics;
    private final BackfillProperties properties;

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public CycleReport runCycle() {
        metrics.cycle();
        int reclaimed = recoverStaleJobs();
        int planned = planApprovedRequests();
        int executed = stopping.get() ? 0 : executeQueuedJobs();
        if (reclaimed + planned + executed > 0) {
            log.info("Backfill cycle done reclaimed={} planned={} executed={}", reclaimed, planned, executed);
        }
        return new CycleReport(reclaimed, planned, executed);
    }

    /**
     * Stops picking new chunks. A chunk already running is allowed to finish.
     */
    public void requestStop() {
        if (stopping.compareAndSet(false, true)) {
            log.info("Backfill executor stopping, no new chunks will be claimed");
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }

    int recoverStaleJobs() {
        Instant cutoff = Instant.now().minus(properties.getWorker().staleJobTimeout());
        int reclaimed = 0;
        for (Long jobId : jobStore.findStaleJobIds(cutoff)) {
            try {
                if (jobStore.reclaim(jobId, cutoff)) {
                    reclaimed++;
                    metrics.chunkReclaimed();
                }
            } catch (RuntimeException e) {
                metrics.cycleError();
                log.error("Failed to reclaim stale backfill job {}", jobId, e);
            }
        }
        return reclaimed;
    }

    int planApprovedRequests() {
        int planned = 0;
        for (Long requestId : chunkPlanner.findRequestsAwaitingPlanning()) {
            try {
                Optional<ChunkPlanner.PlannedRequest> result = chunkPlanner.planRequest(requestId);
                if (result.isPresent()) {
                    planned++;
                    auditEmitter.started(result.get().request(), result.get().totalChunks());
                }
            } catch (DataIntegrityViolationException e) {
                log.info("Backfill request {} was planned concurrently by another worker", requestId);
            } catch (RuntimeException e) {
                metrics.cycleError();
                log.error("Failed to plan backfill request {}", requestId, e);
            }
        }
        return planned;
    }

    int executeQueuedJobs() {
        int limit = properties.getWorker().getMaxJobsPerCycle();
        Set<String> busyTenants = jobStore.busyTenants();
        int executed = 0;
        while (executed < limit && !stopping.get()) {
            List<BackfillJob> candidates = jobStore.findClaimCandidates(busyTenants, limit);
            if (candidates.isEmpty()) {
                break;
            }
            BackfillJob claimed = null;
            for (BackfillJob candidate : candidates) {
                if (busyTenants.contains(candidate.getTenantId())) {
                    continue;
                }
                Optional<BackfillJob> won = claim(candidate);
                busyTenants.add(candidate.getTenantId());
                if (won.isPresent()) {
                    claimed = won.get();
                    break;
                }
            }
            if (claimed == null) {
                // every candidate's tenant is now marked busy, so the next query looks further
                continue;
            }
            execute(claimed);
            executed++;
        }
        return executed;
    }

    private Optional<BackfillJob> claim(BackfillJob candidate) {
        try {
            Optional<BackfillJob> won = jobStore.tryClaim(candidate.getId());
            if (won.isEmpty()) {
                metrics.claimLost();
                log.debug("Lost claim on backfill job {}", candidate.getId());
            }
            return won;
        } catch (DataIntegrityViolationException e) {
            metrics.claimLost();
            log.debug("Tenant {} already has a running chunk, skipping job {}", candidate.getTenantId(),
                    candidate.getId());
            return Optional.empty();
        }
    }

    void execute(BackfillJob job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        MDC.put("requestId", String.valueOf(job.getRequestId()));
        MDC.put("tenantId", job.getTenantId());
        long started = System.nanoTime();
        try {
            log.info("Running backfill chunk {} [{} - {}] attempt {}", job.getChunkIndex(), job.getChunkStartDate(),
                    job.getChunkEndDate(), job.getAttempt());
            ChunkTransformResult result = runTransform(job);
            double duration = (System.nanoTime() - started) / 1_000_000_000.0;
            BackfillJobStore.AppliedResult applied = jobStore.applyResult(job.getId(), job.getStartedAt(), result,
                    duration);
            recordOutcome(applied);
            if (applied.outcome() != BackfillJobStore.ChunkOutcome.DISCARDED) {
                settleRequest(job.getRequestId());
            }
        } catch (RuntimeException e) {
            metrics.cycleError();
            log.error("Failed to record result for backfill job {}", job.getId(), e);
        } finally {
            MDC.remove("jobId");
            MDC.remove("requestId");
            MDC.remove("tenantId");
        }
    }

    private ChunkTransformResult runTransform(BackfillJob job) {
        try {
            ChunkTransformResult result = transformRunner.run(ChunkTransformRequest.from(job));
            return result != null ? result : ChunkTransformResult.failure("No result returned");
        } catch (RuntimeException e) {
            log.warn("Backfill chunk {} of request {} threw: {}", job.getChunkIndex(), job.getRequestId(),
                    e.getMessage());
            return ChunkTransformResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    private void recordOutcome(BackfillJobStore.AppliedResult applied) {
        switch (applied.outcome()) {
            case SUCCEEDED -> metrics.chunkSucceeded();
            case RETRY_SCHEDULED, HELD, WITHDRAWN -> metrics.chunkFailed();
            case EXHAUSTED -> {
                metrics.chunkFailed();
                metrics.chunkExhausted();
            }
            case DISCARDED -> {
            }
        }
    }

    private void settleRequest(Long requestId) {
        BackfillJobStore.RollUp rollUp = jobStore.rollUpRequest(requestId);
        switch (rollUp.transition()) {
            case COMPLETED, CANCELLED -> {
                log.info("Backfill request {} finished with status {}", requestId, rollUp.request().getStatus());
                auditEmitter.completed(rollUp.request());
            }
            case FAILED, STALLED -> auditEmitter.failed(rollUp.request(), rollUp.exhaustedChunks());
            case NONE -> {
            }
        }
    }

    public record CycleReport(int reclaimed, int planned, int executed) {}
}
