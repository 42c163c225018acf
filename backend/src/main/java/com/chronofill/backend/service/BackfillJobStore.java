package com.chronofill.backend.service;

import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.repository.BackfillJobRepository;
import com.chronofill.backend.repository.BackfillRequestRepository;
import com.chronofill.backend.service.transform.ChunkTransformResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transactional boundary for chunk job state. Every public method runs in its own short transaction
 * so that no transaction stays open while a chunk executes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillJobStore {

    private final BackfillJobRepository jobRepository;
    private final BackfillRequestRepository requestRepository;
    private final RetryBackoffPolicy backoffPolicy;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<Long> findStaleJobIds(Instant cutoff) {
        return jobRepository.findByStatusAndStartedAtBefore(BackfillJob.Status.RUNNING, cutoff).stream()
                .map(BackfillJob::getId)
                .toList();
    }

    /**
     * Requeues one stale RUNNING job. Returns false when another worker got there first or the job moved on.
     */
    @Transactional
    public boolean reclaim(Long jobId, Instant cutoff) {
        int updated = jobRepository.reclaimStale(jobId, cutoff, now(), BackfillJob.Status.QUEUED,
                BackfillJob.Status.RUNNING);
        if (updated == 0) {
            return false;
        }
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setMetadata(incrementReclaimCount(job.getMetadata()));
            jobRepository.save(job);
            log.warn("Reclaimed stale backfill job {} (request {}, chunk {}, attempt {})",
                    job.getId(), job.getRequestId(), job.getChunkIndex(), job.getAttempt());
        });
        return true;
    }

    @Transactional(readOnly = true)
    public Set<String> busyTenants() {
        return new HashSet<>(jobRepository.findDistinctTenantIdsByStatus(BackfillJob.Status.RUNNING));
    }

    @Transactional(readOnly = true)
    public List<BackfillJob> findClaimCandidates(Collection<String> excludedTenants, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(limit, 1));
        if (excludedTenants.isEmpty()) {
            return jobRepository.findClaimable(BackfillJob.Status.QUEUED, Instant.now(), page);
        }
        return jobRepository.findClaimableExcluding(BackfillJob.Status.QUEUED, Instant.now(), excludedTenants, page);
    }

    /**
     * Atomically moves a QUEUED job to RUNNING. The returned job's {@code startedAt} is the claim token
     * that {@link #applyResult} checks before writing.
     */
    @Transactional
    public Optional<BackfillJob> tryClaim(Long jobId) {
        int updated = jobRepository.claim(jobId, now(), BackfillJob.Status.QUEUED, BackfillJob.Status.RUNNING);
        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Transactional
    public AppliedResult applyResult(Long jobId, Instant claimedAt, ChunkTransformResult result, double durationSeconds) {
        BackfillJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != BackfillJob.Status.RUNNING || !claimedAt.equals(job.getStartedAt())) {
            log.warn("Discarding result for backfill job {}: claim no longer held", jobId);
            return new AppliedResult(job, ChunkOutcome.DISCARDED, 0);
        }

        if (result.successful()) {
            job.markSuccess(result.rowsAffected(), durationSeconds);
            jobRepository.save(job);
            return new AppliedResult(job, ChunkOutcome.SUCCEEDED, 0);
        }

        job.markFailed(result.errorMessage(), durationSeconds);
        if (job.canRetry()) {
            Set<BackfillJob.Status> held = heldSiblingStatuses(job);
            if (held.contains(BackfillJob.Status.CANCELLED)) {
                job.markCancelled();
                jobRepository.save(job);
                log.info("Backfill job {} failed after its request was cancelled, not retrying", job.getId());
                return new AppliedResult(job, ChunkOutcome.WITHDRAWN, 0);
            }
            if (held.contains(BackfillJob.Status.PAUSED)) {
                job.markPaused();
                jobRepository.save(job);
                log.info("Backfill job {} failed on attempt {}/{} while its request is paused, holding retry",
                        job.getId(), job.getAttempt(), job.getMaxRetries());
                return new AppliedResult(job, ChunkOutcome.HELD, 0);
            }
            double delay = backoffPolicy.delaySeconds(job.getAttempt());
            job.scheduleRetry(delay);
            jobRepository.save(job);
            log.info("Backfill job {} failed on attempt {}/{}, retry in {}s", job.getId(), job.getAttempt(),
                    job.getMaxRetries(), Math.round(delay));
            return new AppliedResult(job, ChunkOutcome.RETRY_SCHEDULED, delay);
        }

        jobRepository.save(job);
        deadLetterQueueService.logFailure(job);
        return new AppliedResult(job, ChunkOutcome.EXHAUSTED, 0);
    }

    /**
     * Settles the parent request from the state of its chunks. Joins the caller's transaction when there is one.
     */
    @Transactional
    public RollUp rollUpRequest(Long requestId) {
        BackfillRequest request = requestRepository.findById(requestId).orElse(null);
        if (request == null || request.getStatus() != BackfillRequest.Status.RUNNING) {
            return RollUp.none(request);
        }
        List<BackfillJob> jobs = jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId);
        if (jobs.isEmpty()) {
            return RollUp.none(request);
        }

        if (jobs.stream().allMatch(job -> job.getStatus() == BackfillJob.Status.SUCCESS)) {
            request.setErrorMessage(null);
            request.transitionTo(BackfillRequest.Status.COMPLETED);
            requestRepository.save(request);
            return new RollUp(request, Transition.COMPLETED, 0);
        }
        if (jobs.stream().anyMatch(BackfillJob::isInFlight)) {
            return RollUp.none(request);
        }

        long cancelled = jobs.stream().filter(job -> job.getStatus() == BackfillJob.Status.CANCELLED).count();
        int exhausted = (int) jobs.stream().filter(BackfillJob::isExhausted).count();
        String failureMessage = failureMessage(exhausted);
        boolean alreadyReported = failureMessage.equals(request.getErrorMessage());

        if (cancelled > 0 && exhausted == 0) {
            request.transitionTo(BackfillRequest.Status.CANCELLED);
            requestRepository.save(request);
            return new RollUp(request, Transition.CANCELLED, 0);
        }
        if (cancelled > 0) {
            request.setErrorMessage(failureMessage);
            request.transitionTo(BackfillRequest.Status.FAILED);
            requestRepository.save(request);
            return new RollUp(request, alreadyReported ? Transition.NONE : Transition.FAILED, exhausted);
        }
        if (alreadyReported) {
            return RollUp.none(request);
        }
        request.setErrorMessage(failureMessage);
        request.setUpdatedAt(Instant.now());
        requestRepository.save(request);
        log.warn("Backfill request {} stalled: {}", requestId, failureMessage);
        return new RollUp(request, Transition.STALLED, exhausted);
    }

    /**
     * Pause and cancel leave their mark on the chunks that had not started. A failed chunk follows its siblings
     * instead of going back to the queue.
     */
    private Set<BackfillJob.Status> heldSiblingStatuses(BackfillJob job) {
        Set<BackfillJob.Status> statuses = EnumSet.noneOf(BackfillJob.Status.class);
        jobRepository.findByRequestIdAndStatusIn(job.getRequestId(),
                        List.of(BackfillJob.Status.PAUSED, BackfillJob.Status.CANCELLED))
                .forEach(sibling -> statuses.add(sibling.getStatus()));
        return statuses;
    }

    static String failureMessage(int exhaustedChunks) {
        return exhaustedChunks + " chunk(s) failed permanently";
    }

    private String incrementReclaimCount(String metadata) {
        try {
            ObjectNode node = metadata == null || metadata.isBlank()
                    ? objectMapper.createObjectNode()
                    : (ObjectNode) objectMapper.readTree(metadata);
            node.put("reclaim_count", node.path("reclaim_count").asInt(0) + 1);
            node.put("last_reclaimed_at", Instant.now().toString());
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | ClassCastException e) {
            log.warn("Unreadable backfill job metadata, resetting: {}", e.getMessage());
            return "{\"reclaim_count\":1}";
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public enum ChunkOutcome {
        SUCCEEDED,
        RETRY_SCHEDULED,
        HELD,
        WITHDRAWN,
        EXHAUSTED,
        DISCARDED
    }

    public enum Transition {
        NONE,
        COMPLETED,
        CANCELLED,
        FAILED,
        STALLED
    }

    public record AppliedResult(BackfillJob job, ChunkOutcome outcome, double retryDelaySeconds) {}

    public record RollUp(BackfillRequest request, Transition transition, int exhaustedChunks) {

        static RollUp none(BackfillRequest request) {
            return new RollUp(request, Transition.NONE, 0);
        }
    }
}
