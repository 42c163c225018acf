package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.dto.CreateBackfillRequest;
import com.chronofill.backend.exception.ConflictException;
import com.chronofill.backend.exception.NotFoundException;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.repository.BackfillJobRepository;
import com.chronofill.backend.repository.BackfillRequestRepository;
import com.chronofill.backend.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Operator lifecycle for backfill requests: create, review, pause, resume, cancel and retry of exhausted chunks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillRequestService {

    private final BackfillRequestValidator validator;
    private final BackfillRequestRepository requestRepository;
    private final BackfillJobRepository jobRepository;
    private final BackfillJobStore jobStore;
    private final DeadLetterQueueService deadLetterQueueService;
    private final BackfillAuditEmitter auditEmitter;
    private final BackfillProperties properties;
    private final TenantRepository tenantRepository;

    /**
     * Creates a PENDING request, or returns the existing one when the same tenant, source and range
     * was requested before. The tenant row stays locked until commit, so concurrent creates for one tenant
     * run their replay and overlap checks one after another.
     */
    @Transactional
    public CreateResult create(CreateBackfillRequest body, String requestedBy) {
        tenantRepository.findByIdForUpdate(body.tenantId());
        BackfillRequestValidator.ValidationOutcome outcome = validator.validateAndPrepare(body.tenantId(),
                body.sourceSystem(), body.startDate(), body.endDate());
        if (!outcome.isNew()) {
            auditEmitter.requested(outcome.existing(), true);
            return new CreateResult(outcome.existing(), false);
        }

        Instant now = Instant.now();
        BackfillRequest request = BackfillRequest.builder()
                .tenantId(body.tenantId())
                .sourceSystem(body.sourceSystem())
                .startDate(body.startDate())
                .endDate(body.endDate())
                .status(BackfillRequest.Status.PENDING)
                .reason(body.reason().trim())
                .requestedBy(requestedBy)
                .idempotencyKey(outcome.idempotencyKey())
                .createdAt(now)
                .updatedAt(now)
                .build();
        request = requestRepository.saveAndFlush(request);

        if (properties.getRequests().isAutoApprove()) {
            request.transitionTo(BackfillRequest.Status.APPROVED);
            request.setReviewedBy(properties.getRequests().getAutoApproveIdentity());
            request.setReviewedAt(Instant.now());
            request = requestRepository.save(request);
        }
        log.info("Backfill request {} created tenantId={} source={} range={}..{} status={}", request.getId(),
                request.getTenantId(), request.getSourceSystem().getValue(), request.getStartDate(),
                request.getEndDate(), request.getStatus());
        auditEmitter.requested(request, false);
        return new CreateResult(request, true);
    }

    @Transactional(readOnly = true)
    public BackfillRequest getRequest(Long requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Backfill request " + requestId + " not found"));
    }

    @Transactional
    public BackfillRequest approve(Long requestId, String reviewer) {
        BackfillRequest request = getRequest(requestId);
        request.transitionTo(BackfillRequest.Status.APPROVED);
        request.setReviewedBy(reviewer);
        request.setReviewedAt(Instant.now());
        log.info("Backfill request {} approved by {}", requestId, reviewer);
        return requestRepository.save(request);
    }

    @Transactional
    public BackfillRequest reject(Long requestId, String reviewer, String note) {
        BackfillRequest request = getRequest(requestId);
        request.transitionTo(BackfillRequest.Status.REJECTED);
        request.setReviewedBy(reviewer);
        request.setReviewedAt(Instant.now());
        if (note != null && !note.isBlank()) {
            request.setErrorMessage("Rejected: " + note.trim());
        }
        log.info("Backfill request {} rejected by {}", requestId, reviewer);
        return requestRepository.save(request);
    }

    @Transactional
    public ActionResult pause(Long requestId) {
        BackfillRequest request = requireRunning(requestId, "pause");
        List<BackfillJob> queued = jobRepository.findByRequestIdAndStatusIn(requestId,
                List.of(BackfillJob.Status.QUEUED));
        queued.forEach(BackfillJob::markPaused);
        jobRepository.saveAll(queued);
        log.info("Backfill request {} paused, {} chunk(s) held", requestId, queued.size());
        auditEmitter.paused(request, queued.size());
        return new ActionResult(request, queued.size());
    }

    @Transactional
    public ActionResult resume(Long requestId) {
        BackfillRequest request = requireRunning(requestId, "resume");
        List<BackfillJob> paused = jobRepository.findByRequestIdAndStatusIn(requestId,
                List.of(BackfillJob.Status.PAUSED));
        paused.forEach(BackfillJob::resume);
        jobRepository.saveAll(paused);
        log.info("Backfill request {} resumed, {} chunk(s) requeued", requestId, paused.size());
        return new ActionResult(request, paused.size());
    }

    /**
     * Cancels every chunk that has not started. A chunk that is running finishes and the request settles
     * once it reports; when nothing is in flight the request settles immediately.
     */
    @Transactional
    public ActionResult cancel(Long requestId) {
        BackfillRequest request = getRequest(requestId);
        if (request.getStatus() == BackfillRequest.Status.PENDING
                || request.getStatus() == BackfillRequest.Status.APPROVED) {
            request.transitionTo(BackfillRequest.Status.CANCELLED);
            requestRepository.save(request);
            log.info("Backfill request {} cancelled before execution", requestId);
            auditEmitter.completed(request);
            return new ActionResult(request, 0);
        }
        if (request.getStatus() != BackfillRequest.Status.RUNNING) {
            request.transitionTo(BackfillRequest.Status.CANCELLED);
        }

        List<BackfillJob> cancellable = jobRepository.findByRequestIdAndStatusIn(requestId,
                List.of(BackfillJob.Status.QUEUED, BackfillJob.Status.PAUSED));
        cancellable.forEach(BackfillJob::markCancelled);
        jobRepository.saveAll(cancellable);

        BackfillJobStore.RollUp rollUp = jobStore.rollUpRequest(requestId);
        BackfillRequest settled = rollUp.request();
        if (settled.getStatus() == BackfillRequest.Status.RUNNING) {
            settleStalledCancel(settled);
        }
        switch (rollUp.transition()) {
            case COMPLETED, CANCELLED -> auditEmitter.completed(settled);
            case FAILED, STALLED -> auditEmitter.failed(settled, rollUp.exhaustedChunks());
            case NONE -> {
            }
        }
        log.info("Backfill request {} cancel: {} chunk(s) cancelled, request now {}", requestId, cancellable.size(),
                settled.getStatus());
        return new ActionResult(settled, cancellable.size());
    }

    /**
     * Gives exhausted chunks of a running request a fresh retry budget and clears the request's failure note.
     */
    @Transactional
    public ActionResult retryFailed(Long requestId) {
        BackfillRequest request = requireRunning(requestId, "retry failed chunks of");
        List<BackfillJob> exhausted = jobRepository.findByRequestIdAndStatusIn(requestId,
                        List.of(BackfillJob.Status.FAILED)).stream()
                .filter(BackfillJob::isExhausted)
                .toList();
        exhausted.forEach(BackfillJob::requeueForOperatorRetry);
        jobRepository.saveAll(exhausted);
        if (!exhausted.isEmpty()) {
            request.setErrorMessage(null);
            request.setUpdatedAt(Instant.now());
            requestRepository.save(request);
            deadLetterQueueService.resolveForRequest(requestId);
        }
        log.info("Backfill request {} retry: {} exhausted chunk(s) requeued", requestId, exhausted.size());
        return new ActionResult(request, exhausted.size());
    }

    private void settleStalledCancel(BackfillRequest request) {
        List<BackfillJob> jobs = jobRepository.findByRequestIdOrderByChunkIndexAsc(request.getId());
        if (jobs.stream().anyMatch(BackfillJob::isInFlight)) {
            return;
        }
        int exhausted = (int) jobs.stream().filter(BackfillJob::isExhausted).count();
        if (exhausted == 0) {
            request.transitionTo(BackfillRequest.Status.CANCELLED);
            requestRepository.save(request);
            auditEmitter.completed(request);
            return;
        }
        boolean alreadyReported = request.getErrorMessage() != null;
        request.setErrorMessage(BackfillJobStore.failureMessage(exhausted));
        request.transitionTo(BackfillRequest.Status.FAILED);
        requestRepository.save(request);
        if (!alreadyReported) {
            auditEmitter.failed(request, exhausted);
        }
    }

    private BackfillRequest requireRunning(Long requestId, String action) {
        BackfillRequest request = getRequest(requestId);
        if (request.getStatus() != BackfillRequest.Status.RUNNING) {
            throw new ConflictException("Cannot " + action + " backfill request " + requestId + " in status "
                    + request.getStatus());
        }
        return request;
    }

    public record CreateResult(BackfillRequest request, boolean created) {}

    public record ActionResult(BackfillRequest request, int affectedChunks) {}
}
