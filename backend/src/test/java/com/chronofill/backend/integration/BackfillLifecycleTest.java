package com.chronofill.backend.integration;

import com.chronofill.backend.dto.BackfillStatusResponse;
import com.chronofill.backend.dto.CreateBackfillRequest;
import com.chronofill.backend.model.AuditEvent;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.model.Tenant;
import com.chronofill.backend.repository.AuditEventRepository;
import com.chronofill.backend.repository.BackfillDeadLetterRepository;
import com.chronofill.backend.repository.BackfillJobRepository;
import com.chronofill.backend.repository.BackfillRequestRepository;
import com.chronofill.backend.repository.TenantRepository;
import com.chronofill.backend.service.BackfillAuditEmitter;
import com.chronofill.backend.service.BackfillExecutor;
import com.chronofill.backend.service.BackfillRequestService;
import com.chronofill.backend.service.BackfillStatusService;
import com.chronofill.backend.service.EffectiveStatus;
import com.chronofill.backend.service.transform.ChunkTransformResult;
import com.chronofill.backend.service.transform.ChunkTransformRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
class BackfillLifecycleTest {

    @MockBean
    private ChunkTransformRunner transformRunner;

    @Autowired
    private BackfillRequestService requestService;

    @Autowired
    private BackfillStatusService statusService;

    @Autowired
    private BackfillExecutor executor;

    @Autowired
    private TenantRepository tenantRepository;

    @Autowired
    private BackfillRequestRepository requestRepository;

    @Autowired
    private BackfillJobRepository jobRepository;

    @Autowired
    private BackfillDeadLetterRepository deadLetterRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @AfterEach
    void cleanUp() {
        deadLetterRepository.deleteAll();
        jobRepository.deleteAll();
        requestRepository.deleteAll();
        auditEventRepository.deleteAll();
        tenantRepository.deleteAll();
    }

    @Test
    void identicalRequestReturnsExistingRecord() {
        tenant("tenant-idem");
        CreateBackfillRequest body = body("tenant-idem", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 14));

        BackfillRequestService.CreateResult first = requestService.create(body, "ops@example.com");
        BackfillRequestService.CreateResult second = requestService.create(body, "someone-else@example.com");

        assertThat(first.created()).isTrue();
        assertThat(first.request().getStatus()).isEqualTo(BackfillRequest.Status.PENDING);
        assertThat(second.created()).isFalse();
        assertThat(second.request().getId()).isEqualTo(first.request().getId());
        assertThat(requestRepository.count()).isEqualTo(1);
        assertThat(auditEvents(first.request().getId())).extracting(AuditEvent::getEventType)
                .containsExactly(BackfillAuditEmitter.REQUESTED, BackfillAuditEmitter.REQUESTED);
    }

    @Test
    void approvedRequestRunsChunkByChunkToCompletion() {
        tenant("tenant-run");
        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.success(250));
        Long requestId = createAndApprove("tenant-run", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 14));

        BackfillExecutor.CycleReport first = executor.runCycle();

        assertThat(first.planned()).isEqualTo(1);
        assertThat(first.executed()).isEqualTo(1);
        BackfillStatusResponse midway = statusService.getStatus(requestId);
        assertThat(midway.getStatus()).isEqualTo(EffectiveStatus.RUNNING);
        assertThat(midway.getTotalChunks()).isEqualTo(2);
        assertThat(midway.getCompletedChunks()).isEqualTo(1);
        assertThat(midway.getPercentComplete()).isEqualTo(50.0);

        executor.runCycle();

        BackfillStatusResponse done = statusService.getStatus(requestId);
        assertThat(done.getStatus()).isEqualTo(EffectiveStatus.COMPLETED);
        assertThat(done.getRawStatus()).isEqualTo(BackfillRequest.Status.COMPLETED);
        assertThat(done.getPercentComplete()).isEqualTo(100.0);
        assertThat(jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId))
                .allSatisfy(job -> {
                    assertThat(job.getStatus()).isEqualTo(BackfillJob.Status.SUCCESS);
                    assertThat(job.getAttempt()).isEqualTo(1);
                    assertThat(job.getRowsAffected()).isEqualTo(250L);
                });
        assertThat(auditEvents(requestId)).extracting(AuditEvent::getEventType).containsExactly(
                BackfillAuditEmitter.REQUESTED, BackfillAuditEmitter.STARTED, BackfillAuditEmitter.COMPLETED);
    }

    @Test
    void failingChunkIsRetriedThenDeadLetteredAndCanBeRetriedByOperator() {
        tenant("tenant-fail");
        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.failure("warehouse timeout"));
        Long requestId = createAndApprove("tenant-fail", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 7));

        executor.runCycle();
        BackfillJob afterFirst = onlyJob(requestId);
        assertThat(afterFirst.getStatus()).isEqualTo(BackfillJob.Status.QUEUED);
        assertThat(afterFirst.getAttempt()).isEqualTo(1);
        assertThat(afterFirst.getNextRetryAt()).isAfter(Instant.now());

        // a job waiting for its retry time is not picked up
        assertThat(executor.runCycle().executed()).isZero();

        makeRetryDue(requestId);
        executor.runCycle();
        makeRetryDue(requestId);
        executor.runCycle();

        BackfillJob exhausted = onlyJob(requestId);
        assertThat(exhausted.getStatus()).isEqualTo(BackfillJob.Status.FAILED);
        assertThat(exhausted.getAttempt()).isEqualTo(3);
        assertThat(exhausted.getErrorMessage()).isEqualTo("warehouse timeout");
        assertThat(deadLetterRepository.findByRequestIdAndResolvedFalse(requestId)).hasSize(1);

        BackfillStatusResponse stalled = statusService.getStatus(requestId);
        assertThat(stalled.getStatus()).isEqualTo(EffectiveStatus.FAILED);
        assertThat(stalled.getRawStatus()).isEqualTo(BackfillRequest.Status.RUNNING);
        assertThat(stalled.getErrorMessage()).isEqualTo("1 chunk(s) failed permanently");
        assertThat(stalled.getFailureReasons()).containsExactly("Chunk 0 (2024-02-01 - 2024-02-07): warehouse timeout");

        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.success(10));
        BackfillRequestService.ActionResult retry = requestService.retryFailed(requestId);
        assertThat(retry.affectedChunks()).isEqualTo(1);
        assertThat(deadLetterRepository.findByRequestIdAndResolvedFalse(requestId)).isEmpty();

        executor.runCycle();

        assertThat(requestRepository.findById(requestId).orElseThrow().getStatus())
                .isEqualTo(BackfillRequest.Status.COMPLETED);
        assertThat(auditEvents(requestId)).extracting(AuditEvent::getEventType).containsExactly(
                BackfillAuditEmitter.REQUESTED, BackfillAuditEmitter.STARTED, BackfillAuditEmitter.FAILED,
                BackfillAuditEmitter.COMPLETED);
    }

    @Test
    void pauseHoldsQueuedChunksAndCancelSettlesRequest() {
        tenant("tenant-pause");
        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.success(1));
        Long requestId = createAndApprove("tenant-pause", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 21));
        executor.runCycle();

        BackfillRequestService.ActionResult paused = requestService.pause(requestId);
        assertThat(paused.affectedChunks()).isEqualTo(2);
        assertThat(statusService.getStatus(requestId).getStatus()).isEqualTo(EffectiveStatus.PAUSED);
        assertThat(executor.runCycle().executed()).isZero();

        BackfillRequestService.ActionResult resumed = requestService.resume(requestId);
        assertThat(resumed.affectedChunks()).isEqualTo(2);
        assertThat(statusService.getStatus(requestId).getStatus()).isEqualTo(EffectiveStatus.RUNNING);

        BackfillRequestService.ActionResult cancelled = requestService.cancel(requestId);
        assertThat(cancelled.affectedChunks()).isEqualTo(2);
        assertThat(cancelled.request().getStatus()).isEqualTo(BackfillRequest.Status.CANCELLED);
        assertThat(jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId))
                .extracting(BackfillJob::getStatus)
                .containsExactly(BackfillJob.Status.SUCCESS, BackfillJob.Status.CANCELLED,
                        BackfillJob.Status.CANCELLED);
    }

    @Test
    void eachTenantRunsAtMostOneChunkPerCycle() {
        tenant("tenant-x");
        tenant("tenant-y");
        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.success(1));
        createAndApprove("tenant-x", LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 21));
        createAndApprove("tenant-y", LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 21));

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.planned()).isEqualTo(2);
        assertThat(report.executed()).isEqualTo(2);
        assertThat(jobRepository.countByTenantIdAndStatus("tenant-x", BackfillJob.Status.SUCCESS)).isEqualTo(1);
        assertThat(jobRepository.countByTenantIdAndStatus("tenant-y", BackfillJob.Status.SUCCESS)).isEqualTo(1);
        assertThat(jobRepository.countByTenantIdAndStatus("tenant-x", BackfillJob.Status.QUEUED)).isEqualTo(2);
    }

    private Long createAndApprove(String tenantId, LocalDate start, LocalDate end) {
        Long requestId = requestService.create(body(tenantId, start, end), "ops@example.com").request().getId();
        requestService.approve(requestId, "reviewer@example.com");
        return requestId;
    }

    private BackfillJob onlyJob(Long requestId) {
        List<BackfillJob> jobs = jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId);
        assertThat(jobs).hasSize(1);
        return jobs.get(0);
    }

    private void makeRetryDue(Long requestId) {
        List<BackfillJob> jobs = jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId);
        jobs.forEach(job -> job.setNextRetryAt(Instant.now().minusSeconds(1)));
        jobRepository.saveAll(jobs);
    }

    private List<AuditEvent> auditEvents(Long requestId) {
        return auditEventRepository.findByResourceTypeAndResourceIdOrderByIdAsc("backfill_request",
                String.valueOf(requestId));
    }

    private void tenant(String id) {
        tenantRepository.save(Tenant.builder()
                .id(id)
                .name(id)
                .status(Tenant.Status.ACTIVE)
                .billingTier("growth")
                .createdAt(Instant.now())
                .build());
    }

    private static CreateBackfillRequest body(String tenantId, LocalDate start, LocalDate end) {
        return new CreateBackfillRequest(tenantId, SourceSystem.SHOPIFY, start, end,
                "Reprocess after connector outage");
    }
}
