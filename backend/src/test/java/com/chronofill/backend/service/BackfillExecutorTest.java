package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.service.transform.ChunkTransformResult;
import com.chronofill.backend.service.transform.ChunkTransformRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackfillExecutorTest {

    private BackfillJobStore jobStore;
    private ChunkPlanner chunkPlanner;
    private ChunkTransformRunner transformRunner;
    private BackfillAuditEmitter auditEmitter;
    private SimpleMeterRegistry meterRegistry;
    private BackfillExecutor executor;

    private final List<BackfillJob> queue = new ArrayList<>();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        jobStore = mock(BackfillJobStore.class);
        chunkPlanner = mock(ChunkPlanner.class);
        transformRunner = mock(ChunkTransformRunner.class);
        auditEmitter = mock(BackfillAuditEmitter.class);
        meterRegistry = new SimpleMeterRegistry();
        BackfillMetrics metrics = new BackfillMetrics(meterRegistry);
        metrics.init();
        executor = new BackfillExecutor(jobStore, chunkPlanner, transformRunner, auditEmitter, metrics,
                new BackfillProperties());

        when(jobStore.findStaleJobIds(any())).thenReturn(List.of());
        when(chunkPlanner.findRequestsAwaitingPlanning()).thenReturn(List.of());
        when(jobStore.busyTenants()).thenAnswer(invocation -> new HashSet<String>());
        when(jobStore.findClaimCandidates(any(), anyInt())).thenAnswer(invocation -> {
            Collection<String> excluded = invocation.getArgument(0);
            return queue.stream().filter(job -> !excluded.contains(job.getTenantId())).toList();
        });
        when(jobStore.tryClaim(anyLong())).thenAnswer(invocation -> {
            Long id = invocation.getArgument(0);
            Optional<BackfillJob> job = queue.stream().filter(candidate -> candidate.getId().equals(id)).findFirst();
            job.ifPresent(claimed -> {
                queue.remove(claimed);
                claimed.setAttempt(claimed.getAttempt() + 1);
                claimed.setStartedAt(Instant.now());
            });
            return job;
        });
        when(jobStore.applyResult(anyLong(), any(), any(), anyDouble())).thenAnswer(invocation ->
                new BackfillJobStore.AppliedResult(null, BackfillJobStore.ChunkOutcome.SUCCEEDED, 0));
        when(jobStore.rollUpRequest(anyLong())).thenReturn(BackfillJobStore.RollUp.none(null));
        when(transformRunner.run(any())).thenReturn(ChunkTransformResult.success(10));
    }

    @Test
    void runsAtMostOneChunkPerTenantPerCycle() {
        queue.add(job(1L, "tenant-a", 0));
        queue.add(job(2L, "tenant-a", 1));
        queue.add(job(3L, "tenant-b", 0));

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.executed()).isEqualTo(2);
        verify(jobStore).tryClaim(1L);
        verify(jobStore).tryClaim(3L);
        verify(jobStore, never()).tryClaim(2L);
        assertThat(queue).extracting(BackfillJob::getId).containsExactly(2L);
    }

    @Test
    void tenantWithRunningChunkIsSkipped() {
        when(jobStore.busyTenants()).thenAnswer(invocation -> new HashSet<>(List.of("tenant-a")));
        queue.add(job(1L, "tenant-a", 0));

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.executed()).isZero();
        verify(jobStore, never()).tryClaim(anyLong());
    }

    @Test
    void lostClaimMovesOnToAnotherTenant() {
        queue.add(job(1L, "tenant-a", 0));
        queue.add(job(2L, "tenant-b", 0));
        doReturn(Optional.empty()).when(jobStore).tryClaim(1L);

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.executed()).isEqualTo(1);
        verify(jobStore).applyResult(eq(2L), any(), any(), anyDouble());
        assertThat(meterRegistry.get("backfill_claims_lost_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void runnerExceptionIsRecordedAsChunkFailure() {
        queue.add(job(1L, "tenant-a", 0));
        when(transformRunner.run(any())).thenThrow(new IllegalStateException("warehouse unreachable"));
        when(jobStore.applyResult(anyLong(), any(), any(), anyDouble())).thenReturn(
                new BackfillJobStore.AppliedResult(null, BackfillJobStore.ChunkOutcome.RETRY_SCHEDULED, 60));

        executor.runCycle();

        ArgumentCaptor<ChunkTransformResult> captor = ArgumentCaptor.forClass(ChunkTransformResult.class);
        verify(jobStore).applyResult(eq(1L), any(), captor.capture(), anyDouble());
        assertThat(captor.getValue().successful()).isFalse();
        assertThat(captor.getValue().errorMessage()).isEqualTo("warehouse unreachable");
        assertThat(meterRegistry.get("backfill_chunks_failed_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void discardedResultDoesNotSettleRequest() {
        queue.add(job(1L, "tenant-a", 0));
        when(jobStore.applyResult(anyLong(), any(), any(), anyDouble())).thenReturn(
                new BackfillJobStore.AppliedResult(null, BackfillJobStore.ChunkOutcome.DISCARDED, 0));

        executor.runCycle();

        verify(jobStore, never()).rollUpRequest(anyLong());
    }

    @Test
    void stalledRequestEmitsFailedAudit() {
        queue.add(job(1L, "tenant-a", 0));
        BackfillRequest request = BackfillRequest.builder().id(100L).status(BackfillRequest.Status.RUNNING).build();
        when(jobStore.applyResult(anyLong(), any(), any(), anyDouble())).thenReturn(
                new BackfillJobStore.AppliedResult(null, BackfillJobStore.ChunkOutcome.EXHAUSTED, 0));
        when(jobStore.rollUpRequest(100L)).thenReturn(
                new BackfillJobStore.RollUp(request, BackfillJobStore.Transition.STALLED, 1));

        executor.runCycle();

        verify(auditEmitter).failed(request, 1);
        verify(auditEmitter, never()).completed(any());
    }

    @Test
    void approvedRequestsArePlannedAndAudited() {
        BackfillRequest request = BackfillRequest.builder().id(100L).status(BackfillRequest.Status.RUNNING).build();
        when(chunkPlanner.findRequestsAwaitingPlanning()).thenReturn(List.of(100L));
        when(chunkPlanner.planRequest(100L)).thenReturn(Optional.of(new ChunkPlanner.PlannedRequest(request, 4)));

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.planned()).isEqualTo(1);
        verify(auditEmitter).started(request, 4);
    }

    @Test
    void staleJobsAreReclaimedBeforeClaiming() {
        when(jobStore.findStaleJobIds(any())).thenReturn(List.of(5L, 6L));
        when(jobStore.reclaim(eq(5L), any())).thenReturn(true);
        when(jobStore.reclaim(eq(6L), any())).thenReturn(false);

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(report.reclaimed()).isEqualTo(1);
        assertThat(meterRegistry.get("backfill_chunks_reclaimed_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void stopRequestPreventsNewClaims() {
        queue.add(job(1L, "tenant-a", 0));
        executor.requestStop();

        BackfillExecutor.CycleReport report = executor.runCycle();

        assertThat(executor.isStopping()).isTrue();
        assertThat(report.executed()).isZero();
        verify(jobStore, never()).findClaimCandidates(any(), anyInt());
        verify(transformRunner, times(0)).run(any());
    }

    private static BackfillJob job(Long id, String tenantId, int chunkIndex) {
        Instant now = Instant.now();
        return BackfillJob.builder()
                .id(id)
                .requestId(100L)
                .tenantId(tenantId)
                .sourceSystem(SourceSystem.SHOPIFY)
                .chunkStartDate(LocalDate.of(2024, 1, 1).plusDays(chunkIndex * 7L))
                .chunkEndDate(LocalDate.of(2024, 1, 7).plusDays(chunkIndex * 7L))
                .chunkIndex(chunkIndex)
                .status(BackfillJob.Status.QUEUED)
                .attempt(0)
                .maxRetries(3)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
