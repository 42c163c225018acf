package com.chronofill.backend.repository;

import com.chronofill.backend.model.BackfillJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface BackfillJobRepository extends JpaRepository<BackfillJob, Long> {

    List<BackfillJob> findByRequestIdOrderByChunkIndexAsc(Long requestId);

    List<BackfillJob> findByRequestIdInOrderByChunkIndexAsc(Collection<Long> requestIds);

    List<BackfillJob> findByRequestIdAndStatusIn(Long requestId, Collection<BackfillJob.Status> statuses);

    boolean existsByRequestId(Long requestId);

    long countByTenantIdAndStatus(String tenantId, BackfillJob.Status status);

    List<BackfillJob> findByStatusAndStartedAtBefore(BackfillJob.Status status, Instant startedAt);

    @Query("select distinct j.tenantId from BackfillJob j where j.status = :status")
    List<String> findDistinctTenantIdsByStatus(@Param("status") BackfillJob.Status status);

    @Query("select j from BackfillJob j where j.status = :queued "
            + "and (j.nextRetryAt is null or j.nextRetryAt <= :now) "
            + "order by j.createdAt asc, j.chunkIndex asc, j.id asc")
    List<BackfillJob> findClaimable(@Param("queued") BackfillJob.Status queued,
                                    @Param("now") Instant now,
                                    Pageable page);

    @Query("select j from BackfillJob j where j.status = :queued "
            + "and (j.nextRetryAt is null or j.nextRetryAt <= :now) "
            + "and j.tenantId not in :excludedTenants "
            + "order by j.createdAt asc, j.chunkIndex asc, j.id asc")
    List<BackfillJob> findClaimableExcluding(@Param("queued") BackfillJob.Status queued,
                                             @Param("now") Instant now,
                                             @Param("excludedTenants") Collection<String> excludedTenants,
                                             Pageable page);

    /**
     * Moves one QUEUED job to RUNNING if, at statement time, it is still QUEUED and its tenant has no RUNNING job.
     * Returns 1 when this caller won the claim, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BackfillJob j set j.status = :running, j.attempt = j.attempt + 1, j.startedAt = :now, "
            + "j.completedAt = null, j.nextRetryAt = null, j.errorMessage = null, j.updatedAt = :now "
            + "where j.id = :id and j.status = :queued and not exists "
            + "(select r.id from BackfillJob r where r.tenantId = j.tenantId and r.status = :running)")
    int claim(@Param("id") Long id,
              @Param("now") Instant now,
              @Param("queued") BackfillJob.Status queued,
              @Param("running") BackfillJob.Status running);

    /**
     * Requeues a RUNNING job whose start is older than the cutoff. Only one caller per stale interval gets 1 back.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BackfillJob j set j.status = :queued, j.startedAt = null, j.nextRetryAt = null, j.updatedAt = :now "
            + "where j.id = :id and j.status = :running and j.startedAt < :cutoff")
    int reclaimStale(@Param("id") Long id,
                     @Param("cutoff") Instant cutoff,
                     @Param("now") Instant now,
                     @Param("queued") BackfillJob.Status queued,
                     @Param("running") BackfillJob.Status running);
}
