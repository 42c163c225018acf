package com.chronofill.backend.repository;

import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BackfillRequestRepository extends JpaRepository<BackfillRequest, Long> {

    Optional<BackfillRequest> findByIdempotencyKey(String idempotencyKey);

    @Query("select r from BackfillRequest r where r.tenantId = :tenantId and r.sourceSystem = :sourceSystem "
            + "and r.status in :statuses and r.startDate <= :endDate and r.endDate >= :startDate "
            + "order by r.createdAt asc")
    List<BackfillRequest> findOverlapping(@Param("tenantId") String tenantId,
                                          @Param("sourceSystem") SourceSystem sourceSystem,
                                          @Param("startDate") LocalDate startDate,
                                          @Param("endDate") LocalDate endDate,
                                          @Param("statuses") Collection<BackfillRequest.Status> statuses);

    @Query("select r from BackfillRequest r where r.status = :status and not exists "
            + "(select j.id from BackfillJob j where j.requestId = r.id) order by r.createdAt asc")
    List<BackfillRequest> findByStatusWithoutJobs(@Param("status") BackfillRequest.Status status);

    List<BackfillRequest> findAllByOrderByCreatedAtDesc();

    List<BackfillRequest> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<BackfillRequest> findByTenantIdAndStatus(String tenantId, BackfillRequest.Status status);
}
