package com.chronofill.backend.model;

import com.chronofill.backend.exception.IllegalStateTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Set;

/**
 * One operator intent to reprocess a tenant's history for a source system and an inclusive date range.
 * Targets an arbitrary tenant chosen by the operator, so it is never scoped by caller identity.
 */
@Entity
@Table(name = "backfill_requests", uniqueConstraints = {
        @UniqueConstraint(name = "uq_backfill_requests_idempotency_key", columnNames = {"idempotency_key"})
})
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequest {

    public static final Set<Status> ACTIVE_STATUSES = EnumSet.of(Status.PENDING, Status.APPROVED, Status.RUNNING);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_system", nullable = false, length = 32)
    private SourceSystem sourceSystem;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Status status;

    @Column(nullable = false, length = 1000)
    private String reason;

    @Column(name = "requested_by", nullable = false)
    private String requestedBy;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public long dayCount() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean isActive() {
        return ACTIVE_STATUSES.contains(status);
    }

    public boolean overlaps(LocalDate start, LocalDate end) {
        return !startDate.isAfter(end) && !endDate.isBefore(start);
    }

    public void transitionTo(Status next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("Backfill request", id, status, next);
        }
        Instant now = Instant.now();
        if (next == Status.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            completedAt = now;
        }
        status = next;
        updatedAt = now;
    }

    public enum Status {
        PENDING,
        APPROVED,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED,
        REJECTED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED || this == REJECTED;
        }

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case PENDING -> next == APPROVED || next == REJECTED || next == CANCELLED;
                case APPROVED -> next == RUNNING || next == CANCELLED;
                case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
                case COMPLETED, FAILED, CANCELLED, REJECTED -> false;
            };
        }
    }
}
