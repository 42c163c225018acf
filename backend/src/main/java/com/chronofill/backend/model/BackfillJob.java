package com.chronofill.backend.model;

import com.chronofill.backend.exception.IllegalStateTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
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

/**
 * One date-bounded chunk of a {@link BackfillRequest}. Chunks are retried independently.
 * <p>
 * QUEUED to RUNNING happens through the conditional claim update in
 * {@code BackfillJobRepository#claim}, never through a setter, so that two workers cannot pick the same row.
 */
@Entity
@Table(name = "backfill_jobs",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_backfill_jobs_request_chunk", columnNames = {"request_id", "chunk_index"})
        },
        indexes = {
                @Index(name = "idx_backfill_jobs_status_created", columnList = "status, created_at"),
                @Index(name = "idx_backfill_jobs_tenant_status", columnList = "tenant_id, status")
        })
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillJob {

    public static final int ERROR_MESSAGE_LIMIT = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false)
    private Long requestId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_system", nullable = false, length = 32)
    private SourceSystem sourceSystem;

    @Column(name = "chunk_start_date", nullable = false)
    private LocalDate chunkStartDate;

    @Column(name = "chunk_end_date", nullable = false)
    private LocalDate chunkEndDate;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Status status;

    @Column(nullable = false)
    private int attempt;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "rows_affected")
    private Long rowsAffected;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "error_message", length = ERROR_MESSAGE_LIMIT)
    private String errorMessage;

    @Column(length = 4000)
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean canRetry() {
        return status == Status.FAILED && attempt < maxRetries;
    }

    public boolean isExhausted() {
        return status == Status.FAILED && attempt >= maxRetries;
    }

    public boolean isInFlight() {
        return status == Status.QUEUED || status == Status.RUNNING || status == Status.PAUSED || canRetry();
    }

    public void markSuccess(long rows, double duration) {
        transitionTo(Status.SUCCESS);
        rowsAffected = rows;
        durationSeconds = duration;
        errorMessage = null;
        completedAt = Instant.now();
    }

    public void markFailed(String error, double duration) {
        transitionTo(Status.FAILED);
        errorMessage = truncate(error);
        durationSeconds = duration;
        completedAt = Instant.now();
    }

    public void scheduleRetry(double delaySeconds) {
        if (!canRetry()) {
            throw new IllegalStateTransitionException("Backfill job", id, status, Status.QUEUED);
        }
        transitionTo(Status.QUEUED);
        nextRetryAt = Instant.now().plusMillis(Math.round(delaySeconds * 1000));
        startedAt = null;
        completedAt = null;
    }

    public void markPaused() {
        transitionTo(Status.PAUSED);
        completedAt = Instant.now();
    }

    public void resume() {
        transitionTo(Status.QUEUED);
        completedAt = null;
        nextRetryAt = null;
    }

    public void markCancelled() {
        transitionTo(Status.CANCELLED);
        completedAt = Instant.now();
    }

    /**
     * Gives an exhausted chunk a fresh retry budget after an operator decided to try again.
     */
    public void requeueForOperatorRetry() {
        if (!isExhausted()) {
            throw new IllegalStateTransitionException("Backfill job", id, status, Status.QUEUED);
        }
        transitionTo(Status.QUEUED);
        attempt = 0;
        errorMessage = null;
        nextRetryAt = null;
        startedAt = null;
        completedAt = null;
    }

    private void transitionTo(Status next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("Backfill job", id, status, next);
        }
        status = next;
        updatedAt = Instant.now();
    }

    private static String truncate(String error) {
        if (error == null || error.isBlank()) {
            return "Unknown error";
        }
        return error.length() <= ERROR_MESSAGE_LIMIT ? error : error.substring(0, ERROR_MESSAGE_LIMIT);
    }

    public enum Status {
        QUEUED,
        RUNNING,
        SUCCESS,
        FAILED,
        PAUSED,
        CANCELLED;

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case QUEUED -> next == RUNNING || next == PAUSED || next == CANCELLED;
                case RUNNING -> next == SUCCESS || next == FAILED || next == QUEUED;
                case FAILED -> next == QUEUED || next == PAUSED || next == CANCELLED;
                case PAUSED -> next == QUEUED || next == CANCELLED;
                case SUCCESS, CANCELLED -> false;
            };
        }
    }
}
