package com.chronofill.backend.service;

import com.chronofill.backend.model.AuditEvent;
import com.chronofill.backend.model.BackfillRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle notifications for backfill requests. Every method is best-effort and never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackfillAuditEmitter {

    public static final String REQUESTED = "backfill.requested";
    public static final String STARTED = "backfill.started";
    public static final String PAUSED = "backfill.paused";
    public static final String FAILED = "backfill.failed";
    public static final String COMPLETED = "backfill.completed";

    private static final String RESOURCE_TYPE = "backfill_request";

    private final AuditEventService auditEventService;

    public void requested(BackfillRequest request, boolean replay) {
        Map<String, Object> metadata = baseMetadata(request);
        metadata.put("requested_by", request.getRequestedBy());
        metadata.put("reason", request.getReason());
        metadata.put("idempotent_replay", replay);
        emit(request, REQUESTED, "REQUESTED", AuditEvent.Outcome.SUCCESS, "api",
                replay ? "Backfill request replayed" : "Backfill requested", metadata);
    }

    public void started(BackfillRequest request, int totalChunks) {
        Map<String, Object> metadata = baseMetadata(request);
        metadata.put("total_chunks", totalChunks);
        emit(request, STARTED, "STARTED", AuditEvent.Outcome.SUCCESS, "worker", "Backfill started", metadata);
    }

    public void paused(BackfillRequest request, int pausedChunks) {
        Map<String, Object> metadata = baseMetadata(request);
        metadata.put("paused_chunks", pausedChunks);
        emit(request, PAUSED, "PAUSED", AuditEvent.Outcome.SUCCESS, "api", "Backfill paused", metadata);
    }

    public void failed(BackfillRequest request, int failedChunks) {
        Map<String, Object> metadata = baseMetadata(request);
        metadata.put("failed_chunks", failedChunks);
        metadata.put("error_message", request.getErrorMessage());
        emit(request, FAILED, "FAILED", AuditEvent.Outcome.FAILURE, "worker", "Backfill failed", metadata);
    }

    public void completed(BackfillRequest request) {
        Map<String, Object> metadata = baseMetadata(request);
        metadata.put("started_at", request.getStartedAt() == null ? null : request.getStartedAt().toString());
        metadata.put("completed_at", request.getCompletedAt() == null ? null : request.getCompletedAt().toString());
        emit(request, COMPLETED, "COMPLETED", AuditEvent.Outcome.SUCCESS, "worker", "Backfill completed", metadata);
    }

    private void emit(BackfillRequest request, String eventType, String action, AuditEvent.Outcome outcome,
                      String source, String description, Map<String, Object> metadata) {
        try {
            auditEventService.record(AuditEvent.builder()
                    .tenantId(request.getTenantId())
                    .eventType(eventType)
                    .action(action)
                    .resourceType(RESOURCE_TYPE)
                    .resourceId(String.valueOf(request.getId()))
                    .outcome(outcome)
                    .source(source)
                    .description(description)
                    .build(), metadata);
        } catch (RuntimeException e) {
            log.warn("Audit emit failed event={} requestId={}: {}", eventType, request.getId(), e.getMessage());
        }
    }

    private Map<String, Object> baseMetadata(BackfillRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("request_id", request.getId());
        metadata.put("tenant_id", request.getTenantId());
        metadata.put("source_system", request.getSourceSystem() == null ? null : request.getSourceSystem().getValue());
        metadata.put("start_date", String.valueOf(request.getStartDate()));
        metadata.put("end_date", String.valueOf(request.getEndDate()));
        metadata.put("status", String.valueOf(request.getStatus()));
        return metadata;
    }
}
