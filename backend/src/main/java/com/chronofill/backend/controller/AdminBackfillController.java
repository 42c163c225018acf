package com.chronofill.backend.controller;

import com.chronofill.backend.config.RequestCorrelationFilter;
import com.chronofill.backend.dto.BackfillActionResponse;
import com.chronofill.backend.dto.BackfillRequestCreatedResponse;
import com.chronofill.backend.dto.BackfillRequestResponse;
import com.chronofill.backend.dto.BackfillStatusResponse;
import com.chronofill.backend.dto.CreateBackfillRequest;
import com.chronofill.backend.dto.ReprocessingPlanResponse;
import com.chronofill.backend.dto.ReviewRequest;
import com.chronofill.backend.exception.BadRequestException;
import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.service.BackfillRequestService;
import com.chronofill.backend.service.BackfillStatusService;
import com.chronofill.backend.service.EffectiveStatus;
import com.chronofill.backend.service.plan.ReprocessingPlanner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/admin/backfills")
@RequiredArgsConstructor
@Tag(name = "Admin Backfills")
public class AdminBackfillController {

    static final String UNKNOWN_OPERATOR = "unknown-operator";

    private final BackfillRequestService requestService;
    private final BackfillStatusService statusService;
    private final ReprocessingPlanner reprocessingPlanner;

    @PostMapping
    @Operation(summary = "Request a historical backfill")
    public ResponseEntity<BackfillRequestCreatedResponse> create(
            @Valid @RequestBody CreateBackfillRequest body,
            @RequestHeader(value = RequestCorrelationFilter.OPERATOR_ID_HEADER, required = false) String operatorId) {
        BackfillRequestService.CreateResult result = requestService.create(body, operator(operatorId));
        BackfillRequestResponse response = BackfillRequestResponse.from(result.request());
        if (result.created()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new BackfillRequestCreatedResponse(response, true, "Backfill request created"));
        }
        return ResponseEntity.ok(new BackfillRequestCreatedResponse(response, false,
                "Identical backfill request already exists"));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get backfill progress")
    public BackfillStatusResponse get(@PathVariable Long id) {
        return statusService.getStatus(id);
    }

    @GetMapping
    @Operation(summary = "List backfills, newest first")
    public List<BackfillStatusResponse> list(@RequestParam(required = false) String tenantId,
                                             @RequestParam(required = false) EffectiveStatus status) {
        return statusService.listStatuses(tenantId, status);
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve a pending backfill")
    public BackfillRequestResponse approve(@PathVariable Long id,
                                           @RequestHeader(value = RequestCorrelationFilter.OPERATOR_ID_HEADER,
                                                   required = false) String operatorId) {
        return BackfillRequestResponse.from(requestService.approve(id, operator(operatorId)));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject a pending backfill")
    public BackfillRequestResponse reject(@PathVariable Long id,
                                          @Valid @RequestBody(required = false) ReviewRequest review,
                                          @RequestHeader(value = RequestCorrelationFilter.OPERATOR_ID_HEADER,
                                                  required = false) String operatorId) {
        String note = review != null ? review.note() : null;
        return BackfillRequestResponse.from(requestService.reject(id, operator(operatorId), note));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause queued chunks")
    public BackfillActionResponse pause(@PathVariable Long id) {
        BackfillRequestService.ActionResult result = requestService.pause(id);
        return toAction("pause", result, result.affectedChunks() + " chunk(s) paused");
    }

    @PostMapping("/{id}/resume")
    @Operation(summary = "Resume paused chunks")
    public BackfillActionResponse resume(@PathVariable Long id) {
        BackfillRequestService.ActionResult result = requestService.resume(id);
        return toAction("resume", result, result.affectedChunks() + " chunk(s) resumed");
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a backfill")
    public BackfillActionResponse cancel(@PathVariable Long id) {
        BackfillRequestService.ActionResult result = requestService.cancel(id);
        return toAction("cancel", result, result.affectedChunks() + " chunk(s) cancelled");
    }

    @PostMapping("/{id}/retry-failed")
    @Operation(summary = "Requeue chunks that exhausted their retries")
    public BackfillActionResponse retryFailed(@PathVariable Long id) {
        BackfillRequestService.ActionResult result = requestService.retryFailed(id);
        return toAction("retry-failed", result, result.affectedChunks() + " chunk(s) requeued");
    }

    @GetMapping("/plan")
    @Operation(summary = "Preview the models a backfill would rebuild")
    public ReprocessingPlanResponse plan(@RequestParam SourceSystem sourceSystem,
                                         @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                         @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                                         @RequestParam(required = false) String tenantId) {
        if (startDate.isAfter(endDate)) {
            throw new BadRequestException("startDate must not be after endDate");
        }
        return ReprocessingPlanResponse.from(reprocessingPlanner.plan(tenantId, sourceSystem, startDate, endDate));
    }

    private BackfillActionResponse toAction(String action, BackfillRequestService.ActionResult result,
                                            String message) {
        log.info("Operator action {} on backfill request {}: {}", action, result.request().getId(), message);
        return new BackfillActionResponse(result.request().getId(), action, result.request().getStatus(),
                result.affectedChunks(), message);
    }

    private static String operator(String operatorId) {
        return operatorId == null || operatorId.isBlank() ? UNKNOWN_OPERATOR : operatorId.trim();
    }
}
