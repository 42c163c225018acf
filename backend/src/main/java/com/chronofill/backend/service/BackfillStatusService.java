package com.chronofill.backend.service;

import com.chronofill.backend.dto.BackfillStatusResponse;
import com.chronofill.backend.dto.ChunkStatusResponse;
import com.chronofill.backend.exception.NotFoundException;
import com.chronofill.backend.model.BackfillJob;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.repository.BackfillJobRepository;
import com.chronofill.backend.repository.BackfillRequestRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only progress view over a request and its chunks. Not scoped by tenant.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BackfillStatusService {

    private final BackfillRequestRepository requestRepository;
    private final BackfillJobRepository jobRepository;

    public BackfillStatusResponse getStatus(Long requestId) {
        BackfillRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Backfill request " + requestId + " not found"));
        return buildStatus(request, jobRepository.findByRequestIdOrderByChunkIndexAsc(requestId));
    }

    public List<BackfillStatusResponse> listStatuses(String tenantId, EffectiveStatus statusFilter) {
        List<BackfillRequest> requests = tenantId == null || tenantId.isBlank()
                ? requestRepository.findAllByOrderByCreatedAtDesc()
                : requestRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        if (requests.isEmpty()) {
            return List.of();
        }
        Map<Long, List<BackfillJob>> jobsByRequest = jobRepository.findByRequestIdInOrderByChunkIndexAsc(
                        requests.stream().map(BackfillRequest::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(BackfillJob::getRequestId));

        List<BackfillStatusResponse> results = new ArrayList<>();
        for (BackfillRequest request : requests) {
            BackfillStatusResponse status = buildStatus(request, jobsByRequest.getOrDefault(request.getId(), List.of()));
            if (statusFilter == null || status.getStatus() == statusFilter) {
                results.add(status);
            }
        }
        return results;
    }

    BackfillStatusResponse buildStatus(BackfillRequest request, List<BackfillJob> jobs) {
        int total = jobs.size();
        int completed = (int) jobs.stream().filter(job -> job.getStatus() == BackfillJob.Status.SUCCESS).count();
        int failed = (int) jobs.stream().filter(BackfillJob::isExhausted).count();
        double percent = total > 0 ? round1(completed * 100.0 / total) : 0.0;

        return BackfillStatusResponse.builder()
                .id(request.getId())
                .tenantId(request.getTenantId())
                .sourceSystem(request.getSourceSystem())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .status(effectiveStatus(request, jobs))
                .rawStatus(request.getStatus())
                .percentComplete(percent)
                .totalChunks(total)
                .completedChunks(completed)
                .failedChunks(failed)
                .currentChunk(jobs.stream()
                        .filter(job -> job.getStatus() == BackfillJob.Status.RUNNING)
                        .findFirst()
                        .map(ChunkStatusResponse::from)
                        .orElse(null))
                .failureReasons(failureReasons(jobs))
                .estimatedSecondsRemaining(estimateRemaining(jobs, total, completed, failed))
                .reason(request.getReason())
                .requestedBy(request.getRequestedBy())
                .errorMessage(request.getErrorMessage())
                .startedAt(request.getStartedAt())
                .completedAt(request.getCompletedAt())
                .createdAt(request.getCreatedAt())
                .build();
    }

    static EffectiveStatus effectiveStatus(BackfillRequest request, List<BackfillJob> jobs) {
        switch (request.getStatus()) {
            case PENDING, APPROVED:
                return EffectiveStatus.PENDING;
            case COMPLETED, CANCELLED:
                return EffectiveStatus.COMPLETED;
            case FAILED, REJECTED:
                return EffectiveStatus.FAILED;
            default:
                break;
        }
        List<BackfillJob> inFlight = jobs.stream().filter(BackfillJob::isInFlight).toList();
        if (!inFlight.isEmpty() && inFlight.stream().allMatch(job -> job.getStatus() == BackfillJob.Status.PAUSED)) {
            return EffectiveStatus.PAUSED;
        }
        if (!jobs.isEmpty() && inFlight.isEmpty() && jobs.stream().anyMatch(BackfillJob::isExhausted)) {
            return EffectiveStatus.FAILED;
        }
        return EffectiveStatus.RUNNING;
    }

    private static List<String> failureReasons(List<BackfillJob> jobs) {
        Set<String> reasons = new LinkedHashSet<>();
        for (BackfillJob job : jobs) {
            if (job.getStatus() == BackfillJob.Status.FAILED && job.getErrorMessage() != null) {
                reasons.add("Chunk " + job.getChunkIndex() + " (" + job.getChunkStartDate() + " - "
                        + job.getChunkEndDate() + "): " + job.getErrorMessage());
            }
        }
        return new ArrayList<>(reasons);
    }

    private static Double estimateRemaining(List<BackfillJob> jobs, int total, int completed, int failed) {
        if (completed == 0) {
            return null;
        }
        OptionalDouble average = jobs.stream()
                .filter(job -> job.getStatus() == BackfillJob.Status.SUCCESS && job.getDurationSeconds() != null
                        && job.getDurationSeconds() > 0)
                .mapToDouble(BackfillJob::getDurationSeconds)
                .average();
        int remaining = total - completed - failed;
        if (average.isEmpty() || remaining <= 0) {
            return null;
        }
        return round1(average.getAsDouble() * remaining);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
