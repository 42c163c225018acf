package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import com.chronofill.backend.exception.BackfillValidationException;
import com.chronofill.backend.exception.DateRangeExceededException;
import com.chronofill.backend.exception.OverlappingBackfillException;
import com.chronofill.backend.exception.TenantNotActiveException;
import com.chronofill.backend.exception.TenantNotFoundException;
import com.chronofill.backend.model.BackfillRequest;
import com.chronofill.backend.model.SourceSystem;
import com.chronofill.backend.model.Tenant;
import com.chronofill.backend.repository.BackfillRequestRepository;
import com.chronofill.backend.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Checks a prospective backfill in a fixed order: idempotent replay, tenant, date range, overlap.
 * A replay short-circuits every other check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillRequestValidator {

    private final TenantRepository tenantRepository;
    private final BackfillRequestRepository requestRepository;
    private final BackfillProperties properties;

    @Transactional(readOnly = true)
    public ValidationOutcome validateAndPrepare(String tenantId, SourceSystem source, LocalDate startDate,
                                                LocalDate endDate) {
        String idempotencyKey = IdempotencyKeys.forBackfill(tenantId, source, startDate, endDate);
        Optional<BackfillRequest> existing = requestRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Idempotent backfill replay requestId={} tenantId={}", existing.get().getId(), tenantId);
            return ValidationOutcome.replay(existing.get(), idempotencyKey);
        }

        Tenant tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> new TenantNotFoundException(tenantId));
        if (!tenant.isActive()) {
            throw new TenantNotActiveException(tenantId, tenant.getStatus());
        }

        validateDateRange(tenant, startDate, endDate);

        List<BackfillRequest> overlapping = requestRepository.findOverlapping(tenantId, source, startDate, endDate,
                BackfillRequest.ACTIVE_STATUSES);
        if (!overlapping.isEmpty()) {
            BackfillRequest conflict = overlapping.get(0);
            throw new OverlappingBackfillException(conflict.getId(), conflict.getStatus());
        }

        return ValidationOutcome.accepted(idempotencyKey);
    }

    private void validateDateRange(Tenant tenant, LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            throw new BackfillValidationException("start_date " + startDate + " is after end_date " + endDate);
        }
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        if (endDate.isAfter(today)) {
            throw new BackfillValidationException("end_date " + endDate + " is in the future");
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        int maxDays = properties.maxDaysForTier(tenant.getBillingTier());
        if (days > maxDays) {
            throw new DateRangeExceededException(days, maxDays, tenant.getBillingTier());
        }
    }

    public record ValidationOutcome(BackfillRequest existing, String idempotencyKey) {

        static ValidationOutcome replay(BackfillRequest existing, String idempotencyKey) {
            return new ValidationOutcome(existing, idempotencyKey);
        }

        static ValidationOutcome accepted(String idempotencyKey) {
            return new ValidationOutcome(null, idempotencyKey);
        }

        public boolean isNew() {
            return existing == null;
        }
    }
}
