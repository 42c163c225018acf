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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BackfillRequestValidatorTest {

    private static final LocalDate TODAY = LocalDate.now(ZoneOffset.UTC);

    private TenantRepository tenantRepository;
    private BackfillRequestRepository requestRepository;
    private BackfillRequestValidator validator;

    @BeforeEach
    void setUp() {
        tenantRepository = mock(TenantRepository.class);
        requestRepository = mock(BackfillRequestRepository.class);
        validator = new BackfillRequestValidator(tenantRepository, requestRepository, new BackfillProperties());
        when(requestRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(requestRepository.findOverlapping(anyString(), any(), any(), any(), any())).thenReturn(List.of());
    }

    @Test
    void replayShortCircuitsEveryOtherCheck() {
        BackfillRequest existing = BackfillRequest.builder()
                .id(41L)
                .status(BackfillRequest.Status.COMPLETED)
                .build();
        LocalDate start = TODAY.minusDays(10);
        String key = IdempotencyKeys.forBackfill("tenant-a", SourceSystem.SHOPIFY, start, TODAY);
        when(requestRepository.findByIdempotencyKey(key)).thenReturn(Optional.of(existing));

        BackfillRequestValidator.ValidationOutcome outcome =
                validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY, start, TODAY);

        assertThat(outcome.isNew()).isFalse();
        assertThat(outcome.existing()).isSameAs(existing);
        assertThat(outcome.idempotencyKey()).isEqualTo(key);
        verifyNoInteractions(tenantRepository);
    }

    @Test
    void unknownTenantIsRejected() {
        when(tenantRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> validator.validateAndPrepare("ghost", SourceSystem.SHOPIFY,
                TODAY.minusDays(5), TODAY.minusDays(1)))
                .isInstanceOf(TenantNotFoundException.class)
                .extracting("errorCode").isEqualTo("TENANT_NOT_FOUND");
    }

    @Test
    void suspendedTenantIsRejected() {
        tenant("tenant-a", Tenant.Status.SUSPENDED, "growth");

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY,
                TODAY.minusDays(5), TODAY.minusDays(1)))
                .isInstanceOf(TenantNotActiveException.class)
                .extracting("errorCode").isEqualTo("TENANT_NOT_ACTIVE");
    }

    @Test
    void endDateInTheFutureIsRejected() {
        tenant("tenant-a", Tenant.Status.ACTIVE, "growth");

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY,
                TODAY.minusDays(5), TODAY.plusDays(1)))
                .isInstanceOf(BackfillValidationException.class)
                .hasMessageContaining("future");
    }

    @Test
    void startAfterEndIsRejected() {
        tenant("tenant-a", Tenant.Status.ACTIVE, "growth");

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY,
                TODAY.minusDays(1), TODAY.minusDays(5)))
                .isInstanceOf(BackfillValidationException.class)
                .extracting("errorCode").isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void rangeLongerThanTierAllowanceIsRejected() {
        tenant("tenant-a", Tenant.Status.ACTIVE, "growth");

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY,
                TODAY.minusDays(90), TODAY))
                .isInstanceOf(DateRangeExceededException.class)
                .extracting("errorCode").isEqualTo("DATE_RANGE_EXCEEDED");
    }

    @Test
    void exactlyNinetyDaysIsAllowedForGrowth() {
        tenant("tenant-a", Tenant.Status.ACTIVE, "growth");

        BackfillRequestValidator.ValidationOutcome outcome = validator.validateAndPrepare("tenant-a",
                SourceSystem.SHOPIFY, TODAY.minusDays(89), TODAY);

        assertThat(outcome.isNew()).isTrue();
    }

    @Test
    void enterpriseTierAllowsAFullYear() {
        tenant("tenant-b", Tenant.Status.ACTIVE, "Enterprise");

        BackfillRequestValidator.ValidationOutcome outcome = validator.validateAndPrepare("tenant-b",
                SourceSystem.GA4, TODAY.minusDays(364), TODAY);

        assertThat(outcome.isNew()).isTrue();
    }

    @Test
    void unknownTierFallsBackToDefaultAllowance() {
        tenant("tenant-c", Tenant.Status.ACTIVE, "platinum");

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-c", SourceSystem.SHOPIFY,
                TODAY.minusDays(120), TODAY))
                .isInstanceOf(DateRangeExceededException.class);
    }

    @Test
    void overlappingActiveRequestIsReported() {
        tenant("tenant-a", Tenant.Status.ACTIVE, "growth");
        BackfillRequest conflict = BackfillRequest.builder()
                .id(12L)
                .status(BackfillRequest.Status.RUNNING)
                .build();
        when(requestRepository.findOverlapping(anyString(), any(), any(), any(), any()))
                .thenReturn(List.of(conflict));

        assertThatThrownBy(() -> validator.validateAndPrepare("tenant-a", SourceSystem.SHOPIFY,
                TODAY.minusDays(10), TODAY.minusDays(1)))
                .isInstanceOfSatisfying(OverlappingBackfillException.class, ex -> {
                    assertThat(ex.getExistingRequestId()).isEqualTo(12L);
                    assertThat(ex.getErrorCode()).isEqualTo("OVERLAPPING_BACKFILL");
                });
    }

    private void tenant(String id, Tenant.Status status, String tier) {
        when(tenantRepository.findById(id)).thenReturn(Optional.of(Tenant.builder()
                .id(id)
                .name(id)
                .status(status)
                .billingTier(tier)
                .createdAt(Instant.now())
                .build()));
    }
}
