package com.chronofill.backend.dto;

import com.chronofill.backend.model.SourceSystem;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateBackfillRequest(
        @NotBlank @Size(max = 64) String tenantId,
        @NotNull SourceSystem sourceSystem,
        @NotNull LocalDate startDate,
        @NotNull LocalDate endDate,
        @NotBlank
        @Size(max = 1000)
        // at least 10 characters from the first to the last non-blank one
        @Pattern(regexp = "^\\s*\\S[\\s\\S]{8,}\\S\\s*$",
                message = "must be at least 10 characters excluding surrounding whitespace")
        String reason
) {}
