package com.chronofill.backend.dto;

import com.chronofill.backend.service.plan.ReprocessingPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReprocessingPlanResponse {
    private String tenantId;
    private String sourceSystem;
    private LocalDate startDate;
    private LocalDate endDate;
    private List<String> ingestionTables;
    private List<String> affectedModels;
    private List<Step> steps;
    private long estimatedRawRows;
    private long estimatedTotalRows;
    private double estimatedSeconds;
    private long dateRangeDays;
    private boolean partial;

    public record Step(int order, String layer, String model, String materialization, List<String> dependsOn) {}

    public static ReprocessingPlanResponse from(ReprocessingPlan plan) {
        return ReprocessingPlanResponse.builder()
                .tenantId(plan.tenantId())
                .sourceSystem(plan.sourceSystem().getValue())
                .startDate(plan.startDate())
                .endDate(plan.endDate())
                .ingestionTables(plan.ingestionTables())
                .affectedModels(plan.affectedModels())
                .steps(plan.steps().stream()
                        .map(step -> new Step(step.order(), step.layer().name().toLowerCase(Locale.ROOT), step.model(),
                                step.materialization().name().toLowerCase(Locale.ROOT), step.dependsOn()))
                        .toList())
                .estimatedRawRows(plan.estimate().estimatedRawRows())
                .estimatedTotalRows(plan.estimate().estimatedTotalRows())
                .estimatedSeconds(plan.estimate().estimatedSeconds())
                .dateRangeDays(plan.estimate().dateRangeDays())
                .partial(plan.partial())
                .build();
    }
}
