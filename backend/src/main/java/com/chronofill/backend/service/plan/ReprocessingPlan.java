package com.chronofill.backend.service.plan;

import com.chronofill.backend.model.SourceSystem;

import java.time.LocalDate;
import java.util.List;

/**
 * Ordered list of models to rebuild for one tenant, source and date range, with a rough cost.
 */
public record ReprocessingPlan(
        String tenantId,
        SourceSystem sourceSystem,
        LocalDate startDate,
        LocalDate endDate,
        List<String> ingestionTables,
        List<String> affectedModels,
        List<Step> steps,
        CostEstimate estimate,
        boolean partial
) {

    public boolean isEmpty() {
        return affectedModels.isEmpty();
    }

    public record Step(int order, ModelLayer layer, String model, Materialization materialization,
                       List<String> dependsOn) {}

    public record CostEstimate(long estimatedRawRows, long estimatedTotalRows, double estimatedSeconds,
                               long dateRangeDays) {}
}
