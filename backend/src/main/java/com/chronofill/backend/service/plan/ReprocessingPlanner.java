package com.chronofill.backend.service.plan;

import com.chronofill.backend.model.SourceSystem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Resolves which transformation models must be rebuilt when one source system is reprocessed,
 * walking the dependency graph forward from the source's staging models.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReprocessingPlanner {

    private final ModelRegistry registry;

    public ReprocessingPlan plan(String tenantId, SourceSystem source, LocalDate startDate, LocalDate endDate) {
        List<String> seeds = registry.stagingModelsFor(source);
        if (seeds.isEmpty()) {
            log.warn("No staging models mapped for source={} tenantId={}", source.getValue(), tenantId);
        }

        List<TransformModel> affected = executionOrder(resolveDownstream(seeds));

        List<ReprocessingPlan.Step> steps = new ArrayList<>();
        int order = 1;
        for (TransformModel model : affected) {
            steps.add(new ReprocessingPlan.Step(order++, model.layer(), model.name(), model.materialization(),
                    model.dependsOn()));
        }

        ReprocessingPlan.CostEstimate estimate = estimate(source, startDate, endDate, affected);
        ReprocessingPlan plan = new ReprocessingPlan(
                tenantId,
                source,
                startDate,
                endDate,
                registry.ingestionTablesFor(source),
                affected.stream().map(TransformModel::name).toList(),
                steps,
                estimate,
                affected.size() < registry.size());
        log.debug("Reprocessing plan tenantId={} source={} models={} estimatedSeconds={}",
                tenantId, source.getValue(), affected.size(), estimate.estimatedSeconds());
        return plan;
    }

    private Set<String> resolveDownstream(List<String> seeds) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (visited.contains(current) || registry.find(current).isEmpty()) {
                continue;
            }
            visited.add(current);
            for (String dependent : registry.dependentsOf(current)) {
                if (!visited.contains(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Topological order over the affected models. Among models whose dependencies are all placed,
     * the lowest layer goes first, then the name.
     */
    private List<TransformModel> executionOrder(Set<String> names) {
        Map<String, Integer> pending = new HashMap<>();
        PriorityQueue<TransformModel> ready = new PriorityQueue<>(
                Comparator.comparing(TransformModel::layer).thenComparing(TransformModel::name));
        for (String name : names) {
            TransformModel model = registry.find(name).orElseThrow();
            int unmet = (int) model.dependsOn().stream().filter(names::contains).count();
            pending.put(name, unmet);
            if (unmet == 0) {
                ready.add(model);
            }
        }
        List<TransformModel> ordered = new ArrayList<>(names.size());
        while (!ready.isEmpty()) {
            TransformModel next = ready.poll();
            ordered.add(next);
            for (String dependent : registry.dependentsOf(next.name())) {
                Integer unmet = pending.get(dependent);
                if (unmet == null) {
                    continue;
                }
                pending.put(dependent, unmet - 1);
                if (unmet == 1) {
                    ready.add(registry.find(dependent).orElseThrow());
                }
            }
        }
        if (ordered.size() != names.size()) {
            throw new IllegalStateException("Dependency cycle among models " + names);
        }
        return ordered;
    }

    private ReprocessingPlan.CostEstimate estimate(SourceSystem source, LocalDate startDate, LocalDate endDate,
                                                   List<TransformModel> affected) {
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        long rawRows = days * registry.rowsPerDay(source);
        long totalRows = rawRows;
        double seconds = 0.0;
        for (TransformModel model : affected) {
            seconds += (rawRows / 1000.0) * model.materialization().getSecondsPerThousandRows();
            if (model.materialization().movesData()) {
                totalRows += rawRows;
            }
        }
        return new ReprocessingPlan.CostEstimate(rawRows, totalRows, Math.round(seconds * 10.0) / 10.0, days);
    }
}
