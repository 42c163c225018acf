package com.chronofill.backend.service;

import com.chronofill.backend.model.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Wraps periodic work so a failing cycle is logged, counted and audited instead of killing the schedule.
 * A task that is still running when its next trigger fires is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;
    private final BackfillMetrics metrics;
    private final Set<String> activeTasks = ConcurrentHashMap.newKeySet();

    /**
     * @return {@code true} when the task ran to completion
     */
    public boolean run(String taskName, Runnable task) {
        if (!activeTasks.add(taskName)) {
            log.warn("Skipping task={} because the previous run has not finished", taskName);
            return false;
        }
        long started = System.nanoTime();
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            log.error("Task aborted task={} after {} ms", taskName, elapsedMs, e);
            metrics.cycleError();
            recordFailure(taskName, e, elapsedMs);
            return false;
        } finally {
            activeTasks.remove(taskName);
        }
    }

    private void recordFailure(String taskName, RuntimeException e, long elapsedMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("task", taskName);
        metadata.put("error_type", e.getClass().getSimpleName());
        metadata.put("error", e.getMessage());
        metadata.put("elapsed_ms", elapsedMs);
        auditEventService.record(AuditEvent.builder()
                .eventType("scheduler")
                .action("TASK_FAILED")
                .resourceType("scheduled_task")
                .resourceId(taskName)
                .outcome(AuditEvent.Outcome.FAILURE)
                .source("worker")
                .description("Scheduled task aborted: " + taskName)
                .build(), metadata);
    }
}
