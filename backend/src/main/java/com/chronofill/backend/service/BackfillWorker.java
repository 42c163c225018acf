package com.chronofill.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "backfill.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackfillWorker implements ApplicationListener<ContextClosedEvent> {

    private final BackfillExecutor executor;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(initialDelayString = "${backfill.worker.poll-interval-seconds:30}000",
            fixedDelayString = "${backfill.worker.poll-interval-seconds:30}000")
    public void poll() {
        if (executor.isStopping()) {
            return;
        }
        scheduledTaskGuard.run("backfillCycle", executor::runCycle);
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        executor.requestStop();
    }
}
