package com.chronofill.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BackfillMetrics {

    private final MeterRegistry meterRegistry;

    private Counter cyclesCounter;
    private Counter cycleErrorsCounter;
    private Counter chunksSucceededCounter;
    private Counter chunksFailedCounter;
    private Counter chunksExhaustedCounter;
    private Counter chunksReclaimedCounter;
    private Counter claimsLostCounter;

    @PostConstruct
    void init() {
        cyclesCounter = Counter.builder("backfill_worker_cycles_total").register(meterRegistry);
        cycleErrorsCounter = Counter.builder("backfill_worker_cycle_errors_total").register(meterRegistry);
        chunksSucceededCounter = Counter.builder("backfill_chunks_succeeded_total").register(meterRegistry);
        chunksFailedCounter = Counter.builder("backfill_chunks_failed_total").register(meterRegistry);
        chunksExhaustedCounter = Counter.builder("backfill_chunks_exhausted_total").register(meterRegistry);
        chunksReclaimedCounter = Counter.builder("backfill_chunks_reclaimed_total").register(meterRegistry);
        claimsLostCounter = Counter.builder("backfill_claims_lost_total").register(meterRegistry);
    }

    public void cycle() {
        increment(cyclesCounter);
    }

    public void cycleError() {
        increment(cycleErrorsCounter);
    }

    public void chunkSucceeded() {
        increment(chunksSucceededCounter);
    }

    public void chunkFailed() {
        increment(chunksFailedCounter);
    }

    public void chunkExhausted() {
        increment(chunksExhaustedCounter);
    }

    public void chunkReclaimed() {
        increment(chunksReclaimedCounter);
    }

    public void claimLost() {
        increment(claimsLostCounter);
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
