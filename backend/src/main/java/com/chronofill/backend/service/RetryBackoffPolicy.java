package com.chronofill.backend.service;

import com.chronofill.backend.config.BackfillProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff with symmetric jitter: {@code base * 2^attempt +/- jitter}, capped at the configured maximum
 * and never below the configured minimum.
 */
@Component
public class RetryBackoffPolicy {

    private static final double MULTIPLIER = 2.0;

    private final IntervalFunction intervalFunction;
    private final BackfillProperties.Retry retry;

    public RetryBackoffPolicy(BackfillProperties properties) {
        this.retry = properties.getRetry();
        this.intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                toDuration(retry.getBaseDelaySeconds()),
                MULTIPLIER,
                retry.getJitterFactor(),
                toDuration(retry.getMaxDelaySeconds())
        );
    }

    /**
     * @param attempt attempts already made on the chunk, zero-based
     */
    public double delaySeconds(int attempt) {
        // the interval function counts attempts from 1 and returns the base delay for the first
        long delayMillis = intervalFunction.apply(Math.max(attempt, 0) + 1);
        double delay = delayMillis / 1000.0;
        return Math.max(Math.min(delay, retry.getMaxDelaySeconds()), retry.getMinDelaySeconds());
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
