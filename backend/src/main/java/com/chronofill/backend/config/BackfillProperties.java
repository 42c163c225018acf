package com.chronofill.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "backfill")
@Data
@Validated
public class BackfillProperties {

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Chunking chunking = new Chunking();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Requests requests = new Requests();

    @Valid
    private Transform transform = new Transform();

    /**
     * Maximum backfill length in days, keyed by lower-case billing tier.
     */
    @NotNull
    private Map<String, Integer> tierMaxDays = defaultTierLimits();

    @Positive
    private int defaultMaxDays = 90;

    public int maxDaysForTier(String billingTier) {
        if (billingTier == null) {
            return defaultMaxDays;
        }
        return tierMaxDays.getOrDefault(billingTier.trim().toLowerCase(Locale.ROOT), defaultMaxDays);
    }

    /**
     * A transform must hit its own timeout and be killed before its chunk can be reclaimed as stale.
     */
    @AssertTrue(message = "backfill.transform.timeout-minutes must be lower than backfill.worker.stale-job-timeout-minutes")
    public boolean isTransformTimeoutBelowStaleTimeout() {
        return transform.getTimeoutMinutes() < worker.getStaleJobTimeoutMinutes();
    }

    private static Map<String, Integer> defaultTierLimits() {
        Map<String, Integer> limits = new HashMap<>();
        limits.put("free", 90);
        limits.put("growth", 90);
        limits.put("enterprise", 365);
        return limits;
    }

    @Data
    public static class Worker {
        private boolean enabled = true;

        @Min(1)
        private int pollIntervalSeconds = 30;

        @Min(1)
        private int maxJobsPerCycle = 5;

        @Min(1)
        private int staleJobTimeoutMinutes = 30;

        public Duration staleJobTimeout() {
            return Duration.ofMinutes(staleJobTimeoutMinutes);
        }
    }

    @Data
    public static class Chunking {
        @Min(1)
        private int chunkSizeDays = 7;
    }

    @Data
    public static class Retry {
        @Min(0)
        private int maxRetries = 3;

        @Positive
        private double baseDelaySeconds = 60;

        @Positive
        private double maxDelaySeconds = 3600;

        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double jitterFactor = 0.25;

        @Positive
        private double minDelaySeconds = 1;
    }

    @Data
    public static class Requests {
        private boolean autoApprove = false;

        @NotBlank
        private String autoApproveIdentity = "system:auto-approve";
    }

    @Data
    public static class Transform {
        /**
         * Command prefix used to launch the transformation program, e.g. {@code dbt run}.
         */
        @NotNull
        private List<String> command = new ArrayList<>(List.of("dbt", "run"));

        private String workingDirectory;

        @Min(1)
        private int timeoutMinutes = 25;

        @Min(100)
        private int maxErrorLength = 1000;
    }
}
