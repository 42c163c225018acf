package com.chronofill.backend.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BackfillPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsKillTransformBeforeChunkCountsAsStale() {
        BackfillProperties properties = new BackfillProperties();

        assertThat(properties.getTransform().getTimeoutMinutes())
                .isLessThan(properties.getWorker().getStaleJobTimeoutMinutes());
        assertThat(validator.validate(properties)).isEmpty();
    }

    @Test
    void transformTimeoutAtOrAboveStaleTimeoutIsRejected() {
        BackfillProperties properties = new BackfillProperties();
        properties.getTransform().setTimeoutMinutes(60);
        properties.getWorker().setStaleJobTimeoutMinutes(30);

        Set<ConstraintViolation<BackfillProperties>> violations = validator.validate(properties);

        assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("transformTimeoutBelowStaleTimeout");

        properties.getTransform().setTimeoutMinutes(30);
        assertThat(validator.validate(properties)).hasSize(1);
    }

    @Test
    void jitterFactorOfOneIsRejected() {
        BackfillProperties properties = new BackfillProperties();
        properties.getRetry().setJitterFactor(1.0);

        assertThat(validator.validate(properties)).extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("retry.jitterFactor");
    }

    @Test
    void contextRefusesToStartWhenTransformOutlivesStaleTimeout() {
        contextRunner
                .withPropertyValues("backfill.transform.timeout-minutes=60",
                        "backfill.worker.stale-job-timeout-minutes=30")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void contextStartsWithDefaultTimeouts() {
        contextRunner.run(context -> assertThat(context).hasNotFailed().hasSingleBean(BackfillProperties.class));
    }

    @EnableConfigurationProperties(BackfillProperties.class)
    static class PropertiesConfig {
    }
}
