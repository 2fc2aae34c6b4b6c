package com.formshield.behavior.engine;

import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.model.VerificationLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationLevelEvaluatorTest {

    private VerificationLevelEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new VerificationLevelEvaluator(new VerificationConfig());
    }

    @Test
    void ruleTable() {
        assertThat(evaluator.derive(0.8, 0, 10_000)).isEqualTo(VerificationLevel.VERIFIED);
        assertThat(evaluator.derive(0.8, 1, 10_000)).isEqualTo(VerificationLevel.ENHANCED);
        assertThat(evaluator.derive(0.6, 1, 10_000)).isEqualTo(VerificationLevel.ENHANCED);
        assertThat(evaluator.derive(0.6, 2, 10_000)).isEqualTo(VerificationLevel.BASIC);
        assertThat(evaluator.derive(0.4, 5, 10_000)).isEqualTo(VerificationLevel.BASIC);
        assertThat(evaluator.derive(0.39, 0, 10_000)).isEqualTo(VerificationLevel.NONE);
    }

    @Test
    void neverVerifiedBeforeMinimumTrackingTime() {
        assertThat(evaluator.derive(1.0, 0, 9_999)).isEqualTo(VerificationLevel.ENHANCED);
    }

    @Test
    void reachedLevelIsNotDowngraded() {
        VerificationLevel level = evaluator.evaluate(VerificationLevel.NONE, 0.9, 0, 12_000);
        assertThat(level).isEqualTo(VerificationLevel.VERIFIED);

        level = evaluator.evaluate(level, 0.1, 4, 13_000);
        assertThat(level).isEqualTo(VerificationLevel.VERIFIED);
    }

    @Test
    void penaltyCanStillBlockAdvancement() {
        VerificationLevel level = evaluator.evaluate(VerificationLevel.BASIC, 0.9, 1, 12_000);

        assertThat(level).isEqualTo(VerificationLevel.ENHANCED);
    }
}
