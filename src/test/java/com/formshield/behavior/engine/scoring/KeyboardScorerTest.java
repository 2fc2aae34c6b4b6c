package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.KeyboardFeatures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeyboardScorerTest {

    private final KeyboardScorer scorer = new KeyboardScorer(new ScoringConfig());

    private double score(KeyboardFeatures keyboard) {
        return scorer.score(SessionFeatures.builder().keyboard(keyboard).build());
    }

    @Test
    void noIntervals_isNeutral() {
        assertThat(score(KeyboardFeatures.builder().build())).isEqualTo(0.5);
    }

    @Test
    void varianceAndPauses_areRewarded() {
        KeyboardFeatures keyboard = KeyboardFeatures.builder()
                .intervalCount(20).intervalVariance(2_000).naturalPauseCount(1).build();

        // 0.5 + 2000/10000 + 1/20
        assertThat(score(keyboard)).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void bonusesAreCapped() {
        KeyboardFeatures keyboard = KeyboardFeatures.builder()
                .intervalCount(10).intervalVariance(1_000_000).naturalPauseCount(10).build();

        assertThat(score(keyboard)).isCloseTo(1.0, within(1e-9));
    }
}
