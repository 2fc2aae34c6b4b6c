package com.formshield.behavior.engine.gate;

import com.formshield.behavior.config.VerificationConfig;
import org.springframework.stereotype.Component;

/**
 * Composite verification score (0-100) used by the final level step of the gate and the status query.
 *
 * Formula:
 *   confidence * 100
 *   + overallScore * 20
 *   + 10 if enough distinct fields were interacted with
 *   + 5  if the session lasted at least the minimum fill time
 *   - 15 per anomaly flag
 * clamped to [0, 100] and rounded to 2 decimals.
 */
@Component
public class CompositeScoreCalculator {

    static final double CONFIDENCE_WEIGHT = 100.0;
    static final double OVERALL_WEIGHT = 20.0;
    static final double INTERACTION_BONUS = 10.0;
    static final double FILL_TIME_BONUS = 5.0;
    static final double FLAG_PENALTY = 15.0;

    private final VerificationConfig config;

    public CompositeScoreCalculator(VerificationConfig config) {
        this.config = config;
    }

    public double compute(double confidence, double overallScore, int fieldInteractions,
                          long sessionTimeMs, int flagCount) {
        double score = confidence * CONFIDENCE_WEIGHT + overallScore * OVERALL_WEIGHT;
        if (fieldInteractions >= config.getRequiredInteractions()) {
            score += INTERACTION_BONUS;
        }
        if (sessionTimeMs >= config.getMinFillTimeMs()) {
            score += FILL_TIME_BONUS;
        }
        score -= flagCount * FLAG_PENALTY;

        score = Math.max(0.0, Math.min(100.0, score));
        return Math.round(score * 100.0) / 100.0;
    }
}
