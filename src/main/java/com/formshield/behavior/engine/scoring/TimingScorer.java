package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.TimingFeatures;
import org.springframework.stereotype.Component;

/**
 * Scores the delay before the first interaction.
 *
 * Under 100ms is faster than a person can orient on a page (-0.3); between 500ms and 10s is the
 * natural range (+0.3). Variance across the first-occurrence delays of different interaction kinds
 * adds up to 0.2.
 */
@Component
public class TimingScorer implements ChannelScorer {

    static final long TOO_FAST_MS = 100;
    static final long NATURAL_MIN_MS = 500;
    static final long NATURAL_MAX_MS = 10_000;
    static final double TOO_FAST_PENALTY = 0.3;
    static final double NATURAL_DELAY_BONUS = 0.3;
    static final double MAX_VARIANCE_BONUS = 0.2;

    private final ScoringConfig config;

    public TimingScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public Channel getSupportedChannel() {
        return Channel.TIMING;
    }

    @Override
    public double score(SessionFeatures features) {
        TimingFeatures timing = features.getTiming();
        double score = BASELINE;
        if (timing == null) {
            return score;
        }

        Long delay = timing.getFirstInteractionDelayMs();
        if (delay != null) {
            if (delay < TOO_FAST_MS) {
                score -= TOO_FAST_PENALTY;
            } else if (delay > NATURAL_MIN_MS && delay < NATURAL_MAX_MS) {
                score += NATURAL_DELAY_BONUS;
            }
        }

        if (timing.getDelayCount() > 1) {
            score += Math.min(timing.getDelayVariance() / config.getVarianceScales().getTimingDelay(),
                    MAX_VARIANCE_BONUS);
        }
        return ChannelScorer.clamp(score);
    }
}
