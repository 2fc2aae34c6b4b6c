package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.ClickFeatures;
import org.springframework.stereotype.Component;

/**
 * Scores click cadence. Irregular intervals add up to 0.4; when more than 80% of intervals sit
 * within the tolerance of the mean the cadence is mechanical and loses 0.3.
 */
@Component
public class ClickScorer implements ChannelScorer {

    static final double MAX_VARIANCE_BONUS = 0.4;
    static final double CONSISTENCY_PENALTY = 0.3;
    static final double CONSISTENCY_LIMIT = 0.8;

    private final ScoringConfig config;

    public ClickScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public Channel getSupportedChannel() {
        return Channel.CLICK;
    }

    @Override
    public double score(SessionFeatures features) {
        ClickFeatures click = features.getClick();
        if (click == null || click.getIntervalCount() == 0) {
            return BASELINE;
        }

        double score = BASELINE;
        score += Math.min(click.getIntervalVariance() / config.getVarianceScales().getClickInterval(),
                MAX_VARIANCE_BONUS);
        if (click.getConsistencyRatio() > CONSISTENCY_LIMIT) {
            score -= CONSISTENCY_PENALTY;
        }
        return ChannelScorer.clamp(score);
    }
}
