package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.TouchFeatures;
import org.springframework.stereotype.Component;

/**
 * Scores touch gestures. Sessions without touch events stay neutral so desktop users are not penalized.
 * Multi-touch adds 0.2; swipe velocity variance adds up to 0.3.
 */
@Component
public class TouchScorer implements ChannelScorer {

    static final double MULTI_TOUCH_BONUS = 0.2;
    static final double MAX_SWIPE_BONUS = 0.3;

    private final ScoringConfig config;

    public TouchScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public Channel getSupportedChannel() {
        return Channel.TOUCH;
    }

    @Override
    public double score(SessionFeatures features) {
        TouchFeatures touch = features.getTouch();
        if (touch == null || touch.getEventCount() == 0) {
            return BASELINE;
        }

        double score = BASELINE;
        if (touch.isMultiTouch()) {
            score += MULTI_TOUCH_BONUS;
        }
        if (touch.getSwipeCount() > 0) {
            score += Math.min(touch.getSwipeVelocityVariance() / config.getVarianceScales().getTouchSwipeVelocity(),
                    MAX_SWIPE_BONUS);
        }
        return ChannelScorer.clamp(score);
    }
}
