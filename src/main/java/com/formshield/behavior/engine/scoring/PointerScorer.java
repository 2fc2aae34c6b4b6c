package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.PointerFeatures;
import org.springframework.stereotype.Component;

/**
 * Scores pointer movement.
 *
 * Logic: below the minimum sample size the channel returns 0.1 (a form filled without any pointer
 * motion is itself a strong automation signal). Otherwise, from the 0.5 baseline:
 *   - a path straighter than the suspicious linearity threshold loses 0.4 and earns nothing for speed
 *     variation, since a scripted straight line with jittered timing is still scripted;
 *   - otherwise velocity variance adds up to 0.3 and acceleration variance up to 0.2.
 */
@Component
public class PointerScorer implements ChannelScorer {

    static final double NO_MOVEMENT_SCORE = 0.1;
    static final double LINEARITY_PENALTY = 0.4;
    static final double MAX_VELOCITY_BONUS = 0.3;
    static final double MAX_ACCELERATION_BONUS = 0.2;

    private final ScoringConfig config;

    public PointerScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public Channel getSupportedChannel() {
        return Channel.POINTER;
    }

    @Override
    public double score(SessionFeatures features) {
        PointerFeatures pointer = features.getPointer();
        if (pointer == null || !pointer.isSufficient()) {
            return NO_MOVEMENT_SCORE;
        }

        double score = BASELINE;

        if (pointer.getLinearity() > config.getThresholds().getSuspiciousLinearity()) {
            return ChannelScorer.clamp(score - LINEARITY_PENALTY);
        }

        ScoringConfig.VarianceScales scales = config.getVarianceScales();
        score += Math.min(pointer.getVelocityVariance() / scales.getPointerVelocity(), MAX_VELOCITY_BONUS);
        score += Math.min(pointer.getAccelerationVariance() / scales.getPointerAcceleration(), MAX_ACCELERATION_BONUS);

        return ChannelScorer.clamp(score);
    }
}
