package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.KeyboardFeatures;
import org.springframework.stereotype.Component;

/**
 * Scores typing rhythm: interval variance adds up to 0.4, the share of natural pauses up to 0.1.
 */
@Component
public class KeyboardScorer implements ChannelScorer {

    static final double MAX_VARIANCE_BONUS = 0.4;
    static final double MAX_PAUSE_BONUS = 0.1;

    private final ScoringConfig config;

    public KeyboardScorer(ScoringConfig config) {
        this.config = config;
    }

    @Override
    public Channel getSupportedChannel() {
        return Channel.KEYBOARD;
    }

    @Override
    public double score(SessionFeatures features) {
        KeyboardFeatures keyboard = features.getKeyboard();
        if (keyboard == null || keyboard.getIntervalCount() == 0) {
            return BASELINE;
        }

        double score = BASELINE;
        score += Math.min(keyboard.getIntervalVariance() / config.getVarianceScales().getKeyboardInterval(),
                MAX_VARIANCE_BONUS);
        double pauseShare = (double) keyboard.getNaturalPauseCount() / keyboard.getIntervalCount();
        score += Math.min(pauseShare, MAX_PAUSE_BONUS);
        return ChannelScorer.clamp(score);
    }
}
