package com.formshield.behavior.engine.scoring;

import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.model.Channel;

/**
 * Interface for all channel scorers.
 * Each implementation maps one channel's features to a score in [0, 1]:
 * 0 = bot-like, 1 = human-like, 0.5 = no evidence either way.
 * Implementations are stateless.
 */
public interface ChannelScorer {

    double BASELINE = 0.5;

    /**
     * The channel this scorer handles.
     */
    Channel getSupportedChannel();

    /**
     * @param features features of all channels at one instant; a scorer reads only its own
     * @return score clamped to [0, 1]
     */
    double score(SessionFeatures features);

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
