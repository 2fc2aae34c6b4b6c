package com.formshield.behavior.engine;

import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.model.VerificationLevel;
import org.springframework.stereotype.Component;

/**
 * Maps confidence, flag count and elapsed session time to a verification level:
 *
 *   VERIFIED  confidence >= 0.8, no flags, session time >= minimum tracking time
 *   ENHANCED  confidence >= 0.6, at most one flag
 *   BASIC     confidence >= 0.4
 *   NONE      otherwise
 *
 * Levels are never lowered here; only a session reset clears them.
 */
@Component
public class VerificationLevelEvaluator {

    static final double VERIFIED_CONFIDENCE = 0.8;
    static final double ENHANCED_CONFIDENCE = 0.6;
    static final double BASIC_CONFIDENCE = 0.4;
    static final int ENHANCED_MAX_FLAGS = 1;

    private final VerificationConfig config;

    public VerificationLevelEvaluator(VerificationConfig config) {
        this.config = config;
    }

    public VerificationLevel derive(double confidence, int flagCount, long sessionTimeMs) {
        if (confidence >= VERIFIED_CONFIDENCE && flagCount == 0
                && sessionTimeMs >= config.getMinTrackingTimeMs()) {
            return VerificationLevel.VERIFIED;
        }
        if (confidence >= ENHANCED_CONFIDENCE && flagCount <= ENHANCED_MAX_FLAGS) {
            return VerificationLevel.ENHANCED;
        }
        if (confidence >= BASIC_CONFIDENCE) {
            return VerificationLevel.BASIC;
        }
        return VerificationLevel.NONE;
    }

    /**
     * @return the higher of the current level and the level the inputs now justify
     */
    public VerificationLevel evaluate(VerificationLevel current, double confidence, int flagCount,
                                      long sessionTimeMs) {
        VerificationLevel derived = derive(confidence, flagCount, sessionTimeMs);
        return current == null ? derived : VerificationLevel.higherOf(current, derived);
    }
}
