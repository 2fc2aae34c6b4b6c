package com.formshield.behavior.session;

import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.Classification;
import com.formshield.behavior.model.VerificationDecision;

/**
 * Notification hooks for a tracking session. All methods default to no-ops.
 * Listeners are called on the thread that mutated the session, while it holds the session lock,
 * so they must return quickly. An exception from a listener is logged and otherwise ignored.
 */
public interface SessionListener {

    /**
     * Fired after each re-evaluation that recomputed the overall score.
     */
    default void onScoreUpdated(String sessionId, double overallScore, Classification classification) {
    }

    /**
     * Fired once when the classification enters BOT or HUMAN, not on every tick it stays there.
     */
    default void onClassificationChanged(String sessionId, Classification previous, Classification current) {
    }

    default void onFlagRaised(String sessionId, AnomalyFlag flag) {
    }

    default void onDecision(String sessionId, VerificationDecision decision) {
    }
}
