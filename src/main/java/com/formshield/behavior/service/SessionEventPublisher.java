package com.formshield.behavior.service;

import com.formshield.behavior.config.MetricsConfig;
import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.Classification;
import com.formshield.behavior.model.FlagType;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.session.SessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Session listener registered on every session: turns session notifications into metrics and log lines.
 */
@Component
public class SessionEventPublisher implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(SessionEventPublisher.class);

    /** Metric tag for flag types outside {@link FlagType}. */
    static final String OTHER_FLAG_TAG = "other";

    private final MetricsConfig metricsConfig;

    public SessionEventPublisher(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    @Override
    public void onClassificationChanged(String sessionId, Classification previous, Classification current) {
        metricsConfig.recordClassificationChange(current.name());
        log.info("Session {} classification {} -> {}", sessionId, previous, current);
    }

    @Override
    public void onFlagRaised(String sessionId, AnomalyFlag flag) {
        metricsConfig.recordFlagRaised(FlagType.fromTag(flag.getType())
                .map(FlagType::getTag)
                .orElse(OTHER_FLAG_TAG));
    }

    @Override
    public void onDecision(String sessionId, VerificationDecision decision) {
        metricsConfig.recordDecision(decision.isAllow(), decision.getReason(), decision.getScore());
        if (decision.isAllow()) {
            log.info("Session {} ALLOWED: reason='{}', level={}, score={}",
                    sessionId, decision.getReason(), decision.getVerificationLevel(), decision.getScore());
        } else {
            log.warn("Session {} BLOCKED: reason='{}', level={}, score={}, recommendations={}",
                    sessionId, decision.getReason(), decision.getVerificationLevel(), decision.getScore(),
                    decision.getRecommendations());
        }
    }
}
