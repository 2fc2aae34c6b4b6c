package com.formshield.behavior.engine.gate;

import com.formshield.behavior.config.VerificationConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class TrackingTimeCheck implements SubmissionCheck {

    private final VerificationConfig config;

    public TrackingTimeCheck(VerificationConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "tracking-time";
    }

    @Override
    public CheckResult check(DecisionContext context) {
        if (context.getSessionTimeMs() < config.getMinTrackingTimeMs()) {
            return CheckResult.reject(DecisionReasons.INSUFFICIENT_TRACKING_TIME,
                    DecisionReasons.RECOMMEND_LONGER_INTERACTION);
        }
        return CheckResult.pass();
    }
}
