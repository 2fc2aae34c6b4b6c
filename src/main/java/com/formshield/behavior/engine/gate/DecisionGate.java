package com.formshield.behavior.engine.gate;

import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.model.VerificationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Final admission decision for a form submission.
 *
 * Runs the ordered {@link SubmissionCheck}s and stops at the first rejection. When all pass,
 * the verification level decides: VERIFIED is accepted, ENHANCED is accepted only with a
 * composite score at or above the configured minimum, anything lower is rejected.
 */
@Component
public class DecisionGate {

    private static final Logger log = LoggerFactory.getLogger(DecisionGate.class);

    private final List<SubmissionCheck> checks;
    private final VerificationConfig config;

    public DecisionGate(List<SubmissionCheck> checks, VerificationConfig config) {
        this.checks = new ArrayList<>(checks);
        this.config = config;
    }

    public VerificationDecision decide(DecisionContext context, long decidedAt) {
        for (SubmissionCheck check : checks) {
            CheckResult result = check.check(context);
            if (!result.isPassed()) {
                log.debug("Submission check '{}' rejected: {}", check.getName(), result.getReason());
                return decision(context, decidedAt, false, result.getReason(), result.getRecommendations());
            }
        }

        VerificationLevel level = context.getVerificationLevel();
        if (level == VerificationLevel.VERIFIED) {
            return decision(context, decidedAt, true, DecisionReasons.HUMAN_VERIFIED, List.of());
        }
        if (level == VerificationLevel.ENHANCED) {
            if (context.getCompositeScore() >= config.getEnhancedMinScore()) {
                return decision(context, decidedAt, true, DecisionReasons.ENHANCED_PASSED, List.of());
            }
            return decision(context, decidedAt, false, DecisionReasons.ENHANCED_INSUFFICIENT,
                    List.of(DecisionReasons.RECOMMEND_CAPTCHA));
        }
        return decision(context, decidedAt, false, DecisionReasons.LEVEL_INSUFFICIENT,
                List.of(DecisionReasons.RECOMMEND_CAPTCHA_OR_CHALLENGES));
    }

    private static VerificationDecision decision(DecisionContext context, long decidedAt, boolean allow,
                                                 String reason, List<String> recommendations) {
        return VerificationDecision.builder()
                .allow(allow)
                .reason(reason)
                .confidence(context.getConfidence())
                .score(context.getCompositeScore())
                .recommendations(new ArrayList<>(recommendations))
                .verificationLevel(context.getVerificationLevel())
                .classification(context.getClassification())
                .decidedAt(decidedAt)
                .build();
    }
}
