package com.formshield.behavior.engine.gate;

import com.formshield.behavior.config.VerificationConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rejects forms submitted too soon after the first interaction.
 */
@Component
@Order(3)
public class FillTimeCheck implements SubmissionCheck {

    private final VerificationConfig config;

    public FillTimeCheck(VerificationConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "fill-time";
    }

    @Override
    public CheckResult check(DecisionContext context) {
        if (context.getTimeToSubmitMs() < config.getMinFillTimeMs()) {
            return CheckResult.reject(DecisionReasons.FILLED_TOO_QUICKLY,
                    DecisionReasons.RECOMMEND_CAPTCHA_OR_VERIFICATION);
        }
        return CheckResult.pass();
    }
}
