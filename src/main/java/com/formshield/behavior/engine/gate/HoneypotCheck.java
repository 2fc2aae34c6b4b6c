package com.formshield.behavior.engine.gate;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class HoneypotCheck implements SubmissionCheck {

    @Override
    public String getName() {
        return "honeypot";
    }

    @Override
    public CheckResult check(DecisionContext context) {
        String value = context.getHoneypotValue();
        if (value != null && !value.isEmpty()) {
            return CheckResult.reject(DecisionReasons.HONEYPOT_FILLED, DecisionReasons.RECOMMEND_BLOCK_AUTOMATED);
        }
        return CheckResult.pass();
    }
}
