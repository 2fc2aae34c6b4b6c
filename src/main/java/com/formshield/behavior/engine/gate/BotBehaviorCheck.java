package com.formshield.behavior.engine.gate;

import com.formshield.behavior.model.Classification;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(5)
public class BotBehaviorCheck implements SubmissionCheck {

    @Override
    public String getName() {
        return "bot-behavior";
    }

    @Override
    public CheckResult check(DecisionContext context) {
        if (context.getClassification() == Classification.BOT) {
            return CheckResult.reject(DecisionReasons.BOT_BEHAVIOR, DecisionReasons.RECOMMEND_BLOCK_BEHAVIOR);
        }
        return CheckResult.pass();
    }
}
