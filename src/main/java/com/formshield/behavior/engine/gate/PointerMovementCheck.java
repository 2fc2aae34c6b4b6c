package com.formshield.behavior.engine.gate;

import com.formshield.behavior.config.VerificationConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(4)
public class PointerMovementCheck implements SubmissionCheck {

    private final VerificationConfig config;

    public PointerMovementCheck(VerificationConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "pointer-movement";
    }

    @Override
    public CheckResult check(DecisionContext context) {
        if (config.isRequirePointerMovement()
                && context.getPointerMovements() < config.getMinPointerMovements()) {
            return CheckResult.reject(DecisionReasons.INSUFFICIENT_MOUSE_MOVEMENT,
                    DecisionReasons.RECOMMEND_MOUSE_INTERACTION);
        }
        return CheckResult.pass();
    }
}
