package com.formshield.behavior.engine.gate;

/**
 * One ordered admission check run at submission time. Checks are ordered with
 * {@link org.springframework.core.annotation.Order}; the gate stops at the first rejection.
 */
public interface SubmissionCheck {

    /**
     * Short identifier used in logs.
     */
    String getName();

    CheckResult check(DecisionContext context);
}
