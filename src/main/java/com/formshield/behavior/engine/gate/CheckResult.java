package com.formshield.behavior.engine.gate;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one admission check. A passing result carries no reason.
 */
@Value
public class CheckResult {

    private static final CheckResult PASSED = new CheckResult(true, null, List.of());

    boolean passed;
    String reason;
    List<String> recommendations;

    public static CheckResult pass() {
        return PASSED;
    }

    public static CheckResult reject(String reason, String... recommendations) {
        return new CheckResult(false, reason, List.of(recommendations));
    }
}
