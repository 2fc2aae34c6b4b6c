package com.formshield.behavior.engine.gate;

import com.formshield.behavior.model.Classification;
import com.formshield.behavior.model.VerificationLevel;
import lombok.Builder;
import lombok.Data;

/**
 * Everything the admission checks read, captured from one session at submission time.
 */
@Data
@Builder
public class DecisionContext {
    private String honeypotValue;
    private long sessionTimeMs;
    private long timeToSubmitMs;
    private long pointerMovements;
    private Classification classification;
    private VerificationLevel verificationLevel;
    private double confidence;
    private double overallScore;
    private double compositeScore;
    private int flagCount;
}
