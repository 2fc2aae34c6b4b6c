package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of the final admission checks for a form submission")
public class VerificationDecision {

    @Schema(description = "Whether the submission should be accepted", example = "true")
    private boolean allow;

    @Schema(description = "Reason for the outcome", example = "human verified")
    private String reason;

    @Schema(description = "Human confidence (0-1) at decision time", example = "0.92")
    private double confidence;

    @Schema(description = "Composite verification score (0-100)", example = "87.5")
    private double score;

    @Schema(description = "Remediation hints for the caller, in priority order", example = "[\"show CAPTCHA\"]")
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Schema(description = "Verification level at decision time", example = "VERIFIED")
    private VerificationLevel verificationLevel;

    @Schema(description = "Classifier output at decision time", example = "HUMAN")
    private Classification classification;

    @Schema(description = "Decision timestamp in epoch milliseconds", example = "1739886764000")
    private long decidedAt;
}
