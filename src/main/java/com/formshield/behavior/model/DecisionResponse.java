package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Final decision plus the data a caller attaches to an accepted submission")
public class DecisionResponse {

    @Schema(description = "Final decision")
    private VerificationDecision decision;

    @Schema(description = "Base64 verification token; present only when the submission is allowed")
    private String token;

    @Schema(description = "Elapsed session time at submission", example = "12450")
    private long sessionTimeMs;

    @Schema(description = "Distinct form fields interacted with", example = "4")
    private int interactionCount;

    @Schema(description = "Human confidence (0-1)", example = "0.92")
    private double humanConfidence;

    @Schema(description = "Verification level", example = "VERIFIED")
    private VerificationLevel verificationLevel;
}
