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
@Schema(description = "Current verification standing of a session")
public class VerificationStatus {

    @Schema(description = "Verification level", example = "ENHANCED")
    private VerificationLevel level;

    @Schema(description = "Composite verification score (0-100)", example = "74.0")
    private double score;

    @Schema(description = "Human confidence (0-1)", example = "0.71")
    private double confidence;

    @Schema(description = "Whether the session reached VERIFIED", example = "false")
    private boolean verified;

    @Schema(description = "Number of anomaly flags raised", example = "1")
    private int flagCount;

    @Schema(description = "Elapsed session time", example = "8400")
    private long sessionTimeMs;

    @Schema(description = "Current classifier output", example = "UNCERTAIN")
    private Classification classification;
}
