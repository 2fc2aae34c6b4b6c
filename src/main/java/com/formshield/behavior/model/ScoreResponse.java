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
@Schema(description = "Current fused score and classification of a session")
public class ScoreResponse {

    @Schema(description = "Session identifier", example = "5f0c2a5e-7f7b-4d0e-a0c4-3b1c9b7d2e11")
    private String sessionId;

    @Schema(description = "Fused overall score (0-1)", example = "0.74")
    private double score;

    @Schema(description = "Classifier output", example = "HUMAN")
    private Classification classification;
}
