package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Point-in-time report of a tracking session")
public class AnalysisSnapshot {

    @Schema(description = "Session identifier", example = "5f0c2a5e-7f7b-4d0e-a0c4-3b1c9b7d2e11")
    private String sessionId;

    @Schema(description = "Whether tracking is active", example = "true")
    private boolean tracking;

    @Schema(description = "Fused overall score (0-1)", example = "0.74")
    private double overallScore;

    @Schema(description = "Per-channel scores (0-1)")
    private Map<Channel, Double> channelScores;

    @Schema(description = "Classifier output", example = "HUMAN")
    private Classification classification;

    @Schema(description = "Human confidence (0-1)", example = "0.94")
    private double confidence;

    @Schema(description = "Verification level", example = "VERIFIED")
    private VerificationLevel verificationLevel;

    @Schema(description = "Anomaly flags raised", example = "0")
    private int flagCount;

    @Schema(description = "Elapsed session time", example = "12450")
    private long sessionDurationMs;

    @Schema(description = "Distinct form fields interacted with", example = "4")
    private int fieldInteractionCount;

    private PointerFeatures pointer;
    private TouchFeatures touch;
    private ClickFeatures click;
    private KeyboardFeatures keyboard;
    private TimingFeatures timing;
}
