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
@Schema(description = "Click cadence features")
public class ClickFeatures {

    @Schema(description = "Clicks observed", example = "6")
    private long clickCount;

    @Schema(description = "Inter-click intervals retained", example = "5")
    private int intervalCount;

    @Schema(description = "Mean inter-click interval in ms", example = "1830.0")
    private double meanInterval;

    @Schema(description = "Inter-click interval variance in ms^2", example = "401233.0")
    private double intervalVariance;

    @Schema(description = "Fraction of intervals within the tolerance of the mean", example = "0.2")
    private double consistencyRatio;
}
