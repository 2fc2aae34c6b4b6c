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
@Schema(description = "Typing rhythm features")
public class KeyboardFeatures {

    @Schema(description = "Key-down and key-up events observed", example = "42")
    private long keyPressCount;

    @Schema(description = "Inter-keystroke intervals retained", example = "20")
    private int intervalCount;

    @Schema(description = "Mean inter-keystroke interval in ms", example = "184.0")
    private double meanInterval;

    @Schema(description = "Inter-keystroke interval variance in ms^2", example = "9120.0")
    private double intervalVariance;

    @Schema(description = "Intervals longer than the natural pause threshold", example = "2")
    private int naturalPauseCount;
}
