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
@Schema(description = "Pointer movement features over the retained window")
public class PointerFeatures {

    @Schema(description = "Positions currently retained (capped)", example = "240")
    private int sampleCount;

    @Schema(description = "Pointer-move events observed over the whole session", example = "240")
    private long movementCount;

    @Schema(description = "Whether enough positions exist for analysis", example = "true")
    private boolean sufficient;

    @Schema(description = "Total path length in pixels", example = "5210.4")
    private double totalDistance;

    @Schema(description = "Mean velocity in px/s", example = "612.3")
    private double averageVelocity;

    @Schema(description = "Peak velocity in px/s", example = "2410.0")
    private double maxVelocity;

    @Schema(description = "Velocity variance in (px/s)^2", example = "80211.5")
    private double velocityVariance;

    @Schema(description = "Acceleration variance in (px/s^2)^2", example = "9.1E7")
    private double accelerationVariance;

    @Schema(description = "1 = perfectly straight path, lower = curved", example = "0.42")
    private double linearity;
}
