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
@Schema(description = "Touch gesture features")
public class TouchFeatures {

    @Schema(description = "Touch start/move/end events observed", example = "36")
    private long eventCount;

    @Schema(description = "Swipe segments measured between consecutive move samples", example = "28")
    private int swipeCount;

    @Schema(description = "Whether any sample had two or more simultaneous contacts", example = "false")
    private boolean multiTouch;

    @Schema(description = "Mean swipe velocity in px/s", example = "540.0")
    private double averageSwipeVelocity;

    @Schema(description = "Swipe velocity variance in (px/s)^2", example = "12034.2")
    private double swipeVelocityVariance;
}
