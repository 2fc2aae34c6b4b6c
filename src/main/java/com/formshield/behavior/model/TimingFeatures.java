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
@Schema(description = "Session timing features")
public class TimingFeatures {

    @Schema(description = "Delay from session start to the first qualifying interaction; null until one occurs",
            example = "1420")
    private Long firstInteractionDelayMs;

    @Schema(description = "Interaction kinds with a recorded first-occurrence delay", example = "3")
    private int delayCount;

    @Schema(description = "Variance of the first-occurrence delays in ms^2", example = "1.2E6")
    private double delayVariance;
}
