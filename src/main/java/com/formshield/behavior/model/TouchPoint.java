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
@Schema(description = "A single active touch contact")
public class TouchPoint {

    @Schema(description = "Touch identifier assigned by the host", example = "0")
    private Integer id;

    @Schema(description = "Viewport X coordinate in CSS pixels", example = "120.5")
    private double x;

    @Schema(description = "Viewport Y coordinate in CSS pixels", example = "340.0")
    private double y;

    @Schema(description = "Contact pressure when reported by the device", example = "1.0")
    private Double force;
}
