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
@Schema(description = "Unsigned verification payload forwarded to a server-side auditor")
public class VerificationToken {

    @Schema(description = "Issue timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Composite verification score (0-100)", example = "87.5")
    private double score;

    @Schema(description = "Human confidence (0-1)", example = "0.92")
    private double confidence;

    @Schema(description = "Session duration at decision time", example = "12450")
    private long sessionDurationMs;
}
