package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "An immutable record of a detected suspicious condition")
public class AnomalyFlag {

    @Schema(description = "Flag tag", example = "honeypot_filled")
    String type;

    @Schema(description = "Contextual data captured with the flag", example = "{\"field\": \"email_confirm\"}")
    Map<String, Object> data;

    @Schema(description = "Detection timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Penalty applied to the human confidence", example = "-0.8")
    double penalty;
}
