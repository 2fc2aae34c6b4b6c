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
@Schema(description = "Submission-time inputs for the final decision")
public class DecisionRequest {

    @Schema(description = "Submitted value of the hidden honeypot field; must be empty for real users", example = "")
    private String honeypotValue;
}
