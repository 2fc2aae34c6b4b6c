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
@Schema(description = "Tracking session handle")
public class SessionResponse {

    @Schema(description = "Session identifier", example = "5f0c2a5e-7f7b-4d0e-a0c4-3b1c9b7d2e11")
    private String sessionId;

    @Schema(description = "Session start in epoch milliseconds", example = "1739886764000")
    private long startedAt;

    @Schema(description = "Whether tracking is active", example = "true")
    private boolean tracking;
}
