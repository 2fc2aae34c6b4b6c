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
@Schema(description = "Acknowledgement of an event batch")
public class EventBatchResult {

    @Schema(description = "Session identifier", example = "5f0c2a5e-7f7b-4d0e-a0c4-3b1c9b7d2e11")
    private String sessionId;

    @Schema(description = "Events received in this batch", example = "25")
    private int received;

    @Schema(description = "Whether tracking is active. Events sent to a stopped session are ignored.", example = "true")
    private boolean tracking;
}
