package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A timestamped interaction event captured by the UI layer. " +
        "Only the payload fields relevant to the kind are read; missing fields are ignored.")
public class InteractionEvent {

    @Schema(description = "Event kind", example = "POINTER_MOVE")
    private EventKind kind;

    @Schema(description = "Event timestamp in epoch milliseconds. Defaults to receive time if not provided.",
            example = "1739886764000")
    private long timestamp;

    @Schema(description = "Pointer X coordinate (pointer and click events)", example = "412.0")
    private Double x;

    @Schema(description = "Pointer Y coordinate (pointer and click events)", example = "188.0")
    private Double y;

    @Schema(description = "Active touch contacts (touch events)")
    private List<TouchPoint> touches;

    @Schema(description = "Form field name (focus, blur, field-input and paste events)", example = "email")
    private String fieldName;

    @Schema(description = "Current field value (field-input events). Only inspected for the honeypot field.")
    private String value;

    @Schema(description = "Pasted text length (paste events)", example = "24")
    private Integer clipboardLength;

    @Schema(description = "Whether the page became hidden (visibility-change events)", example = "false")
    private Boolean hidden;

    @Schema(description = "Key name (keyboard events)", example = "a")
    private String key;
}
