package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An anomaly flag raised by a collaborator")
public class FlagRequest {

    @Schema(description = "Flag tag. Unknown tags receive the default penalty.", example = "paste_detected")
    private String type;

    @Schema(description = "Contextual data", example = "{\"field\": \"password\"}")
    private Map<String, Object> data;
}
