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
@Schema(description = "Optional parameters for starting a tracking session")
public class SessionStartRequest {

    @Schema(description = "Page-load time in epoch milliseconds, in the same timebase as event timestamps. " +
            "Defaults to the server clock.", example = "1739886764000")
    private Long startedAt;

    @Schema(description = "Host environment facts used by the setup-time automation checks")
    private EnvironmentReport environment;
}
