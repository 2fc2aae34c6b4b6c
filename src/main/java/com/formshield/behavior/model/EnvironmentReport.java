package com.formshield.behavior.model;

import com.formshield.behavior.engine.anomaly.EnvironmentProbe;
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
@Schema(description = "Host environment facts reported by the browser-side collaborator")
public class EnvironmentReport implements EnvironmentProbe {

    @Schema(description = "navigator.webdriver", example = "false")
    private boolean webdriver;

    @Schema(description = "PhantomJS globals (callPhantom / _phantom) present", example = "false")
    private boolean phantom;

    @Schema(description = "navigator.userAgent", example = "Mozilla/5.0 (X11; Linux x86_64) Firefox/128.0")
    private String userAgent;

    @Schema(description = "navigator.languages", example = "[\"en-US\", \"en\"]")
    private List<String> languages;

    @Schema(description = "window.innerWidth", example = "1280")
    private Integer innerWidth;

    @Schema(description = "window.innerHeight", example = "720")
    private Integer innerHeight;

    @Schema(description = "window.outerWidth", example = "1280")
    private Integer outerWidth;

    @Schema(description = "window.outerHeight", example = "800")
    private Integer outerHeight;
}
