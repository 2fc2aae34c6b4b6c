package com.formshield.behavior.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A verification token received with a form submission")
public class TokenRequest {

    @Schema(description = "Base64 token issued with an allowed decision")
    private String token;
}
