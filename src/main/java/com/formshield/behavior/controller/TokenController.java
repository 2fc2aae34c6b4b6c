package com.formshield.behavior.controller;

import com.formshield.behavior.model.TokenRequest;
import com.formshield.behavior.model.VerificationToken;
import com.formshield.behavior.service.VerificationTokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/tokens")
@Tag(name = "Tokens", description = "Decode verification tokens attached to submissions")
public class TokenController {

    private final VerificationTokenService tokenService;

    public TokenController(VerificationTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Operation(summary = "Decode a verification token",
            description = "Returns the token payload. Tokens are unsigned; this only checks the encoding.")
    @PostMapping("/decode")
    public ResponseEntity<?> decode(@RequestBody TokenRequest request) {
        try {
            VerificationToken token = tokenService.decode(request != null ? request.getToken() : null);
            return ResponseEntity.ok(token);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "token"));
        }
    }
}
