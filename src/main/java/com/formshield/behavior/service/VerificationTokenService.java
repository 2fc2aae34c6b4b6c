package com.formshield.behavior.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.model.VerificationToken;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;

/**
 * Shapes the verification token attached to accepted submissions: Base64 of the token's JSON.
 * The token is not signed; the server-side auditor is responsible for integrity.
 */
@Service
public class VerificationTokenService {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VerificationTokenService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public VerificationToken issue(VerificationDecision decision, long sessionDurationMs) {
        return VerificationToken.builder()
                .timestamp(clock.millis())
                .score(decision.getScore())
                .confidence(decision.getConfidence())
                .sessionDurationMs(sessionDurationMs)
                .build();
    }

    public String encode(VerificationToken token) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(token);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize verification token", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the token is not Base64 or does not hold a token payload
     */
    public VerificationToken decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("token is empty");
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("token is not valid Base64", e);
        }
        try {
            return objectMapper.readValue(new String(json, StandardCharsets.UTF_8), VerificationToken.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("token payload is not a verification token", e);
        }
    }
}
