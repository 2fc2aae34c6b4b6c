package com.formshield.behavior.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "behavior.verification")
public class VerificationConfig {

    // Session must be tracked at least this long before it can be verified or accepted
    private long minTrackingTimeMs = 10_000;

    // Submissions faster than this after the first interaction are rejected
    private long minFillTimeMs = 3_000;

    private boolean requirePointerMovement = true;
    private int minPointerMovements = 10;

    // Distinct form fields a user is expected to touch; feeds the composite score
    private int requiredInteractions = 5;

    // ENHANCED sessions are accepted only with a composite score at or above this (0-100)
    private double enhancedMinScore = 70.0;

    // Hidden input that real users never fill
    private String honeypotFieldName = "email_confirm";

    // Upper bound on distinct fields tracked per session
    private int maxTrackedFields = 64;

    // Idle sessions are discarded after this long (default 30 minutes)
    private long sessionTtlMs = 1_800_000;

    @PostConstruct
    public void validate() {
        if (minTrackingTimeMs < 0) {
            throw new IllegalStateException("behavior.verification.minTrackingTimeMs must be >= 0");
        }
        if (minFillTimeMs < 0) {
            throw new IllegalStateException("behavior.verification.minFillTimeMs must be >= 0");
        }
        if (minPointerMovements < 0 || requiredInteractions < 0) {
            throw new IllegalStateException("behavior.verification interaction minimums must be >= 0");
        }
        if (enhancedMinScore < 0 || enhancedMinScore > 100) {
            throw new IllegalStateException("behavior.verification.enhancedMinScore must be in [0, 100]");
        }
        if (honeypotFieldName == null || honeypotFieldName.isBlank()) {
            throw new IllegalStateException("behavior.verification.honeypotFieldName must be set");
        }
        if (maxTrackedFields <= 0) {
            throw new IllegalStateException("behavior.verification.maxTrackedFields must be > 0");
        }
        if (sessionTtlMs <= 0) {
            throw new IllegalStateException("behavior.verification.sessionTtlMs must be > 0");
        }
    }
}
