package com.formshield.behavior.model;

/**
 * Staged trust tiers, ordered from least to most trusted.
 */
public enum VerificationLevel {
    NONE,
    BASIC,
    ENHANCED,
    VERIFIED;

    public boolean isAtLeast(VerificationLevel other) {
        return compareTo(other) >= 0;
    }

    public static VerificationLevel higherOf(VerificationLevel a, VerificationLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
