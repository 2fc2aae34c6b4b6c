package com.formshield.behavior.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known anomaly flag tags with their default confidence penalties.
 * Collaborators may raise tags outside this list; those fall back to the configured default penalty.
 */
public enum FlagType {
    HONEYPOT_FILLED("honeypot_filled", -0.8),
    BOT_BEHAVIOR_DETECTED("bot_behavior_detected", -0.6),
    WEBDRIVER_DETECTED("webdriver_detected", -0.7),
    PHANTOM_DETECTED("phantom_detected", -0.9),
    DEV_TOOLS_DETECTED("dev_tools_detected", -0.2),
    FAST_TYPING("fast_typing", -0.3),
    UNIFORM_TYPING("uniform_typing", -0.4),
    PASTE_DETECTED("paste_detected", -0.1),
    FAST_CLICKING("fast_clicking", -0.1),
    SUSPICIOUS_USER_AGENT("suspicious_user_agent", -0.1),
    MISSING_LANGUAGES("missing_languages", -0.1),
    UNUSUAL_VIEWPORT_RATIO("unusual_viewport_ratio", -0.1),
    RAPID_ACTIVITY_AFTER_FOCUS("rapid_activity_after_focus", -0.1);

    private final String tag;
    private final double defaultPenalty;

    FlagType(String tag, double defaultPenalty) {
        this.tag = tag;
        this.defaultPenalty = defaultPenalty;
    }

    public String getTag() {
        return tag;
    }

    public double getDefaultPenalty() {
        return defaultPenalty;
    }

    public static Optional<FlagType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag))
                .findFirst();
    }
}
