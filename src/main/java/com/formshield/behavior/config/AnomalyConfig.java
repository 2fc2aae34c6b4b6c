package com.formshield.behavior.config;

import com.formshield.behavior.model.FlagType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "behavior.anomaly")
public class AnomalyConfig {

    // Penalty per flag tag (e.g. honeypot_filled -> -0.8). Missing tags use defaultPenalty.
    private Map<String, Double> penalties = defaultPenalties();

    private double defaultPenalty = -0.1;

    // Added to confidence while the classifier reports HUMAN
    private double humanConfidenceBonus = 0.2;

    // First input this soon after a field gained focus is flagged
    private long fastTypingMs = 100;

    // Key-downs closer together than this are flagged
    private long uniformTypingMs = 50;

    // Clicks closer together than this are flagged
    private long fastClickMs = 100;

    // Interaction burst window after the page becomes visible again
    private long rapidActivityWindowMs = 100;
    private int rapidActivityBurst = 5;

    // Outer minus inner window size beyond this suggests docked devtools
    private int devToolsThresholdPx = 160;

    private double minViewportRatio = 0.3;
    private double maxViewportRatio = 5.0;

    // Flags kept in the per-session log; the flag count itself is never truncated
    private int flagLogCapacity = 200;

    public double penaltyFor(String tag) {
        if (tag == null) {
            return defaultPenalty;
        }
        return penalties.getOrDefault(tag.toLowerCase(), defaultPenalty);
    }

    @PostConstruct
    public void validate() {
        if (defaultPenalty > 0 || defaultPenalty < -1) {
            throw new IllegalStateException("behavior.anomaly.defaultPenalty must be in [-1, 0]");
        }
        penalties.forEach((tag, penalty) -> {
            if (penalty == null || penalty > 0 || penalty < -1) {
                throw new IllegalStateException("behavior.anomaly.penalties." + tag + " must be in [-1, 0]");
            }
        });
        if (humanConfidenceBonus < 0 || humanConfidenceBonus > 1) {
            throw new IllegalStateException("behavior.anomaly.humanConfidenceBonus must be in [0, 1]");
        }
        if (fastTypingMs < 0 || uniformTypingMs < 0 || fastClickMs < 0 || rapidActivityWindowMs < 0) {
            throw new IllegalStateException("behavior.anomaly timing thresholds must be >= 0");
        }
        if (rapidActivityBurst <= 0 || devToolsThresholdPx <= 0 || flagLogCapacity <= 0) {
            throw new IllegalStateException("behavior.anomaly counts and capacities must be > 0");
        }
        if (minViewportRatio <= 0 || minViewportRatio >= maxViewportRatio) {
            throw new IllegalStateException("behavior.anomaly viewport ratio bounds are invalid");
        }
    }

    private static Map<String, Double> defaultPenalties() {
        Map<String, Double> defaults = new HashMap<>();
        for (FlagType type : FlagType.values()) {
            defaults.put(type.getTag(), type.getDefaultPenalty());
        }
        return defaults;
    }
}
