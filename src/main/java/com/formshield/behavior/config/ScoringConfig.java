package com.formshield.behavior.config;

import com.formshield.behavior.model.Channel;
import jakarta.annotation.PostConstruct;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "behavior.scoring")
public class ScoringConfig {

    public static final double WEIGHT_SUM_EPSILON = 1e-6;

    // Bot / human cut-offs and the pointer linearity limit, replaced as one unit
    @Setter(AccessLevel.NONE)
    private volatile Thresholds thresholds = new Thresholds(0.3, 0.7, 0.95);

    // Cadence of the periodic score re-evaluation
    private long tickIntervalMs = 1000;

    // Rolling history size for touch, click and keyboard channels
    private int historyCapacity = 200;

    // Click intervals within this distance of the mean count as "consistent"
    private double clickConsistencyToleranceMs = 10.0;

    // Inter-keystroke gaps longer than this count as natural pauses
    private double naturalPauseMs = 500.0;

    private volatile Weights weights = new Weights();

    private Pointer pointer = new Pointer();

    private VarianceScales varianceScales = new VarianceScales();

    /**
     * Publish new thresholds in one step; readers holding {@link #getThresholds()} never see a mix.
     */
    public void updateThresholds(double bot, double human, double suspiciousLinearity) {
        this.thresholds = new Thresholds(bot, human, suspiciousLinearity);
    }

    // Property binding for behavior.scoring.botThreshold and friends

    public double getBotThreshold() {
        return thresholds.getBot();
    }

    public synchronized void setBotThreshold(double botThreshold) {
        Thresholds t = thresholds;
        this.thresholds = new Thresholds(botThreshold, t.getHuman(), t.getSuspiciousLinearity());
    }

    public double getHumanThreshold() {
        return thresholds.getHuman();
    }

    public synchronized void setHumanThreshold(double humanThreshold) {
        Thresholds t = thresholds;
        this.thresholds = new Thresholds(t.getBot(), humanThreshold, t.getSuspiciousLinearity());
    }

    public double getSuspiciousLinearityThreshold() {
        return thresholds.getSuspiciousLinearity();
    }

    public synchronized void setSuspiciousLinearityThreshold(double suspiciousLinearityThreshold) {
        Thresholds t = thresholds;
        this.thresholds = new Thresholds(t.getBot(), t.getHuman(), suspiciousLinearityThreshold);
    }

    @PostConstruct
    public void validate() {
        Thresholds t = thresholds;
        Weights weights = this.weights;
        double sum = weights.sum();
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_EPSILON) {
            throw new IllegalStateException(String.format(
                    "behavior.scoring.weights must sum to 1.0 (got %.6f)", sum));
        }
        for (Channel channel : Channel.values()) {
            if (weights.weightFor(channel) < 0) {
                throw new IllegalStateException("behavior.scoring.weights." +
                        channel.name().toLowerCase() + " must be >= 0");
            }
        }
        requireUnitRange("botThreshold", t.getBot());
        requireUnitRange("humanThreshold", t.getHuman());
        requireUnitRange("suspiciousLinearityThreshold", t.getSuspiciousLinearity());
        if (t.getBot() >= t.getHuman()) {
            throw new IllegalStateException("behavior.scoring.botThreshold must be less than humanThreshold");
        }
        if (tickIntervalMs <= 0) {
            throw new IllegalStateException("behavior.scoring.tickIntervalMs must be > 0");
        }
        if (historyCapacity <= 0 || pointer.getCapacity() <= 0) {
            throw new IllegalStateException("behavior.scoring history capacities must be > 0");
        }
        if (pointer.getMinSamples() < 3) {
            throw new IllegalStateException("behavior.scoring.pointer.minSamples must be >= 3");
        }
        if (clickConsistencyToleranceMs < 0 || naturalPauseMs < 0) {
            throw new IllegalStateException("behavior.scoring durations must be >= 0");
        }
        varianceScales.validate();
    }

    private static void requireUnitRange(String name, double value) {
        if (value < 0 || value > 1) {
            throw new IllegalStateException("behavior.scoring." + name + " must be in [0, 1]");
        }
    }

    @Value
    public static class Thresholds {
        // Overall score at or below this classifies the session as a bot
        double bot;

        // Overall score at or above this classifies the session as human
        double human;

        // Pointer paths straighter than this are treated as scripted
        double suspiciousLinearity;
    }

    @Data
    public static class Weights {
        private double pointer = 0.25;
        private double touch = 0.20;
        private double click = 0.20;
        private double keyboard = 0.20;
        private double timing = 0.15;

        public double weightFor(Channel channel) {
            switch (channel) {
                case POINTER: return pointer;
                case TOUCH: return touch;
                case CLICK: return click;
                case KEYBOARD: return keyboard;
                case TIMING: return timing;
                default: throw new IllegalArgumentException("Unknown channel: " + channel);
            }
        }

        public double sum() {
            return pointer + touch + click + keyboard + timing;
        }
    }

    @Data
    public static class Pointer {
        // Most-recent positions kept for velocity and linearity analysis
        private int capacity = 1000;

        // Below this many positions the pointer channel reports "no evidence"
        private int minSamples = 5;
    }

    /**
     * Divisors applied to raw variances before they are capped and added to a channel score.
     * Units follow the feature: px/s for velocities, ms for intervals.
     */
    @Data
    public static class VarianceScales {
        private double pointerVelocity = 1_000.0;
        private double pointerAcceleration = 10_000.0;
        private double touchSwipeVelocity = 1_000.0;
        private double clickInterval = 100_000.0;
        private double keyboardInterval = 10_000.0;
        private double timingDelay = 1_000_000.0;

        void validate() {
            if (pointerVelocity <= 0 || pointerAcceleration <= 0 || touchSwipeVelocity <= 0
                    || clickInterval <= 0 || keyboardInterval <= 0 || timingDelay <= 0) {
                throw new IllegalStateException("behavior.scoring.varianceScales must all be > 0");
            }
        }
    }
}
