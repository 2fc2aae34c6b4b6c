package com.formshield.behavior.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeSessions = registry.gauge("behavior.sessions.active", new AtomicInteger(0));
    }

    public void recordDecision(boolean allowed, String reason, double compositeScore) {
        Counter.builder("behavior.decision.count")
                .tag("allowed", String.valueOf(allowed))
                .tag("reason", reason)
                .register(registry)
                .increment();

        DistributionSummary.builder("behavior.decision.composite_score")
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .record(compositeScore);
    }

    public void recordFlagRaised(String flagType) {
        Counter.builder("behavior.flag.raised.count")
                .tag("type", flagType)
                .register(registry)
                .increment();
    }

    public void recordClassificationChange(String classification) {
        Counter.builder("behavior.classification.change.count")
                .tag("classification", classification)
                .register(registry)
                .increment();
    }

    public void recordScorerError(String channel) {
        Counter.builder("behavior.scorer.error.count")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    public void updateActiveSessions(int count) {
        activeSessions.set(count);
    }
}
