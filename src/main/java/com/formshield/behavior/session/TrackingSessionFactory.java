package com.formshield.behavior.session;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.engine.ChannelFusionEngine;
import com.formshield.behavior.engine.VerificationLevelEvaluator;
import com.formshield.behavior.engine.anomaly.EnvironmentInspector;
import com.formshield.behavior.engine.anomaly.EnvironmentProbe;
import com.formshield.behavior.engine.gate.CompositeScoreCalculator;
import com.formshield.behavior.engine.gate.DecisionGate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds tracking sessions wired to the shared, stateless engine components.
 */
@Component
public class TrackingSessionFactory {

    private final Clock clock;
    private final ScoringConfig scoringConfig;
    private final VerificationConfig verificationConfig;
    private final AnomalyConfig anomalyConfig;
    private final ChannelFusionEngine fusionEngine;
    private final VerificationLevelEvaluator levelEvaluator;
    private final EnvironmentInspector environmentInspector;
    private final CompositeScoreCalculator compositeScoreCalculator;
    private final DecisionGate decisionGate;

    public TrackingSessionFactory(Clock clock, ScoringConfig scoringConfig, VerificationConfig verificationConfig,
                                  AnomalyConfig anomalyConfig, ChannelFusionEngine fusionEngine,
                                  VerificationLevelEvaluator levelEvaluator,
                                  EnvironmentInspector environmentInspector,
                                  CompositeScoreCalculator compositeScoreCalculator, DecisionGate decisionGate) {
        this.clock = clock;
        this.scoringConfig = scoringConfig;
        this.verificationConfig = verificationConfig;
        this.anomalyConfig = anomalyConfig;
        this.fusionEngine = fusionEngine;
        this.levelEvaluator = levelEvaluator;
        this.environmentInspector = environmentInspector;
        this.compositeScoreCalculator = compositeScoreCalculator;
        this.decisionGate = decisionGate;
    }

    /**
     * Create a session that has not started tracking yet.
     *
     * @param startedAt page-load time in epoch millis; null means now
     * @param environment host environment report, may be null
     */
    public TrackingSession create(String id, Long startedAt, EnvironmentProbe environment) {
        long start = startedAt != null && startedAt > 0 ? startedAt : clock.millis();
        TrackingSession session = new TrackingSession(id, start, clock, scoringConfig, verificationConfig,
                anomalyConfig, fusionEngine, levelEvaluator, environmentInspector, compositeScoreCalculator,
                decisionGate);
        if (environment != null) {
            session.updateEnvironment(environment);
        }
        return session;
    }
}
