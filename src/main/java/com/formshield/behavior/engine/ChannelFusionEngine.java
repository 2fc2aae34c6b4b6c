package com.formshield.behavior.engine;

import com.formshield.behavior.config.MetricsConfig;
import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.engine.scoring.ChannelScorer;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.Classification;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every channel scorer against a session's features and fuses the results into one
 * weighted overall score and a three-state classification.
 * Uses the Strategy pattern: each Channel is handled by a registered ChannelScorer.
 */
@Component
public class ChannelFusionEngine {

    private static final Logger log = LoggerFactory.getLogger(ChannelFusionEngine.class);

    private final Map<Channel, ChannelScorer> scorerMap;
    private final ScoringConfig scoringConfig;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public ChannelFusionEngine(List<ChannelScorer> scorers, ScoringConfig scoringConfig,
                               Tracer tracer, MetricsConfig metricsConfig) {
        this.scorerMap = new EnumMap<>(Channel.class);
        this.scoringConfig = scoringConfig;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all scorer implementations
        for (ChannelScorer scorer : scorers) {
            scorerMap.put(scorer.getSupportedChannel(), scorer);
            log.info("Registered channel scorer: {} -> {}",
                    scorer.getSupportedChannel(), scorer.getClass().getSimpleName());
        }

        for (Channel channel : Channel.values()) {
            if (!scorerMap.containsKey(channel)) {
                throw new IllegalStateException("No scorer registered for channel: " + channel);
            }
        }
    }

    /**
     * Score all channels and fuse them.
     *
     * @param features features of one session at one instant
     * @return per-channel scores, the weighted overall score and its classification
     */
    public FusionResult fuse(SessionFeatures features) {
        Map<Channel, Double> channelScores = new EnumMap<>(Channel.class);
        ScoringConfig.Weights weights = scoringConfig.getWeights();
        ScoringConfig.Thresholds thresholds = scoringConfig.getThresholds();
        double overall = 0.0;

        for (Channel channel : Channel.values()) {
            double score = scoreChannel(channel, features);
            channelScores.put(channel, score);
            overall += score * weights.weightFor(channel);
        }

        overall = Math.max(0.0, Math.min(1.0, overall));
        Classification classification = Classification.fromScore(overall,
                thresholds.getBot(), thresholds.getHuman());

        return FusionResult.builder()
                .channelScores(channelScores)
                .overallScore(overall)
                .classification(classification)
                .build();
    }

    private double scoreChannel(Channel channel, SessionFeatures features) {
        ChannelScorer scorer = scorerMap.get(channel);

        Span span = tracer.nextSpan()
                .name("channel.score." + channel)
                .tag("channel", channel.name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            double score = ChannelScorer.clamp(scorer.score(features));
            span.tag("channel.score", String.valueOf(score));
            return score;
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordScorerError(channel.name());
            log.error("Error scoring channel {}: {}", channel, e.getMessage(), e);
            // One failing channel falls back to neutral instead of failing the whole evaluation
            return ChannelScorer.BASELINE;
        } finally {
            span.end();
        }
    }
}
