package com.formshield.behavior.session;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.engine.ChannelFusionEngine;
import com.formshield.behavior.engine.FusionResult;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.engine.VerificationLevelEvaluator;
import com.formshield.behavior.engine.accumulator.ClickAccumulator;
import com.formshield.behavior.engine.accumulator.KeyboardAccumulator;
import com.formshield.behavior.engine.accumulator.PointerAccumulator;
import com.formshield.behavior.engine.accumulator.TimingAccumulator;
import com.formshield.behavior.engine.accumulator.TouchAccumulator;
import com.formshield.behavior.engine.anomaly.Detection;
import com.formshield.behavior.engine.anomaly.EnvironmentInspector;
import com.formshield.behavior.engine.anomaly.EnvironmentProbe;
import com.formshield.behavior.engine.anomaly.FormActivityMonitor;
import com.formshield.behavior.engine.gate.CompositeScoreCalculator;
import com.formshield.behavior.engine.gate.DecisionContext;
import com.formshield.behavior.engine.gate.DecisionGate;
import com.formshield.behavior.model.AnalysisSnapshot;
import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.Classification;
import com.formshield.behavior.model.EventKind;
import com.formshield.behavior.model.FlagType;
import com.formshield.behavior.model.InteractionEvent;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.model.VerificationLevel;
import com.formshield.behavior.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One tracked form or page view.
 *
 * Events flow through {@link #observe} into the channel accumulators and the form activity monitor.
 * Scores are recomputed lazily: observe only marks the session dirty, and the next tick or query
 * re-runs the fusion engine. Confidence is the last overall score, plus the human bonus while the
 * classifier reports HUMAN, plus every anomaly penalty raised so far, clamped to [0, 1].
 *
 * Every public method takes the session monitor, so a tick in progress finishes before stop or reset.
 */
public class TrackingSession {

    private static final Logger log = LoggerFactory.getLogger(TrackingSession.class);

    static final double INITIAL_SCORE = 0.5;

    private final String id;
    private final Clock clock;
    private final ScoringConfig scoringConfig;
    private final VerificationConfig verificationConfig;
    private final AnomalyConfig anomalyConfig;
    private final ChannelFusionEngine fusionEngine;
    private final VerificationLevelEvaluator levelEvaluator;
    private final EnvironmentInspector environmentInspector;
    private final CompositeScoreCalculator compositeScoreCalculator;
    private final DecisionGate decisionGate;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private long startedAt;
    private boolean tracking;
    private boolean dirty;

    private PointerAccumulator pointer;
    private TouchAccumulator touch;
    private ClickAccumulator click;
    private KeyboardAccumulator keyboard;
    private TimingAccumulator timing;
    private FormActivityMonitor activity;

    private double overallScore;
    private Map<Channel, Double> channelScores;
    private Classification classification;
    private double confidence;
    private double penaltyTotal;
    private VerificationLevel level;
    private final ArrayDeque<AnomalyFlag> flags = new ArrayDeque<>();
    private int flagCount;

    private EnvironmentProbe environment;
    private boolean setupInspected;
    private boolean devToolsOpen;
    private boolean honeypotFlagged;
    private long lastActivityAt;

    TrackingSession(String id, long startedAt, Clock clock,
                    ScoringConfig scoringConfig, VerificationConfig verificationConfig, AnomalyConfig anomalyConfig,
                    ChannelFusionEngine fusionEngine, VerificationLevelEvaluator levelEvaluator,
                    EnvironmentInspector environmentInspector, CompositeScoreCalculator compositeScoreCalculator,
                    DecisionGate decisionGate) {
        this.id = id;
        this.clock = clock;
        this.scoringConfig = scoringConfig;
        this.verificationConfig = verificationConfig;
        this.anomalyConfig = anomalyConfig;
        this.fusionEngine = fusionEngine;
        this.levelEvaluator = levelEvaluator;
        this.environmentInspector = environmentInspector;
        this.compositeScoreCalculator = compositeScoreCalculator;
        this.decisionGate = decisionGate;
        initState(startedAt);
    }

    public String getId() {
        return id;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ---- lifecycle ----

    public synchronized void start() {
        if (tracking) {
            return;
        }
        tracking = true;
        lastActivityAt = clock.millis();
        inspectSetup();
        log.info("Tracking started for session {}", id);
    }

    public synchronized void stop() {
        if (!tracking) {
            return;
        }
        tracking = false;
        log.info("Tracking stopped for session {}", id);
    }

    /**
     * Clear all accumulated evidence, flags and the verification level. Tracking resumes if it was active.
     */
    public synchronized void reset() {
        boolean wasTracking = tracking;
        initState(clock.millis());
        setupInspected = false;
        devToolsOpen = false;
        log.info("Session {} reset", id);
        if (wasTracking) {
            tracking = true;
            inspectSetup();
        }
    }

    public synchronized boolean isTracking() {
        return tracking;
    }

    public synchronized long getStartedAt() {
        return startedAt;
    }

    public synchronized long getLastActivityAt() {
        return lastActivityAt;
    }

    // ---- event capture ----

    /**
     * Route one event into the matching accumulators. A no-op while tracking is stopped.
     * Events without a kind, or without the payload fields a channel needs, are ignored by that channel.
     */
    public synchronized void observe(InteractionEvent event) {
        if (!tracking || event == null || event.getKind() == null) {
            return;
        }
        long now = clock.millis();
        long timestamp = event.getTimestamp() > 0 ? event.getTimestamp() : now;
        lastActivityAt = now;

        EventKind kind = event.getKind();
        switch (kind) {
            case POINTER_MOVE:
                if (event.getX() != null && event.getY() != null) {
                    pointer.push(event.getX(), event.getY(), timestamp);
                }
                break;
            case CLICK:
                click.push(timestamp);
                break;
            case TOUCH_START:
                touch.push(TouchAccumulator.Phase.START, event.getTouches(), timestamp);
                break;
            case TOUCH_MOVE:
                touch.push(TouchAccumulator.Phase.MOVE, event.getTouches(), timestamp);
                break;
            case TOUCH_END:
                touch.push(TouchAccumulator.Phase.END, event.getTouches(), timestamp);
                break;
            case KEY_DOWN:
                keyboard.keyDown(timestamp);
                break;
            case KEY_UP:
                keyboard.keyUp(timestamp);
                break;
            default:
                break;
        }

        if (kind.isQualifyingInteraction() && timing.recordInteraction(kind, timestamp)) {
            log.debug("Session {} first interaction {} after {}ms", id, kind,
                    Math.max(0L, timestamp - startedAt));
        }

        for (Detection detection : activity.record(event, timestamp)) {
            if (detection.getType() == FlagType.HONEYPOT_FILLED) {
                honeypotFlagged = true;
            }
            raise(detection.getType().getTag(), detection.getData(), now);
        }
        dirty = true;
    }

    public synchronized void observeAll(List<InteractionEvent> events) {
        if (events == null) {
            return;
        }
        for (InteractionEvent event : events) {
            observe(event);
        }
    }

    /**
     * Replace the environment report. Setup checks run on the first report; the devtools heuristic on every one.
     */
    public synchronized void updateEnvironment(EnvironmentProbe probe) {
        this.environment = probe;
        lastActivityAt = clock.millis();
        if (tracking) {
            inspectSetup();
            checkDevTools();
            updateConfidenceAndLevel();
        }
    }

    /**
     * Record a flag raised by a collaborator. Unknown tags carry the default penalty.
     *
     * @return the recorded flag, or null if tracking is stopped
     */
    public synchronized AnomalyFlag raiseFlag(String type, Map<String, Object> data) {
        if (!tracking) {
            log.debug("Session {} is stopped, ignoring flag {}", id, type);
            return null;
        }
        long now = clock.millis();
        lastActivityAt = now;
        return raise(type, data, now);
    }

    // ---- periodic re-evaluation ----

    /**
     * Periodic re-evaluation: recomputes scores if new evidence arrived and re-runs the devtools heuristic.
     * Does nothing while tracking is stopped.
     */
    public synchronized void tick() {
        if (!tracking) {
            return;
        }
        recomputeIfDirty();
        checkDevTools();
        updateConfidenceAndLevel();
    }

    // ---- queries ----

    public synchronized double currentScore() {
        refresh();
        return overallScore;
    }

    public synchronized Classification classification() {
        refresh();
        return classification;
    }

    public synchronized double confidence() {
        refresh();
        return confidence;
    }

    public synchronized VerificationLevel verificationLevel() {
        refresh();
        return level;
    }

    public synchronized int getFlagCount() {
        return flagCount;
    }

    public synchronized List<AnomalyFlag> getFlags() {
        return Collections.unmodifiableList(new ArrayList<>(flags));
    }

    public synchronized int fieldInteractionCount() {
        return activity.getFieldInteractionCount();
    }

    public synchronized long sessionTimeMs() {
        return Math.max(0L, clock.millis() - startedAt);
    }

    public synchronized AnalysisSnapshot snapshot() {
        refresh();
        SessionFeatures features = features();
        return AnalysisSnapshot.builder()
                .sessionId(id)
                .tracking(tracking)
                .overallScore(overallScore)
                .channelScores(new EnumMap<>(channelScores))
                .classification(classification)
                .confidence(confidence)
                .verificationLevel(level)
                .flagCount(flagCount)
                .sessionDurationMs(sessionTimeMs())
                .fieldInteractionCount(activity.getFieldInteractionCount())
                .pointer(features.getPointer())
                .touch(features.getTouch())
                .click(features.getClick())
                .keyboard(features.getKeyboard())
                .timing(features.getTiming())
                .build();
    }

    public synchronized VerificationStatus status() {
        refresh();
        long sessionTime = sessionTimeMs();
        return VerificationStatus.builder()
                .level(level)
                .score(compositeScore(sessionTime))
                .confidence(confidence)
                .verified(level == VerificationLevel.VERIFIED)
                .flagCount(flagCount)
                .sessionTimeMs(sessionTime)
                .classification(classification)
                .build();
    }

    /**
     * Bring scores, confidence and level up to date with all evidence observed so far.
     */
    public synchronized void refresh() {
        lastActivityAt = clock.millis();
        recomputeIfDirty();
        updateConfidenceAndLevel();
    }

    // ---- decision ----

    /**
     * Run the final admission checks for a submission.
     *
     * @param honeypotValue submitted honeypot field value; a value typed into the honeypot during
     *                      the session counts as well
     */
    public synchronized VerificationDecision decide(String honeypotValue) {
        refresh();
        long now = clock.millis();

        String honeypot = isFilled(honeypotValue) ? honeypotValue : activity.getHoneypotValue();
        if (isFilled(honeypot) && !honeypotFlagged) {
            honeypotFlagged = true;
            raise(FlagType.HONEYPOT_FILLED.getTag(),
                    Map.of("field", verificationConfig.getHoneypotFieldName()), now);
        }

        long sessionTime = sessionTimeMs();
        Long firstInteractionAt = timing.getFirstInteractionAt();
        long timeToSubmit = Math.max(0L, now - (firstInteractionAt != null ? firstInteractionAt : startedAt));

        DecisionContext context = DecisionContext.builder()
                .honeypotValue(honeypot)
                .sessionTimeMs(sessionTime)
                .timeToSubmitMs(timeToSubmit)
                .pointerMovements(activity.getPointerMovements())
                .classification(classification)
                .verificationLevel(level)
                .confidence(confidence)
                .overallScore(overallScore)
                .compositeScore(compositeScore(sessionTime))
                .flagCount(flagCount)
                .build();

        VerificationDecision decision = decisionGate.decide(context, now);
        for (SessionListener listener : listeners) {
            try {
                listener.onDecision(id, decision);
            } catch (Exception e) {
                log.warn("Listener {} failed on decision for session {}: {}",
                        listener.getClass().getSimpleName(), id, e.getMessage(), e);
            }
        }
        return decision;
    }

    // ---- internals ----

    private void initState(long start) {
        this.startedAt = start;
        int capacity = scoringConfig.getHistoryCapacity();
        this.pointer = new PointerAccumulator(scoringConfig.getPointer().getCapacity(),
                scoringConfig.getPointer().getMinSamples());
        this.touch = new TouchAccumulator(capacity);
        this.click = new ClickAccumulator(capacity, scoringConfig.getClickConsistencyToleranceMs());
        this.keyboard = new KeyboardAccumulator(capacity, scoringConfig.getNaturalPauseMs());
        this.timing = new TimingAccumulator(start);
        this.activity = new FormActivityMonitor(anomalyConfig, verificationConfig.getHoneypotFieldName(),
                verificationConfig.getMaxTrackedFields());

        this.overallScore = INITIAL_SCORE;
        this.channelScores = new EnumMap<>(Channel.class);
        for (Channel channel : Channel.values()) {
            channelScores.put(channel, INITIAL_SCORE);
        }
        this.classification = Classification.UNCERTAIN;
        this.confidence = INITIAL_SCORE;
        this.penaltyTotal = 0.0;
        this.level = VerificationLevel.NONE;
        this.flags.clear();
        this.flagCount = 0;
        this.honeypotFlagged = false;
        this.dirty = true;
        this.lastActivityAt = clock.millis();
    }

    private SessionFeatures features() {
        return SessionFeatures.builder()
                .pointer(pointer.features())
                .touch(touch.features())
                .click(click.features())
                .keyboard(keyboard.features())
                .timing(timing.features())
                .build();
    }

    private void recomputeIfDirty() {
        if (!dirty) {
            return;
        }
        dirty = false;

        FusionResult result = fusionEngine.fuse(features());
        Classification previous = classification;
        overallScore = result.getOverallScore();
        channelScores = result.getChannelScores();
        classification = result.getClassification();

        log.debug("Session {} score={} classification={} channels={}",
                id, String.format("%.3f", overallScore), classification, channelScores);
        for (SessionListener listener : listeners) {
            try {
                listener.onScoreUpdated(id, overallScore, classification);
            } catch (Exception e) {
                log.warn("Listener {} failed on score update for session {}: {}",
                        listener.getClass().getSimpleName(), id, e.getMessage(), e);
            }
        }

        if (classification != previous && classification != Classification.UNCERTAIN) {
            for (SessionListener listener : listeners) {
                try {
                    listener.onClassificationChanged(id, previous, classification);
                } catch (Exception e) {
                    log.warn("Listener {} failed on classification change for session {}: {}",
                            listener.getClass().getSimpleName(), id, e.getMessage(), e);
                }
            }
            if (classification == Classification.BOT) {
                raise(FlagType.BOT_BEHAVIOR_DETECTED.getTag(), Map.of("score", overallScore), clock.millis());
            }
        }
    }

    private void updateConfidenceAndLevel() {
        double bonus = classification == Classification.HUMAN ? anomalyConfig.getHumanConfidenceBonus() : 0.0;
        confidence = clamp(overallScore + bonus + penaltyTotal);
        level = levelEvaluator.evaluate(level, confidence, flagCount, sessionTimeMs());
    }

    private AnomalyFlag raise(String type, Map<String, Object> data, long timestamp) {
        String tag = type == null ? "unknown" : type.toLowerCase();
        double penalty = anomalyConfig.penaltyFor(tag);
        AnomalyFlag flag = AnomalyFlag.builder()
                .type(tag)
                .data(data == null ? Collections.emptyMap() : data)
                .timestamp(timestamp)
                .penalty(penalty)
                .build();

        flags.addLast(flag);
        if (flags.size() > anomalyConfig.getFlagLogCapacity()) {
            flags.removeFirst();
        }
        flagCount++;
        penaltyTotal += penalty;
        updateConfidenceAndLevel();

        log.warn("Anomaly flag '{}' raised for session {} (penalty={}, confidence={})",
                tag, id, penalty, String.format("%.3f", confidence));
        for (SessionListener listener : listeners) {
            try {
                listener.onFlagRaised(id, flag);
            } catch (Exception e) {
                log.warn("Listener {} failed on flag for session {}: {}",
                        listener.getClass().getSimpleName(), id, e.getMessage(), e);
            }
        }
        return flag;
    }

    private void inspectSetup() {
        if (setupInspected || environment == null) {
            return;
        }
        setupInspected = true;
        long now = clock.millis();
        for (Detection detection : environmentInspector.inspectSetup(environment)) {
            raise(detection.getType().getTag(), detection.getData(), now);
        }
        checkDevTools();
    }

    // Raises only on the closed -> open transition
    private void checkDevTools() {
        boolean open = environmentInspector.isDevToolsOpen(environment);
        if (open && !devToolsOpen) {
            raise(FlagType.DEV_TOOLS_DETECTED.getTag(), Collections.emptyMap(), clock.millis());
        }
        devToolsOpen = open;
    }

    private double compositeScore(long sessionTime) {
        return compositeScoreCalculator.compute(confidence, overallScore,
                activity.getFieldInteractionCount(), sessionTime, flagCount);
    }

    private static boolean isFilled(String value) {
        return value != null && !value.isEmpty();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
