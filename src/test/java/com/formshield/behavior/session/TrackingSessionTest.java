package com.formshield.behavior.session;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.engine.SessionFeatures;
import com.formshield.behavior.engine.scoring.ChannelScorer;
import com.formshield.behavior.model.AnalysisSnapshot;
import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.Channel;
import com.formshield.behavior.model.Classification;
import com.formshield.behavior.model.EnvironmentReport;
import com.formshield.behavior.model.EventKind;
import com.formshield.behavior.model.InteractionEvent;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.model.VerificationLevel;
import com.formshield.behavior.model.VerificationStatus;
import com.formshield.behavior.testutil.MutableClock;
import com.formshield.behavior.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.formshield.behavior.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrackingSessionTest {

    private MutableClock clock;
    private TrackingSession session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        session = TestDataFactory.sessionFactory(clock).create("s-1", null, null);
        session.start();
    }

    private void observeHumanSession() {
        session.observeAll(curvedPointerPath(T0 + 1_000, 50));
        session.observeAll(humanTyping(T0 + 3_000));
    }

    // ── Scenarios ──

    @Test
    void humanSession_isVerifiedAndAllowed() {
        observeHumanSession();
        clock.setMillis(T0 + 12_000);

        VerificationDecision decision = session.decide(null);

        assertThat(session.classification()).isEqualTo(Classification.HUMAN);
        assertThat(session.verificationLevel()).isEqualTo(VerificationLevel.VERIFIED);
        assertThat(session.getFlagCount()).isZero();
        assertThat(decision.isAllow()).isTrue();
        assertThat(decision.getReason()).isEqualTo("human verified");
    }

    @Test
    void humanSession_channelScores() {
        observeHumanSession();

        AnalysisSnapshot snapshot = session.snapshot();

        assertThat(snapshot.getPointer().getLinearity()).isCloseTo(0.4, within(1e-6));
        assertThat(snapshot.getChannelScores().get(Channel.POINTER)).isCloseTo(1.0, within(1e-9));
        assertThat(snapshot.getChannelScores().get(Channel.KEYBOARD)).isCloseTo(0.9, within(1e-9));
        assertThat(snapshot.getChannelScores().get(Channel.TIMING)).isCloseTo(1.0, within(1e-9));
        assertThat(snapshot.getChannelScores().get(Channel.TOUCH)).isEqualTo(0.5);
        assertThat(snapshot.getChannelScores().get(Channel.CLICK)).isEqualTo(0.5);
        assertThat(snapshot.getOverallScore()).isCloseTo(0.78, within(1e-9));
        assertThat(snapshot.getConfidence()).isCloseTo(0.98, within(1e-9));
    }

    @Test
    void humanSession_beforeMinimumTrackingTime_isNotVerified() {
        observeHumanSession();
        clock.setMillis(T0 + 9_000);

        assertThat(session.verificationLevel()).isEqualTo(VerificationLevel.ENHANCED);
        assertThat(session.decide(null).getReason()).isEqualTo("insufficient tracking time");
    }

    @Test
    void honeypotFilled_rejectsOtherwiseHumanSession() {
        observeHumanSession();
        clock.setMillis(T0 + 15_000);

        VerificationDecision decision = session.decide("bot@example.com");

        assertThat(decision.isAllow()).isFalse();
        assertThat(decision.getReason()).isEqualTo("honeypot filled");
        assertThat(session.getFlags()).extracting(AnomalyFlag::getType).contains("honeypot_filled");
    }

    @Test
    void honeypotTypedDuringSession_counts() {
        observeHumanSession();
        session.observe(fieldInput("email_confirm", "bot@example.com", T0 + 9_000));
        clock.setMillis(T0 + 15_000);

        assertThat(session.decide(null).getReason()).isEqualTo("honeypot filled");
    }

    @Test
    void honeypotInput_flagsImmediatelyAndOnlyOnce() {
        observeHumanSession();
        session.observe(fieldInput("email_confirm", "bot@example.com", T0 + 9_000));
        session.observe(fieldInput("email_confirm", "bot@example.com!", T0 + 9_100));
        clock.setMillis(T0 + 12_000);

        assertThat(session.getFlags()).extracting(AnomalyFlag::getType).containsExactly("honeypot_filled");
        assertThat(session.confidence()).isLessThan(0.5);
        assertThat(session.verificationLevel()).isNotEqualTo(VerificationLevel.VERIFIED);
        assertThat(session.status().isVerified()).isFalse();

        VerificationDecision decision = session.decide(null);

        assertThat(decision.getReason()).isEqualTo("honeypot filled");
        assertThat(session.getFlagCount()).isEqualTo(1);
    }

    @Test
    void fillTime_isMeasuredFromFirstInteraction() {
        session.observeAll(curvedPointerPath(T0 + 10_000, 50));
        clock.setMillis(T0 + 12_000);

        VerificationDecision decision = session.decide(null);

        assertThat(decision.isAllow()).isFalse();
        assertThat(decision.getReason()).isEqualTo("form filled too quickly");
    }

    @Test
    void earlySubmissionWithoutPointer_failsOnTrackingTime() {
        clock.setMillis(T0 + 500);

        VerificationDecision decision = session.decide(null);

        assertThat(decision.isAllow()).isFalse();
        assertThat(decision.getReason()).isEqualTo("insufficient tracking time");
    }

    @Test
    void scriptedSession_isBotAndBlocked() {
        session.observeAll(straightPointerPath(T0 + 50, 20));
        for (int i = 0; i < 6; i++) {
            session.observe(click(T0 + 60 + i * 200L));
        }
        session.tick();

        assertThat(session.classification()).isEqualTo(Classification.BOT);
        assertThat(session.getFlags()).extracting(AnomalyFlag::getType).containsExactly("bot_behavior_detected");

        clock.setMillis(T0 + 15_000);
        VerificationDecision decision = session.decide(null);
        assertThat(decision.isAllow()).isFalse();
        assertThat(decision.getReason()).isEqualTo("bot behavior detected");
    }

    // ── Properties ──

    @Test
    void noEvents_scoreIsDeterministicAndNotHuman() {
        assertThat(session.currentScore()).isCloseTo(0.4, within(1e-9));
        assertThat(session.classification()).isEqualTo(Classification.UNCERTAIN);
    }

    @Test
    void straightLine_pointerScoreAtMostPointTwo() {
        session.observeAll(straightPointerPath(T0 + 1_000, 30));

        AnalysisSnapshot snapshot = session.snapshot();

        assertThat(snapshot.getPointer().getLinearity()).isCloseTo(1.0, within(1e-9));
        assertThat(snapshot.getChannelScores().get(Channel.POINTER)).isLessThanOrEqualTo(0.2);
    }

    @Test
    void snapshot_isIdempotent() {
        observeHumanSession();
        clock.setMillis(T0 + 11_000);

        assertThat(session.snapshot()).isEqualTo(session.snapshot());
    }

    @Test
    void confidence_staysWithinUnitRange() {
        for (int i = 0; i < 10; i++) {
            session.raiseFlag("honeypot_filled", null);
            assertThat(session.confidence()).isBetween(0.0, 1.0);
        }
        assertThat(session.confidence()).isEqualTo(0.0);
        assertThat(session.getFlagCount()).isEqualTo(10);
    }

    @Test
    void unknownFlag_getsDefaultPenalty() {
        AnomalyFlag flag = session.raiseFlag("custom_signal", null);

        assertThat(flag.getPenalty()).isEqualTo(-0.1);
        assertThat(session.confidence()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void flagLog_isBoundedButCountIsNot() {
        AnomalyConfig anomalyConfig = new AnomalyConfig();
        anomalyConfig.setFlagLogCapacity(5);
        ScoringConfig scoringConfig = new ScoringConfig();
        TrackingSession bounded = TestDataFactory.sessionFactory(clock, scoringConfig, new VerificationConfig(),
                anomalyConfig, TestDataFactory.fusionEngine(scoringConfig)).create("s-2", null, null);
        bounded.start();

        for (int i = 0; i < 12; i++) {
            bounded.raiseFlag("paste_detected", null);
        }

        assertThat(bounded.getFlags()).hasSize(5);
        assertThat(bounded.getFlagCount()).isEqualTo(12);
    }

    // ── Lifecycle ──

    @Test
    void stoppedSession_ignoresEvents() {
        session.stop();
        session.observeAll(curvedPointerPath(T0 + 1_000, 50));

        assertThat(session.snapshot().getPointer().getMovementCount()).isZero();
        assertThat(session.isTracking()).isFalse();
    }

    @Test
    void stoppedSession_ignoresRaisedFlags() {
        session.raiseFlag("paste_detected", null);
        double confidence = session.confidence();
        session.stop();

        AnomalyFlag flag = session.raiseFlag("paste_detected", null);

        assertThat(flag).isNull();
        assertThat(session.getFlagCount()).isEqualTo(1);
        assertThat(session.getFlags()).hasSize(1);
        assertThat(session.confidence()).isEqualTo(confidence);
    }

    @Test
    void reset_clearsEvidenceFlagsAndLevel() {
        observeHumanSession();
        clock.setMillis(T0 + 12_000);
        session.raiseFlag("paste_detected", null);
        assertThat(session.verificationLevel()).isNotEqualTo(VerificationLevel.NONE);

        session.reset();

        AnalysisSnapshot snapshot = session.snapshot();
        assertThat(session.isTracking()).isTrue();
        assertThat(snapshot.getFlagCount()).isZero();
        assertThat(snapshot.getPointer().getMovementCount()).isZero();
        assertThat(snapshot.getSessionDurationMs()).isZero();
        assertThat(session.getStartedAt()).isEqualTo(T0 + 12_000);
    }

    @Test
    void zeroTimestamp_usesReceiveTime() {
        clock.setMillis(T0 + 2_000);
        session.observe(InteractionEvent.builder().kind(EventKind.KEY_DOWN).build());

        assertThat(session.snapshot().getTiming().getFirstInteractionDelayMs()).isEqualTo(2_000L);
    }

    @Test
    void malformedEvents_areTolerated() {
        session.observe(null);
        session.observe(InteractionEvent.builder().timestamp(T0 + 10).build());
        session.observe(InteractionEvent.builder().kind(EventKind.TOUCH_MOVE).timestamp(T0 + 20).build());
        session.observe(InteractionEvent.builder().kind(EventKind.POINTER_MOVE).timestamp(T0 + 30).x(5.0).build());
        session.observe(InteractionEvent.builder().kind(EventKind.TOUCH_START).timestamp(T0 + 40)
                .touches(Arrays.asList(null, touchPoint(1, 10, 10))).build());
        session.observe(InteractionEvent.builder().kind(EventKind.TOUCH_MOVE).timestamp(T0 + 50)
                .touches(Collections.singletonList(null)).build());

        assertThat(session.currentScore()).isBetween(0.0, 1.0);
        assertThat(session.snapshot().getPointer().getMovementCount()).isZero();
        assertThat(session.snapshot().getTouch().getEventCount()).isEqualTo(3);
    }

    // ── Environment ──

    @Test
    void automationEnvironment_raisesSetupFlags() {
        EnvironmentReport env = desktopEnvironment();
        env.setWebdriver(true);
        TrackingSession automated = TestDataFactory.sessionFactory(clock).create("s-3", null, env);
        automated.start();

        assertThat(automated.getFlags()).extracting(AnomalyFlag::getType).containsExactly("webdriver_detected");
        assertThat(automated.confidence()).isEqualTo(0.0);
    }

    @Test
    void devTools_flaggedOncePerOpening() {
        EnvironmentReport env = desktopEnvironment();
        session.updateEnvironment(env);

        EnvironmentReport docked = desktopEnvironment();
        docked.setOuterHeight(docked.getInnerHeight() + 300);
        session.updateEnvironment(docked);
        session.tick();
        session.tick();
        assertThat(session.getFlagCount()).isEqualTo(1);

        session.updateEnvironment(env);
        session.updateEnvironment(docked);
        assertThat(session.getFlags()).extracting(AnomalyFlag::getType)
                .containsExactly("dev_tools_detected", "dev_tools_detected");
    }

    // ── Notifications ──

    private static final class AdjustableScorer implements ChannelScorer {
        private final Channel channel;
        private double value = 0.5;

        AdjustableScorer(Channel channel) {
            this.channel = channel;
        }

        @Override
        public Channel getSupportedChannel() {
            return channel;
        }

        @Override
        public double score(SessionFeatures features) {
            return value;
        }
    }

    private static final class RecordingListener implements SessionListener {
        final List<Classification> transitions = new ArrayList<>();
        final List<String> flags = new ArrayList<>();
        final List<VerificationDecision> decisions = new ArrayList<>();

        @Override
        public void onClassificationChanged(String sessionId, Classification previous, Classification current) {
            transitions.add(current);
        }

        @Override
        public void onFlagRaised(String sessionId, AnomalyFlag flag) {
            flags.add(flag.getType());
        }

        @Override
        public void onDecision(String sessionId, VerificationDecision decision) {
            decisions.add(decision);
        }
    }

    private TrackingSession adjustableSession(List<AdjustableScorer> scorers) {
        ScoringConfig scoringConfig = new ScoringConfig();
        for (Channel channel : Channel.values()) {
            scorers.add(new AdjustableScorer(channel));
        }
        TrackingSession adjustable = TestDataFactory.sessionFactory(clock, scoringConfig, new VerificationConfig(),
                new AnomalyConfig(), TestDataFactory.fusionEngine(new ArrayList<>(scorers), scoringConfig))
                .create("s-4", null, null);
        adjustable.start();
        return adjustable;
    }

    private static void setAll(List<AdjustableScorer> scorers, double value) {
        scorers.forEach(s -> s.value = value);
    }

    @Test
    void classificationNotifications_areEdgeTriggered() {
        List<AdjustableScorer> scorers = new ArrayList<>();
        TrackingSession adjustable = adjustableSession(scorers);
        RecordingListener listener = new RecordingListener();
        adjustable.addListener(listener);

        setAll(scorers, 0.9);
        for (int i = 0; i < 5; i++) {
            adjustable.observe(keyDown(T0 + 1_000 + i * 300L));
            adjustable.tick();
        }
        setAll(scorers, 0.1);
        for (int i = 0; i < 5; i++) {
            adjustable.observe(keyDown(T0 + 3_000 + i * 300L));
            adjustable.tick();
        }

        assertThat(listener.transitions).containsExactly(Classification.HUMAN, Classification.BOT);
        assertThat(listener.flags).containsExactly("bot_behavior_detected");
    }

    @Test
    void failingListener_doesNotStopOthersOrCorruptState() {
        List<AdjustableScorer> scorers = new ArrayList<>();
        TrackingSession adjustable = adjustableSession(scorers);
        adjustable.addListener(new SessionListener() {
            @Override
            public void onFlagRaised(String sessionId, AnomalyFlag flag) {
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onDecision(String sessionId, VerificationDecision decision) {
                throw new IllegalStateException("listener bug");
            }
        });
        RecordingListener recorder = new RecordingListener();
        adjustable.addListener(recorder);

        adjustable.raiseFlag("paste_detected", null);
        VerificationDecision decision = adjustable.decide(null);

        assertThat(recorder.flags).containsExactly("paste_detected");
        assertThat(recorder.decisions).containsExactly(decision);
        assertThat(adjustable.getFlagCount()).isEqualTo(1);
    }

    @Test
    void status_reportsCompositeScore() {
        observeHumanSession();
        clock.setMillis(T0 + 12_000);

        VerificationStatus status = session.status();

        // 0.98*100 + 0.78*20 + 0 + 5, clamped
        assertThat(status.getScore()).isEqualTo(100.0);
        assertThat(status.isVerified()).isTrue();
        assertThat(status.getSessionTimeMs()).isEqualTo(12_000L);
    }
}
