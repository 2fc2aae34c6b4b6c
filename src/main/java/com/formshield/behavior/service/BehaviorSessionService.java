package com.formshield.behavior.service;

import com.formshield.behavior.config.MetricsConfig;
import com.formshield.behavior.config.VerificationConfig;
import com.formshield.behavior.model.AnalysisSnapshot;
import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.DecisionResponse;
import com.formshield.behavior.model.EnvironmentReport;
import com.formshield.behavior.model.EventBatchResult;
import com.formshield.behavior.model.FlagRequest;
import com.formshield.behavior.model.InteractionEvent;
import com.formshield.behavior.model.ScoreResponse;
import com.formshield.behavior.model.SessionResponse;
import com.formshield.behavior.model.SessionStartRequest;
import com.formshield.behavior.model.VerificationDecision;
import com.formshield.behavior.model.VerificationStatus;
import com.formshield.behavior.session.TrackingSession;
import com.formshield.behavior.session.TrackingSessionFactory;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry and lifecycle of tracking sessions.
 *
 * Methods addressing a session by id return null when the session does not exist (or has expired).
 * The periodic sweep ticks every tracking session and discards sessions idle for longer than the TTL.
 */
@Service
public class BehaviorSessionService {

    private static final Logger log = LoggerFactory.getLogger(BehaviorSessionService.class);

    private final TrackingSessionFactory sessionFactory;
    private final SessionEventPublisher eventPublisher;
    private final VerificationTokenService tokenService;
    private final VerificationConfig verificationConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ConcurrentHashMap<String, TrackingSession> sessions = new ConcurrentHashMap<>();

    public BehaviorSessionService(TrackingSessionFactory sessionFactory,
                                  SessionEventPublisher eventPublisher,
                                  VerificationTokenService tokenService,
                                  VerificationConfig verificationConfig,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.sessionFactory = sessionFactory;
        this.eventPublisher = eventPublisher;
        this.tokenService = tokenService;
        this.verificationConfig = verificationConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public SessionResponse createSession(SessionStartRequest request) {
        String id = UUID.randomUUID().toString();
        Long startedAt = request != null ? request.getStartedAt() : null;
        EnvironmentReport environment = request != null ? request.getEnvironment() : null;

        TrackingSession session = sessionFactory.create(id, startedAt, environment);
        session.addListener(eventPublisher);
        sessions.put(id, session);
        session.start();
        metricsConfig.updateActiveSessions(sessions.size());

        return toResponse(session);
    }

    public TrackingSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public EventBatchResult observe(String sessionId, List<InteractionEvent> events) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        session.observeAll(events);
        return EventBatchResult.builder()
                .sessionId(sessionId)
                .received(events == null ? 0 : events.size())
                .tracking(session.isTracking())
                .build();
    }

    public VerificationStatus updateEnvironment(String sessionId, EnvironmentReport environment) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        session.updateEnvironment(environment);
        return session.status();
    }

    public AnomalyFlag raiseFlag(String sessionId, FlagRequest request) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        AnomalyFlag flag = session.raiseFlag(request.getType(), request.getData());
        if (flag == null) {
            throw new IllegalStateException("Session " + sessionId + " is not tracking");
        }
        return flag;
    }

    public SessionResponse stop(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        session.stop();
        return toResponse(session);
    }

    public SessionResponse reset(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        session.reset();
        return toResponse(session);
    }

    /**
     * Stop and forget a session.
     *
     * @return false if no such session existed
     */
    public boolean discard(String sessionId) {
        TrackingSession session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.stop();
        metricsConfig.updateActiveSessions(sessions.size());
        log.info("Session {} discarded", sessionId);
        return true;
    }

    public ScoreResponse score(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        return ScoreResponse.builder()
                .sessionId(sessionId)
                .score(session.currentScore())
                .classification(session.classification())
                .build();
    }

    public AnalysisSnapshot analysis(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        return session == null ? null : session.snapshot();
    }

    public VerificationStatus status(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        return session == null ? null : session.status();
    }

    public VerificationStatus refresh(String sessionId) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        session.refresh();
        return session.status();
    }

    /**
     * Run the final decision for a submission. An allowed decision carries a verification token.
     */
    @Observed(name = "behavior.decide", contextualName = "decide-submission")
    public DecisionResponse decide(String sessionId, String honeypotValue) {
        TrackingSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }

        VerificationDecision decision = session.decide(honeypotValue);
        VerificationStatus status = session.status();

        String token = null;
        if (decision.isAllow()) {
            token = tokenService.encode(tokenService.issue(decision, status.getSessionTimeMs()));
        }

        return DecisionResponse.builder()
                .decision(decision)
                .token(token)
                .sessionTimeMs(status.getSessionTimeMs())
                .interactionCount(session.fieldInteractionCount())
                .humanConfidence(status.getConfidence())
                .verificationLevel(status.getLevel())
                .build();
    }

    /**
     * Periodic sweep: re-evaluates every tracking session and drops sessions idle past the TTL.
     */
    @Scheduled(fixedRateString = "${behavior.scoring.tick-interval-ms:1000}")
    @Observed(name = "behavior.tick", contextualName = "tick-sessions")
    public void tickAll() {
        long now = clock.millis();
        long ttl = verificationConfig.getSessionTtlMs();
        int expired = 0;

        for (TrackingSession session : sessions.values()) {
            if (now - session.getLastActivityAt() > ttl) {
                if (sessions.remove(session.getId(), session)) {
                    session.stop();
                    expired++;
                    log.info("Session {} expired after {}ms idle", session.getId(), now - session.getLastActivityAt());
                }
                continue;
            }
            try {
                session.tick();
            } catch (Exception e) {
                log.error("Tick failed for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }

        metricsConfig.updateActiveSessions(sessions.size());
        if (expired > 0) {
            log.info("Session sweep complete: active={}, expired={}", sessions.size(), expired);
        }
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private static SessionResponse toResponse(TrackingSession session) {
        return SessionResponse.builder()
                .sessionId(session.getId())
                .startedAt(session.getStartedAt())
                .tracking(session.isTracking())
                .build();
    }
}
