package com.formshield.behavior.controller;

import com.formshield.behavior.model.AnalysisSnapshot;
import com.formshield.behavior.model.AnomalyFlag;
import com.formshield.behavior.model.DecisionRequest;
import com.formshield.behavior.model.DecisionResponse;
import com.formshield.behavior.model.EnvironmentReport;
import com.formshield.behavior.model.EventBatchResult;
import com.formshield.behavior.model.FlagRequest;
import com.formshield.behavior.model.InteractionEvent;
import com.formshield.behavior.model.ScoreResponse;
import com.formshield.behavior.model.SessionResponse;
import com.formshield.behavior.model.SessionStartRequest;
import com.formshield.behavior.model.VerificationStatus;
import com.formshield.behavior.service.BehaviorSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Sessions", description = "Track form interaction sessions, query their scores and decide submissions")
public class SessionController {

    private final BehaviorSessionService sessionService;

    public SessionController(BehaviorSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Operation(summary = "Start a tracking session",
            description = "Creates a session and starts tracking. The optional environment report runs the " +
                    "setup-time automation checks (webdriver, PhantomJS, user agent, languages, viewport).")
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@RequestBody(required = false) SessionStartRequest request) {
        SessionResponse response = sessionService.createSession(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Submit interaction events",
            description = "Routes a batch of events into the session's channel accumulators. Events with unknown " +
                    "kinds or missing payload fields are ignored. A timestamp of 0 means receive time.")
    @PostMapping("/{sessionId}/events")
    public ResponseEntity<?> observe(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @RequestBody List<InteractionEvent> events) {
        if (events == null) {
            return badRequest("events must be an array", "events");
        }
        EventBatchResult result = sessionService.observe(sessionId, events);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(result);
    }

    @Operation(summary = "Replace the environment report",
            description = "Runs setup checks if none ran yet and re-runs the devtools size heuristic.")
    @PutMapping("/{sessionId}/environment")
    public ResponseEntity<VerificationStatus> updateEnvironment(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @RequestBody EnvironmentReport environment) {
        VerificationStatus status = sessionService.updateEnvironment(sessionId, environment);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @Operation(summary = "Raise an anomaly flag",
            description = "Records a flag detected by a collaborator. Unknown flag types receive the default penalty. "
                    + "Stopped sessions reject flags with 409.")
    @PostMapping("/{sessionId}/flags")
    public ResponseEntity<?> raiseFlag(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @RequestBody FlagRequest request) {
        if (request == null || request.getType() == null || request.getType().isBlank()) {
            return badRequest("type is required", "type");
        }
        AnomalyFlag flag;
        try {
            flag = sessionService.raiseFlag(sessionId, request);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "field", "sessionId"));
        }
        if (flag == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(flag);
    }

    @Operation(summary = "Stop tracking", description = "Further events are ignored; queries keep working.")
    @PostMapping("/{sessionId}/stop")
    public ResponseEntity<SessionResponse> stop(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        SessionResponse response = sessionService.stop(sessionId);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Reset a session",
            description = "Clears all accumulated evidence, flags and the verification level.")
    @PostMapping("/{sessionId}/reset")
    public ResponseEntity<SessionResponse> reset(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        SessionResponse response = sessionService.reset(sessionId);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Discard a session")
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> discard(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        if (!sessionService.discard(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Get the current score and classification")
    @GetMapping("/{sessionId}/score")
    public ResponseEntity<ScoreResponse> score(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        ScoreResponse response = sessionService.score(sessionId);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get the full analysis snapshot",
            description = "Channel scores, raw feature summaries, classification, confidence, flag count and duration.")
    @GetMapping("/{sessionId}/analysis")
    public ResponseEntity<AnalysisSnapshot> analysis(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        AnalysisSnapshot snapshot = sessionService.analysis(sessionId);
        if (snapshot == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    @Operation(summary = "Get the verification status")
    @GetMapping("/{sessionId}/status")
    public ResponseEntity<VerificationStatus> status(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        VerificationStatus status = sessionService.status(sessionId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @Operation(summary = "Force a re-evaluation", description = "Recomputes score, confidence and level, returns the status.")
    @PostMapping("/{sessionId}/refresh")
    public ResponseEntity<VerificationStatus> refresh(@Parameter(description = "Session ID") @PathVariable String sessionId) {
        VerificationStatus status = sessionService.refresh(sessionId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @Operation(summary = "Decide a form submission",
            description = "Runs the ordered admission checks (honeypot, tracking time, fill time, pointer movement, " +
                    "bot classification) and then the verification level. Allowed decisions carry a token.")
    @PostMapping("/{sessionId}/decision")
    public ResponseEntity<DecisionResponse> decide(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @RequestBody(required = false) DecisionRequest request) {
        String honeypotValue = request != null ? request.getHoneypotValue() : null;
        DecisionResponse response = sessionService.decide(sessionId, honeypotValue);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
