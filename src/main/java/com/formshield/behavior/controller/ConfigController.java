package com.formshield.behavior.controller;

import com.formshield.behavior.config.ScoringConfig;
import com.formshield.behavior.config.VerificationConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (thresholds, channel weights, verification)")
public class ConfigController {

    private final ScoringConfig scoringConfig;
    private final VerificationConfig verificationConfig;

    public ConfigController(ScoringConfig scoringConfig, VerificationConfig verificationConfig) {
        this.scoringConfig = scoringConfig;
        this.verificationConfig = verificationConfig;
    }

    // ── Thresholds ──

    @Operation(summary = "Get classification thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        ScoringConfig.Thresholds t = scoringConfig.getThresholds();
        return ResponseEntity.ok(Map.of(
                "botThreshold", t.getBot(),
                "humanThreshold", t.getHuman(),
                "suspiciousLinearityThreshold", t.getSuspiciousLinearity()
        ));
    }

    @Operation(summary = "Update classification thresholds",
            description = "Changes apply on the next re-evaluation but reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        ScoringConfig.Thresholds current = scoringConfig.getThresholds();
        double bot = toDouble(body, "botThreshold", current.getBot());
        double human = toDouble(body, "humanThreshold", current.getHuman());
        double linearity = toDouble(body, "suspiciousLinearityThreshold", current.getSuspiciousLinearity());

        if (bot < 0 || bot > 1) return badRequest("botThreshold must be in [0, 1]", "botThreshold");
        if (human < 0 || human > 1) return badRequest("humanThreshold must be in [0, 1]", "humanThreshold");
        if (bot >= human) return badRequest("botThreshold must be less than humanThreshold", "botThreshold");
        if (linearity < 0 || linearity > 1) {
            return badRequest("suspiciousLinearityThreshold must be in [0, 1]", "suspiciousLinearityThreshold");
        }

        scoringConfig.updateThresholds(bot, human, linearity);

        return getThresholds();
    }

    // ── Channel weights ──

    @Operation(summary = "Get channel weights")
    @GetMapping("/weights")
    public ResponseEntity<Map<String, Object>> getWeights() {
        ScoringConfig.Weights w = scoringConfig.getWeights();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pointer", w.getPointer());
        body.put("touch", w.getTouch());
        body.put("click", w.getClick());
        body.put("keyboard", w.getKeyboard());
        body.put("timing", w.getTiming());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update channel weights",
            description = "All five weights must be >= 0 and sum to 1.0. Changes reset on restart.")
    @PutMapping("/weights")
    public ResponseEntity<?> updateWeights(@RequestBody Map<String, Object> body) {
        ScoringConfig.Weights current = scoringConfig.getWeights();
        ScoringConfig.Weights updated = new ScoringConfig.Weights();
        updated.setPointer(toDouble(body, "pointer", current.getPointer()));
        updated.setTouch(toDouble(body, "touch", current.getTouch()));
        updated.setClick(toDouble(body, "click", current.getClick()));
        updated.setKeyboard(toDouble(body, "keyboard", current.getKeyboard()));
        updated.setTiming(toDouble(body, "timing", current.getTiming()));

        if (updated.getPointer() < 0) return badRequest("pointer must be >= 0", "pointer");
        if (updated.getTouch() < 0) return badRequest("touch must be >= 0", "touch");
        if (updated.getClick() < 0) return badRequest("click must be >= 0", "click");
        if (updated.getKeyboard() < 0) return badRequest("keyboard must be >= 0", "keyboard");
        if (updated.getTiming() < 0) return badRequest("timing must be >= 0", "timing");
        if (Math.abs(updated.sum() - 1.0) > ScoringConfig.WEIGHT_SUM_EPSILON) {
            return badRequest(String.format("weights must sum to 1.0 (got %.6f)", updated.sum()), "weights");
        }

        scoringConfig.setWeights(updated);
        return getWeights();
    }

    // ── Verification ──

    @Operation(summary = "Get verification requirements")
    @GetMapping("/verification")
    public ResponseEntity<Map<String, Object>> getVerification() {
        return ResponseEntity.ok(Map.of(
                "minTrackingTimeMs", verificationConfig.getMinTrackingTimeMs(),
                "minFillTimeMs", verificationConfig.getMinFillTimeMs(),
                "requirePointerMovement", verificationConfig.isRequirePointerMovement(),
                "minPointerMovements", verificationConfig.getMinPointerMovements()
        ));
    }

    @Operation(summary = "Update verification requirements",
            description = "Changes apply to the next decision but reset on restart.")
    @PutMapping("/verification")
    public ResponseEntity<?> updateVerification(@RequestBody Map<String, Object> body) {
        long minTracking = toLong(body, "minTrackingTimeMs", verificationConfig.getMinTrackingTimeMs());
        long minFill = toLong(body, "minFillTimeMs", verificationConfig.getMinFillTimeMs());
        boolean requirePointer = toBoolean(body, "requirePointerMovement",
                verificationConfig.isRequirePointerMovement());
        int minMovements = toInt(body, "minPointerMovements", verificationConfig.getMinPointerMovements());

        if (minTracking < 0) return badRequest("minTrackingTimeMs must be >= 0", "minTrackingTimeMs");
        if (minFill < 0) return badRequest("minFillTimeMs must be >= 0", "minFillTimeMs");
        if (minMovements < 0) return badRequest("minPointerMovements must be >= 0", "minPointerMovements");

        verificationConfig.setMinTrackingTimeMs(minTracking);
        verificationConfig.setMinFillTimeMs(minFill);
        verificationConfig.setRequirePointerMovement(requirePointer);
        verificationConfig.setMinPointerMovements(minMovements);

        return getVerification();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
