package com.formshield.behavior.engine.anomaly;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.model.FlagType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Setup-time automation checks over an {@link EnvironmentProbe}, plus the devtools size heuristic
 * that sessions re-run on every tick.
 */
@Component
public class EnvironmentInspector {

    private static final List<String> HEADLESS_MARKERS = List.of("HeadlessChrome", "PhantomJS");

    private final AnomalyConfig config;

    public EnvironmentInspector(AnomalyConfig config) {
        this.config = config;
    }

    /**
     * Run the one-shot checks: automation markers, user agent, languages and viewport ratio.
     * A null probe yields no detections.
     */
    public List<Detection> inspectSetup(EnvironmentProbe probe) {
        List<Detection> detections = new ArrayList<>();
        if (probe == null) {
            return detections;
        }

        if (probe.isWebdriver()) {
            detections.add(Detection.of(FlagType.WEBDRIVER_DETECTED));
        }
        if (probe.isPhantom()) {
            detections.add(Detection.of(FlagType.PHANTOM_DETECTED));
        }

        String userAgent = probe.getUserAgent();
        if (isSuspiciousUserAgent(userAgent)) {
            detections.add(Detection.of(FlagType.SUSPICIOUS_USER_AGENT,
                    Map.of("userAgent", String.valueOf(userAgent))));
        }

        List<String> languages = probe.getLanguages();
        if (languages == null || languages.isEmpty()) {
            detections.add(Detection.of(FlagType.MISSING_LANGUAGES));
        }

        Integer width = probe.getInnerWidth();
        Integer height = probe.getInnerHeight();
        if (width != null && height != null && height > 0) {
            double ratio = (double) width / height;
            if (ratio < config.getMinViewportRatio() || ratio > config.getMaxViewportRatio()) {
                detections.add(Detection.of(FlagType.UNUSUAL_VIEWPORT_RATIO, Map.of("ratio", ratio)));
            }
        }

        return detections;
    }

    /**
     * Docked devtools shrink the inner window: outer minus inner beyond the threshold in either
     * dimension counts as open. Missing dimensions count as closed.
     */
    public boolean isDevToolsOpen(EnvironmentProbe probe) {
        if (probe == null) {
            return false;
        }
        int threshold = config.getDevToolsThresholdPx();
        return exceeds(probe.getOuterHeight(), probe.getInnerHeight(), threshold)
                || exceeds(probe.getOuterWidth(), probe.getInnerWidth(), threshold);
    }

    static boolean isSuspiciousUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank() || "undefined".equals(userAgent)) {
            return true;
        }
        return HEADLESS_MARKERS.stream().anyMatch(userAgent::contains);
    }

    private static boolean exceeds(Integer outer, Integer inner, int threshold) {
        return outer != null && inner != null && outer - inner > threshold;
    }
}
