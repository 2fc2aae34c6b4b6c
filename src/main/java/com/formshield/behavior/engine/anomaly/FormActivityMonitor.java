package com.formshield.behavior.engine.anomaly;

import com.formshield.behavior.config.AnomalyConfig;
import com.formshield.behavior.model.EventKind;
import com.formshield.behavior.model.FlagType;
import com.formshield.behavior.model.InteractionEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session form activity: field interactions, interaction counters and the event-time anomaly rules.
 *
 * Rules:
 *   fast_typing     - first input on a field within fastTypingMs of its first focus
 *   uniform_typing  - key-down to key-down interval in (0, uniformTypingMs)
 *   fast_clicking   - click to click interval below fastClickMs
 *   paste_detected  - any paste
 *   rapid_activity  - more than rapidActivityBurst interactions within rapidActivityWindowMs
 *                     of the page becoming visible again (once per return)
 *   honeypot_filled - first non-empty input into the honeypot field (once per session)
 *
 * Not thread-safe; the owning session serializes access.
 */
public class FormActivityMonitor {

    private final AnomalyConfig config;
    private final String honeypotFieldName;
    private final int maxTrackedFields;

    private final Map<String, FieldActivity> fields = new LinkedHashMap<>();

    private long pointerMovements;
    private long focusEvents;
    private long keystrokes;
    private String honeypotValue;

    private Long lastKeyDownAt;
    private Long lastClickAt;

    private Long visibleSince;
    private int burstCount;
    private boolean burstFlagged;
    private boolean honeypotFlagged;

    public FormActivityMonitor(AnomalyConfig config, String honeypotFieldName, int maxTrackedFields) {
        this.config = config;
        this.honeypotFieldName = honeypotFieldName;
        this.maxTrackedFields = maxTrackedFields;
    }

    /**
     * Record one event and return whatever it tripped. Events missing the fields a rule needs are ignored by that rule.
     */
    public List<Detection> record(InteractionEvent event, long timestamp) {
        EventKind kind = event.getKind();
        if (kind == null) {
            return Collections.emptyList();
        }

        List<Detection> detections = new ArrayList<>(1);
        switch (kind) {
            case POINTER_MOVE:
                if (event.getX() != null && event.getY() != null) {
                    pointerMovements++;
                }
                break;
            case CLICK:
                checkClick(timestamp, detections);
                break;
            case KEY_DOWN:
                checkKeyDown(timestamp, detections);
                break;
            case FOCUS:
                onFocus(event.getFieldName(), timestamp);
                break;
            case FIELD_INPUT:
                onFieldInput(event.getFieldName(), event.getValue(), timestamp, detections);
                break;
            case PASTE:
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("field", event.getFieldName());
                data.put("dataLength", event.getClipboardLength() == null ? 0 : event.getClipboardLength());
                detections.add(Detection.of(FlagType.PASTE_DETECTED, data));
                break;
            case VISIBILITY_CHANGE:
                onVisibilityChange(event.getHidden(), timestamp);
                break;
            default:
                break;
        }

        if (kind != EventKind.VISIBILITY_CHANGE && kind != EventKind.BLUR) {
            checkBurst(timestamp, detections);
        }
        return detections;
    }

    public long getPointerMovements() {
        return pointerMovements;
    }

    public long getFocusEvents() {
        return focusEvents;
    }

    public long getKeystrokes() {
        return keystrokes;
    }

    public int getFieldInteractionCount() {
        return fields.size();
    }

    public Map<String, FieldActivity> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Last value typed into the honeypot field, or null if it was never touched.
     */
    public String getHoneypotValue() {
        return honeypotValue;
    }

    private void onFocus(String fieldName, long timestamp) {
        if (fieldName == null || fieldName.isEmpty()) {
            return;
        }
        focusEvents++;
        FieldActivity activity = fields.get(fieldName);
        if (activity == null) {
            if (fields.size() >= maxTrackedFields) {
                return;
            }
            activity = new FieldActivity(timestamp);
            fields.put(fieldName, activity);
        }
        activity.focused(timestamp);
    }

    private void onFieldInput(String fieldName, String value, long timestamp, List<Detection> detections) {
        if (fieldName == null || fieldName.isEmpty()) {
            return;
        }
        keystrokes++;

        if (fieldName.equals(honeypotFieldName)) {
            honeypotValue = value;
            if (value != null && !value.isEmpty() && !honeypotFlagged) {
                honeypotFlagged = true;
                detections.add(Detection.of(FlagType.HONEYPOT_FILLED, Map.of("field", fieldName)));
            }
        }

        FieldActivity activity = fields.get(fieldName);
        if (activity == null) {
            return;
        }
        activity.input(timestamp);
        if (activity.getInputCount() == 1) {
            long sinceFocus = Math.max(0L, timestamp - activity.getFirstFocusAt());
            if (sinceFocus < config.getFastTypingMs()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("field", fieldName);
                data.put("timeSinceFocus", sinceFocus);
                detections.add(Detection.of(FlagType.FAST_TYPING, data));
            }
        }
    }

    private void checkKeyDown(long timestamp, List<Detection> detections) {
        if (lastKeyDownAt != null) {
            long interval = timestamp - lastKeyDownAt;
            if (interval > 0 && interval < config.getUniformTypingMs()) {
                detections.add(Detection.of(FlagType.UNIFORM_TYPING, Map.of("interval", interval)));
            }
        }
        lastKeyDownAt = timestamp;
    }

    private void checkClick(long timestamp, List<Detection> detections) {
        if (lastClickAt != null) {
            long interval = Math.max(0L, timestamp - lastClickAt);
            if (interval < config.getFastClickMs()) {
                detections.add(Detection.of(FlagType.FAST_CLICKING, Map.of("interval", interval)));
            }
        }
        lastClickAt = timestamp;
    }

    private void onVisibilityChange(Boolean hidden, long timestamp) {
        if (hidden == null) {
            return;
        }
        if (hidden) {
            visibleSince = null;
        } else {
            visibleSince = timestamp;
            burstCount = 0;
            burstFlagged = false;
        }
    }

    private void checkBurst(long timestamp, List<Detection> detections) {
        if (visibleSince == null || burstFlagged) {
            return;
        }
        if (timestamp - visibleSince > config.getRapidActivityWindowMs()) {
            visibleSince = null;
            return;
        }
        burstCount++;
        if (burstCount > config.getRapidActivityBurst()) {
            burstFlagged = true;
            detections.add(Detection.of(FlagType.RAPID_ACTIVITY_AFTER_FOCUS,
                    Map.of("interactions", burstCount, "timeWindow", config.getRapidActivityWindowMs())));
        }
    }
}
