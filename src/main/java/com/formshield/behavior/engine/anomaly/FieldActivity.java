package com.formshield.behavior.engine.anomaly;

import lombok.Getter;

/**
 * Focus and input counts for one form field.
 */
@Getter
public class FieldActivity {

    private final long firstFocusAt;
    private int focusCount;
    private int inputCount;
    private long lastActivityAt;

    FieldActivity(long firstFocusAt) {
        this.firstFocusAt = firstFocusAt;
        this.lastActivityAt = firstFocusAt;
    }

    void focused(long timestamp) {
        focusCount++;
        lastActivityAt = Math.max(lastActivityAt, timestamp);
    }

    void input(long timestamp) {
        inputCount++;
        lastActivityAt = Math.max(lastActivityAt, timestamp);
    }
}
