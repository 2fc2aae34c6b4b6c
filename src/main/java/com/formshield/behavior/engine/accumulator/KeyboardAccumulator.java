package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.KeyboardFeatures;

/**
 * Typing rhythm. An inter-keystroke interval is the gap between a key release and the next key press,
 * so held keys and rollover do not distort it.
 */
public class KeyboardAccumulator {

    private final RollingWindow intervals;
    private final double naturalPauseMs;

    private Long lastKeyUpAt;
    private boolean lastWasKeyUp;
    private long keyPressCount;

    public KeyboardAccumulator(int capacity, double naturalPauseMs) {
        this.intervals = new RollingWindow(capacity);
        this.naturalPauseMs = naturalPauseMs;
    }

    public void keyDown(long timestamp) {
        keyPressCount++;
        if (lastWasKeyUp && lastKeyUpAt != null) {
            intervals.add(Math.max(0L, timestamp - lastKeyUpAt));
        }
        lastWasKeyUp = false;
    }

    public void keyUp(long timestamp) {
        keyPressCount++;
        lastKeyUpAt = timestamp;
        lastWasKeyUp = true;
    }

    public KeyboardFeatures features() {
        return KeyboardFeatures.builder()
                .keyPressCount(keyPressCount)
                .intervalCount(intervals.size())
                .meanInterval(intervals.mean())
                .intervalVariance(intervals.variance())
                .naturalPauseCount(intervals.countAbove(naturalPauseMs))
                .build();
    }
}
