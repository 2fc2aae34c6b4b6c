package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.ClickFeatures;

public class ClickAccumulator {

    private final RollingWindow intervals;
    private final double consistencyToleranceMs;

    private Long lastClickAt;
    private long clickCount;

    public ClickAccumulator(int capacity, double consistencyToleranceMs) {
        this.intervals = new RollingWindow(capacity);
        this.consistencyToleranceMs = consistencyToleranceMs;
    }

    public void push(long timestamp) {
        clickCount++;
        if (lastClickAt != null) {
            intervals.add(Math.max(0L, timestamp - lastClickAt));
        }
        lastClickAt = timestamp;
    }

    public ClickFeatures features() {
        int n = intervals.size();
        double mean = intervals.mean();
        double consistency = n == 0 ? 0.0
                : (double) intervals.countWithin(mean, consistencyToleranceMs) / n;

        return ClickFeatures.builder()
                .clickCount(clickCount)
                .intervalCount(n)
                .meanInterval(mean)
                .intervalVariance(intervals.variance())
                .consistencyRatio(consistency)
                .build();
    }
}
