package com.formshield.behavior.engine.accumulator;

import java.util.ArrayDeque;

/**
 * Fixed-capacity FIFO window of doubles with running sum and sum of squares,
 * so mean and population variance are O(1) regardless of history length.
 */
public class RollingWindow {

    private final int capacity;
    private final ArrayDeque<Double> values;
    private double sum;
    private double sumSquares;
    private long evictions;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(Math.min(capacity, 256));
    }

    public void add(double value) {
        if (values.size() == capacity) {
            double evicted = values.removeFirst();
            sum -= evicted;
            sumSquares -= evicted * evicted;
            // Re-derive the running sums once per full turnover to cap floating-point drift
            if (++evictions % capacity == 0) {
                resum();
            }
        }
        values.addLast(value);
        sum += value;
        sumSquares += value * value;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public double sum() {
        return sum;
    }

    public double mean() {
        return values.isEmpty() ? 0.0 : sum / values.size();
    }

    public double variance() {
        int n = values.size();
        if (n == 0) {
            return 0.0;
        }
        double mean = sum / n;
        return Math.max(0.0, sumSquares / n - mean * mean);
    }

    public int countWithin(double center, double tolerance) {
        int count = 0;
        for (double v : values) {
            if (Math.abs(v - center) < tolerance) {
                count++;
            }
        }
        return count;
    }

    public int countAbove(double threshold) {
        int count = 0;
        for (double v : values) {
            if (v > threshold) {
                count++;
            }
        }
        return count;
    }

    public void clear() {
        values.clear();
        sum = 0.0;
        sumSquares = 0.0;
        evictions = 0;
    }

    private void resum() {
        double s = 0.0;
        double sq = 0.0;
        for (double v : values) {
            s += v;
            sq += v * v;
        }
        sum = s;
        sumSquares = sq;
    }
}
