package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.PointerFeatures;

import java.util.ArrayDeque;

/**
 * Rolling pointer history with incrementally maintained movement aggregates.
 *
 * Per step between consecutive positions:
 *   velocity     = distance / elapsed seconds
 *   acceleration = (velocity - previous velocity) / elapsed seconds
 *   deviation    = absolute heading change at the middle point of the last three positions, in [0, pi]
 *
 * Linearity over the retained window = 1 - (sum of deviations / sum of step distances), clamped to [0, 1].
 * A straight path has no heading change and scores 1.0.
 *
 * Every aggregate is kept in a {@link RollingWindow} of the same capacity as the position buffer,
 * so pushing is O(1) and no history beyond the window is ever rescanned.
 */
public class PointerAccumulator {

    private final int capacity;
    private final int minSamples;

    private final ArrayDeque<Sample> positions;
    private final RollingWindow velocities;
    private final RollingWindow accelerations;
    private final RollingWindow headingDeviations;
    private final RollingWindow stepDistances;

    private Sample last;
    private Sample beforeLast;
    private Double lastVelocity;

    private long movementCount;
    private double totalDistance;
    private double maxVelocity;

    public PointerAccumulator(int capacity, int minSamples) {
        this.capacity = capacity;
        this.minSamples = minSamples;
        this.positions = new ArrayDeque<>(Math.min(capacity, 256));
        this.velocities = new RollingWindow(capacity);
        this.accelerations = new RollingWindow(capacity);
        this.headingDeviations = new RollingWindow(capacity);
        this.stepDistances = new RollingWindow(capacity);
    }

    public void push(double x, double y, long timestamp) {
        Sample current = new Sample(x, y, timestamp);
        movementCount++;

        if (last != null) {
            double distance = Math.hypot(x - last.x, y - last.y);
            totalDistance += distance;

            // Out-of-order timestamps contribute distance but no velocity sample
            long elapsedMs = Math.max(0L, timestamp - last.timestamp);
            if (elapsedMs > 0) {
                double seconds = elapsedMs / 1000.0;
                double velocity = distance / seconds;
                if (lastVelocity != null) {
                    accelerations.add((velocity - lastVelocity) / seconds);
                }
                velocities.add(velocity);
                lastVelocity = velocity;
                if (velocity > maxVelocity) {
                    maxVelocity = velocity;
                }
            }

            if (beforeLast != null) {
                headingDeviations.add(headingChange(beforeLast, last, current));
                stepDistances.add(distance);
            }
        }

        positions.addLast(current);
        if (positions.size() > capacity) {
            positions.removeFirst();
        }
        beforeLast = last;
        last = current;
    }

    public PointerFeatures features() {
        int retained = positions.size();
        boolean sufficient = retained >= minSamples;

        PointerFeatures.PointerFeaturesBuilder builder = PointerFeatures.builder()
                .sampleCount(retained)
                .movementCount(movementCount)
                .sufficient(sufficient)
                .totalDistance(totalDistance)
                .maxVelocity(maxVelocity);

        if (!sufficient) {
            return builder.build();
        }

        return builder
                .averageVelocity(velocities.mean())
                .velocityVariance(velocities.variance())
                .accelerationVariance(accelerations.variance())
                .linearity(linearity())
                .build();
    }

    public long getMovementCount() {
        return movementCount;
    }

    private double linearity() {
        if (positions.size() < 3) {
            return 0.0;
        }
        double distance = stepDistances.sum();
        if (distance <= 0) {
            return 0.0;
        }
        double score = 1.0 - headingDeviations.sum() / distance;
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static double headingChange(Sample p1, Sample p2, Sample p3) {
        double dx1 = p2.x - p1.x;
        double dy1 = p2.y - p1.y;
        double dx2 = p3.x - p2.x;
        double dy2 = p3.y - p2.y;
        // A zero-length step has no heading
        if ((dx1 == 0 && dy1 == 0) || (dx2 == 0 && dy2 == 0)) {
            return 0.0;
        }
        double deviation = Math.abs(Math.atan2(dy2, dx2) - Math.atan2(dy1, dx1));
        return deviation > Math.PI ? 2 * Math.PI - deviation : deviation;
    }

    private static final class Sample {
        final double x;
        final double y;
        final long timestamp;

        Sample(double x, double y, long timestamp) {
            this.x = x;
            this.y = y;
            this.timestamp = timestamp;
        }
    }
}
