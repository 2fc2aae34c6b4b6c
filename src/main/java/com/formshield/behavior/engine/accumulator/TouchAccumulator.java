package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.TouchFeatures;
import com.formshield.behavior.model.TouchPoint;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Touch snapshots and swipe statistics. Swipe velocity is measured on the first contact
 * between consecutive move samples of the same gesture.
 */
public class TouchAccumulator {

    public enum Phase { START, MOVE, END }

    private final int capacity;
    private final ArrayDeque<Snapshot> snapshots;
    private final RollingWindow swipeVelocities;

    private Snapshot lastMove;
    private long eventCount;
    private boolean multiTouch;
    private double totalSwipeDistance;

    public TouchAccumulator(int capacity) {
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(Math.min(capacity, 64));
        this.swipeVelocities = new RollingWindow(capacity);
    }

    public void push(Phase phase, List<TouchPoint> touches, long timestamp) {
        // Null entries in the contact list are dropped
        int contacts = 0;
        TouchPoint first = null;
        if (touches != null) {
            for (TouchPoint touch : touches) {
                if (touch == null) {
                    continue;
                }
                if (first == null) {
                    first = touch;
                }
                contacts++;
            }
        }
        eventCount++;
        if (contacts >= 2) {
            multiTouch = true;
        }

        Snapshot snapshot = first != null
                ? new Snapshot(phase, contacts, first.getX(), first.getY(), timestamp)
                : new Snapshot(phase, 0, 0, 0, timestamp);
        snapshots.addLast(snapshot);
        if (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }

        switch (phase) {
            case START:
            case END:
                lastMove = null;
                break;
            case MOVE:
                if (contacts == 0) {
                    break;
                }
                if (lastMove != null) {
                    double distance = Math.hypot(snapshot.x - lastMove.x, snapshot.y - lastMove.y);
                    long elapsedMs = Math.max(0L, timestamp - lastMove.timestamp);
                    totalSwipeDistance += distance;
                    if (elapsedMs > 0) {
                        swipeVelocities.add(distance / (elapsedMs / 1000.0));
                    }
                }
                lastMove = snapshot;
                break;
            default:
                break;
        }
    }

    public TouchFeatures features() {
        return TouchFeatures.builder()
                .eventCount(eventCount)
                .swipeCount(swipeVelocities.size())
                .multiTouch(multiTouch)
                .averageSwipeVelocity(swipeVelocities.mean())
                .swipeVelocityVariance(swipeVelocities.variance())
                .build();
    }

    public double getTotalSwipeDistance() {
        return totalSwipeDistance;
    }

    private static final class Snapshot {
        final Phase phase;
        final int contacts;
        final double x;
        final double y;
        final long timestamp;

        Snapshot(Phase phase, int contacts, double x, double y, long timestamp) {
            this.phase = phase;
            this.contacts = contacts;
            this.x = x;
            this.y = y;
            this.timestamp = timestamp;
        }
    }
}
