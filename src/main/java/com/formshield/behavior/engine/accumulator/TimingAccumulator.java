package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.EventKind;
import com.formshield.behavior.model.TimingFeatures;

import java.util.EnumMap;
import java.util.Map;

/**
 * Session start, first qualifying interaction, and the first-occurrence delay of each interaction kind.
 */
public class TimingAccumulator {

    private final long sessionStart;
    private final Map<EventKind, Long> firstOccurrenceDelays = new EnumMap<>(EventKind.class);
    private Long firstInteractionAt;

    public TimingAccumulator(long sessionStart) {
        this.sessionStart = sessionStart;
    }

    /**
     * @return true if this was the first qualifying interaction of the session
     */
    public boolean recordInteraction(EventKind kind, long timestamp) {
        long delay = Math.max(0L, timestamp - sessionStart);
        firstOccurrenceDelays.putIfAbsent(kind, delay);
        if (firstInteractionAt == null) {
            firstInteractionAt = timestamp;
            return true;
        }
        return false;
    }

    public Long getFirstInteractionAt() {
        return firstInteractionAt;
    }

    public long getSessionStart() {
        return sessionStart;
    }

    public TimingFeatures features() {
        int n = firstOccurrenceDelays.size();
        double variance = 0.0;
        if (n > 0) {
            double mean = 0.0;
            for (long delay : firstOccurrenceDelays.values()) {
                mean += delay;
            }
            mean /= n;
            for (long delay : firstOccurrenceDelays.values()) {
                variance += (delay - mean) * (delay - mean);
            }
            variance /= n;
        }

        return TimingFeatures.builder()
                .firstInteractionDelayMs(firstInteractionAt == null
                        ? null : Math.max(0L, firstInteractionAt - sessionStart))
                .delayCount(n)
                .delayVariance(variance)
                .build();
    }
}
