package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.TouchFeatures;
import com.formshield.behavior.model.TouchPoint;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TouchAccumulatorTest {

    private static List<TouchPoint> at(double x, double y) {
        return List.of(TouchPoint.builder().id(0).x(x).y(y).build());
    }

    @Test
    void noEvents_emptyFeatures() {
        TouchFeatures f = new TouchAccumulator(200).features();

        assertThat(f.getEventCount()).isZero();
        assertThat(f.getSwipeCount()).isZero();
        assertThat(f.isMultiTouch()).isFalse();
    }

    @Test
    void swipeVelocity_measuredBetweenConsecutiveMoves() {
        TouchAccumulator acc = new TouchAccumulator(200);
        acc.push(TouchAccumulator.Phase.START, at(0, 0), 1000);
        acc.push(TouchAccumulator.Phase.MOVE, at(0, 0), 1010);
        acc.push(TouchAccumulator.Phase.MOVE, at(30, 40), 1060);
        acc.push(TouchAccumulator.Phase.END, Collections.emptyList(), 1070);

        TouchFeatures f = acc.features();

        assertThat(f.getEventCount()).isEqualTo(4);
        assertThat(f.getSwipeCount()).isEqualTo(1);
        // 50px in 50ms
        assertThat(f.getAverageSwipeVelocity()).isCloseTo(1000.0, within(1e-9));
        assertThat(acc.getTotalSwipeDistance()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void newGesture_doesNotJoinPreviousOne() {
        TouchAccumulator acc = new TouchAccumulator(200);
        acc.push(TouchAccumulator.Phase.MOVE, at(0, 0), 1000);
        acc.push(TouchAccumulator.Phase.END, null, 1010);
        acc.push(TouchAccumulator.Phase.START, at(500, 500), 1100);
        acc.push(TouchAccumulator.Phase.MOVE, at(500, 500), 1110);

        assertThat(acc.features().getSwipeCount()).isZero();
    }

    @Test
    void twoContacts_setsMultiTouch() {
        TouchAccumulator acc = new TouchAccumulator(200);
        acc.push(TouchAccumulator.Phase.START, List.of(
                TouchPoint.builder().id(0).x(10).y(10).build(),
                TouchPoint.builder().id(1).x(80).y(90).build()), 1000);

        assertThat(acc.features().isMultiTouch()).isTrue();
    }

    @Test
    void nullContacts_areSkipped() {
        TouchAccumulator acc = new TouchAccumulator(200);
        acc.push(TouchAccumulator.Phase.START, Arrays.asList(null, TouchPoint.builder().id(1).x(0).y(0).build()), 1000);
        acc.push(TouchAccumulator.Phase.MOVE, Arrays.asList(null, TouchPoint.builder().id(1).x(0).y(0).build()), 1010);
        acc.push(TouchAccumulator.Phase.MOVE, Arrays.asList(TouchPoint.builder().id(1).x(30).y(40).build(), null), 1060);
        acc.push(TouchAccumulator.Phase.MOVE, Collections.singletonList(null), 1070);

        TouchFeatures f = acc.features();

        assertThat(f.getEventCount()).isEqualTo(4);
        assertThat(f.isMultiTouch()).isFalse();
        assertThat(f.getSwipeCount()).isEqualTo(1);
        assertThat(acc.getTotalSwipeDistance()).isCloseTo(50.0, within(1e-9));
    }
}
