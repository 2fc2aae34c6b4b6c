package com.formshield.behavior.engine.accumulator;

import com.formshield.behavior.model.PointerFeatures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PointerAccumulatorTest {

    @Test
    void belowMinSamples_returnsNeutralFeatures() {
        PointerAccumulator acc = new PointerAccumulator(1000, 5);
        acc.push(0, 0, 1000);
        acc.push(10, 0, 1010);

        PointerFeatures f = acc.features();

        assertThat(f.isSufficient()).isFalse();
        assertThat(f.getSampleCount()).isEqualTo(2);
        assertThat(f.getLinearity()).isEqualTo(0.0);
        assertThat(f.getVelocityVariance()).isEqualTo(0.0);
        assertThat(f.getTotalDistance()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void straightLine_linearityIsOne() {
        PointerAccumulator acc = new PointerAccumulator(1000, 5);
        for (int i = 0; i < 20; i++) {
            acc.push(i * 5.0, 300, 1000 + i * 10L);
        }

        PointerFeatures f = acc.features();

        assertThat(f.isSufficient()).isTrue();
        assertThat(f.getLinearity()).isCloseTo(1.0, within(1e-9));
        // 5px per 10ms
        assertThat(f.getAverageVelocity()).isCloseTo(500.0, within(1e-6));
        assertThat(f.getVelocityVariance()).isCloseTo(0.0, within(1e-6));
        assertThat(f.getTotalDistance()).isCloseTo(95.0, within(1e-9));
    }

    @Test
    void zigzag_lowersLinearity() {
        PointerAccumulator acc = new PointerAccumulator(1000, 5);
        double x = 0;
        double y = 0;
        acc.push(x, y, 0);
        for (int k = 1; k < 50; k++) {
            double heading = k % 2 == 0 ? 0.6 : -0.6;
            x += 2 * Math.cos(heading);
            y += 2 * Math.sin(heading);
            acc.push(x, y, k * 20L);
        }

        // 1.2 rad of heading change per 2px step
        assertThat(acc.features().getLinearity()).isCloseTo(0.4, within(1e-6));
    }

    @Test
    void outOfOrderTimestamp_doesNotProduceNegativeOrInfiniteVelocity() {
        PointerAccumulator acc = new PointerAccumulator(1000, 3);
        acc.push(0, 0, 1000);
        acc.push(10, 0, 1010);
        acc.push(20, 0, 900);
        acc.push(30, 0, 1030);

        PointerFeatures f = acc.features();

        assertThat(f.getMaxVelocity()).isFinite().isGreaterThanOrEqualTo(0.0);
        assertThat(f.getAverageVelocity()).isFinite().isGreaterThanOrEqualTo(0.0);
        assertThat(f.getMovementCount()).isEqualTo(4);
    }

    @Test
    void historyIsCappedAtCapacity() {
        PointerAccumulator acc = new PointerAccumulator(10, 5);
        for (int i = 0; i < 100; i++) {
            acc.push(i, i, i * 10L);
        }

        PointerFeatures f = acc.features();

        assertThat(f.getSampleCount()).isEqualTo(10);
        assertThat(f.getMovementCount()).isEqualTo(100);
    }

    @Test
    void features_isPure() {
        PointerAccumulator acc = new PointerAccumulator(1000, 5);
        for (int i = 0; i < 10; i++) {
            acc.push(i * 3.0, i * i, i * 15L);
        }

        assertThat(acc.features()).isEqualTo(acc.features());
    }
}
