package com.finance.anomaly.engine.timeseries;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpikeDetectorTest {

    private final SpikeDetector detector = new SpikeDetector(0.3, 8, 3.0);

    @Test
    void detect_isolatedSpike_flagsItsPosition() {
        double[] series = new double[20];
        Arrays.fill(series, 100.0);
        series[12] = 1000.0;

        List<SeriesSignal> signals = detector.detect(series);

        assertThat(signals).extracting(SeriesSignal::getPosition).contains(12);
        SeriesSignal spike = signals.stream().filter(s -> s.getPosition() == 12).findFirst().orElseThrow();
        assertThat(spike.getScore()).isGreaterThan(0.3).isLessThanOrEqualTo(1.0);
    }

    @Test
    void detect_boundedNoise_yieldsNothing() {
        double[] noise = {3, -4, 1, 5, -2, -5, 4, 0, -3, 2, -1, 5, -4, 3, -2, 1, -5, 4, -3, 2, 0, -1, 5, -4};
        double[] series = new double[noise.length];
        for (int i = 0; i < noise.length; i++) series[i] = 100.0 + noise[i];

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    void detect_noiseWithSpike_flagsOnlyTheSpike() {
        double[] noise = {3, -4, 1, 5, -2, -5, 4, 0, -3, 2, -1, 5, -4, 3, -2, 1, -5, 4, -3, 2, 0, -1, 5, -4};
        double[] series = new double[noise.length];
        for (int i = 0; i < noise.length; i++) series[i] = 100.0 + noise[i];
        series[12] = 400.0;

        assertThat(detector.detect(series)).extracting(SeriesSignal::getPosition).containsOnly(12);
    }

    @Test
    void detect_constantSeries_yieldsNothing() {
        double[] series = new double[15];
        Arrays.fill(series, 42.0);

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    void detect_perfectlyLinearSeries_yieldsNothing() {
        double[] series = new double[15];
        for (int i = 0; i < series.length; i++) series[i] = 10.0 + 3.0 * i;

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    void detect_shorterThanMinimumLength_yieldsNothing() {
        assertThat(detector.detect(new double[] {1, 1, 1, 50, 1, 1, 1})).isEmpty();
    }

    @Test
    void mirrorPad_reflectsWithoutRepeatingEdges() {
        double[] padded = SpikeDetector.mirrorPad(new double[] {1, 2, 3, 4}, 2);

        assertThat(padded).containsExactly(3, 2, 1, 2, 3, 4, 3, 2);
    }
}
