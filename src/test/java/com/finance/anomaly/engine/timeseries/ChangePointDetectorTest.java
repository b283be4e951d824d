package com.finance.anomaly.engine.timeseries;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChangePointDetectorTest {

    private final ChangePointDetector detector = new ChangePointDetector(0.95, 8);

    @Test
    void detect_levelShift_flagsFirstPointOfNewLevel() {
        double[] series = new double[20];
        Arrays.fill(series, 0, 10, 100.0);
        Arrays.fill(series, 10, 20, 200.0);

        List<SeriesSignal> signals = detector.detect(series);

        assertThat(signals).hasSize(1);
        assertThat(signals.get(0).getPosition()).isEqualTo(10);
        assertThat(signals.get(0).getScore()).isCloseTo(0.576, within(0.01));
    }

    @Test
    void detect_linearTrend_isNotAChange() {
        double[] series = new double[20];
        for (int i = 0; i < series.length; i++) series[i] = 50.0 + 5.0 * i;

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    void detect_constantSeries_yieldsNothing() {
        double[] series = new double[12];
        Arrays.fill(series, 7.0);

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    void inverseNormal_matchesKnownQuantiles() {
        assertThat(ChangePointDetector.inverseNormal(0.975)).isCloseTo(1.959964, within(1e-5));
        assertThat(ChangePointDetector.inverseNormal(0.5)).isCloseTo(0.0, within(1e-9));
    }
}
