package com.finance.anomaly.engine.timeseries;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesForecasterTest {

    private final SeriesForecaster forecaster = new SeriesForecaster(12);

    @Test
    void forecast_linearSeries_extendsTheLine() {
        double[] series = new double[24];
        for (int i = 0; i < series.length; i++) series[i] = i + 1;

        SeriesForecaster.Forecast forecast = forecaster.forecast(series, 3);

        assertThat(forecast.isSeasonal()).isTrue();
        assertThat(forecast.getSlope()).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.getR2()).isCloseTo(1.0, within(1e-9));
        assertThat(forecast.getValues()[0]).isCloseTo(25.0, within(1e-6));
        assertThat(forecast.getValues()[2]).isCloseTo(27.0, within(1e-6));
    }

    @Test
    void forecast_repeatingSeason_carriesSeasonalIndex() {
        double[] series = new double[24];
        for (int i = 0; i < series.length; i++) series[i] = i % 12 == 11 ? 200.0 : 100.0;

        SeriesForecaster.Forecast forecast = forecaster.forecast(series, 12);

        // Month 12 of the next season stands out again
        assertThat(forecast.getValues()[11]).isGreaterThan(forecast.getValues()[10] + 50.0);
    }

    @Test
    void forecast_shortSeries_usesTrendOnly() {
        SeriesForecaster.Forecast forecast = forecaster.forecast(new double[] {10, 12, 14, 16, 18, 20}, 2);

        assertThat(forecast.isSeasonal()).isFalse();
        assertThat(forecast.getValues()).containsExactly(new double[] {22.0, 24.0}, within(1e-9));
    }
}
