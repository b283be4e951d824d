package com.finance.anomaly.engine.timeseries;

import lombok.Value;

/**
 * Linear trend plus additive seasonal indices. Seasonal indices are only fitted once the series
 * covers two full seasons; below that the forecast is the trend line alone.
 */
public class SeriesForecaster {

    private final int seasonLength;

    public SeriesForecaster(int seasonLength) {
        this.seasonLength = seasonLength;
    }

    @Value
    public static class Forecast {
        double[] values;
        // Goodness of fit of trend + seasonality over the observed points, in [0, 1]
        double r2;
        double slope;
        boolean seasonal;
    }

    public Forecast forecast(double[] series, int horizon) {
        int n = series.length;
        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (double v : series) meanY += v;
        meanY /= n;

        double sxx = 0.0;
        double sxy = 0.0;
        for (int t = 0; t < n; t++) {
            sxx += (t - meanX) * (t - meanX);
            sxy += (t - meanX) * (series[t] - meanY);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;

        boolean seasonal = seasonLength > 1 && n >= 2 * seasonLength;
        double[] indices = new double[Math.max(1, seasonLength)];
        if (seasonal) {
            int[] counts = new int[seasonLength];
            for (int t = 0; t < n; t++) {
                indices[t % seasonLength] += series[t] - (intercept + slope * t);
                counts[t % seasonLength]++;
            }
            double centre = 0.0;
            for (int s = 0; s < seasonLength; s++) {
                indices[s] /= counts[s];
                centre += indices[s];
            }
            centre /= seasonLength;
            for (int s = 0; s < seasonLength; s++) {
                indices[s] -= centre;
            }
        }

        double sse = 0.0;
        double sst = 0.0;
        for (int t = 0; t < n; t++) {
            double fitted = intercept + slope * t + (seasonal ? indices[t % seasonLength] : 0.0);
            sse += (series[t] - fitted) * (series[t] - fitted);
            sst += (series[t] - meanY) * (series[t] - meanY);
        }
        double r2 = sst == 0.0 ? 1.0 : Math.max(0.0, Math.min(1.0, 1.0 - sse / sst));

        double[] values = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            int t = n + h;
            values[h] = intercept + slope * t + (seasonal ? indices[t % seasonLength] : 0.0);
        }
        return new Forecast(values, r2, slope, seasonal);
    }
}
