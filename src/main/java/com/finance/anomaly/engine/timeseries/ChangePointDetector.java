package com.finance.anomaly.engine.timeseries;

import com.finance.anomaly.engine.statistics.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Two-window level-shift test.
 *
 * <p>At every split position the median of the following window is compared with the median of the
 * preceding window, after removing the drift a robust slope (median of first differences) predicts
 * over one window. Noise is estimated from the median absolute deviation of the first differences,
 * so a single step does not inflate it. The shift is converted to a z statistic and tested against a
 * Bonferroni-corrected two-sided critical value at the configured confidence. Accepted positions are
 * thinned so no two are closer than one window.
 */
public class ChangePointDetector {

    private static final double MAD_TO_SIGMA = 1.4826;

    private final double confidence;
    private final int minLength;

    public ChangePointDetector(double confidence, int minLength) {
        this.confidence = confidence;
        this.minLength = Math.max(8, minLength);
    }

    public List<SeriesSignal> detect(double[] values) {
        int n = values.length;
        List<SeriesSignal> signals = new ArrayList<>();
        if (n < minLength) return signals;

        int window = Math.max(3, Math.min(n / 2 - 1, n / 5));
        if (n <= 2 * window) return signals;
        if (isConstant(values)) return signals;

        double[] diffs = new double[n - 1];
        for (int i = 1; i < n; i++) {
            diffs[i - 1] = values[i] - values[i - 1];
        }
        double slope = DescriptiveStatistics.median(diffs);
        double sigma = noiseSigma(diffs, slope);

        int positions = n - 2 * window + 1;
        double critical = inverseNormal(1.0 - (1.0 - confidence) / (2.0 * positions));

        // Variance of the median difference of two windows plus the error of the drift correction
        double variance = sigma * sigma * (Math.PI / 2.0) * (2.0 / window)
                + (double) window * window * (Math.PI / 2.0) * 2.0 * sigma * sigma / (n - 1);
        double standardError = Math.sqrt(variance);

        List<double[]> candidates = new ArrayList<>();
        for (int i = window; i <= n - window; i++) {
            double[] left = Arrays.copyOfRange(values, i - window, i);
            double[] right = Arrays.copyOfRange(values, i, i + window);
            double shift = Math.abs(DescriptiveStatistics.median(right) - DescriptiveStatistics.median(left)
                    - slope * window);
            if (shift < 1e-9) continue;

            double z = standardError < 1e-12 ? Double.POSITIVE_INFINITY : shift / standardError;
            if (z > critical) {
                double meanGap = Math.abs(DescriptiveStatistics.mean(right) - DescriptiveStatistics.mean(left));
                candidates.add(new double[] {i, z, meanGap});
            }
        }

        candidates.sort(Comparator.<double[]>comparingDouble(c -> -c[1])
                .thenComparingDouble(c -> -c[2])
                .thenComparingDouble(c -> c[0]));

        List<Integer> accepted = new ArrayList<>();
        for (double[] candidate : candidates) {
            int position = (int) candidate[0];
            boolean clear = accepted.stream().allMatch(p -> Math.abs(p - position) >= window);
            if (!clear) continue;
            accepted.add(position);
            double score = Math.min(1.0, candidate[1] / (2.0 * critical));
            signals.add(new SeriesSignal(position, score));
        }
        signals.sort(Comparator.comparingInt(SeriesSignal::getPosition));
        return signals;
    }

    private static double noiseSigma(double[] diffs, double slope) {
        double[] deviations = new double[diffs.length];
        for (int i = 0; i < diffs.length; i++) {
            deviations[i] = Math.abs(diffs[i] - slope);
        }
        // Differences carry the noise of two observations
        double sigma = MAD_TO_SIGMA * DescriptiveStatistics.median(deviations) / Math.sqrt(2.0);
        if (sigma >= 1e-12) return sigma;

        double mean = DescriptiveStatistics.mean(diffs);
        double sumSq = 0.0;
        for (double d : diffs) sumSq += (d - mean) * (d - mean);
        double sampleStd = diffs.length > 1 ? Math.sqrt(sumSq / (diffs.length - 1)) : 0.0;
        return sampleStd / Math.sqrt(2.0);
    }

    private static boolean isConstant(double[] values) {
        for (double v : values) {
            if (v != values[0]) return false;
        }
        return true;
    }

    /**
     * Standard normal quantile (Acklam's rational approximation, relative error below 1.2e-9).
     */
    static double inverseNormal(double p) {
        if (p <= 0.0) return Double.NEGATIVE_INFINITY;
        if (p >= 1.0) return Double.POSITIVE_INFINITY;

        double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
                1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
                6.680131188771972e+01, -1.328068155288572e+01};
        double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
                -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
                3.754408661907416e+00};

        double low = 0.02425;
        if (p < low) {
            double q = Math.sqrt(-2.0 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        }
        if (p > 1.0 - low) {
            double q = Math.sqrt(-2.0 * Math.log(1.0 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1.0);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
                / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1.0);
    }
}
