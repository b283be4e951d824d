package com.finance.anomaly.engine.statistics;

import java.util.Arrays;
import java.util.List;

/**
 * Population statistics over small in-memory samples. All methods are total: degenerate input
 * (empty sample, zero spread) yields 0 instead of NaN or an exception.
 */
public final class DescriptiveStatistics {

    private DescriptiveStatistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double mean(List<Double> values) {
        return mean(toArray(values));
    }

    /**
     * Population standard deviation (divides by n).
     */
    public static double stdDev(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /**
     * Third standardized moment. 0 for fewer than 3 values or zero standard deviation.
     */
    public static double skewness(double[] values) {
        if (values.length < 3) return 0.0;
        double mean = mean(values);
        double std = stdDev(values);
        if (std == 0.0) return 0.0;
        double third = 0.0;
        for (double v : values) {
            double d = v - mean;
            third += d * d * d;
        }
        third /= values.length;
        return third / (std * std * std);
    }

    public static double median(double[] values) {
        if (values.length == 0) return 0.0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Equal-width histogram over [min, max]; the last bin is closed on the right.
     * Returns an all-zero histogram when the value range is 0.
     */
    public static int[] histogram(double[] values, int bins) {
        int[] counts = new int[bins];
        if (values.length == 0 || bins <= 0) return counts;
        double min = Arrays.stream(values).min().orElse(0.0);
        double max = Arrays.stream(values).max().orElse(0.0);
        double range = max - min;
        if (range == 0.0) return counts;
        double width = range / bins;
        for (double v : values) {
            int idx = (int) ((v - min) / width);
            if (idx >= bins) idx = bins - 1;
            if (idx < 0) idx = 0;
            counts[idx]++;
        }
        return counts;
    }

    /**
     * Two highest bins are non-adjacent and the second holds at least {@code peakRatio} of the first.
     * Ties keep the lower bin index first.
     */
    public static boolean isBimodal(int[] histogram, double peakRatio) {
        if (histogram.length < 4) return false;
        int first = -1;
        int second = -1;
        for (int i = 0; i < histogram.length; i++) {
            if (first < 0 || histogram[i] > histogram[first]) {
                second = first;
                first = i;
            } else if (second < 0 || histogram[i] > histogram[second]) {
                second = i;
            }
        }
        if (histogram[first] == 0) return false;
        if (histogram[second] < histogram[first] * peakRatio) return false;
        return Math.abs(first - second) > 1;
    }

    /**
     * Pearson correlation coefficient. 0 when the series differ in length, have fewer than
     * 2 points, or either series is constant.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) return 0.0;
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        double denominator = Math.sqrt(sxx * syy);
        if (denominator == 0.0) return 0.0;
        double r = sxy / denominator;
        // Rounding can push |r| a hair over 1
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Relative change in percent, or NaN when the base is 0.
     */
    public static double percentChange(double from, double to) {
        if (from == 0.0) return Double.NaN;
        return (to - from) / from * 100.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
