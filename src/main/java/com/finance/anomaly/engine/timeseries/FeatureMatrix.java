package com.finance.anomaly.engine.timeseries;

import com.finance.anomaly.model.Submission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-width numeric feature matrix: one row per submission, one column per global address that
 * appears in enough of the submissions. Absent values are 0.
 */
public final class FeatureMatrix {

    private final List<String> columns;
    private final double[][] values;

    private FeatureMatrix(List<String> columns, double[][] values) {
        this.columns = columns;
        this.values = values;
    }

    /**
     * Columns are the addresses present in at least {@code presenceRatio} of the submissions, in
     * first-seen order, capped at {@code maxFeatures}.
     */
    public static FeatureMatrix build(List<Submission> submissions, double presenceRatio, int maxFeatures) {
        Map<String, Integer> presence = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            for (String address : submission.getNumericValues().keySet()) {
                presence.merge(address, 1, Integer::sum);
            }
        }

        double required = submissions.size() * presenceRatio;
        List<String> columns = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : presence.entrySet()) {
            if (columns.size() >= maxFeatures) break;
            if (entry.getValue() >= required) {
                columns.add(entry.getKey());
            }
        }

        double[][] values = new double[submissions.size()][columns.size()];
        for (int r = 0; r < submissions.size(); r++) {
            Map<String, Double> numeric = submissions.get(r).getNumericValues();
            for (int c = 0; c < columns.size(); c++) {
                values[r][c] = numeric.getOrDefault(columns.get(c), 0.0);
            }
        }
        return new FeatureMatrix(List.copyOf(columns), values);
    }

    public List<String> getColumns() {
        return columns;
    }

    public int featureCount() {
        return columns.size();
    }

    /**
     * Copy scaled per column to [0, 1]. Constant columns become 0.
     */
    public double[][] normalized() {
        int n = values.length;
        int dims = columns.size();
        double[][] out = new double[n][dims];
        for (int c = 0; c < dims; c++) {
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double[] row : values) {
                min = Math.min(min, row[c]);
                max = Math.max(max, row[c]);
            }
            double range = max - min;
            for (int r = 0; r < n; r++) {
                out[r][c] = range == 0.0 ? 0.0 : (values[r][c] - min) / range;
            }
        }
        return out;
    }

    /**
     * Raw (unscaled) column means over the given rows.
     */
    public double[] columnMeans(List<Integer> rowIndexes) {
        double[] means = new double[columns.size()];
        if (rowIndexes.isEmpty()) return means;
        for (int r : rowIndexes) {
            for (int c = 0; c < means.length; c++) {
                means[c] += values[r][c];
            }
        }
        for (int c = 0; c < means.length; c++) {
            means[c] /= rowIndexes.size();
        }
        return means;
    }
}
