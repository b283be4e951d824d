package com.finance.anomaly.engine.timeseries;

import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Submission;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns submissions into per-address chronological series. Zero and missing values are left out
 * of a series rather than treated as observations.
 */
public final class SeriesExtractor {

    private SeriesExtractor() {}

    /**
     * One point per reporting month and address, for a single dealer's submissions.
     */
    public static Map<String, List<SeriesPoint>> perAddress(List<Submission> dealerSubmissions) {
        List<Submission> ordered = new ArrayList<>(DataSnapshot.firstPerDealerAndPeriod(dealerSubmissions));
        ordered.sort(Submission.CHRONOLOGICAL);

        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        for (Submission submission : ordered) {
            for (Map.Entry<String, Double> entry : submission.getNumericValues().entrySet()) {
                double value = entry.getValue();
                if (value == 0.0) continue;
                series.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new SeriesPoint(submission.getPeriod(), value));
            }
        }
        return series;
    }

    /**
     * Per reporting month, the average of each address across all dealers that reported it.
     */
    public static Map<String, List<SeriesPoint>> periodAverages(List<Submission> submissions) {
        TreeMap<YearMonth, Map<String, double[]>> sums = new TreeMap<>();
        for (Submission submission : DataSnapshot.firstPerDealerAndPeriod(submissions)) {
            Map<String, double[]> perAddress = sums.computeIfAbsent(submission.getPeriod(), k -> new LinkedHashMap<>());
            for (Map.Entry<String, Double> entry : submission.getNumericValues().entrySet()) {
                double[] acc = perAddress.computeIfAbsent(entry.getKey(), k -> new double[2]);
                acc[0] += entry.getValue();
                acc[1] += 1;
            }
        }

        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        for (Map.Entry<YearMonth, Map<String, double[]>> period : sums.entrySet()) {
            for (Map.Entry<String, double[]> entry : period.getValue().entrySet()) {
                double average = entry.getValue()[0] / entry.getValue()[1];
                if (average == 0.0) continue;
                series.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new SeriesPoint(period.getKey(), average));
            }
        }
        return series;
    }

    public static double[] values(List<SeriesPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }
}
