package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds pairs of cells that move together across a dealer's submissions.
 *
 * Logic: the series of each address is the current submission followed by at least 5 earlier
 * submissions of the same dealer. Only addresses present in all of them take part. Pairs with
 * |Pearson r| above 0.7 are reported, high above 0.9, with confidence |r| * 100.
 */
@Component
public class CellCorrelationDetector implements Detector<DataPattern> {

    private final DetectionThresholdConfig config;

    public CellCorrelationDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "cell-correlation";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.Correlation options = config.getCorrelation();
        Submission current = context.getSubmission();
        if (current == null) {
            return DetectionOutcome.insufficientData(getName(), "no submission in scope");
        }
        List<Submission> history = DealerHistory.before(context, current);
        if (history.size() < options.getMinHistory()) {
            return DetectionOutcome.insufficientData(getName(),
                    history.size() + " earlier submissions, need " + options.getMinHistory());
        }

        List<Submission> all = new ArrayList<>();
        all.add(current);
        all.addAll(history);
        List<Map<String, Double>> values = new ArrayList<>();
        for (Submission submission : all) {
            values.add(submission.getNumericValues());
        }

        List<String> addresses = new ArrayList<>();
        for (String address : values.get(0).keySet()) {
            if (values.stream().allMatch(v -> v.containsKey(address))) {
                addresses.add(address);
            }
        }
        if (addresses.size() < options.getMinAddresses()) {
            return DetectionOutcome.insufficientData(getName(),
                    addresses.size() + " addresses common to all submissions, need " + options.getMinAddresses());
        }

        TimeRange range = ReportingPeriods.span(all);
        List<DataPattern> patterns = new ArrayList<>();
        for (int i = 0; i < addresses.size(); i++) {
            if (context.isCancelled()) break;
            double[] x = series(values, addresses.get(i));
            for (int j = i + 1; j < addresses.size(); j++) {
                double[] y = series(values, addresses.get(j));
                double r = DescriptiveStatistics.pearson(x, y);
                double strength = Math.abs(r);
                if (strength <= options.getThreshold()) continue;

                String type = r > 0 ? "positive" : "negative";
                patterns.add(DataPattern.builder()
                        .patternType("Cell Correlation")
                        .description(String.format(Locale.ROOT, "Strong %s correlation (r = %.2f) between %s and %s",
                                type, r, addresses.get(i), addresses.get(j)))
                        .significance(strength > options.getHighThreshold() ? Severity.HIGH : Severity.MEDIUM)
                        .confidenceScore(strength * 100.0)
                        .detectedAt(context.getNow())
                        .correlation(r)
                        .relatedCellAddresses(List.of(addresses.get(i), addresses.get(j)))
                        .timeRange(range)
                        .build());
            }
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }

    private static double[] series(List<Map<String, Double>> values, String address) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).get(address);
        }
        return out;
    }
}
