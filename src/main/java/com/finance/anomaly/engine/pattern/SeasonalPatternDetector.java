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
import java.util.Map;

/**
 * Peak and trough calendar months of each cell over at least a year of a dealer's submissions.
 *
 * Logic: with the current submission and at least 11 earlier ones, every address present in all of
 * them is averaged per calendar month. If the highest month average exceeds the lowest (positive)
 * one by 20% or more it is a Seasonal Pattern. Confidence = min(95, 60 + percentDiff / 2);
 * high when percentDiff is above 50.
 */
@Component
public class SeasonalPatternDetector implements Detector<DataPattern> {

    private final DetectionThresholdConfig config;

    public SeasonalPatternDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "seasonal-pattern";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.Seasonal options = config.getSeasonal();
        Submission current = context.getSubmission();
        if (current == null) {
            return DetectionOutcome.insufficientData(getName(), "no submission in scope");
        }
        List<Submission> history = DealerHistory.before(context, current);
        if (history.size() < options.getMinHistory()) {
            return DetectionOutcome.insufficientData(getName(),
                    history.size() + " earlier submissions, need " + options.getMinHistory());
        }

        List<Submission> all = new ArrayList<>(history);
        all.add(current);
        TimeRange range = ReportingPeriods.span(all);

        List<DataPattern> patterns = new ArrayList<>();
        for (String address : current.getNumericValues().keySet()) {
            if (context.isCancelled()) break;
            if (!history.stream().allMatch(s -> s.getNumericValues().containsKey(address))) continue;

            double[] sums = new double[12];
            int[] counts = new int[12];
            for (Submission submission : all) {
                Map<String, Double> values = submission.getNumericValues();
                sums[submission.getMonth() - 1] += values.get(address);
                counts[submission.getMonth() - 1]++;
            }

            int peak = -1;
            int trough = -1;
            double peakValue = 0.0;
            double troughValue = 0.0;
            for (int m = 0; m < 12; m++) {
                if (counts[m] == 0) continue;
                double average = sums[m] / counts[m];
                if (peak < 0 || average > peakValue) {
                    peak = m;
                    peakValue = average;
                }
                if (trough < 0 || average < troughValue) {
                    trough = m;
                    troughValue = average;
                }
            }
            if (troughValue <= 0.0 || (peakValue - troughValue) / troughValue < options.getMinSpreadRatio()) continue;

            double percentDiff = DescriptiveStatistics.round1((peakValue - troughValue) / troughValue * 100.0);
            patterns.add(DataPattern.builder()
                    .patternType("Seasonal Pattern")
                    .description("Cell " + address + " shows seasonal pattern with highest values in "
                            + ReportingPeriods.monthName(peak + 1) + " and lowest in "
                            + ReportingPeriods.monthName(trough + 1) + " (" + ReportingPeriods.percent(percentDiff)
                            + "% difference)")
                    .significance(percentDiff > options.getHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                    .confidenceScore(Math.min(95.0, 60.0 + percentDiff / 2.0))
                    .detectedAt(context.getNow())
                    .relatedCellAddresses(List.of(address))
                    .timeRange(range)
                    .build());
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }
}
