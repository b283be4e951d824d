package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Year-on-year shifts in a dealer's average figures.
 *
 * Logic: over the dealer's latest 60 reporting months (at least 12 required), each address is
 * averaged per year. For every pair of consecutive years, addresses whose average moved by 15% or
 * more are ranked by size of change; the top 3 form one Yearly Change Pattern, high if any moved
 * by 30% or more.
 */
@Component
public class YearlyChangeDetector implements Detector<DataPattern> {

    private static final double CONFIDENCE = 80.0;

    private final DetectionThresholdConfig config;

    public YearlyChangeDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "yearly-change";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.DealerPatterns options = config.getDealerPatterns();
        Dealer dealer = context.getDealer();
        if (dealer == null) {
            return DetectionOutcome.insufficientData(getName(), "no dealer in scope");
        }
        List<Submission> window = DealerHistory.latest(context, dealer.getId(), options.getMaxSubmissions());
        if (window.size() < options.getMinSubmissions()) {
            return DetectionOutcome.insufficientData(getName(),
                    window.size() + " reporting months, need " + options.getMinSubmissions());
        }

        TreeMap<Integer, Map<String, List<Double>>> byYear = new TreeMap<>();
        for (Submission submission : window) {
            Map<String, List<Double>> year = byYear.computeIfAbsent(submission.getYear(), k -> new LinkedHashMap<>());
            submission.getNumericValues().forEach((address, value) ->
                    year.computeIfAbsent(address, k -> new ArrayList<>()).add(value));
        }
        if (byYear.size() < 2) {
            return DetectionOutcome.insufficientData(getName(), "data covers a single year");
        }

        List<Integer> years = new ArrayList<>(byYear.keySet());
        List<DataPattern> patterns = new ArrayList<>();
        for (int y = 1; y < years.size(); y++) {
            if (context.isCancelled()) break;
            int previousYear = years.get(y - 1);
            int currentYear = years.get(y);
            Map<String, List<Double>> before = byYear.get(previousYear);
            Map<String, List<Double>> after = byYear.get(currentYear);

            List<Change> changes = new ArrayList<>();
            for (Map.Entry<String, List<Double>> entry : before.entrySet()) {
                List<Double> afterValues = after.get(entry.getKey());
                if (afterValues == null) continue;
                double from = DescriptiveStatistics.mean(entry.getValue());
                double to = DescriptiveStatistics.mean(afterValues);
                if (from == 0.0) continue;
                double percent = DescriptiveStatistics.percentChange(from, to);
                if (Math.abs(percent) >= options.getYearlyChangePercent()) {
                    changes.add(new Change(entry.getKey(), from, to, percent));
                }
            }
            if (changes.isEmpty()) continue;

            List<Change> top = changes.stream()
                    .sorted(Comparator.comparingDouble((Change c) -> -Math.abs(c.percent)))
                    .limit(options.getTopChanges())
                    .collect(Collectors.toList());
            String summary = top.stream()
                    .map(c -> String.format(Locale.ROOT, "%s: %.1f%% change from %.0f to %.0f",
                            c.address, c.percent, c.from, c.to))
                    .collect(Collectors.joining(", "));
            boolean high = top.stream().anyMatch(c -> Math.abs(c.percent) >= options.getYearlyHighPercent());

            patterns.add(DataPattern.builder()
                    .patternType("Yearly Change Pattern")
                    .description("Dealer " + dealer.getId() + " showed significant changes from "
                            + previousYear + " to " + currentYear + ": " + summary)
                    .significance(high ? Severity.HIGH : Severity.MEDIUM)
                    .confidenceScore(CONFIDENCE)
                    .detectedAt(context.getNow())
                    .relatedCellAddresses(top.stream().map(c -> c.address).collect(Collectors.toList()))
                    .timeRange(TimeRange.of(YearMonth.of(previousYear, 1), YearMonth.of(currentYear, 12)))
                    .build());
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }

    private static final class Change {
        final String address;
        final double from;
        final double to;
        final double percent;

        Change(String address, double from, double to, double percent) {
            this.address = address;
            this.from = from;
            this.to = to;
            this.percent = percent;
        }
    }
}
