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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Peak and trough months of a dealer's most regularly reported cells.
 *
 * Logic: addresses present in at least 80% of the dealer's latest reporting months (at least 3 such
 * addresses, first 10 considered) are averaged per calendar month. With 6 or more months of data,
 * months at least 15% above the mean of the monthly averages are peaks and those 15% below are troughs.
 */
@Component
public class MonthlySeasonalityDetector implements Detector<DataPattern> {

    private static final double CONFIDENCE = 75.0;

    private final DetectionThresholdConfig config;

    public MonthlySeasonalityDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "monthly-seasonality";
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

        Map<String, Integer> presence = new LinkedHashMap<>();
        for (Submission submission : window) {
            submission.getNumericValues().keySet().forEach(a -> presence.merge(a, 1, Integer::sum));
        }
        List<String> regular = presence.entrySet().stream()
                .filter(e -> e.getValue() >= window.size() * options.getMonthlyPresenceRatio())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (regular.size() < options.getMonthlyMinAddresses()) {
            return DetectionOutcome.insufficientData(getName(),
                    regular.size() + " regularly reported addresses, need " + options.getMonthlyMinAddresses());
        }

        TimeRange range = ReportingPeriods.span(window);
        List<DataPattern> patterns = new ArrayList<>();
        for (String address : regular.subList(0, Math.min(regular.size(), options.getMonthlyMaxAddresses()))) {
            if (context.isCancelled()) break;

            TreeMap<Integer, List<Double>> byMonth = new TreeMap<>();
            for (Submission submission : window) {
                Double value = submission.getNumericValues().get(address);
                if (value != null) {
                    byMonth.computeIfAbsent(submission.getMonth(), k -> new ArrayList<>()).add(value);
                }
            }
            if (byMonth.size() < options.getMonthlyMinMonths()) continue;

            Map<Integer, Double> averages = new TreeMap<>();
            byMonth.forEach((month, values) -> averages.put(month, DescriptiveStatistics.mean(values)));
            double overall = DescriptiveStatistics.mean(new ArrayList<>(averages.values()));
            if (overall == 0.0) continue;

            List<String> marks = new ArrayList<>();
            averages.forEach((month, average) -> {
                double deviation = (average - overall) / overall * 100.0;
                if (Math.abs(deviation) >= options.getMonthlyDeviationPercent()) {
                    marks.add(ReportingPeriods.monthName(month) + ": " + (deviation > 0 ? "Peak" : "Trough"));
                }
            });
            if (marks.isEmpty()) continue;

            patterns.add(DataPattern.builder()
                    .patternType("Monthly Seasonality")
                    .description("Dealer " + dealer.getId() + " shows seasonal patterns for " + address + ": "
                            + String.join(", ", marks))
                    .significance(Severity.MEDIUM)
                    .confidenceScore(CONFIDENCE)
                    .detectedAt(context.getNow())
                    .relatedCellAddresses(List.of(address))
                    .timeRange(range)
                    .build());
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }
}
