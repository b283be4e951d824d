package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flags cells whose total across dealers moves in one direction over the last few reporting months.
 *
 * Logic: per reporting month, sum each address over all submissions of that month. The last 3 months
 * must share at least 3 addresses. For each shared address a strictly increasing total is an
 * Increasing Trend and a strictly decreasing one a Decreasing Trend.
 * Percent change = (last - first) / first; high when the change exceeds 30%.
 *
 * Example: totals 10, 20, 30 give an Increasing Trend of 200% (high). Totals 10, 25, 20 give nothing.
 */
@Component
public class TemporalTrendDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public TemporalTrendDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "temporal-trend";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        int months = config.getTrend().getMonths();
        List<Submission> submissions = context.getSubmissions() != null
                ? DataSnapshot.firstPerDealerAndPeriod(context.getSubmissions())
                : List.of();

        TreeMap<YearMonth, Map<String, Double>> totals = new TreeMap<>();
        for (Submission submission : submissions) {
            Map<String, Double> monthTotals = totals.computeIfAbsent(submission.getPeriod(), k -> new LinkedHashMap<>());
            submission.getNumericValues().forEach((address, value) -> monthTotals.merge(address, value, Double::sum));
        }
        if (totals.size() < months) {
            return DetectionOutcome.insufficientData(getName(),
                    "only " + totals.size() + " reporting months, need " + months);
        }

        List<YearMonth> window = new ArrayList<>(totals.keySet()).subList(totals.size() - months, totals.size());
        List<Map<String, Double>> windowTotals = new ArrayList<>();
        for (YearMonth period : window) {
            windowTotals.add(totals.get(period));
        }
        Set<String> shared = new LinkedHashSet<>(windowTotals.get(0).keySet());
        windowTotals.forEach(m -> shared.retainAll(m.keySet()));
        int minShared = config.getTrend().getMinSharedAddresses();
        if (shared.size() < minShared) {
            return DetectionOutcome.insufficientData(getName(),
                    "only " + shared.size() + " addresses shared by the last " + months + " months, need " + minShared);
        }
        TimeRange range = TimeRange.of(window.get(0), window.get(window.size() - 1));

        List<DataAnomaly> anomalies = new ArrayList<>();
        for (String address : shared) {
            if (context.isCancelled()) break;

            double[] series = windowTotals.stream().mapToDouble(m -> m.get(address)).toArray();
            boolean increasing = isStrictlyMonotonic(series, true);
            boolean decreasing = isStrictlyMonotonic(series, false);
            if (!increasing && !decreasing) continue;

            double first = series[0];
            double last = series[series.length - 1];
            // Percent change is undefined from a zero base
            if (first == 0.0) continue;

            double change = DescriptiveStatistics.round1(Math.abs((last - first) / first * 100.0));
            String direction = increasing ? "increase" : "decrease";
            anomalies.add(DataAnomaly.builder()
                    .anomalyType(increasing ? "Increasing Trend" : "Decreasing Trend")
                    .description("Cell " + address + " shows a consistent " + direction + " over the last "
                            + months + " months, with " + ReportingPeriods.percent(change) + "% total " + direction)
                    .severity(change > config.getTrend().getHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                    .detectedAt(context.getNow())
                    .anomalyScore(Math.min(100.0, change))
                    .affectedEntity(context.subjectLabel())
                    .affectedMetric(address)
                    .actualValue(last)
                    .expectedValue(first)
                    .relatedCellAddresses(List.of(address))
                    .timeRange(range)
                    .build());
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }

    private static boolean isStrictlyMonotonic(double[] series, boolean increasing) {
        for (int i = 1; i < series.length; i++) {
            if (increasing ? series[i] <= series[i - 1] : series[i] >= series[i - 1]) {
                return false;
            }
        }
        return true;
    }
}
