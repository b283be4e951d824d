package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.Cell;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compares a submission with the same dealer's submission for the same month one year earlier.
 *
 * Year-Over-Year Variance: cells whose value moved by more than 20% (high above 50%).
 * Missing Historical Data: cells reported last year that the current submission lacks
 * (high when more than 5).
 */
@Component
public class HistoricalVarianceDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public HistoricalVarianceDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "historical-variance";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        Submission current = context.getSubmission();
        if (current == null) {
            return DetectionOutcome.insufficientData(getName(), "no submission to check");
        }
        YearMonth lastYear = current.getPeriod().minusYears(1);
        Optional<Submission> previous = context.getSnapshot().submissionsOf(current.getDealerId()).stream()
                .filter(s -> s.getPeriod().equals(lastYear))
                .findFirst();
        if (previous.isEmpty()) {
            return DetectionOutcome.insufficientData(getName(), "no submission for " + lastYear);
        }

        DetectionThresholdConfig.SubmissionChecks options = config.getSubmission();
        String dealerName = context.getSnapshot().dealerName(current.getDealerId());
        String monthName = ReportingPeriods.monthName(current.getMonth());
        TimeRange range = TimeRange.of(lastYear, current.getPeriod());

        List<DataAnomaly> anomalies = new ArrayList<>();
        Map<String, Double> previousValues = previous.get().getNumericValues();
        for (Map.Entry<String, Double> entry : current.getNumericValues().entrySet()) {
            if (context.isCancelled()) break;
            Double before = previousValues.get(entry.getKey());
            if (before == null || before == 0.0) continue;

            double change = DescriptiveStatistics.percentChange(before, entry.getValue());
            if (Math.abs(change) <= options.getYearOverYearPercent()) continue;

            double rounded = DescriptiveStatistics.round1(change);
            String direction = rounded > 0 ? "increase" : "decrease";
            anomalies.add(DataAnomaly.builder()
                    .anomalyType("Year-Over-Year Variance")
                    .description("Cell " + entry.getKey() + " shows " + ReportingPeriods.percent(Math.abs(rounded))
                            + "% " + direction + " compared to " + monthName + " last year")
                    .severity(Math.abs(change) > options.getYearOverYearHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                    .detectedAt(context.getNow())
                    .anomalyScore(Math.min(100.0, Math.abs(change)))
                    .affectedEntity(dealerName)
                    .affectedMetric(entry.getKey())
                    .actualValue(entry.getValue())
                    .expectedValue(before)
                    .threshold(options.getYearOverYearPercent())
                    .relatedCellAddresses(List.of(entry.getKey()))
                    .timeRange(range)
                    .build());
        }

        Set<String> missing = new LinkedHashSet<>();
        for (Cell cell : previous.get().getCells()) {
            if (cell.getGlobalAddress() != null && current.findCell(cell.getGlobalAddress()).isEmpty()) {
                missing.add(cell.getGlobalAddress());
            }
        }
        if (!missing.isEmpty()) {
            anomalies.add(DataAnomaly.builder()
                    .anomalyType("Missing Historical Data")
                    .description("Found " + missing.size()
                            + " cells that were reported last year but missing in current submission")
                    .severity(missing.size() > options.getMissingHistoricalHighCount() ? Severity.HIGH : Severity.MEDIUM)
                    .detectedAt(context.getNow())
                    .affectedEntity(dealerName)
                    .actualValue((double) missing.size())
                    .relatedCellAddresses(List.copyOf(missing))
                    .recommendedAction("Check whether these cells were dropped from the template or left out")
                    .timeRange(range)
                    .build());
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }
}
