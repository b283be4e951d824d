package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects dealers whose figures rise at quarter end.
 *
 * Logic: over the dealer's submissions, for each address reported in at least half of them,
 * average the values of quarter-end months (3, 6, 9, 12) and of the other months. With at least
 * 2 values on each side, a quarter-end average above 1.2x the other months is a Quarterly Pattern,
 * high when the uplift exceeds 40%.
 */
@Component
public class QuarterlyPatternDetector implements Detector<DataAnomaly> {

    private static final Set<Integer> QUARTER_END_MONTHS = Set.of(3, 6, 9, 12);

    private final DetectionThresholdConfig config;

    public QuarterlyPatternDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "quarterly-pattern";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        DetectionThresholdConfig.DealerChecks options = config.getDealer();
        Dealer dealer = context.getDealer();
        if (dealer == null) {
            return DetectionOutcome.insufficientData(getName(), "no dealer in scope");
        }
        List<Submission> history = DataSnapshot.firstPerDealerAndPeriod(
                context.getSnapshot().submissionsOf(dealer.getId()));
        if (history.size() < options.getMinSubmissions()) {
            return DetectionOutcome.insufficientData(getName(),
                    history.size() + " submissions, need " + options.getMinSubmissions());
        }

        Map<String, Integer> presence = new LinkedHashMap<>();
        for (Submission submission : history) {
            submission.getNumericValues().keySet().forEach(a -> presence.merge(a, 1, Integer::sum));
        }

        List<DataAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : presence.entrySet()) {
            if (context.isCancelled()) break;
            if (entry.getValue() < history.size() / 2) continue;
            String address = entry.getKey();

            List<Double> quarterEnd = new ArrayList<>();
            List<Double> otherMonths = new ArrayList<>();
            for (Submission submission : history) {
                Double value = submission.getNumericValues().get(address);
                if (value == null) continue;
                (QUARTER_END_MONTHS.contains(submission.getMonth()) ? quarterEnd : otherMonths).add(value);
            }
            if (quarterEnd.size() < options.getQuarterMinSamples() || otherMonths.size() < options.getQuarterMinSamples()) {
                continue;
            }

            double quarterAvg = DescriptiveStatistics.mean(quarterEnd);
            double otherAvg = DescriptiveStatistics.mean(otherMonths);
            if (otherAvg <= 0.0 || quarterAvg <= otherAvg * options.getQuarterUpliftRatio()) continue;

            double uplift = DescriptiveStatistics.round1((quarterAvg - otherAvg) / otherAvg * 100.0);
            anomalies.add(DataAnomaly.builder()
                    .anomalyType("Quarterly Pattern")
                    .description("Dealer '" + dealer.getName() + "' shows " + ReportingPeriods.percent(uplift)
                            + "% higher values for " + address + " at quarter-end months")
                    .severity(uplift > options.getQuarterHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                    .detectedAt(context.getNow())
                    .affectedEntity(dealer.getName())
                    .affectedMetric(address)
                    .actualValue(quarterAvg)
                    .expectedValue(otherAvg)
                    .threshold(otherAvg * options.getQuarterUpliftRatio())
                    .relatedCellAddresses(List.of(address))
                    .businessImpact("Quarter-end figures may be inflated relative to underlying activity")
                    .timeRange(ReportingPeriods.span(history))
                    .build());
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }
}
