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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares dealers against each other on the same cell in the same reporting month.
 *
 * Logic: for every global address, take the most recent month in which at least 3 dealers reported
 * it. Each dealer's value is scored against its peers (the other dealers of that month):
 *   z = |value - peerMean| / peerStdDev
 * z above 2 is an outlier, provided the value also sits at least 10% away from the peer
 * mean. Severity: z > 3 high, z > 2.5 medium, otherwise low.
 * Score = min(100, z * 25). Peers with zero spread give no z-score and are skipped.
 *
 * Example: values {100, 102, 98, 101, 500}. For 500 the peers have mean 100.25 and std 1.48,
 * so z is about 270 (high). For 100 the peers include 500 and z stays below 1.
 * Values {100, 101, 99, 100.5} give z above 2 for 99 but only a 1.5% deviation, so nothing is flagged.
 */
@Component
public class CrossDealerOutlierDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public CrossDealerOutlierDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "cross-dealer-outlier";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        DetectionThresholdConfig.CrossDealer options = config.getCrossDealer();
        List<Submission> submissions = context.getSubmissions() != null
                ? DataSnapshot.firstPerDealerAndPeriod(context.getSubmissions())
                : List.of();

        // address -> period -> dealer -> value
        Map<String, TreeMap<YearMonth, Map<String, Double>>> observations = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            for (Map.Entry<String, Double> entry : submission.getNumericValues().entrySet()) {
                observations.computeIfAbsent(entry.getKey(), k -> new TreeMap<>())
                        .computeIfAbsent(submission.getPeriod(), k -> new LinkedHashMap<>())
                        .putIfAbsent(submission.getDealerId(), entry.getValue());
            }
        }

        List<DataAnomaly> anomalies = new ArrayList<>();
        boolean anyComparable = false;
        for (Map.Entry<String, TreeMap<YearMonth, Map<String, Double>>> entry : observations.entrySet()) {
            if (context.isCancelled()) break;
            String address = entry.getKey();

            Map.Entry<YearMonth, Map<String, Double>> latest = null;
            for (Map.Entry<YearMonth, Map<String, Double>> period : entry.getValue().descendingMap().entrySet()) {
                if (period.getValue().size() >= options.getMinDealers()) {
                    latest = period;
                    break;
                }
            }
            if (latest == null) continue;
            anyComparable = true;

            for (Map.Entry<String, Double> dealerValue : latest.getValue().entrySet()) {
                List<Double> peers = new ArrayList<>();
                latest.getValue().forEach((dealerId, value) -> {
                    if (!dealerId.equals(dealerValue.getKey())) peers.add(value);
                });
                double[] peerValues = DescriptiveStatistics.toArray(peers);
                double peerMean = DescriptiveStatistics.mean(peerValues);
                double peerStd = DescriptiveStatistics.stdDev(peerValues);
                if (peerStd == 0.0) continue;

                double value = dealerValue.getValue();
                double z = Math.abs(value - peerMean) / peerStd;
                if (z <= options.getOutlierZScore()) continue;
                if (peerMean != 0.0
                        && Math.abs(value - peerMean) / Math.abs(peerMean) * 100.0 < options.getMinDeviationPercent()) {
                    continue;
                }

                anomalies.add(outlier(context, address, latest.getKey(), dealerValue.getKey(),
                        value, peerMean, peerStd, z));
            }
        }

        if (!anyComparable && !context.isCancelled()) {
            return DetectionOutcome.insufficientData(getName(),
                    "no address reported by at least " + options.getMinDealers() + " dealers in one month");
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }

    private DataAnomaly outlier(DetectionContext context, String address, YearMonth period, String dealerId,
                                double value, double peerMean, double peerStd, double z) {
        DetectionThresholdConfig.CrossDealer options = config.getCrossDealer();
        String dealerName = context.getSnapshot() != null ? context.getSnapshot().dealerName(dealerId) : dealerId;

        String description;
        if (peerMean != 0.0) {
            double deviation = DescriptiveStatistics.round1((value - peerMean) / Math.abs(peerMean) * 100.0);
            String direction = deviation > 0 ? "higher" : "lower";
            description = "Dealer '" + dealerName + "' reported value for " + address + " is "
                    + ReportingPeriods.percent(Math.abs(deviation)) + "% " + direction + " than average";
        } else {
            description = "Dealer '" + dealerName + "' reported value for " + address
                    + " deviates from the average of its peers";
        }

        Severity severity = z > options.getHighZ() ? Severity.HIGH
                : z > options.getMediumZ() ? Severity.MEDIUM
                : Severity.LOW;

        return DataAnomaly.builder()
                .anomalyType("Cross-Dealer Outlier")
                .description(description)
                .severity(severity)
                .detectedAt(context.getNow())
                .anomalyScore(Math.min(100.0, z * options.getScorePerZ()))
                .affectedEntity(dealerName)
                .affectedMetric(address)
                .actualValue(value)
                .expectedValue(peerMean)
                .threshold(peerMean + options.getOutlierZScore() * peerStd)
                .relatedCellAddresses(List.of(address))
                .businessImpact("Reported figure is out of line with other dealers for the same month")
                .recommendedAction("Confirm the value with the dealer before consolidating")
                .timeRange(TimeRange.single(period))
                .build();
    }
}
