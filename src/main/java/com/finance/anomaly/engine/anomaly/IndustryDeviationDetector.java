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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares a dealer's latest submission with every other dealer's submission for the same month.
 *
 * Logic: for each numeric cell, the industry average is the mean of the peers' values for that
 * address (at least 3 peers). A deviation beyond 30% is an Industry Deviation, high beyond 50%.
 */
@Component
public class IndustryDeviationDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public IndustryDeviationDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "industry-deviation";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        DetectionThresholdConfig.DealerChecks options = config.getDealer();
        Submission latest = context.getSubmission();
        if (latest == null) {
            return DetectionOutcome.insufficientData(getName(), "dealer has no submissions");
        }

        List<Submission> peers = new ArrayList<>();
        for (Submission candidate : DataSnapshot.firstPerDealerAndPeriod(
                context.getSnapshot().submissionsIn(latest.getPeriod()))) {
            if (!latest.getDealerId().equals(candidate.getDealerId())) {
                peers.add(candidate);
            }
        }
        if (peers.size() < options.getIndustryMinPeers()) {
            return DetectionOutcome.insufficientData(getName(),
                    peers.size() + " peer submissions for " + latest.getPeriod() + ", need " + options.getIndustryMinPeers());
        }

        String dealerName = context.getSnapshot().dealerName(latest.getDealerId());
        List<DataAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, Double> entry : latest.getNumericValues().entrySet()) {
            if (context.isCancelled()) break;
            String address = entry.getKey();

            List<Double> peerValues = new ArrayList<>();
            for (Submission peer : peers) {
                Double value = peer.getNumericValues().get(address);
                if (value != null) peerValues.add(value);
            }
            if (peerValues.size() < options.getIndustryMinPeers()) continue;

            double industryAvg = DescriptiveStatistics.mean(peerValues);
            if (industryAvg == 0.0) continue;
            double deviation = DescriptiveStatistics.round1(
                    DescriptiveStatistics.percentChange(industryAvg, entry.getValue()));
            if (Math.abs(deviation) <= options.getIndustryDeviationPercent()) continue;

            String direction = deviation > 0 ? "above" : "below";
            anomalies.add(DataAnomaly.builder()
                    .anomalyType("Industry Deviation")
                    .description("Dealer '" + dealerName + "' is " + ReportingPeriods.percent(Math.abs(deviation))
                            + "% " + direction + " industry average for " + address)
                    .severity(Math.abs(deviation) > options.getIndustryHighPercent() ? Severity.HIGH : Severity.MEDIUM)
                    .detectedAt(context.getNow())
                    .anomalyScore(Math.min(100.0, Math.abs(deviation)))
                    .affectedEntity(dealerName)
                    .affectedMetric(address)
                    .actualValue(entry.getValue())
                    .expectedValue(industryAvg)
                    .threshold(options.getIndustryDeviationPercent())
                    .relatedCellAddresses(List.of(address))
                    .timeRange(TimeRange.single(latest.getPeriod()))
                    .build());
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }
}
