package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.ReportingPeriods;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks at the shape of each cell's value distribution across the working set of submissions.
 *
 * Logic: values are grouped by global address. Addresses with enough observations get a
 * 10-bin histogram over their value range and a skewness estimate.
 *   - Bimodal Distribution (medium): the two fullest bins are not adjacent and the second
 *     holds at least 75% of the first.
 *   - Skewed Distribution (low): |skewness| above the configured threshold.
 */
@Component
public class DistributionAnomalyDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public DistributionAnomalyDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "distribution";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        DetectionThresholdConfig.Distribution options = config.getDistribution();
        List<Submission> submissions = context.getSubmissions() != null ? context.getSubmissions() : List.of();
        if (submissions.isEmpty()) {
            return DetectionOutcome.insufficientData(getName(), "no submissions in scope");
        }

        Map<String, List<Double>> valuesByAddress = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            submission.getNumericValues().forEach((address, value) ->
                    valuesByAddress.computeIfAbsent(address, k -> new ArrayList<>()).add(value));
        }
        TimeRange range = ReportingPeriods.span(submissions);

        List<DataAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<Double>> entry : valuesByAddress.entrySet()) {
            if (context.isCancelled()) break;
            if (entry.getValue().size() < options.getMinObservations()) continue;

            String address = entry.getKey();
            double[] values = DescriptiveStatistics.toArray(entry.getValue());
            double mean = DescriptiveStatistics.mean(values);

            int[] histogram = DescriptiveStatistics.histogram(values, options.getHistogramBins());
            if (DescriptiveStatistics.isBimodal(histogram, options.getBimodalPeakRatio())) {
                anomalies.add(DataAnomaly.builder()
                        .anomalyType("Bimodal Distribution")
                        .description("Cell " + address + " shows a bimodal distribution pattern, "
                                + "suggesting two distinct groups of values")
                        .severity(Severity.MEDIUM)
                        .detectedAt(context.getNow())
                        .affectedEntity(context.subjectLabel())
                        .affectedMetric(address)
                        .expectedValue(mean)
                        .relatedCellAddresses(List.of(address))
                        .recommendedAction("Check whether two reporting conventions are mixed for this cell")
                        .timeRange(range)
                        .build());
            }

            double skewness = DescriptiveStatistics.skewness(values);
            if (Math.abs(skewness) > options.getSkewnessThreshold()) {
                String direction = skewness > 0 ? "positively" : "negatively";
                anomalies.add(DataAnomaly.builder()
                        .anomalyType("Skewed Distribution")
                        .description(String.format(Locale.ROOT,
                                "Cell %s values are strongly %s skewed (skewness: %.2f)", address, direction, skewness))
                        .severity(Severity.LOW)
                        .detectedAt(context.getNow())
                        .affectedEntity(context.subjectLabel())
                        .affectedMetric(address)
                        .expectedValue(mean)
                        .threshold(options.getSkewnessThreshold())
                        .relatedCellAddresses(List.of(address))
                        .timeRange(range)
                        .build());
            }
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }
}
