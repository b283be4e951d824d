package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.statistics.DescriptiveStatistics;
import com.finance.anomaly.model.Cell;
import com.finance.anomaly.model.CellDataType;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TemplateStructure;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks one submission table by table against its template.
 *
 * Missing Data: template cells that are absent from the submission or blank. High when more than
 * 5 cells of a table are missing.
 *
 * Statistical Outlier: in tables with more than 5 reported numeric cells, values further than
 * 2 standard deviations from the table mean. High when more than 2 such values are found.
 */
@Component
public class TemplateCompletenessDetector implements Detector<DataAnomaly> {

    private final DetectionThresholdConfig config;

    public TemplateCompletenessDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "template-completeness";
    }

    @Override
    public DetectionOutcome<DataAnomaly> detect(DetectionContext context) {
        Submission submission = context.getSubmission();
        if (submission == null) {
            return DetectionOutcome.insufficientData(getName(), "no submission to check");
        }
        Optional<TemplateStructure> template = context.getSnapshot().template(submission.getTemplateId());
        if (template.isEmpty()) {
            return DetectionOutcome.insufficientData(getName(),
                    "template " + submission.getTemplateId() + " not found");
        }

        String dealerName = context.getSnapshot().dealerName(submission.getDealerId());
        Map<String, Double> numericValues = submission.getNumericValues();
        List<DataAnomaly> anomalies = new ArrayList<>();

        for (TemplateStructure.Sheet sheet : template.get().getSheets()) {
            for (TemplateStructure.Table table : sheet.getTables()) {
                if (context.isCancelled()) break;
                checkMissing(context, submission, dealerName, sheet, table).ifPresent(anomalies::add);
                checkOutliers(context, submission, dealerName, sheet, table, numericValues).ifPresent(anomalies::add);
            }
        }
        return DetectionOutcome.of(getName(), anomalies, context);
    }

    private Optional<DataAnomaly> checkMissing(DetectionContext context, Submission submission, String dealerName,
                                               TemplateStructure.Sheet sheet, TemplateStructure.Table table) {
        List<String> missing = new ArrayList<>();
        for (TemplateStructure.TemplateCell templateCell : table.getCells()) {
            if (templateCell.getDataType() != CellDataType.NUMBER && templateCell.getDataType() != CellDataType.TEXT) {
                continue;
            }
            Optional<Cell> reported = submission.findCell(templateCell.getGlobalAddress());
            if (reported.isEmpty() || reported.get().isBlank()) {
                missing.add(templateCell.getGlobalAddress());
            }
        }
        if (missing.isEmpty()) return Optional.empty();

        int highCount = config.getSubmission().getMissingHighCount();
        return Optional.of(DataAnomaly.builder()
                .anomalyType("Missing Data")
                .description("Found " + missing.size() + " empty cells in table '" + table.getName()
                        + "' on sheet '" + sheet.getName() + "'")
                .severity(missing.size() > highCount ? Severity.HIGH : Severity.MEDIUM)
                .detectedAt(context.getNow())
                .affectedEntity(dealerName)
                .affectedMetric(sheet.getName() + " / " + table.getName())
                .actualValue((double) missing.size())
                .threshold((double) highCount)
                .relatedCellAddresses(List.copyOf(missing))
                .recommendedAction("Request the missing cells from the dealer")
                .timeRange(TimeRange.single(submission.getPeriod()))
                .build());
    }

    private Optional<DataAnomaly> checkOutliers(DetectionContext context, Submission submission, String dealerName,
                                                TemplateStructure.Sheet sheet, TemplateStructure.Table table,
                                                Map<String, Double> numericValues) {
        DetectionThresholdConfig.SubmissionChecks options = config.getSubmission();
        List<String> addresses = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (TemplateStructure.TemplateCell templateCell : table.getCells()) {
            if (templateCell.getDataType() != CellDataType.NUMBER) continue;
            Double value = numericValues.get(templateCell.getGlobalAddress());
            if (value != null) {
                addresses.add(templateCell.getGlobalAddress());
                values.add(value);
            }
        }
        if (values.size() <= options.getOutlierMinCells()) return Optional.empty();

        double[] array = DescriptiveStatistics.toArray(values);
        double mean = DescriptiveStatistics.mean(array);
        double std = DescriptiveStatistics.stdDev(array);
        if (std == 0.0) return Optional.empty();

        List<String> outliers = new ArrayList<>();
        for (int i = 0; i < array.length; i++) {
            if (Math.abs(array[i] - mean) > options.getOutlierZ() * std) {
                outliers.add(addresses.get(i));
            }
        }
        if (outliers.isEmpty()) return Optional.empty();

        return Optional.of(DataAnomaly.builder()
                .anomalyType("Statistical Outlier")
                .description("Found " + outliers.size() + " outlier values in table '" + table.getName()
                        + "' on sheet '" + sheet.getName() + "'")
                .severity(outliers.size() > options.getOutlierHighCount() ? Severity.HIGH : Severity.MEDIUM)
                .detectedAt(context.getNow())
                .affectedEntity(dealerName)
                .affectedMetric(sheet.getName() + " / " + table.getName())
                .expectedValue(mean)
                .threshold(mean + options.getOutlierZ() * std)
                .relatedCellAddresses(List.copyOf(outliers))
                .timeRange(TimeRange.single(submission.getPeriod()))
                .build());
    }
}
