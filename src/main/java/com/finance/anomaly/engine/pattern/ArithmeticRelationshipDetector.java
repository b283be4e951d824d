package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.model.Cell;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mines exact arithmetic relationships between cells of the same sheet in one submission.
 *
 * Logic: for every sheet with at least 3 numeric cells, each triple (a, b, c) of distinct cells is
 * tested for a + b = c (unordered a, b) and a - b = c (ordered a, b) within an absolute tolerance
 * of 0.01. Triples where a or b is zero are skipped since they match trivially.
 *
 * Example: A=40, B=60, C=100 gives the Sum Relationship A + B = C. With C=100.02 it no longer holds;
 * with C=100.005 it still does.
 */
@Component
public class ArithmeticRelationshipDetector implements Detector<DataPattern> {

    private final DetectionThresholdConfig config;

    public ArithmeticRelationshipDetector(DetectionThresholdConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "arithmetic-relationship";
    }

    @Override
    public DetectionOutcome<DataPattern> detect(DetectionContext context) {
        DetectionThresholdConfig.Arithmetic options = config.getArithmetic();
        Submission submission = context.getSubmission();
        if (submission == null) {
            return DetectionOutcome.insufficientData(getName(), "no submission in scope");
        }

        Map<String, Map<String, Double>> bySheet = new LinkedHashMap<>();
        for (Cell cell : submission.getCells()) {
            if (!cell.isNumeric() || cell.getGlobalAddress() == null) continue;
            bySheet.computeIfAbsent(cell.getSheetName(), k -> new LinkedHashMap<>())
                    .putIfAbsent(cell.getGlobalAddress(), cell.getValue());
        }

        TimeRange range = TimeRange.single(submission.getPeriod());
        Set<String> seen = new LinkedHashSet<>();
        List<DataPattern> patterns = new ArrayList<>();
        for (Map<String, Double> sheet : bySheet.values()) {
            if (sheet.size() < options.getMinCellsPerSheet()) continue;
            List<String> addresses = new ArrayList<>(sheet.keySet());
            double[] values = addresses.stream().mapToDouble(sheet::get).toArray();
            int n = addresses.size();

            for (int i = 0; i < n; i++) {
                if (context.isCancelled()) break;
                if (values[i] == 0.0) continue;
                for (int j = 0; j < n; j++) {
                    if (j == i || values[j] == 0.0) continue;
                    for (int k = 0; k < n; k++) {
                        if (k == i || k == j) continue;

                        if (i < j && Math.abs(values[i] + values[j] - values[k]) < options.getTolerance()) {
                            String formula = addresses.get(i) + " + " + addresses.get(j) + " = " + addresses.get(k);
                            if (seen.add(formula)) {
                                patterns.add(relationship("Sum Relationship", formula, addresses, i, j, k, context, range));
                            }
                        }
                        if (Math.abs(values[i] - values[j] - values[k]) < options.getTolerance()) {
                            String formula = addresses.get(i) + " - " + addresses.get(j) + " = " + addresses.get(k);
                            if (seen.add(formula)) {
                                patterns.add(relationship("Difference Relationship", formula, addresses, i, j, k, context, range));
                            }
                        }
                    }
                }
            }
        }
        return DetectionOutcome.of(getName(), patterns, context);
    }

    private DataPattern relationship(String type, String formula, List<String> addresses, int a, int b, int c,
                                     DetectionContext context, TimeRange range) {
        return DataPattern.builder()
                .patternType(type)
                .description(formula)
                .formula(formula)
                .significance(Severity.HIGH)
                .confidenceScore(config.getArithmetic().getConfidence())
                .detectedAt(context.getNow())
                .relatedCellAddresses(List.of(addresses.get(a), addresses.get(b), addresses.get(c)))
                .timeRange(range)
                .build();
    }
}
