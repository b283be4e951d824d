package com.finance.anomaly.testutil;

import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    private TestDataFactory() {}

    public static Dealer createDealer(String id, String groupId) {
        return Dealer.builder()
                .id(id)
                .name("Dealer " + id)
                .groupId(groupId)
                .groupName(groupId != null ? "Group " + groupId : null)
                .build();
    }

    public static Cell numberCell(String globalAddress, double value) {
        return Cell.builder()
                .address(globalAddress.substring(globalAddress.indexOf('!') + 1))
                .globalAddress(globalAddress)
                .value(value)
                .dataType(CellDataType.NUMBER)
                .build();
    }

    public static Cell textCell(String globalAddress, String text) {
        return Cell.builder()
                .address(globalAddress.substring(globalAddress.indexOf('!') + 1))
                .globalAddress(globalAddress)
                .textValue(text)
                .dataType(CellDataType.TEXT)
                .build();
    }

    /**
     * Submission filed on the 5th of the month after its reporting period.
     */
    public static Submission createSubmission(String id, String dealerId, int year, int month, List<Cell> cells) {
        return Submission.builder()
                .id(id)
                .dealerId(dealerId)
                .templateId("TPL-1")
                .year(year)
                .month(month)
                .submittedAt(LocalDate.of(year, month, 1).plusMonths(1).withDayOfMonth(5)
                        .atStartOfDay(ZoneOffset.UTC).toInstant())
                .status("SUBMITTED")
                .cells(new ArrayList<>(cells))
                .build();
    }

    /**
     * Submission with one number cell per entry of {@code values}.
     */
    public static Submission createSubmission(String id, String dealerId, int year, int month, Map<String, Double> values) {
        List<Cell> cells = new ArrayList<>();
        values.forEach((address, value) -> cells.add(numberCell(address, value)));
        return createSubmission(id, dealerId, year, month, cells);
    }

    /**
     * Ordered address/value map from alternating arguments: values("BS!A1", 10.0, "BS!A2", 20.0).
     */
    public static Map<String, Double> values(Object... addressValuePairs) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < addressValuePairs.length; i += 2) {
            values.put((String) addressValuePairs[i], ((Number) addressValuePairs[i + 1]).doubleValue());
        }
        return values;
    }

    /**
     * Monthly submissions of one dealer, one per element of {@code series}, starting at the given month.
     */
    public static List<Submission> monthlySeries(String dealerId, int startYear, int startMonth,
                                                 String address, double[] series) {
        List<Submission> submissions = new ArrayList<>();
        LocalDate period = LocalDate.of(startYear, startMonth, 1);
        for (int i = 0; i < series.length; i++) {
            LocalDate p = period.plusMonths(i);
            submissions.add(createSubmission(dealerId + "-" + p.getYear() + "-" + p.getMonthValue(), dealerId,
                    p.getYear(), p.getMonthValue(), values(address, series[i])));
        }
        return submissions;
    }

    public static TemplateStructure createTemplate(String templateId, String sheet, String table,
                                                   TemplateStructure.TemplateCell... cells) {
        TemplateStructure.Table templateTable = TemplateStructure.Table.builder()
                .name(table)
                .cells(new ArrayList<>(List.of(cells)))
                .build();
        TemplateStructure.Sheet templateSheet = TemplateStructure.Sheet.builder()
                .name(sheet)
                .tables(new ArrayList<>(List.of(templateTable)))
                .build();
        return TemplateStructure.builder()
                .templateId(templateId)
                .name("Template " + templateId)
                .sheets(new ArrayList<>(List.of(templateSheet)))
                .build();
    }

    public static TemplateStructure.TemplateCell templateCell(String globalAddress, CellDataType type) {
        return TemplateStructure.TemplateCell.builder()
                .address(globalAddress.substring(globalAddress.indexOf('!') + 1))
                .globalAddress(globalAddress)
                .dataType(type)
                .build();
    }

    public static DetectionContext submissionContext(DataSnapshot snapshot, Submission submission) {
        return DetectionContext.builder()
                .scope(DetectionScope.SUBMISSION)
                .snapshot(snapshot)
                .submission(submission)
                .dealer(snapshot.dealer(submission.getDealerId()).orElse(null))
                .now(NOW)
                .build();
    }

    public static DetectionContext dealerContext(DataSnapshot snapshot, String dealerId) {
        return DetectionContext.builder()
                .scope(DetectionScope.DEALER)
                .snapshot(snapshot)
                .dealer(snapshot.dealer(dealerId).orElseThrow())
                .submission(snapshot.latestSubmissionOf(dealerId).orElse(null))
                .now(NOW)
                .build();
    }

    public static DetectionContext globalContext(DataSnapshot snapshot) {
        return DetectionContext.builder()
                .scope(DetectionScope.GLOBAL)
                .snapshot(snapshot)
                .submissions(snapshot.getSubmissions())
                .now(NOW)
                .build();
    }

    public static DataAnomaly createAnomaly(String type, Severity severity, double score, Instant detectedAt) {
        return DataAnomaly.builder()
                .anomalyType(type)
                .description(type + " in BS!A1")
                .severity(severity)
                .anomalyScore(score)
                .detectedAt(detectedAt)
                .affectedEntity("DEALER-1")
                .affectedMetric("BS!A1")
                .relatedCellAddresses(List.of("BS!A1"))
                .build();
    }

    public static DataPattern createPattern(String type, Severity significance, double confidence) {
        return DataPattern.builder()
                .patternType(type)
                .description(type + " between BS!A1 and BS!A2")
                .significance(significance)
                .confidenceScore(confidence)
                .detectedAt(NOW)
                .relatedCellAddresses(List.of("BS!A1", "BS!A2"))
                .build();
    }

    public static <T> DetectionReport<T> createReport(DetectionScope scope, String subjectId, List<T> findings) {
        return DetectionReport.<T>builder()
                .scope(scope)
                .subjectId(subjectId)
                .subjectFound(true)
                .findings(findings)
                .outcomes(List.of(DetectorOutcome.builder()
                        .detector("test-detector")
                        .status(DetectorStatus.COMPLETED)
                        .findingCount(findings.size())
                        .build()))
                .generatedAt(NOW)
                .build();
    }
}
