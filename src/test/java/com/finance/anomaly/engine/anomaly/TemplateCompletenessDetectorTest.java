package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class TemplateCompletenessDetectorTest {

    private final TemplateCompletenessDetector detector = new TemplateCompletenessDetector(new DetectionThresholdConfig());

    private final TemplateStructure template = createTemplate("TPL-1", "BS", "Assets",
            templateCell("BS!A1", CellDataType.NUMBER),
            templateCell("BS!A2", CellDataType.NUMBER),
            templateCell("BS!A3", CellDataType.NUMBER),
            templateCell("BS!A4", CellDataType.NUMBER),
            templateCell("BS!A5", CellDataType.NUMBER),
            templateCell("BS!A6", CellDataType.NUMBER),
            templateCell("BS!A7", CellDataType.NUMBER),
            templateCell("BS!B1", CellDataType.TEXT));

    @Test
    void detect_absentAndBlankCells_reportsMissingData() {
        List<Cell> cells = new ArrayList<>();
        for (int i = 1; i <= 6; i++) cells.add(numberCell("BS!A" + i, 10.0));
        cells.add(textCell("BS!B1", "  "));
        Submission submission = createSubmission("S1", "D1", 2024, 6, cells);

        DetectionOutcome<DataAnomaly> outcome = detector.detect(submissionContext(snapshotWith(submission), submission));

        assertThat(outcome.getFindings()).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo("Missing Data");
            assertThat(a.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(a.getRelatedCellAddresses()).containsExactly("BS!A7", "BS!B1");
            assertThat(a.getDescription()).isEqualTo("Found 2 empty cells in table 'Assets' on sheet 'BS'");
        });
    }

    @Test
    void detect_valueFarFromTableMean_reportsStatisticalOutlier() {
        List<Cell> cells = new ArrayList<>();
        for (int i = 1; i <= 6; i++) cells.add(numberCell("BS!A" + i, 10.0));
        cells.add(numberCell("BS!A7", 100.0));
        cells.add(textCell("BS!B1", "Audited"));
        Submission submission = createSubmission("S1", "D1", 2024, 6, cells);

        DetectionOutcome<DataAnomaly> outcome = detector.detect(submissionContext(snapshotWith(submission), submission));

        assertThat(outcome.getFindings()).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo("Statistical Outlier");
            assertThat(a.getRelatedCellAddresses()).containsExactly("BS!A7");
        });
    }

    @Test
    void detect_unknownTemplate_insufficientData() {
        Submission submission = createSubmission("S1", "D1", 2024, 6, values("BS!A1", 1.0));
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), List.of(submission), List.of());

        DetectionOutcome<DataAnomaly> outcome = detector.detect(submissionContext(snapshot, submission));

        assertThat(outcome.getStatus()).isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }

    private DataSnapshot snapshotWith(Submission submission) {
        return DataSnapshot.of(List.of(createDealer("D1", null)), List.of(submission), List.of(template));
    }
}
