package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class HistoricalVarianceDetectorTest {

    private final HistoricalVarianceDetector detector = new HistoricalVarianceDetector(new DetectionThresholdConfig());

    @Test
    void detect_comparesWithSameMonthLastYear() {
        Submission lastYear = createSubmission("S-2023-03", "D1", 2023, 3,
                values("BS!A1", 100.0, "BS!A2", 50.0, "BS!A3", 10.0));
        Submission current = createSubmission("S-2024-03", "D1", 2024, 3,
                values("BS!A1", 160.0, "BS!A2", 55.0));
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), List.of(lastYear, current), List.of());

        DetectionOutcome<DataAnomaly> outcome = detector.detect(submissionContext(snapshot, current));

        assertThat(outcome.getFindings()).extracting(DataAnomaly::getAnomalyType)
                .containsExactly("Year-Over-Year Variance", "Missing Historical Data");

        DataAnomaly variance = outcome.getFindings().get(0);
        assertThat(variance.getAffectedMetric()).isEqualTo("BS!A1");
        assertThat(variance.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(variance.getDescription()).isEqualTo("Cell BS!A1 shows 60.0% increase compared to March last year");

        DataAnomaly missing = outcome.getFindings().get(1);
        assertThat(missing.getRelatedCellAddresses()).containsExactly("BS!A3");
        assertThat(missing.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void detect_noSubmissionLastYear_insufficientData() {
        Submission current = createSubmission("S-2024-03", "D1", 2024, 3, values("BS!A1", 160.0));
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), List.of(current), List.of());

        assertThat(detector.detect(submissionContext(snapshot, current)).getStatus())
                .isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }
}
