package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.model.Submission;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class DistributionAnomalyDetectorTest {

    private final DistributionAnomalyDetector detector = new DistributionAnomalyDetector(new DetectionThresholdConfig());

    @Test
    void detect_constantValues_noSkewedDistribution() {
        DetectionOutcome<DataAnomaly> outcome = detector.detect(globalContext(snapshotOf(7, 7, 7, 7, 7, 7)));

        assertThat(outcome.getFindings()).isEmpty();
    }

    @Test
    void detect_longTail_reportsSkewedDistribution() {
        DetectionOutcome<DataAnomaly> outcome = detector.detect(globalContext(snapshotOf(1, 1, 1, 1, 1, 1, 1, 20)));

        assertThat(outcome.getFindings())
                .filteredOn(a -> a.getAnomalyType().equals("Skewed Distribution"))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getSeverity()).isEqualTo(Severity.LOW);
                    assertThat(a.getDescription()).contains("positively skewed");
                });
    }

    @Test
    void detect_twoSeparatedGroups_reportsBimodalDistribution() {
        DetectionOutcome<DataAnomaly> outcome = detector.detect(globalContext(snapshotOf(1, 1, 1, 1, 10, 10, 10, 10)));

        assertThat(outcome.getFindings())
                .extracting(DataAnomaly::getAnomalyType)
                .containsExactly("Bimodal Distribution");
        assertThat(outcome.getFindings().get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void detect_fewerThanFiveObservations_skipsAddress() {
        DetectionOutcome<DataAnomaly> outcome = detector.detect(globalContext(snapshotOf(1, 1, 1, 50)));

        assertThat(outcome.getFindings()).isEmpty();
    }

    private static DataSnapshot snapshotOf(double... reported) {
        List<Submission> submissions = new ArrayList<>();
        for (int i = 0; i < reported.length; i++) {
            submissions.add(createSubmission("S" + i, "D" + i, 2024, 11, values("BS!A1", reported[i])));
        }
        return DataSnapshot.of(List.of(), submissions, List.of());
    }
}
