package com.finance.anomaly.engine.pattern;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.*;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ClusterPatternDetectorTest {

    private final ClusterPatternDetector detector = new ClusterPatternDetector(new DetectionThresholdConfig());

    @Test
    void detect_twoSeparatedGroups_yieldTwoClusters() {
        List<Submission> submissions = new ArrayList<>();
        YearMonth start = YearMonth.of(2023, 7);
        for (int i = 0; i < 12; i++) {
            YearMonth period = start.plusMonths(i);
            double v = i % 2 == 0 ? 10.0 : 100.0;
            submissions.add(createSubmission("S" + i, "D1", period.getYear(), period.getMonthValue(),
                    values("BS!A1", v, "BS!A2", v)));
        }
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), submissions, List.of());

        DetectionOutcome<DataPattern> outcome = detector.detect(dealerContext(snapshot, "D1"));

        List<DataPattern> clusters = outcome.getFindings().stream()
                .filter(p -> p.getPatternType().equals("Dealer D1 Cluster Pattern"))
                .collect(java.util.stream.Collectors.toList());
        assertThat(clusters).hasSize(2);
        assertThat(clusters).allSatisfy(p -> {
            assertThat(p.getDescription()).contains("50.0% of submissions (6 out of 12)");
            assertThat(p.getSignificance()).isEqualTo(Severity.MEDIUM);
        });
        assertThat(clusters).extracting(DataPattern::getDescription)
                .anySatisfy(d -> assertThat(d).contains("BS!A1: 10, BS!A2: 10"))
                .anySatisfy(d -> assertThat(d).contains("BS!A1: 100, BS!A2: 100"));

        // Both clusters span 2023 and 2024
        assertThat(outcome.getFindings()).filteredOn(p -> p.getPatternType().equals("Dealer D1 Stable Pattern"))
                .hasSize(2);
    }

    @Test
    void detect_tooFewSubmissions_insufficientData() {
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)),
                monthlySeries("D1", 2024, 1, "BS!A1", new double[] {1, 2, 3}), List.of());

        assertThat(detector.detect(dealerContext(snapshot, "D1")).getStatus()).isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }
}
