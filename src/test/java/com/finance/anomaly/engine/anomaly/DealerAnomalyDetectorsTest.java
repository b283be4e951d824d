package com.finance.anomaly.engine.anomaly;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Quarter-end uplift and industry deviation, the two checks that only run for a whole dealer.
 */
class DealerAnomalyDetectorsTest {

    private final DetectionThresholdConfig config = new DetectionThresholdConfig();

    @Test
    void quarterly_quarterEndUplift_reported() {
        double[] series = new double[8];
        for (int i = 0; i < series.length; i++) series[i] = (i + 1) % 3 == 0 ? 150.0 : 100.0;
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)),
                monthlySeries("D1", 2024, 1, "PL!C5", series), List.of());

        DetectionOutcome<DataAnomaly> outcome = new QuarterlyPatternDetector(config)
                .detect(dealerContext(snapshot, "D1"));

        assertThat(outcome.getFindings()).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo("Quarterly Pattern");
            assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(a.getDescription()).contains("50.0% higher values for PL!C5");
        });
    }

    @Test
    void quarterly_flatSeries_nothingReported() {
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)),
                monthlySeries("D1", 2024, 1, "PL!C5", new double[] {100, 100, 100, 100, 100, 100}), List.of());

        assertThat(new QuarterlyPatternDetector(config).detect(dealerContext(snapshot, "D1")).getFindings()).isEmpty();
    }

    @Test
    void industry_latestValueFarAbovePeers_reported() {
        List<Dealer> dealers = new ArrayList<>();
        List<Submission> submissions = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            dealers.add(createDealer("D" + i, null));
            submissions.add(createSubmission("S" + i, "D" + i, 2024, 6, values("BS!A1", i == 1 ? 200.0 : 100.0)));
        }
        // Older month of the same dealer is ignored
        submissions.add(createSubmission("S0", "D1", 2024, 5, values("BS!A1", 100.0)));
        DataSnapshot snapshot = DataSnapshot.of(dealers, submissions, List.of());

        DetectionOutcome<DataAnomaly> outcome = new IndustryDeviationDetector(config)
                .detect(dealerContext(snapshot, "D1"));

        assertThat(outcome.getFindings()).singleElement().satisfies(a -> {
            assertThat(a.getAnomalyType()).isEqualTo("Industry Deviation");
            assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(a.getExpectedValue()).isEqualTo(100.0);
            assertThat(a.getDescription()).isEqualTo("Dealer 'Dealer D1' is 100.0% above industry average for BS!A1");
        });
    }

    @Test
    void industry_tooFewPeers_insufficientData() {
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null), createDealer("D2", null)),
                List.of(createSubmission("S1", "D1", 2024, 6, values("BS!A1", 200.0)),
                        createSubmission("S2", "D2", 2024, 6, values("BS!A1", 100.0))),
                List.of());

        assertThat(new IndustryDeviationDetector(config).detect(dealerContext(snapshot, "D1")).getStatus())
                .isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }
}
