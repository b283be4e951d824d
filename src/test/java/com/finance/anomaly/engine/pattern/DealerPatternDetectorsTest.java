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

class DealerPatternDetectorsTest {

    private final DetectionThresholdConfig config = new DetectionThresholdConfig();

    @Test
    void yearlyChange_reportsChangeBetweenConsecutiveYears() {
        List<Submission> submissions = new ArrayList<>();
        for (int m = 1; m <= 12; m++) {
            submissions.add(createSubmission("A" + m, "D1", 2023, m, values("BS!A1", 100.0, "BS!A2", 50.0)));
            submissions.add(createSubmission("B" + m, "D1", 2024, m, values("BS!A1", 130.0, "BS!A2", 50.0)));
        }
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), submissions, List.of());

        DetectionOutcome<DataPattern> outcome = new YearlyChangeDetector(config).detect(dealerContext(snapshot, "D1"));

        assertThat(outcome.getFindings()).singleElement().satisfies(p -> {
            assertThat(p.getPatternType()).isEqualTo("Yearly Change Pattern");
            assertThat(p.getDescription()).contains("from 2023 to 2024").contains("BS!A1: 30.0% change from 100 to 130");
            assertThat(p.getSignificance()).isEqualTo(Severity.HIGH);
            assertThat(p.getRelatedCellAddresses()).containsExactly("BS!A1");
            assertThat(p.getTimeRange().getStart()).isEqualTo(YearMonth.of(2023, 1));
            assertThat(p.getTimeRange().getEnd()).isEqualTo(YearMonth.of(2024, 12));
        });
    }

    @Test
    void yearlyChange_fewerThanTwelveMonths_insufficientData() {
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)),
                monthlySeries("D1", 2024, 1, "BS!A1", new double[] {1, 2, 3, 4, 5, 6}), List.of());

        assertThat(new YearlyChangeDetector(config).detect(dealerContext(snapshot, "D1")).getStatus())
                .isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }

    @Test
    void monthlySeasonality_marksPeakMonth() {
        List<Submission> submissions = new ArrayList<>();
        for (int m = 1; m <= 12; m++) {
            submissions.add(createSubmission("S" + m, "D1", 2024, m,
                    values("BS!A1", m == 12 ? 200.0 : 100.0, "BS!A2", 10.0, "BS!A3", 20.0)));
        }
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)), submissions, List.of());

        DetectionOutcome<DataPattern> outcome = new MonthlySeasonalityDetector(config).detect(dealerContext(snapshot, "D1"));

        assertThat(outcome.getFindings()).singleElement().satisfies(p -> {
            assertThat(p.getPatternType()).isEqualTo("Monthly Seasonality");
            assertThat(p.getDescription()).isEqualTo("Dealer D1 shows seasonal patterns for BS!A1: December: Peak");
            assertThat(p.getSignificance()).isEqualTo(Severity.MEDIUM);
            assertThat(p.getConfidenceScore()).isEqualTo(75.0);
        });
    }

    @Test
    void groupDeviation_dealerAboveItsGroup() {
        List<Dealer> dealers = List.of(createDealer("D1", "G1"), createDealer("D2", "G1"), createDealer("D3", "G1"));
        List<Submission> submissions = new ArrayList<>();
        for (Dealer dealer : dealers) {
            double a1 = dealer.getId().equals("D1") ? 150.0 : 100.0;
            for (int m = 1; m <= 12; m++) {
                submissions.add(createSubmission(dealer.getId() + "-" + m, dealer.getId(), 2024, m,
                        values("BS!A1", a1, "BS!A2", 100.0, "BS!A3", 100.0)));
            }
        }
        DataSnapshot snapshot = DataSnapshot.of(dealers, submissions, List.of());

        DetectionOutcome<DataPattern> outcome = new GroupDeviationDetector(config).detect(dealerContext(snapshot, "D1"));

        assertThat(outcome.getFindings()).singleElement().satisfies(p -> {
            assertThat(p.getPatternType()).isEqualTo("Group Deviation Pattern");
            assertThat(p.getDescription()).isEqualTo("Dealer Dealer D1 shows higher values than other Group G1 dealers: "
                    + "BS!A1: 50.0% different (150 vs. group avg 100)");
            assertThat(p.getSignificance()).isEqualTo(Severity.HIGH);
            assertThat(p.getIndustryComparison().getBenchmark()).isEqualTo(100.0);
            assertThat(p.getIndustryComparison().getDeviation()).isEqualTo(50.0);
        });
    }

    @Test
    void groupDeviation_dealerWithoutGroup_insufficientData() {
        DataSnapshot snapshot = DataSnapshot.of(List.of(createDealer("D1", null)),
                monthlySeries("D1", 2024, 1, "BS!A1", new double[] {1, 2, 3}), List.of());

        assertThat(new GroupDeviationDetector(config).detect(dealerContext(snapshot, "D1")).getStatus())
                .isEqualTo(DetectorStatus.INSUFFICIENT_DATA);
    }
}
