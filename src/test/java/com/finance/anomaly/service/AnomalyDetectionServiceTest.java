package com.finance.anomaly.service;

import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.DetectorOutcome;
import com.finance.anomaly.model.DetectorStatus;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.repository.FinanceDataRepository;
import com.finance.anomaly.repository.InMemoryFinanceDataRepository;
import com.finance.anomaly.testutil.TestServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock
    private FinanceDataRepository failingRepository;

    private ExecutorService executor;
    private InMemoryFinanceDataRepository repository;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        repository = new InMemoryFinanceDataRepository();
        double[] reported = {100, 102, 98, 101, 500};
        for (int i = 0; i < reported.length; i++) {
            String dealerId = "D" + (i + 1);
            repository.saveDealer(createDealer(dealerId, "G1"))
                    .saveSubmission(createSubmission("S" + (i + 1), dealerId, 2024, 12, values("BS!A1", reported[i])));
        }
        service = new TestServices(repository, executor).anomalies();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void detectAnomaliesInSubmission_unknownSubmission_notFoundReport() {
        DetectionReport<DataAnomaly> report = service.detectAnomaliesInSubmission("NOPE");

        assertThat(report.isSubjectFound()).isFalse();
        assertThat(report.getScope()).isEqualTo(DetectionScope.SUBMISSION);
        assertThat(report.getFindings()).isEmpty();
        assertThat(report.getOutcomes()).isEmpty();
    }

    @Test
    void detectAnomaliesInSubmission_runsSubmissionDetectors() {
        DetectionReport<DataAnomaly> report = service.detectAnomaliesInSubmission("S1");

        assertThat(report.isSubjectFound()).isTrue();
        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getDetector)
                .containsExactly("template-completeness", "historical-variance");
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    void detectAnomaliesByGroup_fansOutPerDealerAndFlagsOutlier() {
        DetectionReport<DataAnomaly> report = service.detectAnomaliesByGroup("G1");

        assertThat(report.isSubjectFound()).isTrue();
        // four dealer detectors per member plus cross-dealer and trend over the group
        assertThat(report.getOutcomes()).hasSize(5 * 4 + 2);
        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getUnit)
                .contains("D1", "D5", "G1");
        assertThat(report.getFindings())
                .filteredOn(a -> "Cross-Dealer Outlier".equals(a.getAnomalyType()))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getAffectedEntity()).isEqualTo("Dealer D5");
                    assertThat(a.getSeverity()).isEqualTo(Severity.HIGH);
                });
    }

    @Test
    void detectAnomaliesByGroup_unknownGroup_notFoundReport() {
        assertThat(service.detectAnomaliesByGroup("G-404").isSubjectFound()).isFalse();
    }

    @Test
    void detectGlobalAnomalies_usesSubmissionsOfRecentMonths() {
        DetectionReport<DataAnomaly> report = service.detectGlobalAnomalies(3);

        assertThat(report.getScope()).isEqualTo(DetectionScope.GLOBAL);
        assertThat(report.getSubjectId()).isNull();
        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getDetector)
                .containsExactly("distribution", "cross-dealer-outlier", "temporal-trend");
        assertThat(report.getFindings()).extracting(DataAnomaly::getAffectedEntity).contains("Dealer D5");
    }

    @Test
    void detectGlobalAnomalies_windowExcludesOlderSubmissions() {
        // Filed 2024-07-05, outside the one-month window ending at NOW
        repository.saveSubmission(createSubmission("OLD", "D1", 2024, 6, values("BS!A1", 9999.0)));

        DetectionReport<DataAnomaly> report = service.detectGlobalAnomalies(1);

        assertThat(report.getFindings()).noneMatch(a -> Double.valueOf(9999.0).equals(a.getActualValue()));
    }

    @Test
    void repositoryFailure_reportedAsFailedLoaderOutcome() {
        when(failingRepository.getSubmission(any())).thenThrow(new IllegalStateException("cluster unreachable"));
        AnomalyDetectionService failing = new TestServices(failingRepository, executor).anomalies();

        DetectionReport<DataAnomaly> report = failing.detectAnomaliesInSubmission("S1");

        assertThat(report.isSubjectFound()).isTrue();
        assertThat(report.getFindings()).isEmpty();
        assertThat(report.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getDetector()).isEqualTo("snapshot-loader");
            assertThat(o.getStatus()).isEqualTo(DetectorStatus.FAILED);
            assertThat(o.getReason()).isEqualTo("cluster unreachable");
        });
    }

    @Test
    void globalRepositoryFailure_reportedAsFailedLoaderOutcome() {
        when(failingRepository.listDealers(any())).thenThrow(new IllegalStateException("scan timed out"));
        AnomalyDetectionService failing = new TestServices(failingRepository, executor).anomalies();

        DetectionReport<DataAnomaly> report = failing.detectGlobalAnomalies(3);

        assertThat(report.getOutcomes()).extracting(DetectorOutcome::getStatus).containsExactly(DetectorStatus.FAILED);
    }
}
