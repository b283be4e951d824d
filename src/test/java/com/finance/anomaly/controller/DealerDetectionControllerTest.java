package com.finance.anomaly.controller;

import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.service.AnomalyDetectionService;
import com.finance.anomaly.service.PatternDetectionService;
import com.finance.anomaly.service.TimeSeriesMlService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DealerDetectionController.class)
class DealerDetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService anomalyDetectionService;

    @MockBean
    private PatternDetectionService patternDetectionService;

    @MockBean
    private TimeSeriesMlService timeSeriesMlService;

    @Test
    void getAnomalies_found() throws Exception {
        when(anomalyDetectionService.detectAnomaliesByDealer("D-1"))
                .thenReturn(createReport(DetectionScope.DEALER, "D-1",
                        List.of(createAnomaly("Quarterly Pattern", Severity.HIGH, 80, NOW))));

        mockMvc.perform(get("/api/v1/dealers/D-1/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("DEALER"))
                .andExpect(jsonPath("$.findings[0].anomalyType").value("Quarterly Pattern"))
                .andExpect(jsonPath("$.findings[0].affectedMetric").value("BS!A1"));
    }

    @Test
    void getAnomalies_unknownDealer_notFound() throws Exception {
        when(anomalyDetectionService.detectAnomaliesByDealer("D-404"))
                .thenReturn(DetectionReport.<DataAnomaly>notFound(DetectionScope.DEALER, "D-404", NOW));

        mockMvc.perform(get("/api/v1/dealers/D-404/anomalies"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getPatterns_found() throws Exception {
        when(patternDetectionService.detectPatternsByDealer("D-1"))
                .thenReturn(createReport(DetectionScope.DEALER, "D-1",
                        List.of(createPattern("Yearly Change Pattern", Severity.HIGH, 80.0))));

        mockMvc.perform(get("/api/v1/dealers/D-1/patterns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.findings[0].patternType").value("Yearly Change Pattern"));
    }

    @Test
    void getMlAnomalies_found() throws Exception {
        when(timeSeriesMlService.detectTimeSeriesAnomaliesByDealer("D-1"))
                .thenReturn(createReport(DetectionScope.DEALER, "D-1",
                        List.of(createAnomaly("ML-Detected Dealer Change Point", Severity.MEDIUM, 58, NOW))));

        mockMvc.perform(get("/api/v1/dealers/D-1/ml-anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.findings[0].anomalyType").value("ML-Detected Dealer Change Point"))
                .andExpect(jsonPath("$.findings[0].anomalyScore").value(58.0));
    }

    @Test
    void getMlClusters_found() throws Exception {
        when(timeSeriesMlService.detectClustersByDealer("D-1"))
                .thenReturn(createReport(DetectionScope.DEALER, "D-1",
                        List.of(createPattern("Dealer D-1 Cluster Pattern", Severity.MEDIUM, 70.0))));

        mockMvc.perform(get("/api/v1/dealers/D-1/ml-clusters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.findings.length()").value(1));
    }
}
