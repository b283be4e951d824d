package com.finance.anomaly.controller;

import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Severity;
import com.finance.anomaly.service.AnomalyDetectionService;
import com.finance.anomaly.service.TimeSeriesMlService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.finance.anomaly.testutil.TestDataFactory.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GlobalDetectionController.class)
class GlobalDetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService anomalyDetectionService;

    @MockBean
    private TimeSeriesMlService timeSeriesMlService;

    @Test
    void getAnomalies_defaultWindow() throws Exception {
        when(anomalyDetectionService.detectGlobalAnomalies(3))
                .thenReturn(createReport(DetectionScope.GLOBAL, null,
                        List.of(createAnomaly("Skewed Distribution", Severity.MEDIUM, 40, NOW))));

        mockMvc.perform(get("/api/v1/global/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("GLOBAL"))
                .andExpect(jsonPath("$.findings[0].anomalyType").value("Skewed Distribution"));
    }

    @Test
    void getAnomalies_customWindow() throws Exception {
        when(anomalyDetectionService.detectGlobalAnomalies(6))
                .thenReturn(createReport(DetectionScope.GLOBAL, null, List.of()));

        mockMvc.perform(get("/api/v1/global/anomalies").param("lastMonths", "6"))
                .andExpect(status().isOk());

        verify(anomalyDetectionService).detectGlobalAnomalies(6);
    }

    @Test
    void getAnomalies_nonPositiveWindow_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/global/anomalies").param("lastMonths", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("lastMonths"));

        verify(anomalyDetectionService, never()).detectGlobalAnomalies(anyInt());
    }

    @Test
    void getMlClusters_found() throws Exception {
        when(timeSeriesMlService.detectGlobalClusters(3))
                .thenReturn(createReport(DetectionScope.GLOBAL, null,
                        List.of(createPattern("Global Cluster Pattern", Severity.HIGH, 70.0))));

        mockMvc.perform(get("/api/v1/global/ml-clusters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.findings[0].patternType").value("Global Cluster Pattern"));
    }

    @Test
    void getMlClusters_negativeWindow_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/global/ml-clusters").param("lastMonths", "-2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("lastMonths must be >= 1"));
    }
}
