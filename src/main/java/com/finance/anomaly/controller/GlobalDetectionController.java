package com.finance.anomaly.controller;

import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.service.AnomalyDetectionService;
import com.finance.anomaly.service.TimeSeriesMlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/global")
@Tag(name = "Global", description = "Analysis across every dealer over a recent window of submissions")
public class GlobalDetectionController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final TimeSeriesMlService timeSeriesMlService;

    public GlobalDetectionController(AnomalyDetectionService anomalyDetectionService,
                                     TimeSeriesMlService timeSeriesMlService) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.timeSeriesMlService = timeSeriesMlService;
    }

    @Operation(summary = "Detect global anomalies",
            description = "Distribution shape, cross-dealer outliers and temporal trends over submissions filed " +
                    "in the last N months. Ordered newest first.")
    @GetMapping("/anomalies")
    public ResponseEntity<?> getAnomalies(
            @Parameter(description = "Look-back window in months", example = "3")
            @RequestParam(defaultValue = "3") int lastMonths) {
        if (lastMonths < 1) return badRequest();
        DetectionReport<DataAnomaly> report = anomalyDetectionService.detectGlobalAnomalies(lastMonths);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Cluster recent submissions of all dealers")
    @GetMapping("/ml-clusters")
    public ResponseEntity<?> getMlClusters(
            @Parameter(description = "Look-back window in months", example = "3")
            @RequestParam(defaultValue = "3") int lastMonths) {
        if (lastMonths < 1) return badRequest();
        DetectionReport<DataPattern> report = timeSeriesMlService.detectGlobalClusters(lastMonths);
        return ResponseEntity.ok(report);
    }

    private static ResponseEntity<Map<String, String>> badRequest() {
        return ResponseEntity.badRequest().body(Map.of("error", "lastMonths must be >= 1", "field", "lastMonths"));
    }
}
