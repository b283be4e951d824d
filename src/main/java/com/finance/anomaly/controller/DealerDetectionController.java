package com.finance.anomaly.controller;

import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.service.AnomalyDetectionService;
import com.finance.anomaly.service.PatternDetectionService;
import com.finance.anomaly.service.TimeSeriesMlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/dealers")
@Tag(name = "Dealers", description = "Anomalies and patterns across one dealer's submission history")
public class DealerDetectionController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final PatternDetectionService patternDetectionService;
    private final TimeSeriesMlService timeSeriesMlService;

    public DealerDetectionController(AnomalyDetectionService anomalyDetectionService,
                                     PatternDetectionService patternDetectionService,
                                     TimeSeriesMlService timeSeriesMlService) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.patternDetectionService = patternDetectionService;
        this.timeSeriesMlService = timeSeriesMlService;
    }

    @Operation(summary = "Detect dealer anomalies",
            description = "Checks of the latest submission, quarter-end uplift and deviation from peer dealers " +
                    "in the latest reporting month.")
    @GetMapping("/{dealerId}/anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getAnomalies(
            @Parameter(description = "Dealer ID", example = "DEALER-001")
            @PathVariable String dealerId) {
        return respond(anomalyDetectionService.detectAnomaliesByDealer(dealerId));
    }

    @Operation(summary = "Detect dealer patterns",
            description = "Yearly changes, monthly seasonality and deviation from the dealer's group.")
    @GetMapping("/{dealerId}/patterns")
    public ResponseEntity<DetectionReport<DataPattern>> getPatterns(
            @Parameter(description = "Dealer ID", example = "DEALER-001")
            @PathVariable String dealerId) {
        return respond(patternDetectionService.detectPatternsByDealer(dealerId));
    }

    @Operation(summary = "Detect time-series anomalies for a dealer",
            description = "Spikes and change points in every cell series of the dealer.")
    @GetMapping("/{dealerId}/ml-anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getMlAnomalies(
            @Parameter(description = "Dealer ID", example = "DEALER-001")
            @PathVariable String dealerId) {
        return respond(timeSeriesMlService.detectTimeSeriesAnomaliesByDealer(dealerId));
    }

    @Operation(summary = "Cluster a dealer's submissions")
    @GetMapping("/{dealerId}/ml-clusters")
    public ResponseEntity<DetectionReport<DataPattern>> getMlClusters(
            @Parameter(description = "Dealer ID", example = "DEALER-001")
            @PathVariable String dealerId) {
        return respond(timeSeriesMlService.detectClustersByDealer(dealerId));
    }

    private static <T> ResponseEntity<DetectionReport<T>> respond(DetectionReport<T> report) {
        if (!report.isSubjectFound()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }
}
