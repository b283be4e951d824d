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
@RequestMapping("/api/v1/dealer-groups")
@Tag(name = "Dealer Groups", description = "Batch analysis of every dealer in a group, bounded by the batch deadline")
public class DealerGroupDetectionController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final PatternDetectionService patternDetectionService;
    private final TimeSeriesMlService timeSeriesMlService;

    public DealerGroupDetectionController(AnomalyDetectionService anomalyDetectionService,
                                          PatternDetectionService patternDetectionService,
                                          TimeSeriesMlService timeSeriesMlService) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.patternDetectionService = patternDetectionService;
        this.timeSeriesMlService = timeSeriesMlService;
    }

    @Operation(summary = "Detect group anomalies",
            description = "Dealer anomalies of every member plus cross-dealer outliers and temporal trends " +
                    "within the group. Detectors still running at the deadline are reported as cancelled.")
    @GetMapping("/{groupId}/anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getAnomalies(
            @Parameter(description = "Dealer group ID", example = "GROUP-NORTH")
            @PathVariable String groupId) {
        return respond(anomalyDetectionService.detectAnomaliesByGroup(groupId));
    }

    @Operation(summary = "Detect group patterns",
            description = "Clusters of the group's submissions and each member's deviation from the group.")
    @GetMapping("/{groupId}/patterns")
    public ResponseEntity<DetectionReport<DataPattern>> getPatterns(
            @Parameter(description = "Dealer group ID", example = "GROUP-NORTH")
            @PathVariable String groupId) {
        return respond(patternDetectionService.detectPatternsByGroup(groupId));
    }

    @Operation(summary = "Detect time-series anomalies for a group",
            description = "Spikes and change points in the group's monthly averages.")
    @GetMapping("/{groupId}/ml-anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getMlAnomalies(
            @Parameter(description = "Dealer group ID", example = "GROUP-NORTH")
            @PathVariable String groupId) {
        return respond(timeSeriesMlService.detectTimeSeriesAnomaliesByGroup(groupId));
    }

    @Operation(summary = "Cluster a group's submissions")
    @GetMapping("/{groupId}/ml-clusters")
    public ResponseEntity<DetectionReport<DataPattern>> getMlClusters(
            @Parameter(description = "Dealer group ID", example = "GROUP-NORTH")
            @PathVariable String groupId) {
        return respond(timeSeriesMlService.detectClustersByGroup(groupId));
    }

    private static <T> ResponseEntity<DetectionReport<T>> respond(DetectionReport<T> report) {
        if (!report.isSubjectFound()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }
}
