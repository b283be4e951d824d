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
@RequestMapping("/api/v1/submissions")
@Tag(name = "Submissions", description = "Anomaly, pattern and time-series analysis of a single submission")
public class SubmissionDetectionController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final PatternDetectionService patternDetectionService;
    private final TimeSeriesMlService timeSeriesMlService;

    public SubmissionDetectionController(AnomalyDetectionService anomalyDetectionService,
                                         PatternDetectionService patternDetectionService,
                                         TimeSeriesMlService timeSeriesMlService) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.patternDetectionService = patternDetectionService;
        this.timeSeriesMlService = timeSeriesMlService;
    }

    @Operation(summary = "Detect anomalies in a submission",
            description = "Missing template cells, in-table statistical outliers and year-over-year variance " +
                    "against the same month of the previous year.")
    @GetMapping("/{submissionId}/anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getAnomalies(
            @Parameter(description = "Submission ID", example = "SUB-2024-03-DEALER-001")
            @PathVariable String submissionId) {
        return respond(anomalyDetectionService.detectAnomaliesInSubmission(submissionId));
    }

    @Operation(summary = "Detect patterns in a submission",
            description = "Cell correlations across the dealer's history, arithmetic relationships between cells " +
                    "of a sheet and seasonal peaks.")
    @GetMapping("/{submissionId}/patterns")
    public ResponseEntity<DetectionReport<DataPattern>> getPatterns(
            @Parameter(description = "Submission ID", example = "SUB-2024-03-DEALER-001")
            @PathVariable String submissionId) {
        return respond(patternDetectionService.detectPatternsInSubmission(submissionId));
    }

    @Operation(summary = "Detect time-series anomalies for a submission",
            description = "Spikes and change points in the dealer's series up to the submission's month.")
    @GetMapping("/{submissionId}/ml-anomalies")
    public ResponseEntity<DetectionReport<DataAnomaly>> getMlAnomalies(
            @Parameter(description = "Submission ID", example = "SUB-2024-03-DEALER-001")
            @PathVariable String submissionId) {
        return respond(timeSeriesMlService.detectTimeSeriesAnomaliesInSubmission(submissionId));
    }

    @Operation(summary = "Cluster the submission's dealer history",
            description = "k-means clusters of the dealer's submissions up to the submission's month.")
    @GetMapping("/{submissionId}/ml-clusters")
    public ResponseEntity<DetectionReport<DataPattern>> getMlClusters(
            @Parameter(description = "Submission ID", example = "SUB-2024-03-DEALER-001")
            @PathVariable String submissionId) {
        return respond(timeSeriesMlService.detectClustersForSubmission(submissionId));
    }

    @Operation(summary = "Forecast the submission's cells",
            description = "Three-month forecast from linear trend plus monthly seasonal indices.")
    @GetMapping("/{submissionId}/ml-forecast")
    public ResponseEntity<DetectionReport<DataPattern>> getForecast(
            @Parameter(description = "Submission ID", example = "SUB-2024-03-DEALER-001")
            @PathVariable String submissionId) {
        return respond(timeSeriesMlService.forecast(submissionId));
    }

    private static <T> ResponseEntity<DetectionReport<T>> respond(DetectionReport<T> report) {
        if (!report.isSubjectFound()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(report);
    }
}
