package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A statistically or behaviourally unusual value found in submitted data")
public class DataAnomaly {

    @Schema(description = "Anomaly type tag", example = "Cross-Dealer Outlier")
    String anomalyType;

    @Schema(description = "Human-readable explanation",
            example = "Dealer 'Northside Motors' reported value for BalanceSheet!C12 is 395.0% higher than average")
    String description;

    @Schema(description = "Severity of the anomaly", example = "high")
    Severity severity;

    @Schema(description = "When the anomaly was detected")
    Instant detectedAt;

    @Schema(description = "Anomaly score (0-100)", example = "100.0")
    Double anomalyScore;

    @Schema(description = "Dealer, group or submission the anomaly concerns", example = "Northside Motors")
    String affectedEntity;

    @Schema(description = "Metric (global cell address) the anomaly concerns", example = "BalanceSheet!C12")
    String affectedMetric;

    @Schema(description = "Observed value", example = "500.0")
    Double actualValue;

    @Schema(description = "Value the detector expected", example = "100.25")
    Double expectedValue;

    @Schema(description = "Threshold that was exceeded", example = "103.49")
    Double threshold;

    @Schema(description = "Global cell addresses involved")
    List<String> relatedCellAddresses;

    @Schema(description = "Business impact note")
    String businessImpact;

    @Schema(description = "Suggested follow-up")
    String recommendedAction;

    @Schema(description = "Reporting period span of the anomaly")
    TimeRange timeRange;
}
