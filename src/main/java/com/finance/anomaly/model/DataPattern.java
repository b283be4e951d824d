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
@Schema(description = "A recurring structural relationship found in submitted data")
public class DataPattern {

    @Schema(description = "Pattern type tag", example = "Cell Correlation")
    String patternType;

    @Schema(description = "Human-readable explanation",
            example = "Strong positive correlation (r = 0.97) between Income!B4 and Income!B9")
    String description;

    @Schema(description = "Significance of the pattern", example = "high")
    Severity significance;

    @Schema(description = "Confidence score (0-100)", example = "97.0")
    double confidenceScore;

    @Schema(description = "When the pattern was detected")
    Instant detectedAt;

    @Schema(description = "Pearson correlation coefficient, for correlation patterns", example = "0.97")
    Double correlation;

    @Schema(description = "Formula, for arithmetic relationships", example = "Income!B4 + Income!B5 = Income!B6")
    String formula;

    @Schema(description = "Coefficient of determination, for fitted patterns", example = "0.82")
    Double r2Value;

    @Schema(description = "Global cell addresses involved")
    List<String> relatedCellAddresses;

    @Schema(description = "Reporting period span of the pattern")
    TimeRange timeRange;

    @Schema(description = "Comparison against a peer benchmark")
    IndustryComparison industryComparison;
}
