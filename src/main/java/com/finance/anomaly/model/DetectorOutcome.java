package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "How a single detector run ended")
public class DetectorOutcome {

    @Schema(description = "Detector name", example = "cross-dealer-outlier")
    String detector;

    @Schema(description = "Unit the detector ran for (dealer id for group fan-out)", example = "DEALER-001")
    String unit;

    @Schema(description = "Run status", example = "COMPLETED")
    DetectorStatus status;

    @Schema(description = "Number of findings the run produced", example = "2")
    int findingCount;

    @Schema(description = "Why the detector did not complete", example = "fewer than 3 dealers share a reporting period")
    String reason;
}
