package com.finance.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "How a dealer's value compares with its peer benchmark")
public class IndustryComparison {

    @Schema(description = "Peer benchmark value", example = "48200.0")
    double benchmark;

    @Schema(description = "Deviation from the benchmark in percent", example = "-34.5")
    double deviation;
}
