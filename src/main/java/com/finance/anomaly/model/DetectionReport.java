package com.finance.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Result of one detection request: ordered findings plus the outcome of every detector that ran.
 * A request for an unknown subject yields {@code subjectFound=false} and no findings.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Ordered findings of a detection request with per-detector outcomes")
public class DetectionReport<T> {

    @Schema(description = "Scope of the request", example = "DEALER")
    DetectionScope scope;

    @Schema(description = "Submission, dealer or group id; null for global scope", example = "DEALER-001")
    String subjectId;

    @Schema(description = "Whether the requested subject exists", example = "true")
    boolean subjectFound;

    @Schema(description = "Findings in ranked order")
    List<T> findings;

    @Schema(description = "Outcome of every detector run")
    List<DetectorOutcome> outcomes;

    @Schema(description = "When the report was produced")
    Instant generatedAt;

    public static <T> DetectionReport<T> notFound(DetectionScope scope, String subjectId, Instant now) {
        return DetectionReport.<T>builder()
                .scope(scope)
                .subjectId(subjectId)
                .subjectFound(false)
                .findings(List.of())
                .outcomes(List.of())
                .generatedAt(now)
                .build();
    }
}
