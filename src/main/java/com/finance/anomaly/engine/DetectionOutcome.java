package com.finance.anomaly.engine;

import com.finance.anomaly.model.DetectorOutcome;
import com.finance.anomaly.model.DetectorStatus;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Explicit result of one detector run. Insufficient data and failures carry a reason and no findings;
 * a cancelled run keeps whatever it produced before the deadline.
 */
@Value
public class DetectionOutcome<T> {

    String detector;
    @With
    String unit;
    DetectorStatus status;
    List<T> findings;
    String reason;

    public static <T> DetectionOutcome<T> completed(String detector, List<T> findings) {
        return new DetectionOutcome<>(detector, null, DetectorStatus.COMPLETED, List.copyOf(findings), null);
    }

    public static <T> DetectionOutcome<T> insufficientData(String detector, String reason) {
        return new DetectionOutcome<>(detector, null, DetectorStatus.INSUFFICIENT_DATA, List.of(), reason);
    }

    public static <T> DetectionOutcome<T> failed(String detector, String reason) {
        return new DetectionOutcome<>(detector, null, DetectorStatus.FAILED, List.of(), reason);
    }

    public static <T> DetectionOutcome<T> cancelled(String detector, List<T> partialFindings) {
        return new DetectionOutcome<>(detector, null, DetectorStatus.CANCELLED, List.copyOf(partialFindings),
                "batch deadline reached");
    }

    /**
     * Completed or cancelled depending on whether the context was cancelled mid-run.
     */
    public static <T> DetectionOutcome<T> of(String detector, List<T> findings, DetectionContext context) {
        return context.isCancelled() ? cancelled(detector, findings) : completed(detector, findings);
    }

    public DetectorOutcome toSummary() {
        return DetectorOutcome.builder()
                .detector(detector)
                .unit(unit)
                .status(status)
                .findingCount(findings.size())
                .reason(reason)
                .build();
    }
}
