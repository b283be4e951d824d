package com.finance.anomaly.engine;

import lombok.Value;

/**
 * One unit of fan-out work: a detector bound to the context it runs against.
 */
@Value
public class DetectionTask<T> {

    Detector<T> detector;
    DetectionContext context;
    // Label of the unit the task belongs to (dealer id in group fan-out), null otherwise
    String unit;

    public static <T> DetectionTask<T> of(Detector<T> detector, DetectionContext context) {
        return new DetectionTask<>(detector, context, null);
    }

    public static <T> DetectionTask<T> of(Detector<T> detector, DetectionContext context, String unit) {
        return new DetectionTask<>(detector, context, unit);
    }
}
