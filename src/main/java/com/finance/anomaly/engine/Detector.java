package com.finance.anomaly.engine;

/**
 * A single detection algorithm. Implementations are pure functions of the context: they read the
 * loaded snapshot, never the store, and never depend on another detector's output.
 *
 * @param <T> finding type ({@code DataAnomaly} or {@code DataPattern})
 */
public interface Detector<T> {

    /**
     * Stable name used in outcomes, metrics and span tags.
     */
    String getName();

    /**
     * Run the detector. Unmet minimum-sample preconditions are reported as
     * {@link DetectionOutcome#insufficientData}, not thrown.
     */
    DetectionOutcome<T> detect(DetectionContext context);
}
