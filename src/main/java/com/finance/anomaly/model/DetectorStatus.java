package com.finance.anomaly.model;

public enum DetectorStatus {
    /** Detector ran to completion; it may still have produced zero findings. */
    COMPLETED,
    /** Minimum-sample precondition not met, no findings. */
    INSUFFICIENT_DATA,
    /** Detector threw; findings discarded. */
    FAILED,
    /** Batch deadline passed; findings computed before the deadline are kept. */
    CANCELLED
}
