package com.finance.anomaly.model;

public enum DetectionScope {
    SUBMISSION,
    DEALER,
    GROUP,
    GLOBAL
}
