package com.finance.anomaly.engine.timeseries;

import lombok.Value;

/**
 * A flagged point of a series: its index and a confidence score in [0, 1].
 */
@Value
public class SeriesSignal {
    int position;
    double score;
}
