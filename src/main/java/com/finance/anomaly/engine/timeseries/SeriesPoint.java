package com.finance.anomaly.engine.timeseries;

import lombok.Value;

import java.time.YearMonth;

@Value
public class SeriesPoint {
    YearMonth period;
    double value;
}
