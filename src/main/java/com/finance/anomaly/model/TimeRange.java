package com.finance.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.YearMonth;

@Value
@Builder
@Jacksonized
@Schema(description = "Reporting period span a finding refers to")
public class TimeRange {

    @Schema(description = "First reporting month (inclusive)", example = "2023-01")
    YearMonth start;

    @Schema(description = "Last reporting month (inclusive)", example = "2024-03")
    YearMonth end;

    public static TimeRange of(YearMonth start, YearMonth end) {
        return TimeRange.builder().start(start).end(end).build();
    }

    public static TimeRange single(YearMonth period) {
        return of(period, period);
    }
}
