package com.finance.anomaly.engine;

import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TimeRange;

import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.Locale;

public final class ReportingPeriods {

    private ReportingPeriods() {}

    public static String monthName(int month) {
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * "3/2024" style label used in finding descriptions.
     */
    public static String label(YearMonth period) {
        return period.getMonthValue() + "/" + period.getYear();
    }

    /**
     * Span from the earliest to the latest reporting month of the given submissions, or null if empty.
     */
    public static TimeRange span(Collection<Submission> submissions) {
        YearMonth start = null;
        YearMonth end = null;
        for (Submission submission : submissions) {
            YearMonth period = submission.getPeriod();
            if (start == null || period.isBefore(start)) start = period;
            if (end == null || period.isAfter(end)) end = period;
        }
        return start == null ? null : TimeRange.of(start, end);
    }

    public static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
