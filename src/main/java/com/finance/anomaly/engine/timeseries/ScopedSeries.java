package com.finance.anomaly.engine.timeseries;

import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.model.Submission;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks the per-address series a time-series detector works on for the context's scope:
 * <ul>
 *   <li>submission: the dealer's history up to and including the submission's month</li>
 *   <li>dealer: the dealer's full history</li>
 *   <li>group and global: the monthly average across the dealers of the working set</li>
 * </ul>
 */
public final class ScopedSeries {

    private ScopedSeries() {}

    public static Map<String, List<SeriesPoint>> of(DetectionContext context) {
        switch (context.getScope()) {
            case SUBMISSION: {
                Submission submission = context.getSubmission();
                if (submission == null) return Map.of();
                List<Submission> history = context.getSnapshot().submissionsOf(submission.getDealerId()).stream()
                        .filter(s -> !s.getPeriod().isAfter(submission.getPeriod()))
                        .collect(Collectors.toList());
                return SeriesExtractor.perAddress(history);
            }
            case DEALER:
                if (context.getDealer() == null) return Map.of();
                return SeriesExtractor.perAddress(context.getSnapshot().submissionsOf(context.getDealer().getId()));
            default:
                List<Submission> submissions = context.getSubmissions() != null ? context.getSubmissions() : List.of();
                return SeriesExtractor.periodAverages(submissions);
        }
    }

    /**
     * "dealer DEALER-001" or "dealer group G-1", as used in finding descriptions.
     */
    public static String subjectPhrase(DetectionContext context) {
        switch (context.getScope()) {
            case SUBMISSION:
                return "dealer " + (context.getSubmission() != null ? context.getSubmission().getDealerId() : "");
            case DEALER:
                return "dealer " + (context.getDealer() != null ? context.getDealer().getId() : "");
            case GROUP:
                return "dealer group " + context.getGroupId();
            default:
                return "all dealers";
        }
    }

    /**
     * Scope word inserted into finding type tags ("Dealer", "Group"); empty for submission scope.
     */
    public static String typeQualifier(DetectionContext context) {
        switch (context.getScope()) {
            case DEALER:
                return "Dealer ";
            case GROUP:
                return "Group ";
            case GLOBAL:
                return "Global ";
            default:
                return "";
        }
    }
}
