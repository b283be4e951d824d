package com.finance.anomaly.repository;

import com.finance.anomaly.model.Submission;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Criteria for {@link FinanceDataRepository#listSubmissions}. Unset criteria match everything;
 * set criteria are combined with AND.
 */
@Value
@Builder
public class SubmissionFilter {

    String dealerId;
    Set<String> dealerIds;
    Integer month;
    Integer year;
    // Filed at or after this instant
    Instant since;

    public static SubmissionFilter all() {
        return SubmissionFilter.builder().build();
    }

    public static SubmissionFilter forDealer(String dealerId) {
        return SubmissionFilter.builder().dealerId(dealerId).build();
    }

    public static SubmissionFilter forDealers(Set<String> dealerIds) {
        return SubmissionFilter.builder().dealerIds(dealerIds).build();
    }

    public static SubmissionFilter forPeriod(int month, int year) {
        return SubmissionFilter.builder().month(month).year(year).build();
    }

    public static SubmissionFilter since(Instant since) {
        return SubmissionFilter.builder().since(since).build();
    }

    public boolean matches(Submission submission) {
        if (dealerId != null && !dealerId.equals(submission.getDealerId())) return false;
        if (dealerIds != null && !dealerIds.contains(submission.getDealerId())) return false;
        if (month != null && month != submission.getMonth()) return false;
        if (year != null && year != submission.getYear()) return false;
        if (since != null) {
            Instant submittedAt = submission.getSubmittedAt();
            if (submittedAt == null || submittedAt.isBefore(since)) return false;
        }
        return true;
    }
}
