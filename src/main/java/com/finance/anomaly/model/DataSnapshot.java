package com.finance.anomaly.model;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything loaded for one detection scope, indexed by id. Entities reference each other by id
 * only; lookups go through this snapshot. Submissions are kept in chronological order.
 */
public final class DataSnapshot {

    private static final DataSnapshot EMPTY = new DataSnapshot(List.of(), List.of(), List.of());

    private final Map<String, Dealer> dealers;
    private final List<Submission> submissions;
    private final Map<String, List<Submission>> submissionsByDealer;
    private final Map<String, TemplateStructure> templates;

    private DataSnapshot(Collection<Dealer> dealers,
                         Collection<Submission> submissions,
                         Collection<TemplateStructure> templates) {
        Map<String, Dealer> dealerIndex = new LinkedHashMap<>();
        for (Dealer dealer : dealers) {
            dealerIndex.putIfAbsent(dealer.getId(), dealer);
        }

        // Same submission may arrive from several reads of one scope
        Map<String, Submission> unique = new LinkedHashMap<>();
        for (Submission submission : submissions) {
            unique.putIfAbsent(submission.getId(), submission);
        }
        List<Submission> ordered = new ArrayList<>(unique.values());
        ordered.sort(Submission.CHRONOLOGICAL);

        Map<String, List<Submission>> byDealer = new LinkedHashMap<>();
        for (Submission submission : ordered) {
            byDealer.computeIfAbsent(submission.getDealerId(), k -> new ArrayList<>()).add(submission);
        }
        byDealer.replaceAll((k, v) -> Collections.unmodifiableList(v));

        Map<String, TemplateStructure> templateIndex = new LinkedHashMap<>();
        for (TemplateStructure template : templates) {
            templateIndex.putIfAbsent(template.getTemplateId(), template);
        }

        this.dealers = Collections.unmodifiableMap(dealerIndex);
        this.submissions = Collections.unmodifiableList(ordered);
        this.submissionsByDealer = Collections.unmodifiableMap(byDealer);
        this.templates = Collections.unmodifiableMap(templateIndex);
    }

    public static DataSnapshot of(Collection<Dealer> dealers,
                                  Collection<Submission> submissions,
                                  Collection<TemplateStructure> templates) {
        return new DataSnapshot(dealers, submissions, templates);
    }

    public static DataSnapshot empty() {
        return EMPTY;
    }

    public Optional<Dealer> dealer(String dealerId) {
        return Optional.ofNullable(dealers.get(dealerId));
    }

    public Collection<Dealer> getDealers() {
        return dealers.values();
    }

    /**
     * Dealer name for display, falling back to the id when the dealer was not loaded.
     */
    public String dealerName(String dealerId) {
        Dealer dealer = dealers.get(dealerId);
        return dealer != null && dealer.getName() != null ? dealer.getName() : dealerId;
    }

    public List<Submission> getSubmissions() {
        return submissions;
    }

    public List<Submission> submissionsOf(String dealerId) {
        return submissionsByDealer.getOrDefault(dealerId, List.of());
    }

    public Optional<Submission> submission(String submissionId) {
        return submissions.stream().filter(s -> s.getId().equals(submissionId)).findFirst();
    }

    public Optional<TemplateStructure> template(String templateId) {
        if (templateId == null) return Optional.empty();
        return Optional.ofNullable(templates.get(templateId));
    }

    /**
     * The dealer's most recent reporting month, first filing of that month.
     */
    public Optional<Submission> latestSubmissionOf(String dealerId) {
        return firstPerDealerAndPeriod(submissionsOf(dealerId)).stream().max(Submission.CHRONOLOGICAL);
    }

    /**
     * Submissions of the dealers belonging to the group, in chronological order.
     */
    public List<Submission> submissionsOfGroup(String groupId) {
        return submissions.stream()
                .filter(s -> {
                    Dealer dealer = dealers.get(s.getDealerId());
                    return dealer != null && groupId.equals(dealer.getGroupId());
                })
                .collect(Collectors.toList());
    }

    public List<Submission> submissionsIn(YearMonth period) {
        return submissions.stream()
                .filter(s -> s.getYear() == period.getYear() && s.getMonth() == period.getMonthValue())
                .collect(Collectors.toList());
    }

    /**
     * Keeps the chronologically first submission per (dealer, reporting month); later duplicates are dropped.
     * The input order is preserved for the kept entries.
     */
    public static List<Submission> firstPerDealerAndPeriod(List<Submission> submissions) {
        List<Submission> sorted = new ArrayList<>(submissions);
        sorted.sort(Submission.CHRONOLOGICAL);
        Map<String, Submission> firsts = new LinkedHashMap<>();
        for (Submission submission : sorted) {
            firsts.putIfAbsent(submission.getDealerId() + "|" + submission.getPeriod(), submission);
        }
        return submissions.stream()
                .filter(s -> firsts.get(s.getDealerId() + "|" + s.getPeriod()) == s)
                .collect(Collectors.toList());
    }
}
