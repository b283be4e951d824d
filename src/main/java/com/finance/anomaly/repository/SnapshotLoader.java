package com.finance.anomaly.repository;

import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TemplateStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads, once per request, everything a scope's detectors need. Each method returns empty when
 * the subject of the scope does not exist.
 */
@Component
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final FinanceDataRepository repository;

    public SnapshotLoader(FinanceDataRepository repository) {
        this.repository = repository;
    }

    /**
     * The submission, its template, its dealer and the dealer's full submission history.
     */
    public Optional<DataSnapshot> forSubmission(String submissionId) {
        Optional<Submission> found = repository.getSubmission(submissionId);
        if (found.isEmpty()) return Optional.empty();
        Submission submission = found.get();

        List<Dealer> dealers = repository.getDealer(submission.getDealerId()).map(List::of).orElse(List.of());
        List<Submission> submissions = new ArrayList<>(
                repository.listSubmissions(SubmissionFilter.forDealer(submission.getDealerId())));
        submissions.add(submission);
        List<TemplateStructure> templates = repository.getTemplateStructure(submission.getTemplateId())
                .map(List::of).orElse(List.of());

        log.debug("Loaded submission snapshot {}: {} dealer submissions", submissionId, submissions.size());
        return Optional.of(DataSnapshot.of(dealers, submissions, templates));
    }

    /**
     * The dealer, its group peers and their submissions, the template of the dealer's latest
     * submission, and every dealer's submissions for that same reporting month.
     */
    public Optional<DataSnapshot> forDealer(String dealerId) {
        Optional<Dealer> found = repository.getDealer(dealerId);
        if (found.isEmpty()) return Optional.empty();
        Dealer dealer = found.get();

        List<Dealer> dealers = new ArrayList<>();
        dealers.add(dealer);
        if (dealer.getGroupId() != null) {
            dealers.addAll(repository.listDealers(dealer.getGroupId()));
        }
        Set<String> dealerIds = dealers.stream().map(Dealer::getId).collect(Collectors.toCollection(LinkedHashSet::new));

        List<Submission> submissions = new ArrayList<>(repository.listSubmissions(SubmissionFilter.forDealers(dealerIds)));
        List<TemplateStructure> templates = new ArrayList<>();
        latestOf(submissions, dealerId).ifPresent(latest -> {
            submissions.addAll(repository.listSubmissions(
                    SubmissionFilter.forPeriod(latest.getMonth(), latest.getYear())));
            repository.getTemplateStructure(latest.getTemplateId()).ifPresent(templates::add);
        });

        log.debug("Loaded dealer snapshot {}: {} dealers, {} submissions", dealerId, dealers.size(), submissions.size());
        return Optional.of(DataSnapshot.of(dealers, submissions, templates));
    }

    /**
     * All dealers of the group with their submissions, plus what each dealer's scope needs
     * (peer submissions of its latest reporting month and that submission's template).
     */
    public Optional<DataSnapshot> forGroup(String groupId) {
        List<Dealer> dealers = repository.listDealers(groupId);
        if (dealers.isEmpty()) return Optional.empty();

        Set<String> dealerIds = dealers.stream().map(Dealer::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        List<Submission> submissions = new ArrayList<>(repository.listSubmissions(SubmissionFilter.forDealers(dealerIds)));

        Set<YearMonth> latestPeriods = new LinkedHashSet<>();
        Set<String> templateIds = new LinkedHashSet<>();
        for (String dealerId : dealerIds) {
            latestOf(submissions, dealerId).ifPresent(latest -> {
                latestPeriods.add(latest.getPeriod());
                if (latest.getTemplateId() != null) templateIds.add(latest.getTemplateId());
            });
        }
        for (YearMonth period : latestPeriods) {
            submissions.addAll(repository.listSubmissions(
                    SubmissionFilter.forPeriod(period.getMonthValue(), period.getYear())));
        }
        List<TemplateStructure> templates = new ArrayList<>();
        for (String templateId : templateIds) {
            repository.getTemplateStructure(templateId).ifPresent(templates::add);
        }

        log.debug("Loaded group snapshot {}: {} dealers, {} submissions", groupId, dealers.size(), submissions.size());
        return Optional.of(DataSnapshot.of(dealers, submissions, templates));
    }

    /**
     * Every dealer and every submission filed at or after {@code since}.
     */
    public DataSnapshot forGlobal(Instant since) {
        List<Dealer> dealers = repository.listDealers(null);
        List<Submission> submissions = repository.listSubmissions(SubmissionFilter.since(since));
        log.debug("Loaded global snapshot since {}: {} submissions", since, submissions.size());
        return DataSnapshot.of(dealers, submissions, List.of());
    }

    private static Optional<Submission> latestOf(List<Submission> submissions, String dealerId) {
        List<Submission> own = submissions.stream()
                .filter(s -> dealerId.equals(s.getDealerId()))
                .collect(Collectors.toList());
        return DataSnapshot.firstPerDealerAndPeriod(own).stream().max(Submission.CHRONOLOGICAL);
    }
}
