package com.finance.anomaly.repository;

import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TemplateStructure;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed repository for local runs ({@code detection.repository=memory}) and tests.
 * Write methods exist only to stage data; the engine itself uses the read contract.
 */
@Repository
@ConditionalOnProperty(name = "detection.repository", havingValue = "memory")
public class InMemoryFinanceDataRepository implements FinanceDataRepository {

    private final Map<String, Dealer> dealers = new ConcurrentHashMap<>();
    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();
    private final Map<String, TemplateStructure> templates = new ConcurrentHashMap<>();

    public InMemoryFinanceDataRepository saveDealer(Dealer dealer) {
        dealers.put(dealer.getId(), dealer);
        return this;
    }

    public InMemoryFinanceDataRepository saveSubmission(Submission submission) {
        submissions.put(submission.getId(), submission);
        return this;
    }

    public InMemoryFinanceDataRepository saveTemplate(TemplateStructure template) {
        templates.put(template.getTemplateId(), template);
        return this;
    }

    @Override
    public Optional<Dealer> getDealer(String dealerId) {
        if (dealerId == null) return Optional.empty();
        return Optional.ofNullable(dealers.get(dealerId));
    }

    @Override
    public List<Dealer> listDealers(String groupId) {
        return dealers.values().stream()
                .filter(d -> groupId == null || Objects.equals(groupId, d.getGroupId()))
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Submission> getSubmission(String submissionId) {
        if (submissionId == null) return Optional.empty();
        return Optional.ofNullable(submissions.get(submissionId));
    }

    @Override
    public List<Submission> listSubmissions(SubmissionFilter filter) {
        return submissions.values().stream()
                .filter(filter::matches)
                .sorted(Submission.CHRONOLOGICAL)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<TemplateStructure> getTemplateStructure(String templateId) {
        if (templateId == null) return Optional.empty();
        return Optional.ofNullable(templates.get(templateId));
    }
}
