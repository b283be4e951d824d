package com.finance.anomaly.repository;

import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TemplateStructure;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to dealers, submissions (with their cells) and template structures.
 * The detection engine never writes through this contract.
 */
public interface FinanceDataRepository {

    Optional<Dealer> getDealer(String dealerId);

    /**
     * @param groupId dealer group to restrict to, or null for every dealer
     */
    List<Dealer> listDealers(String groupId);

    Optional<Submission> getSubmission(String submissionId);

    List<Submission> listSubmissions(SubmissionFilter filter);

    Optional<TemplateStructure> getTemplateStructure(String templateId);
}
