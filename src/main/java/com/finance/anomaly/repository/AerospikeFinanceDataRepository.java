package com.finance.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finance.anomaly.config.AerospikeConfig;
import com.finance.anomaly.model.Cell;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.model.TemplateStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads dealers, submissions and template structures from Aerospike.
 * Cells and template sheets are stored as JSON strings in a single bin each.
 */
@Repository
@ConditionalOnProperty(name = "detection.repository", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeFinanceDataRepository implements FinanceDataRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeFinanceDataRepository.class);

    private static final TypeReference<List<Cell>> CELL_LIST = new TypeReference<>() {};
    private static final TypeReference<List<TemplateStructure.Sheet>> SHEET_LIST = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeFinanceDataRepository(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultReadPolicy") Policy readPolicy,
                                          @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<Dealer> getDealer(String dealerId) {
        if (dealerId == null) return Optional.empty();
        Key key = new Key(namespace, AerospikeConfig.SET_DEALERS, dealerId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.of(mapDealer(dealerId, record));
    }

    @Override
    public List<Dealer> listDealers(String groupId) {
        List<Dealer> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DEALERS,
                (key, record) -> {
                    if (groupId != null && !groupId.equals(record.getString("groupId"))) return;
                    synchronized (results) {
                        results.add(mapDealer(record.getString("id"), record));
                    }
                });
        results.sort(Comparator.comparing(Dealer::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return results;
    }

    @Override
    public Optional<Submission> getSubmission(String submissionId) {
        if (submissionId == null) return Optional.empty();
        Key key = new Key(namespace, AerospikeConfig.SET_SUBMISSIONS, submissionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.ofNullable(mapSubmission(submissionId, record));
    }

    @Override
    public List<Submission> listSubmissions(SubmissionFilter filter) {
        List<Submission> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SUBMISSIONS,
                (key, record) -> {
                    // Cheap bin checks before the cells bin is parsed
                    if (!matchesHeader(filter, record)) return;
                    Submission submission = mapSubmission(record.getString("id"), record);
                    if (submission == null || !filter.matches(submission)) return;
                    synchronized (results) {
                        results.add(submission);
                    }
                });
        results.sort(Submission.CHRONOLOGICAL);
        return results;
    }

    @Override
    public Optional<TemplateStructure> getTemplateStructure(String templateId) {
        if (templateId == null) return Optional.empty();
        Key key = new Key(namespace, AerospikeConfig.SET_TEMPLATES, templateId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();

        List<TemplateStructure.Sheet> sheets;
        try {
            String json = record.getString("sheets");
            sheets = json != null ? objectMapper.readValue(json, SHEET_LIST) : new ArrayList<>();
        } catch (Exception e) {
            log.warn("Failed to deserialize template structure {}: {}", templateId, e.getMessage());
            return Optional.empty();
        }

        return Optional.of(TemplateStructure.builder()
                .templateId(templateId)
                .name(record.getString("name"))
                .sheets(sheets)
                .build());
    }

    private boolean matchesHeader(SubmissionFilter filter, Record record) {
        String dealerId = record.getString("dealerId");
        if (filter.getDealerId() != null && !filter.getDealerId().equals(dealerId)) return false;
        if (filter.getDealerIds() != null && !filter.getDealerIds().contains(dealerId)) return false;
        if (filter.getMonth() != null && filter.getMonth() != record.getInt("month")) return false;
        return filter.getYear() == null || filter.getYear() == record.getInt("year");
    }

    private Dealer mapDealer(String dealerId, Record record) {
        return Dealer.builder()
                .id(dealerId != null ? dealerId : record.getString("id"))
                .name(record.getString("name"))
                .groupId(record.getString("groupId"))
                .groupName(record.getString("groupName"))
                .build();
    }

    private Submission mapSubmission(String submissionId, Record record) {
        List<Cell> cells;
        try {
            String json = record.getString("cells");
            cells = json != null ? objectMapper.readValue(json, CELL_LIST) : new ArrayList<>();
        } catch (Exception e) {
            log.warn("Failed to deserialize cells of submission {}: {}", submissionId, e.getMessage());
            return null;
        }

        long submittedAt = record.getLong("submittedAt");
        return Submission.builder()
                .id(submissionId != null ? submissionId : record.getString("id"))
                .dealerId(record.getString("dealerId"))
                .templateId(record.getString("templateId"))
                .month(record.getInt("month"))
                .year(record.getInt("year"))
                .submittedAt(submittedAt > 0 ? Instant.ofEpochMilli(submittedAt) : null)
                .status(record.getString("status"))
                .cells(cells)
                .build();
    }
}
