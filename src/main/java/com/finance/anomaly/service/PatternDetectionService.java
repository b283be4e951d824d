package com.finance.anomaly.service;

import com.finance.anomaly.engine.CancellationToken;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionTask;
import com.finance.anomaly.engine.aggregation.ResultAggregator;
import com.finance.anomaly.engine.pattern.ArithmeticRelationshipDetector;
import com.finance.anomaly.engine.pattern.CellCorrelationDetector;
import com.finance.anomaly.engine.pattern.ClusterPatternDetector;
import com.finance.anomaly.engine.pattern.GroupDeviationDetector;
import com.finance.anomaly.engine.pattern.MonthlySeasonalityDetector;
import com.finance.anomaly.engine.pattern.SeasonalPatternDetector;
import com.finance.anomaly.engine.pattern.YearlyChangeDetector;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.repository.SnapshotLoader;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mines recurring relationships: between cells of a submission, across a dealer's history and
 * between a dealer and its group.
 */
@Service
public class PatternDetectionService {

    private static final String OPERATION = "patterns";

    private final SnapshotLoader snapshotLoader;
    private final DetectionRunner runner;
    private final ResultAggregator aggregator;

    private final CellCorrelationDetector cellCorrelation;
    private final ArithmeticRelationshipDetector arithmeticRelationship;
    private final SeasonalPatternDetector seasonalPattern;
    private final YearlyChangeDetector yearlyChange;
    private final MonthlySeasonalityDetector monthlySeasonality;
    private final GroupDeviationDetector groupDeviation;
    private final ClusterPatternDetector clusterPattern;

    public PatternDetectionService(SnapshotLoader snapshotLoader,
                                   DetectionRunner runner,
                                   ResultAggregator aggregator,
                                   CellCorrelationDetector cellCorrelation,
                                   ArithmeticRelationshipDetector arithmeticRelationship,
                                   SeasonalPatternDetector seasonalPattern,
                                   YearlyChangeDetector yearlyChange,
                                   MonthlySeasonalityDetector monthlySeasonality,
                                   GroupDeviationDetector groupDeviation,
                                   ClusterPatternDetector clusterPattern) {
        this.snapshotLoader = snapshotLoader;
        this.runner = runner;
        this.aggregator = aggregator;
        this.cellCorrelation = cellCorrelation;
        this.arithmeticRelationship = arithmeticRelationship;
        this.seasonalPattern = seasonalPattern;
        this.yearlyChange = yearlyChange;
        this.monthlySeasonality = monthlySeasonality;
        this.groupDeviation = groupDeviation;
        this.clusterPattern = clusterPattern;
    }

    /**
     * Flow:
     *   1. Load the submission with its dealer's history
     *   2. Run correlation, arithmetic and seasonal mining in parallel
     *   3. Rank by significance, then confidence
     */
    @Observed(name = "detection.patterns.submission", contextualName = "detect-submission-patterns")
    public DetectionReport<DataPattern> detectPatternsInSubmission(String submissionId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forSubmission(submissionId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.SUBMISSION, submissionId, OPERATION, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.SUBMISSION, submissionId);
        }
        DataSnapshot snapshot = loaded.get();
        Submission submission = snapshot.submission(submissionId).orElseThrow();

        DetectionContext context = DetectionContext.builder()
                .scope(DetectionScope.SUBMISSION)
                .snapshot(snapshot)
                .submission(submission)
                .dealer(snapshot.dealer(submission.getDealerId()).orElse(null))
                .now(runner.now())
                .build();

        List<DetectionTask<DataPattern>> tasks = List.of(
                DetectionTask.of(cellCorrelation, context),
                DetectionTask.of(arithmeticRelationship, context),
                DetectionTask.of(seasonalPattern, context));
        return runner.execute(DetectionScope.SUBMISSION, submissionId, OPERATION, tasks,
                CancellationToken.none(), aggregator::mergePatterns);
    }

    /**
     * Year-over-year changes, monthly seasonality and deviation from the dealer's group.
     */
    @Observed(name = "detection.patterns.dealer", contextualName = "detect-dealer-patterns")
    public DetectionReport<DataPattern> detectPatternsByDealer(String dealerId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forDealer(dealerId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.DEALER, dealerId, OPERATION, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.DEALER, dealerId);
        }
        DataSnapshot snapshot = loaded.get();
        DetectionContext context = dealerContext(snapshot, snapshot.dealer(dealerId).orElseThrow(),
                CancellationToken.none());

        List<DetectionTask<DataPattern>> tasks = List.of(
                DetectionTask.of(yearlyChange, context),
                DetectionTask.of(monthlySeasonality, context),
                DetectionTask.of(groupDeviation, context));
        return runner.execute(DetectionScope.DEALER, dealerId, OPERATION, tasks,
                CancellationToken.none(), aggregator::mergePatterns);
    }

    /**
     * Clusters of the group's submissions plus every member's deviation from the group.
     */
    @Observed(name = "detection.patterns.group", contextualName = "detect-group-patterns")
    public DetectionReport<DataPattern> detectPatternsByGroup(String groupId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forGroup(groupId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.GROUP, groupId, OPERATION, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.GROUP, groupId);
        }
        DataSnapshot snapshot = loaded.get();
        CancellationToken cancellation = runner.batchToken();

        List<DetectionTask<DataPattern>> tasks = new ArrayList<>();
        DetectionContext groupContext = DetectionContext.builder()
                .scope(DetectionScope.GROUP)
                .snapshot(snapshot)
                .groupId(groupId)
                .submissions(snapshot.submissionsOfGroup(groupId))
                .now(runner.now())
                .cancellation(cancellation)
                .build();
        tasks.add(DetectionTask.of(clusterPattern, groupContext, groupId));

        for (Dealer dealer : snapshot.getDealers()) {
            if (!groupId.equals(dealer.getGroupId())) continue;
            tasks.add(DetectionTask.of(groupDeviation, dealerContext(snapshot, dealer, cancellation), dealer.getId()));
        }
        return runner.execute(DetectionScope.GROUP, groupId, OPERATION, tasks, cancellation,
                aggregator::mergePatterns);
    }

    private DetectionContext dealerContext(DataSnapshot snapshot, Dealer dealer, CancellationToken cancellation) {
        return DetectionContext.builder()
                .scope(DetectionScope.DEALER)
                .snapshot(snapshot)
                .dealer(dealer)
                .submission(snapshot.latestSubmissionOf(dealer.getId()).orElse(null))
                .now(runner.now())
                .cancellation(cancellation)
                .build();
    }
}
