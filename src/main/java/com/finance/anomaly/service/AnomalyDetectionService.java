package com.finance.anomaly.service;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.CancellationToken;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionTask;
import com.finance.anomaly.engine.Detector;
import com.finance.anomaly.engine.aggregation.ResultAggregator;
import com.finance.anomaly.engine.anomaly.CrossDealerOutlierDetector;
import com.finance.anomaly.engine.anomaly.DistributionAnomalyDetector;
import com.finance.anomaly.engine.anomaly.HistoricalVarianceDetector;
import com.finance.anomaly.engine.anomaly.IndustryDeviationDetector;
import com.finance.anomaly.engine.anomaly.QuarterlyPatternDetector;
import com.finance.anomaly.engine.anomaly.TemplateCompletenessDetector;
import com.finance.anomaly.engine.anomaly.TemporalTrendDetector;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.Dealer;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.repository.SnapshotLoader;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statistical anomaly detection for a submission, a dealer, a dealer group or every dealer.
 *
 * Flow (every scope):
 *   1. Load the scope's snapshot once (a missing subject returns an empty not-found report)
 *   2. Bind each detector of the scope to a context over that snapshot
 *   3. Run the tasks in parallel on the detection engine
 *   4. Merge, de-duplicate and rank the findings
 */
@Service
public class AnomalyDetectionService {

    private static final String OPERATION = "anomalies";

    private final SnapshotLoader snapshotLoader;
    private final DetectionRunner runner;
    private final ResultAggregator aggregator;
    private final DetectionThresholdConfig config;

    private final TemplateCompletenessDetector templateCompleteness;
    private final HistoricalVarianceDetector historicalVariance;
    private final QuarterlyPatternDetector quarterlyPattern;
    private final IndustryDeviationDetector industryDeviation;
    private final DistributionAnomalyDetector distribution;
    private final CrossDealerOutlierDetector crossDealerOutlier;
    private final TemporalTrendDetector temporalTrend;

    public AnomalyDetectionService(SnapshotLoader snapshotLoader,
                                   DetectionRunner runner,
                                   ResultAggregator aggregator,
                                   DetectionThresholdConfig config,
                                   TemplateCompletenessDetector templateCompleteness,
                                   HistoricalVarianceDetector historicalVariance,
                                   QuarterlyPatternDetector quarterlyPattern,
                                   IndustryDeviationDetector industryDeviation,
                                   DistributionAnomalyDetector distribution,
                                   CrossDealerOutlierDetector crossDealerOutlier,
                                   TemporalTrendDetector temporalTrend) {
        this.snapshotLoader = snapshotLoader;
        this.runner = runner;
        this.aggregator = aggregator;
        this.config = config;
        this.templateCompleteness = templateCompleteness;
        this.historicalVariance = historicalVariance;
        this.quarterlyPattern = quarterlyPattern;
        this.industryDeviation = industryDeviation;
        this.distribution = distribution;
        this.crossDealerOutlier = crossDealerOutlier;
        this.temporalTrend = temporalTrend;
    }

    /**
     * Missing template cells, in-table outliers and year-over-year variance of one submission.
     */
    @Observed(name = "detection.anomalies.submission", contextualName = "detect-submission-anomalies")
    public DetectionReport<DataAnomaly> detectAnomaliesInSubmission(String submissionId) {
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

        List<DetectionTask<DataAnomaly>> tasks = List.of(
                DetectionTask.of(templateCompleteness, context),
                DetectionTask.of(historicalVariance, context));
        return runner.execute(DetectionScope.SUBMISSION, submissionId, OPERATION, tasks,
                CancellationToken.none(), aggregator::mergeAnomalies);
    }

    /**
     * The latest submission's checks plus the dealer's quarter-end uplift and its deviation
     * from peer dealers in the latest reporting month.
     */
    @Observed(name = "detection.anomalies.dealer", contextualName = "detect-dealer-anomalies")
    public DetectionReport<DataAnomaly> detectAnomaliesByDealer(String dealerId) {
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
        Dealer dealer = snapshot.dealer(dealerId).orElseThrow();

        List<DetectionTask<DataAnomaly>> tasks = dealerTasks(snapshot, dealer, CancellationToken.none(), null);
        return runner.execute(DetectionScope.DEALER, dealerId, OPERATION, tasks,
                CancellationToken.none(), aggregator::mergeAnomalies);
    }

    /**
     * Dealer-scope anomalies of every member dealer, plus cross-dealer outliers and temporal
     * trends over the group's own submissions. Runs under the batch deadline.
     */
    @Observed(name = "detection.anomalies.group", contextualName = "detect-group-anomalies")
    public DetectionReport<DataAnomaly> detectAnomaliesByGroup(String groupId) {
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

        List<DetectionTask<DataAnomaly>> tasks = new ArrayList<>();
        for (Dealer dealer : snapshot.getDealers()) {
            if (!groupId.equals(dealer.getGroupId())) continue;
            tasks.addAll(dealerTasks(snapshot, dealer, cancellation, dealer.getId()));
        }

        DetectionContext groupContext = DetectionContext.builder()
                .scope(DetectionScope.GROUP)
                .snapshot(snapshot)
                .groupId(groupId)
                .submissions(snapshot.submissionsOfGroup(groupId))
                .now(runner.now())
                .cancellation(cancellation)
                .build();
        tasks.add(DetectionTask.of(crossDealerOutlier, groupContext, groupId));
        tasks.add(DetectionTask.of(temporalTrend, groupContext, groupId));

        return runner.execute(DetectionScope.GROUP, groupId, OPERATION, tasks, cancellation,
                aggregator::mergeAnomalies);
    }

    /**
     * Distribution shape, cross-dealer outliers and temporal trends over every submission filed
     * in the last {@code lastMonths} months. Ranked newest first.
     */
    @Observed(name = "detection.anomalies.global", contextualName = "detect-global-anomalies")
    public DetectionReport<DataAnomaly> detectGlobalAnomalies(int lastMonths) {
        int months = lastMonths > 0 ? lastMonths : config.getDefaultLastMonths();
        Instant now = runner.now();
        Instant since = now.atZone(ZoneOffset.UTC).minusMonths(months).toInstant();

        DataSnapshot snapshot;
        try {
            snapshot = snapshotLoader.forGlobal(since);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.GLOBAL, null, OPERATION, e);
        }
        CancellationToken cancellation = runner.batchToken();

        DetectionContext context = DetectionContext.builder()
                .scope(DetectionScope.GLOBAL)
                .snapshot(snapshot)
                .submissions(snapshot.getSubmissions())
                .now(now)
                .cancellation(cancellation)
                .build();

        List<DetectionTask<DataAnomaly>> tasks = List.of(
                DetectionTask.of(distribution, context),
                DetectionTask.of(crossDealerOutlier, context),
                DetectionTask.of(temporalTrend, context));
        return runner.execute(DetectionScope.GLOBAL, null, OPERATION, tasks, cancellation,
                aggregator::mergeGlobalAnomalies);
    }

    private List<DetectionTask<DataAnomaly>> dealerTasks(DataSnapshot snapshot,
                                                         Dealer dealer,
                                                         CancellationToken cancellation,
                                                         String unit) {
        DetectionContext context = DetectionContext.builder()
                .scope(DetectionScope.DEALER)
                .snapshot(snapshot)
                .dealer(dealer)
                .submission(snapshot.latestSubmissionOf(dealer.getId()).orElse(null))
                .now(runner.now())
                .cancellation(cancellation)
                .build();

        List<Detector<DataAnomaly>> detectors = List.of(
                templateCompleteness, historicalVariance, quarterlyPattern, industryDeviation);
        List<DetectionTask<DataAnomaly>> tasks = new ArrayList<>(detectors.size());
        for (Detector<DataAnomaly> detector : detectors) {
            tasks.add(DetectionTask.of(detector, context, unit));
        }
        return tasks;
    }
}
