package com.finance.anomaly.service;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.engine.CancellationToken;
import com.finance.anomaly.engine.DetectionContext;
import com.finance.anomaly.engine.DetectionTask;
import com.finance.anomaly.engine.aggregation.ResultAggregator;
import com.finance.anomaly.engine.anomaly.ChangePointAnomalyDetector;
import com.finance.anomaly.engine.anomaly.SpikeAnomalyDetector;
import com.finance.anomaly.engine.pattern.ClusterPatternDetector;
import com.finance.anomaly.engine.pattern.ForecastPatternDetector;
import com.finance.anomaly.model.DataAnomaly;
import com.finance.anomaly.model.DataPattern;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.Submission;
import com.finance.anomaly.repository.SnapshotLoader;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Time-series ML over per-address monthly series: spike and change-point anomalies, k-means
 * clustering of submissions and short-horizon forecasts.
 *
 * Every operation resolves its scope to a context first; the detectors derive the series or the
 * submissions to cluster from the context's scope.
 */
@Service
public class TimeSeriesMlService {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesMlService.class);

    private static final String ML_ANOMALIES = "ml-anomalies";
    private static final String ML_CLUSTERS = "ml-clusters";
    private static final String ML_FORECAST = "ml-forecast";

    private final SnapshotLoader snapshotLoader;
    private final DetectionRunner runner;
    private final ResultAggregator aggregator;
    private final DetectionThresholdConfig config;

    private final SpikeAnomalyDetector spikeDetector;
    private final ChangePointAnomalyDetector changePointDetector;
    private final ClusterPatternDetector clusterDetector;
    private final ForecastPatternDetector forecastDetector;

    public TimeSeriesMlService(SnapshotLoader snapshotLoader,
                               DetectionRunner runner,
                               ResultAggregator aggregator,
                               DetectionThresholdConfig config,
                               SpikeAnomalyDetector spikeDetector,
                               ChangePointAnomalyDetector changePointDetector,
                               ClusterPatternDetector clusterDetector,
                               ForecastPatternDetector forecastDetector) {
        this.snapshotLoader = snapshotLoader;
        this.runner = runner;
        this.aggregator = aggregator;
        this.config = config;
        this.spikeDetector = spikeDetector;
        this.changePointDetector = changePointDetector;
        this.clusterDetector = clusterDetector;
        this.forecastDetector = forecastDetector;
    }

    // ── Spike and change-point anomalies ──

    @Observed(name = "detection.ml.anomalies.submission", contextualName = "detect-submission-ml-anomalies")
    public DetectionReport<DataAnomaly> detectTimeSeriesAnomaliesInSubmission(String submissionId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forSubmission(submissionId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.SUBMISSION, submissionId, ML_ANOMALIES, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.SUBMISSION, submissionId);
        }
        DetectionContext context = submissionContext(loaded.get(), submissionId);
        return runner.execute(DetectionScope.SUBMISSION, submissionId, ML_ANOMALIES, seriesTasks(context, null),
                CancellationToken.none(), aggregator::mergeAnomalies);
    }

    @Observed(name = "detection.ml.anomalies.dealer", contextualName = "detect-dealer-ml-anomalies")
    public DetectionReport<DataAnomaly> detectTimeSeriesAnomaliesByDealer(String dealerId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forDealer(dealerId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.DEALER, dealerId, ML_ANOMALIES, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.DEALER, dealerId);
        }
        DetectionContext context = dealerContext(loaded.get(), dealerId);
        return runner.execute(DetectionScope.DEALER, dealerId, ML_ANOMALIES, seriesTasks(context, null),
                CancellationToken.none(), aggregator::mergeAnomalies);
    }

    /**
     * Series of the group are the averages over its member dealers per reporting month.
     */
    @Observed(name = "detection.ml.anomalies.group", contextualName = "detect-group-ml-anomalies")
    public DetectionReport<DataAnomaly> detectTimeSeriesAnomaliesByGroup(String groupId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forGroup(groupId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.GROUP, groupId, ML_ANOMALIES, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.GROUP, groupId);
        }
        CancellationToken cancellation = runner.batchToken();
        DetectionContext context = groupContext(loaded.get(), groupId, cancellation);
        return runner.execute(DetectionScope.GROUP, groupId, ML_ANOMALIES, seriesTasks(context, groupId),
                cancellation, aggregator::mergeAnomalies);
    }

    // ── Clustering ──

    @Observed(name = "detection.ml.clusters.submission", contextualName = "cluster-submission-history")
    public DetectionReport<DataPattern> detectClustersForSubmission(String submissionId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forSubmission(submissionId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.SUBMISSION, submissionId, ML_CLUSTERS, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.SUBMISSION, submissionId);
        }
        DetectionContext context = submissionContext(loaded.get(), submissionId);
        return runner.execute(DetectionScope.SUBMISSION, submissionId, ML_CLUSTERS,
                List.of(DetectionTask.of(clusterDetector, context)),
                CancellationToken.none(), aggregator::mergePatterns);
    }

    @Observed(name = "detection.ml.clusters.dealer", contextualName = "cluster-dealer-submissions")
    public DetectionReport<DataPattern> detectClustersByDealer(String dealerId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forDealer(dealerId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.DEALER, dealerId, ML_CLUSTERS, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.DEALER, dealerId);
        }
        DetectionContext context = dealerContext(loaded.get(), dealerId);
        return runner.execute(DetectionScope.DEALER, dealerId, ML_CLUSTERS,
                List.of(DetectionTask.of(clusterDetector, context)),
                CancellationToken.none(), aggregator::mergePatterns);
    }

    @Observed(name = "detection.ml.clusters.group", contextualName = "cluster-group-submissions")
    public DetectionReport<DataPattern> detectClustersByGroup(String groupId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forGroup(groupId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.GROUP, groupId, ML_CLUSTERS, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.GROUP, groupId);
        }
        CancellationToken cancellation = runner.batchToken();
        DetectionContext context = groupContext(loaded.get(), groupId, cancellation);
        return runner.execute(DetectionScope.GROUP, groupId, ML_CLUSTERS,
                List.of(DetectionTask.of(clusterDetector, context, groupId)),
                cancellation, aggregator::mergePatterns);
    }

    /**
     * Clusters every submission filed in the last {@code lastMonths} months.
     */
    @Observed(name = "detection.ml.clusters.global", contextualName = "cluster-global-submissions")
    public DetectionReport<DataPattern> detectGlobalClusters(int lastMonths) {
        int months = lastMonths > 0 ? lastMonths : config.getDefaultLastMonths();
        Instant now = runner.now();
        Instant since = now.atZone(ZoneOffset.UTC).minusMonths(months).toInstant();

        DataSnapshot snapshot;
        try {
            snapshot = snapshotLoader.forGlobal(since);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.GLOBAL, null, ML_CLUSTERS, e);
        }
        log.debug("Clustering {} submissions filed since {}", snapshot.getSubmissions().size(), since);

        CancellationToken cancellation = runner.batchToken();
        DetectionContext context = DetectionContext.builder()
                .scope(DetectionScope.GLOBAL)
                .snapshot(snapshot)
                .submissions(snapshot.getSubmissions())
                .now(now)
                .cancellation(cancellation)
                .build();
        return runner.execute(DetectionScope.GLOBAL, null, ML_CLUSTERS,
                List.of(DetectionTask.of(clusterDetector, context)),
                cancellation, aggregator::mergePatterns);
    }

    // ── Forecast ──

    /**
     * Three-month forecast of every cell of the submission's dealer with enough history.
     */
    @Observed(name = "detection.ml.forecast", contextualName = "forecast-submission")
    public DetectionReport<DataPattern> forecast(String submissionId) {
        Optional<DataSnapshot> loaded;
        try {
            loaded = snapshotLoader.forSubmission(submissionId);
        } catch (RuntimeException e) {
            return runner.loadFailed(DetectionScope.SUBMISSION, submissionId, ML_FORECAST, e);
        }
        if (loaded.isEmpty()) {
            return runner.notFound(DetectionScope.SUBMISSION, submissionId);
        }
        DetectionContext context = submissionContext(loaded.get(), submissionId);
        return runner.execute(DetectionScope.SUBMISSION, submissionId, ML_FORECAST,
                List.of(DetectionTask.of(forecastDetector, context)),
                CancellationToken.none(), aggregator::mergePatterns);
    }

    private List<DetectionTask<DataAnomaly>> seriesTasks(DetectionContext context, String unit) {
        return List.of(
                DetectionTask.of(spikeDetector, context, unit),
                DetectionTask.of(changePointDetector, context, unit));
    }

    private DetectionContext submissionContext(DataSnapshot snapshot, String submissionId) {
        Submission submission = snapshot.submission(submissionId).orElseThrow();
        return DetectionContext.builder()
                .scope(DetectionScope.SUBMISSION)
                .snapshot(snapshot)
                .submission(submission)
                .dealer(snapshot.dealer(submission.getDealerId()).orElse(null))
                .now(runner.now())
                .build();
    }

    private DetectionContext dealerContext(DataSnapshot snapshot, String dealerId) {
        return DetectionContext.builder()
                .scope(DetectionScope.DEALER)
                .snapshot(snapshot)
                .dealer(snapshot.dealer(dealerId).orElseThrow())
                .submission(snapshot.latestSubmissionOf(dealerId).orElse(null))
                .now(runner.now())
                .build();
    }

    private DetectionContext groupContext(DataSnapshot snapshot, String groupId, CancellationToken cancellation) {
        return DetectionContext.builder()
                .scope(DetectionScope.GROUP)
                .snapshot(snapshot)
                .groupId(groupId)
                .submissions(snapshot.submissionsOfGroup(groupId))
                .now(runner.now())
                .cancellation(cancellation)
                .build();
    }
}
