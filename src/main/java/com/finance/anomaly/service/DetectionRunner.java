package com.finance.anomaly.service;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.config.MetricsConfig;
import com.finance.anomaly.engine.CancellationToken;
import com.finance.anomaly.engine.DetectionEngine;
import com.finance.anomaly.engine.DetectionOutcome;
import com.finance.anomaly.engine.DetectionTask;
import com.finance.anomaly.model.DetectionReport;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.DetectorOutcome;
import com.finance.anomaly.model.DetectorStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Steps shared by every detection request once its snapshot is loaded: fan the tasks out on the
 * engine, fan the outcomes in, record metrics and build the report.
 */
@Component
public class DetectionRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunner.class);

    private final DetectionEngine engine;
    private final MetricsConfig metricsConfig;
    private final DetectionThresholdConfig config;
    private final Clock clock;

    public DetectionRunner(DetectionEngine engine,
                           MetricsConfig metricsConfig,
                           DetectionThresholdConfig config,
                           Clock clock) {
        this.engine = engine;
        this.metricsConfig = metricsConfig;
        this.config = config;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Token for group and global requests, expiring after the configured batch timeout.
     */
    public CancellationToken batchToken() {
        return CancellationToken.withTimeout(clock, Duration.ofSeconds(config.getBatchTimeoutSeconds()));
    }

    public <T> DetectionReport<T> execute(DetectionScope scope,
                                          String subjectId,
                                          String operation,
                                          List<DetectionTask<T>> tasks,
                                          CancellationToken cancellation,
                                          Function<List<DetectionOutcome<T>>, List<T>> merger) {
        long start = System.nanoTime();
        List<DetectionOutcome<T>> outcomes = engine.run(tasks, cancellation);
        List<T> findings = merger.apply(outcomes);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        metricsConfig.recordScopeDuration(scope.name(), operation, elapsed);
        metricsConfig.recordFindings(scope.name(), operation, findings.size());

        long failed = outcomes.stream().filter(o -> o.getStatus() == DetectorStatus.FAILED).count();
        long cancelled = outcomes.stream().filter(o -> o.getStatus() == DetectorStatus.CANCELLED).count();
        log.info("{} {} {}: {} findings from {} detector runs ({} failed, {} cancelled) in {} ms",
                operation, scope, subjectId != null ? subjectId : "", findings.size(), outcomes.size(),
                failed, cancelled, elapsed.toMillis());

        return DetectionReport.<T>builder()
                .scope(scope)
                .subjectId(subjectId)
                .subjectFound(true)
                .findings(findings)
                .outcomes(outcomes.stream().map(DetectionOutcome::toSummary).collect(Collectors.toList()))
                .generatedAt(now())
                .build();
    }

    public <T> DetectionReport<T> notFound(DetectionScope scope, String subjectId) {
        log.info("{} {} not found, returning empty report", scope, subjectId);
        metricsConfig.recordSubjectNotFound(scope.name());
        return DetectionReport.notFound(scope, subjectId, now());
    }

    /**
     * Report for a request whose data could not be read. Nothing ran, so there are no findings;
     * the failure is carried as the single outcome.
     */
    public <T> DetectionReport<T> loadFailed(DetectionScope scope, String subjectId, String operation, RuntimeException e) {
        log.error("Failed to load data for {} {} {}: {}", operation, scope, subjectId, e.getMessage(), e);
        metricsConfig.recordLoadFailure(scope.name());
        return DetectionReport.<T>builder()
                .scope(scope)
                .subjectId(subjectId)
                .subjectFound(true)
                .findings(List.of())
                .outcomes(List.of(DetectorOutcome.builder()
                        .detector("snapshot-loader")
                        .status(DetectorStatus.FAILED)
                        .findingCount(0)
                        .reason(String.valueOf(e.getMessage()))
                        .build()))
                .generatedAt(now())
                .build();
    }
}
