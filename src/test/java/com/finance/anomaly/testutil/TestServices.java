package com.finance.anomaly.testutil;

import com.finance.anomaly.config.DetectionThresholdConfig;
import com.finance.anomaly.config.MetricsConfig;
import com.finance.anomaly.engine.DetectionEngine;
import com.finance.anomaly.engine.aggregation.ResultAggregator;
import com.finance.anomaly.engine.anomaly.*;
import com.finance.anomaly.engine.pattern.*;
import com.finance.anomaly.repository.FinanceDataRepository;
import com.finance.anomaly.repository.SnapshotLoader;
import com.finance.anomaly.service.AnomalyDetectionService;
import com.finance.anomaly.service.DetectionRunner;
import com.finance.anomaly.service.PatternDetectionService;
import com.finance.anomaly.service.TimeSeriesMlService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;

/**
 * Wires the detection services by hand over a given repository, with the clock fixed at
 * {@link TestDataFactory#NOW}.
 */
public final class TestServices {

    private final SnapshotLoader loader;
    private final DetectionRunner runner;
    private final ResultAggregator aggregator = new ResultAggregator();
    private final DetectionThresholdConfig config = new DetectionThresholdConfig();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    public TestServices(FinanceDataRepository repository, ExecutorService executor) {
        MetricsConfig metrics = new MetricsConfig(registry);
        this.loader = new SnapshotLoader(repository);
        this.runner = new DetectionRunner(new DetectionEngine(executor, Tracer.NOOP, metrics), metrics, config,
                Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC));
    }

    public SimpleMeterRegistry registry() {
        return registry;
    }

    public AnomalyDetectionService anomalies() {
        return new AnomalyDetectionService(loader, runner, aggregator, config,
                new TemplateCompletenessDetector(config),
                new HistoricalVarianceDetector(config),
                new QuarterlyPatternDetector(config),
                new IndustryDeviationDetector(config),
                new DistributionAnomalyDetector(config),
                new CrossDealerOutlierDetector(config),
                new TemporalTrendDetector(config));
    }

    public PatternDetectionService patterns() {
        return new PatternDetectionService(loader, runner, aggregator,
                new CellCorrelationDetector(config),
                new ArithmeticRelationshipDetector(config),
                new SeasonalPatternDetector(config),
                new YearlyChangeDetector(config),
                new MonthlySeasonalityDetector(config),
                new GroupDeviationDetector(config),
                new ClusterPatternDetector(config));
    }

    public TimeSeriesMlService timeSeries() {
        return new TimeSeriesMlService(loader, runner, aggregator, config,
                new SpikeAnomalyDetector(config),
                new ChangePointAnomalyDetector(config),
                new ClusterPatternDetector(config),
                new ForecastPatternDetector(config));
    }
}
