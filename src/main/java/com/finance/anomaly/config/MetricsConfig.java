package com.finance.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectorRun(String detector, String status) {
        Counter.builder("detection.detector.runs")
                .tag("detector", detector)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFindings(String scope, String kind, int count) {
        DistributionSummary.builder("detection.findings")
                .tag("scope", scope)
                .tag("kind", kind)
                .register(registry)
                .record(count);
    }

    public void recordScopeDuration(String scope, String operation, Duration duration) {
        Timer.builder("detection.scope.duration")
                .tag("scope", scope)
                .tag("operation", operation)
                .register(registry)
                .record(duration);
    }

    public void recordSubjectNotFound(String scope) {
        Counter.builder("detection.subject.not_found")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public void recordLoadFailure(String scope) {
        Counter.builder("detection.snapshot.load_failures")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }
}
