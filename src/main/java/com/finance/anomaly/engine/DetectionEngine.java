package com.finance.anomaly.engine;

import com.finance.anomaly.config.MetricsConfig;
import com.finance.anomaly.model.DetectorStatus;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs detector tasks in parallel on the bounded detection pool and collects one outcome per task,
 * in task order. Each run gets its own tracing span; a detector that throws is reported as FAILED
 * and does not affect the others.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    // Time given to detectors to return partial results after the deadline flips the token
    private static final long CANCELLATION_GRACE_MS = 500;

    private final ExecutorService executor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(@Qualifier("detectionExecutor") ExecutorService executor,
                           Tracer tracer,
                           MetricsConfig metricsConfig) {
        this.executor = executor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    public <T> List<DetectionOutcome<T>> run(List<DetectionTask<T>> tasks, CancellationToken cancellation) {
        List<CompletableFuture<DetectionOutcome<T>>> futures = new ArrayList<>(tasks.size());
        for (DetectionTask<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(task), executor));
        }

        List<DetectionOutcome<T>> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), tasks.get(i), cancellation));
        }
        return outcomes;
    }

    private <T> DetectionOutcome<T> await(CompletableFuture<DetectionOutcome<T>> future,
                                          DetectionTask<T> task,
                                          CancellationToken cancellation) {
        String name = task.getDetector().getName();
        try {
            if (!cancellation.hasDeadline()) {
                return future.get();
            }
            return future.get(cancellation.remainingMillis() + CANCELLATION_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancellation.cancel();
            future.cancel(true);
            log.warn("Detector {} did not finish before the batch deadline (unit={})", name, task.getUnit());
            metricsConfig.recordDetectorRun(name, DetectorStatus.CANCELLED.name());
            return DetectionOutcome.<T>cancelled(name, List.of()).withUnit(task.getUnit());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            future.cancel(true);
            return DetectionOutcome.<T>cancelled(name, List.of()).withUnit(task.getUnit());
        } catch (ExecutionException e) {
            log.error("Detector {} task failed (unit={}): {}", name, task.getUnit(), e.getCause().getMessage(), e.getCause());
            return DetectionOutcome.<T>failed(name, String.valueOf(e.getCause().getMessage())).withUnit(task.getUnit());
        }
    }

    private <T> DetectionOutcome<T> execute(DetectionTask<T> task) {
        Detector<T> detector = task.getDetector();
        DetectionContext context = task.getContext();

        Span span = tracer.nextSpan()
                .name("detector." + detector.getName())
                .tag("detector.name", detector.getName())
                .tag("detection.scope", context.getScope().name())
                .start();
        if (task.getUnit() != null) {
            span.tag("detection.unit", task.getUnit());
        }

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectionOutcome<T> outcome = detector.detect(context).withUnit(task.getUnit());

            span.tag("detector.status", outcome.getStatus().name());
            span.tag("detector.findings", String.valueOf(outcome.getFindings().size()));
            metricsConfig.recordDetectorRun(detector.getName(), outcome.getStatus().name());

            if (outcome.getStatus() == DetectorStatus.INSUFFICIENT_DATA) {
                log.debug("Detector {} skipped for {} {}: {}", detector.getName(),
                        context.getScope(), context.subjectLabel(), outcome.getReason());
            } else if (outcome.getStatus() == DetectorStatus.CANCELLED) {
                log.info("Detector {} cancelled for {} {} with {} partial findings", detector.getName(),
                        context.getScope(), context.subjectLabel(), outcome.getFindings().size());
            }
            return outcome;
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordDetectorRun(detector.getName(), DetectorStatus.FAILED.name());
            log.error("Error running detector {} for {} {}: {}", detector.getName(),
                    context.getScope(), context.subjectLabel(), e.getMessage(), e);
            // Don't let one failing detector block the rest of the scope
            return DetectionOutcome.<T>failed(detector.getName(), String.valueOf(e.getMessage()))
                    .withUnit(task.getUnit());
        } finally {
            span.end();
        }
    }
}
