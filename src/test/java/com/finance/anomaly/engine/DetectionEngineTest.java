package com.finance.anomaly.engine;

import com.finance.anomaly.config.MetricsConfig;
import com.finance.anomaly.model.DataSnapshot;
import com.finance.anomaly.model.DetectionScope;
import com.finance.anomaly.model.DetectorStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.finance.anomaly.testutil.TestDataFactory.globalContext;
import static org.assertj.core.api.Assertions.assertThat;

class DetectionEngineTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private DetectionEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        engine = new DetectionEngine(executor, Tracer.NOOP, new MetricsConfig(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void run_collectsOutcomesInTaskOrder() {
        DetectionContext context = globalContext(DataSnapshot.empty());

        List<DetectionOutcome<String>> outcomes = engine.run(List.of(
                DetectionTask.of(fixed("first", List.of("a", "b")), context),
                DetectionTask.of(fixed("second", List.of("c")), context, "D1")), CancellationToken.none());

        assertThat(outcomes).extracting(DetectionOutcome::getDetector).containsExactly("first", "second");
        assertThat(outcomes.get(0).getFindings()).containsExactly("a", "b");
        assertThat(outcomes.get(1).getUnit()).isEqualTo("D1");
        assertThat(outcomes).allSatisfy(o -> assertThat(o.getStatus()).isEqualTo(DetectorStatus.COMPLETED));
    }

    @Test
    void run_throwingDetector_isReportedAsFailedWithoutAffectingOthers() {
        DetectionContext context = globalContext(DataSnapshot.empty());
        Detector<String> broken = new Detector<>() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public DetectionOutcome<String> detect(DetectionContext ctx) {
                throw new IllegalStateException("boom");
            }
        };

        List<DetectionOutcome<String>> outcomes = engine.run(List.of(
                DetectionTask.of(broken, context),
                DetectionTask.of(fixed("healthy", List.of("x")), context)), CancellationToken.none());

        assertThat(outcomes.get(0).getStatus()).isEqualTo(DetectorStatus.FAILED);
        assertThat(outcomes.get(0).getReason()).isEqualTo("boom");
        assertThat(outcomes.get(1).getFindings()).containsExactly("x");
        assertThat(registry.find("detection.detector.runs").tag("status", "FAILED").counter()).isNotNull();
    }

    @Test
    void run_expiredDeadline_returnsCancelledOutcome() {
        CancellationToken token = CancellationToken.withTimeout(Clock.systemUTC(), Duration.ZERO);
        DetectionContext context = DetectionContext.builder()
                .scope(DetectionScope.GLOBAL)
                .snapshot(DataSnapshot.empty())
                .cancellation(token)
                .build();
        Detector<String> cooperative = new Detector<>() {
            @Override
            public String getName() {
                return "cooperative";
            }

            @Override
            public DetectionOutcome<String> detect(DetectionContext ctx) {
                return DetectionOutcome.of(getName(), List.of(), ctx);
            }
        };

        List<DetectionOutcome<String>> outcomes = engine.run(List.of(DetectionTask.of(cooperative, context)), token);

        assertThat(outcomes).singleElement()
                .satisfies(o -> assertThat(o.getStatus()).isEqualTo(DetectorStatus.CANCELLED));
    }

    private static Detector<String> fixed(String name, List<String> findings) {
        return new Detector<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public DetectionOutcome<String> detect(DetectionContext context) {
                return DetectionOutcome.completed(name, findings);
            }
        };
    }
}
