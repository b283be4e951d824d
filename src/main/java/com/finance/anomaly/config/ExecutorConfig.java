package com.finance.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    /**
     * Bounded pool the detection engine fans detector runs out on.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService detectionExecutor(DetectionThresholdConfig config) {
        int threads = config.effectiveParallelism();
        AtomicInteger counter = new AtomicInteger();
        log.info("Detection worker pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock detectionClock() {
        return Clock.systemUTC();
    }
}
