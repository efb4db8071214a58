package com.payshield.gleaner.config;

import com.payshield.gleaner.domain.DetectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DetectionConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

    @Bean
    public Clock detectionClock(AppProperties props) {
        ZoneId zone = ZoneId.of(props.getDetection().getZone());
        log.info("Detection clock zone: {}", zone);
        return Clock.system(zone);
    }

    @Bean
    public DetectionEngine detectionEngine() {
        return new DetectionEngine();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(AppProperties props) {
        int threads = props.getDetection().getWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "glean-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Detection worker pool initialized - threads: {}", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }
}
