package com.payshield.gleaner.config;

import com.payshield.gleaner.application.DetectionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    @Bean
    ApplicationRunner runDetectionOnStartup(AppProperties props, DetectionOrchestrator orchestrator) {
        return args -> {
            if (!props.getBatch().isRunOnStartup()) {
                log.info("Startup detection run disabled - set app.batch.run-on-startup=true to enable");
                return;
            }

            log.info("Running glean detection on startup - invoices: {}, line items: {}",
                    props.getData().getInvoicesPath(), props.getData().getLineItemsPath());
            DetectionOrchestrator.DetectionRun run = orchestrator.run();
            log.info("Startup detection run {} finished with {} gleans", run.runId(), run.total());
        };
    }
}
