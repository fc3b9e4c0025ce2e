package com.trendloop.orchestrator.service;

import com.trendloop.orchestrator.model.RunVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Run-once mode for external triggers (cron, systemd timer, CI job).
 *
 * Enabled with {@code trendloop.pipeline.run-once=true}: runs a single pipeline at
 * startup, then shuts the application down and exits with the verdict's exit code
 * (0 completed, 2 safety abort, 3 timeout, 4 snapshot failure, 5 rejected).
 *
 * To run:
 *   java -jar orchestrator.jar --trendloop.pipeline.run-once=true
 */
@Component
@ConditionalOnProperty(name = "trendloop.pipeline.run-once", havingValue = "true")
public class RunOnceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RunOnceRunner.class);

    private final PipelineOrchestrator orchestrator;
    private final ApplicationContext   context;

    public RunOnceRunner(PipelineOrchestrator orchestrator, ApplicationContext context) {
        this.orchestrator = orchestrator;
        this.context      = context;
    }

    @Override
    public void run(String... args) {
        RunVerdict verdict = runOnce();
        System.exit(SpringApplication.exit(context, verdict::exitCode));
    }

    RunVerdict runOnce() {
        try {
            RunVerdict verdict = orchestrator.run().verdict();
            log.info("Run-once finished: {} (exit code {})", verdict, verdict.exitCode());
            return verdict;
        } catch (ConcurrentRunException e) {
            log.error("Run-once rejected: {}", e.getMessage());
            return RunVerdict.REJECTED_CONCURRENT;
        }
    }
}
