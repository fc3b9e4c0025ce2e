package com.trendloop.orchestrator.service;

import com.trendloop.orchestrator.report.RunReport;
import com.trendloop.orchestrator.snapshot.SnapshotRetention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers for the pipeline and for snapshot retention.
 *
 * Both crons come from application.yml; set a cron to "-" to disable it
 * (for example when an external cron calls the service in run-once mode).
 *
 * Spring's default scheduler has a single thread, so a pipeline tick and a
 * retention tick never overlap; a tick that fires while a REST-triggered run
 * is active is dropped, not queued.
 */
@Component
@EnableScheduling
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineOrchestrator orchestrator;
    private final SnapshotRetention    retention;

    public PipelineScheduler(PipelineOrchestrator orchestrator, SnapshotRetention retention) {
        this.orchestrator = orchestrator;
        this.retention    = retention;
    }

    @Scheduled(cron = "${trendloop.pipeline.cron:0 0 */6 * * *}", zone = "UTC")
    public void runPipeline() {
        try {
            RunReport report = orchestrator.run();
            log.info("Scheduled run {} ended {}", report.runId(), report.verdict());
        } catch (ConcurrentRunException e) {
            log.warn("Scheduled run skipped: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${trendloop.snapshot.retention-cron:0 30 3 * * *}", zone = "UTC")
    public void pruneSnapshots() {
        try {
            retention.prune();
        } catch (RuntimeException e) {
            log.error("Snapshot retention pass failed: {}", e.getMessage(), e);
        }
    }
}
