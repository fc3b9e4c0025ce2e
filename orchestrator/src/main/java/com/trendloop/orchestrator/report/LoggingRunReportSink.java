package com.trendloop.orchestrator.report;

import com.trendloop.orchestrator.snapshot.QuarantineService;
import com.trendloop.orchestrator.snapshot.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes a human-readable run summary to the log.
 *
 * Aborted runs are logged at ERROR together with the recovery hints an operator
 * needs to roll the published tree back by hand.
 */
public class LoggingRunReportSink implements RunReportSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingRunReportSink.class);

    private static final String RULE = "=".repeat(60);

    private final SnapshotManager   snapshots;
    private final QuarantineService quarantine;

    public LoggingRunReportSink(SnapshotManager snapshots, QuarantineService quarantine) {
        this.snapshots  = snapshots;
        this.quarantine = quarantine;
    }

    @Override
    public void publish(RunReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(RULE).append('\n');
        sb.append("  Run ").append(report.runId()).append(" → ").append(report.verdict()).append('\n');
        sb.append(RULE).append('\n');
        sb.append(String.format("  duration: %.1fs   success: %d   failure: %d   skipped: %d%n",
                report.duration().toMillis() / 1000.0,
                report.successCount(), report.failureCount(), report.skippedCount()));
        report.snapshotName().ifPresent(s -> sb.append("  snapshot: ").append(s).append('\n'));
        report.abortReason().ifPresent(r -> sb.append("  reason:   ").append(r).append('\n'));
        report.safetyState().ifPresent(g -> sb.append(String.format("  streak:   %d/%d failures, budget %ds%n",
                g.consecutiveFailureCount(), g.maxConsecutiveFailures(), g.maxRuntime().toSeconds())));
        Map<String, Long> calls = report.apiCalls();
        if (!calls.isEmpty()) {
            sb.append("  api calls: ").append(calls).append('\n');
        }
        sb.append('\n');
        for (StageReport e : report.entries()) {
            sb.append(String.format("  %2d. %-20s %-8s %6dms  %s%n",
                    e.ordinal(), e.stageName(), e.status(), e.duration().toMillis(), e.outcome().message()));
        }
        sb.append(RULE);

        if (report.verdict().isAborted()) {
            log.error("Pipeline run aborted:{}", sb);
            report.snapshotName().ifPresent(this::logRecoveryHints);
        } else {
            log.info("Pipeline run finished:{}", sb);
        }
    }

    private void logRecoveryHints(String snapshotName) {
        log.error("Recovery: published tree was snapshotted to {}; previous versions of "
                        + "removed files are in {}. Restore with POST /runs/restore/{} or copy "
                        + "the snapshot directory back by hand.",
                snapshots.backupRoot().resolve(snapshotName), quarantine.root(), snapshotName);
    }
}
