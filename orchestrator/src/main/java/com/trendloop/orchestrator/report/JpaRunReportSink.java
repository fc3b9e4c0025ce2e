package com.trendloop.orchestrator.report;

import com.trendloop.orchestrator.model.RunRecord;
import com.trendloop.orchestrator.model.StageRecord;
import com.trendloop.orchestrator.repository.RunRepository;
import com.trendloop.orchestrator.stage.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Persists every finished run report as one runs row plus one stage_results row
 * per entry, so history survives restarts and can be served by the REST API.
 *
 * The save is a single cascade from {@link RunRecord}; Spring Data wraps it in
 * its own transaction.
 */
public class JpaRunReportSink implements RunReportSink {

    private static final Logger log = LoggerFactory.getLogger(JpaRunReportSink.class);

    private final RunRepository runRepo;

    public JpaRunReportSink(RunRepository runRepo) {
        this.runRepo = runRepo;
    }

    @Override
    public void publish(RunReport report) {
        RunRecord record = toRecord(report);
        runRepo.save(record);
        log.debug("Persisted run {} with {} stage rows", report.runId(), record.getStages().size());
    }

    static RunRecord toRecord(RunReport report) {
        RunRecord run = new RunRecord(report.runId(), report.verdict(), report.startedAt(), report.finishedAt());
        run.setSnapshotName(report.snapshotName().orElse(null));
        run.setAbortReason(report.abortReason().orElse(null));
        run.setCounts((int) report.successCount(), (int) report.failureCount(), (int) report.skippedCount());

        List<StageReport> entries = report.entries();
        for (int i = 0; i < entries.size(); i++) {
            StageReport e = entries.get(i);
            StageRecord row = new StageRecord(run, i, e.stageName(), e.ordinal(), e.status());
            row.setMessage(e.outcome().message());
            row.setStartedAt(e.startedAt());
            row.setDurationMs(e.duration().toMillis());
            if (e.outcome() instanceof StageOutcome.Failure f) {
                row.setFailureKind(f.kind().name());
            }
            run.addStage(row);
        }
        return run;
    }
}
