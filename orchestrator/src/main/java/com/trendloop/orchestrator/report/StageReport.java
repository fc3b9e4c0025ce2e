package com.trendloop.orchestrator.report;

import com.trendloop.orchestrator.model.StageStatus;
import com.trendloop.orchestrator.stage.StageOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * One line of the run report: what a stage returned and how long it took.
 *
 * Stages never started because the run was aborted appear with a
 * {@link StageOutcome.Skipped} outcome and a zero duration.
 */
public record StageReport(
        String       stageName,
        int          ordinal,
        StageOutcome outcome,
        Instant      startedAt,
        Duration     duration) {

    public StageStatus status() {
        return outcome.status();
    }
}
