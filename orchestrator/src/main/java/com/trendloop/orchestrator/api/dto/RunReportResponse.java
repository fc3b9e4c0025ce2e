package com.trendloop.orchestrator.api.dto;

import com.trendloop.orchestrator.model.StageStatus;
import com.trendloop.orchestrator.report.RunReport;
import com.trendloop.orchestrator.report.StageReport;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /runs: the finalized in-memory report of the run that
 * was just executed.
 */
public record RunReportResponse(
        UUID    runId,
        String  verdict,
        int     exitCode,
        Instant startedAt,
        Instant finishedAt,
        String  snapshotName,
        String  abortReason,
        List<Entry> stages
) {
    public record Entry(String stageName, int ordinal, StageStatus status, String message, long durationMs) {

        static Entry from(StageReport e) {
            return new Entry(e.stageName(), e.ordinal(), e.status(), e.outcome().message(), e.duration().toMillis());
        }
    }

    public static RunReportResponse from(RunReport report) {
        return new RunReportResponse(
                report.runId(),
                report.verdict().name(),
                report.verdict().exitCode(),
                report.startedAt(),
                report.finishedAt(),
                report.snapshotName().orElse(null),
                report.abortReason().orElse(null),
                report.entries().stream().map(Entry::from).toList()
        );
    }
}
