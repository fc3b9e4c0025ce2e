package com.trendloop.orchestrator.api.dto;

import com.trendloop.orchestrator.model.RunRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /runs/{id} and GET /runs/recent.
 */
public record RunResponse(
        UUID    id,
        String  verdict,
        Instant startedAt,
        Instant finishedAt,
        String  snapshotName,
        String  abortReason,
        int     successCount,
        int     failureCount,
        int     skippedCount
) {
    public static RunResponse from(RunRecord run) {
        return new RunResponse(
                run.getId(),
                run.getVerdict().name(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getSnapshotName(),
                run.getAbortReason(),
                run.getSuccessCount(),
                run.getFailureCount(),
                run.getSkippedCount()
        );
    }
}
