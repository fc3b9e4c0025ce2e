package com.trendloop.orchestrator.api.dto;

import com.trendloop.orchestrator.model.StageRecord;
import com.trendloop.orchestrator.model.StageStatus;

import java.time.Instant;

/**
 * Read-only view of one persisted stage row, returned by GET /runs/{id}/stages.
 */
public record StageResultResponse(
        int         position,
        String      stageName,
        int         ordinal,
        StageStatus status,
        String      failureKind,
        String      message,
        Instant     startedAt,
        long        durationMs
) {
    public static StageResultResponse from(StageRecord s) {
        return new StageResultResponse(
                s.getPosition(),
                s.getStageName(),
                s.getOrdinal(),
                s.getStatus(),
                s.getFailureKind(),
                s.getMessage(),
                s.getStartedAt(),
                s.getDurationMs()
        );
    }
}
