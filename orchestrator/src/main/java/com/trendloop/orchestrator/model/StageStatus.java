package com.trendloop.orchestrator.model;

/**
 * Recorded status of one stage within a run.
 *
 * Stored as plain text in stage_results.status.
 */
public enum StageStatus {
    SUCCESS,
    FAILURE,
    SKIPPED
}
