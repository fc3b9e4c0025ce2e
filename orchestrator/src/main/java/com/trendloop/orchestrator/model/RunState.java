package com.trendloop.orchestrator.model;

/**
 * States of one orchestrator run.
 *
 * Transitions:
 *   IDLE → SNAPSHOT_TAKEN → RUNNING → COMPLETED | ABORTED_SAFETY | ABORTED_TIMEOUT
 *   IDLE → ABORTED_SNAPSHOT   (recovery point could not be created; no stage runs)
 *
 * A run reaches exactly one terminal state. There is no restart; the next run
 * starts from IDLE with a fresh snapshot.
 */
public enum RunState {
    IDLE,
    SNAPSHOT_TAKEN,
    RUNNING,
    COMPLETED,
    ABORTED_SAFETY,
    ABORTED_TIMEOUT,
    ABORTED_SNAPSHOT;

    public RunVerdict toVerdict() {
        return switch (this) {
            case COMPLETED        -> RunVerdict.COMPLETED;
            case ABORTED_SAFETY   -> RunVerdict.ABORTED_SAFETY;
            case ABORTED_TIMEOUT  -> RunVerdict.ABORTED_TIMEOUT;
            case ABORTED_SNAPSHOT -> RunVerdict.ABORTED_SNAPSHOT;
            default -> throw new IllegalStateException("Run state " + this + " is not terminal");
        };
    }
}
