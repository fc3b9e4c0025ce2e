package com.trendloop.orchestrator.model;

/**
 * Externally observable result of one pipeline invocation.
 *
 * The exit code is what a cron/systemd trigger sees when the orchestrator runs
 * in run-once mode; anything non-zero should raise an alert.
 */
public enum RunVerdict {
    COMPLETED(0),             // every stage ran; isolated failures are allowed
    ABORTED_SAFETY(2),        // failure streak hit the limit
    ABORTED_TIMEOUT(3),       // wall-clock budget exhausted before a stage started
    ABORTED_SNAPSHOT(4),      // no recovery point, so no stage ran
    REJECTED_CONCURRENT(5);   // another run was active; this request did nothing

    private final int exitCode;

    RunVerdict(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() { return exitCode; }

    public boolean isAborted() {
        return this != COMPLETED;
    }
}
