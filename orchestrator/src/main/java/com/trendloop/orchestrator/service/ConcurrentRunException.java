package com.trendloop.orchestrator.service;

import java.util.UUID;

/**
 * Thrown when a run (or a restore) is requested while another run holds the run lock.
 *
 * The request is rejected immediately; the active run is not touched.
 */
public class ConcurrentRunException extends RuntimeException {

    private final UUID activeRunId;

    public ConcurrentRunException(UUID activeRunId) {
        super("Pipeline run " + activeRunId + " is already in progress");
        this.activeRunId = activeRunId;
    }

    public UUID getActiveRunId() { return activeRunId; }
}
