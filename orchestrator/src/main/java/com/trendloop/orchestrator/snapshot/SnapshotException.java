package com.trendloop.orchestrator.snapshot;

/**
 * Thrown when a recovery point cannot be created or restored.
 *
 * A creation failure aborts the run before any stage executes. A restore failure is
 * always reported to the caller, never swallowed.
 */
public class SnapshotException extends RuntimeException {

    public enum Kind { SOURCE_UNREADABLE, DESTINATION_UNWRITABLE, STALE_HANDLE, RESTORE_FAILED }

    private final Kind kind;

    public SnapshotException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SnapshotException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
